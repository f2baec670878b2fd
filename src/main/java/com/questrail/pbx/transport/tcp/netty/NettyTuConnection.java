package com.questrail.pbx.transport.tcp.netty;

import com.questrail.pbx.transport.TuConnection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

/**
 * NettyTuConnection
 * -----------------------------------------------------------------------------
 * {@link TuConnection} backed by a Netty {@link Channel}.
 *
 * <h2>Write Ordering</h2>
 * Lines for one connection are written by its own servicing thread and by the
 * threads servicing its peer. Every write is handed to the channel's event
 * loop as a task, including writes issued from the event loop itself, so the
 * loop's FIFO task queue preserves the order in which the calls were made.
 * Writing directly when already on the loop would let such a write overtake
 * tasks queued earlier by other threads. Close requests take the same queue,
 * so lines written before a close still go out.
 */
final class NettyTuConnection implements TuConnection
{
    private static final Logger log = LoggerFactory.getLogger(NettyTuConnection.class);

    private static final byte[] CRLF = {'\r', '\n'};

    private final Channel channel;
    private final String description;

    NettyTuConnection(Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.description = String.valueOf(channel.remoteAddress());
    }

    @Override
    public void writeLine(String line) {
        byte[] text = line.getBytes(StandardCharsets.UTF_8);
        runOnLoop(() -> write(text), "line");
    }

    private void write(byte[] text) {
        if (!channel.isActive()) {
            log.debug("Dropped line to {}: connection closed", description);
            return;
        }
        channel.writeAndFlush(Unpooled.wrappedBuffer(text, CRLF))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        // A failed notification never fails the call; end of stream cleans up.
                        log.debug("Write to {} failed", description, future.cause());
                    }
                });
    }

    @Override
    public void shutdown() {
        // Closing the channel ends the read side; the inactive event then drives unregistration.
        runOnLoop(channel::close, "shutdown");
    }

    @Override
    public void close() {
        runOnLoop(channel::close, "close");
    }

    private void runOnLoop(Runnable task, String what) {
        try {
            channel.eventLoop().execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Dropped {} for {}: event loop shut down", what, description);
        }
    }

    @Override
    public String describe() {
        return description;
    }
}
