package com.questrail.pbx.transport.tcp.netty;

import com.questrail.pbx.observability.NullObservabilitySink;
import com.questrail.pbx.observability.PbxErrorEvent;
import com.questrail.pbx.observability.PbxObservabilitySink;
import com.questrail.pbx.runtime.PbxStartupException;
import com.questrail.pbx.transport.PbxConnectionListener;
import com.questrail.pbx.transport.PbxServerEndpoint;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * NettyPbxServerEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link PbxServerEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>: it accepts TCP
 * connections, splits inbound bytes into CRLF (or LF) terminated lines and
 * reports connections and lines to its {@link PbxConnectionListener}.
 *
 * It MUST NOT interpret commands or touch telephone units.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Connections leave it as
 * {@link com.questrail.pbx.transport.TuConnection}.
 *
 * <h2>Threading</h2>
 * Each accepted connection is pinned to one worker event loop; all callbacks
 * for that connection run there, in order. Different connections are serviced
 * concurrently by different workers.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the listening socket (blocking) and accepts.
 * - {@link #stopAccepting()} closes the listening socket only.
 * - {@link #stop()} closes the listening socket and shuts down both groups.
 */
public final class NettyPbxServerEndpoint implements PbxServerEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyPbxServerEndpoint.class);

    private final InetSocketAddress bindAddress;
    private final PbxObservabilitySink observabilitySink;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile PbxConnectionListener listener;
    private volatile Channel serverChannel;

    /**
     * @param bindAddress   listening address; port 0 picks an ephemeral port
     * @param maxLineLength longest accepted line; longer lines are dropped
     * @param workerThreads worker event loops, 0 for Netty's default
     */
    public NettyPbxServerEndpoint(InetSocketAddress bindAddress,
                                  int maxLineLength,
                                  int workerThreads,
                                  PbxObservabilitySink observabilitySink)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(workerThreads);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LineBasedFrameDecoder(maxLineLength));
                        p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                        p.addLast(new ConnectionHandler());
                    }
                });
    }

    @Override
    public void setListener(PbxConnectionListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();
        try {
            serverChannel = bootstrap.bind(bindAddress).syncUninterruptibly().channel();
        } catch (Exception e) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new PbxStartupException("Cannot listen on " + bindAddress, e);
        }
        log.info("PBX listening on {}", serverChannel.localAddress());
    }

    @Override
    public void stopAccepting()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
    }

    @Override
    public void stop()
    {
        stopAccepting();
        bossGroup.shutdownGracefully().syncUninterruptibly();
        workerGroup.shutdownGracefully().syncUninterruptibly();
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("Endpoint not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    private PbxConnectionListener requireListener()
    {
        PbxConnectionListener l = listener;
        if (l == null) {
            throw new IllegalStateException("PbxConnectionListener must be set before start()");
        }
        return l;
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * One instance per accepted channel. Wraps the channel as a connection on
     * activation and forwards decoded lines.
     */
    private final class ConnectionHandler extends SimpleChannelInboundHandler<String>
    {
        private NettyTuConnection connection;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            connection = new NettyTuConnection(ctx.channel());
            requireListener().onConnectionOpened(connection);
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line)
        {
            if (connection != null) {
                listener.onLine(connection, line);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (connection != null) {
                listener.onConnectionClosed(connection);
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (cause instanceof TooLongFrameException) {
                // Over-long line: the decoder skips to the next terminator, keep the connection.
                log.debug("Dropped over-long line from {}", ctx.channel().remoteAddress());
                return;
            }
            observabilitySink.onError(new PbxErrorEvent(
                Instant.now(),
                "Connection " + ctx.channel().remoteAddress() + " failed",
                cause
            ));
            ctx.close();
        }
    }
}
