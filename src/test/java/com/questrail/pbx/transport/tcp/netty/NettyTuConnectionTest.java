package com.questrail.pbx.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class NettyTuConnectionTest {

    private EmbeddedChannel channel;
    private NettyTuConnection connection;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel();
        connection = new NettyTuConnection(channel);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private String nextOutbound() {
        ByteBuf buf = channel.readOutbound();
        assertNotNull(buf, "expected an outbound line");
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    void linesAreCrlfTerminatedInCallOrder() {
        connection.writeLine("ON HOOK 3");
        connection.writeLine("DIAL TONE");
        assertNull(channel.readOutbound(), "writes go through the event loop queue");

        channel.runPendingTasks();

        assertEquals("ON HOOK 3\r\n", nextOutbound());
        assertEquals("DIAL TONE\r\n", nextOutbound());
        assertNull(channel.readOutbound());
    }

    @Test
    void linesWrittenBeforeCloseStillGoOut() {
        connection.writeLine("chat bye");
        connection.close();
        connection.writeLine("ON HOOK 3");

        channel.runPendingTasks();

        assertEquals("chat bye\r\n", nextOutbound());
        assertNull(channel.readOutbound());
        assertFalse(channel.isOpen());
    }

    @Test
    void failedWriteKeepsChannelOpen() {
        EmbeddedChannel failing = new EmbeddedChannel(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                ReferenceCountUtil.release(msg);
                promise.setFailure(new IOException("Connection reset by peer"));
            }
        });
        NettyTuConnection onFailing = new NettyTuConnection(failing);

        onFailing.writeLine("RINGING");
        failing.runPendingTasks();

        assertTrue(failing.isOpen());
        assertDoesNotThrow(failing::checkException);
        assertNull(failing.readOutbound());
        failing.finishAndReleaseAll();
    }
}
