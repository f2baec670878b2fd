package com.questrail.pbx.runtime;

import com.questrail.pbx.transport.PbxConnectionListener;
import com.questrail.pbx.transport.PbxServerEndpoint;
import com.questrail.pbx.transport.RecordingTuConnection;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * FakePbxServerEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link PbxServerEndpoint}. Tests open connections explicitly; a
 * connection that is shut down reports end of stream from a separate thread,
 * the way a servicing thread would after its read returns.
 */
public final class FakePbxServerEndpoint implements PbxServerEndpoint {

    private PbxConnectionListener listener;
    private volatile boolean started;
    private volatile boolean accepting;
    private volatile boolean stopped;

    @Override
    public void setListener(PbxConnectionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
        accepting = true;
    }

    @Override
    public void stopAccepting() {
        accepting = false;
    }

    @Override
    public void stop() {
        accepting = false;
        stopped = true;
    }

    @Override
    public InetSocketAddress localAddress() {
        return new InetSocketAddress("127.0.0.1", 0);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Open a connection whose shutdown is reported back as end of stream.
     */
    public RecordingTuConnection open(String name) {
        RecordingTuConnection connection = new RecordingTuConnection(name);
        connection.onShutdown(() -> {
            Thread eof = new Thread(() -> listener.onConnectionClosed(connection), "eof-" + name);
            eof.start();
        });
        listener.onConnectionOpened(connection);
        return connection;
    }

    /**
     * Open a connection that ignores shutdown until the test closes it.
     */
    public RecordingTuConnection openStubborn(String name) {
        RecordingTuConnection connection = new RecordingTuConnection(name);
        listener.onConnectionOpened(connection);
        return connection;
    }

    public void line(RecordingTuConnection connection, String line) {
        listener.onLine(connection, line);
    }

    public void endOfStream(RecordingTuConnection connection) {
        listener.onConnectionClosed(connection);
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public boolean isStopped() {
        return stopped;
    }
}
