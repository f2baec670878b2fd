package com.questrail.pbx.transport;

/**
 * PbxConnectionListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link PbxServerEndpoint}.
 *
 * <p>For any single connection the callbacks are serialized: one
 * {@link #onConnectionOpened}, any number of {@link #onLine}, then one
 * {@link #onConnectionClosed}. Callbacks for different connections may run
 * concurrently on different threads.</p>
 */
public interface PbxConnectionListener
{
    /**
     * Called once when a client connection has been accepted.
     */
    void onConnectionOpened(TuConnection connection);

    /**
     * Called for every complete line received, terminator already stripped.
     */
    void onLine(TuConnection connection, String line);

    /**
     * Called once when the connection reaches end of stream, fails, or is
     * shut down locally.
     */
    void onConnectionClosed(TuConnection connection);
}
