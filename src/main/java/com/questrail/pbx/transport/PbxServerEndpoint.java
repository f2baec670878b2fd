package com.questrail.pbx.transport;

import java.net.InetSocketAddress;

/**
 * PbxServerEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for the listening side of the PBX transport.
 *
 * <p>An endpoint accepts connections, frames inbound bytes into lines and hands
 * both to its {@link PbxConnectionListener}. It carries no call semantics.</p>
 */
public interface PbxServerEndpoint
{
    /**
     * Register the listener. Must be called before {@link #start()}.
     */
    void setListener(PbxConnectionListener listener);

    /**
     * Bind and begin accepting connections. Blocks until the bind completed.
     *
     * @throws com.questrail.pbx.runtime.PbxStartupException if binding fails
     */
    void start();

    /**
     * Stop accepting new connections. Already accepted connections stay open.
     */
    void stopAccepting();

    /**
     * Release all transport threads and resources.
     */
    void stop();

    /**
     * Actual bound address, valid after {@link #start()}.
     */
    InetSocketAddress localAddress();
}
