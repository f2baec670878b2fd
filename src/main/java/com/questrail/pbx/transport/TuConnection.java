package com.questrail.pbx.transport;

/**
 * TuConnection
 * -----------------------------------------------------------------------------
 * The duplex byte-stream handle owned by a telephone unit.
 *
 * <p>The PBX core only ever <em>writes</em> to a connection; reading belongs to
 * the transport that accepted it and delivers parsed lines to a
 * {@link PbxConnectionListener}.</p>
 *
 * <h2>Ownership</h2>
 * A connection is exclusively owned by the unit it was handed to. The unit
 * calls {@link #close()} exactly once, when its last reference is released.
 * {@link #shutdown()} may be called by the shutdown path at any time and only
 * forces the reading side to observe end of stream.
 */
public interface TuConnection
{
    /**
     * Write one line followed by CRLF.
     *
     * <p>Writes issued from different threads are delivered in the order the
     * calls were made. A failed write (for example on an already closed
     * connection) is dropped; it never throws.</p>
     *
     * @param line line content without terminator
     */
    void writeLine(String line);

    /**
     * Abortively shut the connection down so that a pending read returns
     * end of stream. Does not release ownership.
     */
    void shutdown();

    /**
     * Release the connection. Called once by the owning unit.
     */
    void close();

    /**
     * Short description of the remote end, for logs.
     */
    String describe();
}
