package com.questrail.pbx.api;

/**
 * TuState
 * -----------------------------------------------------------------------------
 * Call state of a single telephone unit (TU).
 *
 * <h2>The Seven States</h2>
 * <ul>
 *   <li>{@link #ON_HOOK}     – idle; the initial state of every unit</li>
 *   <li>{@link #DIAL_TONE}   – off-hook and ready to dial</li>
 *   <li>{@link #RINGING}     – being called by a peer</li>
 *   <li>{@link #RING_BACK}   – calling a peer, waiting for the answer</li>
 *   <li>{@link #BUSY_SIGNAL} – the dialed unit could not be rung</li>
 *   <li>{@link #CONNECTED}   – in a call with a peer</li>
 *   <li>{@link #ERROR}       – the dialed extension does not exist</li>
 * </ul>
 *
 * <h2>Peer Presence</h2>
 * A unit has a peer exactly when its state is one of {@link #RINGING},
 * {@link #RING_BACK} or {@link #CONNECTED}; see {@link #hasPeer()}.
 *
 * <h2>Wire Text</h2>
 * {@link #wireText()} is the fixed prefix of the status line sent to a client
 * when its unit enters this state. Line assembly (extensions, terminators)
 * lives in {@code com.questrail.pbx.protocol.PbxNotifications}.
 */
public enum TuState
{
    ON_HOOK("ON HOOK"),
    DIAL_TONE("DIAL TONE"),
    RINGING("RINGING"),
    RING_BACK("RING BACK"),
    BUSY_SIGNAL("BUSY SIGNAL"),
    CONNECTED("CONNECTED"),
    ERROR("ERROR");

    private final String wireText;

    TuState(String wireText) {
        this.wireText = wireText;
    }

    public String wireText() {
        return wireText;
    }

    /**
     * Returns {@code true} if a unit in this state is linked to a peer.
     */
    public boolean hasPeer() {
        return this == RINGING || this == RING_BACK || this == CONNECTED;
    }
}
