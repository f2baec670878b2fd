package com.questrail.pbx.protocol;

import com.questrail.pbx.api.TuState;

import java.util.Objects;

/**
 * PbxNotifications
 * -----------------------------------------------------------------------------
 * Builds the server-to-client lines of the PBX wire protocol.
 *
 * <p>Returned strings never include the CRLF terminator; the transport appends
 * it in {@link com.questrail.pbx.transport.TuConnection#writeLine(String)}.</p>
 *
 * <pre>
 *   ON_HOOK      ON HOOK &lt;own-extension&gt;
 *   DIAL_TONE    DIAL TONE
 *   RINGING      RINGING
 *   RING_BACK    RING BACK
 *   BUSY_SIGNAL  BUSY SIGNAL
 *   CONNECTED    CONNECTED &lt;peer-extension&gt;
 *   ERROR        ERROR
 *   chat relay   chat &lt;text&gt;
 * </pre>
 */
public final class PbxNotifications
{
    public static final String CHAT_PREFIX = "chat";

    private PbxNotifications() {
    }

    /**
     * Status line for a unit that is now in {@code state}.
     *
     * @param state          new state of the unit
     * @param ownExtension   extension of the unit being notified
     * @param peerExtension  extension of its peer; only read for {@link TuState#CONNECTED}
     */
    public static String statusLine(TuState state, int ownExtension, int peerExtension) {
        Objects.requireNonNull(state, "state");
        switch (state) {
            case ON_HOOK:
                return state.wireText() + " " + ownExtension;
            case CONNECTED:
                return state.wireText() + " " + peerExtension;
            default:
                return state.wireText();
        }
    }

    /**
     * Line relayed to the peer of a unit that sent {@code chat <text>}.
     */
    public static String chatLine(String text) {
        return CHAT_PREFIX + " " + Objects.requireNonNull(text, "text");
    }
}
