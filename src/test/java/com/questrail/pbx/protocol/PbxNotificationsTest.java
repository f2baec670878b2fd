package com.questrail.pbx.protocol;

import com.questrail.pbx.api.TuState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PbxNotificationsTest {

    @Test
    void onHookCarriesOwnExtensionAndConnectedCarriesPeer() {
        assertEquals("ON HOOK 7", PbxNotifications.statusLine(TuState.ON_HOOK, 7, 8));
        assertEquals("CONNECTED 8", PbxNotifications.statusLine(TuState.CONNECTED, 7, 8));
    }

    @Test
    void otherStatesAreBare() {
        assertEquals("DIAL TONE", PbxNotifications.statusLine(TuState.DIAL_TONE, 7, -1));
        assertEquals("RINGING", PbxNotifications.statusLine(TuState.RINGING, 7, 8));
        assertEquals("RING BACK", PbxNotifications.statusLine(TuState.RING_BACK, 7, 8));
        assertEquals("BUSY SIGNAL", PbxNotifications.statusLine(TuState.BUSY_SIGNAL, 7, -1));
        assertEquals("ERROR", PbxNotifications.statusLine(TuState.ERROR, 7, -1));
    }

    @Test
    void chatLine() {
        assertEquals("chat hi there", PbxNotifications.chatLine("hi there"));
        assertEquals("chat ", PbxNotifications.chatLine(""));
    }
}
