package com.questrail.pbx.protocol;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PbxCommandParserTest {

    private final PbxCommandParser parser = new PbxCommandParser();

    @Test
    void parsesArgumentlessCommands() {
        assertEquals(Optional.of(new PbxCommand.Pickup()), parser.parse("pickup"));
        assertEquals(Optional.of(new PbxCommand.Hangup()), parser.parse("hangup"));
    }

    @Test
    void parsesDial() {
        assertEquals(Optional.of(new PbxCommand.Dial(8)), parser.parse("dial 8"));
        assertEquals(Optional.of(new PbxCommand.Dial(0)), parser.parse("dial 0"));
    }

    @Test
    void nonNumericDialTargetIsUnresolvable() {
        PbxCommand.Dial dial = (PbxCommand.Dial) parser.parse("dial bob").orElseThrow();
        assertEquals(PbxCommand.Dial.UNRESOLVABLE, dial.extension());

        assertEquals(Optional.of(new PbxCommand.Dial(PbxCommand.Dial.UNRESOLVABLE)), parser.parse("dial -3"));
        assertEquals(Optional.of(new PbxCommand.Dial(PbxCommand.Dial.UNRESOLVABLE)), parser.parse("dial +3"));
        assertEquals(Optional.of(new PbxCommand.Dial(PbxCommand.Dial.UNRESOLVABLE)),
            parser.parse("dial 99999999999999"));
    }

    @Test
    void onlyAsciiDigitsFormAnExtension() {
        // Arabic-Indic and fullwidth eights
        assertEquals(Optional.of(new PbxCommand.Dial(PbxCommand.Dial.UNRESOLVABLE)), parser.parse("dial \u0668"));
        assertEquals(Optional.of(new PbxCommand.Dial(PbxCommand.Dial.UNRESOLVABLE)), parser.parse("dial \uFF18"));
        assertEquals(Optional.of(new PbxCommand.Dial(PbxCommand.Dial.UNRESOLVABLE)), parser.parse("dial 1\u0668"));
    }

    @Test
    void chatKeepsRestOfLineVerbatim() {
        assertEquals(Optional.of(new PbxCommand.Chat("hello  big world ")),
            parser.parse("chat hello  big world "));
        assertEquals(Optional.of(new PbxCommand.Chat("")), parser.parse("chat"));
        assertEquals(Optional.of(new PbxCommand.Chat("")), parser.parse("chat "));
    }

    @Test
    void wrongArgumentCountsAreIgnored() {
        assertTrue(parser.parse("pickup now").isEmpty());
        assertTrue(parser.parse("hangup ").isEmpty());
        assertTrue(parser.parse("dial").isEmpty());
        assertTrue(parser.parse("dial ").isEmpty());
        assertTrue(parser.parse("dial 1 2").isEmpty());
    }

    @Test
    void unknownInputIsIgnored() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("PICKUP").isEmpty());
        assertTrue(parser.parse(" pickup").isEmpty());
        assertTrue(parser.parse("answer").isEmpty());
    }
}
