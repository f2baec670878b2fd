package com.questrail.pbx.protocol;

import java.util.Objects;

/**
 * PbxCommand
 * -----------------------------------------------------------------------------
 * A well-formed client command. Produced by {@link PbxCommandParser}; anything
 * that does not parse into one of these is ignored by the server.
 */
public sealed interface PbxCommand
        permits PbxCommand.Pickup, PbxCommand.Hangup, PbxCommand.Dial, PbxCommand.Chat
{
    /** {@code pickup} */
    record Pickup() implements PbxCommand {
    }

    /** {@code hangup} */
    record Hangup() implements PbxCommand {
    }

    /**
     * {@code dial <extension>}.
     *
     * <p>An argument that is not a string of ASCII decimal digits is carried
     * as {@link #UNRESOLVABLE}; no registered unit can ever have that
     * extension.</p>
     */
    record Dial(int extension) implements PbxCommand {
        public static final int UNRESOLVABLE = -1;
    }

    /** {@code chat <text>}; text may be empty and may contain spaces. */
    record Chat(String text) implements PbxCommand {
        public Chat {
            Objects.requireNonNull(text, "text");
        }
    }
}
