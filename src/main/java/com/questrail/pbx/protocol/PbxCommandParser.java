package com.questrail.pbx.protocol;

import java.util.Optional;

/**
 * PbxCommandParser
 * -----------------------------------------------------------------------------
 * Turns one inbound line (terminator already stripped) into a
 * {@link PbxCommand}.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   pickup
 *   hangup
 *   dial &lt;extension&gt;
 *   chat [&lt;text&gt;]
 * </pre>
 *
 * <p>Words are separated by a single space. {@code pickup} and {@code hangup}
 * take no argument and {@code dial} exactly one; for {@code chat} everything
 * after the first space is the text, verbatim. Unknown commands and wrong
 * argument counts yield {@link Optional#empty()}.</p>
 */
public final class PbxCommandParser
{
    private static final String PICKUP = "pickup";
    private static final String HANGUP = "hangup";
    private static final String DIAL = "dial";
    private static final String CHAT = "chat";

    private static final PbxCommand.Pickup PICKUP_COMMAND = new PbxCommand.Pickup();
    private static final PbxCommand.Hangup HANGUP_COMMAND = new PbxCommand.Hangup();

    public Optional<PbxCommand> parse(String line) {
        if (line == null || line.isEmpty()) {
            return Optional.empty();
        }

        int space = line.indexOf(' ');
        String verb = space < 0 ? line : line.substring(0, space);
        String rest = space < 0 ? null : line.substring(space + 1);

        switch (verb) {
            case PICKUP:
                return rest == null ? Optional.of(PICKUP_COMMAND) : Optional.empty();
            case HANGUP:
                return rest == null ? Optional.of(HANGUP_COMMAND) : Optional.empty();
            case DIAL:
                return parseDial(rest);
            case CHAT:
                return Optional.of(new PbxCommand.Chat(rest == null ? "" : rest));
            default:
                return Optional.empty();
        }
    }

    private static Optional<PbxCommand> parseDial(String argument) {
        if (argument == null || argument.isEmpty() || argument.indexOf(' ') >= 0) {
            return Optional.empty();
        }
        return Optional.of(new PbxCommand.Dial(parseExtension(argument)));
    }

    private static int parseExtension(String argument) {
        for (int i = 0; i < argument.length(); i++) {
            char c = argument.charAt(i);
            if (c < '0' || c > '9') {
                return PbxCommand.Dial.UNRESOLVABLE;
            }
        }
        try {
            return Integer.parseInt(argument);
        } catch (NumberFormatException e) {
            // Out of int range: cannot name any slot.
            return PbxCommand.Dial.UNRESOLVABLE;
        }
    }
}
