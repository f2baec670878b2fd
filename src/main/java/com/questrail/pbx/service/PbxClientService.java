package com.questrail.pbx.service;

import com.questrail.pbx.core.PbxRegistry;
import com.questrail.pbx.core.TelephoneUnit;
import com.questrail.pbx.observability.NullObservabilitySink;
import com.questrail.pbx.observability.PbxObservabilitySink;
import com.questrail.pbx.protocol.PbxCommand;
import com.questrail.pbx.protocol.PbxCommandParser;
import com.questrail.pbx.transport.PbxConnectionListener;
import com.questrail.pbx.transport.TuConnection;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * PbxClientService
 * =============================================================================
 * Services client connections on behalf of the PBX: one telephone unit per
 * connection, from acceptance to end of stream.
 *
 * <h2>Per-Connection Lifecycle</h2>
 * <pre>
 *   opened  → new TelephoneUnit, register (full: discard, connection closed)
 *   line    → parse → pickup | hangup | dial (via directory) | chat
 *   closed  → unregister (forced hangup, connection released)
 * </pre>
 *
 * <p>Lines that do not parse are ignored. This class holds no call state of its
 * own; it only routes commands to the unit owned by the connection.</p>
 */
public final class PbxClientService implements PbxConnectionListener
{
    private final PbxRegistry registry;
    private final PbxCommandParser parser;
    private final PbxObservabilitySink observabilitySink;
    private final ConcurrentMap<TuConnection, TelephoneUnit> units = new ConcurrentHashMap<>();

    public PbxClientService(PbxRegistry registry,
                            PbxCommandParser parser,
                            PbxObservabilitySink observabilitySink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public PbxClientService(PbxRegistry registry) {
        this(registry, new PbxCommandParser(), null);
    }

    /**
     * @return the unit serviced for {@code connection}, if it is registered
     */
    public Optional<TelephoneUnit> unitFor(TuConnection connection) {
        return Optional.ofNullable(units.get(connection));
    }

    @Override
    public void onConnectionOpened(TuConnection connection) {
        TelephoneUnit tu = new TelephoneUnit(connection, observabilitySink);
        OptionalInt extension = registry.register(tu);
        if (extension.isEmpty()) {
            tu.discard();
            return;
        }
        units.put(connection, tu);
    }

    @Override
    public void onLine(TuConnection connection, String line) {
        TelephoneUnit tu = units.get(connection);
        if (tu == null) {
            return;
        }
        parser.parse(line).ifPresent(command -> execute(tu, command));
    }

    @Override
    public void onConnectionClosed(TuConnection connection) {
        TelephoneUnit tu = units.remove(connection);
        if (tu != null) {
            registry.unregister(tu);
        }
    }

    private void execute(TelephoneUnit tu, PbxCommand command) {
        if (command instanceof PbxCommand.Pickup) {
            tu.pickup();
        } else if (command instanceof PbxCommand.Hangup) {
            tu.hangup();
        } else if (command instanceof PbxCommand.Dial dial) {
            registry.dial(tu, dial.extension());
        } else if (command instanceof PbxCommand.Chat chat) {
            // Not connected: nothing is sent and the client gets no reply.
            tu.chat(chat.text());
        }
    }
}
