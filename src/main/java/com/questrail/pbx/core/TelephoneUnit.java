package com.questrail.pbx.core;

import com.questrail.pbx.api.TuState;
import com.questrail.pbx.observability.NullObservabilitySink;
import com.questrail.pbx.observability.PbxObservabilitySink;
import com.questrail.pbx.observability.TuStateTransitionEvent;
import com.questrail.pbx.protocol.PbxNotifications;
import com.questrail.pbx.transport.TuConnection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TelephoneUnit
 * =============================================================================
 * One telephone unit (TU): a client connection, its call state, at most one
 * peer, and a reference count that decides when the connection is closed.
 *
 * <h2>State Machine</h2>
 * <pre>
 *   pickup   ON_HOOK   → DIAL_TONE
 *            RINGING   → CONNECTED      (peer RING_BACK → CONNECTED)
 *   hangup   CONNECTED → ON_HOOK        (peer → DIAL_TONE)
 *            RINGING   → ON_HOOK        (peer → DIAL_TONE)
 *            RING_BACK → ON_HOOK        (peer RINGING → ON_HOOK)
 *            DIAL_TONE, BUSY_SIGNAL, ERROR → ON_HOOK
 *   dial     DIAL_TONE → ERROR          (no such extension)
 *            DIAL_TONE → BUSY_SIGNAL    (self, or target not idle)
 *            DIAL_TONE → RING_BACK      (target ON_HOOK → RINGING)
 * </pre>
 * Any other combination leaves the state unchanged and re-notifies it.
 * {@code ERROR} and {@code BUSY_SIGNAL} are left only through {@link #hangup()}.
 *
 * <h2>Notifications</h2>
 * Every operation writes the resulting state of each unit it touched to that
 * unit's connection while that unit is still locked, so a client never sees a
 * status line older than the transition that produced it. A failed write is
 * logged at debug and the transition stands.
 *
 * <h2>Locking</h2>
 * Each unit has its own lock. When an operation needs two units it acquires
 * both in ascending {@link #lockOrder} regardless of which one is acting; if
 * the acting unit orders second it first drops its own lock, takes both in
 * order and re-validates the peer link before mutating. Two units dialing or
 * hanging up on each other concurrently can therefore never wait on each
 * other in a cycle.
 *
 * <h2>References</h2>
 * A registered unit holds {@code 1 + (peer present ? 1 : 0)} references: one
 * owned by the directory, one owned by the peer. The connection is closed
 * exactly once, when the count reaches zero.
 */
public final class TelephoneUnit
{
    private static final Logger log = LoggerFactory.getLogger(TelephoneUnit.class);

    /** Extension of a unit that has not been registered yet. */
    public static final int NO_EXTENSION = -1;

    private static final AtomicLong LOCK_ORDER_SEQUENCE = new AtomicLong();

    private final long lockOrder = LOCK_ORDER_SEQUENCE.getAndIncrement();
    private final ReentrantLock lock = new ReentrantLock();
    private final TuConnection connection;
    private final PbxObservabilitySink observabilitySink;

    private volatile int extension = NO_EXTENSION;

    // Guarded by lock.
    private TuState state = TuState.ON_HOOK;
    private TelephoneUnit peer;
    private int refCount = 1;
    private boolean destroyed;

    public TelephoneUnit(TuConnection connection, PbxObservabilitySink observabilitySink) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public TelephoneUnit(TuConnection connection) {
        this(connection, null);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public TuConnection connection() {
        return connection;
    }

    /**
     * @return the assigned extension, or {@link #NO_EXTENSION} before registration
     */
    public int extension() {
        return extension;
    }

    public TuState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Optional<TelephoneUnit> peer() {
        lock.lock();
        try {
            return Optional.ofNullable(peer);
        } finally {
            lock.unlock();
        }
    }

    public int refCount() {
        lock.lock();
        try {
            return refCount;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDestroyed() {
        lock.lock();
        try {
            return destroyed;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Operations
    // ---------------------------------------------------------------------

    /**
     * Take the handset off-hook.
     *
     * <p>{@code ON_HOOK} goes to {@code DIAL_TONE}. {@code RINGING} answers the
     * call: this unit and its peer both go to {@code CONNECTED}. Any other state
     * is only re-notified.</p>
     */
    public void pickup() {
        for (;;) {
            TelephoneUnit caller;
            lock.lock();
            try {
                if (state != TuState.RINGING) {
                    TuState old = state;
                    if (state == TuState.ON_HOOK) {
                        state = TuState.DIAL_TONE;
                    }
                    notifyState(old, "pickup");
                    return;
                }
                caller = peer;
            } finally {
                lock.unlock();
            }

            lockWith(caller);
            try {
                if (state != TuState.RINGING || peer != caller) {
                    continue;
                }
                TuState callerOld = caller.state;
                state = TuState.CONNECTED;
                caller.state = TuState.CONNECTED;
                notifyState(TuState.RINGING, "pickup");
                caller.notifyState(callerOld, "answered");
                return;
            } finally {
                unlockWith(caller);
            }
        }
    }

    /**
     * Replace the handset.
     *
     * <p>Ends any call, ringing or ring-back in progress: the peer link is cleared
     * on both sides and each side releases the reference it held on the other.
     * The peer goes to {@code DIAL_TONE}, or to {@code ON_HOOK} if it was the one
     * ringing. An {@code ON_HOOK} unit is only re-notified.</p>
     */
    public void hangup() {
        for (;;) {
            TelephoneUnit other;
            lock.lock();
            try {
                if (!state.hasPeer()) {
                    TuState old = state;
                    state = TuState.ON_HOOK;
                    notifyState(old, "hangup");
                    return;
                }
                other = peer;
            } finally {
                lock.unlock();
            }

            lockWith(other);
            try {
                if (!state.hasPeer() || peer != other) {
                    continue;
                }
                TuState old = state;
                TuState otherOld = other.state;

                state = TuState.ON_HOOK;
                other.state = old == TuState.RING_BACK ? TuState.ON_HOOK : TuState.DIAL_TONE;
                peer = null;
                other.peer = null;

                notifyState(old, "hangup");
                other.notifyState(otherOld, "peer hangup");

                other.unref();
                unref();
                return;
            } finally {
                unlockWith(other);
            }
        }
    }

    /**
     * Call {@code target}.
     *
     * <p>Only a unit in {@code DIAL_TONE} can dial; in any other state the current
     * state is re-notified, whether or not a target was found.</p>
     *
     * @param target the unit registered at the dialed extension, or {@code null}
     *               if no unit is registered there
     */
    public void dial(TelephoneUnit target) {
        lock.lock();
        try {
            if (state != TuState.DIAL_TONE) {
                notifyState(state, "dial");
                return;
            }
            if (target == null) {
                state = TuState.ERROR;
                notifyState(TuState.DIAL_TONE, "dial");
                return;
            }
            if (target == this) {
                state = TuState.BUSY_SIGNAL;
                notifyState(TuState.DIAL_TONE, "dial");
                return;
            }
        } finally {
            lock.unlock();
        }

        lockWith(target);
        try {
            TuState old = state;
            if (old != TuState.DIAL_TONE) {
                notifyState(old, "dial");
                return;
            }
            if (target.destroyed) {
                state = TuState.ERROR;
                notifyState(old, "dial");
                return;
            }
            if (target.peer != null || target.state != TuState.ON_HOOK) {
                state = TuState.BUSY_SIGNAL;
                notifyState(old, "dial");
                return;
            }

            peer = target;
            target.peer = this;
            state = TuState.RING_BACK;
            target.state = TuState.RINGING;
            ref();
            target.ref();

            notifyState(old, "dial");
            target.notifyState(TuState.ON_HOOK, "incoming call");
        } finally {
            unlockWith(target);
        }
    }

    /**
     * Send {@code chat <message>} to the peer of a connected unit and re-notify
     * this unit's {@code CONNECTED} state.
     *
     * @return {@code false} if no call is in progress; nothing is written then
     */
    public boolean chat(String message) {
        Objects.requireNonNull(message, "message");
        for (;;) {
            TelephoneUnit other;
            lock.lock();
            try {
                if (state != TuState.CONNECTED) {
                    return false;
                }
                other = peer;
            } finally {
                lock.unlock();
            }

            lockWith(other);
            try {
                if (state != TuState.CONNECTED || peer != other) {
                    continue;
                }
                other.write(PbxNotifications.chatLine(message));
                notifyState(TuState.CONNECTED, "chat");
                return true;
            } finally {
                unlockWith(other);
            }
        }
    }

    /**
     * Release the initial reference of a unit that never got registered,
     * closing its connection.
     *
     * @throws IllegalStateException if the unit has an extension
     */
    public void discard() {
        if (extension != NO_EXTENSION) {
            throw new IllegalStateException("Registered unit cannot be discarded: " + this);
        }
        unref();
    }

    // ---------------------------------------------------------------------
    // Directory hooks
    // ---------------------------------------------------------------------

    /**
     * Assign the extension and send the initial {@code ON HOOK <extension>}.
     * Called once, by the directory, while it holds its own lock.
     */
    void assignExtension(int newExtension) {
        if (newExtension < 0) {
            throw new IllegalArgumentException("extension must be >= 0: " + newExtension);
        }
        lock.lock();
        try {
            if (destroyed) {
                throw new IllegalStateException("Unit already destroyed");
            }
            if (extension != NO_EXTENSION) {
                throw new IllegalStateException("Extension already assigned: " + extension);
            }
            extension = newExtension;
            notifyState(state, "register");
        } finally {
            lock.unlock();
        }
    }

    void ref() {
        lock.lock();
        try {
            if (destroyed) {
                throw new IllegalStateException("Unit already destroyed");
            }
            refCount++;
        } finally {
            lock.unlock();
        }
    }

    void unref() {
        lock.lock();
        try {
            if (destroyed) {
                throw new IllegalStateException("Unit already destroyed");
            }
            refCount--;
            if (refCount == 0) {
                destroyed = true;
                connection.close();
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void lockWith(TelephoneUnit other) {
        if (lockOrder < other.lockOrder) {
            lock.lock();
            other.lock.lock();
        } else {
            other.lock.lock();
            lock.lock();
        }
    }

    private void unlockWith(TelephoneUnit other) {
        other.lock.unlock();
        lock.unlock();
    }

    /** Caller holds this unit's lock and, for CONNECTED, the peer's lock. */
    private void notifyState(TuState oldState, String operation) {
        int peerExtension = peer != null ? peer.extension : NO_EXTENSION;
        write(PbxNotifications.statusLine(state, extension, peerExtension));
        observabilitySink.onStateTransition(new TuStateTransitionEvent(
            Instant.now(),
            extension,
            oldState,
            state,
            operation
        ));
    }

    private void write(String line) {
        try {
            connection.writeLine(line);
        } catch (RuntimeException e) {
            log.debug("Notification to extension {} failed", extension, e);
        }
    }

    @Override
    public String toString() {
        return "TelephoneUnit[extension=" + extension + ", connection=" + connection.describe() + "]";
    }
}
