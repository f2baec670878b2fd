package com.questrail.pbx.core;

import com.questrail.pbx.observability.NullObservabilitySink;
import com.questrail.pbx.observability.PbxObservabilitySink;
import com.questrail.pbx.observability.PbxRegistryEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PbxRegistry
 * =============================================================================
 * Fixed-capacity extension directory. Slot {@code i} holds the unit registered
 * at extension {@code i}, and the directory owns one reference to every unit
 * it holds.
 *
 * <h2>Lock Order</h2>
 * The directory lock guards slot membership only. Every operation that touches
 * a unit takes the directory lock first and unit locks afterwards; no code path
 * asks for the directory lock while holding a unit lock.
 *
 * <h2>Shutdown</h2>
 * <pre>
 *   shutdownConnections()  → refuse new registrations, shut every connection down
 *   awaitEmpty()           → block until the last unregister() empties the table
 *   terminate()            → only legal once empty
 * </pre>
 */
public final class PbxRegistry
{
    private final TelephoneUnit[] slots;
    private final PbxObservabilitySink observabilitySink;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition emptied = lock.newCondition();

    // Guarded by lock.
    private int occupied;
    private boolean closing;
    private boolean terminated;

    public PbxRegistry(int capacity, PbxObservabilitySink observabilitySink) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        }
        this.slots = new TelephoneUnit[capacity];
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public PbxRegistry(int capacity) {
        this(capacity, null);
    }

    public int capacity() {
        return slots.length;
    }

    public int size() {
        lock.lock();
        try {
            return occupied;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosing() {
        lock.lock();
        try {
            return closing;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminated() {
        lock.lock();
        try {
            return terminated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the unit registered at {@code extension}, if any
     */
    public Optional<TelephoneUnit> lookup(int extension) {
        lock.lock();
        try {
            return Optional.ofNullable(slotAt(extension));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Register {@code tu} at the first free slot and send it
     * {@code ON HOOK <extension>}. The directory takes over the unit's initial
     * reference.
     *
     * @return the assigned extension, or empty if the directory is full or
     *         shutting down; nothing is changed in that case and the caller
     *         must {@link TelephoneUnit#discard() discard} the unit
     */
    public OptionalInt register(TelephoneUnit tu) {
        Objects.requireNonNull(tu, "tu");
        lock.lock();
        try {
            int free = closing ? -1 : firstFreeSlot();
            if (free < 0) {
                fire(PbxRegistryEvent.Kind.REJECTED, TelephoneUnit.NO_EXTENSION, tu);
                return OptionalInt.empty();
            }
            tu.assignExtension(free);
            slots[free] = tu;
            occupied++;
            fire(PbxRegistryEvent.Kind.REGISTERED, free, tu);
            return OptionalInt.of(free);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unplug {@code tu}: hang it up (ending any call), clear its slot and release
     * the directory's reference, which closes its connection.
     *
     * @return {@code false} if {@code tu} is not registered
     */
    public boolean unregister(TelephoneUnit tu) {
        Objects.requireNonNull(tu, "tu");
        lock.lock();
        try {
            int ext = tu.extension();
            if (slotAt(ext) != tu) {
                return false;
            }
            tu.hangup();
            slots[ext] = null;
            occupied--;
            tu.unref();
            fire(PbxRegistryEvent.Kind.UNREGISTERED, ext, tu);

            if (occupied == 0) {
                emptied.signalAll();
                if (closing) {
                    fire(PbxRegistryEvent.Kind.DRAINED, TelephoneUnit.NO_EXTENSION, null);
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dial {@code extension} from {@code tu}. An extension with no registered
     * unit is passed on as an absent target, see {@link TelephoneUnit#dial}.
     *
     * @return {@code false} if {@code tu} itself is not registered
     */
    public boolean dial(TelephoneUnit tu, int extension) {
        Objects.requireNonNull(tu, "tu");
        lock.lock();
        try {
            if (slotAt(tu.extension()) != tu) {
                return false;
            }
            tu.dial(slotAt(extension));
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    /**
     * Refuse further registrations and shut down the connection of every
     * registered unit. Slots and unit states are left alone; each unit leaves
     * the directory when its servicing side observes end of stream and calls
     * {@link #unregister}.
     *
     * @return number of connections shut down
     */
    public int shutdownConnections() {
        lock.lock();
        try {
            closing = true;
            int count = 0;
            for (TelephoneUnit tu : slots) {
                if (tu != null) {
                    tu.connection().shutdown();
                    count++;
                }
            }
            if (occupied == 0) {
                fire(PbxRegistryEvent.Kind.DRAINED, TelephoneUnit.NO_EXTENSION, null);
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until no unit is registered.
     */
    public void awaitEmpty() throws InterruptedException {
        lock.lock();
        try {
            while (occupied > 0) {
                emptied.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until no unit is registered or the timeout expires.
     *
     * @return {@code true} if the directory is empty
     */
    public boolean awaitEmpty(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (occupied > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = emptied.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release the directory for good.
     *
     * @throws IllegalStateException if any slot is still occupied
     */
    public void terminate() {
        lock.lock();
        try {
            if (occupied > 0) {
                throw new IllegalStateException(occupied + " extensions still registered");
            }
            closing = true;
            terminated = true;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private TelephoneUnit slotAt(int extension) {
        if (extension < 0 || extension >= slots.length) {
            return null;
        }
        return slots[extension];
    }

    private int firstFreeSlot() {
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                return i;
            }
        }
        return -1;
    }

    private void fire(PbxRegistryEvent.Kind kind, int extension, TelephoneUnit tu) {
        observabilitySink.onRegistryEvent(new PbxRegistryEvent(
            Instant.now(),
            kind,
            extension,
            occupied,
            slots.length,
            tu != null ? tu.connection().describe() : ""
        ));
    }
}
