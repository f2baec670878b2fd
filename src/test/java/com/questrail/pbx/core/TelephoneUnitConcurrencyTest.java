package com.questrail.pbx.core;

import com.questrail.pbx.api.TuState;
import com.questrail.pbx.transport.RecordingTuConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TelephoneUnitConcurrencyTest
 * -----------------------------------------------------------------------------
 * Drives pairs of units from competing threads, the way two servicing threads
 * act on units that are each other's peers, and checks that
 * <ul>
 *   <li>no pair of operations deadlocks (every worker finishes in time)</li>
 *   <li>peer links and reference counts are consistent once quiescent</li>
 * </ul>
 */
class TelephoneUnitConcurrencyTest {

    private static final int ROUNDS = 5_000;

    private PbxRegistry registry;
    private ExecutorService workers;

    @BeforeEach
    void setUp() {
        registry = new PbxRegistry(8);
        workers = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private TelephoneUnit plug() {
        TelephoneUnit tu = new TelephoneUnit(new RecordingTuConnection());
        assertTrue(registry.register(tu).isPresent());
        return tu;
    }

    private static void assertConsistent(TelephoneUnit... units) {
        for (TelephoneUnit tu : units) {
            TuState state = tu.state();
            Optional<TelephoneUnit> peer = tu.peer();
            assertEquals(state.hasPeer(), peer.isPresent(), () -> tu + " in " + state);
            peer.ifPresent(p -> assertSame(tu, p.peer().orElse(null), "peer link not reciprocal"));
            assertEquals(peer.isPresent() ? 2 : 1, tu.refCount(), () -> "refcount of " + tu);
            assertFalse(tu.isDestroyed());
        }
    }

    private void runAll(List<Runnable> tasks) throws Exception {
        CyclicBarrier start = new CyclicBarrier(tasks.size());
        List<Future<?>> futures = new ArrayList<>();
        for (Runnable task : tasks) {
            futures.add(workers.submit(() -> {
                start.await();
                task.run();
                return null;
            }));
        }
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
    }

    @Test
    void peersDialingAndHangingUpOnEachOtherNeverDeadlock() throws Exception {
        TelephoneUnit x = plug();
        TelephoneUnit y = plug();

        runAll(List.of(
            () -> {
                for (int i = 0; i < ROUNDS; i++) {
                    x.pickup();
                    registry.dial(x, y.extension());
                    x.pickup();
                    x.hangup();
                }
            },
            () -> {
                for (int i = 0; i < ROUNDS; i++) {
                    y.pickup();
                    registry.dial(y, x.extension());
                    y.pickup();
                    y.hangup();
                }
            }
        ));

        assertConsistent(x, y);
    }

    @Test
    void simultaneousHangupOfBothSidesClearsLinkOnce() throws Exception {
        TelephoneUnit x = plug();
        TelephoneUnit y = plug();

        for (int i = 0; i < 500; i++) {
            x.hangup();
            y.hangup();
            x.pickup();
            registry.dial(x, y.extension());
            if (i % 2 == 0) {
                y.pickup();
            }

            runAll(List.of(x::hangup, y::hangup));

            assertEquals(TuState.ON_HOOK, x.state());
            assertConsistent(x, y);
        }
    }

    @Test
    void chatAndHangupRaceKeepsUnitsConsistent() throws Exception {
        TelephoneUnit x = plug();
        TelephoneUnit y = plug();
        TelephoneUnit z = plug();

        runAll(List.of(
            () -> {
                for (int i = 0; i < ROUNDS; i++) {
                    x.pickup();
                    registry.dial(x, (i % 2 == 0 ? y : z).extension());
                    x.chat("ping " + i);
                    x.hangup();
                }
            },
            () -> {
                for (int i = 0; i < ROUNDS; i++) {
                    y.pickup();
                    y.chat("pong " + i);
                    y.hangup();
                }
            },
            () -> {
                for (int i = 0; i < ROUNDS; i++) {
                    z.pickup();
                    registry.dial(z, y.extension());
                    z.chat("z " + i);
                    z.hangup();
                }
            }
        ));

        assertConsistent(x, y, z);
    }

    @Test
    void unregisterRacingPeerOperationsLeavesSurvivorIdle() throws Exception {
        for (int i = 0; i < 200; i++) {
            PbxRegistry round = new PbxRegistry(2);
            RecordingTuConnection leavingConn = new RecordingTuConnection();
            TelephoneUnit leaving = new TelephoneUnit(leavingConn);
            TelephoneUnit staying = new TelephoneUnit(new RecordingTuConnection());
            round.register(leaving);
            round.register(staying);
            leaving.pickup();
            round.dial(leaving, staying.extension());

            runAll(List.of(
                () -> round.unregister(leaving),
                () -> {
                    staying.pickup();
                    staying.chat("still there?");
                }
            ));

            assertTrue(leaving.isDestroyed());
            assertEquals(1, leavingConn.closeCount());
            assertTrue(staying.peer().isEmpty());
            assertEquals(1, staying.refCount());
            assertTrue(staying.state() == TuState.DIAL_TONE || staying.state() == TuState.ON_HOOK,
                () -> "unexpected " + staying.state());
        }
    }
}
