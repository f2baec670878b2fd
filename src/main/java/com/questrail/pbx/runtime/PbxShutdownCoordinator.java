package com.questrail.pbx.runtime;

import com.questrail.pbx.core.PbxRegistry;
import com.questrail.pbx.transport.PbxServerEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PbxShutdownCoordinator
 * =============================================================================
 * Drains the PBX: every open connection is forced closed, then the coordinator
 * waits until the directory is empty before releasing it and the transport.
 *
 * <h2>Shutdown Flow</h2>
 * <pre>
 * 1. shutdown() called
 *    └─▶ Phase: RUNNING → DRAINING
 *        └─▶ Stop accepting connections
 *        └─▶ Shut down every registered connection
 *        └─▶ Wait until the last unregistration empties the directory
 *
 * 2. Directory empty
 *    └─▶ Terminate directory, release transport threads
 *    └─▶ Phase: DRAINING → TERMINATED
 * </pre>
 *
 * <p>The drain has no upper bound: it ends when every servicing side has seen
 * its connection close and unregistered. One caller drives the sequence at a
 * time; concurrent callers wait for it. If the driving caller is interrupted
 * the phase stays {@code DRAINING} and the next caller, waiting or new,
 * resumes the wait for the drain. Connections are shut down only once.</p>
 */
public final class PbxShutdownCoordinator {

    public enum Phase {
        RUNNING,
        DRAINING,
        TERMINATED
    }

    private static final Logger log = LoggerFactory.getLogger(PbxShutdownCoordinator.class);

    private final PbxRegistry registry;
    private final PbxServerEndpoint endpoint;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition driverReleased = lock.newCondition();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile Phase phase = Phase.RUNNING;

    // Guarded by lock.
    private boolean driving;
    private boolean connectionsShutDown;

    public PbxShutdownCoordinator(PbxRegistry registry, PbxServerEndpoint endpoint) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Run the shutdown sequence, or resume one that was interrupted. Returns
     * once the directory is empty and released.
     *
     * @throws InterruptedException if interrupted while waiting; the directory
     *         is then left draining and a later call picks the drain up again
     */
    public void shutdown() throws InterruptedException {
        boolean shutDownConnections;
        lock.lock();
        try {
            while (driving) {
                driverReleased.await();
            }
            if (phase == Phase.TERMINATED) {
                return;
            }
            driving = true;
            phase = Phase.DRAINING;
            shutDownConnections = !connectionsShutDown;
            connectionsShutDown = true;
        } finally {
            lock.unlock();
        }

        boolean done = false;
        try {
            drain(shutDownConnections);
            done = true;
        } finally {
            lock.lock();
            try {
                driving = false;
                if (done) {
                    phase = Phase.TERMINATED;
                }
                driverReleased.signalAll();
            } finally {
                lock.unlock();
            }
        }
        terminated.countDown();
        log.info("PBX terminated");
    }

    private void drain(boolean shutDownConnections) throws InterruptedException {
        if (shutDownConnections) {
            endpoint.stopAccepting();
            int closed = registry.shutdownConnections();
            log.info("Shutting down PBX, {} connections to drain", closed);
        } else {
            log.info("Resuming PBX drain, {} connections left", registry.size());
        }

        registry.awaitEmpty();
        registry.terminate();
        endpoint.stop();
    }

    /**
     * Block until a shutdown driven by another thread has completed.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    /**
     * @return {@code true} if terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
