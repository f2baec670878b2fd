package com.questrail.pbx.runtime;

import com.questrail.pbx.config.PbxConfig;
import com.questrail.pbx.core.PbxRegistry;
import com.questrail.pbx.observability.NullObservabilitySink;
import com.questrail.pbx.observability.PbxObservabilitySink;
import com.questrail.pbx.protocol.PbxCommandParser;
import com.questrail.pbx.service.PbxClientService;
import com.questrail.pbx.transport.PbxServerEndpoint;
import com.questrail.pbx.transport.tcp.netty.NettyPbxServerEndpoint;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PbxRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a running PBX.
 *
 * <p>Everything that would otherwise be process-global (the directory, the
 * shutdown state) is created here once and handed to the components that need
 * it; nothing is reachable through static state.</p>
 *
 * <pre>
 *   PbxServerEndpoint ──lines──▶ PbxClientService ──▶ PbxRegistry ──▶ TelephoneUnit
 *                                                          ▲
 *   PbxShutdownCoordinator ────────────────────────────────┘
 * </pre>
 */
public final class PbxRuntime {
    private final PbxRegistry registry;
    private final PbxClientService service;
    private final PbxServerEndpoint endpoint;
    private final PbxShutdownCoordinator shutdownCoordinator;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private PbxRuntime(PbxRegistry registry,
                       PbxClientService service,
                       PbxServerEndpoint endpoint,
                       PbxShutdownCoordinator shutdownCoordinator) {
        this.registry = registry;
        this.service = service;
        this.endpoint = endpoint;
        this.shutdownCoordinator = shutdownCoordinator;
    }

    /**
     * Bind the listening address and start accepting connections.
     *
     * @throws PbxStartupException if the address cannot be bound
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("PBX already started");
        }
        endpoint.start();
    }

    /**
     * Drain and stop. Blocks until every connection has been unregistered.
     */
    public void shutdown() throws InterruptedException {
        shutdownCoordinator.shutdown();
    }

    public void awaitTermination() throws InterruptedException {
        shutdownCoordinator.awaitTermination();
    }

    public InetSocketAddress localAddress() {
        return endpoint.localAddress();
    }

    public PbxRegistry registry() {
        return registry;
    }

    public PbxClientService service() {
        return service;
    }

    public PbxShutdownCoordinator shutdownCoordinator() {
        return shutdownCoordinator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PbxConfig config = PbxConfig.defaults();
        private PbxObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private PbxServerEndpoint endpoint;

        public Builder withConfig(PbxConfig config) {
                return this;
        }

        public Builder withObservabilitySink(PbxObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace the Netty endpoint, e.g. with an in-memory one.
         */
        public Builder withEndpoint(PbxServerEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public PbxRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Directory
            PbxRegistry registry = new PbxRegistry(config.maxExtensions(), observabilitySink);

            // 2. Per-connection service
            PbxClientService service = new PbxClientService(registry, new PbxCommandParser(), observabilitySink);

            // 3. Transport
            PbxServerEndpoint effectiveEndpoint = endpoint != null
                ? endpoint
                : new NettyPbxServerEndpoint(
                    config.bindAddress(),
                    config.maxLineLength(),
                    config.workerThreads(),
                    observabilitySink);
            effectiveEndpoint.setListener(service);

            // 4. Shutdown
            PbxShutdownCoordinator coordinator = new PbxShutdownCoordinator(registry, effectiveEndpoint);

            return new PbxRuntime(registry, service, effectiveEndpoint, coordinator);
        }
    }
}
