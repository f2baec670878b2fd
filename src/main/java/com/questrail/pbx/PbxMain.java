package com.questrail.pbx;

import com.questrail.pbx.config.PbxConfig;
import com.questrail.pbx.observability.Slf4jPbxObservabilitySink;
import com.questrail.pbx.runtime.PbxRuntime;
import com.questrail.pbx.runtime.PbxStartupException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * PBX server entry point.
 *
 * <pre>
 *   pbx -p &lt;port&gt;
 * </pre>
 *
 * A termination signal (SIGHUP, SIGINT, SIGTERM) runs the shutdown sequence
 * through a JVM shutdown hook before the process exits.
 */
public final class PbxMain {
    private static final Logger log = LoggerFactory.getLogger(PbxMain.class);

    static final String USAGE = "usage: pbx -p <port>";

    private PbxMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        OptionalInt port = parsePort(args);
        if (port.isEmpty()) {
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        PbxRuntime runtime = PbxRuntime.builder()
            .withConfig(PbxConfig.builder().withPort(port.getAsInt()).build())
            .withObservabilitySink(new Slf4jPbxObservabilitySink())
            .build();

        try {
            runtime.start();
        } catch (PbxStartupException e) {
            log.error("PBX failed to start", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                runtime.shutdown();
            } catch (InterruptedException e) {
                log.warn("Interrupted while draining connections");
                Thread.currentThread().interrupt();
            }
        }, "pbx-shutdown"));

        runtime.awaitTermination();
    }

    /**
     * Accepts exactly {@code -p <port>} with a port in 0-65535.
     */
    static OptionalInt parsePort(String[] args) {
        if (args == null || args.length != 2 || !"-p".equals(args[0])) {
            return OptionalInt.empty();
        }
        try {
            int port = Integer.parseInt(args[1]);
            return port >= 0 && port <= 0xFFFF ? OptionalInt.of(port) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
