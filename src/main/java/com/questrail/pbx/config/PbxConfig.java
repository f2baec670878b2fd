package com.questrail.pbx.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for the PBX runtime.
 *
 * @param bindAddress    address the server listens on; port 0 picks an ephemeral port
 * @param maxExtensions  capacity of the extension directory
 * @param maxLineLength  longest accepted command line, terminator excluded
 * @param workerThreads  connection servicing threads; 0 lets the transport choose
 */
public record PbxConfig(
    InetSocketAddress bindAddress,
    int maxExtensions,
    int maxLineLength,
    int workerThreads
) {
    public static final int DEFAULT_MAX_EXTENSIONS = 1024;
    public static final int DEFAULT_MAX_LINE_LENGTH = 8192;

    public PbxConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxExtensions <= 0) {
            throw new IllegalArgumentException("maxExtensions must be > 0: " + maxExtensions);
        }
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be > 0: " + maxLineLength);
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads must be >= 0: " + workerThreads);
        }
    }

    public static PbxConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private int maxExtensions = DEFAULT_MAX_EXTENSIONS;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        private int workerThreads = 0;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withPort(int port) {
            if (port < 0 || port > 0xFFFF) {
                throw new IllegalArgumentException("Port must be 0-65535");
            }
            this.bindAddress = new InetSocketAddress(port);
            return this;
        }

        public Builder withMaxExtensions(int maxExtensions) {
            this.maxExtensions = maxExtensions;
            return this;
        }

        public Builder withMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public PbxConfig build() {
            return new PbxConfig(bindAddress, maxExtensions, maxLineLength, workerThreads);
        }
    }
}
