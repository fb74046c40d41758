package io.pipingrelay.server.config;

import io.pipingrelay.core.engine.RendezvousEngine;

/**
 * Root configuration of the relay server.
 *
 * <p>
 * Use {@link #builder()}; every field has a default.
 *
 * @param host          bind address of both connectors
 * @param httpPort      HTTP listen port ({@code 0} picks an ephemeral port)
 * @param maxThreads    Jetty worker pool ceiling; every open transfer holds
 *                      one worker per sender and per receiver
 * @param minThreads    Jetty worker pool floor
 * @param idleTimeoutMs how long a connection may stay silent, including a
 *                      sender or receiver waiting for its peers
 * @param chunkSize     bytes read from a sender per relayed chunk
 * @param livenessCheckMs how often a waiting sender or receiver checks that
 *                      its client is still connected
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 * @param tls           HTTPS listener
 */
public record RelayConfig(
        String host,
        int httpPort,
        int maxThreads,
        int minThreads,
        long idleTimeoutMs,
        int chunkSize,
        long livenessCheckMs,
        String loggingFormat,
        String loggingLevel,
        TlsConfig tls) {

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RelayConfig}, pre-filled with the defaults. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int httpPort = 8080;
        private int maxThreads = 250;
        private int minThreads = 8;
        private long idleTimeoutMs = 600_000;
        private int chunkSize = RendezvousEngine.DEFAULT_CHUNK_SIZE;
        private long livenessCheckMs = RendezvousEngine.DEFAULT_LIVENESS_INTERVAL.toMillis();
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private boolean tlsEnabled;
        private Integer httpsPort;
        private String crtPath;
        private String keyPath;

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder httpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder maxThreads(int maxThreads) {
            this.maxThreads = maxThreads;
            return this;
        }

        public Builder minThreads(int minThreads) {
            this.minThreads = minThreads;
            return this;
        }

        public Builder idleTimeoutMs(long idleTimeoutMs) {
            this.idleTimeoutMs = idleTimeoutMs;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder livenessCheckMs(long livenessCheckMs) {
            this.livenessCheckMs = livenessCheckMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder tlsEnabled(boolean tlsEnabled) {
            this.tlsEnabled = tlsEnabled;
            return this;
        }

        public Builder httpsPort(int httpsPort) {
            this.httpsPort = httpsPort;
            return this;
        }

        public Builder crtPath(String crtPath) {
            this.crtPath = crtPath;
            return this;
        }

        public Builder keyPath(String keyPath) {
            this.keyPath = keyPath;
            return this;
        }

        public RelayConfig build() {
            TlsConfig tls = !tlsEnabled && httpsPort == null && crtPath == null && keyPath == null
                    ? TlsConfig.DISABLED
                    : new TlsConfig(tlsEnabled, httpsPort, crtPath, keyPath);
            return new RelayConfig(
                    host, httpPort, maxThreads, minThreads, idleTimeoutMs, chunkSize, livenessCheckMs,
                    loggingFormat, loggingLevel, tls);
        }
    }
}
