package com.questrail.facelink.session;

import java.time.Duration;
import java.util.Objects;

/**
 * LinkTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for a {@link LinkSession}.
 *
 * <p>These values control how long the link waits, not what the protocol
 * means. Every blocking wait in the session is bounded by one of them.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>responseTimeout</b>: default wait for the status line of an ordinary command.</li>
 *   <li><b>greetingTimeout</b>: wait for the {@code connected} status a socket device
 *       sends on accept.</li>
 *   <li><b>imageReadyTimeout</b>: wait for {@code ready} after the image header.</li>
 *   <li><b>imageCompleteTimeout</b>: wait for the final status after the payload; covers
 *       on-device JPEG decode.</li>
 *   <li><b>bootDrainWait</b>: how long to let the device boot before discarding its output.</li>
 *   <li><b>pollInterval</b>: pause between empty reads while waiting for a response.</li>
 *   <li><b>connectTimeout</b>: TCP connect handshake limit.</li>
 *   <li><b>writeTimeout</b>: limit on a single transport write; a peer that stops
 *       reading cannot stall the link past it.</li>
 *   <li><b>maxQueuedEvents</b>: event queue cap; the oldest event is evicted beyond it.</li>
 * </ul>
 */
public record LinkTimingPolicy(
        Duration responseTimeout,
        Duration greetingTimeout,
        Duration imageReadyTimeout,
        Duration imageCompleteTimeout,
        Duration bootDrainWait,
        Duration pollInterval,
        Duration connectTimeout,
        Duration writeTimeout,
        int maxQueuedEvents
) {
    public LinkTimingPolicy {
        requireNonNegative(responseTimeout, "responseTimeout");
        requireNonNegative(greetingTimeout, "greetingTimeout");
        requireNonNegative(imageReadyTimeout, "imageReadyTimeout");
        requireNonNegative(imageCompleteTimeout, "imageCompleteTimeout");
        requireNonNegative(bootDrainWait, "bootDrainWait");
        requireNonNegative(pollInterval, "pollInterval");
        requireNonNegative(connectTimeout, "connectTimeout");
        requireNonNegative(writeTimeout, "writeTimeout");
        if (writeTimeout.isZero()) {
            throw new IllegalArgumentException("writeTimeout must be > 0");
        }

        if (maxQueuedEvents < 1) {
            throw new IllegalArgumentException("maxQueuedEvents must be >= 1");
        }
    }

    /**
     * Defaults matching the display firmware:
     * <ul>
     *   <li>responseTimeout: 5s</li>
     *   <li>greetingTimeout: 3s</li>
     *   <li>imageReadyTimeout: 3s</li>
     *   <li>imageCompleteTimeout: 15s</li>
     *   <li>bootDrainWait: 1.5s</li>
     *   <li>pollInterval: 2ms</li>
     *   <li>connectTimeout: 2s</li>
     *   <li>writeTimeout: 2s</li>
     *   <li>maxQueuedEvents: 256</li>
     * </ul>
     */
    public static LinkTimingPolicy defaults() {
        return builder().build();
    }

    /**
     * Defaults with only the response timeout replaced.
     */
    public static LinkTimingPolicy withResponseTimeout(Duration responseTimeout) {
        return builder().responseTimeout(responseTimeout).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }

    public static final class Builder {
        private Duration responseTimeout = Duration.ofSeconds(5);
        private Duration greetingTimeout = Duration.ofSeconds(3);
        private Duration imageReadyTimeout = Duration.ofSeconds(3);
        private Duration imageCompleteTimeout = Duration.ofSeconds(15);
        private Duration bootDrainWait = Duration.ofMillis(1500);
        private Duration pollInterval = Duration.ofMillis(2);
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration writeTimeout = Duration.ofSeconds(2);
        private int maxQueuedEvents = 256;

        private Builder() {}

        public Builder responseTimeout(Duration d) {
            this.responseTimeout = d;
            return this;
        }

        public Builder greetingTimeout(Duration d) {
            this.greetingTimeout = d;
            return this;
        }

        public Builder imageReadyTimeout(Duration d) {
            this.imageReadyTimeout = d;
            return this;
        }

        public Builder imageCompleteTimeout(Duration d) {
            this.imageCompleteTimeout = d;
            return this;
        }

        public Builder bootDrainWait(Duration d) {
            this.bootDrainWait = d;
            return this;
        }

        public Builder pollInterval(Duration d) {
            this.pollInterval = d;
            return this;
        }

        public Builder connectTimeout(Duration d) {
            this.connectTimeout = d;
            return this;
        }

        public Builder writeTimeout(Duration d) {
            this.writeTimeout = d;
            return this;
        }

        public Builder maxQueuedEvents(int max) {
            this.maxQueuedEvents = max;
            return this;
        }

        public LinkTimingPolicy build() {
            return new LinkTimingPolicy(
                    responseTimeout,
                    greetingTimeout,
                    imageReadyTimeout,
                    imageCompleteTimeout,
                    bootDrainWait,
                    pollInterval,
                    connectTimeout,
                    writeTimeout,
                    maxQueuedEvents
            );
        }
    }
}
