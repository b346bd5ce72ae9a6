package com.questrail.facelink.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * MouthSyncConfig
 * -----------------------------------------------------------------------------
 * Parameters of {@link MouthSyncOrchestrator} and its HTTP collaborators.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>bufferDelay</b>: time between triggering remote playback and the first
 *       mouth frame; the speaker buffers this long before sound comes out.</li>
 *   <li><b>minAudioBytes</b>: smaller downloads are treated as "no audio".</li>
 *   <li><b>playFormat</b>: {@code format} field of the playback request.</li>
 *   <li><b>fetchTimeout</b>: limit for downloading the clip.</li>
 *   <li><b>playTimeout</b>: limit for the playback request.</li>
 * </ul>
 */
public record MouthSyncConfig(
        Duration bufferDelay,
        int minAudioBytes,
        String playFormat,
        Duration fetchTimeout,
        Duration playTimeout
) {
    public MouthSyncConfig {
        Objects.requireNonNull(bufferDelay, "bufferDelay");
        Objects.requireNonNull(playFormat, "playFormat");
        Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        Objects.requireNonNull(playTimeout, "playTimeout");

        if (bufferDelay.isNegative()) {
            throw new IllegalArgumentException("bufferDelay must be >= 0");
        }
        if (minAudioBytes < 0) {
            throw new IllegalArgumentException("minAudioBytes must be >= 0");
        }
        if (playFormat.isBlank()) {
            throw new IllegalArgumentException("playFormat must not be blank");
        }
        if (fetchTimeout.isZero() || fetchTimeout.isNegative()
                || playTimeout.isZero() || playTimeout.isNegative()) {
            throw new IllegalArgumentException("timeouts must be > 0");
        }
    }

    /**
     * bufferDelay 400 ms, minAudioBytes 100, playFormat "mp3", fetchTimeout 10 s, playTimeout 5 s.
     */
    public static MouthSyncConfig defaults() {
        return new MouthSyncConfig(
                Duration.ofMillis(400),
                100,
                "mp3",
                Duration.ofSeconds(10),
                Duration.ofSeconds(5));
    }

    public MouthSyncConfig withBufferDelay(Duration delay) {
        return new MouthSyncConfig(delay, minAudioBytes, playFormat, fetchTimeout, playTimeout);
    }
}
