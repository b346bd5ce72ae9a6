package com.questrail.facelink.sync;

import com.questrail.facelink.animation.AnimationHandle;
import com.questrail.facelink.animation.MouthAnimationScheduler;
import com.questrail.facelink.api.FireAndForgetChannel;
import com.questrail.facelink.audio.AudioDecodeException;
import com.questrail.facelink.audio.Envelope;
import com.questrail.facelink.audio.EnvelopeExtractor;
import com.questrail.facelink.internal.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * MouthSyncOrchestrator
 * =============================================================================
 * Plays a clip on a remote speaker with the face's mouth following it.
 *
 * <pre>
 *   fetch clip ─▶ extract envelope ─▶ trigger playback ─▶ (bufferDelay) ─▶ animate
 * </pre>
 *
 * <p>Every failure before the animation is scheduled means "no animation" and
 * is logged; nothing here throws for bad audio or an unreachable speaker. The
 * call returns as soon as the animation is scheduled.</p>
 */
public final class MouthSyncOrchestrator
{
    private static final Logger log = LoggerFactory.getLogger(MouthSyncOrchestrator.class);

    private final AudioSource audioSource;
    private final EnvelopeExtractor extractor;
    private final PlaybackTrigger playbackTrigger;
    private final MouthAnimationScheduler animator;
    private final FireAndForgetChannel channel;
    private final MonotonicScheduler scheduler;
    private final MouthSyncConfig config;

    public MouthSyncOrchestrator(AudioSource audioSource,
                                 EnvelopeExtractor extractor,
                                 PlaybackTrigger playbackTrigger,
                                 MouthAnimationScheduler animator,
                                 FireAndForgetChannel channel,
                                 MonotonicScheduler scheduler,
                                 MouthSyncConfig config) {
        this.audioSource = Objects.requireNonNull(audioSource, "audioSource");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.playbackTrigger = Objects.requireNonNull(playbackTrigger, "playbackTrigger");
        this.animator = Objects.requireNonNull(animator, "animator");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Animate {@code audioUrl} without triggering remote playback.
     */
    public Optional<AnimationHandle> playWithMouthSync(URI audioUrl) {
        return playWithMouthSync(audioUrl, null);
    }

    /**
     * @param playEndpoint speaker endpoint to trigger, or {@code null} to skip playback
     * @return the scheduled animation, or empty if there is nothing to animate
     */
    public Optional<AnimationHandle> playWithMouthSync(URI audioUrl, URI playEndpoint) {
        Objects.requireNonNull(audioUrl, "audioUrl");

        byte[] audio;
        try {
            audio = audioSource.fetch(audioUrl);
        } catch (IOException e) {
            log.warn("Audio fetch failed for {}: {}", audioUrl, e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }

        if (audio == null || audio.length < config.minAudioBytes()) {
            log.warn("Audio too small ({} bytes), skipping mouth sync",
                    audio == null ? 0 : audio.length);
            return Optional.empty();
        }

        Envelope envelope;
        try {
            envelope = extractor.extract(audio);
        } catch (AudioDecodeException e) {
            log.warn("Envelope extraction failed: {}", e.toString());
            return Optional.empty();
        }
        if (envelope.isEmpty()) {
            log.warn("No envelope frames for {}", audioUrl);
            return Optional.empty();
        }

        log.info("Envelope: {} frames, audio {} ms, animation {} ms",
                envelope.size(),
                envelope.audioDuration().toMillis(),
                envelope.animationDuration().toMillis());

        if (playEndpoint != null) {
            try {
                playbackTrigger.trigger(playEndpoint, audioUrl);
            } catch (IOException e) {
                log.warn("Playback trigger to {} failed: {}", playEndpoint, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }

        return Optional.of(animator.startAfter(config.bufferDelay(), envelope, channel, scheduler));
    }
}
