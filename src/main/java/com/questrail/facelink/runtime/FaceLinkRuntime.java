package com.questrail.facelink.runtime;

import com.questrail.facelink.animation.AnimationHandle;
import com.questrail.facelink.animation.MouthAnimationScheduler;
import com.questrail.facelink.audio.EnvelopeExtractor;
import com.questrail.facelink.audio.JavaSoundPcmDecoder;
import com.questrail.facelink.audio.PcmDecoder;
import com.questrail.facelink.device.SenseCapDisplay;
import com.questrail.facelink.internal.time.MonotonicClock;
import com.questrail.facelink.internal.time.MonotonicScheduler;
import com.questrail.facelink.internal.time.ScheduledExecutorScheduler;
import com.questrail.facelink.internal.time.SystemMonotonicClock;
import com.questrail.facelink.internal.time.SystemSleeper;
import com.questrail.facelink.internal.time.SystemWallClock;
import com.questrail.facelink.observability.LinkErrorEvent;
import com.questrail.facelink.observability.LinkObservabilitySink;
import com.questrail.facelink.observability.NullObservabilitySink;
import com.questrail.facelink.protocol.model.DeviceEvent;
import com.questrail.facelink.protocol.model.DeviceResponse;
import com.questrail.facelink.session.LinkSession;
import com.questrail.facelink.sync.AudioSource;
import com.questrail.facelink.sync.HttpAudioSource;
import com.questrail.facelink.sync.HttpPlaybackTrigger;
import com.questrail.facelink.sync.MouthSyncOrchestrator;
import com.questrail.facelink.sync.PlaybackTrigger;
import com.questrail.facelink.transport.ByteTransport;
import com.questrail.facelink.transport.DeviceEndpoint;
import com.questrail.facelink.transport.serial.SerialPortTransport;
import com.questrail.facelink.transport.tcp.netty.NettySocketTransport;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * FaceLinkRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one face display.
 *
 * <h2>Startup</h2>
 * <ul>
 *   <li>Serial: open the port, let the board boot, discard boot output.</li>
 *   <li>Socket: connect, then consume the {@code connected} greeting.</li>
 * </ul>
 *
 * <h2>Threads</h2>
 * The caller's thread issues commands. A single-thread scheduled executor owned
 * by the runtime runs mouth animations; {@link #stop()} shuts it down.
 */
public final class FaceLinkRuntime implements AutoCloseable {
    private final FaceLinkRuntimeConfig config;
    private final LinkSession session;
    private final SenseCapDisplay display;
    private final MouthSyncOrchestrator mouthSync;
    private final ScheduledExecutorService animationExecutor;
    private final DeviceResponse greeting;

    private FaceLinkRuntime(
            FaceLinkRuntimeConfig config,
            LinkSession session,
            MouthSyncOrchestrator mouthSync,
            ScheduledExecutorService animationExecutor,
            DeviceResponse greeting) {
        this.config = config;
        this.session = session;
        this.display = new SenseCapDisplay(session);
        this.mouthSync = mouthSync;
        this.animationExecutor = animationExecutor;
        this.greeting = greeting;
    }

    public FaceLinkRuntimeConfig config() {
        return config;
    }

    public LinkSession link() {
        return session;
    }

    public SenseCapDisplay display() {
        return display;
    }

    /** The socket greeting, empty on serial links. */
    public Optional<DeviceResponse> greeting() {
        return Optional.ofNullable(greeting);
    }

    public List<DeviceEvent> collectEvents() {
        return session.collectEvents();
    }

    /**
     * Harvest pending events and report whether any of them is a press of the
     * configured button region.
     */
    public boolean pollButtonPress(boolean touchAnywhere) {
        boolean pressed = false;
        for (DeviceEvent event : session.collectEvents()) {
            pressed |= config.buttonRegion().isPress(event, touchAnywhere);
        }
        return pressed;
    }

    /**
     * Play {@code audioUrl} on the configured speaker, if any, and animate the mouth.
     */
    public Optional<AnimationHandle> playWithMouthSync(URI audioUrl) {
        return mouthSync.playWithMouthSync(audioUrl, config.playEndpoint());
    }

    public Optional<AnimationHandle> playWithMouthSync(URI audioUrl, URI playEndpoint) {
        return mouthSync.playWithMouthSync(audioUrl, playEndpoint);
    }

    public void stop() {
        animationExecutor.shutdown();
        try {
            if (!animationExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                animationExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            animationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        session.close();
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FaceLinkRuntimeConfig config;
        private LinkObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private ByteTransport transport;
        private PcmDecoder decoder;
        private AudioSource audioSource;
        private PlaybackTrigger playbackTrigger;

        public Builder withConfig(FaceLinkRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(LinkObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Use an already open transport instead of opening {@code config.endpoint()}.
         * The endpoint still decides between boot drain and greeting.
         */
        public Builder withTransport(ByteTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withPcmDecoder(PcmDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder withAudioSource(AudioSource audioSource) {
            this.audioSource = audioSource;
            return this;
        }

        public Builder withPlaybackTrigger(PlaybackTrigger playbackTrigger) {
            this.playbackTrigger = playbackTrigger;
            return this;
        }

        /**
         * Open the link and wire the stack.
         *
         * @throws com.questrail.facelink.transport.TransportException if the device cannot be reached
         */
        public FaceLinkRuntime build() {
            Objects.requireNonNull(config, "config");
            LinkObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Transport and session
            ByteTransport t = transport != null ? transport : open(config, sink);
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            LinkSession session = new LinkSession(
                t, config.timingPolicy(), clock, SystemSleeper.INSTANCE, SystemWallClock.INSTANCE, sink);

            // 2. Bring the link to a clean state
            DeviceResponse greeting = null;
            try {
                if (config.endpoint() instanceof DeviceEndpoint.Socket) {
                    greeting = session.awaitGreeting(config.timingPolicy().greetingTimeout());
                } else {
                    session.drainBoot(config.timingPolicy().bootDrainWait());
                }
            } catch (RuntimeException e) {
                sink.onError(new LinkErrorEvent(SystemWallClock.INSTANCE.now(), "Link startup failed", e));
                session.close();
                throw e;
            }

            // 3. Animation thread
            ScheduledExecutorService exec = Executors.newScheduledThreadPool(1, r -> {
                Thread th = new Thread(r, "facelink-animation");
                th.setDaemon(true);
                return th;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(exec, clock);

            // 4. Mouth sync
            MouthSyncOrchestrator mouthSync = new MouthSyncOrchestrator(
                audioSource != null ? audioSource : new HttpAudioSource(config.mouthSyncConfig().fetchTimeout()),
                new EnvelopeExtractor(decoder != null ? decoder : new JavaSoundPcmDecoder(), config.envelopeConfig()),
                playbackTrigger != null
                    ? playbackTrigger
                    : new HttpPlaybackTrigger(config.mouthSyncConfig().playTimeout(), config.mouthSyncConfig().playFormat()),
                new MouthAnimationScheduler(clock, SystemSleeper.INSTANCE, SystemWallClock.INSTANCE, sink),
                session.fireAndForget(),
                scheduler,
                config.mouthSyncConfig()
            );

            return new FaceLinkRuntime(config, session, mouthSync, exec, greeting);
        }

        private static ByteTransport open(FaceLinkRuntimeConfig config, LinkObservabilitySink sink) {
            DeviceEndpoint endpoint = config.endpoint();
            if (endpoint instanceof DeviceEndpoint.Serial serial) {
                return SerialPortTransport.open(
                    serial.portName(), serial.baudRate(), config.timingPolicy().writeTimeout(), sink);
            }
            DeviceEndpoint.Socket socket = (DeviceEndpoint.Socket) endpoint;
            return NettySocketTransport.connect(
                socket.host(), socket.port(),
                config.timingPolicy().connectTimeout(), config.timingPolicy().writeTimeout(), sink);
        }
    }
}
