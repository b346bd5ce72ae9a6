package com.questrail.facelink.runtime;

import com.questrail.facelink.audio.EnvelopeConfig;
import com.questrail.facelink.device.ButtonRegion;
import com.questrail.facelink.session.LinkTimingPolicy;
import com.questrail.facelink.sync.MouthSyncConfig;
import com.questrail.facelink.transport.DeviceEndpoint;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the FaceLink runtime.
 *
 * <p>{@code playEndpoint} is optional; without it clips are animated but not
 * sent to a speaker.</p>
 */
public record FaceLinkRuntimeConfig(
    DeviceEndpoint endpoint,
    LinkTimingPolicy timingPolicy,
    EnvelopeConfig envelopeConfig,
    MouthSyncConfig mouthSyncConfig,
    ButtonRegion buttonRegion,
    URI playEndpoint
) {
    public FaceLinkRuntimeConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(envelopeConfig, "envelopeConfig");
        Objects.requireNonNull(mouthSyncConfig, "mouthSyncConfig");
        Objects.requireNonNull(buttonRegion, "buttonRegion");
    }

    public Optional<URI> playEndpointIfSet() {
        return Optional.ofNullable(playEndpoint);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DeviceEndpoint endpoint;
        private LinkTimingPolicy timingPolicy = LinkTimingPolicy.defaults();
        private EnvelopeConfig envelopeConfig = EnvelopeConfig.defaults();
        private MouthSyncConfig mouthSyncConfig = MouthSyncConfig.defaults();
        private ButtonRegion buttonRegion = ButtonRegion.DEFAULT;
        private URI playEndpoint;

        public Builder withEndpoint(DeviceEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /** Serial port path or {@code host[:port]}; see {@link DeviceEndpoint#parse(String)}. */
        public Builder withHost(String host) {
            this.endpoint = DeviceEndpoint.parse(host);
            return this;
        }

        public Builder withTimingPolicy(LinkTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withEnvelopeConfig(EnvelopeConfig envelopeConfig) {
            this.envelopeConfig = envelopeConfig;
            return this;
        }

        public Builder withMouthSyncConfig(MouthSyncConfig mouthSyncConfig) {
            this.mouthSyncConfig = mouthSyncConfig;
            return this;
        }

        public Builder withButtonRegion(ButtonRegion buttonRegion) {
            this.buttonRegion = buttonRegion;
            return this;
        }

        public Builder withPlayEndpoint(URI playEndpoint) {
            this.playEndpoint = playEndpoint;
            return this;
        }

        public FaceLinkRuntimeConfig build() {
            return new FaceLinkRuntimeConfig(
                endpoint, timingPolicy, envelopeConfig, mouthSyncConfig, buttonRegion, playEndpoint);
        }
    }
}
