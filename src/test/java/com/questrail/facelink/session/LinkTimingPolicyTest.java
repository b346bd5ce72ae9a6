package com.questrail.facelink.session;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LinkTimingPolicyTest
 * -----------------------------------------------------------------------------
 * Validates link timing configuration and factory methods.
 */
class LinkTimingPolicyTest {

    @Test
    void defaultsFactoryReturnsExpectedValues() {
        LinkTimingPolicy policy = LinkTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(5), policy.responseTimeout());
        assertEquals(Duration.ofSeconds(3), policy.greetingTimeout());
        assertEquals(Duration.ofSeconds(3), policy.imageReadyTimeout());
        assertEquals(Duration.ofSeconds(15), policy.imageCompleteTimeout());
        assertEquals(Duration.ofMillis(1500), policy.bootDrainWait());
        assertEquals(Duration.ofMillis(2), policy.pollInterval());
        assertEquals(Duration.ofSeconds(2), policy.connectTimeout());
        assertEquals(Duration.ofSeconds(2), policy.writeTimeout());
        assertEquals(256, policy.maxQueuedEvents());
    }

    @Test
    void withResponseTimeoutKeepsOtherDefaults() {
        LinkTimingPolicy policy = LinkTimingPolicy.withResponseTimeout(Duration.ofMillis(750));

        assertEquals(Duration.ofMillis(750), policy.responseTimeout());
        assertEquals(Duration.ofSeconds(15), policy.imageCompleteTimeout());
    }

    @Test
    void zeroDurationsAreAccepted() {
        LinkTimingPolicy policy = LinkTimingPolicy.builder()
                .responseTimeout(Duration.ZERO)
                .bootDrainWait(Duration.ZERO)
                .build();

        assertEquals(Duration.ZERO, policy.responseTimeout());
    }

    @Test
    void canonicalConstructorRejectsNull() {
        assertThrows(NullPointerException.class, () ->
                LinkTimingPolicy.builder().responseTimeout(null).build());
        assertThrows(NullPointerException.class, () ->
                LinkTimingPolicy.builder().pollInterval(null).build());
    }

    @Test
    void canonicalConstructorRejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class, () ->
                LinkTimingPolicy.builder().imageReadyTimeout(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class, () ->
                LinkTimingPolicy.builder().connectTimeout(Duration.ofMillis(-1)).build());
    }

    @Test
    void writeTimeoutMustBePositive() {
        assertThrows(IllegalArgumentException.class, () ->
                LinkTimingPolicy.builder().writeTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () ->
                LinkTimingPolicy.builder().writeTimeout(Duration.ofMillis(-5)).build());
    }

    @Test
    void queueCapMustBePositive() {
        assertThrows(IllegalArgumentException.class, () ->
                LinkTimingPolicy.builder().maxQueuedEvents(0).build());
    }
}
