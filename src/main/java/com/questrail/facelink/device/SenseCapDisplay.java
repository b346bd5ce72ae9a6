package com.questrail.facelink.device;

import com.questrail.facelink.api.DeviceLink;
import com.questrail.facelink.internal.time.Sleeper;
import com.questrail.facelink.internal.time.SystemSleeper;
import com.questrail.facelink.protocol.model.DeviceCommand;
import com.questrail.facelink.protocol.model.DeviceResponse;

import java.time.Duration;
import java.util.Objects;

/**
 * SenseCapDisplay
 * =============================================================================
 * Typed command vocabulary of the face display firmware.
 *
 * <p>Every method is a blocking request/response exchange on the underlying
 * {@link DeviceLink} and returns the device's status. Mouth frames for
 * animation do not go through here; they use the link's fire-and-forget
 * channel.</p>
 */
public final class SenseCapDisplay
{
    public static final String DEFAULT_CLEAR_COLOR = "#000000";

    private static final int ALERT_BEEPS = 3;
    private static final Duration ALERT_GAP = Duration.ofMillis(150);

    private final DeviceLink link;
    private final Sleeper sleeper;

    public SenseCapDisplay(DeviceLink link) {
        this(link, SystemSleeper.INSTANCE);
    }

    public SenseCapDisplay(DeviceLink link, Sleeper sleeper) {
        this.link = Objects.requireNonNull(link, "link");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public DeviceLink link() {
        return link;
    }

    /** Fill the screen with {@code #RRGGBB}. */
    public DeviceResponse clear(String hexColor) {
        Objects.requireNonNull(hexColor, "hexColor");
        return link.sendCommand(DeviceCommand.builder("clear").put("color", hexColor).build());
    }

    public DeviceResponse clear() {
        return clear(DEFAULT_CLEAR_COLOR);
    }

    public DeviceResponse faceOn() {
        return face(true);
    }

    public DeviceResponse faceOff() {
        return face(false);
    }

    /** Mouth openness, 0 (closed smile) to 1 (fully open). */
    public DeviceResponse mouth(double open) {
        return link.sendCommand(DeviceCommand.mouth(clamp01(open)));
    }

    /** Floating hearts, 0 (none) to 1 (all). */
    public DeviceResponse love(double value) {
        return link.sendCommand(DeviceCommand.builder("love").put("value", clamp01(value)).build());
    }

    public DeviceResponse blink() {
        return link.sendCommand(DeviceCommand.of("blink"));
    }

    public DeviceResponse backlight(boolean on) {
        return link.sendCommand(DeviceCommand.builder("bl").put("on", on).build());
    }

    public DeviceResponse tone(int frequencyHz, int durationMs) {
        if (frequencyHz <= 0 || durationMs <= 0) {
            throw new IllegalArgumentException("frequency and duration must be > 0");
        }
        return link.sendCommand(DeviceCommand.builder("tone")
                .put("freq", frequencyHz)
                .put("dur", durationMs)
                .build());
    }

    public DeviceResponse beep() {
        return tone(1000, 100);
    }

    /**
     * Three short high beeps.
     *
     * @return the status of the last beep, or the first non-ok one
     */
    public DeviceResponse alert() {
        DeviceResponse last = DeviceResponse.of(DeviceResponse.OK);
        for (int i = 0; i < ALERT_BEEPS; i++) {
            last = tone(2000, 100);
            if (!last.isOk()) {
                return last;
            }
            if (i < ALERT_BEEPS - 1) {
                try {
                    sleeper.sleepNanos(ALERT_GAP.toNanos());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return last;
                }
            }
        }
        return last;
    }

    /** Melody string of {@code note:duration} pairs, e.g. {@code "C4:4 D4:4 E4:4"}. */
    public DeviceResponse melody(String notes) {
        Objects.requireNonNull(notes, "notes");
        return link.sendCommand(DeviceCommand.builder("melody").put("notes", notes).build());
    }

    public DeviceResponse stopAudio() {
        return link.sendCommand(DeviceCommand.of("stop"));
    }

    /** Network status; an ok response carries {@code ip} and, when connected, {@code port}. */
    public DeviceResponse wifiStatus() {
        return link.sendCommand(DeviceCommand.of("wifi"));
    }

    /** Show a baseline JPEG sized for the panel. */
    public DeviceResponse showJpeg(byte[] jpeg) {
        return link.sendBinaryPayload(Objects.requireNonNull(jpeg, "jpeg"));
    }

    private DeviceResponse face(boolean on) {
        return link.sendCommand(DeviceCommand.builder("face").put("on", on).build());
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
