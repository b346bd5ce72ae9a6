package com.questrail.facelink.device;

import com.questrail.facelink.internal.time.Sleeper;
import com.questrail.facelink.internal.time.SystemSleeper;
import com.questrail.facelink.transport.ByteTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * ServoController
 * =============================================================================
 * Line protocol of the servo/backlight board on its own serial port.
 *
 * <pre>
 *   S&lt;angle&gt;\n         servo angle, clamped to [120, 150]
 *   C&lt;r&gt;,&lt;g&gt;,&lt;b&gt;\n     backlight colour
 * </pre>
 *
 * <p>The board never answers; writes are fire-and-forget.</p>
 */
public final class ServoController implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ServoController.class);

    public static final int SERVO_BAUD = 115200;
    public static final int SERVO_MIN = 120;
    public static final int SERVO_MAX = 150;
    public static final int INITIAL_ANGLE = 135;
    public static final Duration BOOT_DELAY = Duration.ofMillis(500);

    private final ByteTransport transport;
    private final Object writeLock = new Object();

    private ServoController(ByteTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Take over an open transport: wait for the board to boot, discard its boot
     * output, then move the servo to {@code initialAngle}.
     */
    public static ServoController attach(ByteTransport transport, Sleeper sleeper, Duration bootDelay, int initialAngle) {
        Objects.requireNonNull(sleeper, "sleeper");
        Objects.requireNonNull(bootDelay, "bootDelay");

        ServoController servo = new ServoController(transport);
        try {
            sleeper.sleepNanos(bootDelay.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        int discarded = 0;
        byte[] chunk;
        while ((chunk = transport.readAvailable()).length > 0) {
            discarded += chunk.length;
        }
        log.info("Servo connected on {} ({} boot bytes discarded)", transport.describe(), discarded);

        servo.sendServo(initialAngle);
        return servo;
    }

    public static ServoController attach(ByteTransport transport) {
        return attach(transport, SystemSleeper.INSTANCE, BOOT_DELAY, INITIAL_ANGLE);
    }

    /**
     * @return the angle actually sent
     */
    public int sendServo(int angle) {
        int clamped = Math.max(SERVO_MIN, Math.min(SERVO_MAX, angle));
        writeLine("S" + clamped);
        return clamped;
    }

    public void sendColor(int r, int g, int b) {
        writeLine("C" + r + "," + g + "," + b);
    }

    /**
     * Drive the servo from an interest level in {@code [0, 10]}.
     *
     * @return the matching love value for the display
     */
    public double setInterest(double interest) {
        int angle = sendServo(interestToServo(interest));
        log.debug("Interest {} -> angle {}", interest, angle);
        return interestToLove(interest);
    }

    public static double interestToLove(double interest) {
        return Math.max(0.0, Math.min(1.0, interest / 10.0));
    }

    public static int interestToServo(double interest) {
        double t = Math.max(0.0, Math.min(10.0, interest)) / 10.0;
        return (int) Math.floor(SERVO_MIN + t * (SERVO_MAX - SERVO_MIN));
    }

    @Override
    public void close() {
        transport.close();
        log.info("Servo closed on {}", transport.describe());
    }

    private void writeLine(String line) {
        synchronized (writeLock) {
            transport.write((line + "\n").getBytes(StandardCharsets.US_ASCII));
        }
    }
}
