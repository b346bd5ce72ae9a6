package com.questrail.facelink.transport;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * DeviceEndpoint
 * -----------------------------------------------------------------------------
 * Where the device lives: a serial port or a TCP host.
 *
 * <p>{@link #parse(String)} chooses the variant from a single host string:</p>
 * <ul>
 *   <li>{@code /dev/ttyUSB0}, {@code ttyACM0}, {@code COM6} → {@link Serial}</li>
 *   <li>{@code sensecap.local}, {@code 192.168.1.42:7777}, {@code [::1]:7777} → {@link Socket}</li>
 * </ul>
 */
public sealed interface DeviceEndpoint permits DeviceEndpoint.Serial, DeviceEndpoint.Socket
{
    /** Baud rate agreed with the display firmware. */
    int DISPLAY_BAUD = 921_600;

    /** TCP port the display firmware listens on. */
    int DEFAULT_TCP_PORT = 7777;

    Pattern WINDOWS_COM = Pattern.compile("(?i)^COM\\d+$");

    static DeviceEndpoint parse(String host) {
        return parse(host, DISPLAY_BAUD);
    }

    static DeviceEndpoint parse(String host, int serialBaud) {
        Objects.requireNonNull(host, "host");
        String h = host.trim();
        if (h.isEmpty()) {
            throw new IllegalArgumentException("host must not be blank");
        }

        if (h.startsWith("/dev/")
                || h.toLowerCase(Locale.ROOT).startsWith("tty")
                || WINDOWS_COM.matcher(h).matches()) {
            return new Serial(h, serialBaud);
        }

        // [v6-literal]:port
        if (h.startsWith("[")) {
            int close = h.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("Unterminated IPv6 literal: " + host);
            }
            String addr = h.substring(1, close);
            String rest = h.substring(close + 1);
            if (rest.isEmpty()) {
                return new Socket(addr, DEFAULT_TCP_PORT);
            }
            if (!rest.startsWith(":")) {
                throw new IllegalArgumentException("Invalid host: " + host);
            }
            return new Socket(addr, parsePort(rest.substring(1), host));
        }

        int colon = h.lastIndexOf(':');
        if (colon > 0 && h.indexOf(':') == colon) {
            return new Socket(h.substring(0, colon), parsePort(h.substring(colon + 1), host));
        }
        return new Socket(h, DEFAULT_TCP_PORT);
    }

    private static int parsePort(String text, String host) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in host: " + host, e);
        }
    }

    /**
     * Point-to-point serial link.
     */
    record Serial(String portName, int baudRate) implements DeviceEndpoint {
        public Serial {
            Objects.requireNonNull(portName, "portName");
            if (baudRate <= 0) {
                throw new IllegalArgumentException("baudRate must be positive");
            }
        }
    }

    /**
     * TCP stream to the device's socket server.
     */
    record Socket(String host, int port) implements DeviceEndpoint {
        public Socket {
            Objects.requireNonNull(host, "host");
            if (host.isBlank()) {
                throw new IllegalArgumentException("host must not be blank");
            }
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port must be 1-65535");
            }
        }
    }
}
