package com.questrail.facelink.protocol.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * LineFramer
 * -----------------------------------------------------------------------------
 * Splits an ordered byte stream into newline-terminated text lines.
 *
 * <p>Unlike a datagram decoder, the framer is stateful: bytes that do not yet
 * end in {@code '\n'} are carried over to the next {@link #feed(byte[])}. The
 * sequence of lines produced is therefore independent of how the stream was
 * chunked by the transport.</p>
 *
 * <p>Each segment is decoded as UTF-8 with malformed sequences replaced, then
 * trimmed; blank lines are skipped. Decoding never throws: the device prints
 * its boot log on the same stream and that must not abort reading.</p>
 *
 * <p>Not thread-safe. The owning session serializes access.</p>
 */
public final class LineFramer
{
    private static final int INITIAL_CAPACITY = 4096;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;
    // bytes before this index are known to contain no newline
    private int scanFrom;

    /**
     * Append raw bytes received from the transport.
     */
    public void feed(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            return;
        }
        ensureCapacity(length + bytes.length);
        System.arraycopy(bytes, 0, buffer, length, bytes.length);
        length += bytes.length;
    }

    /**
     * Extract the next complete, non-blank line.
     *
     * @return the trimmed line, or empty if no complete line is buffered
     */
    public Optional<String> nextLine() {
        while (true) {
            int newline = indexOfNewline();
            if (newline < 0) {
                return Optional.empty();
            }

            String text = new String(buffer, 0, newline, StandardCharsets.UTF_8).trim();
            consume(newline + 1);

            if (!text.isEmpty()) {
                return Optional.of(text);
            }
        }
    }

    /**
     * Number of bytes currently buffered (complete lines plus the partial tail).
     */
    public int buffered() {
        return length;
    }

    /**
     * Discard everything buffered, including any partial line.
     *
     * @return number of bytes discarded
     */
    public int reset() {
        int discarded = length;
        length = 0;
        scanFrom = 0;
        if (buffer.length > INITIAL_CAPACITY) {
            buffer = new byte[INITIAL_CAPACITY];
        }
        return discarded;
    }

    private int indexOfNewline() {
        for (int i = scanFrom; i < length; i++) {
            if (buffer[i] == '\n') {
                return i;
            }
        }
        scanFrom = length;
        return -1;
    }

    private void consume(int count) {
        int remaining = length - count;
        System.arraycopy(buffer, count, buffer, 0, remaining);
        length = remaining;
        scanFrom = 0;
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
