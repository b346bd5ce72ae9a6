package com.questrail.facelink.transport;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * ScriptedTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link ByteTransport}.
 *
 * <p>Records every write. Inbound bytes come from two places: chunks injected
 * directly with {@link #inject(String)}, and replies queued with
 * {@link #replyOnWrite(String...)}, which are released one batch per write so
 * that a response can never be read before its command was sent.</p>
 *
 * <p>Each {@link #readAvailable()} hands out at most one chunk, so tests can
 * control how the stream is split.</p>
 */
public final class ScriptedTransport implements ByteTransport {

    private final Deque<byte[]> inbound = new ArrayDeque<>();
    private final Deque<List<byte[]>> replies = new ArrayDeque<>();
    private final List<byte[]> writes = new ArrayList<>();
    private RuntimeException writeFailure;
    private boolean peerClosed;
    private boolean closed;
    private int reads;

    // ---------------------------------------------------------------------
    // ByteTransport
    // ---------------------------------------------------------------------

    @Override
    public synchronized void write(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (closed) {
            throw new TransportClosedException("closed");
        }
        if (writeFailure != null) {
            throw writeFailure;
        }
        writes.add(bytes.clone());
        List<byte[]> batch = replies.pollFirst();
        if (batch != null) {
            inbound.addAll(batch);
        }
    }

    @Override
    public synchronized byte[] readAvailable() {
        reads++;
        byte[] next = inbound.pollFirst();
        if (next != null) {
            return next;
        }
        if (peerClosed || closed) {
            throw new TransportClosedException("peer closed");
        }
        return new byte[0];
    }

    @Override
    public String describe() {
        return "scripted://test";
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized ScriptedTransport inject(String text) {
        return inject(text.getBytes(StandardCharsets.UTF_8));
    }

    public synchronized ScriptedTransport inject(byte[] chunk) {
        inbound.addLast(chunk.clone());
        return this;
    }

    /**
     * Queue the inbound chunks to release on the next unanswered write.
     */
    public synchronized ScriptedTransport replyOnWrite(String... chunks) {
        List<byte[]> batch = new ArrayList<>();
        for (String c : chunks) {
            batch.add(c.getBytes(StandardCharsets.UTF_8));
        }
        replies.addLast(batch);
        return this;
    }

    /** Queue a write that releases nothing. */
    public synchronized ScriptedTransport silentOnWrite() {
        replies.addLast(Collections.emptyList());
        return this;
    }

    public synchronized void failWritesWith(RuntimeException failure) {
        this.writeFailure = failure;
    }

    /** After the buffered chunks are read, report the peer as gone. */
    public synchronized void closeFromPeer() {
        peerClosed = true;
    }

    public synchronized List<byte[]> writes() {
        return new ArrayList<>(writes);
    }

    public synchronized List<String> writtenLines() {
        List<String> lines = new ArrayList<>();
        for (byte[] w : writes) {
            lines.add(new String(w, StandardCharsets.UTF_8));
        }
        return lines;
    }

    public synchronized byte[] allWrittenBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] w : writes) {
            out.writeBytes(w);
        }
        return out.toByteArray();
    }

    public synchronized int reads() {
        return reads;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
