package com.questrail.facelink.transport;

/**
 * ByteTransport
 * -----------------------------------------------------------------------------
 * Minimal port for an ordered, reliable byte stream to the device.
 *
 * <p>The port is intentionally small. Everything above it (line framing,
 * classification, response matching, image handshake) lives in the session;
 * implementations perform raw I/O only and never interpret bytes.</p>
 *
 * <p>Implementations may be backed by a serial port, a Netty socket channel, or
 * a test double.</p>
 */
public interface ByteTransport extends AutoCloseable
{
    /**
     * Write the whole buffer.
     *
     * <p>A single call is atomic with respect to other {@code write} calls on the
     * same transport: bytes of two concurrent writes never interleave.</p>
     *
     * @throws TransportException if the bytes could not be written
     */
    void write(byte[] bytes);

    /**
     * Return whatever bytes have arrived since the previous call.
     *
     * <p>Must return promptly; an empty array means "nothing yet".</p>
     *
     * @throws TransportClosedException once the stream has ended and every
     *         received byte has been handed out
     * @throws TransportException on any other read failure
     */
    byte[] readAvailable();

    /**
     * Human-readable description of the remote end, for logs.
     */
    String describe();

    /**
     * Release the underlying resource. Idempotent.
     */
    @Override
    void close();
}
