package com.questrail.facelink.transport.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.questrail.facelink.internal.time.SystemWallClock;
import com.questrail.facelink.observability.LinkObservabilitySink;
import com.questrail.facelink.observability.LinkTransportEvent;
import com.questrail.facelink.observability.NullObservabilitySink;
import com.questrail.facelink.transport.ByteTransport;
import com.questrail.facelink.transport.TransportClosedException;
import com.questrail.facelink.transport.TransportException;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * SerialPortTransport
 * =============================================================================
 * jSerialComm-backed {@link ByteTransport} for a point-to-point serial link
 * (the display's CH340 bridge, or the servo board).
 *
 * <p>Reads are non-blocking: {@link #readAvailable()} returns exactly the bytes
 * the driver has buffered. Writes block until the whole buffer is handed to the
 * driver or the write timeout expires.</p>
 *
 * <p>The device prints a boot log when the port is opened (the CH340 toggles
 * reset). This class does not filter it; the session discards it with a boot
 * drain.</p>
 */
public final class SerialPortTransport implements ByteTransport
{
    private static final byte[] EMPTY = new byte[0];
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(2);

    private final SerialPort port;
    private final String portName;
    private final int baudRate;
    private final LinkObservabilitySink observabilitySink;
    private final Object writeLock = new Object();

    private volatile boolean closed;

    private SerialPortTransport(SerialPort port, String portName, int baudRate, LinkObservabilitySink observabilitySink) {
        this.port = port;
        this.portName = portName;
        this.baudRate = baudRate;
        this.observabilitySink = observabilitySink;
    }

    /**
     * Open the named port (e.g. {@code /dev/ttyUSB0} or {@code COM6}) at 8N1.
     *
     * @throws TransportException if the port cannot be opened
     */
    public static SerialPortTransport open(String portName, int baudRate, LinkObservabilitySink observabilitySink) {
        return open(portName, baudRate, DEFAULT_WRITE_TIMEOUT, observabilitySink);
    }

    /**
     * Open the named port with writes bounded by {@code writeTimeout}.
     */
    public static SerialPortTransport open(String portName,
                                           int baudRate,
                                           Duration writeTimeout,
                                           LinkObservabilitySink observabilitySink)
    {
        Objects.requireNonNull(portName, "portName");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        int writeTimeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1, writeTimeout.toMillis()));
        LinkObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        final SerialPort port;
        try {
            port = SerialPort.getCommPort(portName);
        } catch (RuntimeException e) {
            throw new TransportException("Unknown serial port " + portName, e);
        }

        port.setComPortParameters(baudRate, 8, SerialPort.ONE_STOP_BIT, SerialPort.NO_PARITY);
        port.setComPortTimeouts(SerialPort.TIMEOUT_NONBLOCKING | SerialPort.TIMEOUT_WRITE_BLOCKING, 0, writeTimeoutMs);

        if (!port.openPort()) {
            throw new TransportException("Failed to open serial port " + portName + " at " + baudRate + " baud");
        }

        SerialPortTransport transport = new SerialPortTransport(port, portName, baudRate, sink);
        sink.onTransportEvent(new LinkTransportEvent.Opened(SystemWallClock.INSTANCE.now(), transport.describe()));
        return transport;
    }

    @Override
    public void write(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        ensureOpen();

        synchronized (writeLock) {
            int offset = 0;
            while (offset < bytes.length) {
                byte[] chunk = offset == 0 ? bytes : Arrays.copyOfRange(bytes, offset, bytes.length);
                int written = port.writeBytes(chunk, chunk.length);
                if (written <= 0) {
                    throw new TransportException("Write to " + describe() + " failed after " + offset + " bytes");
                }
                offset += written;
            }
        }
    }

    @Override
    public byte[] readAvailable() {
        ensureOpen();

        int available = port.bytesAvailable();
        if (available < 0) {
            throw new TransportClosedException("Serial port " + portName + " is no longer available");
        }
        if (available == 0) {
            return EMPTY;
        }

        byte[] buf = new byte[available];
        int read = port.readBytes(buf, buf.length);
        if (read < 0) {
            throw new TransportClosedException("Serial port " + portName + " is no longer available");
        }
        return read == buf.length ? buf : Arrays.copyOf(buf, read);
    }

    @Override
    public String describe() {
        return "serial://" + portName + "@" + baudRate;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (port.isOpen()) {
            port.closePort();
        }
        observabilitySink.onTransportEvent(
                new LinkTransportEvent.Closed(SystemWallClock.INSTANCE.now(), describe(), null));
    }

    private void ensureOpen() {
        if (closed || !port.isOpen()) {
            throw new TransportClosedException("Serial port " + portName + " is closed");
        }
    }
}
