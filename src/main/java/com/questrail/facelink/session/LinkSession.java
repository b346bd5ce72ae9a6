package com.questrail.facelink.session;

import com.questrail.facelink.api.DeviceLink;
import com.questrail.facelink.api.FireAndForgetChannel;
import com.questrail.facelink.internal.time.MonotonicClock;
import com.questrail.facelink.internal.time.Sleeper;
import com.questrail.facelink.internal.time.SystemMonotonicClock;
import com.questrail.facelink.internal.time.SystemSleeper;
import com.questrail.facelink.internal.time.SystemWallClock;
import com.questrail.facelink.internal.time.WallClock;
import com.questrail.facelink.observability.LinkObservabilitySink;
import com.questrail.facelink.observability.LinkProtocolEvent;
import com.questrail.facelink.observability.NullObservabilitySink;
import com.questrail.facelink.protocol.codec.JsonLineCodec;
import com.questrail.facelink.protocol.codec.LineFramer;
import com.questrail.facelink.protocol.model.DeviceCommand;
import com.questrail.facelink.protocol.model.DeviceEvent;
import com.questrail.facelink.protocol.model.DeviceResponse;
import com.questrail.facelink.protocol.model.LinkMessage;
import com.questrail.facelink.protocol.model.MalformedLine;
import com.questrail.facelink.transport.ByteTransport;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * LinkSession
 * =============================================================================
 * {@link DeviceLink} over a {@link ByteTransport}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   ByteTransport.readAvailable()
 *        → LineFramer (carry-over of partial lines)
 *            → JsonLineCodec.classify
 *                → DeviceEvent     : appended to the event queue
 *                → DeviceResponse  : returned to the waiting command (or dropped as stale)
 *                → MalformedLine   : dropped
 * </pre>
 *
 * <h2>Stale status lines</h2>
 * The firmware acknowledges every line it receives, including mouth frames sent
 * on the fire-and-forget channel. Those acknowledgements have no waiter. Before
 * a command is written, whatever the device has already sent is pumped: events
 * are queued and status lines are dropped as stale, so they cannot be taken as
 * the reply to the new command.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>The <b>command token</b> ({@code commandToken}) is held for every
 *       response-awaiting exchange and for all reads of the transport and the
 *       framer. First status line wins, which is only correct because of it.</li>
 *   <li>The <b>write lock</b> ({@code writeLock}) makes every line, and the
 *       image payload, a single write. The fire-and-forget channel takes only
 *       this lock.</li>
 *   <li>The event queue has its own lock so that {@link #collectEvents()} can
 *       drain it while another thread holds the command token.</li>
 * </ul>
 */
public final class LinkSession implements DeviceLink
{
    private static final int MAX_PENDING_READS = 64;

    private final ByteTransport transport;
    private final LinkTimingPolicy timing;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final WallClock wallClock;
    private final LinkObservabilitySink observabilitySink;

    private final JsonLineCodec codec = new JsonLineCodec();
    private final LineFramer framer = new LineFramer();
    private final ReentrantLock commandToken = new ReentrantLock();
    private final Object writeLock = new Object();
    private final Object eventLock = new Object();
    private final ArrayDeque<DeviceEvent> events = new ArrayDeque<>();

    private final ImageTransfer imageTransfer;
    private final FireAndForgetChannel fireAndForget;

    public LinkSession(ByteTransport transport, LinkTimingPolicy timing, LinkObservabilitySink observabilitySink)
    {
        this(transport, timing, SystemMonotonicClock.INSTANCE, SystemSleeper.INSTANCE,
                SystemWallClock.INSTANCE, observabilitySink);
    }

    public LinkSession(ByteTransport transport,
                       LinkTimingPolicy timing,
                       MonotonicClock clock,
                       Sleeper sleeper,
                       WallClock wallClock,
                       LinkObservabilitySink observabilitySink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.imageTransfer = new ImageTransfer(this, timing);
        this.fireAndForget = command -> writeRaw(codec.encode(Objects.requireNonNull(command, "command")));
    }

    // -------------------------------------------------------------------------
    // DeviceLink
    // -------------------------------------------------------------------------

    @Override
    public DeviceResponse sendCommand(DeviceCommand command) {
        return sendCommand(command, timing.responseTimeout());
    }

    @Override
    public DeviceResponse sendCommand(DeviceCommand command, Duration timeout) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");

        if (!acquireToken(timeout)) {
            return timedOut(command.name(), timeout);
        }
        try {
            return exchange(command, timeout);
        } finally {
            commandToken.unlock();
        }
    }

    @Override
    public DeviceResponse sendBinaryPayload(byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        Duration budget = timing.imageReadyTimeout().plus(timing.imageCompleteTimeout());
        if (!acquireToken(budget)) {
            return timedOut(DeviceCommand.IMAGE, budget);
        }
        try {
            return imageTransfer.transfer(payload);
        } finally {
            commandToken.unlock();
        }
    }

    @Override
    public List<DeviceEvent> collectEvents() {
        // A command in progress is already pumping the transport; just swap the queue.
        if (commandToken.tryLock()) {
            try {
                pumpAvailable();
            } finally {
                commandToken.unlock();
            }
        }

        synchronized (eventLock) {
            List<DeviceEvent> drained = List.copyOf(events);
            events.clear();
            return drained;
        }
    }

    @Override
    public void drainBoot(Duration wait) {
        Objects.requireNonNull(wait, "wait");
        try {
            sleeper.sleepNanos(wait.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        commandToken.lock();
        try {
            int discarded = transport.readAvailable().length + framer.reset();
            observabilitySink.onProtocolEvent(
                    new LinkProtocolEvent.BootOutputDiscarded(wallClock.now(), discarded));
        } finally {
            commandToken.unlock();
        }
    }

    @Override
    public FireAndForgetChannel fireAndForget() {
        return fireAndForget;
    }

    @Override
    public void close() {
        transport.close();
    }

    /**
     * Consume the status line a socket device sends as soon as it accepts a connection.
     *
     * @return the greeting, or the timeout sentinel
     */
    public DeviceResponse awaitGreeting(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (!acquireToken(timeout)) {
            return timedOut("greeting", timeout);
        }
        try {
            return awaitResponse("greeting", timeout);
        } finally {
            commandToken.unlock();
        }
    }

    public String describe() {
        return transport.describe();
    }

    // -------------------------------------------------------------------------
    // Exchange primitives (command token must be held)
    // -------------------------------------------------------------------------

    DeviceResponse exchange(DeviceCommand command, Duration timeout) {
        return exchange(command, timeout, response -> true);
    }

    /**
     * Write {@code command} and wait for the first status line {@code accept} admits.
     */
    DeviceResponse exchange(DeviceCommand command, Duration timeout, Predicate<DeviceResponse> accept) {
        requireToken();
        discardPending();
        writeRaw(codec.encode(command));
        return awaitResponse(command.name(), timeout, accept);
    }

    /**
     * Wait for the first status line. Events seen on the way are queued; lines
     * after the status line stay buffered in the framer.
     */
    DeviceResponse awaitResponse(String label, Duration timeout) {
        return awaitResponse(label, timeout, response -> true);
    }

    /**
     * As {@link #awaitResponse(String, Duration)}, but status lines rejected by
     * {@code accept} are dropped as stale and the wait goes on.
     */
    DeviceResponse awaitResponse(String label, Duration timeout, Predicate<DeviceResponse> accept) {
        requireToken();

        long deadline = clock.deadlineAfter(timeout);
        long pollNanos = Math.max(1, timing.pollInterval().toNanos());

        while (true) {
            Optional<DeviceResponse> response = nextBufferedResponse(accept);
            if (response.isPresent()) {
                return response.get();
            }

            byte[] bytes = transport.readAvailable();
            if (bytes.length > 0) {
                framer.feed(bytes);
                response = nextBufferedResponse(accept);
                if (response.isPresent()) {
                    return response.get();
                }
            }

            long remaining = deadline - clock.nowNanos();
            if (remaining <= 0) {
                break;
            }
            if (bytes.length == 0) {
                try {
                    sleeper.sleepNanos(Math.min(remaining, pollNanos));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        return timedOut(label, timeout);
    }

    void writeRaw(byte[] bytes) {
        synchronized (writeLock) {
            transport.write(bytes);
        }
    }

    LinkObservabilitySink observabilitySink() {
        return observabilitySink;
    }

    WallClock wallClock() {
        return wallClock;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private Optional<DeviceResponse> nextBufferedResponse(Predicate<DeviceResponse> accept) {
        Optional<String> line;
        while ((line = framer.nextLine()).isPresent()) {
            LinkMessage message = codec.classify(line.get());
            if (message instanceof DeviceResponse response) {
                if (accept.test(response)) {
                    return Optional.of(response);
                }
                dropStale(response);
            } else {
                handleUnsolicited(message);
            }
        }
        return Optional.empty();
    }

    /**
     * Read until the transport has nothing more, bounded by {@link #MAX_PENDING_READS},
     * then classify everything complete in the framer.
     */
    private void discardPending() {
        byte[] bytes;
        int reads = 0;
        while (reads++ < MAX_PENDING_READS && (bytes = transport.readAvailable()).length > 0) {
            framer.feed(bytes);
        }
        drainFramer();
    }

    private void pumpAvailable() {
        framer.feed(transport.readAvailable());
        drainFramer();
    }

    private void drainFramer() {
        Optional<String> line;
        while ((line = framer.nextLine()).isPresent()) {
            LinkMessage message = codec.classify(line.get());
            if (message instanceof DeviceResponse stale) {
                dropStale(stale);
            } else {
                handleUnsolicited(message);
            }
        }
    }

    private void dropStale(DeviceResponse stale) {
        observabilitySink.onProtocolEvent(new LinkProtocolEvent.StaleResponseDropped(wallClock.now(), stale));
    }

    private void handleUnsolicited(LinkMessage message) {
        if (message instanceof DeviceEvent event) {
            enqueue(event);
        } else if (message instanceof MalformedLine malformed) {
            observabilitySink.onProtocolEvent(new LinkProtocolEvent.MalformedLineDropped(
                    wallClock.now(), malformed.text(), malformed.reason()));
        }
    }

    private void enqueue(DeviceEvent event) {
        DeviceEvent evicted = null;
        synchronized (eventLock) {
            if (events.size() >= timing.maxQueuedEvents()) {
                evicted = events.pollFirst();
            }
            events.addLast(event);
        }
        if (evicted != null) {
            observabilitySink.onProtocolEvent(new LinkProtocolEvent.EventDropped(wallClock.now(), evicted));
        }
    }

    private boolean acquireToken(Duration timeout) {
        try {
            return commandToken.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void requireToken() {
        if (!commandToken.isHeldByCurrentThread()) {
            throw new IllegalStateException("command token not held");
        }
    }

    private DeviceResponse timedOut(String label, Duration timeout) {
        observabilitySink.onProtocolEvent(new LinkProtocolEvent.ResponseTimeout(wallClock.now(), label, timeout));
        return DeviceResponse.timeout();
    }
}
