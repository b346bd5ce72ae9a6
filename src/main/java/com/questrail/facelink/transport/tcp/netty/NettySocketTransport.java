package com.questrail.facelink.transport.tcp.netty;

import com.questrail.facelink.internal.time.SystemWallClock;
import com.questrail.facelink.observability.LinkObservabilitySink;
import com.questrail.facelink.observability.LinkTransportEvent;
import com.questrail.facelink.observability.NullObservabilitySink;
import com.questrail.facelink.transport.ByteTransport;
import com.questrail.facelink.transport.TransportClosedException;
import com.questrail.facelink.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettySocketTransport
 * =============================================================================
 * Netty-backed implementation of the {@link ByteTransport} port over TCP.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not split
 * lines, parse JSON, wait for responses or retry anything.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound buffers are copied into a carry buffer on the
 * event loop and released there; {@link #readAvailable()} hands the copy out as
 * a plain {@code byte[]}.
 *
 * <h2>Socket options</h2>
 * {@code TCP_NODELAY} is on so that small command lines are not held back by
 * Nagle's algorithm; {@code SO_KEEPALIVE} is on so that a silently vanished
 * device is eventually reported as closed.
 *
 * <h2>Write deadline</h2>
 * Every write waits at most {@code writeTimeout} for the flush. A peer that
 * stops reading fills the socket buffers; on expiry the write is cancelled, the
 * connection is closed (a partial line cannot be recovered) and
 * {@link TransportException} is thrown.
 *
 * <h2>Close detection</h2>
 * When the channel goes inactive the transport is marked closed. Bytes that
 * arrived before the close are still returned; after that,
 * {@link #readAvailable()} throws {@link TransportClosedException}.
 */
public final class NettySocketTransport implements ByteTransport
{
    private static final byte[] EMPTY = new byte[0];

    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(2);

    private final String host;
    private final int port;
    private final Duration writeTimeout;
    private final LinkObservabilitySink observabilitySink;

    private final EventLoopGroup group;
    private final Object inboundLock = new Object();
    private final ByteArrayOutputStream inbound = new ByteArrayOutputStream();
    private final Object writeLock = new Object();
    private final AtomicBoolean closeReported = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Channel channel;
    private volatile boolean inactive;
    private volatile Throwable failure;

    private NettySocketTransport(String host, int port, Duration writeTimeout, LinkObservabilitySink observabilitySink) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
        if (writeTimeout.isNegative() || writeTimeout.isZero()) {
            throw new IllegalArgumentException("writeTimeout must be > 0");
        }
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.group = new NioEventLoopGroup(1);
    }

    /**
     * Connect to the device's socket server.
     *
     * <p>Blocks for at most {@code connectTimeout}.</p>
     *
     * @throws TransportException if the connection cannot be established
     */
    public static NettySocketTransport connect(String host,
                                               int port,
                                               Duration connectTimeout,
                                               LinkObservabilitySink observabilitySink)
    {
        return connect(host, port, connectTimeout, DEFAULT_WRITE_TIMEOUT, observabilitySink);
    }

    /**
     * Connect with writes bounded by {@code writeTimeout}.
     *
     * @throws TransportException if the connection cannot be established
     */
    public static NettySocketTransport connect(String host,
                                               int port,
                                               Duration connectTimeout,
                                               Duration writeTimeout,
                                               LinkObservabilitySink observabilitySink)
    {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        NettySocketTransport transport = new NettySocketTransport(host, port, writeTimeout, observabilitySink);
        transport.open(connectTimeout);
        return transport;
    }

    private void open(Duration connectTimeout) {
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port);
        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new TransportException("Failed to connect to " + describe(), f.cause());
        }

        channel = f.channel();
        observabilitySink.onTransportEvent(
                new LinkTransportEvent.Opened(SystemWallClock.INSTANCE.now(), describe()));
    }

    @Override
    public void write(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");

        Channel ch = channel;
        if (ch == null || inactive || !ch.isActive()) {
            throw new TransportClosedException("Connection to " + describe() + " is closed", failure);
        }
        if (bytes.length == 0) {
            return;
        }

        // The caller owns the array; wait for the flush so it is not reused under Netty.
        synchronized (writeLock) {
            ChannelFuture f = ch.writeAndFlush(Unpooled.wrappedBuffer(bytes));
            if (!f.awaitUninterruptibly(writeTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                f.cancel(false);
                TransportException timeout = new TransportException(
                        "Write of " + bytes.length + " bytes to " + describe()
                                + " not flushed within " + writeTimeout.toMillis() + " ms");
                markInactive(timeout);
                ch.close();
                throw timeout;
            }
            if (!f.isSuccess()) {
                throw new TransportException("Write to " + describe() + " failed", f.cause());
            }
        }
    }

    @Override
    public byte[] readAvailable() {
        // Snapshot first: once inactive is observed, every received byte is already buffered.
        boolean wasInactive = inactive;

        synchronized (inboundLock) {
            if (inbound.size() > 0) {
                byte[] out = inbound.toByteArray();
                inbound.reset();
                return out;
            }
        }

        if (wasInactive) {
            throw new TransportClosedException("Connection closed by " + describe(), failure);
        }
        return EMPTY;
    }

    @Override
    public String describe() {
        return "tcp://" + host + ":" + port;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    private void markInactive(Throwable cause) {
        if (cause != null && failure == null) {
            failure = cause;
        }
        inactive = true;

        if (closeReported.compareAndSet(false, true)) {
            observabilitySink.onTransportEvent(
                    new LinkTransportEvent.Closed(SystemWallClock.INSTANCE.now(), describe(), cause));
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies received bytes into the carry buffer and tracks channel liveness.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);

            synchronized (inboundLock) {
                inbound.write(bytes, 0, bytes.length);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            markInactive(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            markInactive(cause);
            ctx.close();
        }
    }
}
