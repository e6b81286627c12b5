package com.questrail.callwatch.protocol.ami.transport.tcp.netty;

import com.questrail.callwatch.protocol.ami.transport.StreamEndpoint;
import com.questrail.callwatch.protocol.ami.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Frame or parse protocol blocks</li>
 *   <li>Retry connections</li>
 *   <li>Schedule keep-alives or timeouts</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound chunks are copied into {@code byte[]} and emitted to the port
 * listener. All reference-counted buffers are released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * - Each {@link #connect} creates a fresh channel with its own handler.
 * - {@link #close()} retires that handler first, so no callback for the closed
 *   connection reaches the listener afterwards.
 * - {@link #shutdown()} also shuts down the event loop group.
 *
 * All listener callbacks run on the single event loop thread.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamEndpoint.class);

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final Object lock = new Object();

    private volatile StreamEndpointListener listener;

    // Guarded by lock.
    private InboundHandler handler;
    private ChannelFuture pendingConnect;
    private Channel channel;
    private boolean shutdown;

    /**
     * Uses a dedicated single-threaded {@link NioEventLoopGroup}; that thread is
     * the session's read loop.
     */
    public NettyTcpStreamEndpoint()
    {
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("callwatch-ami-io", true));
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true);
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect(String host, int port, Duration timeout)
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timeout, "timeout");
        StreamEndpointListener l = requireListener();

        InboundHandler h = new InboundHandler(l);
        ChannelFuture f;
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("Endpoint has been shut down");
            }
            closeLocked();

            int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis()));
            f = bootstrap.clone()
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                    .handler(h)
                    .connect(host, port);
            handler = h;
            pendingConnect = f;
        }

        log.debug("Connecting to {}:{}", host, port);
        f.addListener((ChannelFutureListener) future -> onConnectComplete(h, future));
    }

    private void onConnectComplete(InboundHandler h, ChannelFuture future)
    {
        synchronized (lock) {
            if (handler != h) {
                // close() or a newer connect() superseded this attempt.
                if (future.isSuccess()) {
                    future.channel().close();
                }
                return;
            }
            pendingConnect = null;
            if (future.isSuccess()) {
                channel = future.channel();
            }
        }

        if (future.isSuccess()) {
            h.up();
        }
        else if (!future.isCancelled()) {
            h.down(future.cause());
        }
    }

    @Override
    public boolean send(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        Channel ch;
        synchronized (lock) {
            ch = channel;
        }
        if (ch == null || !ch.isActive()) {
            return false;
        }

        ch.writeAndFlush(Unpooled.wrappedBuffer(payload))
                .addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
        return true;
    }

    @Override
    public void close()
    {
        synchronized (lock) {
            closeLocked();
        }
    }

    @Override
    public void shutdown()
    {
        synchronized (lock) {
            shutdown = true;
            closeLocked();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private void closeLocked()
    {
        if (handler != null) {
            handler.retire();
            handler = null;
        }
        if (pendingConnect != null) {
            pendingConnect.cancel(false);
            pendingConnect = null;
        }
        if (channel != null) {
            channel.close();
            channel = null;
        }
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before connect()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * One instance per connection. Forwards raw bytes and at most one
     * down-notification to the port listener until retired.
     */
    private static final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final StreamEndpointListener listener;
        private volatile boolean retired;
        private volatile boolean reportedDown;
        private Throwable failure;

        InboundHandler(StreamEndpointListener listener)
        {
            this.listener = listener;
        }

        void retire()
        {
            retired = true;
        }

        void up()
        {
            if (!retired) {
                listener.onTransportUp();
            }
        }

        void down(Throwable cause)
        {
            if (retired || reportedDown) {
                return;
            }
            reportedDown = true;
            listener.onTransportDown(cause);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            if (retired) {
                return;
            }

            // Copy into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            listener.onBytes(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            down(failure);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("Connection error on {}", ctx.channel(), cause);
            failure = cause;
            ctx.close();
        }
    }
}
