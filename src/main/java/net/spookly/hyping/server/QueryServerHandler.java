package net.spookly.hyping.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.PortUnreachableException;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import io.netty.util.concurrent.ScheduledFuture;
import net.spookly.hyping.protocol.MalformedMessageException;
import net.spookly.hyping.protocol.QueryCodec;
import net.spookly.hyping.status.StatusSource;

/**
 * Receives query datagrams and hands each one to an independent worker.
 * <p>
 * The I/O thread only counts, rate limits and copies the (bounded) frame. Decoding, reading the
 * status source, encoding and writing happen on the worker executor. Malformed input is never
 * answered.
 */
@ChannelHandler.Sharable
final class QueryServerHandler extends SimpleChannelInboundHandler<DatagramPacket> {
    private static final Logger LOGGER = Logger.getLogger(QueryServerHandler.class.getName());

    private final StatusSource statusSource;
    private final QueryMetrics metrics;
    private final ResponseCache responseCache;
    private final QueryRateLimiter rateLimiter;
    private final Executor workers;
    private final long sendTimeoutMs;
    private final AtomicReference<Throwable> lastTransportError = new AtomicReference<>();

    QueryServerHandler(StatusSource statusSource,
                       QueryMetrics metrics,
                       ResponseCache responseCache,
                       QueryRateLimiter rateLimiter,
                       Executor workers,
                       long sendTimeoutMs) {
        this.statusSource = Objects.requireNonNull(statusSource, "statusSource");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.responseCache = Objects.requireNonNull(responseCache, "responseCache");
        this.rateLimiter = rateLimiter;
        this.workers = Objects.requireNonNull(workers, "workers");
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
        metrics.recordReceived();
        InetSocketAddress sender = packet.sender();
        ByteBuf content = packet.content();
        if (content.readableBytes() > QueryCodec.MAX_REQUEST_SIZE) {
            metrics.recordInvalid();
            LOGGER.log(Level.FINE, "Dropping oversized datagram (" + content.readableBytes() + " bytes) from " + sender);
            return;
        }
        if (rateLimiter != null && sender != null && !rateLimiter.tryAcquire(sender.getAddress())) {
            metrics.recordRateLimited();
            LOGGER.log(Level.FINE, "Rate limited query from " + sender);
            return;
        }
        byte[] frame = ByteBufUtil.getBytes(content);
        long receivedAt = System.nanoTime();
        try {
            workers.execute(() -> handle(ctx, sender, frame, receivedAt));
        } catch (RejectedExecutionException e) {
            metrics.recordDropped();
            LOGGER.log(Level.FINE, "Worker queue full, dropping query from " + sender);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // Netty keeps a datagram channel open only for port-unreachable; any other read IOException closes it.
        if (cause instanceof PortUnreachableException) {
            LOGGER.log(Level.FINE, "Peer unreachable on query listener: " + cause.getMessage());
            return;
        }
        lastTransportError.set(cause);
        if (cause instanceof IOException) {
            LOGGER.log(Level.WARNING, "Query listener socket failed, closing: " + cause.getMessage());
            return;
        }
        LOGGER.log(Level.WARNING, "Query listener error", cause);
    }

    Throwable lastTransportError() {
        return lastTransportError.get();
    }

    void handle(ChannelHandlerContext ctx, InetSocketAddress sender, byte[] frame, long receivedAt) {
        try {
            QueryCodec.decodeRequest(frame);
        } catch (MalformedMessageException e) {
            metrics.recordInvalid();
            LOGGER.log(Level.FINE, "Dropping malformed query from " + sender + ": " + e.getMessage());
            return;
        }
        metrics.recordRequest();

        byte[] response;
        try {
            response = responseCache.responseFor(statusSource.current());
        } catch (RuntimeException e) {
            metrics.recordProcessingError();
            LOGGER.log(Level.WARNING, "Failed to encode status response for " + sender, e);
            return;
        }
        send(ctx, sender, response, receivedAt);
    }

    private void send(ChannelHandlerContext ctx, InetSocketAddress sender, byte[] response, long receivedAt) {
        ChannelFuture write = ctx.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(response), sender));
        AtomicBoolean timedOut = new AtomicBoolean(false);
        ScheduledFuture<?> timeout = null;
        if (sendTimeoutMs > 0 && !write.isDone()) {
            timeout = ctx.executor().schedule(() -> {
                if (!write.isDone()) {
                    timedOut.set(true);
                    write.cancel(false);
                }
            }, sendTimeoutMs, TimeUnit.MILLISECONDS);
        }
        ScheduledFuture<?> finalTimeout = timeout;
        write.addListener(future -> {
            if (finalTimeout != null) {
                finalTimeout.cancel(false);
            }
            if (future.isSuccess()) {
                metrics.recordSent(System.nanoTime() - receivedAt);
                return;
            }
            if (timedOut.get() || future.isCancelled()) {
                metrics.recordSendTimeout();
                LOGGER.log(Level.FINE, "Response to " + sender + " timed out after " + sendTimeoutMs + "ms");
                return;
            }
            metrics.recordSendFailure();
            LOGGER.log(Level.FINE, "Failed to send response to " + sender + ": " + future.cause());
        });
    }
}
