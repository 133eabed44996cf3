package net.spookly.hyping.client;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.ScheduledFuture;
import net.spookly.hyping.protocol.QueryCodec;
import net.spookly.hyping.protocol.QueryException;
import net.spookly.hyping.protocol.QueryTimeoutException;
import net.spookly.hyping.protocol.QueryTransportException;

/**
 * Sends status queries to one server and measures the round trip.
 * <p>
 * Every call binds its own ephemeral socket, so calls may run concurrently without seeing each
 * other's replies. No retries are attempted.
 */
public final class QueryClient implements AutoCloseable {
    private final InetSocketAddress serverAddress;
    private final EventLoopGroup workerGroup;
    private final boolean ownsWorkerGroup;

    public QueryClient(InetSocketAddress serverAddress) {
        this(serverAddress, new NioEventLoopGroup(1, new DefaultThreadFactory("hyping-query-client", true)), true);
    }

    /**
     * Create a client on a shared event loop group. The group is not shut down by {@link #close()}.
     */
    public QueryClient(InetSocketAddress serverAddress, EventLoopGroup workerGroup) {
        this(serverAddress, workerGroup, false);
    }

    private QueryClient(InetSocketAddress serverAddress, EventLoopGroup workerGroup, boolean ownsWorkerGroup) {
        this.serverAddress = Objects.requireNonNull(serverAddress, "serverAddress");
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
        this.ownsWorkerGroup = ownsWorkerGroup;
    }

    public InetSocketAddress serverAddress() {
        return serverAddress;
    }

    /**
     * Query the server, blocking for at most {@code timeout}.
     *
     * @throws QueryTimeoutException when no response arrived in time
     * @throws net.spookly.hyping.protocol.MalformedMessageException when the response did not decode
     * @throws QueryTransportException when the local socket could not be used
     */
    public QueryResult status(Duration timeout) throws QueryException {
        try {
            return statusAsync(timeout).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QueryException) {
                throw (QueryException) cause;
            }
            throw new QueryTransportException("Query to " + serverAddress + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryTransportException("Query to " + serverAddress + " interrupted", e);
        }
    }

    /**
     * Query the server without blocking. The future fails with a {@link QueryException}.
     */
    public CompletableFuture<QueryResult> statusAsync(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        long startNanos = System.nanoTime();
        CompletableFuture<QueryResult> result = new CompletableFuture<>();
        QueryClientHandler handler = new QueryClientHandler(serverAddress, result);
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(workerGroup)
                .channel(NioDatagramChannel.class)
                .handler(handler);

        ChannelFuture bindFuture;
        try {
            bindFuture = bootstrap.bind(0);
        } catch (RuntimeException e) {
            result.completeExceptionally(new QueryTransportException("Query client is closed", e));
            return result;
        }
        bindFuture.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(new QueryTransportException("Failed to bind query socket", future.cause()));
                return;
            }
            Channel channel = future.channel();
            long remainingNanos = Math.max(0L, timeout.toNanos() - (System.nanoTime() - startNanos));
            ScheduledFuture<?> timer = channel.eventLoop().schedule(
                    () -> result.completeExceptionally(new QueryTimeoutException(timeout)),
                    remainingNanos,
                    TimeUnit.NANOSECONDS
            );
            result.whenComplete((ignored, error) -> {
                timer.cancel(false);
                channel.close();
            });
            handler.markSent(System.nanoTime());
            channel.writeAndFlush(new DatagramPacket(Unpooled.wrappedBuffer(QueryCodec.encodeRequest()), serverAddress))
                    .addListener(write -> {
                        if (!write.isSuccess()) {
                            result.completeExceptionally(new QueryTransportException(
                                    "Failed to send query to " + serverAddress, write.cause()));
                        }
                    });
        });
        return result;
    }

    @Override
    public void close() {
        if (ownsWorkerGroup) {
            workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }
}
