package net.spookly.hyping.server;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import net.spookly.hyping.config.ConfigDefaults;
import net.spookly.hyping.config.HypingConfig;
import net.spookly.hyping.protocol.QueryTransportException;
import net.spookly.hyping.status.StatusSource;
import net.spookly.hyping.util.ListenAddress;

/**
 * UDP listener that answers status queries from the live status source.
 * <p>
 * The protocol is stateless: nothing is kept per peer apart from the optional rate limiter
 * buckets. Request handling fans out to a bounded worker pool.
 */
public final class QueryServer implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(QueryServer.class.getName());
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 2L;

    private final InetSocketAddress bindAddress;
    private final StatusSource statusSource;
    private final int workers;
    private final int queueCapacity;
    private final int sendTimeoutMs;
    private final QueryRateLimiter rateLimiter;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private EventLoopGroup ioGroup;
    private ThreadPoolExecutor workerPool;
    private QueryServerHandler handler;
    private volatile Channel channel;

    public QueryServer(InetSocketAddress bindAddress, StatusSource statusSource) {
        this(bindAddress, statusSource, null);
    }

    /**
     * Create a responder with optional tuning from the {@code query} config section.
     */
    public QueryServer(InetSocketAddress bindAddress, StatusSource statusSource, HypingConfig.QueryConfig settings) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.statusSource = Objects.requireNonNull(statusSource, "statusSource");
        this.workers = settings == null || settings.workers == null
                ? ConfigDefaults.defaultWorkers()
                : settings.workers;
        this.queueCapacity = settings == null || settings.queueCapacity == null
                ? ConfigDefaults.DEFAULT_QUEUE_CAPACITY
                : settings.queueCapacity;
        this.sendTimeoutMs = settings == null || settings.sendTimeoutMs == null
                ? ConfigDefaults.DEFAULT_SEND_TIMEOUT_MS
                : settings.sendTimeoutMs;
        this.rateLimiter = settings == null ? null : QueryRateLimiter.fromConfig(settings.rateLimit);
    }

    public static QueryServer fromConfig(HypingConfig config, StatusSource statusSource) {
        Objects.requireNonNull(config, "config");
        InetSocketAddress address = ListenAddress.parse(config.query.listen).toSocketAddress();
        return new QueryServer(address, statusSource, config.query);
    }

    /**
     * Bind the listener and return the bound address. Calling it again returns the same address.
     */
    public InetSocketAddress start(QueryMetrics metrics) throws QueryTransportException {
        InetSocketAddress bound = bindUnlessStopped(metrics);
        if (bound == null) {
            throw new IllegalStateException("Query server already stopped");
        }
        return bound;
    }

    /**
     * Serve queries until {@link #stop()} is called or the current thread is interrupted. Returns
     * immediately when the server was already stopped.
     *
     * @throws QueryTransportException when binding fails or the socket dies on its own
     */
    public void run(QueryMetrics metrics) throws QueryTransportException {
        if (bindUnlessStopped(metrics) == null) {
            return;
        }
        Channel active = channel;
        try {
            active.closeFuture().await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            return;
        }
        if (stopping.get()) {
            return;
        }
        Throwable cause = handler == null ? null : handler.lastTransportError();
        stop();
        throw new QueryTransportException("Query listener closed unexpectedly", cause);
    }

    private synchronized InetSocketAddress bindUnlessStopped(QueryMetrics metrics) throws QueryTransportException {
        Objects.requireNonNull(metrics, "metrics");
        if (stopping.get()) {
            return null;
        }
        if (channel != null) {
            return localAddress();
        }
        workerPool = new ThreadPoolExecutor(
                workers,
                workers,
                30L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                workerThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy()
        );
        workerPool.allowCoreThreadTimeOut(true);
        handler = new QueryServerHandler(statusSource, metrics, new ResponseCache(), rateLimiter, workerPool, sendTimeoutMs);
        ioGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("hyping-query-io", true));

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(ioGroup)
                .channel(NioDatagramChannel.class)
                .handler(handler);

        ChannelFuture bindFuture = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bindFuture.isSuccess()) {
            releaseResources();
            throw new QueryTransportException("Failed to bind query listener on " + bindAddress, bindFuture.cause());
        }
        channel = bindFuture.channel();
        InetSocketAddress bound = localAddress();
        LOGGER.log(Level.INFO, "Query listener bound on " + bound.getHostString() + ":" + bound.getPort()
                + " (workers=" + workers + ", queue=" + queueCapacity
                + ", rateLimit=" + (rateLimiter == null ? "off" : "on") + ")");
        return bound;
    }

    /**
     * Address the listener is bound to, or null before {@link #start(QueryMetrics)}.
     */
    public InetSocketAddress localAddress() {
        Channel active = channel;
        return active == null ? null : (InetSocketAddress) active.localAddress();
    }

    Channel channel() {
        return channel;
    }

    public boolean isRunning() {
        Channel active = channel;
        return active != null && active.isActive();
    }

    /**
     * Close the listener. Queued requests are abandoned rather than drained.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            Channel active = channel;
            if (active != null) {
                active.close().awaitUninterruptibly(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
            releaseResources();
        }
        LOGGER.log(Level.INFO, "Query listener stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void releaseResources() {
        if (workerPool != null) {
            workerPool.shutdownNow();
            workerPool = null;
        }
        if (ioGroup != null) {
            ioGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            ioGroup = null;
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "hyping-query-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
