package net.spookly.hyping.server;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically logs a one-line metrics summary for operators.
 */
public final class QueryMetricsReporter implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(QueryMetricsReporter.class.getName());

    private final QueryMetrics metrics;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledTask;
    private QueryMetricsSnapshot lastReported;

    public QueryMetricsReporter(QueryMetrics metrics, int intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Start periodic reports. An interval of 0 disables reporting.
     */
    public synchronized void start() {
        if (stopped.get() || scheduledTask != null || intervalSeconds <= 0) {
            return;
        }
        scheduledTask = scheduler.scheduleAtFixedRate(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Stop reporting and log one final summary.
     */
    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        scheduler.shutdownNow();
        LOGGER.log(Level.INFO, "Query metrics (final): " + metrics.snapshot().summary());
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Log the current snapshot unless nothing changed since the last report.
     *
     * @return the logged snapshot, or null when it was skipped
     */
    QueryMetricsSnapshot runOnce() {
        QueryMetricsSnapshot snapshot = metrics.snapshot();
        if (snapshot.equals(lastReported)) {
            return null;
        }
        lastReported = snapshot;
        LOGGER.log(Level.INFO, "Query metrics: " + snapshot.summary());
        return snapshot;
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "hyping-metrics-reporter");
            thread.setDaemon(true);
            return thread;
        };
    }
}
