package net.spookly.hyping.server;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic counters shared by every responder worker.
 * <p>
 * Each counter is updated atomically; {@link #snapshot()} copies them without locking.
 */
public final class QueryMetrics {
    /**
     * Datagrams read from the socket, valid or not.
     */
    private final AtomicLong receivedPackets = new AtomicLong();
    /**
     * Datagrams that decoded into a request.
     */
    private final AtomicLong requests = new AtomicLong();
    /**
     * Datagrams rejected by the codec.
     */
    private final AtomicLong invalidPackets = new AtomicLong();
    /**
     * Requests discarded because the worker queue was full.
     */
    private final AtomicLong droppedPackets = new AtomicLong();
    /**
     * Requests discarded by the per-peer rate limiter.
     */
    private final AtomicLong rateLimited = new AtomicLong();
    /**
     * Requests that failed while building the response.
     */
    private final AtomicLong processingErrors = new AtomicLong();
    private final AtomicLong sentResponses = new AtomicLong();
    private final AtomicLong failedResponses = new AtomicLong();
    private final AtomicLong timedOutResponses = new AtomicLong();
    /**
     * Sum of receive-to-sent latency for every sent response.
     */
    private final AtomicLong processingNanosTotal = new AtomicLong();

    void recordReceived() {
        receivedPackets.incrementAndGet();
    }

    void recordRequest() {
        requests.incrementAndGet();
    }

    void recordInvalid() {
        invalidPackets.incrementAndGet();
    }

    void recordDropped() {
        droppedPackets.incrementAndGet();
    }

    void recordRateLimited() {
        rateLimited.incrementAndGet();
    }

    void recordProcessingError() {
        processingErrors.incrementAndGet();
    }

    void recordSent(long processingNanos) {
        sentResponses.incrementAndGet();
        if (processingNanos > 0) {
            processingNanosTotal.addAndGet(processingNanos);
        }
    }

    void recordSendFailure() {
        failedResponses.incrementAndGet();
    }

    void recordSendTimeout() {
        timedOutResponses.incrementAndGet();
    }

    /**
     * Copy the current counter values. Never blocks writers.
     */
    public QueryMetricsSnapshot snapshot() {
        return new QueryMetricsSnapshot(
                receivedPackets.get(),
                requests.get(),
                invalidPackets.get(),
                droppedPackets.get(),
                rateLimited.get(),
                processingErrors.get(),
                sentResponses.get(),
                failedResponses.get(),
                timedOutResponses.get(),
                processingNanosTotal.get()
        );
    }
}
