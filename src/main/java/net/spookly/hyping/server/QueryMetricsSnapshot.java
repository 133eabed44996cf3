package net.spookly.hyping.server;

/**
 * Point-in-time copy of {@link QueryMetrics}.
 */
public record QueryMetricsSnapshot(long receivedPackets,
                                   long requests,
                                   long invalidPackets,
                                   long droppedPackets,
                                   long rateLimited,
                                   long processingErrors,
                                   long sentResponses,
                                   long failedResponses,
                                   long timedOutResponses,
                                   long processingNanosTotal) {

    /**
     * Mean receive-to-sent latency in microseconds, 0 before the first response.
     */
    public long averageProcessingMicros() {
        if (sentResponses == 0) {
            return 0;
        }
        return processingNanosTotal / sentResponses / 1_000L;
    }

    /**
     * Every failure the responder counted, excluding rate limiting.
     */
    public long errors() {
        return invalidPackets + droppedPackets + processingErrors + failedResponses + timedOutResponses;
    }

    public String summary() {
        return "received=" + receivedPackets
                + " requests=" + requests
                + " sent=" + sentResponses
                + " invalid=" + invalidPackets
                + " dropped=" + droppedPackets
                + " rateLimited=" + rateLimited
                + " processingErrors=" + processingErrors
                + " sendFailed=" + failedResponses
                + " sendTimedOut=" + timedOutResponses
                + " avgProcessingUs=" + averageProcessingMicros();
    }
}
