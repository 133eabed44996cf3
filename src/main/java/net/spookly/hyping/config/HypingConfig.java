package net.spookly.hyping.config;

public class HypingConfig {
    public QueryConfig query;
    public StatusConfig status;
    public ObservabilityConfig observability;

    public static class QueryConfig {
        public String listen;
        public Integer workers;
        public Integer queueCapacity;
        public Integer sendTimeoutMs;
        public RateLimitConfig rateLimit;
    }

    public static class RateLimitConfig {
        public Boolean enabled;
        /**
         * Requests a single source address may send back to back.
         */
        public Integer burst;
        public Integer refillPerSecond;
    }

    /**
     * Initial status record served until the owning application publishes another.
     */
    public static class StatusConfig {
        public String buildId;
        public Integer playersCount;
        public Integer playerCap;
        public String battleMode;
        public Boolean perPlayerDefault;
    }

    public static class ObservabilityConfig {
        public LoggingConfig logging;
        public MetricsConfig metrics;
    }

    public static class LoggingConfig {
        public String level;
    }

    public static class MetricsConfig {
        public Integer reportIntervalSeconds;
    }
}
