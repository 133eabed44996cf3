package net.spookly.hyping.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final String DEFAULT_LISTEN = "0.0.0.0:14006";
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;
    public static final int DEFAULT_SEND_TIMEOUT_MS = 1000;
    public static final int DEFAULT_RATE_LIMIT_BURST = 20;
    public static final int DEFAULT_RATE_LIMIT_REFILL_PER_SECOND = 10;

    private static final String DEFAULT_YAML = """
            # Generated default Hyping config.
            query:
              listen: "%s"
              workers: 4
              queueCapacity: %d
              sendTimeoutMs: %d
              rateLimit:
                enabled: false
                burst: %d
                refillPerSecond: %d

            status:
              buildId: ""
              playersCount: 0
              playerCap: 100
              battleMode: global_pve

            observability:
              logging:
                level: info
              metrics:
                reportIntervalSeconds: 60
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML.formatted(
                DEFAULT_LISTEN,
                DEFAULT_QUEUE_CAPACITY,
                DEFAULT_SEND_TIMEOUT_MS,
                DEFAULT_RATE_LIMIT_BURST,
                DEFAULT_RATE_LIMIT_REFILL_PER_SECOND
        );
    }

    /**
     * Worker count used when {@code query.workers} is absent.
     */
    public static int defaultWorkers() {
        return Math.max(2, Runtime.getRuntime().availableProcessors());
    }
}
