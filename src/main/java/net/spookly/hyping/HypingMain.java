package net.spookly.hyping;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.logging.LogManager;

import net.spookly.hyping.client.QueryClient;
import net.spookly.hyping.client.QueryResult;
import net.spookly.hyping.config.ConfigException;
import net.spookly.hyping.config.ConfigLoader;
import net.spookly.hyping.config.ConfigPrinter;
import net.spookly.hyping.config.HypingConfig;
import net.spookly.hyping.config.LogLevels;
import net.spookly.hyping.config.StatusConfigMapper;
import net.spookly.hyping.protocol.QueryException;
import net.spookly.hyping.protocol.QueryTransportException;
import net.spookly.hyping.server.QueryMetrics;
import net.spookly.hyping.server.QueryMetricsReporter;
import net.spookly.hyping.server.QueryServer;
import net.spookly.hyping.status.BattleMode;
import net.spookly.hyping.status.LiveStatusSource;
import net.spookly.hyping.status.StatusRecord;
import net.spookly.hyping.util.ListenAddress;

/**
 * Standalone entry point: runs the status responder, or sends one-shot queries with --query.
 */
public final class HypingMain {
    private static final String DEFAULT_CONFIG = "config/hyping.yaml";
    private static final String LOGGING_RESOURCE = "/logging.properties";
    private static final int DEFAULT_QUERY_TIMEOUT_MS = 1000;

    private HypingMain() {
    }

    public static void main(String[] args) {
        configureLogging();
        CliOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        if (options.queryTarget != null) {
            System.exit(runQueries(options));
            return;
        }
        try {
            System.exit(runServer(options));
        } catch (ConfigException e) {
            System.err.println(e.getMessage());
            System.exit(2);
        }
    }

    private static int runServer(CliOptions options) {
        HypingConfig config = ConfigLoader.load(options.configPath);
        LogLevels.apply(config);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return 0;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return 0;
        }
        System.out.println("Hyping config loaded: listen=" + config.query.listen);

        LiveStatusSource statusSource = new LiveStatusSource(StatusConfigMapper.toRecord(config.status));
        QueryMetrics metrics = new QueryMetrics();
        QueryMetricsReporter reporter = new QueryMetricsReporter(metrics, reportIntervalSeconds(config));
        QueryServer server = QueryServer.fromConfig(config, statusSource);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            reporter.stop();
        }, "hyping-shutdown"));

        reporter.start();
        try {
            server.run(metrics);
            return 0;
        } catch (QueryTransportException e) {
            System.err.println("Query listener failed: " + e.getMessage()
                    + (e.getCause() == null ? "" : " (" + e.getCause() + ")"));
            return 1;
        } finally {
            reporter.stop();
        }
    }

    private static int runQueries(CliOptions options) {
        ListenAddress target;
        try {
            target = ListenAddress.parse(options.queryTarget);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid --query target: " + e.getMessage());
            return 2;
        }
        Duration timeout = Duration.ofMillis(options.timeoutMs);
        int succeeded = 0;
        try (QueryClient client = new QueryClient(target.toSocketAddress())) {
            for (int i = 0; i < options.count; i++) {
                try {
                    QueryResult result = client.status(timeout);
                    succeeded++;
                    System.out.println("Ping = " + result.roundTrip().toMillis() + "ms");
                    System.out.println("Server info: " + describe(result));
                } catch (QueryException e) {
                    System.err.println("Query " + (i + 1) + "/" + options.count + " failed: " + e.getMessage());
                }
            }
        }
        return succeeded > 0 ? 0 : 1;
    }

    private static String describe(QueryResult result) {
        StatusRecord status = result.status();
        BattleMode mode = status.battleMode();
        return "build=" + (status.isBuildKnown() ? status.buildIdText() : "unknown")
                + " players=" + status.playersCount() + "/" + status.playerCap()
                + " battleMode=" + mode.type()
                + (mode.type() == BattleMode.Type.PER_PLAYER ? " (pvpByDefault=" + mode.perPlayerDefault() + ")" : "");
    }

    private static int reportIntervalSeconds(HypingConfig config) {
        if (config.observability == null || config.observability.metrics == null
                || config.observability.metrics.reportIntervalSeconds == null) {
            return 0;
        }
        return config.observability.metrics.reportIntervalSeconds;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = HypingMain.class.getResourceAsStream(LOGGING_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging configuration: " + e.getMessage());
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        String queryTarget = null;
        int timeoutMs = DEFAULT_QUERY_TIMEOUT_MS;
        int count = 1;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig, queryTarget, timeoutMs, count);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config":
                case "-c":
                    configPath = Paths.get(requireValue(args, ++i, arg));
                    break;
                case "--dry-run":
                    dryRun = true;
                    break;
                case "--print-effective-config":
                    printEffectiveConfig = true;
                    break;
                case "--query":
                case "-q":
                    queryTarget = requireValue(args, ++i, arg);
                    break;
                case "--timeout":
                    timeoutMs = requirePositiveInt(requireValue(args, ++i, arg), arg);
                    break;
                case "--count":
                    count = requirePositiveInt(requireValue(args, ++i, arg), arg);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig, queryTarget, timeoutMs, count);
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a value");
        }
        return args[index];
    }

    private static int requirePositiveInt(String raw, String flag) {
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException(flag + " must be greater than 0: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " must be numeric: " + raw, e);
        }
    }

    record CliOptions(Path configPath,
                      boolean dryRun,
                      boolean printEffectiveConfig,
                      String queryTarget,
                      int timeoutMs,
                      int count) {
    }
}
