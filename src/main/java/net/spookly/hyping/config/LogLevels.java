package net.spookly.hyping.config;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps {@code observability.logging.level} onto java.util.logging.
 */
public final class LogLevels {
    private static final String ROOT_LOGGER = "";

    private LogLevels() {
    }

    /**
     * Accepts the usual names (trace, debug, info, warn, error) as well as JUL level names.
     */
    public static Level parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Level.INFO;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "trace":
                return Level.FINEST;
            case "debug":
                return Level.FINE;
            case "info":
                return Level.INFO;
            case "warn":
            case "warning":
                return Level.WARNING;
            case "error":
                return Level.SEVERE;
            default:
                return Level.parse(value.toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Apply the configured level to the root logger and its handlers.
     */
    public static void apply(HypingConfig config) {
        String raw = null;
        if (config != null && config.observability != null && config.observability.logging != null) {
            raw = config.observability.logging.level;
        }
        Level level = parse(raw);
        Logger root = Logger.getLogger(ROOT_LOGGER);
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
