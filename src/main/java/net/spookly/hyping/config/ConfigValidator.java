package net.spookly.hyping.config;

import java.util.ArrayList;
import java.util.List;

import net.spookly.hyping.status.StatusRecord;
import net.spookly.hyping.util.ListenAddress;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(HypingConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateQuery(config, errors);
        validateStatus(config, errors);
        validateObservability(config, errors);

        throwIfErrors(errors);
    }

    private static void validateQuery(HypingConfig config, List<String> errors) {
        HypingConfig.QueryConfig query = config.query;
        if (query == null) {
            errors.add("query section is required");
            return;
        }
        if (isBlank(query.listen)) {
            errors.add("query.listen is required");
        } else {
            try {
                ListenAddress.parse(query.listen);
            } catch (IllegalArgumentException e) {
                errors.add("query.listen is invalid: " + e.getMessage());
            }
        }
        requirePositiveIfSet(errors, query.workers, "query.workers");
        requirePositiveIfSet(errors, query.queueCapacity, "query.queueCapacity");
        requirePositiveIfSet(errors, query.sendTimeoutMs, "query.sendTimeoutMs");

        HypingConfig.RateLimitConfig rateLimit = query.rateLimit;
        if (rateLimit != null && isTrue(rateLimit.enabled)) {
            requirePositive(errors, rateLimit.burst, "query.rateLimit.burst");
            requirePositive(errors, rateLimit.refillPerSecond, "query.rateLimit.refillPerSecond");
        }
    }

    private static void validateStatus(HypingConfig config, List<String> errors) {
        HypingConfig.StatusConfig status = config.status;
        if (status == null) {
            errors.add("status section is required");
            return;
        }
        if (status.buildId != null) {
            try {
                StatusRecord.buildIdFromText(status.buildId);
            } catch (IllegalArgumentException e) {
                errors.add("status.buildId is invalid: " + e.getMessage());
            }
        }
        requireCount(errors, status.playersCount, "status.playersCount");
        requireCount(errors, status.playerCap, "status.playerCap");
        if (isBlank(status.battleMode)) {
            errors.add("status.battleMode is required");
        } else if (!isOneOf(status.battleMode, "global_pvp", "global_pve", "per_player")) {
            errors.add("status.battleMode must be one of: global_pvp, global_pve, per_player");
        } else if (status.perPlayerDefault != null && !isOneOf(status.battleMode, "per_player")) {
            errors.add("status.perPlayerDefault only applies to battleMode per_player");
        }
    }

    private static void validateObservability(HypingConfig config, List<String> errors) {
        HypingConfig.ObservabilityConfig observability = config.observability;
        if (observability == null) {
            return;
        }
        if (observability.logging != null && !isBlank(observability.logging.level)) {
            try {
                LogLevels.parse(observability.logging.level);
            } catch (IllegalArgumentException e) {
                errors.add("observability.logging.level is invalid: " + observability.logging.level);
            }
        }
        if (observability.metrics != null && observability.metrics.reportIntervalSeconds != null
                && observability.metrics.reportIntervalSeconds < 0) {
            errors.add("observability.metrics.reportIntervalSeconds must be >= 0");
        }
    }

    private static void requireCount(List<String> errors, Integer value, String field) {
        if (value == null || value < 0 || value > StatusRecord.MAX_COUNT) {
            errors.add(field + " must be between 0 and " + StatusRecord.MAX_COUNT);
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static void requirePositiveIfSet(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isTrue(Boolean value) {
        return value != null && value;
    }

    static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.trim().equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
