package net.spookly.hyping.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Expands {@code env:NAME}, {@code env:NAME:fallback} and {@code path:file} scalar values.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";

    private EnvExpander() {
    }

    static Object expand(Object value, Path baseDir) {
        return expand(value, baseDir, System::getenv);
    }

    static Object expand(Object value, Path baseDir, Function<String, String> environment) {
        if (value instanceof Map<?, ?> raw) {
            Map<Object, Object> expanded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                expanded.put(entry.getKey(), expand(entry.getValue(), baseDir, environment));
            }
            return expanded;
        }
        if (value instanceof List<?> raw) {
            List<Object> expanded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                expanded.add(expand(item, baseDir, environment));
            }
            return expanded;
        }
        if (value instanceof String raw) {
            if (raw.startsWith(ENV_PREFIX)) {
                return expandEnv(raw.substring(ENV_PREFIX.length()), environment);
            }
            if (raw.startsWith(PATH_PREFIX)) {
                return readPath(raw.substring(PATH_PREFIX.length()), baseDir);
            }
        }
        return value;
    }

    private static String expandEnv(String reference, Function<String, String> environment) {
        int separator = reference.indexOf(':');
        String key = separator < 0 ? reference : reference.substring(0, separator);
        if (key.isBlank()) {
            throw new ConfigException("Environment reference is empty");
        }
        String envValue = environment.apply(key);
        if (envValue != null) {
            return envValue;
        }
        if (separator >= 0) {
            return reference.substring(separator + 1);
        }
        throw new ConfigException("Missing required environment variable: " + key);
    }

    private static String readPath(String location, Path baseDir) {
        if (location.isBlank()) {
            throw new ConfigException("Path value is empty");
        }
        Path resolved;
        try {
            resolved = Path.of(location);
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + location, e);
        }
        if (baseDir != null && !resolved.isAbsolute()) {
            resolved = baseDir.resolve(resolved).normalize();
        }
        try {
            return Files.readString(resolved, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + resolved, e);
        }
    }
}
