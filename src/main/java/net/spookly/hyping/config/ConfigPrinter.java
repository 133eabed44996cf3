package net.spookly.hyping.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.Iterator;
import java.util.Map;

/**
 * Renders the effective configuration, omitting unset values.
 */
public final class ConfigPrinter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(HypingConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        pruneNulls(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void pruneNulls(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Iterator<Map.Entry<String, Object>> iterator = data.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Object> entry = iterator.next();
            Object value = entry.getValue();
            if (value == null) {
                iterator.remove();
            } else if (value instanceof Map) {
                Map<String, Object> nested = (Map<String, Object>) value;
                pruneNulls(nested);
                if (nested.isEmpty()) {
                    iterator.remove();
                }
            }
        }
    }
}
