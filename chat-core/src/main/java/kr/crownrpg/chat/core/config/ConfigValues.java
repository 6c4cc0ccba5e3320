package kr.crownrpg.chat.core.config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient conversions for values read out of YAML maps.
 */
final class ConfigValues {

    private ConfigValues() {
    }

    static String trimToEmpty(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    static String str(Object value, String defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        return String.valueOf(value);
    }

    static int toInt(Object value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static boolean toBoolean(Object value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    static Map<String, Object> section(Object value) {
        if (value instanceof Map<?, ?> m) {
            return castMap(m);
        }
        return new HashMap<>();
    }

    static List<?> list(Object value) {
        if (value instanceof List<?> l) {
            return l;
        }
        return List.of();
    }

    static Map<String, Object> castMap(Map<?, ?> m) {
        Map<String, Object> out = new HashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            if (e.getKey() == null) continue;
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }
}
