package com.example.aspects.persistence;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors over maps produced by SnakeYAML. Wrong or missing values
 * fall back to the supplied default.
 */
final class YamlValues {

    private YamlValues() {}

    static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    static int getInt(Map<String, Object> map, String key, int defaultVal) {
        return toInt(map.get(key), defaultVal);
    }

    static int toInt(Object val, int defaultVal) {
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try { return Double.parseDouble(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    static boolean getBoolean(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean) return (Boolean) val;
        if (val instanceof String) return Boolean.parseBoolean(((String) val).trim());
        return defaultVal;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return Collections.emptyMap();
    }

    @SuppressWarnings("unchecked")
    static List<Object> getList(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val instanceof List) return (List<Object>) val;
        return Collections.emptyList();
    }
}
