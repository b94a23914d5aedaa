package io.voicecast.util;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment variable utilities.
 *
 * Every lookup checks the environment first, then JVM system properties, so tests and
 * {@code -D} flags can override a key without touching the process environment.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static Duration getMillis(String key, Duration defaultValue) {
        long millis = getLong(key, -1L);
        return millis < 0 ? defaultValue : Duration.ofMillis(millis);
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    /**
     * Parse a {@code from=to,from=to} list. Malformed pairs are skipped.
     */
    public static Map<String, String> getPairs(String key) {
        String value = get(key, null);
        if (value == null) return Collections.emptyMap();

        Map<String, String> pairs = new LinkedHashMap<>();
        for (String part : value.split(",")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2 && !kv[0].isBlank() && !kv[1].isBlank()) {
                pairs.put(kv[0].trim(), kv[1].trim());
            }
        }
        return Collections.unmodifiableMap(pairs);
    }

    private Env() {}
}
