package in.signalbridge.util;

import java.time.Duration;

/**
 * Environment variable utilities.
 * Values come from the process environment first, then from system properties.
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

    /**
     * Duration expressed in milliseconds, e.g. {@code QUOTE_TIMEOUT_MS=8000}.
     */
    public static Duration getMillis(String key, Duration defaultValue) {
        long millis = getLong(key, -1L);
        return millis < 0 ? defaultValue : Duration.ofMillis(millis);
    }

    private Env() {}
}
