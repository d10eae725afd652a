package io.liquidenergy.util;

import java.time.Duration;

/**
 * Reads settings from environment variables, falling back to system
 * properties of the same name.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Duration given in milliseconds, e.g. {@code HUMMINGBOT_REQUEST_TIMEOUT_MS=2500}.
     */
    public static Duration getMillis(String key, Duration defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private Env() {}
}
