package io.forecast4j.core;

import java.util.Locale;

/**
 * Measurement system requested from the weather provider.
 */
public enum Units {
    METRIC("metric"),
    IMPERIAL("imperial"),
    STANDARD("standard");

    private final String value;

    Units(String value) {
        this.value = value;
    }

    /**
     * Lower-case form used in storage and on the provider wire.
     */
    public String value() {
        return value;
    }

    public static Units parse(String value) {
        if (value == null || value.isBlank()) {
            return METRIC;
        }
        String s = value.trim().toLowerCase(Locale.ROOT);
        for (Units u : values()) {
            if (u.value.equals(s)) {
                return u;
            }
        }
        throw new IllegalArgumentException("Unsupported units: " + value);
    }
}
