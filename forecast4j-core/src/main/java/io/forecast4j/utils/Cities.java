package io.forecast4j.utils;

import java.util.Locale;

public final class Cities {
    private Cities() {
    }

    /**
     * Canonical form used for cache keys and city matching: trimmed, lower-case.
     */
    public static String normalize(String city) {
        if (city == null) {
            throw new IllegalArgumentException("city must not be null");
        }
        String s = city.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("city must not be blank");
        }
        return s.toLowerCase(Locale.ROOT);
    }
}
