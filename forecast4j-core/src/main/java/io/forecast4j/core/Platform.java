package io.forecast4j.core;

import java.util.Locale;

public enum Platform {
    IOS,
    ANDROID,
    WEB;

    public static Platform parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("platform must not be blank");
        }
        return Platform.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
