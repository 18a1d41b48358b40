package io.forecast4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import io.forecast4j.utils.Cities;

/**
 * A device registered for push notifications.
 *
 * <p>Devices are owned by the registration API; the engine only reads them.
 */
public record Device(
        String id,
        String token,
        Platform platform,
        String deviceName,
        String appVersion,
        List<String> cities,
        Units units,
        boolean enabled,
        Instant registeredAt,
        Instant updatedAt
) {
    public Device {
        Objects.requireNonNull(token, "token must not be null");
        cities = cities == null ? List.of() : List.copyOf(cities);
        units = units == null ? Units.IMPERIAL : units;
    }

    /**
     * Case-insensitive membership check; both sides are trimmed.
     */
    public boolean subscribesTo(String city) {
        if (city == null || city.isBlank()) {
            return false;
        }
        String wanted = Cities.normalize(city);
        for (String c : cities) {
            if (c != null && !c.isBlank() && Cities.normalize(c).equals(wanted)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A device receives a job's notification only when enabled and subscribed to the job's city.
     */
    public boolean isTargetFor(String city) {
        return enabled && subscribesTo(city);
    }
}
