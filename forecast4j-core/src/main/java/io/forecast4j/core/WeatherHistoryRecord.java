package io.forecast4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One stored weather snapshot. Unique by (city, timestamp, units).
 */
public record WeatherHistoryRecord(
        String city,
        double lat,
        double lon,
        Instant timestamp,
        double temperature,
        double feelsLike,
        int humidity,
        int pressure,
        double windSpeed,
        Integer windDirection,
        Integer clouds,
        Integer visibility,
        String description,
        String icon,
        Double rain1h,
        Double snow1h,
        Units units,
        Instant fetchedAt
) {
    public WeatherHistoryRecord {
        Objects.requireNonNull(city, "city must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(units, "units must not be null");
    }

    /**
     * Stores an observation under the requested city key and units.
     *
     * <p>The requested city is kept (not the provider's spelling) so later lookups for the same key hit.
     */
    public static WeatherHistoryRecord from(String city, Units units, WeatherObservation o, Instant fetchedAt) {
        return new WeatherHistoryRecord(
                city,
                o.lat(),
                o.lon(),
                o.timestamp() != null ? o.timestamp() : fetchedAt,
                o.temperature(),
                o.feelsLike(),
                o.humidity(),
                o.pressure(),
                o.windSpeed(),
                o.windDirection(),
                o.clouds(),
                o.visibility(),
                o.description(),
                o.icon(),
                o.rain1h(),
                o.snow1h(),
                units,
                fetchedAt
        );
    }

    public double precipitation() {
        double rain = rain1h == null ? 0.0 : rain1h;
        double snow = snow1h == null ? 0.0 : snow1h;
        return rain + snow;
    }
}
