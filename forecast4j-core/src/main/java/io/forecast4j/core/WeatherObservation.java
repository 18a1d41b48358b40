package io.forecast4j.core;

import java.time.Instant;

/**
 * Current conditions as returned by the weather provider for one fetch.
 */
public record WeatherObservation(
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
        Double snow1h
) {
}
