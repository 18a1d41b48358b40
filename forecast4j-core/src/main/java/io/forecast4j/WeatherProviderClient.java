package io.forecast4j;

import io.forecast4j.core.FetchException;
import io.forecast4j.core.Units;
import io.forecast4j.core.WeatherObservation;

/**
 * Upstream weather API. Implemented by the host application.
 */
public interface WeatherProviderClient {

    /**
     * Fetch current conditions for a city.
     *
     * @throws FetchException with {@link FetchException#isTransient()} telling whether a retry may help
     */
    WeatherObservation fetch(String city, Units units) throws FetchException;
}
