package io.forecast4j;

import io.forecast4j.core.FetchException;
import io.forecast4j.core.Units;
import io.forecast4j.core.WeatherObservation;

import java.time.LocalDate;
import java.util.List;

/**
 * Upstream archive of past observations, used to fill gaps in the weather history.
 * Optional; the history backfill only runs when the host application provides one.
 */
public interface HistoricalWeatherClient {

    /**
     * Observations recorded for a city during one UTC day. Each call counts as one upstream call.
     *
     * @throws FetchException with {@link FetchException#isTransient()} telling whether a later run may succeed
     */
    List<WeatherObservation> fetchDay(String city, Units units, LocalDate day) throws FetchException;
}
