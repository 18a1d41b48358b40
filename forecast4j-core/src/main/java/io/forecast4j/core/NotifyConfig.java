package io.forecast4j.core;

/**
 * Delivery rules attached to a scheduler job.
 *
 * @param onRun           notify on every run
 * @param onAlert         notify when the observation describes a weather alert
 * @param onPrecipitation notify when rain or snow was observed
 * @param coldThreshold   notify when the temperature is below this value (nullable)
 * @param heatThreshold   notify when the temperature is above this value (nullable)
 */
public record NotifyConfig(
        boolean onRun,
        boolean onAlert,
        boolean onPrecipitation,
        Double coldThreshold,
        Double heatThreshold
) {
    public static NotifyConfig defaults() {
        return new NotifyConfig(true, true, false, null, null);
    }
}
