package io.forecast4j.internal;

import io.forecast4j.core.NotificationPayload;
import io.forecast4j.core.NotificationPriority;
import io.forecast4j.core.NotifyConfig;
import io.forecast4j.core.SchedulerJob;
import io.forecast4j.core.Units;
import io.forecast4j.core.WeatherHistoryRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a weather record into a push payload and decides whether it is worth sending.
 */
public final class ForecastMessages {

    static final List<String> ALERT_KEYWORDS = List.of(
            "alert", "warning", "storm", "tornado", "hurricane", "blizzard");

    private ForecastMessages() {
    }

    /**
     * True when any rule of the job's notify config matches the record.
     */
    public static boolean shouldNotify(WeatherHistoryRecord record, NotifyConfig notify) {
        if (notify.onRun()) {
            return true;
        }
        if (notify.onAlert() && isAlert(record)) {
            return true;
        }
        if (notify.onPrecipitation() && record.precipitation() > 0) {
            return true;
        }
        return thresholdTripped(record, notify);
    }

    public static NotificationPayload build(SchedulerJob job, WeatherHistoryRecord record) {
        String symbol = temperatureSymbol(record.units());

        StringBuilder body = new StringBuilder();
        body.append(String.format(Locale.ROOT, "Now: %.1f%s (feels %.1f%s)",
                record.temperature(), symbol, record.feelsLike(), symbol));
        if (record.description() != null && !record.description().isBlank()) {
            body.append('\n').append(capitalize(record.description()));
        }
        if (record.rain1h() != null && record.rain1h() > 0) {
            body.append('\n').append(String.format(Locale.ROOT, "Rain: %.1f mm/h", record.rain1h()));
        }
        if (record.snow1h() != null && record.snow1h() > 0) {
            body.append('\n').append(String.format(Locale.ROOT, "Snow: %.1f mm/h", record.snow1h()));
        }

        boolean urgent = isAlert(record) || thresholdTripped(record, job.notifyConfig());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("city", job.city());
        data.put("jobId", job.id());
        data.put("units", record.units().value());
        data.put("includeDaily", job.includeDaily());
        data.put("includeHourly", job.includeHourly());
        data.put("timestamp", record.timestamp().toString());

        return new NotificationPayload(
                "Weather: " + job.city(),
                body.toString(),
                urgent ? NotificationPriority.HIGH : NotificationPriority.DEFAULT,
                data);
    }

    static boolean isAlert(WeatherHistoryRecord record) {
        String description = record.description();
        if (description == null) {
            return false;
        }
        String d = description.toLowerCase(Locale.ROOT);
        for (String keyword : ALERT_KEYWORDS) {
            if (d.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    static boolean thresholdTripped(WeatherHistoryRecord record, NotifyConfig notify) {
        if (notify.coldThreshold() != null && record.temperature() < notify.coldThreshold()) {
            return true;
        }
        return notify.heatThreshold() != null && record.temperature() > notify.heatThreshold();
    }

    private static String temperatureSymbol(Units units) {
        return switch (units) {
            case METRIC -> "°C";
            case IMPERIAL -> "°F";
            case STANDARD -> " K";
        };
    }

    private static String capitalize(String s) {
        String t = s.trim();
        return t.substring(0, 1).toUpperCase(Locale.ROOT) + t.substring(1);
    }
}
