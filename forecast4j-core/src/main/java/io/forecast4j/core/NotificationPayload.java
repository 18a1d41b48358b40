package io.forecast4j.core;

import java.util.Map;

/**
 * What gets pushed to a device. Rendering is up to the client app.
 *
 * @param title    short headline
 * @param body     multi-line summary
 * @param priority delivery priority hint
 * @param data     routing data (city, job id, units, sections to show)
 */
public record NotificationPayload(
        String title,
        String body,
        NotificationPriority priority,
        Map<String, Object> data
) {
    public NotificationPayload {
        priority = priority == null ? NotificationPriority.DEFAULT : priority;
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
