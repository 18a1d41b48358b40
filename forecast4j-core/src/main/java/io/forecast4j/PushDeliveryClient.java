package io.forecast4j;

import io.forecast4j.core.DeliveryResult;
import io.forecast4j.core.NotificationPayload;
import io.forecast4j.core.Platform;
import io.forecast4j.core.PushServiceUnavailableException;

/**
 * Push service (Expo, FCM, APNs...). Implemented by the host application.
 */
public interface PushDeliveryClient {

    /**
     * Deliver one notification to one device.
     *
     * <p>Runtime exceptions other than {@link PushServiceUnavailableException} are treated as transient failures.
     *
     * @throws PushServiceUnavailableException when the service itself is unreachable for every device
     */
    DeliveryResult send(String deviceToken, Platform platform, NotificationPayload payload);
}
