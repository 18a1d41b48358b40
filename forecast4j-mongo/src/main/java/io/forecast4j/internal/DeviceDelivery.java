package io.forecast4j.internal;

/**
 * Result of pushing to one device.
 *
 * @param attempts send calls made, 0 when aborted before the first one
 */
public record DeviceDelivery(String deviceId, String token, DeliveryStatus status, int attempts) {
}
