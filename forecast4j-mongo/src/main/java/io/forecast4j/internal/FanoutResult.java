package io.forecast4j.internal;

import java.util.List;

/**
 * Aggregate of one fan-out batch. {@code notified + failed == targeted} always holds.
 */
public record FanoutResult(int targeted, List<DeviceDelivery> deliveries, boolean aborted, String abortReason) {

    public FanoutResult {
        deliveries = deliveries == null ? List.of() : List.copyOf(deliveries);
    }

    public static FanoutResult empty() {
        return new FanoutResult(0, List.of(), false, null);
    }

    public int notified() {
        int n = 0;
        for (DeviceDelivery d : deliveries) {
            if (d.status().isDelivered()) {
                n++;
            }
        }
        return n;
    }

    public int failed() {
        return targeted - notified();
    }

    public List<String> permanentlyFailedTokens() {
        return deliveries.stream()
                .filter(d -> d.status() == DeliveryStatus.FAILED_PERMANENT)
                .map(DeviceDelivery::token)
                .toList();
    }
}
