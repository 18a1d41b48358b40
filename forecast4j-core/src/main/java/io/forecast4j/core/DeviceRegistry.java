package io.forecast4j.core;

import java.util.List;

/**
 * Read-only view over registered devices.
 */
public interface DeviceRegistry {

    /**
     * Enabled devices whose subscribed cities contain {@code city} (case-insensitive).
     */
    List<Device> findEnabledByCity(String city);

    /**
     * Every enabled device, oldest registration first.
     */
    List<Device> findEnabled();
}
