package io.forecast4j.internal;

import io.forecast4j.core.Device;
import io.forecast4j.core.DeviceRegistry;
import io.forecast4j.core.Platform;
import io.forecast4j.core.Units;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Returns every stored device, ignoring the filter, so tests can check that the executor filters again.
 */
final class InMemoryDeviceRegistry implements DeviceRegistry {

    final List<Device> devices = new CopyOnWriteArrayList<>();

    static Device device(String token, boolean enabled, String... cities) {
        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        return new Device("id-" + token, token, Platform.IOS, null, "1.0.0", List.of(cities), Units.METRIC,
                enabled, at, at);
    }

    InMemoryDeviceRegistry add(Device device) {
        devices.add(device);
        return this;
    }

    @Override
    public List<Device> findEnabledByCity(String city) {
        return List.copyOf(devices);
    }

    @Override
    public List<Device> findEnabled() {
        return devices.stream().filter(Device::enabled).toList();
    }
}
