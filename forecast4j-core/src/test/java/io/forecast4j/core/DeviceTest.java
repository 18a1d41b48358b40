package io.forecast4j.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeviceTest {

    @Test
    void subscribesToShouldIgnoreCaseAndSurroundingSpaces() {
        Device device = device(true, "  New York ", "paris");

        assertTrue(device.subscribesTo("new york"));
        assertTrue(device.subscribesTo("PARIS"));
        assertFalse(device.subscribesTo("York"));
        assertFalse(device.subscribesTo(null));
    }

    @Test
    void disabledDeviceShouldNeverBeTarget() {
        assertTrue(device(true, "Paris").isTargetFor("Paris"));
        assertFalse(device(false, "Paris").isTargetFor("Paris"));
    }

    @Test
    void defaultsShouldApply() {
        Device device = new Device(null, "tok", Platform.WEB, null, null, null, null, true, null, null);

        assertEquals(List.of(), device.cities());
        assertEquals(Units.IMPERIAL, device.units());
        assertThrows(NullPointerException.class,
                () -> new Device(null, null, Platform.WEB, null, null, List.of(), Units.METRIC, true, null, null));
    }

    @Test
    void unitsAndPlatformShouldParseCaseInsensitively() {
        assertEquals(Units.IMPERIAL, Units.parse(" Imperial "));
        assertEquals(Units.METRIC, Units.parse(null));
        assertEquals(Platform.ANDROID, Platform.parse("android"));
        assertThrows(IllegalArgumentException.class, () -> Units.parse("kelvin"));
    }

    private static Device device(boolean enabled, String... cities) {
        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        return new Device("d1", "tok", Platform.IOS, "iPhone", "1.2.0", List.of(cities), Units.METRIC, enabled, at, at);
    }
}
