package io.forecast4j.internal.mongo;

import io.forecast4j.core.Device;
import io.forecast4j.core.DeviceRegistry;
import io.forecast4j.core.PersistResult;
import io.forecast4j.core.StorageException;
import io.forecast4j.utils.Cities;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Device lookups over the {@code devices} collection.
 *
 * <p>The engine only reads through {@link #findEnabledByCity(String)} and {@link #findEnabled()}; {@link #register(Device)} is the
 * registration path owned by the device API.
 */
public class MongoDeviceRegistry implements DeviceRegistry {

    private final MongoTemplate mongoTemplate;

    public MongoDeviceRegistry(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<Device> findEnabledByCity(String city) {
        String wanted = Cities.normalize(city);
        // whole-value, case-insensitive match on any element of cities
        Query q = new Query(Criteria.where("enabled").is(true)
                .and("cities").regex("^\\s*" + Pattern.quote(wanted) + "\\s*$", "i"));

        List<DeviceDocument> docs;
        try {
            docs = mongoTemplate.find(q, DeviceDocument.class);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load devices for city " + wanted + ": " + e.getMessage(), e);
        }

        List<Device> devices = new ArrayList<>(docs.size());
        for (DeviceDocument doc : docs) {
            Device d = toDevice(doc);
            if (d.isTargetFor(wanted)) {
                devices.add(d);
            }
        }
        return devices;
    }

    @Override
    public List<Device> findEnabled() {
        Query q = new Query(Criteria.where("enabled").is(true)).with(Sort.by(Sort.Direction.ASC, "registeredAt"));
        try {
            return mongoTemplate.find(q, DeviceDocument.class).stream().map(MongoDeviceRegistry::toDevice).toList();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load enabled devices: " + e.getMessage(), e);
        }
    }

    /**
     * Insert or refresh a device, keyed by its push token.
     */
    public PersistResult register(Device device) {
        Objects.requireNonNull(device, "device must not be null");
        Instant now = Instant.now();
        Query q = new Query(Criteria.where("token").is(device.token()));
        Update u = new Update()
                .set("platform", device.platform())
                .set("deviceName", device.deviceName())
                .set("appVersion", device.appVersion())
                .set("cities", device.cities())
                .set("units", device.units())
                .set("enabled", device.enabled())
                .set("updatedAt", now)
                .setOnInsert("registeredAt", device.registeredAt() != null ? device.registeredAt() : now);
        try {
            return mongoTemplate.upsert(q, u, DeviceDocument.class).getUpsertedId() != null
                    ? PersistResult.createdResult()
                    : PersistResult.updatedResult();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to register device: " + e.getMessage(), e);
        }
    }

    private static Device toDevice(DeviceDocument doc) {
        return new Device(
                doc.getId(),
                doc.getToken(),
                doc.getPlatform(),
                doc.getDeviceName(),
                doc.getAppVersion(),
                doc.getCities(),
                doc.getUnits(),
                doc.isEnabled(),
                doc.getRegisteredAt(),
                doc.getUpdatedAt()
        );
    }
}
