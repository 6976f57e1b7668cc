package de.netcompliance.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import de.netcompliance.core.model.Device;
import de.netcompliance.core.repository.DeviceInventory;
import de.netcompliance.util.yaml.YamlUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Device inventory read from a YAML list. Keeps the contact backoff of each device in memory:
 * from the second consecutive failure on, a device is due again after 15, 30 and finally 120
 * minutes.
 */
@Slf4j
public class YamlDeviceInventory implements DeviceInventory {

    private static final int BACKOFF_THRESHOLD = 2;

    private final Map<String, Device> devices = new ConcurrentHashMap<>();
    private final Clock clock;

    public YamlDeviceInventory(final InputStream content, final Clock clock) {
        this.clock = clock;
        List<Device> loaded = YamlUtil.load(content, new TypeReference<>() {
        });
        if (Objects.nonNull(loaded)) {
            loaded.forEach(device -> devices.put(device.getId(), device));
        }
        log.info("Loaded {} device(s)", devices.size());
    }

    @Override
    public Optional<Device> findDevice(final String deviceId) {
        return Optional.ofNullable(deviceId).map(devices::get);
    }

    public Collection<Device> findAll() {
        return List.copyOf(devices.values());
    }

    @Override
    public void recordContact(final String deviceId, final boolean reachable) {
        devices.computeIfPresent(deviceId, (id, device) -> {
            if (reachable) {
                device.setConsecutiveFailures(0);
                device.setNextCheckDue(null);
                return device;
            }
            var failures = device.getConsecutiveFailures() + 1;
            device.setConsecutiveFailures(failures);
            if (failures >= BACKOFF_THRESHOLD) {
                device.setNextCheckDue(clock.instant().plus(backoff(failures)));
                log.info("Device {} failed {} time(s) in a row, next check due {}",
                        device.getHostname(), failures, device.getNextCheckDue());
            }
            return device;
        });
    }

    static Duration backoff(final int failures) {
        return switch (failures) {
            case 0, 1 -> Duration.ZERO;
            case 2 -> Duration.ofMinutes(15);
            case 3 -> Duration.ofMinutes(30);
            default -> Duration.ofMinutes(120);
        };
    }
}
