package de.netcompliance.core.repository;

import de.netcompliance.core.model.Device;

import java.util.Optional;

public interface DeviceInventory {

    Optional<Device> findDevice(final String deviceId);

    /**
     * Reports whether a device could be reached, so the inventory can maintain its backoff
     * counters. The engine never writes device records itself.
     */
    default void recordContact(final String deviceId, final boolean reachable) {
    }
}
