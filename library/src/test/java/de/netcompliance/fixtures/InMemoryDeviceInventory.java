package de.netcompliance.fixtures;

import de.netcompliance.core.model.Device;
import de.netcompliance.core.repository.DeviceInventory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryDeviceInventory implements DeviceInventory {

    private final Map<String, Device> devices = new ConcurrentHashMap<>();
    private final List<String> contacts = new CopyOnWriteArrayList<>();

    public InMemoryDeviceInventory(final Device... devices) {
        for (Device device : devices) {
            this.devices.put(device.getId(), device);
        }
    }

    @Override
    public Optional<Device> findDevice(final String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    @Override
    public void recordContact(final String deviceId, final boolean reachable) {
        contacts.add(deviceId + (reachable ? " reachable" : " unreachable"));
    }

    public List<String> getContacts() {
        return List.copyOf(contacts);
    }
}
