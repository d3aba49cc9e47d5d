package com.statecheck.device;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Device database holding registered handles in memory.
 */
public class InMemoryDeviceDatabase implements DeviceDatabase {
    private final Map<String, DeviceHandle> devices = new ConcurrentHashMap<>();

    public InMemoryDeviceDatabase register(DeviceHandle device) {
        devices.put(device.getName(), device);
        return this;
    }

    @Override
    public DeviceHandle resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("device name is blank");
        }
        DeviceHandle device = devices.get(name);
        if (device == null) {
            throw new DeviceNotFoundException("Device not found: " + name);
        }
        return device;
    }
}
