package com.statecheck.device;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Map-backed device handle with optional sub-devices.
 */
public class SimpleDeviceHandle implements DeviceHandle {
    private final String name;
    private final Map<String, SignalHandle> signals = new LinkedHashMap<>();
    private final Map<String, DeviceHandle> subDevices = new LinkedHashMap<>();

    public SimpleDeviceHandle(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public SimpleDeviceHandle withSignal(String attr, SignalHandle signal) {
        signals.put(attr, signal);
        return this;
    }

    public SimpleDeviceHandle withSubDevice(String attr, DeviceHandle device) {
        subDevices.put(attr, device);
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<SignalHandle> getSignal(String attr) {
        if (attr == null || attr.isBlank()) {
            return Optional.empty();
        }
        SignalHandle direct = signals.get(attr);
        if (direct != null) {
            return Optional.of(direct);
        }

        String[] parts = attr.split("\\.", 2);
        if (parts.length == 2) {
            DeviceHandle sub = subDevices.get(parts[0]);
            if (sub != null) {
                return sub.getSignal(parts[1]);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "SimpleDeviceHandle[" + name + "]";
    }
}
