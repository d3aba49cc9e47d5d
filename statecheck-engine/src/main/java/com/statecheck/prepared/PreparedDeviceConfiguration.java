package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.check.Comparison;
import com.statecheck.device.DeviceDatabase;
import com.statecheck.device.DeviceHandle;
import com.statecheck.model.DeviceConfiguration;
import com.statecheck.model.Result;
import com.statecheck.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A prepared {@link DeviceConfiguration}: one leaf per device, attribute and comparison.
 */
public class PreparedDeviceConfiguration extends PreparedCheckConfiguration<PreparedSignalComparison> {
    private static final Logger log = LoggerFactory.getLogger(PreparedDeviceConfiguration.class);

    private final DeviceConfiguration config;
    private final List<DeviceHandle> devices;

    private PreparedDeviceConfiguration(
            DataCache cache,
            PreparedGroup parent,
            DeviceConfiguration config,
            List<DeviceHandle> devices
    ) {
        super(cache, parent);
        this.config = config;
        this.devices = devices;
    }

    /**
     * Resolves every named device, then binds the comparisons.
     *
     * @throws PreparationFailedException if any device cannot be resolved
     */
    public static PreparedDeviceConfiguration fromConfig(
            DeviceConfiguration config,
            PreparedGroup parent,
            DeviceDatabase deviceDatabase,
            DataCache cache
    ) throws PreparationFailedException {
        List<String> names = config.getDevices() != null ? config.getDevices() : List.of();
        List<DeviceHandle> devices = new ArrayList<>(names.size());

        for (String name : names) {
            try {
                if (deviceDatabase == null) {
                    throw new IllegalStateException("No device database available");
                }
                devices.add(deviceDatabase.resolve(name));
            } catch (RuntimeException e) {
                log.warn("Failed to load device: config={}, device={}, reason={}",
                        displayName(config), name, e.getMessage());
                throw new PreparationFailedException(new FailedConfiguration(
                        parent,
                        config,
                        Result.of(Severity.ERROR, "Failed to load device: " + name),
                        e
                ));
            }
        }

        PreparedDeviceConfiguration prepared = new PreparedDeviceConfiguration(cache, parent, config, devices);
        prepared.bind(config.getByAttr(), config.getShared());
        return prepared;
    }

    /**
     * Prepares directly from device handles, building a transient configuration for them.
     */
    public static PreparedDeviceConfiguration fromDevices(
            List<DeviceHandle> devices,
            Map<String, List<Comparison>> byAttr,
            List<Comparison> shared,
            PreparedGroup parent,
            DataCache cache
    ) {
        DeviceConfiguration config = new DeviceConfiguration();
        config.setDevices(devices.stream().map(DeviceHandle::getName).toList());
        if (byAttr != null) {
            config.setByAttr(byAttr);
        }
        if (shared != null) {
            config.setShared(shared);
        }

        PreparedDeviceConfiguration prepared =
                new PreparedDeviceConfiguration(cache, parent, config, List.copyOf(devices));
        prepared.bind(config.getByAttr(), config.getShared());
        return prepared;
    }

    private void bind(Map<String, List<Comparison>> byAttr, List<Comparison> shared) {
        if (byAttr == null) {
            return;
        }
        for (DeviceHandle device : devices) {
            for (Map.Entry<String, List<Comparison>> entry : byAttr.entrySet()) {
                String attr = entry.getKey();
                for (Comparison comparison : withShared(entry.getValue(), shared)) {
                    addComparison(device.getName() + "." + attr, comparison,
                            () -> PreparedSignalComparison.fromDevice(
                                    device, attr, comparison, config.getName(), this, getCache()));
                }
            }
        }
    }

    @Override
    public DeviceConfiguration getConfig() {
        return config;
    }

    public List<DeviceHandle> getDevices() {
        return devices;
    }
}
