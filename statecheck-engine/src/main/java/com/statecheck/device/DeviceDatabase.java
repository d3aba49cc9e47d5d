package com.statecheck.device;

/**
 * Resolves device names to live device handles.
 */
public interface DeviceDatabase {

    /**
     * @param name device name
     * @return the device
     * @throws DeviceNotFoundException if no device is known under that name
     */
    DeviceHandle resolve(String name);
}
