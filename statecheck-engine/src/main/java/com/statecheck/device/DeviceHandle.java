package com.statecheck.device;

import java.util.Optional;

/**
 * A resolved device exposing named attributes as signals.
 */
public interface DeviceHandle {

    String getName();

    /**
     * Looks up an attribute; dots walk into sub-devices.
     *
     * @param attr attribute name
     * @return the signal, or empty if the device has no such attribute
     */
    Optional<SignalHandle> getSignal(String attr);
}
