package com.statecheck.device;

/**
 * Creates signal handles for raw PV names.
 */
@FunctionalInterface
public interface SignalFactory {

    SignalHandle create(String pvName);
}
