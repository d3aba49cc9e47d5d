package com.statecheck.device;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimpleDeviceHandleTest {

    @Test
    void resolvesDirectAndNestedAttributes() {
        StaticSignal position = new StaticSignal("m1.position", 1.0);
        StaticSignal gain = new StaticSignal("m1.controller.gain", 3);
        SimpleDeviceHandle device = new SimpleDeviceHandle("m1")
                .withSignal("position", position)
                .withSubDevice("controller", new SimpleDeviceHandle("m1.controller").withSignal("gain", gain));

        assertSame(position, device.getSignal("position").orElseThrow());
        assertSame(gain, device.getSignal("controller.gain").orElseThrow());
        assertTrue(device.getSignal("controller.missing").isEmpty());
        assertTrue(device.getSignal("velocity").isEmpty());
    }

    @Test
    void databaseRejectsUnknownDevices() {
        InMemoryDeviceDatabase db = new InMemoryDeviceDatabase().register(new SimpleDeviceHandle("m1"));
        assertEquals("m1", db.resolve("m1").getName());
        assertThrows(DeviceNotFoundException.class, () -> db.resolve("m2"));
    }

    @Test
    void unknownPvReadsAsDisconnected() {
        SignalHandle signal = new StaticSignalRegistry().create("NOT:THERE");
        assertTrue(signal.read(false).isCompletedExceptionally());
        assertThrows(IllegalArgumentException.class, () -> new StaticSignalRegistry().create(""));
    }
}
