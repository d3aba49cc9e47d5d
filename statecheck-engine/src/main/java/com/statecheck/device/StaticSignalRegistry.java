package com.statecheck.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Signal factory backed by registered in-memory signals.
 *
 * <p>Unknown names are not rejected up front: they produce a signal that never connects, so the
 * problem surfaces at read time as a disconnect.
 */
public class StaticSignalRegistry implements SignalFactory {
    private static final Logger log = LoggerFactory.getLogger(StaticSignalRegistry.class);

    private final Map<String, SignalHandle> signals = new ConcurrentHashMap<>();

    public StaticSignalRegistry register(SignalHandle signal) {
        signals.put(signal.getName(), signal);
        return this;
    }

    public StaticSignalRegistry register(String pvName, Object value) {
        return register(new StaticSignal(pvName, value));
    }

    @Override
    public SignalHandle create(String pvName) {
        if (pvName == null || pvName.isBlank()) {
            throw new IllegalArgumentException("PV name is blank");
        }
        SignalHandle signal = signals.get(pvName);
        if (signal == null) {
            log.debug("No signal registered for PV {}; it will read as disconnected", pvName);
            return StaticSignal.disconnected(pvName);
        }
        return signal;
    }
}
