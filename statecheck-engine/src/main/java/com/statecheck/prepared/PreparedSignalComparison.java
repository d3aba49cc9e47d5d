package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.check.Comparison;
import com.statecheck.device.DeviceHandle;
import com.statecheck.device.SignalHandle;
import com.statecheck.model.Result;

import java.util.concurrent.CompletableFuture;

/**
 * A comparison reading a device attribute or a bare process variable.
 */
public class PreparedSignalComparison extends PreparedComparison {
    private final DeviceHandle device;
    private final SignalHandle signal;

    PreparedSignalComparison(
            DataCache cache,
            String identifier,
            Comparison comparison,
            String name,
            PreparedConfiguration parent,
            DeviceHandle device,
            SignalHandle signal
    ) {
        super(cache, identifier, comparison, name, parent);
        this.device = device;
        this.signal = signal;
    }

    /**
     * Binds a comparison to a device attribute.
     *
     * @throws PreparedComparisonException if the device has no such attribute
     */
    public static PreparedSignalComparison fromDevice(
            DeviceHandle device,
            String attr,
            Comparison comparison,
            String name,
            PreparedConfiguration parent,
            DataCache cache
    ) throws PreparedComparisonException {
        String identifier = device.getName() + "." + attr;
        SignalHandle signal = device.getSignal(attr)
                .orElseThrow(() -> new PreparedComparisonException(
                        "Attribute " + attr + " does not exist on device " + device.getName(),
                        identifier, comparison, name));
        return new PreparedSignalComparison(cache, identifier, comparison, name, parent, device, signal);
    }

    /**
     * Binds a comparison to a process variable through the cache's signal factory.
     *
     * @throws PreparedComparisonException if the signal cannot be created
     */
    public static PreparedSignalComparison fromPvName(
            String pvName,
            Comparison comparison,
            String name,
            PreparedConfiguration parent,
            DataCache cache
    ) throws PreparedComparisonException {
        SignalHandle signal;
        try {
            signal = cache.signal(pvName);
        } catch (RuntimeException e) {
            throw new PreparedComparisonException(
                    "Failed to create signal " + pvName + ": " + e.getMessage(), e, pvName, comparison, name);
        }
        return new PreparedSignalComparison(cache, pvName, comparison, name, parent, null, signal);
    }

    @Override
    public CompletableFuture<Object> getDataAsync() {
        if (signal == null) {
            throw new IllegalStateException("Signal instance unset");
        }
        Comparison comparison = getComparison();
        return getCache().getSignalData(
                signal,
                comparison.getReducePeriod(),
                comparison.getReduceMethod(),
                Boolean.TRUE.equals(comparison.getString())
        );
    }

    @Override
    protected Result compareData(Object data) {
        if (data == null) {
            return Result.of(getComparison().getIfDisconnected(),
                    "No data available for signal '" + getIdentifier() + "' in comparison "
                            + getComparison().describe());
        }
        return getComparison().compare(data, getIdentifier());
    }

    /**
     * @return owning device, or {@code null} for a bare process variable
     */
    public DeviceHandle getDevice() {
        return device;
    }

    public SignalHandle getSignal() {
        return signal;
    }
}
