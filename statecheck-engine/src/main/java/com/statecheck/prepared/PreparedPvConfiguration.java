package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.check.Comparison;
import com.statecheck.model.PvConfiguration;

import java.util.List;
import java.util.Map;

/**
 * A prepared {@link PvConfiguration}: one leaf per process variable and comparison.
 */
public class PreparedPvConfiguration extends PreparedCheckConfiguration<PreparedSignalComparison> {
    private final PvConfiguration config;

    private PreparedPvConfiguration(DataCache cache, PreparedGroup parent, PvConfiguration config) {
        super(cache, parent);
        this.config = config;
    }

    public static PreparedPvConfiguration fromConfig(PvConfiguration config, PreparedGroup parent, DataCache cache) {
        PreparedPvConfiguration prepared = new PreparedPvConfiguration(cache, parent, config);
        Map<String, List<Comparison>> byPv = config.getByPv();
        if (byPv != null) {
            for (Map.Entry<String, List<Comparison>> entry : byPv.entrySet()) {
                String pvName = entry.getKey();
                for (Comparison comparison : withShared(entry.getValue(), config.getShared())) {
                    prepared.addComparison(pvName, comparison,
                            () -> PreparedSignalComparison.fromPvName(
                                    pvName, comparison, config.getName(), prepared, cache));
                }
            }
        }
        return prepared;
    }

    /**
     * Prepares directly from process variable names, building a transient configuration for them.
     */
    public static PreparedPvConfiguration fromPvs(
            Map<String, List<Comparison>> byPv,
            List<Comparison> shared,
            PreparedGroup parent,
            DataCache cache
    ) {
        PvConfiguration config = new PvConfiguration();
        if (byPv != null) {
            config.setByPv(byPv);
        }
        if (shared != null) {
            config.setShared(shared);
        }
        return fromConfig(config, parent, cache);
    }

    @Override
    public PvConfiguration getConfig() {
        return config;
    }
}
