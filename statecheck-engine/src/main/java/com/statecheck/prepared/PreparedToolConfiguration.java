package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.check.Comparison;
import com.statecheck.model.ToolConfiguration;
import com.statecheck.tool.Tool;

import java.util.List;
import java.util.Map;

/**
 * A prepared {@link ToolConfiguration}. Every leaf shares the one tool instance, so the tool
 * runs once per cache lifetime.
 */
public class PreparedToolConfiguration extends PreparedCheckConfiguration<PreparedToolComparison> {
    private final ToolConfiguration config;

    private PreparedToolConfiguration(DataCache cache, PreparedGroup parent, ToolConfiguration config) {
        super(cache, parent);
        this.config = config;
    }

    public static PreparedToolConfiguration fromConfig(ToolConfiguration config, PreparedGroup parent, DataCache cache) {
        PreparedToolConfiguration prepared = new PreparedToolConfiguration(cache, parent, config);
        Tool tool = config.getTool();
        Map<String, List<Comparison>> byAttr = config.getByAttr();
        if (byAttr != null) {
            for (Map.Entry<String, List<Comparison>> entry : byAttr.entrySet()) {
                String key = entry.getKey();
                for (Comparison comparison : withShared(entry.getValue(), config.getShared())) {
                    prepared.addComparison(key, comparison,
                            () -> PreparedToolComparison.fromTool(
                                    tool, key, comparison, config.getName(), prepared, cache));
                }
            }
        }
        return prepared;
    }

    /**
     * Prepares directly from a tool instance, building a transient configuration for it.
     */
    public static PreparedToolConfiguration fromTool(
            Tool tool,
            Map<String, List<Comparison>> byAttr,
            List<Comparison> shared,
            PreparedGroup parent,
            DataCache cache
    ) {
        ToolConfiguration config = new ToolConfiguration();
        config.setTool(tool);
        if (byAttr != null) {
            config.setByAttr(byAttr);
        }
        if (shared != null) {
            config.setShared(shared);
        }
        return fromConfig(config, parent, cache);
    }

    @Override
    public ToolConfiguration getConfig() {
        return config;
    }
}
