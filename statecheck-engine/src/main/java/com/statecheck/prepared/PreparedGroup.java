package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.device.DeviceDatabase;
import com.statecheck.model.Configuration;
import com.statecheck.model.ConfigurationGroup;
import com.statecheck.model.Result;
import com.statecheck.model.ResultSummarizer;
import com.statecheck.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * A prepared {@link ConfigurationGroup}.
 */
public class PreparedGroup extends PreparedConfiguration {
    private static final Logger log = LoggerFactory.getLogger(PreparedGroup.class);

    private final ConfigurationGroup config;
    private final List<PreparedConfiguration> configs = new ArrayList<>();

    private PreparedGroup(DataCache cache, PreparedGroup parent, ConfigurationGroup config) {
        super(cache, parent);
        this.config = config;
    }

    /**
     * Prepares a group and, in order, all of its children. A child that fails to prepare is
     * recorded in {@link #getPrepareFailures()}; its siblings are still prepared.
     *
     * @param group group configuration
     * @param parent parent group, or {@code null} for the root
     * @param deviceDatabase resolves device names
     * @param cache data cache
     * @return the prepared group
     */
    public static PreparedGroup fromGroup(
            ConfigurationGroup group,
            PreparedGroup parent,
            DeviceDatabase deviceDatabase,
            DataCache cache
    ) {
        PreparedGroup prepared = new PreparedGroup(cache, parent, group);
        List<Configuration> children = group.getConfigs() != null ? group.getConfigs() : List.of();

        for (Configuration child : children) {
            try {
                prepared.configs.add(PreparedConfiguration.fromConfig(child, prepared, deviceDatabase, cache));
            } catch (PreparationFailedException e) {
                prepared.recordFailure(e.getFailure());
            } catch (RuntimeException e) {
                log.error("Unexpected failure preparing configuration: group={}, config={}",
                        displayName(group), displayName(child), e);
                prepared.recordFailure(new FailedConfiguration(
                        prepared,
                        child,
                        Result.of(Severity.ERROR, "Failed to prepare configuration " + displayName(child) + ": " + e.getMessage()),
                        e
                ));
            }
        }
        return prepared;
    }

    @Override
    public ConfigurationGroup getConfig() {
        return config;
    }

    public List<PreparedConfiguration> getConfigs() {
        return Collections.unmodifiableList(configs);
    }

    /**
     * @return direct child groups
     */
    public List<PreparedGroup> getSubgroups() {
        return configs.stream()
                .filter(PreparedGroup.class::isInstance)
                .map(PreparedGroup.class::cast)
                .toList();
    }

    /**
     * Walks nested groups depth-first, each before its own subgroups. This group is not included.
     *
     * @return a fresh traversal
     */
    public Stream<PreparedGroup> walkGroups() {
        return getSubgroups().stream()
                .flatMap(group -> Stream.concat(Stream.of(group), group.walkGroups()));
    }

    @Override
    public Stream<PreparedLeaf> walkComparisons() {
        return Stream.concat(
                getPrepareFailures().stream(),
                configs.stream().flatMap(PreparedConfiguration::walkComparisons)
        );
    }

    @Override
    Result fold() {
        List<Object> results = new ArrayList<>(configs.size());
        for (PreparedConfiguration child : configs) {
            try {
                results.add(child.fold());
            } catch (RuntimeException e) {
                log.error("Failed to fold result: config={}", displayName(child.getConfig()), e);
                results.add(e);
            }
        }

        Result folded;
        if (!getPrepareFailures().isEmpty()) {
            folded = Result.of(Severity.ERROR, INITIALIZATION_FAILURE);
        } else {
            folded = Result.of(ResultSummarizer.summarize(config.getMode(), results), null);
        }
        setResult(folded);
        return folded;
    }
}
