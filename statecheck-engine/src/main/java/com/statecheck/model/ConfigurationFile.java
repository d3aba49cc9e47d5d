package com.statecheck.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A configuration file: a version marker and the top-level group.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConfigurationFile {
    private int version = 0;
    private ConfigurationGroup root = new ConfigurationGroup();

    /**
     * Walks every configuration in the file, starting with the root group.
     *
     * @return configurations in pre-order
     */
    public Stream<Configuration> walkConfigs() {
        return Stream.concat(Stream.of(root), root.walkConfigs());
    }

    /**
     * Finds device configurations that include the given device.
     *
     * @param name device name
     * @return matching configurations
     */
    public Stream<DeviceConfiguration> getByDevice(String name) {
        return walkConfigs()
                .filter(DeviceConfiguration.class::isInstance)
                .map(DeviceConfiguration.class::cast)
                .filter(config -> config.getDevices() != null && config.getDevices().contains(name));
    }

    /**
     * Finds PV configurations that check the given PV.
     *
     * @param pvName PV name
     * @return matching configurations
     */
    public Stream<PvConfiguration> getByPv(String pvName) {
        return walkConfigs()
                .filter(PvConfiguration.class::isInstance)
                .map(PvConfiguration.class::cast)
                .filter(config -> config.getByPv() != null && config.getByPv().containsKey(pvName));
    }

    /**
     * Finds configurations carrying at least one of the given tags.
     *
     * @param tags tags; none yields nothing
     * @return matching configurations
     */
    public Stream<Configuration> getByTag(String... tags) {
        if (tags == null || tags.length == 0) {
            return Stream.empty();
        }

        Set<String> tagSet = new HashSet<>(Arrays.asList(tags));
        return walkConfigs()
                .filter(config -> config.getTags() != null
                        && config.getTags().stream().anyMatch(tagSet::contains));
    }
}
