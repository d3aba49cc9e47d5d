package com.statecheck.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Ordered group of configurations combined with a {@link GroupResultMode}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConfigurationGroup extends Configuration {
    private List<Configuration> configs = new ArrayList<>();
    /**
     * Free-form values carried with the group. Only the file format reads and writes them.
     */
    private Map<String, Object> values = new LinkedHashMap<>();
    private GroupResultMode mode = GroupResultMode.ALL;

    /**
     * Walks the descendants of this group depth-first, each group before its children.
     *
     * <p>The group itself is not included. Every call starts a fresh traversal.
     *
     * @return descendant configurations
     */
    public Stream<Configuration> walkConfigs() {
        List<Configuration> children = configs != null ? configs : List.of();
        return children.stream().flatMap(config -> {
            if (config instanceof ConfigurationGroup group) {
                return Stream.concat(Stream.of(config), group.walkConfigs());
            }
            return Stream.of(config);
        });
    }
}
