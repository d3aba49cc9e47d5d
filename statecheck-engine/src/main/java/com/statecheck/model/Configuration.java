package com.statecheck.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * Settings shared by every configuration node.
 *
 * <p>Serialized as a tagged union: the variant name wraps the node's fields. The variant set is
 * closed; preparation dispatches over exactly these four types.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConfigurationGroup.class, name = "ConfigurationGroup"),
        @JsonSubTypes.Type(value = DeviceConfiguration.class, name = "DeviceConfiguration"),
        @JsonSubTypes.Type(value = PvConfiguration.class, name = "PVConfiguration"),
        @JsonSubTypes.Type(value = ToolConfiguration.class, name = "ToolConfiguration")
})
public abstract class Configuration {
    private String name;
    private String description;
    private List<String> tags;
}
