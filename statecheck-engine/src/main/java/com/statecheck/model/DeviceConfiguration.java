package com.statecheck.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.statecheck.check.Comparison;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks attributes of one or more named devices.
 *
 * <p>Attribute names may address sub-devices with dots ({@code "sub_device.component"}).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DeviceConfiguration extends Configuration {
    private List<String> devices = new ArrayList<>();
    private Map<String, List<Comparison>> byAttr = new LinkedHashMap<>();
    /**
     * Comparisons run against every attribute in {@link #byAttr}.
     */
    private List<Comparison> shared = new ArrayList<>();
}
