package com.statecheck.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.statecheck.check.Comparison;
import com.statecheck.tool.Ping;
import com.statecheck.tool.Tool;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies status through a {@link Tool} and compares keys of its result.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ToolConfiguration extends Configuration {
    private Tool tool = new Ping();
    /**
     * Result key to comparisons.
     */
    private Map<String, List<Comparison>> byAttr = new LinkedHashMap<>();
    private List<Comparison> shared = new ArrayList<>();
}
