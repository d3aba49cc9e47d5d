package com.statecheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a group combines the results of its children.
 */
public enum GroupResultMode {
    /** Every child has to pass: the worst child severity wins. */
    ALL,
    /** One passing child is enough: the best child severity wins. */
    ANY;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GroupResultMode fromJson(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("mode is blank");
        }
        return GroupResultMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
