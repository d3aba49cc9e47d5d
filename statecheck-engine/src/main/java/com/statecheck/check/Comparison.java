package com.statecheck.check;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.statecheck.model.ReduceMethod;
import com.statecheck.model.Result;
import com.statecheck.model.Severity;
import lombok.Data;

/**
 * A predicate run against one acquired value.
 *
 * <p>Besides the predicate itself a comparison carries the policies its prepared leaf applies:
 * the severity reported when data cannot be acquired, the severity of a failed check, and how
 * signal samples are reduced before comparing.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Equals.class, name = "Equals"),
        @JsonSubTypes.Type(value = Range.class, name = "Range")
})
public abstract class Comparison {
    private String name;
    private String description;
    /**
     * Reported when the value cannot be read or is missing.
     */
    private Severity ifDisconnected = Severity.ERROR;
    /**
     * Reported when the check does not pass.
     */
    private Severity severityOnFailure = Severity.ERROR;
    /**
     * Sampling window in seconds; {@code null} reads the current value once.
     */
    private Double reducePeriod;
    private ReduceMethod reduceMethod = ReduceMethod.AVERAGE;
    /**
     * Read the value as a string.
     */
    private Boolean string;

    /**
     * Compares a value.
     *
     * @param value acquired value, never {@code null}
     * @param identifier identifier of the value, used in reasons
     * @return result of the comparison
     */
    public abstract Result compare(Object value, String identifier);

    /**
     * Short human readable form used in result reasons and logs.
     *
     * @return description of the predicate
     */
    public abstract String describe();

    protected Result failure(String identifier, Object value) {
        return Result.of(severityOnFailure, identifier + ": " + value + " failed " + describe());
    }
}
