package com.statecheck.check;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.statecheck.model.Result;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;

/**
 * Passes when the value equals {@link #value}; numbers are compared within {@code atol + rtol * |value|}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Equals extends Comparison {
    private Object value;
    private Double rtol;
    private Double atol;
    private boolean invert;

    @Override
    public Result compare(Object actual, String identifier) {
        boolean passed = matches(actual) != invert;
        return passed ? Result.success() : failure(identifier, actual);
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(invert ? "not equal to " : "equal to ").append(value);
        if (atol != null || rtol != null) {
            sb.append(" (atol=").append(atol).append(", rtol=").append(rtol).append(')');
        }
        return sb.toString();
    }

    private boolean matches(Object actual) {
        if (actual instanceof Number a && value instanceof Number expected) {
            double diff = Math.abs(a.doubleValue() - expected.doubleValue());
            double tolerance = (atol != null ? atol : 0.0) + (rtol != null ? rtol : 0.0) * Math.abs(expected.doubleValue());
            return diff <= tolerance;
        }
        return Objects.equals(actual, value);
    }
}
