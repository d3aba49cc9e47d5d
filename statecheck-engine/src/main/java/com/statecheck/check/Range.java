package com.statecheck.check;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.statecheck.model.Result;
import com.statecheck.model.Severity;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Passes when a numeric value lies within [{@link #low}, {@link #high}].
 *
 * <p>Optional warning bounds narrow the passing band: values inside the range but outside
 * [{@link #warnLow}, {@link #warnHigh}] report {@link Severity#WARNING}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Range extends Comparison {
    private double low;
    private double high;
    private Double warnLow;
    private Double warnHigh;
    private boolean inclusive = true;

    @Override
    public Result compare(Object value, String identifier) {
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("Range requires a numeric value, got "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }

        double v = number.doubleValue();
        if (!within(v, low, high)) {
            return failure(identifier, value);
        }
        double wl = warnLow != null ? warnLow : low;
        double wh = warnHigh != null ? warnHigh : high;
        if (!within(v, wl, wh)) {
            return Result.of(Severity.WARNING, identifier + ": " + value + " outside warning band [" + wl + ", " + wh + "]");
        }
        return Result.success();
    }

    @Override
    public String describe() {
        return (inclusive ? "[" : "(") + low + ", " + high + (inclusive ? "]" : ")");
    }

    private boolean within(double v, double lo, double hi) {
        return inclusive ? v >= lo && v <= hi : v > lo && v < hi;
    }
}
