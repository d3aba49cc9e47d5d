package com.statecheck.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Reduction applied to the samples of a signal collected over a time window.
 */
public enum ReduceMethod {
    AVERAGE,
    MEDIAN,
    SUM,
    MIN,
    MAX,
    STD,
    LATEST;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ReduceMethod fromJson(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("reduce_method is blank");
        }
        return ReduceMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Reduces numeric samples, given oldest first.
     *
     * @param samples samples (non-empty)
     * @return reduced value
     */
    public double reduce(List<Double> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("no samples to reduce");
        }

        switch (this) {
            case LATEST:
                return samples.get(samples.size() - 1);
            case SUM:
                return samples.stream().mapToDouble(Double::doubleValue).sum();
            case MIN:
                return samples.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
            case MAX:
                return samples.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
            case MEDIAN: {
                List<Double> sorted = new ArrayList<>(samples);
                Collections.sort(sorted);
                int mid = sorted.size() / 2;
                if (sorted.size() % 2 == 1) {
                    return sorted.get(mid);
                }
                return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
            }
            case STD: {
                double mean = samples.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
                double variance = samples.stream()
                        .mapToDouble(v -> (v - mean) * (v - mean))
                        .average()
                        .orElseThrow();
                return Math.sqrt(variance);
            }
            case AVERAGE:
            default:
                return samples.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        }
    }
}
