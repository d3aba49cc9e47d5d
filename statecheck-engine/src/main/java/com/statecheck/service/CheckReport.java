package com.statecheck.service;

import com.statecheck.model.Result;
import com.statecheck.model.Severity;
import com.statecheck.prepared.FailedConfiguration;
import com.statecheck.prepared.PreparedFile;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@link CheckService} run.
 */
@Data
@Builder
public class CheckReport {
    private String runId;
    private Result result;
    private PreparedFile preparedFile;
    /**
     * Walked leaves (comparisons and preparation failures) per severity.
     */
    private Map<Severity, Long> severityCounts;
    private List<FailedConfiguration> failures;

    public Severity getSeverity() {
        return result != null ? result.getSeverity() : Severity.INTERNAL_ERROR;
    }

    public long count(Severity severity) {
        return severityCounts != null ? severityCounts.getOrDefault(severity, 0L) : 0L;
    }
}
