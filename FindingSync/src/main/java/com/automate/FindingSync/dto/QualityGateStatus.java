package com.automate.FindingSync.dto;

import java.util.List;

/**
 * Project quality gate with conditions already translated for display:
 * rating thresholds as letters and metric keys with spaces.
 */
public record QualityGateStatus(
        String status,
        List<Condition> conditions,
        String periodDate
) {
    public record Condition(
            String status,
            String metricKey,
            String comparator,
            String errorThreshold,
            String actualValue
    ) {}
}
