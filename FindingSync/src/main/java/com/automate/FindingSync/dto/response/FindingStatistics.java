package com.automate.FindingSync.dto.response;

import java.util.List;
import java.util.Map;

/** Counts over all of a project's findings, open or not. */
public record FindingStatistics(
        long total,
        long open,
        long assigned,
        Map<String, Long> bySeverity,
        Map<String, Long> byType,
        Map<String, Long> byLocalStatus,
        List<RuleCount> topRules
) {
    public record RuleCount(String ruleKey, String ruleName, long count) {}
}
