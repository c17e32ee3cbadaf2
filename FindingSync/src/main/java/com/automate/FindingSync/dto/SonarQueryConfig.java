package com.automate.FindingSync.dto;

/**
 * Query filters the upstream API accepts for a given server version.
 * A null {@code ruleTypes} means rules are searched without a type filter.
 */
public record SonarQueryConfig(
        String issueTypes,
        String ruleTypes,
        String issueStatuses,
        String hotspotStatuses
) {
    public SonarQueryConfig withAllBugs() {
        return new SonarQueryConfig(
                issueTypes + ",BUG",
                ruleTypes == null ? null : ruleTypes + ",BUG",
                issueStatuses,
                hotspotStatuses);
    }

    public SonarQueryConfig withoutRuleTypeFilter() {
        return new SonarQueryConfig(issueTypes, null, issueStatuses, hotspotStatuses);
    }
}
