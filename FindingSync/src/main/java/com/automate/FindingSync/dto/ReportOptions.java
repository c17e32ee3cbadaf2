package com.automate.FindingSync.dto;

import com.automate.FindingSync.exception.SonarApiException;
import lombok.Builder;
import lombok.Getter;

/**
 * Per-run collection and report options. Every recognized option is a field
 * here with its default; inconsistent combinations are rejected when the
 * object is built.
 */
@Getter
public class ReportOptions {

    public static final int DEFAULT_TREND_PERIOD_DAYS = 90;

    /** Project key on the server. Required. */
    private final String sonarComponent;
    private final String projectName;
    private final String applicationName;
    private final String releaseName;
    private final String branch;
    private final String pullRequest;
    private final String organization;
    /** Only findings in the new-code period; also reports the period definition. */
    private final boolean inNewCodePeriod;
    private final boolean securityHotspots;
    private final boolean qualityGateStatus;
    private final boolean coverage;
    /** Also report BUG issues. */
    private final boolean allBugs;
    /** Search rules without a type filter. */
    private final boolean fixMissingRule;
    private final boolean rulesInReport;
    private final boolean onlyDetectedRules;
    private final boolean includeCompliance;
    private final boolean saveTrendData;
    private final boolean includeTrends;
    private final int trendPeriodDays;

    @Builder(toBuilder = true)
    private ReportOptions(String sonarComponent, String projectName, String applicationName, String releaseName,
                          String branch, String pullRequest, String organization,
                          Boolean inNewCodePeriod, Boolean securityHotspots, Boolean qualityGateStatus,
                          Boolean coverage, Boolean allBugs, Boolean fixMissingRule,
                          Boolean rulesInReport, Boolean onlyDetectedRules, Boolean includeCompliance,
                          Boolean saveTrendData, Boolean includeTrends, Integer trendPeriodDays) {
        this.sonarComponent = blankToNull(sonarComponent);
        this.projectName = blankToNull(projectName) != null ? projectName : this.sonarComponent;
        this.applicationName = blankToNull(applicationName);
        this.releaseName = blankToNull(releaseName);
        this.branch = blankToNull(branch);
        this.pullRequest = blankToNull(pullRequest);
        this.organization = blankToNull(organization);
        this.inNewCodePeriod = orDefault(inNewCodePeriod, false);
        this.securityHotspots = orDefault(securityHotspots, true);
        this.qualityGateStatus = orDefault(qualityGateStatus, false);
        this.coverage = orDefault(coverage, false);
        this.allBugs = orDefault(allBugs, false);
        this.fixMissingRule = orDefault(fixMissingRule, false);
        this.rulesInReport = orDefault(rulesInReport, true);
        this.onlyDetectedRules = orDefault(onlyDetectedRules, false);
        this.includeCompliance = orDefault(includeCompliance, true);
        this.saveTrendData = orDefault(saveTrendData, false);
        this.includeTrends = orDefault(includeTrends, false);
        this.trendPeriodDays = trendPeriodDays == null ? DEFAULT_TREND_PERIOD_DAYS : trendPeriodDays;
        validate();
    }

    private void validate() {
        if (sonarComponent == null) {
            throw SonarApiException.validation("sonarComponent is required");
        }
        if (branch != null && pullRequest != null) {
            throw SonarApiException.validation("branch and pullRequest cannot be used together");
        }
        if (onlyDetectedRules && !rulesInReport) {
            throw SonarApiException.validation("onlyDetectedRules requires rulesInReport");
        }
        if (allBugs && fixMissingRule) {
            throw SonarApiException.validation("allBugs and fixMissingRule cannot be used together");
        }
        if (trendPeriodDays < 1) {
            throw SonarApiException.validation("trendPeriodDays must be at least 1");
        }
    }

    private static boolean orDefault(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
