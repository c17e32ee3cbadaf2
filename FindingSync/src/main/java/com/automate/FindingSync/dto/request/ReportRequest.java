package com.automate.FindingSync.dto.request;

import com.automate.FindingSync.client.SonarConnection;
import com.automate.FindingSync.dto.ReportOptions;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * One-shot report of a single component. Unset options take their defaults.
 */
@Data
public class ReportRequest {
    @NotBlank
    @Pattern(regexp = "^https?://.+", message = "must be an http(s) URL")
    private String sonarUrl;

    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String sonarToken;
    private String sonarUsername;
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String sonarPassword;
    private String sonarOrganization;

    private String sonarComponent;
    private String projectName;
    private String applicationName;
    private String releaseName;
    private String branch;
    private String pullRequest;

    private Boolean inNewCodePeriod;
    private Boolean securityHotspots;
    private Boolean qualityGateStatus;
    private Boolean coverage;
    private Boolean allBugs;
    private Boolean fixMissingRule;
    private Boolean rulesInReport;
    private Boolean onlyDetectedRules;
    private Boolean includeCompliance;
    private Boolean saveTrendData;
    private Boolean includeTrends;
    private Integer trendPeriodDays;

    public SonarConnection toConnection() {
        return new SonarConnection(sonarUrl, sonarToken, sonarUsername, sonarPassword, sonarOrganization);
    }

    public ReportOptions toOptions() {
        return toOptions(sonarComponent);
    }

    public ReportOptions toOptions(String component) {
        return ReportOptions.builder()
                .sonarComponent(component)
                .projectName(projectName)
                .applicationName(applicationName)
                .releaseName(releaseName)
                .branch(branch)
                .pullRequest(pullRequest)
                .organization(sonarOrganization)
                .inNewCodePeriod(inNewCodePeriod)
                .securityHotspots(securityHotspots)
                .qualityGateStatus(qualityGateStatus)
                .coverage(coverage)
                .allBugs(allBugs)
                .fixMissingRule(fixMissingRule)
                .rulesInReport(rulesInReport)
                .onlyDetectedRules(onlyDetectedRules)
                .includeCompliance(includeCompliance)
                .saveTrendData(saveTrendData)
                .includeTrends(includeTrends)
                .trendPeriodDays(trendPeriodDays)
                .build();
    }
}
