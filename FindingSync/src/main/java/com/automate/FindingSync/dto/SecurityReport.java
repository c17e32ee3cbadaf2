package com.automate.FindingSync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecurityReport {
    private Instant generatedAt;
    private String projectName;
    private String applicationName;
    private String releaseName;
    private String sonarBaseUrl;
    private String sonarComponent;
    private String branch;
    private String pullRequest;
    private String organization;
    private String serverVersion;
    private boolean inNewCodePeriod;
    /** New-code period definition, e.g. "PREVIOUS_VERSION > 1.2". */
    private String newCodePeriod;
    private List<RuleInfo> rules;
    /** Issues then hotspots, highest severity first. */
    private List<SonarFinding> findings;
    private SeveritySummary summary;
    private ComplianceSummary compliance;
    private QualityGateStatus qualityGate;
    private Double coverage;
    private TrendAnalysis trendAnalysis;
}
