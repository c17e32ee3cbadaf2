package com.automate.FindingSync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Several projects of one server collected under one login. A project that
 * fails is listed with its error and left out of the totals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PortfolioReport {
    private Instant generatedAt;
    private String name;
    private String sonarBaseUrl;
    private List<Entry> projects;
    private SeveritySummary totals;
    private Double averageCoverage;
    private int gatesPassed;
    private int gatesFailed;
    private int projectsFailed;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        private String sonarComponent;
        private boolean success;
        private SecurityReport report;
        private String error;
        private String errorKind;
    }
}
