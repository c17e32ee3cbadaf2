package com.automate.FindingSync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a project's trend history file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrendSnapshot {

    /** Epoch millis. */
    private long timestamp;
    /** ISO-8601 form of {@code timestamp}. */
    private String date;
    private Summary summary;
    private double coverage;
    private String qualityGateStatus;
    private int totalIssues;
    private String branch;
    private Compliance compliance;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Summary {
        private int high;
        private int medium;
        private int low;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Compliance {
        private int owaspCount;
        private int cweCount;
        private int sansCount;
    }
}
