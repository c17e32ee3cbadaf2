package com.automate.FindingSync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Deltas of the latest snapshot against the previous one ({@code deltas})
 * and against the oldest one in the period ({@code overallTrend}).
 * Keys: high, medium, low, total, coverage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrendAnalysis {
    private boolean hasTrendData;
    private String message;
    private Integer dataPoints;
    private Long periodDays;
    private TrendSnapshot latest;
    private TrendSnapshot previous;
    private TrendSnapshot oldest;
    private Map<String, TrendDelta> deltas;
    private Map<String, TrendDelta> overallTrend;
}
