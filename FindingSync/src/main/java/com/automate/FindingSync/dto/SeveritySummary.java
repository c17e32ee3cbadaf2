package com.automate.FindingSync.dto;

public record SeveritySummary(
        int high,
        int medium,
        int low,
        int total
) {
    public static final SeveritySummary EMPTY = new SeveritySummary(0, 0, 0, 0);

    public SeveritySummary plus(SeveritySummary other) {
        return new SeveritySummary(high + other.high, medium + other.medium, low + other.low, total + other.total);
    }
}
