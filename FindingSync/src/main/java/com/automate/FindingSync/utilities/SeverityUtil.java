package com.automate.FindingSync.utilities;

import com.automate.FindingSync.dto.SeveritySummary;
import com.automate.FindingSync.dto.SonarFinding;
import com.automate.FindingSync.entity.Severity;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes the two severity vocabularies the server uses: issue severities
 * (BLOCKER..INFO) and hotspot vulnerability probabilities (HIGH/MEDIUM/LOW).
 */
public final class SeverityUtil {

    public static final String HIGH = "HIGH";
    public static final String MEDIUM = "MEDIUM";
    public static final String LOW = "LOW";

    public enum RiskLevel { HIGH, MEDIUM, LOW }

    private static final Set<String> ISSUE_LABELS = Set.of("CRITICAL", "MAJOR", "MINOR", "INFO", MEDIUM, LOW);

    private SeverityUtil() {
    }

    /** Ordered severity of an issue; HIGH/MEDIUM/LOW aliases fold onto BLOCKER/MAJOR/MINOR. */
    public static Severity issueLevel(String raw) {
        return switch (upper(raw)) {
            case "BLOCKER", HIGH -> Severity.BLOCKER;
            case "CRITICAL" -> Severity.CRITICAL;
            case "MINOR", LOW -> Severity.MINOR;
            case "INFO" -> Severity.INFO;
            default -> Severity.MAJOR;
        };
    }

    /** Report label of an issue: BLOCKER reads HIGH, other known labels pass through. */
    public static String issueLabel(String raw) {
        Severity level = issueLevel(raw);
        if (level == Severity.BLOCKER) return HIGH;
        String label = upper(raw);
        return ISSUE_LABELS.contains(label) ? label : level.name();
    }

    /** Report label of a hotspot; unknown or missing probability reads MEDIUM. */
    public static String hotspotLabel(String probability) {
        return switch (upper(probability)) {
            case HIGH, "BLOCKER" -> HIGH;
            case LOW -> LOW;
            default -> MEDIUM;
        };
    }

    /** Stored severity of a hotspot label. */
    public static Severity hotspotLevel(String label) {
        return switch (hotspotLabel(label)) {
            case HIGH -> Severity.CRITICAL;
            case LOW -> Severity.MINOR;
            default -> Severity.MAJOR;
        };
    }

    public static RiskLevel risk(String label) {
        return switch (upper(label)) {
            case HIGH, "BLOCKER", "CRITICAL" -> RiskLevel.HIGH;
            case LOW, "MINOR", "INFO" -> RiskLevel.LOW;
            default -> RiskLevel.MEDIUM;
        };
    }

    public static SeveritySummary summarize(Collection<SonarFinding> findings) {
        int high = 0, medium = 0, low = 0;
        for (SonarFinding f : findings) {
            switch (risk(f.getSeverity())) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        return new SeveritySummary(high, medium, low, findings.size());
    }

    private static String upper(String raw) {
        return raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    }
}
