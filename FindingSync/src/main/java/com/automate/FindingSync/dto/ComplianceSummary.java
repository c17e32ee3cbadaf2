package com.automate.FindingSync.dto;

import java.util.List;

public record ComplianceSummary(
        List<ComplianceCategory> owasp,
        List<ComplianceCategory> cwe,
        List<ComplianceCategory> sans,
        List<String> otherTags,
        boolean hasComplianceData
) {
    public static ComplianceSummary of(List<ComplianceCategory> owasp, List<ComplianceCategory> cwe,
                                       List<ComplianceCategory> sans, List<String> otherTags) {
        return new ComplianceSummary(owasp, cwe, sans, otherTags,
                !owasp.isEmpty() || !cwe.isEmpty() || !sans.isEmpty());
    }

    /**
     * @param id          category identifier, e.g. a1-injection or CWE-89
     * @param label       display name
     * @param findingKeys keys of the findings counted, sorted
     */
    public record ComplianceCategory(String id, String label, int count, List<String> findingKeys) {}
}
