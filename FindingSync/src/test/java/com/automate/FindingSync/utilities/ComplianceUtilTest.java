package com.automate.FindingSync.utilities;

import com.automate.FindingSync.dto.ComplianceSummary;
import com.automate.FindingSync.dto.ComplianceSummary.ComplianceCategory;
import com.automate.FindingSync.dto.SonarFinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceUtilTest {

    @Test
    void owaspNumberWinsOverKeywords() {
        assertThat(ComplianceUtil.owaspCategory("owasp-a10")).isEqualTo("a10-insufficient-logging");
        assertThat(ComplianceUtil.owaspCategory("owasp-a1")).isEqualTo("a1-injection");
        assertThat(ComplianceUtil.owaspCategory("owasp-a3")).isEqualTo("a3-sensitive-data-exposure");
        assertThat(ComplianceUtil.owaspCategory("owasp-xss")).isEqualTo("a7-xss");
        assertThat(ComplianceUtil.owaspCategory("owasp-unknown")).isNull();
    }

    @Test
    void extractsCweAndSansIdentifiers() {
        assertThat(ComplianceUtil.cweId("cwe-089")).isEqualTo("CWE-89");
        assertThat(ComplianceUtil.cweId("CWE79")).isEqualTo("CWE-79");
        assertThat(ComplianceUtil.cweId("cwe")).isNull();
        assertThat(ComplianceUtil.sansId("sans-top25")).isEqualTo("SANS-25");
        assertThat(ComplianceUtil.sansId("sans-top25-porous")).isEqualTo("SANS-25-POROUS");
    }

    @Test
    void countsDistinctFindingsPerCategory() {
        List<SonarFinding> findings = List.of(
                finding("A", "owasp-a1", "cwe-89", "cwe-89", "sans-top25-insecure"),
                finding("B", "owasp-a1", "cwe-79", "spring"),
                finding("C", "owasp-a7", "cwe-79"));

        ComplianceSummary summary = ComplianceUtil.classify(findings);

        assertThat(summary.hasComplianceData()).isTrue();
        assertThat(summary.owasp()).extracting(ComplianceCategory::id).containsExactly("a1-injection", "a7-xss");
        assertThat(summary.owasp().get(0).count()).isEqualTo(2);
        assertThat(summary.owasp().get(0).label()).isEqualTo("A1 INJECTION");
        assertThat(summary.cwe()).extracting(ComplianceCategory::id).containsExactly("CWE-79", "CWE-89");
        assertThat(summary.cwe().get(1).findingKeys()).containsExactly("A");
        assertThat(summary.sans()).extracting(ComplianceCategory::id).containsExactly("SANS-25-INSECURE");
        assertThat(summary.otherTags()).containsExactly("spring");
    }

    @Test
    void plainTagsGoToOtherTagsAndUnknownFrameworkTagsAreDropped() {
        ComplianceSummary summary = ComplianceUtil.classify(List.of(
                finding("A", "owasp-a1-injection", "cwe-89", "needs-review"),
                finding("B", "owasp-top-10", "cwe", "sans-top")));

        assertThat(summary.owasp()).extracting(ComplianceCategory::id).containsExactly("a1-injection");
        assertThat(summary.cwe()).extracting(ComplianceCategory::id).containsExactly("CWE-89");
        assertThat(summary.sans()).isEmpty();
        assertThat(summary.otherTags()).containsExactly("needs-review");
    }

    @Test
    void untaggedFindingsHaveNoComplianceData() {
        ComplianceSummary summary = ComplianceUtil.classify(List.of(finding("A")));

        assertThat(summary.hasComplianceData()).isFalse();
        assertThat(summary.owasp()).isEmpty();
    }

    private static SonarFinding finding(String key, String... tags) {
        return SonarFinding.builder().key(key).tags(List.of(tags)).build();
    }
}
