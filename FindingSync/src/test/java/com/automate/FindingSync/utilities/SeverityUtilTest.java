package com.automate.FindingSync.utilities;

import com.automate.FindingSync.dto.SeveritySummary;
import com.automate.FindingSync.dto.SonarFinding;
import com.automate.FindingSync.entity.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityUtilTest {

    @Test
    void blockerIsReportedAsHigh() {
        assertThat(SeverityUtil.issueLabel("BLOCKER")).isEqualTo("HIGH");
        assertThat(SeverityUtil.issueLabel("critical")).isEqualTo("CRITICAL");
        assertThat(SeverityUtil.issueLabel("MINOR")).isEqualTo("MINOR");
        assertThat(SeverityUtil.issueLabel("whatever")).isEqualTo("MAJOR");
        assertThat(SeverityUtil.issueLevel("BLOCKER")).isEqualTo(Severity.BLOCKER);
        assertThat(SeverityUtil.issueLevel(null)).isEqualTo(Severity.MAJOR);
    }

    @Test
    void hotspotProbabilityDefaultsToMedium() {
        assertThat(SeverityUtil.hotspotLabel("HIGH")).isEqualTo("HIGH");
        assertThat(SeverityUtil.hotspotLabel("low")).isEqualTo("LOW");
        assertThat(SeverityUtil.hotspotLabel(null)).isEqualTo("MEDIUM");
        assertThat(SeverityUtil.hotspotLevel("HIGH")).isEqualTo(Severity.CRITICAL);
        assertThat(SeverityUtil.hotspotLevel("LOW")).isEqualTo(Severity.MINOR);
    }

    @Test
    void summaryBucketsEveryLabel() {
        List<SonarFinding> findings = List.of(
                finding("HIGH"), finding("CRITICAL"), finding("BLOCKER"),
                finding("MEDIUM"), finding("MAJOR"),
                finding("LOW"), finding("MINOR"), finding("INFO"));

        assertThat(SeverityUtil.summarize(findings)).isEqualTo(new SeveritySummary(3, 2, 3, 8));
        assertThat(SeverityUtil.summarize(List.of())).isEqualTo(SeveritySummary.EMPTY);
    }

    private static SonarFinding finding(String severity) {
        return SonarFinding.builder().key(severity).severity(severity).build();
    }
}
