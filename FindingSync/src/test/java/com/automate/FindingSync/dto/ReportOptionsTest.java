package com.automate.FindingSync.dto;

import com.automate.FindingSync.exception.SonarApiException;
import com.automate.FindingSync.exception.SonarErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportOptionsTest {

    @Test
    void defaultsApplyAndProjectNameFallsBackToComponent() {
        ReportOptions options = ReportOptions.builder().sonarComponent(" my:app ").branch("").build();

        assertThat(options.getSonarComponent()).isEqualTo("my:app");
        assertThat(options.getProjectName()).isEqualTo("my:app");
        assertThat(options.getBranch()).isNull();
        assertThat(options.isSecurityHotspots()).isTrue();
        assertThat(options.isRulesInReport()).isTrue();
        assertThat(options.isIncludeCompliance()).isTrue();
        assertThat(options.isQualityGateStatus()).isFalse();
        assertThat(options.getTrendPeriodDays()).isEqualTo(ReportOptions.DEFAULT_TREND_PERIOD_DAYS);
    }

    @Test
    void componentIsRequired() {
        assertValidationError(ReportOptions.builder(), "sonarComponent is required");
    }

    @Test
    void conflictingOptionsAreRejected() {
        assertValidationError(ReportOptions.builder().sonarComponent("a").branch("dev").pullRequest("12"),
                "branch and pullRequest cannot be used together");
        assertValidationError(ReportOptions.builder().sonarComponent("a").rulesInReport(false).onlyDetectedRules(true),
                "onlyDetectedRules requires rulesInReport");
        assertValidationError(ReportOptions.builder().sonarComponent("a").allBugs(true).fixMissingRule(true),
                "allBugs and fixMissingRule cannot be used together");
        assertValidationError(ReportOptions.builder().sonarComponent("a").trendPeriodDays(0),
                "trendPeriodDays must be at least 1");
    }

    @Test
    void toBuilderRevalidates() {
        ReportOptions base = ReportOptions.builder().sonarComponent("a").projectName("A").build();

        ReportOptions other = base.toBuilder().sonarComponent("b").projectName(null).build();

        assertThat(other.getProjectName()).isEqualTo("b");
    }

    private static void assertValidationError(ReportOptions.ReportOptionsBuilder builder, String message) {
        assertThatThrownBy(builder::build)
                .isInstanceOfSatisfying(SonarApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(SonarErrorKind.VALIDATION);
                    assertThat(e.getMessage()).isEqualTo(message);
                });
    }
}
