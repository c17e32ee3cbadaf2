package com.automate.FindingSync.utilities;

import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.dto.SonarQueryConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SonarVersionUtilTest {

    @Test
    void parsesLeadingVersionFromFreeText() {
        assertThat(SonarVersion.parse("10.3.0.82913")).isEqualTo(new SonarVersion(10, 3, 0));
        assertThat(SonarVersion.parse("v7.8")).isEqualTo(new SonarVersion(7, 8, 0));
        assertThat(SonarVersion.parse("9")).isEqualTo(new SonarVersion(9, 0, 0));
        assertThat(SonarVersion.parse("unknown")).isNull();
        assertThat(SonarVersion.parse(null)).isNull();
    }

    @Test
    void rangesAreHalfOpen() {
        SonarVersion v78 = SonarVersion.of(7, 8);
        assertThat(v78.within(SonarVersion.of(7, 3), SonarVersion.of(7, 8))).isFalse();
        assertThat(v78.within(SonarVersion.of(7, 8), SonarVersion.of(8, 0))).isTrue();
    }

    @Test
    void selectsFiltersPerVersionBand() {
        assertThat(SonarVersionUtil.resolve("7.5.0")).isEqualTo(SonarVersionUtil.HOTSPOTS_AS_ISSUES);
        assertThat(SonarVersionUtil.resolve("7.8.5")).isEqualTo(SonarVersionUtil.HOTSPOTS_AS_ISSUES_TO_REVIEW);
        assertThat(SonarVersionUtil.resolve("7.9.6.1234").issueStatuses()).endsWith(",TO_REVIEW");
        assertThat(SonarVersionUtil.resolve("8.0")).isEqualTo(SonarVersionUtil.HOTSPOT_RULES_ONLY);
        assertThat(SonarVersionUtil.resolve("10.3.0.82913")).isEqualTo(SonarVersionUtil.HOTSPOT_RULES_ONLY);
    }

    @Test
    void oldOrUnparsableVersionsGetTheBaseFilters() {
        assertThat(SonarVersionUtil.resolve("6.7")).isEqualTo(SonarVersionUtil.BASE);
        assertThat(SonarVersionUtil.resolve("garbage")).isEqualTo(SonarVersionUtil.BASE);
        assertThat(SonarVersionUtil.resolve(null)).isEqualTo(SonarVersionUtil.BASE);
    }

    @Test
    void allBugsWidensIssueAndRuleTypes() {
        ReportOptions options = ReportOptions.builder().sonarComponent("app").allBugs(true).build();

        SonarQueryConfig config = SonarVersionUtil.resolve("10.3", options);

        assertThat(config.issueTypes()).isEqualTo("VULNERABILITY,BUG");
        assertThat(config.ruleTypes()).isEqualTo("VULNERABILITY,SECURITY_HOTSPOT,BUG");
    }

    @Test
    void fixMissingRuleDropsTheRuleTypeFilter() {
        ReportOptions options = ReportOptions.builder().sonarComponent("app").fixMissingRule(true).build();

        SonarQueryConfig config = SonarVersionUtil.resolve("10.3", options);

        assertThat(config.ruleTypes()).isNull();
        assertThat(config.issueTypes()).isEqualTo("VULNERABILITY");
    }
}
