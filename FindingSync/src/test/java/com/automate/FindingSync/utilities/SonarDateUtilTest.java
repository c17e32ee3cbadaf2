package com.automate.FindingSync.utilities;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SonarDateUtilTest {

    @Test
    void acceptsSonarAndIsoOffsets() {
        Instant expected = Instant.parse("2024-01-10T10:00:00Z");
        assertThat(SonarDateUtil.parseSonarInstant("2024-01-10T10:00:00+0000")).isEqualTo(expected);
        assertThat(SonarDateUtil.parseSonarInstant("2024-01-10T12:00:00+02:00")).isEqualTo(expected);
        assertThat(SonarDateUtil.parseSonarInstant(String.valueOf(expected.toEpochMilli()))).isEqualTo(expected);
        assertThat(SonarDateUtil.parseSonarInstant("yesterday")).isNull();
    }

    @Test
    void formatsDayInUtcOrFallsBack() {
        assertThat(SonarDateUtil.formatDay("2024-01-10T23:30:00-0200", "n/a")).isEqualTo("2024-01-11");
        assertThat(SonarDateUtil.formatDay(null, "n/a")).isEqualTo("n/a");
    }

    @Test
    void linksCarryBranchAndEncodedKeys() {
        assertThat(SonarLinkUtil.issueLink("http://s", "dev", "my:app", "AX1"))
                .isEqualTo("http://s/project/issues?branch=dev&id=my%3Aapp&issues=AX1&open=AX1");
        assertThat(SonarLinkUtil.hotspotLink("http://s", null, "app", "H1"))
                .isEqualTo("http://s/security_hotspots?id=app&hotspots=H1");
        assertThat(SonarLinkUtil.shortComponent("my:app:src/Main.java")).isEqualTo("src/Main.java");
    }
}
