package com.automate.FindingSync.utilities;

import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.dto.SonarQueryConfig;

/**
 * Maps a server version to the query filters it supports. Ranges are
 * half-open and checked in order; anything unmatched gets the base set.
 */
public final class SonarVersionUtil {

    private static final String OPEN_STATUSES = "OPEN,CONFIRMED,REOPENED";
    private static final String HOTSPOT_STATUSES = "TO_REVIEW";

    static final SonarQueryConfig BASE = new SonarQueryConfig(
            "VULNERABILITY", "VULNERABILITY", OPEN_STATUSES, HOTSPOT_STATUSES);

    // hotspots were reported as issues before 8.0
    static final SonarQueryConfig HOTSPOTS_AS_ISSUES = new SonarQueryConfig(
            "VULNERABILITY,SECURITY_HOTSPOT", "VULNERABILITY,SECURITY_HOTSPOT", OPEN_STATUSES, HOTSPOT_STATUSES);

    static final SonarQueryConfig HOTSPOTS_AS_ISSUES_TO_REVIEW = new SonarQueryConfig(
            "VULNERABILITY,SECURITY_HOTSPOT", "VULNERABILITY,SECURITY_HOTSPOT", OPEN_STATUSES + ",TO_REVIEW", HOTSPOT_STATUSES);

    static final SonarQueryConfig HOTSPOT_RULES_ONLY = new SonarQueryConfig(
            "VULNERABILITY", "VULNERABILITY,SECURITY_HOTSPOT", OPEN_STATUSES, HOTSPOT_STATUSES);

    private static final SonarVersion V7_3 = SonarVersion.of(7, 3);
    private static final SonarVersion V7_8 = SonarVersion.of(7, 8);
    private static final SonarVersion V8_0 = SonarVersion.of(8, 0);

    private SonarVersionUtil() {
    }

    public static SonarQueryConfig resolve(String serverVersion) {
        SonarVersion version = SonarVersion.parse(serverVersion);
        if (version == null) return BASE;
        if (version.within(V7_3, V7_8)) return HOTSPOTS_AS_ISSUES;
        if (version.within(V7_8, V8_0)) return HOTSPOTS_AS_ISSUES_TO_REVIEW;
        if (version.atLeast(V8_0)) return HOTSPOT_RULES_ONLY;
        return BASE;
    }

    /** Version filters with the report options that widen them applied on top. */
    public static SonarQueryConfig resolve(String serverVersion, ReportOptions options) {
        SonarQueryConfig config = resolve(serverVersion);
        if (options.isAllBugs()) config = config.withAllBugs();
        if (options.isFixMissingRule()) config = config.withoutRuleTypeFilter();
        return config;
    }
}
