package com.automate.FindingSync.utilities;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/** Deep links into the SonarQube UI. */
public final class SonarLinkUtil {

    private SonarLinkUtil() {
    }

    public static String issueLink(String baseUrl, String branch, String component, String issueKey) {
        return baseUrl + "/project/issues?" + branchParam(branch)
                + "id=" + enc(component)
                + "&issues=" + enc(issueKey)
                + "&open=" + enc(issueKey);
    }

    public static String hotspotLink(String baseUrl, String branch, String component, String hotspotKey) {
        return baseUrl + "/security_hotspots?" + branchParam(branch)
                + "id=" + enc(component)
                + "&hotspots=" + enc(hotspotKey);
    }

    /** Text after the last ':' of a component key, i.e. the file path. */
    public static String shortComponent(String componentKey) {
        if (componentKey == null) return null;
        int idx = componentKey.lastIndexOf(':');
        return idx < 0 ? componentKey : componentKey.substring(idx + 1);
    }

    private static String branchParam(String branch) {
        return branch == null || branch.isBlank() ? "" : "branch=" + enc(branch) + "&";
    }

    private static String enc(String v) {
        return v == null ? "" : URLEncoder.encode(v, StandardCharsets.UTF_8);
    }
}
