package com.automate.FindingSync.collector;

import com.automate.FindingSync.dto.ReportOptions;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/** Small helpers shared by the collectors. */
final class SonarParams {

    private SonarParams() {
    }

    static Map<String, String> of(String... keyValues) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            put(params, keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    static void put(Map<String, String> params, String key, String value) {
        if (value != null && !value.isBlank()) params.put(key, value);
    }

    /** branch or pullRequest, whichever the options name. */
    static void scope(Map<String, String> params, ReportOptions options) {
        put(params, "branch", options.getBranch());
        put(params, "pullRequest", options.getPullRequest());
    }

    static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isMissingNode() || v.isNull() ? null : v.asText();
    }

    static Integer integer(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isNumber() ? v.asInt() : null;
    }
}
