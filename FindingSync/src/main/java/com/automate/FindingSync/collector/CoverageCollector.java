package com.automate.FindingSync.collector;

import com.automate.FindingSync.client.SonarClient;
import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.exception.SonarApiException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class CoverageCollector {

    static final String PATH = "/api/measures/component";

    /** Line coverage percentage, 0 when the project has no measure, null when not requested. */
    public Double collect(SonarClient client, ReportOptions options) {
        if (!options.isCoverage()) {
            return null;
        }
        Map<String, String> params = SonarParams.of(
                "component", options.getSonarComponent(),
                "metricKeys", "coverage");
        SonarParams.scope(params, options);
        try {
            JsonNode value = client.get(PATH, params).path("component").path("measures").path(0).path("value");
            return value.isMissingNode() || value.isNull() ? 0.0 : value.asDouble(0.0);
        } catch (SonarApiException e) {
            throw SonarApiException.wrap("Failed to collect coverage", e);
        }
    }
}
