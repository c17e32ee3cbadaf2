package com.automate.FindingSync.collector;

import com.automate.FindingSync.client.SonarClient;
import com.automate.FindingSync.dto.QualityGateStatus;
import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.exception.SonarApiException;
import com.automate.FindingSync.utilities.SonarDateUtil;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.automate.FindingSync.collector.SonarParams.text;

@Slf4j
@Component
public class QualityGateCollector {

    static final String PATH = "/api/qualitygates/project_status";

    /** @return the gate, or null when the options do not ask for it */
    public QualityGateStatus collect(SonarClient client, ReportOptions options) {
        if (!options.isQualityGateStatus()) {
            return null;
        }
        Map<String, String> params = SonarParams.of("projectKey", options.getSonarComponent());
        SonarParams.scope(params, options);
        try {
            JsonNode projectStatus = client.get(PATH, params).path("projectStatus");
            QualityGateStatus gate = toStatus(projectStatus);
            log.info("Quality gate for {}: {}", options.getSonarComponent(), gate.status());
            return gate;
        } catch (SonarApiException e) {
            throw SonarApiException.wrap("Failed to collect quality gate status", e);
        }
    }

    static QualityGateStatus toStatus(JsonNode projectStatus) {
        List<QualityGateStatus.Condition> conditions = new ArrayList<>();
        for (JsonNode c : projectStatus.path("conditions")) {
            String metricKey = text(c, "metricKey");
            String displayKey = metricKey == null ? null : metricKey.replace('_', ' ');
            boolean percentage = displayKey != null && displayKey.contains("duplicated lines density");
            conditions.add(new QualityGateStatus.Condition(
                    text(c, "status"),
                    displayKey,
                    text(c, "comparator"),
                    displayValue(text(c, "errorThreshold"), percentage),
                    displayValue(text(c, "actualValue"), percentage)));
        }

        String periodDate = text(projectStatus.path("period"), "date");
        if (periodDate == null) periodDate = text(projectStatus.path("periods").path(0), "date");

        String status = text(projectStatus, "status");
        return new QualityGateStatus(
                status != null ? status : "NONE",
                conditions,
                SonarDateUtil.formatDay(periodDate, "N/A"));
    }

    /** Rating codes 1..4 read as A..D; anything else is kept as sent. */
    static String displayValue(String raw, boolean percentage) {
        if (raw == null) return null;
        if (percentage) return raw + "%";
        String val = raw.trim();
        if (val.endsWith(".0")) {
            val = val.substring(0, val.length() - 2);
        }
        return switch (val) {
            case "1" -> "A";
            case "2" -> "B";
            case "3" -> "C";
            case "4" -> "D";
            default -> raw;
        };
    }
}
