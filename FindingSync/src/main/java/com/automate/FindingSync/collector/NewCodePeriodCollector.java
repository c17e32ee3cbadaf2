package com.automate.FindingSync.collector;

import com.automate.FindingSync.client.SonarClient;
import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.exception.SonarApiException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.automate.FindingSync.collector.SonarParams.text;

@Component
public class NewCodePeriodCollector {

    static final String PATH = "/api/new_code_periods/list";

    /** "TYPE > value" of the first period definition, e.g. "NUMBER_OF_DAYS > 30". */
    public String collect(SonarClient client, ReportOptions options) {
        if (!options.isInNewCodePeriod()) {
            return null;
        }
        try {
            JsonNode first = client.get(PATH, Map.of("project", options.getSonarComponent()))
                    .path("newCodePeriods").path(0);
            String type = text(first, "type");
            if (type == null) return null;
            String value = text(first, "value");
            return value == null ? type : type + " > " + value;
        } catch (SonarApiException e) {
            throw SonarApiException.wrap("Failed to collect new code period", e);
        }
    }
}
