package com.automate.FindingSync.collector;

import com.automate.FindingSync.client.SonarClient;
import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.dto.RuleInfo;
import com.automate.FindingSync.dto.SonarQueryConfig;
import com.automate.FindingSync.exception.SonarApiException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.automate.FindingSync.collector.SonarParams.text;

@Slf4j
@Component
public class RuleCollector {

    static final String PATH = "/api/rules/search";

    /** Active rules keyed by rule key; a key seen twice keeps the later entry. */
    public Map<String, RuleInfo> collect(SonarClient client, SonarQueryConfig config, ReportOptions options) {
        Map<String, String> params = SonarParams.of(
                "activation", "true",
                "f", "name,htmlDesc,severity",
                "types", config.ruleTypes(),
                "organization", options.getOrganization());
        try {
            List<RuleInfo> rules = client.paginate(PATH, params, (page, results) -> {
                JsonNode items = page.path("rules");
                for (JsonNode r : items) {
                    results.add(new RuleInfo(text(r, "key"), text(r, "name"), text(r, "htmlDesc"), text(r, "severity")));
                }
                return items.size();
            });
            Map<String, RuleInfo> byKey = new LinkedHashMap<>();
            for (RuleInfo rule : rules) {
                byKey.put(rule.key(), rule);
            }
            log.info("Collected {} rules for {}", byKey.size(), options.getSonarComponent());
            return byKey;
        } catch (SonarApiException e) {
            throw SonarApiException.wrap("Failed to collect rules", e);
        }
    }
}
