package com.automate.FindingSync.collector;

import com.automate.FindingSync.client.SonarClient;
import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.dto.SonarFinding;
import com.automate.FindingSync.dto.SonarQueryConfig;
import com.automate.FindingSync.entity.FindingType;
import com.automate.FindingSync.exception.SonarApiException;
import com.automate.FindingSync.utilities.SeverityUtil;
import com.automate.FindingSync.utilities.SonarLinkUtil;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.automate.FindingSync.collector.SonarParams.integer;
import static com.automate.FindingSync.collector.SonarParams.text;

/**
 * Hotspots are fetched in two phases: the keys from the search endpoint,
 * then one detail call per key.
 */
@Slf4j
@Component
public class HotspotCollector {

    static final String SEARCH_PATH = "/api/hotspots/search";
    static final String SHOW_PATH = "/api/hotspots/show";

    public List<SonarFinding> collect(SonarClient client, SonarQueryConfig config, ReportOptions options) {
        if (!options.isSecurityHotspots()) {
            return List.of();
        }
        Map<String, String> params = SonarParams.of(
                "projectKey", options.getSonarComponent(),
                "status", config.hotspotStatuses(),
                "organization", options.getOrganization());
        if (options.isInNewCodePeriod()) params.put("inNewCodePeriod", "true");
        SonarParams.scope(params, options);

        try {
            List<String> keys = client.paginate(SEARCH_PATH, params, (page, results) -> {
                JsonNode items = page.path("hotspots");
                for (JsonNode h : items) {
                    results.add(text(h, "key"));
                }
                return items.size();
            });

            List<SonarFinding> hotspots = new ArrayList<>(keys.size());
            for (String key : keys) {
                JsonNode detail = client.get(SHOW_PATH, Map.of("hotspot", key));
                hotspots.add(toFinding(detail, client.getBaseUrl(), options));
            }
            log.info("Collected {} hotspots for {}", hotspots.size(), options.getSonarComponent());
            return hotspots;
        } catch (SonarApiException e) {
            throw SonarApiException.wrap("Failed to collect hotspots", e);
        }
    }

    static SonarFinding toFinding(JsonNode hotspot, String baseUrl, ReportOptions options) {
        JsonNode rule = hotspot.path("rule");
        String probability = text(rule, "vulnerabilityProbability");
        if (probability == null) probability = text(hotspot, "vulnerabilityProbability");
        String label = SeverityUtil.hotspotLabel(probability);

        JsonNode componentNode = hotspot.path("component");
        String component = componentNode.isObject() ? text(componentNode, "key") : text(hotspot, "component");

        List<String> tags = new ArrayList<>();
        hotspot.path("tags").forEach(t -> tags.add(t.asText()));

        String key = text(hotspot, "key");
        String ruleName = text(rule, "name");
        return SonarFinding.builder()
                .key(key)
                .ruleKey(text(rule, "key"))
                .ruleName(ruleName != null ? ruleName : "/")
                .severity(label)
                .level(SeverityUtil.hotspotLevel(label))
                .type(FindingType.SECURITY_HOTSPOT)
                .status(text(hotspot, "status"))
                .resolution(text(hotspot, "resolution"))
                .component(SonarLinkUtil.shortComponent(component))
                .line(integer(hotspot, "line"))
                .message(text(hotspot, "message"))
                .link(SonarLinkUtil.hotspotLink(baseUrl, options.getBranch(), options.getSonarComponent(), key))
                .tags(tags)
                .build();
    }
}
