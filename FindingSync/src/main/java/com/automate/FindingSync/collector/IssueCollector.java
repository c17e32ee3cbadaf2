package com.automate.FindingSync.collector;

import com.automate.FindingSync.client.SonarClient;
import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.dto.RuleInfo;
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

@Slf4j
@Component
public class IssueCollector {

    static final String PATH = "/api/issues/search";

    public List<SonarFinding> collect(SonarClient client, SonarQueryConfig config, ReportOptions options,
                                      Map<String, RuleInfo> rules) {
        Map<String, String> params = SonarParams.of(
                "componentKeys", options.getSonarComponent(),
                "statuses", config.issueStatuses(),
                "resolved", "false",
                "types", config.issueTypes(),
                "s", "STATUS",
                "asc", "no",
                "organization", options.getOrganization());
        if (options.isInNewCodePeriod()) params.put("inNewCodePeriod", "true");
        SonarParams.scope(params, options);

        try {
            List<SonarFinding> issues = client.paginate(PATH, params, (page, results) -> {
                JsonNode items = page.path("issues");
                for (JsonNode issue : items) {
                    results.add(toFinding(issue, rules, client.getBaseUrl(), options));
                }
                return items.size();
            });
            log.info("Collected {} issues for {}", issues.size(), options.getSonarComponent());
            return issues;
        } catch (SonarApiException e) {
            throw SonarApiException.wrap("Failed to collect issues", e);
        }
    }

    static SonarFinding toFinding(JsonNode issue, Map<String, RuleInfo> rules, String baseUrl, ReportOptions options) {
        String ruleKey = text(issue, "rule");
        RuleInfo rule = ruleKey == null ? null : rules.get(ruleKey);
        String rawSeverity = text(issue, "severity");
        if (rawSeverity == null && rule != null) rawSeverity = rule.severity();

        String key = text(issue, "key");
        Integer line = integer(issue, "line");
        if (line == null) line = integer(issue.path("textRange"), "startLine");

        List<String> tags = new ArrayList<>();
        issue.path("tags").forEach(t -> tags.add(t.asText()));

        return SonarFinding.builder()
                .key(key)
                .ruleKey(ruleKey)
                .ruleName(rule != null && rule.name() != null ? rule.name() : "/")
                .severity(SeverityUtil.issueLabel(rawSeverity))
                .level(SeverityUtil.issueLevel(rawSeverity))
                .type(FindingType.fromSonar(text(issue, "type")))
                .status(text(issue, "status"))
                .resolution(text(issue, "resolution"))
                .component(SonarLinkUtil.shortComponent(text(issue, "component")))
                .line(line)
                .message(text(issue, "message"))
                .link(SonarLinkUtil.issueLink(baseUrl, options.getBranch(), options.getSonarComponent(), key))
                .effort(text(issue, "effort"))
                .debt(text(issue, "debt"))
                .tags(tags)
                .build();
    }
}
