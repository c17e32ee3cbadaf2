package com.automate.FindingSync.Service;

import com.automate.FindingSync.client.SonarClient;
import com.automate.FindingSync.client.SonarClientFactory;
import com.automate.FindingSync.client.SonarConnection;
import com.automate.FindingSync.collector.CoverageCollector;
import com.automate.FindingSync.collector.HotspotCollector;
import com.automate.FindingSync.collector.IssueCollector;
import com.automate.FindingSync.collector.NewCodePeriodCollector;
import com.automate.FindingSync.collector.QualityGateCollector;
import com.automate.FindingSync.collector.RuleCollector;
import com.automate.FindingSync.dto.PortfolioReport;
import com.automate.FindingSync.dto.QualityGateStatus;
import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.dto.RuleInfo;
import com.automate.FindingSync.dto.SecurityReport;
import com.automate.FindingSync.dto.SeveritySummary;
import com.automate.FindingSync.dto.SonarFinding;
import com.automate.FindingSync.dto.SonarQueryConfig;
import com.automate.FindingSync.exception.SonarApiException;
import com.automate.FindingSync.utilities.ComplianceUtil;
import com.automate.FindingSync.utilities.SeverityUtil;
import com.automate.FindingSync.utilities.SonarVersionUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Strict one-shot collection of a project into a {@link SecurityReport}.
 * Unlike a sync nothing is stored, and any collector failure fails the report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    static final Comparator<SonarFinding> HIGHEST_SEVERITY_FIRST =
            Comparator.comparing(SonarFinding::getLevel, Comparator.nullsLast(Comparator.reverseOrder()));

    private final SonarClientFactory clientFactory;
    private final RuleCollector ruleCollector;
    private final IssueCollector issueCollector;
    private final HotspotCollector hotspotCollector;
    private final QualityGateCollector qualityGateCollector;
    private final CoverageCollector coverageCollector;
    private final NewCodePeriodCollector newCodePeriodCollector;
    private final TrendService trendService;
    private final List<ReportPublisher> publishers;
    private final Clock clock;

    public SecurityReport generateReport(SonarConnection connection, ReportOptions options) {
        SonarClient client = clientFactory.create(connection);
        String version = client.detectVersion();
        client.authenticate();
        SecurityReport report = collect(client, version, options);
        publish(report);
        return report;
    }

    /**
     * Collects several projects of one server with a single login. A project
     * that fails is recorded with its error; the others still run.
     *
     * @param template options applied to every project; its component is replaced
     */
    public PortfolioReport generatePortfolioReport(SonarConnection connection, String name,
                                                   List<String> components, ReportOptions template) {
        SonarClient client = clientFactory.create(connection);
        String version = client.detectVersion();
        client.authenticate();

        List<PortfolioReport.Entry> entries = new ArrayList<>();
        for (String component : components) {
            try {
                ReportOptions options = template.toBuilder()
                        .sonarComponent(component)
                        .projectName(null)
                        .build();
                entries.add(PortfolioReport.Entry.builder()
                        .sonarComponent(component)
                        .success(true)
                        .report(collect(client, version, options))
                        .build());
            } catch (SonarApiException e) {
                log.warn("Portfolio {}: project {} failed: kind={}, status={}, msg={}",
                        name, component, e.getKind(), e.getStatusCode(), e.getMessage());
                entries.add(PortfolioReport.Entry.builder()
                        .sonarComponent(component)
                        .success(false)
                        .error(e.getMessage())
                        .errorKind(e.getKind().name())
                        .build());
            }
        }

        PortfolioReport portfolio = aggregate(name, client.getBaseUrl(), entries);
        for (ReportPublisher publisher : publishers) {
            try {
                publisher.publishPortfolio(portfolio);
            } catch (RuntimeException e) {
                log.warn("Report publisher {} failed for portfolio {}", publisher.getClass().getSimpleName(), name, e);
            }
        }
        return portfolio;
    }

    private SecurityReport collect(SonarClient client, String version, ReportOptions options) {
        SonarQueryConfig config = SonarVersionUtil.resolve(version, options);

        Map<String, RuleInfo> rules = ruleCollector.collect(client, config, options);
        List<SonarFinding> issues = issueCollector.collect(client, config, options, rules);
        List<SonarFinding> hotspots = hotspotCollector.collect(client, config, options);
        QualityGateStatus gate = qualityGateCollector.collect(client, options);
        Double coverage = coverageCollector.collect(client, options);
        String newCodePeriod = newCodePeriodCollector.collect(client, options);

        List<SonarFinding> findings = new ArrayList<>(issues.size() + hotspots.size());
        findings.addAll(issues);
        findings.addAll(hotspots);
        findings.sort(HIGHEST_SEVERITY_FIRST);

        SecurityReport report = SecurityReport.builder()
                .generatedAt(Instant.now(clock))
                .projectName(options.getProjectName())
                .applicationName(options.getApplicationName())
                .releaseName(options.getReleaseName())
                .sonarBaseUrl(client.getBaseUrl())
                .sonarComponent(options.getSonarComponent())
                .branch(options.getBranch())
                .pullRequest(options.getPullRequest())
                .organization(options.getOrganization())
                .serverVersion(version)
                .inNewCodePeriod(options.isInNewCodePeriod())
                .newCodePeriod(newCodePeriod)
                .rules(selectRules(rules, findings, options))
                .findings(findings)
                .summary(SeverityUtil.summarize(findings))
                .compliance(options.isIncludeCompliance() ? ComplianceUtil.classify(findings) : null)
                .qualityGate(gate)
                .coverage(coverage)
                .build();

        if (options.isSaveTrendData()) {
            trendService.appendSnapshot(options.getSonarComponent(), trendService.snapshotOf(report));
        }
        if (options.isIncludeTrends()) {
            report.setTrendAnalysis(trendService.computeTrend(
                    trendService.loadHistory(options.getSonarComponent(), options.getTrendPeriodDays())));
        }
        log.info("Report for {} built: {} issue(s), {} hotspot(s)",
                options.getSonarComponent(), issues.size(), hotspots.size());
        return report;
    }

    static List<RuleInfo> selectRules(Map<String, RuleInfo> rules, List<SonarFinding> findings, ReportOptions options) {
        if (!options.isRulesInReport()) {
            return null;
        }
        if (!options.isOnlyDetectedRules()) {
            return new ArrayList<>(rules.values());
        }
        Set<String> detected = findings.stream()
                .map(SonarFinding::getRuleKey)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return rules.values().stream().filter(r -> detected.contains(r.key())).toList();
    }

    private PortfolioReport aggregate(String name, String baseUrl, List<PortfolioReport.Entry> entries) {
        SeveritySummary totals = SeveritySummary.EMPTY;
        double coverageSum = 0;
        int coverageCount = 0;
        int passed = 0;
        int failedGates = 0;
        int failedProjects = 0;
        for (PortfolioReport.Entry entry : entries) {
            if (!entry.isSuccess()) {
                failedProjects++;
                continue;
            }
            SecurityReport r = entry.getReport();
            totals = totals.plus(r.getSummary());
            if (r.getCoverage() != null) {
                coverageSum += r.getCoverage();
                coverageCount++;
            }
            if (r.getQualityGate() != null) {
                if ("OK".equals(r.getQualityGate().status())) passed++;
                else if ("ERROR".equals(r.getQualityGate().status())) failedGates++;
            }
        }
        return PortfolioReport.builder()
                .generatedAt(Instant.now(clock))
                .name(name)
                .sonarBaseUrl(baseUrl)
                .projects(entries)
                .totals(totals)
                .averageCoverage(coverageCount == 0 ? null : Math.round(coverageSum / coverageCount * 10.0) / 10.0)
                .gatesPassed(passed)
                .gatesFailed(failedGates)
                .projectsFailed(failedProjects)
                .build();
    }

    private void publish(SecurityReport report) {
        for (ReportPublisher publisher : publishers) {
            try {
                publisher.publish(report);
            } catch (RuntimeException e) {
                log.warn("Report publisher {} failed for {}", publisher.getClass().getSimpleName(),
                        report.getSonarComponent(), e);
            }
        }
    }
}
