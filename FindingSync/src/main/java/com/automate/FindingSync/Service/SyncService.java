package com.automate.FindingSync.Service;

import com.automate.FindingSync.Config.SyncProperties;
import com.automate.FindingSync.Config.SyncProperties.ConcurrentRunPolicy;
import com.automate.FindingSync.client.SonarClient;
import com.automate.FindingSync.client.SonarClientFactory;
import com.automate.FindingSync.client.SonarConnection;
import com.automate.FindingSync.collector.CoverageCollector;
import com.automate.FindingSync.collector.HotspotCollector;
import com.automate.FindingSync.collector.IssueCollector;
import com.automate.FindingSync.collector.QualityGateCollector;
import com.automate.FindingSync.collector.RuleCollector;
import com.automate.FindingSync.dto.QualityGateStatus;
import com.automate.FindingSync.dto.ReportOptions;
import com.automate.FindingSync.dto.RuleInfo;
import com.automate.FindingSync.dto.SonarFinding;
import com.automate.FindingSync.dto.SonarQueryConfig;
import com.automate.FindingSync.dto.SyncResult;
import com.automate.FindingSync.dto.SyncStatus;
import com.automate.FindingSync.entity.ProjectsEntity;
import com.automate.FindingSync.entity.ScansEntity;
import com.automate.FindingSync.entity.SyncExecutionEntity;
import com.automate.FindingSync.exception.ProjectNotFoundException;
import com.automate.FindingSync.exception.SonarApiException;
import com.automate.FindingSync.exception.SonarErrorKind;
import com.automate.FindingSync.exception.SyncConflictException;
import com.automate.FindingSync.repository.ProjectsRepository;
import com.automate.FindingSync.repository.SyncExecutionRepository;
import com.automate.FindingSync.utilities.ComplianceUtil;
import com.automate.FindingSync.utilities.SeverityUtil;
import com.automate.FindingSync.utilities.SonarVersionUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Pulls one project's findings from its server and reconciles them with the
 * local store. Runs of the same project never overlap.
 */
@Slf4j
@Service
public class SyncService {

    private final ProjectsRepository projectsRepository;
    private final SyncExecutionRepository executionRepository;
    private final ReconciliationService reconciliationService;
    private final TrendService trendService;
    private final SyncRunRegistry registry;
    private final SonarClientFactory clientFactory;
    private final RuleCollector ruleCollector;
    private final IssueCollector issueCollector;
    private final HotspotCollector hotspotCollector;
    private final QualityGateCollector qualityGateCollector;
    private final CoverageCollector coverageCollector;
    private final SyncProperties props;
    private final Executor syncExecutor;
    private final Clock clock;

    public SyncService(ProjectsRepository projectsRepository,
                       SyncExecutionRepository executionRepository,
                       ReconciliationService reconciliationService,
                       TrendService trendService,
                       SyncRunRegistry registry,
                       SonarClientFactory clientFactory,
                       RuleCollector ruleCollector,
                       IssueCollector issueCollector,
                       HotspotCollector hotspotCollector,
                       QualityGateCollector qualityGateCollector,
                       CoverageCollector coverageCollector,
                       SyncProperties props,
                       @Qualifier("syncExecutor") Executor syncExecutor,
                       Clock clock) {
        this.projectsRepository = projectsRepository;
        this.executionRepository = executionRepository;
        this.reconciliationService = reconciliationService;
        this.trendService = trendService;
        this.registry = registry;
        this.clientFactory = clientFactory;
        this.ruleCollector = ruleCollector;
        this.issueCollector = issueCollector;
        this.hotspotCollector = hotspotCollector;
        this.qualityGateCollector = qualityGateCollector;
        this.coverageCollector = coverageCollector;
        this.props = props;
        this.syncExecutor = syncExecutor;
        this.clock = clock;
    }

    /**
     * Runs a sync on the calling thread. When the project is already syncing,
     * REJECT returns a failed result and COALESCE waits for the running one.
     */
    public SyncResult syncProject(UUID projectId) {
        CompletableFuture<SyncResult> running = registry.tryStart(projectId);
        if (running != null) {
            if (props.getConcurrentRunPolicy() == ConcurrentRunPolicy.COALESCE) {
                log.info("Sync already running for project {}, waiting for it", projectId);
                return running.join();
            }
            log.warn("Sync already running for project {}, request rejected", projectId);
            return SyncResult.rejected(projectId, "Sync already running for project " + projectId);
        }
        return runClaimed(projectId);
    }

    public CompletableFuture<SyncResult> syncProjectAsync(UUID projectId) {
        return CompletableFuture.supplyAsync(() -> syncProject(projectId), syncExecutor);
    }

    /**
     * Claims the project and hands the run to the sync executor.
     *
     * @throws SyncConflictException when a run is in flight and the policy is REJECT
     */
    public SyncStatus triggerSync(UUID projectId) {
        if (!projectsRepository.existsById(projectId)) {
            throw new ProjectNotFoundException(projectId);
        }
        CompletableFuture<SyncResult> running = registry.tryStart(projectId);
        if (running != null) {
            if (props.getConcurrentRunPolicy() == ConcurrentRunPolicy.REJECT) {
                throw new SyncConflictException(projectId);
            }
            return registry.status(projectId);
        }
        try {
            syncExecutor.execute(() -> runClaimed(projectId));
        } catch (TaskRejectedException e) {
            log.error("Sync executor rejected project {}", projectId, e);
            registry.finish(projectId, SyncResult.failure(projectId, null, e, 0));
            throw e;
        }
        return registry.status(projectId);
    }

    /** Sequential sync of every enabled project. */
    public List<SyncResult> syncAllProjects() {
        List<ProjectsEntity> projects = projectsRepository.findBySyncEnabledTrue();
        log.info("Starting sync for {} project(s)", projects.size());
        List<SyncResult> results = new ArrayList<>();
        for (ProjectsEntity project : projects) {
            results.add(syncProject(project.getProjectId()));
        }
        return results;
    }

    public SyncStatus getSyncStatus(UUID projectId) {
        return registry.status(projectId);
    }

    public Map<UUID, SyncStatus> getAllSyncStatuses() {
        return registry.all();
    }

    private SyncResult runClaimed(UUID projectId) {
        Instant startedAt = now();
        long t0 = System.nanoTime();
        String projectName = null;
        SyncResult result;
        try {
            ProjectsEntity project = projectsRepository.findById(projectId)
                    .orElseThrow(() -> new ProjectNotFoundException(projectId));
            projectName = project.getName();
            result = execute(project, startedAt);
            result.setDurationMs(elapsedMs(t0));
            log.info("Completed sync for {} in {}ms: {} issue(s), {} hotspot(s), {} stale",
                    projectName, result.getDurationMs(), result.getIssuesFound(),
                    result.getHotspotsFound(), result.getStaleMarked());
        } catch (SonarApiException e) {
            log.error("Sync failed for project {} ({}): kind={}, status={}, endpoint={}, msg={}, bodyPreview={}",
                    projectId, projectName, e.getKind(), e.getStatusCode(), e.getEndpoint(),
                    e.getMessage(), e.bodyPreview());
            result = SyncResult.failure(projectId, projectName, e, elapsedMs(t0));
        } catch (RuntimeException e) {
            log.error("Sync failed for project {} ({})", projectId, projectName, e);
            result = SyncResult.failure(projectId, projectName, e, elapsedMs(t0));
        }

        try {
            recordExecution(result, startedAt);
        } catch (RuntimeException e) {
            log.error("Failed to record sync execution for project {}", projectId, e);
        } finally {
            registry.finish(projectId, result);
        }
        return result;
    }

    private SyncResult execute(ProjectsEntity project, Instant startedAt) {
        UUID projectId = project.getProjectId();
        log.info("Starting sync for project {} ({})", project.getName(), project.getSonarComponent());

        registry.progress(projectId, 5, "Validating connection");
        SonarConnection connection = connectionOf(project);
        if (!connection.hasCredentials()) {
            throw SonarApiException.validation("Project " + project.getName() + " has no token or username/password");
        }
        ReportOptions options = ReportOptions.builder()
                .sonarComponent(project.getSonarComponent())
                .projectName(project.getName())
                .branch(project.getBranch())
                .organization(project.getSonarOrganization())
                .securityHotspots(true)
                .qualityGateStatus(true)
                .coverage(true)
                .build();
        SonarClient client = clientFactory.create(connection);

        registry.progress(projectId, 10, "Detecting server version");
        String version = client.detectVersion();
        SonarQueryConfig config = SonarVersionUtil.resolve(version, options);
        log.info("Server version {} for {}", version, connection.baseUrl());

        registry.progress(projectId, 20, "Authenticating");
        client.authenticate();

        registry.progress(projectId, 30, "Fetching rules");
        Map<String, RuleInfo> rules = ruleCollector.collect(client, config, options);

        registry.progress(projectId, 45, "Fetching issues");
        List<SonarFinding> issues = issueCollector.collect(client, config, options, rules);

        registry.progress(projectId, 60, "Fetching hotspots");
        boolean hotspotsDegraded = false;
        List<SonarFinding> hotspots;
        try {
            hotspots = hotspotCollector.collect(client, config, options);
        } catch (SonarApiException e) {
            if (e.getKind() == SonarErrorKind.AUTHENTICATION || e.getKind() == SonarErrorKind.VALIDATION) {
                throw e;
            }
            SonarApiException partial = e.asPartial();
            log.warn("Could not fetch hotspots for {}, continuing without them: {}",
                    project.getName(), partial.getMessage());
            hotspots = List.of();
            hotspotsDegraded = true;
        }

        registry.progress(projectId, 70, "Fetching quality gate");
        QualityGateStatus gate = qualityGateCollector.collect(client, options);

        registry.progress(projectId, 75, "Fetching coverage");
        boolean coverageDegraded = false;
        Double coverage;
        try {
            coverage = coverageCollector.collect(client, options);
        } catch (SonarApiException e) {
            if (e.getKind() == SonarErrorKind.AUTHENTICATION || e.getKind() == SonarErrorKind.VALIDATION) {
                throw e;
            }
            log.warn("Could not fetch coverage for {}: {}", project.getName(), e.asPartial().getMessage());
            coverage = null;
            coverageDegraded = true;
        }

        registry.progress(projectId, 80, "Storing findings");
        List<SonarFinding> all = new ArrayList<>(issues.size() + hotspots.size());
        all.addAll(issues);
        all.addAll(hotspots);
        int created = 0;
        for (SonarFinding finding : all) {
            if (reconciliationService.upsertFinding(projectId, finding, startedAt)) {
                created++;
            }
        }

        registry.progress(projectId, 90, "Cleaning up stale findings");
        int stale = reconciliationService.markStaleFindings(projectId, startedAt, now(), !hotspotsDegraded);

        registry.progress(projectId, 95, "Recording scan");
        String gateStatus = gate != null ? gate.status() : null;
        ScansEntity scan = scanOf(all, hotspots.size(), gateStatus, coverage, version, startedAt,
                issues.size(), rules.size(), hotspotsDegraded, coverageDegraded);
        reconciliationService.recordScan(projectId, scan, now());

        if (props.isSaveTrendSnapshots()) {
            saveTrendSnapshot(project, all, coverage, gateStatus);
        }

        return SyncResult.builder()
                .success(true)
                .projectId(projectId)
                .projectName(project.getName())
                .issuesFound(issues.size())
                .hotspotsFound(hotspots.size())
                .findingsUpserted(all.size())
                .findingsCreated(created)
                .staleMarked(stale)
                .qualityGate(gateStatus)
                .hotspotsDegraded(hotspotsDegraded)
                .coverageDegraded(coverageDegraded)
                .build();
    }

    static ScansEntity scanOf(List<SonarFinding> findings, int hotspotCount, String gateStatus, Double coverage,
                              String version, Instant scanDate, int issueCount, int ruleCount,
                              boolean hotspotsDegraded, boolean coverageDegraded) {
        ScansEntity scan = new ScansEntity();
        scan.setScanDate(scanDate);
        scan.setTotalIssues(findings.size());
        for (SonarFinding f : findings) {
            switch (f.getLevel()) {
                case BLOCKER -> scan.setBlockerCount(scan.getBlockerCount() + 1);
                case CRITICAL -> scan.setCriticalCount(scan.getCriticalCount() + 1);
                case MAJOR -> scan.setMajorCount(scan.getMajorCount() + 1);
                case MINOR -> scan.setMinorCount(scan.getMinorCount() + 1);
                case INFO -> scan.setInfoCount(scan.getInfoCount() + 1);
            }
        }
        scan.setHotspotCount(hotspotCount);
        scan.setQualityGateStatus(gateStatus);
        scan.setCoverage(coverage);
        scan.setServerVersion(version);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", version);
        metadata.put("issueCount", issueCount);
        metadata.put("hotspotCount", hotspotCount);
        metadata.put("ruleCount", ruleCount);
        metadata.put("hotspotsDegraded", hotspotsDegraded);
        metadata.put("coverageDegraded", coverageDegraded);
        scan.setMetadata(metadata);
        return scan;
    }

    private void saveTrendSnapshot(ProjectsEntity project, List<SonarFinding> findings, Double coverage, String gate) {
        try {
            trendService.appendSnapshot(project.getSonarComponent(), trendService.snapshotOf(
                    SeverityUtil.summarize(findings), coverage, gate, findings.size(),
                    project.getBranch(), ComplianceUtil.classify(findings)));
        } catch (RuntimeException e) {
            log.error("Failed to save trend snapshot for {}", project.getSonarComponent(), e);
        }
    }

    private void recordExecution(SyncResult result, Instant startedAt) {
        SyncExecutionEntity exec = new SyncExecutionEntity();
        exec.setProjectId(result.getProjectId());
        exec.setStatus(result.isSuccess() ? SyncExecutionEntity.Outcome.SUCCESS : SyncExecutionEntity.Outcome.FAILED);
        exec.setStartedAt(startedAt);
        exec.setCompletedAt(now());
        exec.setDurationMs(result.getDurationMs());
        exec.setIssuesFound(result.getIssuesFound());
        exec.setHotspotsFound(result.getHotspotsFound());
        exec.setFindingsUpserted(result.getFindingsUpserted());
        exec.setStaleMarked(result.getStaleMarked());
        exec.setQualityGate(result.getQualityGate());
        exec.setErrorMessage(truncate(result.getError(), 2000));
        exec.setErrorKind(result.getErrorKind() != null ? result.getErrorKind().name() : null);
        exec.setHttpStatus(result.getHttpStatus());
        exec.setEndpoint(truncate(result.getEndpoint(), 1000));
        executionRepository.save(exec);
    }

    static SonarConnection connectionOf(ProjectsEntity project) {
        return new SonarConnection(project.getSonarUrl(), project.getSonarToken(),
                project.getSonarUsername(), project.getSonarPassword(), project.getSonarOrganization());
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
