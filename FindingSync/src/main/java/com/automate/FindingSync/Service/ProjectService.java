package com.automate.FindingSync.Service;

import com.automate.FindingSync.dto.request.ProjectRequest;
import com.automate.FindingSync.dto.response.ProjectResponse;
import com.automate.FindingSync.dto.response.ProjectSummary;
import com.automate.FindingSync.dto.response.ScanResponse;
import com.automate.FindingSync.dto.response.SyncExecutionResponse;
import com.automate.FindingSync.entity.ProjectsEntity;
import com.automate.FindingSync.exception.ProjectNotFoundException;
import com.automate.FindingSync.repository.ProjectsRepository;
import com.automate.FindingSync.repository.ScansRepository;
import com.automate.FindingSync.repository.SyncExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {

    private static final String DEFAULT_BRANCH = "main";

    private final ProjectsRepository projectsRepository;
    private final ScansRepository scansRepository;
    private final SyncExecutionRepository executionRepository;
    private final SyncRunRegistry registry;
    private final FindingService findingService;
    private final Clock clock;

    @Transactional
    public ProjectResponse createProject(ProjectRequest req) {
        String sonarUrl = normalizeUrl(req.getSonarUrl());
        String branch = branchOf(req.getBranch());
        if (projectsRepository.existsBySonarUrlAndSonarComponentAndBranch(sonarUrl, req.getSonarComponent().trim(), branch)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Project already exists for " + req.getSonarComponent() + " on branch " + branch);
        }
        ProjectsEntity project = new ProjectsEntity();
        apply(project, req);
        ProjectsEntity saved = projectsRepository.save(project);
        log.info("Created project {} ({})", saved.getName(), saved.getProjectId());
        return ProjectResponse.of(saved);
    }

    @Transactional
    public ProjectResponse updateProject(UUID projectId, ProjectRequest req) {
        ProjectsEntity project = load(projectId);
        String sonarUrl = normalizeUrl(req.getSonarUrl());
        String branch = branchOf(req.getBranch());
        boolean identityChanged = !sonarUrl.equals(project.getSonarUrl())
                || !req.getSonarComponent().trim().equals(project.getSonarComponent())
                || !branch.equals(project.getBranch());
        if (identityChanged && projectsRepository.existsBySonarUrlAndSonarComponentAndBranch(
                sonarUrl, req.getSonarComponent().trim(), branch)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Project already exists for " + req.getSonarComponent() + " on branch " + branch);
        }
        apply(project, req);
        return ProjectResponse.of(projectsRepository.save(project));
    }

    @Transactional(readOnly = true)
    public ProjectResponse getProject(UUID projectId) {
        return ProjectResponse.of(load(projectId));
    }

    @Transactional(readOnly = true)
    public List<ProjectResponse> listProjects() {
        return projectsRepository.findAllByOrderByNameAsc().stream().map(ProjectResponse::of).toList();
    }

    /** Findings, scans, history and comments go with the project. */
    @Transactional
    public void deleteProject(UUID projectId) {
        ProjectsEntity project = load(projectId);
        projectsRepository.delete(project);
        registry.forget(projectId);
        log.info("Deleted project {} ({})", project.getName(), projectId);
    }

    /** Enabled projects never synced, or last synced longer ago than their interval. */
    @Transactional(readOnly = true)
    public List<ProjectsEntity> findDueForSync(Instant now) {
        return projectsRepository.findBySyncEnabledTrue().stream()
                .filter(p -> isDue(p, now))
                .toList();
    }

    static boolean isDue(ProjectsEntity project, Instant now) {
        if (project.getLastSyncAt() == null) return true;
        Instant next = project.getLastSyncAt().plus(Duration.ofMinutes(project.getSyncIntervalMinutes()));
        return !next.isAfter(now);
    }

    @Transactional
    public void touchLastSync(UUID projectId, Instant at) {
        if (projectsRepository.updateLastSyncAt(projectId, at) == 0) {
            throw new ProjectNotFoundException(projectId);
        }
    }

    @Transactional(readOnly = true)
    public List<ScanResponse> getScans(UUID projectId, int limit) {
        load(projectId);
        return scansRepository.findByProject_ProjectIdOrderByScanDateDesc(projectId, PageRequest.of(0, clamp(limit)))
                .stream().map(ScanResponse::of).toList();
    }

    @Transactional(readOnly = true)
    public List<SyncExecutionResponse> getExecutions(UUID projectId, int limit) {
        return executionRepository.findByProjectIdOrderByStartedAtDesc(projectId, PageRequest.of(0, clamp(limit)))
                .stream().map(SyncExecutionResponse::of).toList();
    }

    /** Scans of the last {@code days} days, oldest first. */
    @Transactional(readOnly = true)
    public List<ScanResponse> getScanTrend(UUID projectId, int days) {
        load(projectId);
        Instant from = Instant.now(clock).minus(Duration.ofDays(Math.max(days, 1)));
        return scansRepository.findByProject_ProjectIdAndScanDateGreaterThanEqualOrderByScanDateAsc(projectId, from)
                .stream().map(ScanResponse::of).toList();
    }

    @Transactional(readOnly = true)
    public ProjectSummary getSummary(UUID projectId) {
        ProjectsEntity project = load(projectId);
        ScanResponse latest = scansRepository.findFirstByProject_ProjectIdOrderByScanDateDesc(projectId)
                .map(ScanResponse::of)
                .orElse(null);
        return new ProjectSummary(ProjectResponse.of(project), latest,
                findingService.statistics(projectId), registry.status(projectId));
    }

    ProjectsEntity load(UUID projectId) {
        return projectsRepository.findById(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    private static void apply(ProjectsEntity project, ProjectRequest req) {
        project.setName(req.getName().trim());
        project.setDescription(req.getDescription());
        project.setSonarUrl(normalizeUrl(req.getSonarUrl()));
        project.setSonarComponent(req.getSonarComponent().trim());
        project.setBranch(branchOf(req.getBranch()));
        project.setSonarOrganization(blankToNull(req.getSonarOrganization()));
        project.setSonarUsername(blankToNull(req.getSonarUsername()));
        // absent secrets on update keep the stored ones
        if (req.getSonarToken() != null) project.setSonarToken(blankToNull(req.getSonarToken()));
        if (req.getSonarPassword() != null) project.setSonarPassword(blankToNull(req.getSonarPassword()));
        if (req.getSyncEnabled() != null) project.setSyncEnabled(req.getSyncEnabled());
        if (req.getSyncIntervalMinutes() != null) project.setSyncIntervalMinutes(req.getSyncIntervalMinutes());
    }

    private static String normalizeUrl(String url) {
        return Objects.requireNonNull(url).trim().replaceAll("/+$", "");
    }

    private static String branchOf(String branch) {
        return branch == null || branch.isBlank() ? DEFAULT_BRANCH : branch.trim();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static int clamp(int limit) {
        return Math.min(Math.max(limit, 1), 500);
    }
}
