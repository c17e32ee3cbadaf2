package com.automate.FindingSync.Controller;

import com.automate.FindingSync.Service.FindingService;
import com.automate.FindingSync.Service.ProjectService;
import com.automate.FindingSync.Service.SyncService;
import com.automate.FindingSync.dto.FindingFilter;
import com.automate.FindingSync.dto.SyncResult;
import com.automate.FindingSync.dto.SyncStatus;
import com.automate.FindingSync.dto.request.ProjectRequest;
import com.automate.FindingSync.dto.response.FindingResponse;
import com.automate.FindingSync.dto.response.ProjectResponse;
import com.automate.FindingSync.dto.response.ProjectSummary;
import com.automate.FindingSync.dto.response.ScanResponse;
import com.automate.FindingSync.dto.response.SyncExecutionResponse;
import com.automate.FindingSync.entity.FindingType;
import com.automate.FindingSync.entity.LocalStatus;
import com.automate.FindingSync.entity.Severity;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;
    private final SyncService syncService;
    private final FindingService findingService;

    public ProjectController(ProjectService projectService, SyncService syncService, FindingService findingService) {
        this.projectService = projectService;
        this.syncService = syncService;
        this.findingService = findingService;
    }

    @GetMapping
    public List<ProjectResponse> listProjects() {
        return projectService.listProjects();
    }

    @PostMapping
    public ResponseEntity<ProjectResponse> createProject(@Valid @RequestBody ProjectRequest req,
                                                         UriComponentsBuilder uriBuilder) {
        ProjectResponse created = projectService.createProject(req);
        URI location = uriBuilder
                .path("/api/projects/{id}")
                .buildAndExpand(created.projectId())
                .toUri();
        return ResponseEntity.created(location).body(created);
    }

    @GetMapping("/{projectId}")
    public ProjectResponse getProject(@PathVariable UUID projectId) {
        return projectService.getProject(projectId);
    }

    @PutMapping("/{projectId}")
    public ProjectResponse updateProject(@PathVariable UUID projectId, @Valid @RequestBody ProjectRequest req) {
        return projectService.updateProject(projectId, req);
    }

    @DeleteMapping("/{projectId}")
    public ResponseEntity<Void> deleteProject(@PathVariable UUID projectId) {
        projectService.deleteProject(projectId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{projectId}/sync")
    public ResponseEntity<SyncStatus> triggerSync(@PathVariable UUID projectId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(syncService.triggerSync(projectId));
    }

    @GetMapping("/{projectId}/sync-status")
    public SyncStatus getSyncStatus(@PathVariable UUID projectId) {
        return syncService.getSyncStatus(projectId);
    }

    @GetMapping("/sync-status")
    public Map<UUID, SyncStatus> getAllSyncStatuses() {
        return syncService.getAllSyncStatuses();
    }

    @PostMapping("/sync-all")
    public List<SyncResult> syncAll() {
        return syncService.syncAllProjects();
    }

    @GetMapping("/{projectId}/scans")
    public List<ScanResponse> getScans(@PathVariable UUID projectId,
                                       @RequestParam(defaultValue = "20") int limit) {
        return projectService.getScans(projectId, limit);
    }

    @GetMapping("/{projectId}/executions")
    public List<SyncExecutionResponse> getExecutions(@PathVariable UUID projectId,
                                                     @RequestParam(defaultValue = "20") int limit) {
        return projectService.getExecutions(projectId, limit);
    }

    @GetMapping("/{projectId}/summary")
    public ProjectSummary getSummary(@PathVariable UUID projectId) {
        return projectService.getSummary(projectId);
    }

    @GetMapping("/{projectId}/trends")
    public List<ScanResponse> getTrends(@PathVariable UUID projectId,
                                        @RequestParam(defaultValue = "30") int days) {
        return projectService.getScanTrend(projectId, days);
    }

    @GetMapping("/{projectId}/findings")
    public List<FindingResponse> getFindings(@PathVariable UUID projectId,
                                             @RequestParam(required = false) Severity severity,
                                             @RequestParam(required = false) FindingType type,
                                             @RequestParam(required = false) String status,
                                             @RequestParam(required = false) LocalStatus localStatus,
                                             @RequestParam(required = false) String assignedTo,
                                             @RequestParam(required = false) String ruleKey,
                                             @RequestParam(required = false) String search) {
        return findingService.listFindings(projectId,
                new FindingFilter(severity, type, status, localStatus, assignedTo, ruleKey, search));
    }
}
