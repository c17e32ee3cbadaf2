package com.automate.FindingSync.jobs;

import com.automate.FindingSync.Service.ProjectService;
import com.automate.FindingSync.Service.SyncRunRegistry;
import com.automate.FindingSync.Service.SyncService;
import com.automate.FindingSync.entity.ProjectsEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "sync.scheduler", name = "enabled", havingValue = "true")
public class ProjectSyncJob {
    private static final Logger log = LoggerFactory.getLogger(ProjectSyncJob.class);

    private final ProjectService projectService;
    private final SyncService syncService;
    private final SyncRunRegistry registry;
    private final Clock clock;

    public ProjectSyncJob(ProjectService projectService, SyncService syncService,
                          SyncRunRegistry registry, Clock clock) {
        this.projectService = projectService;
        this.syncService = syncService;
        this.registry = registry;
        this.clock = clock;
    }

    /** Starts a sync for every enabled project whose interval has elapsed. */
    @Scheduled(fixedDelayString = "${sync.scheduler.poll-interval-ms:60000}",
            initialDelayString = "${sync.scheduler.poll-interval-ms:60000}")
    public void syncDueProjects() {
        List<ProjectsEntity> due = projectService.findDueForSync(Instant.now(clock));
        int started = 0;
        for (ProjectsEntity project : due) {
            if (registry.isRunning(project.getProjectId())) {
                continue;
            }
            try {
                syncService.syncProjectAsync(project.getProjectId())
                        .whenComplete((result, ex) -> {
                            if (ex != null) {
                                log.error("Scheduled sync of {} failed", project.getName(), ex);
                            } else if (!result.isSuccess()) {
                                log.warn("Scheduled sync of {} failed: {}", project.getName(), result.getError());
                            }
                        });
                started++;
            } catch (TaskRejectedException e) {
                log.warn("Sync executor is full, {} waits for the next poll: {}", project.getName(), e.getMessage());
            }
        }
        if (started > 0) {
            log.info("Scheduled sync started for {} of {} due project(s)", started, due.size());
        }
    }
}
