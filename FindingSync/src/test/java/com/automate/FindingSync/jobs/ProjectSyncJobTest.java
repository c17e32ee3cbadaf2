package com.automate.FindingSync.jobs;

import com.automate.FindingSync.Service.ProjectService;
import com.automate.FindingSync.Service.SyncRunRegistry;
import com.automate.FindingSync.Service.SyncService;
import com.automate.FindingSync.dto.SyncResult;
import com.automate.FindingSync.entity.ProjectsEntity;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProjectSyncJobTest {

    private static final Instant NOW = Instant.parse("2024-05-03T09:30:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ProjectService projectService = mock(ProjectService.class);
    private final SyncService syncService = mock(SyncService.class);
    private final SyncRunRegistry registry = new SyncRunRegistry(clock);
    private final ProjectSyncJob job = new ProjectSyncJob(projectService, syncService, registry, clock);

    @Test
    void rejectedProjectDoesNotStopTheRestOfThePoll() {
        ProjectsEntity first = project("first");
        ProjectsEntity second = project("second");
        ProjectsEntity third = project("third");
        when(projectService.findDueForSync(any())).thenReturn(List.of(first, second, third));
        when(syncService.syncProjectAsync(first.getProjectId()))
                .thenThrow(new TaskRejectedException("queue full"));
        when(syncService.syncProjectAsync(second.getProjectId()))
                .thenReturn(CompletableFuture.completedFuture(SyncResult.builder().success(true).build()));
        when(syncService.syncProjectAsync(third.getProjectId()))
                .thenReturn(CompletableFuture.completedFuture(SyncResult.builder().success(false).error("boom").build()));

        job.syncDueProjects();

        verify(syncService).syncProjectAsync(second.getProjectId());
        verify(syncService).syncProjectAsync(third.getProjectId());
    }

    @Test
    void projectAlreadyRunningIsSkipped() {
        ProjectsEntity busy = project("busy");
        when(projectService.findDueForSync(NOW)).thenReturn(List.of(busy));
        registry.tryStart(busy.getProjectId());

        job.syncDueProjects();

        verify(syncService, never()).syncProjectAsync(busy.getProjectId());
    }

    private static ProjectsEntity project(String name) {
        ProjectsEntity p = new ProjectsEntity();
        p.setProjectId(UUID.randomUUID());
        p.setName(name);
        return p;
    }
}
