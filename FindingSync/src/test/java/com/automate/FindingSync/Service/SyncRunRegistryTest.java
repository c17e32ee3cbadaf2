package com.automate.FindingSync.Service;

import com.automate.FindingSync.dto.SyncResult;
import com.automate.FindingSync.dto.SyncStatus;
import com.automate.FindingSync.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class SyncRunRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final SyncRunRegistry registry = new SyncRunRegistry(clock);
    private final UUID projectId = UUID.randomUUID();

    @Test
    void secondClaimSeesTheRunInFlight() {
        assertThat(registry.tryStart(projectId)).isNull();

        CompletableFuture<SyncResult> running = registry.tryStart(projectId);

        assertThat(running).isNotNull().isNotDone();
        assertThat(registry.isRunning(projectId)).isTrue();
        assertThat(registry.status(projectId).getStatus()).isEqualTo(SyncStatus.State.RUNNING);
        assertThat(registry.status(projectId).getProgress()).isZero();
    }

    @Test
    void finishCompletesWaitersAndReleasesTheProject() {
        registry.tryStart(projectId);
        CompletableFuture<SyncResult> waiter = registry.tryStart(projectId);
        clock.advance(Duration.ofSeconds(5));
        SyncResult result = SyncResult.builder().success(true).projectId(projectId).build();

        registry.finish(projectId, result);

        assertThat(waiter).isCompletedWithValue(result);
        assertThat(registry.isRunning(projectId)).isFalse();
        SyncStatus status = registry.status(projectId);
        assertThat(status.getStatus()).isEqualTo(SyncStatus.State.COMPLETED);
        assertThat(status.getProgress()).isEqualTo(100);
        assertThat(status.getStartedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(status.getCompletedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:05Z"));
        assertThat(registry.tryStart(projectId)).isNull();
    }

    @Test
    void progressOnlyUpdatesRunningProjects() {
        registry.tryStart(projectId);
        registry.progress(projectId, 45, "Fetching issues");
        assertThat(registry.status(projectId).getStep()).isEqualTo("Fetching issues");

        registry.finish(projectId, SyncResult.rejected(projectId, "boom"));
        registry.progress(projectId, 60, "Fetching hotspots");

        SyncStatus status = registry.status(projectId);
        assertThat(status.getStatus()).isEqualTo(SyncStatus.State.FAILED);
        assertThat(status.getError()).isEqualTo("boom");
        assertThat(status.getProgress()).isNull();
    }

    @Test
    void unknownProjectIsIdleAndForgetDropsFinishedState() {
        assertThat(registry.status(projectId).getStatus()).isEqualTo(SyncStatus.State.IDLE);

        registry.tryStart(projectId);
        registry.forget(projectId);
        assertThat(registry.status(projectId).getStatus()).isEqualTo(SyncStatus.State.RUNNING);

        registry.finish(projectId, SyncResult.rejected(projectId, "done"));
        registry.forget(projectId);
        assertThat(registry.status(projectId).getStatus()).isEqualTo(SyncStatus.State.IDLE);
        assertThat(registry.all()).isEmpty();
    }
}
