package com.automate.FindingSync.Service;

import com.automate.FindingSync.dto.SyncResult;
import com.automate.FindingSync.dto.SyncStatus;
import com.automate.FindingSync.dto.SyncStatus.State;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-project run state: at most one run in flight per project, with the
 * last known status kept for observers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncRunRegistry {

    private final Clock clock;

    private final Map<UUID, SyncStatus> statuses = new ConcurrentHashMap<>();
    private final Map<UUID, CompletableFuture<SyncResult>> inFlight = new ConcurrentHashMap<>();

    /**
     * Claims the project for a new run.
     *
     * @return null when the caller now owns the run, otherwise the run already in flight
     */
    public CompletableFuture<SyncResult> tryStart(UUID projectId) {
        CompletableFuture<SyncResult> claim = new CompletableFuture<>();
        CompletableFuture<SyncResult> existing = inFlight.putIfAbsent(projectId, claim);
        if (existing != null) {
            return existing;
        }
        statuses.put(projectId, SyncStatus.builder()
                .status(State.RUNNING)
                .progress(0)
                .step("Starting sync")
                .startedAt(Instant.now(clock))
                .build());
        return null;
    }

    public void progress(UUID projectId, int progress, String step) {
        statuses.computeIfPresent(projectId, (id, s) -> s.getStatus() == State.RUNNING
                ? s.toBuilder().progress(progress).step(step).build()
                : s);
    }

    /** Records the terminal state, then releases the project for the next run. */
    public void finish(UUID projectId, SyncResult result) {
        SyncStatus current = statuses.get(projectId);
        statuses.put(projectId, SyncStatus.builder()
                .status(result.isSuccess() ? State.COMPLETED : State.FAILED)
                .progress(result.isSuccess() ? 100 : null)
                .startedAt(current != null ? current.getStartedAt() : null)
                .completedAt(Instant.now(clock))
                .error(result.getError())
                .result(result)
                .build());
        CompletableFuture<SyncResult> run = inFlight.remove(projectId);
        if (run != null) {
            run.complete(result);
        }
    }

    public boolean isRunning(UUID projectId) {
        return inFlight.containsKey(projectId);
    }

    public SyncStatus status(UUID projectId) {
        return statuses.getOrDefault(projectId, SyncStatus.idle());
    }

    public Map<UUID, SyncStatus> all() {
        return new HashMap<>(statuses);
    }

    public void forget(UUID projectId) {
        if (!isRunning(projectId)) {
            statuses.remove(projectId);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (!inFlight.isEmpty()) {
            log.warn("Shutting down with {} sync run(s) in flight", inFlight.size());
        }
        inFlight.forEach((projectId, run) ->
                run.complete(SyncResult.rejected(projectId, "Sync interrupted by shutdown")));
        inFlight.clear();
        statuses.clear();
    }
}
