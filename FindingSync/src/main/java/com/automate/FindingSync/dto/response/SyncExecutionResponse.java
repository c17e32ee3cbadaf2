package com.automate.FindingSync.dto.response;

import com.automate.FindingSync.entity.SyncExecutionEntity;

import java.time.Instant;
import java.util.UUID;

public record SyncExecutionResponse(
        UUID executionId,
        String status,
        Instant startedAt,
        Instant completedAt,
        long durationMs,
        int issuesFound,
        int hotspotsFound,
        int findingsUpserted,
        int staleMarked,
        String qualityGate,
        String errorMessage,
        String errorKind,
        Integer httpStatus,
        String endpoint
) {
    public static SyncExecutionResponse of(SyncExecutionEntity e) {
        return new SyncExecutionResponse(e.getExecutionId(), e.getStatus().name(), e.getStartedAt(),
                e.getCompletedAt(), e.getDurationMs(), e.getIssuesFound(), e.getHotspotsFound(),
                e.getFindingsUpserted(), e.getStaleMarked(), e.getQualityGate(), e.getErrorMessage(),
                e.getErrorKind(), e.getHttpStatus(), e.getEndpoint());
    }
}
