package com.automate.FindingSync.dto;

import com.automate.FindingSync.exception.SonarApiException;
import com.automate.FindingSync.exception.SonarErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Outcome of one sync run. On failure {@code error} always carries a message;
 * kind, HTTP status and endpoint are filled when known.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncResult {
    private boolean success;
    private UUID projectId;
    private String projectName;
    private int issuesFound;
    private int hotspotsFound;
    private int findingsUpserted;
    private int findingsCreated;
    private int staleMarked;
    private String qualityGate;
    private boolean hotspotsDegraded;
    private boolean coverageDegraded;
    private long durationMs;
    private String error;
    private SonarErrorKind errorKind;
    private Integer httpStatus;
    private String endpoint;

    public static SyncResult failure(UUID projectId, String projectName, Throwable ex, long durationMs) {
        SyncResultBuilder b = SyncResult.builder()
                .success(false)
                .projectId(projectId)
                .projectName(projectName)
                .durationMs(durationMs)
                .error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        if (ex instanceof SonarApiException sae) {
            b.errorKind(sae.getKind())
                    .httpStatus(sae.getStatusCode() > 0 ? sae.getStatusCode() : null)
                    .endpoint(sae.getEndpoint());
        }
        return b.build();
    }

    public static SyncResult rejected(UUID projectId, String message) {
        return SyncResult.builder()
                .success(false)
                .projectId(projectId)
                .error(message)
                .build();
    }
}
