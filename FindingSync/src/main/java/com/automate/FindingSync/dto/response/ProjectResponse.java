package com.automate.FindingSync.dto.response;

import com.automate.FindingSync.entity.ProjectsEntity;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

public record ProjectResponse(
        UUID projectId,
        String name,
        String description,
        String sonarUrl,
        String sonarComponent,
        String branch,
        String sonarOrganization,
        String sonarUsername,
        boolean hasToken,
        boolean syncEnabled,
        int syncIntervalMinutes,
        Instant lastSyncAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ProjectResponse of(ProjectsEntity p) {
        return new ProjectResponse(
                p.getProjectId(),
                p.getName(),
                p.getDescription(),
                p.getSonarUrl(),
                p.getSonarComponent(),
                p.getBranch(),
                p.getSonarOrganization(),
                p.getSonarUsername(),
                p.getSonarToken() != null && !p.getSonarToken().isBlank(),
                p.isSyncEnabled(),
                p.getSyncIntervalMinutes(),
                p.getLastSyncAt(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
