package com.automate.FindingSync.dto.response;

import com.automate.FindingSync.entity.FindingType;
import com.automate.FindingSync.entity.FindingsEntity;
import com.automate.FindingSync.entity.LocalStatus;
import com.automate.FindingSync.entity.Severity;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record FindingResponse(
        UUID findingId,
        UUID projectId,
        String sonarKey,
        String ruleKey,
        String ruleName,
        Severity severity,
        FindingType type,
        String status,
        String resolution,
        String component,
        Integer line,
        String message,
        String sonarLink,
        String effort,
        String debt,
        List<String> tags,
        Instant firstSeenAt,
        Instant lastSeenAt,
        Instant resolvedAt,
        LocalStatus localStatus,
        String assignedTo,
        int priority,
        LocalDate dueDate
) {
    public static FindingResponse of(FindingsEntity f) {
        return new FindingResponse(
                f.getFindingId(), f.getProject().getProjectId(), f.getSonarKey(), f.getRuleKey(), f.getRuleName(),
                f.getSeverity(), f.getType(), f.getStatus(), f.getResolution(), f.getComponent(), f.getLine(),
                f.getMessage(), f.getSonarLink(), f.getEffort(), f.getDebt(),
                f.getTags() == null ? List.of() : List.copyOf(f.getTags()),
                f.getFirstSeenAt(), f.getLastSeenAt(), f.getResolvedAt(),
                f.getLocalStatus(), f.getAssignedTo(), f.getPriority(), f.getDueDate());
    }
}
