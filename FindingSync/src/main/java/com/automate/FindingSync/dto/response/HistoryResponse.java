package com.automate.FindingSync.dto.response;

import com.automate.FindingSync.entity.FindingHistoryEntity;
import com.automate.FindingSync.entity.HistoryAction;

import java.time.LocalDateTime;
import java.util.UUID;

public record HistoryResponse(
        UUID historyId,
        HistoryAction action,
        String fieldName,
        String oldValue,
        String newValue,
        String performedBy,
        LocalDateTime createdAt
) {
    public static HistoryResponse of(FindingHistoryEntity h) {
        return new HistoryResponse(h.getHistoryId(), h.getAction(), h.getFieldName(), h.getOldValue(),
                h.getNewValue(), h.getPerformedBy(), h.getCreatedAt());
    }
}
