package com.automate.FindingSync.dto.request;

import com.automate.FindingSync.entity.LocalStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StatusUpdateRequest {
    @NotNull
    private LocalStatus status;
    private String performedBy;
}
