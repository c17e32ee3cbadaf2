package com.automate.FindingSync.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PriorityRequest {
    @NotNull
    private Integer priority;
    private String performedBy;
}
