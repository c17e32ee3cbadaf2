package com.automate.FindingSync.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AssignRequest {
    // null or blank unassigns
    @Size(max = 255)
    private String assignedTo;
    private String performedBy;
}
