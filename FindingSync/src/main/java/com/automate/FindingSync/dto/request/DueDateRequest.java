package com.automate.FindingSync.dto.request;

import lombok.Data;

import java.time.LocalDate;

@Data
public class DueDateRequest {
    // null clears the due date
    private LocalDate dueDate;
    private String performedBy;
}
