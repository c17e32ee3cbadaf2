package com.automate.FindingSync.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

/** Several components of the same server; options apply to each of them. */
@Data
@EqualsAndHashCode(callSuper = true)
public class PortfolioReportRequest extends ReportRequest {
    @NotBlank
    private String name;

    @NotEmpty
    private List<@NotBlank String> components;
}
