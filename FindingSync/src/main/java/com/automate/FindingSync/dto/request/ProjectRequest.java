package com.automate.FindingSync.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ProjectRequest {
    @NotBlank
    @Size(max = 255)
    private String name;

    @Size(max = 1000)
    private String description;

    @NotBlank
    @Pattern(regexp = "^https?://.+", message = "must be an http(s) URL")
    private String sonarUrl;

    @NotBlank
    private String sonarComponent;

    private String branch;

    // credentials are accepted but never echoed back
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String sonarToken;
    private String sonarUsername;
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String sonarPassword;

    private String sonarOrganization;

    private Boolean syncEnabled;

    @Min(1)
    @Max(10080)
    private Integer syncIntervalMinutes;
}
