package com.automate.FindingSync.dto;

import com.automate.FindingSync.entity.FindingType;
import com.automate.FindingSync.entity.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One issue or hotspot as collected from the server.
 * {@code severity} is the report label (HIGH, CRITICAL, MEDIUM...);
 * {@code level} is the ordered severity used for storage and sorting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SonarFinding {
    private String key;
    private String ruleKey;
    private String ruleName;
    private String severity;
    private Severity level;
    private FindingType type;
    private String status;
    private String resolution;
    private String component;
    private Integer line;
    private String message;
    private String link;
    private String effort;
    private String debt;
    private List<String> tags;
}
