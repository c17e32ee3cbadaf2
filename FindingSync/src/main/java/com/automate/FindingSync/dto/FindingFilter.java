package com.automate.FindingSync.dto;

import com.automate.FindingSync.entity.FindingType;
import com.automate.FindingSync.entity.LocalStatus;
import com.automate.FindingSync.entity.Severity;

/** Optional criteria for listing a project's findings; null means any. */
public record FindingFilter(
        Severity severity,
        FindingType type,
        String status,
        LocalStatus localStatus,
        String assignedTo,
        String ruleKey,
        String search
) {}
