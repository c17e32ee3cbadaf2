package com.automate.FindingSync.dto;

public record RuleInfo(
        String key,
        String name,
        String htmlDescription,
        String severity
) {}
