package com.automate.FindingSync.dto;

public record ErrorResponse(
        int status,
        String error,
        String message,
        String path
) {}
