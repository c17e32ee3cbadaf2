package com.automate.FindingSync.dto.response;

import com.automate.FindingSync.dto.SyncStatus;

public record ProjectSummary(
        ProjectResponse project,
        ScanResponse latestScan,
        FindingStatistics statistics,
        SyncStatus syncStatus
) {}
