package com.automate.FindingSync.dto.response;

import com.automate.FindingSync.entity.ScansEntity;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ScanResponse(
        UUID scanId,
        Instant scanDate,
        int totalIssues,
        int blockerCount,
        int criticalCount,
        int majorCount,
        int minorCount,
        int infoCount,
        int hotspotCount,
        String qualityGateStatus,
        Double coverage,
        String serverVersion,
        Map<String, Object> metadata
) {
    public static ScanResponse of(ScansEntity s) {
        return new ScanResponse(s.getScanId(), s.getScanDate(), s.getTotalIssues(), s.getBlockerCount(),
                s.getCriticalCount(), s.getMajorCount(), s.getMinorCount(), s.getInfoCount(),
                s.getHotspotCount(), s.getQualityGateStatus(), s.getCoverage(), s.getServerVersion(),
                s.getMetadata());
    }
}
