package com.automate.FindingSync.entity;

import java.util.Locale;

public enum FindingType {
    VULNERABILITY,
    BUG,
    CODE_SMELL,
    SECURITY_HOTSPOT;

    public static FindingType fromSonar(String raw) {
        if (raw == null || raw.isBlank()) return VULNERABILITY;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknown) {
            return VULNERABILITY;
        }
    }
}
