package com.automate.FindingSync.utilities;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public final class SonarDateUtil {

    // Sonar writes offsets without a colon, e.g. 2024-01-10T10:00:00+0000
    private static final DateTimeFormatter SONAR_OFFSET = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

    private SonarDateUtil() {
    }

    /** Accepts ISO offsets with or without a colon, or epoch millis. Null when unparsable. */
    public static Instant parseSonarInstant(String s) {
        if (s == null || s.isBlank()) return null;
        String v = s.trim();
        try {
            return OffsetDateTime.parse(v, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException notIso) {
            try {
                return OffsetDateTime.parse(v, SONAR_OFFSET).toInstant();
            } catch (DateTimeParseException notSonar) {
                try {
                    return Instant.ofEpochMilli(Long.parseLong(v));
                } catch (NumberFormatException notEpoch) {
                    return null;
                }
            }
        }
    }

    /** yyyy-MM-dd in UTC, or {@code fallback} when the value cannot be parsed. */
    public static String formatDay(String sonarDate, String fallback) {
        Instant at = parseSonarInstant(sonarDate);
        return at == null ? fallback : DAY.format(at.atOffset(ZoneOffset.UTC));
    }
}
