package com.automate.FindingSync.utilities;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * major.minor.patch taken from free text such as "10.3.0.82913" or "v7.8".
 */
public record SonarVersion(int major, int minor, int patch) implements Comparable<SonarVersion> {

    private static final Pattern VERSION = Pattern.compile("(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");

    /** @return the first version-looking run of digits, or null if there is none */
    public static SonarVersion parse(String raw) {
        if (raw == null) return null;
        Matcher m = VERSION.matcher(raw);
        if (!m.find()) return null;
        try {
            return new SonarVersion(
                    Integer.parseInt(m.group(1)),
                    m.group(2) == null ? 0 : Integer.parseInt(m.group(2)),
                    m.group(3) == null ? 0 : Integer.parseInt(m.group(3)));
        } catch (NumberFormatException tooLarge) {
            return null;
        }
    }

    public static SonarVersion of(int major, int minor) {
        return new SonarVersion(major, minor, 0);
    }

    /** Half-open range check: {@code from <= this < to}. */
    public boolean within(SonarVersion from, SonarVersion to) {
        return compareTo(from) >= 0 && compareTo(to) < 0;
    }

    public boolean atLeast(SonarVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(SonarVersion o) {
        if (major != o.major) return Integer.compare(major, o.major);
        if (minor != o.minor) return Integer.compare(minor, o.minor);
        return Integer.compare(patch, o.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
