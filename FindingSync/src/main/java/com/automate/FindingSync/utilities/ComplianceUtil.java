package com.automate.FindingSync.utilities;

import com.automate.FindingSync.dto.ComplianceSummary;
import com.automate.FindingSync.dto.ComplianceSummary.ComplianceCategory;
import com.automate.FindingSync.dto.SonarFinding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies findings into OWASP Top 10 (2017), CWE and SANS Top 25 buckets from their tags.
 */
public final class ComplianceUtil {

    public static final List<String> OWASP_CATEGORIES = List.of(
            "a1-injection",
            "a2-broken-authentication",
            "a3-sensitive-data-exposure",
            "a4-xxe",
            "a5-broken-access-control",
            "a6-security-misconfiguration",
            "a7-xss",
            "a8-insecure-deserialization",
            "a9-vulnerable-components",
            "a10-insufficient-logging"
    );

    // keyword fallback per category, same order as OWASP_CATEGORIES
    private static final List<List<String>> OWASP_KEYWORDS = List.of(
            List.of("injection"),
            List.of("authentication"),
            List.of("sensitive-data"),
            List.of("xxe"),
            List.of("access-control"),
            List.of("misconfiguration"),
            List.of("xss", "cross-site"),
            List.of("deserialization"),
            List.of("component"),
            List.of("logging")
    );

    private static final Pattern OWASP_NUMBER = Pattern.compile("(?<![a-z0-9])a(\\d{1,2})(?!\\d)");
    private static final Pattern CWE = Pattern.compile("cwe-?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SANS = Pattern.compile("sans(?:-?top)?[- ]?(\\d+)(?:-([a-z]+))?", Pattern.CASE_INSENSITIVE);

    private ComplianceUtil() {
    }

    public static ComplianceSummary classify(Collection<SonarFinding> findings) {
        Map<String, Set<String>> owasp = new HashMap<>();
        Map<String, Set<String>> cwe = new HashMap<>();
        Map<String, Set<String>> sans = new HashMap<>();
        Set<String> otherTags = new TreeSet<>();

        for (SonarFinding finding : findings) {
            if (finding.getTags() == null) continue;
            String key = finding.getKey() == null ? "" : finding.getKey();
            for (String tag : finding.getTags()) {
                if (tag == null || tag.isBlank()) continue;
                String lower = tag.toLowerCase(Locale.ROOT);
                String bucket;
                Map<String, Set<String>> target;
                if (lower.contains("owasp-a") || lower.contains("owasp-top-10")) {
                    bucket = owaspCategory(lower);
                    target = owasp;
                } else if (lower.contains("cwe")) {
                    bucket = cweId(tag);
                    target = cwe;
                } else if (lower.contains("sans-top") || lower.contains("sans25")) {
                    bucket = sansId(tag);
                    target = sans;
                } else {
                    otherTags.add(tag);
                    continue;
                }
                // a framework tag without a known id is dropped
                if (bucket != null) {
                    target.computeIfAbsent(bucket, k -> new TreeSet<>()).add(key);
                }
            }
        }

        return ComplianceSummary.of(
                toCategories(owasp, id -> id.replace('-', ' ').toUpperCase(Locale.ROOT),
                        Comparator.comparingInt(OWASP_CATEGORIES::indexOf)),
                toCategories(cwe, Function.identity(), Comparator.comparingInt(ComplianceUtil::numericSuffix)),
                toCategories(sans, Function.identity(), Comparator.naturalOrder()),
                new ArrayList<>(otherTags));
    }

    /** Category id for an OWASP tag: explicit number first, keywords otherwise. */
    public static String owaspCategory(String tag) {
        String lower = tag.toLowerCase(Locale.ROOT);
        Matcher m = OWASP_NUMBER.matcher(lower);
        if (m.find()) {
            int n = Integer.parseInt(m.group(1));
            if (n >= 1 && n <= OWASP_CATEGORIES.size()) {
                return OWASP_CATEGORIES.get(n - 1);
            }
        }
        for (int i = 0; i < OWASP_KEYWORDS.size(); i++) {
            for (String keyword : OWASP_KEYWORDS.get(i)) {
                if (lower.contains(keyword)) return OWASP_CATEGORIES.get(i);
            }
        }
        return null;
    }

    public static String cweId(String tag) {
        Matcher m = CWE.matcher(tag);
        return m.find() ? "CWE-" + Integer.parseInt(m.group(1)) : null;
    }

    /** SANS-25 for "sans25", SANS-25-POROUS for "sans-top25-porous". */
    public static String sansId(String tag) {
        Matcher m = SANS.matcher(tag);
        if (!m.find()) return null;
        String id = "SANS-" + m.group(1);
        return m.group(2) == null ? id : id + "-" + m.group(2).toUpperCase(Locale.ROOT);
    }

    private static List<ComplianceCategory> toCategories(Map<String, Set<String>> grouped,
                                                         Function<String, String> label,
                                                         Comparator<String> tieBreak) {
        Comparator<ComplianceCategory> order = Comparator
                .comparingInt(ComplianceCategory::count).reversed()
                .thenComparing(ComplianceCategory::id, tieBreak);
        return grouped.entrySet().stream()
                .map(e -> new ComplianceCategory(e.getKey(), label.apply(e.getKey()),
                        e.getValue().size(), List.copyOf(e.getValue())))
                .sorted(order)
                .toList();
    }

    private static int numericSuffix(String id) {
        int dash = id.lastIndexOf('-');
        try {
            return Integer.parseInt(id.substring(dash + 1));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
