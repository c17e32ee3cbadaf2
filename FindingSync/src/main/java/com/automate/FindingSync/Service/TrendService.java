package com.automate.FindingSync.Service;

import com.automate.FindingSync.Config.SyncProperties;
import com.automate.FindingSync.dto.ComplianceSummary;
import com.automate.FindingSync.dto.SecurityReport;
import com.automate.FindingSync.dto.SeveritySummary;
import com.automate.FindingSync.dto.TrendAnalysis;
import com.automate.FindingSync.dto.TrendDelta;
import com.automate.FindingSync.dto.TrendSnapshot;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * File-backed trend history: one JSON array per project key, newest last.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrendService {

    private static final long DAY_MS = Duration.ofDays(1).toMillis();
    private static final TypeReference<List<TrendSnapshot>> HISTORY_TYPE = new TypeReference<>() {};

    private final SyncProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Appends to the project's history, evicting the oldest entries past the limit.
     *
     * @return the history as written
     */
    public synchronized List<TrendSnapshot> appendSnapshot(String projectKey, TrendSnapshot snapshot) {
        Path file = historyFile(projectKey);
        List<TrendSnapshot> history = new ArrayList<>(readHistory(file));
        history.add(snapshot);
        int limit = props.getTrendHistoryLimit();
        if (history.size() > limit) {
            history = new ArrayList<>(history.subList(history.size() - limit, history.size()));
        }
        write(file, history);
        log.info("Trend snapshot saved to {} ({} entries)", file, history.size());
        return history;
    }

    /** Snapshots taken within the last {@code periodDays} days, oldest first. */
    public List<TrendSnapshot> loadHistory(String projectKey, int periodDays) {
        List<TrendSnapshot> history = readHistory(historyFile(projectKey));
        long cutoff = clock.millis() - periodDays * DAY_MS;
        return history.stream().filter(s -> s.getTimestamp() >= cutoff).toList();
    }

    public TrendSnapshot snapshotOf(SecurityReport report) {
        return snapshotOf(report.getSummary(), report.getCoverage(),
                report.getQualityGate() != null ? report.getQualityGate().status() : null,
                report.getFindings() != null ? report.getFindings().size() : 0,
                report.getBranch(), report.getCompliance());
    }

    public TrendSnapshot snapshotOf(SeveritySummary summary, Double coverage, String qualityGateStatus,
                                    int totalIssues, String branch, ComplianceSummary compliance) {
        long now = clock.millis();
        SeveritySummary s = summary != null ? summary : SeveritySummary.EMPTY;
        return TrendSnapshot.builder()
                .timestamp(now)
                .date(Instant.ofEpochMilli(now).toString())
                .summary(new TrendSnapshot.Summary(s.high(), s.medium(), s.low()))
                .coverage(coverage != null ? coverage : 0)
                .qualityGateStatus(qualityGateStatus != null ? qualityGateStatus : "N/A")
                .totalIssues(totalIssues)
                .branch(branch != null ? branch : "main")
                .compliance(compliance == null ? null : new TrendSnapshot.Compliance(
                        compliance.owasp().size(), compliance.cwe().size(), compliance.sans().size()))
                .build();
    }

    public TrendAnalysis computeTrend(List<TrendSnapshot> history) {
        if (history == null || history.size() < 2) {
            return TrendAnalysis.builder()
                    .hasTrendData(false)
                    .message("Need at least 2 historical snapshots for trend analysis")
                    .build();
        }
        TrendSnapshot oldest = history.get(0);
        TrendSnapshot previous = history.get(history.size() - 2);
        TrendSnapshot latest = history.get(history.size() - 1);
        long spanMs = latest.getTimestamp() - oldest.getTimestamp();

        return TrendAnalysis.builder()
                .hasTrendData(true)
                .dataPoints(history.size())
                .periodDays((long) Math.ceil((double) spanMs / DAY_MS))
                .latest(latest)
                .previous(previous)
                .oldest(oldest)
                .deltas(deltas(latest, previous))
                .overallTrend(deltas(latest, oldest))
                .build();
    }

    private static Map<String, TrendDelta> deltas(TrendSnapshot current, TrendSnapshot base) {
        Map<String, TrendDelta> out = new LinkedHashMap<>();
        out.put("high", delta(current, base, s -> summaryOf(s).getHigh()));
        out.put("medium", delta(current, base, s -> summaryOf(s).getMedium()));
        out.put("low", delta(current, base, s -> summaryOf(s).getLow()));
        out.put("total", delta(current, base, TrendSnapshot::getTotalIssues));
        out.put("coverage", delta(current, base, TrendSnapshot::getCoverage));
        return out;
    }

    private static TrendDelta delta(TrendSnapshot current, TrendSnapshot base, ToDoubleFunction<TrendSnapshot> metric) {
        return TrendDelta.between(metric.applyAsDouble(current), metric.applyAsDouble(base));
    }

    private static TrendSnapshot.Summary summaryOf(TrendSnapshot s) {
        return s.getSummary() != null ? s.getSummary() : new TrendSnapshot.Summary();
    }

    static String fileName(String projectKey) {
        return projectKey.replaceAll("[^a-zA-Z0-9]", "_") + ".json";
    }

    private Path historyFile(String projectKey) {
        return Paths.get(props.getTrendDirectory()).resolve(fileName(projectKey));
    }

    private List<TrendSnapshot> readHistory(Path file) {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<TrendSnapshot> history = objectMapper.readValue(file.toFile(), HISTORY_TYPE);
            return history != null ? history : List.of();
        } catch (IOException e) {
            log.error("Failed to load trend history {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private void write(Path file, List<TrendSnapshot> history) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), history);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write trend history " + file, e);
        }
    }
}
