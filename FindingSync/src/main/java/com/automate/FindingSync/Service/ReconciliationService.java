package com.automate.FindingSync.Service;

import com.automate.FindingSync.dto.SonarFinding;
import com.automate.FindingSync.entity.FindingHistoryEntity;
import com.automate.FindingSync.entity.FindingType;
import com.automate.FindingSync.entity.FindingsEntity;
import com.automate.FindingSync.entity.HistoryAction;
import com.automate.FindingSync.entity.LocalStatus;
import com.automate.FindingSync.entity.ScansEntity;
import com.automate.FindingSync.repository.FindingHistoryRepository;
import com.automate.FindingSync.repository.FindingsRepository;
import com.automate.FindingSync.repository.ProjectsRepository;
import com.automate.FindingSync.repository.ScansRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes collected findings into the local store. Every public method commits
 * on its own, so a failed run keeps what was already applied and a re-run
 * re-applies the same writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    public static final String SYNC_ACTOR = "sync";
    private static final int MESSAGE_MAX = 4000;

    private final ProjectsRepository projectsRepository;
    private final FindingsRepository findingsRepository;
    private final FindingHistoryRepository historyRepository;
    private final ScansRepository scansRepository;

    /**
     * Inserts or updates the finding keyed by (project, sonar key). Local
     * workflow fields are never touched on update.
     *
     * @return true when a new row was inserted
     */
    @Transactional
    public boolean upsertFinding(UUID projectId, SonarFinding finding, Instant seenAt) {
        Optional<FindingsEntity> existing = findingsRepository.findByProject_ProjectIdAndSonarKey(projectId, finding.getKey());
        if (existing.isPresent()) {
            FindingsEntity entity = existing.get();
            applyUpstream(entity, finding);
            if (entity.getLastSeenAt() == null || seenAt.isAfter(entity.getLastSeenAt())) {
                entity.setLastSeenAt(seenAt);
            }
            syncResolvedAt(entity, seenAt);
            return false;
        }

        FindingsEntity entity = new FindingsEntity();
        entity.setProject(projectsRepository.getReferenceById(projectId));
        entity.setSonarKey(finding.getKey());
        applyUpstream(entity, finding);
        entity.setFirstSeenAt(seenAt);
        entity.setLastSeenAt(seenAt);
        entity.setLocalStatus(LocalStatus.NEW);
        entity.setPriority(0);
        syncResolvedAt(entity, seenAt);
        findingsRepository.save(entity);
        return true;
    }

    /**
     * Closes findings of the project that were not seen since {@code runStartedAt}.
     * A finding still NEW locally moves to RESOLVED.
     *
     * @param includeHotspots false when this run could not collect hotspots
     * @return number of findings closed
     */
    @Transactional
    public int markStaleFindings(UUID projectId, Instant runStartedAt, Instant now, boolean includeHotspots) {
        List<FindingsEntity> candidates = findingsRepository.findStaleCandidates(
                projectId, runStartedAt, FindingsEntity.TERMINAL_STATUSES);
        List<FindingHistoryEntity> history = new ArrayList<>();
        int marked = 0;
        for (FindingsEntity finding : candidates) {
            if (!includeHotspots && finding.getType() == FindingType.SECURITY_HOTSPOT) {
                continue;
            }
            finding.setStatus("CLOSED");
            finding.setResolvedAt(now);
            if (finding.getLocalStatus() == LocalStatus.NEW) {
                finding.setLocalStatus(LocalStatus.RESOLVED);
                history.add(FindingHistoryEntity.of(finding, HistoryAction.STATUS_CHANGE, "local_status",
                        LocalStatus.NEW.name(), LocalStatus.RESOLVED.name(), SYNC_ACTOR));
            }
            marked++;
        }
        historyRepository.saveAll(history);
        if (marked > 0) {
            log.info("Marked {} stale finding(s) as CLOSED for project {}", marked, projectId);
        }
        return marked;
    }

    /** Stores the scan snapshot and the project's last-sync time together. */
    @Transactional
    public ScansEntity recordScan(UUID projectId, ScansEntity scan, Instant syncedAt) {
        scan.setProject(projectsRepository.getReferenceById(projectId));
        ScansEntity saved = scansRepository.save(scan);
        projectsRepository.updateLastSyncAt(projectId, syncedAt);
        return saved;
    }

    private static void applyUpstream(FindingsEntity entity, SonarFinding finding) {
        entity.setRuleKey(finding.getRuleKey());
        entity.setRuleName(finding.getRuleName());
        entity.setSeverity(finding.getLevel());
        entity.setType(finding.getType());
        entity.setStatus(finding.getStatus());
        entity.setResolution(finding.getResolution());
        entity.setComponent(finding.getComponent());
        entity.setLine(finding.getLine());
        entity.setMessage(truncate(finding.getMessage()));
        entity.setSonarLink(finding.getLink());
        entity.setEffort(finding.getEffort());
        entity.setDebt(finding.getDebt());
        entity.setTags(finding.getTags() == null ? List.of() : new ArrayList<>(finding.getTags()));
    }

    // resolvedAt follows the upstream status unless the local workflow already closed it
    private static void syncResolvedAt(FindingsEntity entity, Instant at) {
        if (entity.isUpstreamTerminal()) {
            if (entity.getResolvedAt() == null) entity.setResolvedAt(at);
        } else if (!entity.getLocalStatus().isTerminal()) {
            entity.setResolvedAt(null);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MESSAGE_MAX) return message;
        return message.substring(0, MESSAGE_MAX);
    }
}
