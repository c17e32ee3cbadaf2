package com.automate.FindingSync.Service;

import com.automate.FindingSync.dto.FindingFilter;
import com.automate.FindingSync.dto.response.CommentResponse;
import com.automate.FindingSync.dto.response.FindingResponse;
import com.automate.FindingSync.dto.response.FindingStatistics;
import com.automate.FindingSync.dto.response.HistoryResponse;
import com.automate.FindingSync.entity.FindingCommentsEntity;
import com.automate.FindingSync.entity.FindingHistoryEntity;
import com.automate.FindingSync.entity.FindingsEntity;
import com.automate.FindingSync.entity.HistoryAction;
import com.automate.FindingSync.entity.LocalStatus;
import com.automate.FindingSync.exception.FindingNotFoundException;
import com.automate.FindingSync.exception.InvalidLocalStatusTransitionException;
import com.automate.FindingSync.exception.ProjectNotFoundException;
import com.automate.FindingSync.repository.FindingCommentsRepository;
import com.automate.FindingSync.repository.FindingHistoryRepository;
import com.automate.FindingSync.repository.FindingSpecifications;
import com.automate.FindingSync.repository.FindingsRepository;
import com.automate.FindingSync.repository.ProjectsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Local triage of stored findings. Every change to a workflow field is
 * written to the finding's history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FindingService {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 4;
    private static final String ANONYMOUS = "anonymous";
    private static final int TOP_RULES = 10;

    private static final Sort BY_KEY = Sort.by("sonarKey");

    private final ProjectsRepository projectsRepository;
    private final FindingsRepository findingsRepository;
    private final FindingHistoryRepository historyRepository;
    private final FindingCommentsRepository commentsRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<FindingResponse> listFindings(UUID projectId, FindingFilter filter) {
        requireProject(projectId);
        // severity is stored as its name, so order by rank in memory
        return findingsRepository.findAll(FindingSpecifications.matching(projectId, filter),
                        Sort.by(Sort.Order.desc("lastSeenAt")))
                .stream()
                .sorted(Comparator.comparing(FindingsEntity::getSeverity).reversed())
                .map(FindingResponse::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public FindingResponse getFinding(UUID findingId) {
        return FindingResponse.of(load(findingId));
    }

    /**
     * Moves the finding through the local workflow. Same status is a no-op;
     * entering a terminal status stamps resolvedAt.
     */
    @Transactional
    public FindingResponse updateLocalStatus(UUID findingId, LocalStatus target, String performedBy) {
        FindingsEntity finding = load(findingId);
        LocalStatus current = finding.getLocalStatus();
        if (current == target) {
            return FindingResponse.of(finding);
        }
        if (!current.canTransitionTo(target)) {
            throw new InvalidLocalStatusTransitionException(current, target);
        }
        finding.setLocalStatus(target);
        if (target.isTerminal()) {
            finding.setResolvedAt(now());
        } else if (!finding.isUpstreamTerminal()) {
            finding.setResolvedAt(null);
        }
        record(finding, HistoryAction.STATUS_CHANGE, "local_status", current.name(), target.name(), performedBy);
        log.info("Finding {} moved {} -> {} by {}", findingId, current, target, actor(performedBy));
        return FindingResponse.of(finding);
    }

    @Transactional
    public FindingResponse assign(UUID findingId, String assignee, String performedBy) {
        FindingsEntity finding = load(findingId);
        String next = assignee == null || assignee.isBlank() ? null : assignee.trim();
        String previous = finding.getAssignedTo();
        if (!Objects.equals(previous, next)) {
            finding.setAssignedTo(next);
            record(finding, HistoryAction.ASSIGNMENT, "assigned_to", previous, next, performedBy);
        }
        return FindingResponse.of(finding);
    }

    @Transactional
    public FindingResponse updatePriority(UUID findingId, int priority, String performedBy) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
        FindingsEntity finding = load(findingId);
        int previous = finding.getPriority();
        if (previous != priority) {
            finding.setPriority(priority);
            record(finding, HistoryAction.PRIORITY_CHANGE, "priority",
                    String.valueOf(previous), String.valueOf(priority), performedBy);
        }
        return FindingResponse.of(finding);
    }

    @Transactional
    public FindingResponse updateDueDate(UUID findingId, LocalDate dueDate, String performedBy) {
        FindingsEntity finding = load(findingId);
        LocalDate previous = finding.getDueDate();
        if (!Objects.equals(previous, dueDate)) {
            finding.setDueDate(dueDate);
            record(finding, HistoryAction.DUE_DATE_CHANGE, "due_date",
                    previous != null ? previous.toString() : null,
                    dueDate != null ? dueDate.toString() : null, performedBy);
        }
        return FindingResponse.of(finding);
    }

    @Transactional(readOnly = true)
    public List<CommentResponse> getComments(UUID findingId) {
        load(findingId);
        return commentsRepository.findByFinding_FindingIdOrderByCreatedAtAsc(findingId)
                .stream().map(CommentResponse::of).toList();
    }

    @Transactional
    public CommentResponse addComment(UUID findingId, String author, String content) {
        FindingsEntity finding = load(findingId);
        FindingCommentsEntity comment = new FindingCommentsEntity();
        comment.setFinding(finding);
        comment.setAuthor(author.trim());
        comment.setContent(content);
        FindingCommentsEntity saved = commentsRepository.save(comment);
        record(finding, HistoryAction.COMMENT_ADDED, "comment", null, preview(content), author);
        return CommentResponse.of(saved);
    }

    @Transactional
    public CommentResponse updateComment(UUID commentId, String content) {
        FindingCommentsEntity comment = commentsRepository.findById(commentId)
                .orElseThrow(() -> FindingNotFoundException.comment(commentId));
        comment.setContent(content);
        return CommentResponse.of(commentsRepository.saveAndFlush(comment));
    }

    @Transactional
    public void deleteComment(UUID commentId) {
        FindingCommentsEntity comment = commentsRepository.findById(commentId)
                .orElseThrow(() -> FindingNotFoundException.comment(commentId));
        commentsRepository.delete(comment);
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<HistoryResponse> getHistory(UUID findingId, int limit) {
        load(findingId);
        int size = Math.min(Math.max(limit, 1), 500);
        return historyRepository.findByFinding_FindingIdOrderByCreatedAtDesc(findingId, PageRequest.of(0, size))
                .stream().map(HistoryResponse::of).toList();
    }

    @Transactional(readOnly = true)
    public FindingStatistics statistics(UUID projectId) {
        requireProject(projectId);
        List<FindingsEntity> findings = findingsRepository.findByProject_ProjectId(projectId, BY_KEY);

        long open = findings.stream().filter(f -> !f.isUpstreamTerminal()).count();
        long assigned = findings.stream().filter(f -> f.getAssignedTo() != null).count();

        Map<String, Long> bySeverity = countBy(findings, f -> f.getSeverity().name());
        Map<String, Long> byType = countBy(findings, f -> f.getType().name());
        Map<String, Long> byLocalStatus = countBy(findings, f -> f.getLocalStatus().name());

        Map<String, List<FindingsEntity>> byRule = findings.stream()
                .filter(f -> f.getRuleKey() != null)
                .collect(Collectors.groupingBy(FindingsEntity::getRuleKey));
        List<FindingStatistics.RuleCount> topRules = byRule.entrySet().stream()
                .map(e -> new FindingStatistics.RuleCount(e.getKey(), e.getValue().get(0).getRuleName(), e.getValue().size()))
                .sorted(Comparator.comparingLong(FindingStatistics.RuleCount::count).reversed()
                        .thenComparing(FindingStatistics.RuleCount::ruleKey))
                .limit(TOP_RULES)
                .toList();

        return new FindingStatistics(findings.size(), open, assigned, bySeverity, byType, byLocalStatus, topRules);
    }

    private static Map<String, Long> countBy(List<FindingsEntity> findings, Function<FindingsEntity, String> key) {
        return findings.stream().collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.counting()));
    }

    private void record(FindingsEntity finding, HistoryAction action, String field,
                        String oldValue, String newValue, String performedBy) {
        historyRepository.save(FindingHistoryEntity.of(finding, action, field, oldValue, newValue, actor(performedBy)));
    }

    private FindingsEntity load(UUID findingId) {
        return findingsRepository.findById(findingId).orElseThrow(() -> new FindingNotFoundException(findingId));
    }

    private void requireProject(UUID projectId) {
        if (!projectsRepository.existsById(projectId)) {
            throw new ProjectNotFoundException(projectId);
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static String actor(String performedBy) {
        return performedBy == null || performedBy.isBlank() ? ANONYMOUS : performedBy.trim();
    }

    private static String preview(String content) {
        return content.length() <= 200 ? content : content.substring(0, 200);
    }
}
