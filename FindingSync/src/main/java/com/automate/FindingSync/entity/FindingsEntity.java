package com.automate.FindingSync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "findings",
        uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "sonar_key"}),
        indexes = {
                @Index(name = "idx_findings_project_last_seen", columnList = "project_id, last_seen_at"),
                @Index(name = "idx_findings_local_status", columnList = "local_status")
        })
public class FindingsEntity {

    /** Upstream statuses after which a finding counts as resolved. */
    public static final Set<String> TERMINAL_STATUSES = Set.of("CLOSED", "RESOLVED");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID findingId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private ProjectsEntity project;

    @Column(name = "sonar_key", nullable = false)
    private String sonarKey;

    @Column(name = "rule_key")
    private String ruleKey;

    @Column(name = "rule_name", length = 1000)
    private String ruleName;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false)
    private FindingType type;

    @Column(name = "status")
    private String status;

    @Column(name = "resolution")
    private String resolution;

    @Column(name = "component", length = 1000)
    private String component;

    @Column(name = "line")
    private Integer line;

    @Column(name = "message", length = 4000)
    private String message;

    @Column(name = "sonar_link", length = 2000)
    private String sonarLink;

    @Column(name = "effort")
    private String effort;

    @Column(name = "debt")
    private String debt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags")
    private List<String> tags;

    @Column(name = "first_seen_at", nullable = false)
    private Instant firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "local_status", nullable = false)
    private LocalStatus localStatus = LocalStatus.NEW;

    @Column(name = "assigned_to")
    private String assignedTo;

    @Column(name = "priority", nullable = false)
    private int priority = 0;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isUpstreamTerminal() {
        return status != null && TERMINAL_STATUSES.contains(status);
    }
}
