package com.automate.FindingSync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one finished sync run. Kept when the project is deleted.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Immutable
@Table(name = "sync_executions", indexes = @Index(name = "idx_exec_project_started", columnList = "project_id, started_at"))
public class SyncExecutionEntity {

    public enum Outcome { SUCCESS, FAILED }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID executionId;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private Outcome status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(name = "issues_found")
    private int issuesFound;

    @Column(name = "hotspots_found")
    private int hotspotsFound;

    @Column(name = "findings_upserted")
    private int findingsUpserted;

    @Column(name = "stale_marked")
    private int staleMarked;

    @Column(name = "quality_gate")
    private String qualityGate;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "error_kind")
    private String errorKind;

    @Column(name = "http_status")
    private Integer httpStatus;

    @Column(name = "endpoint", length = 1000)
    private String endpoint;
}
