package com.automate.FindingSync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate counts taken at the end of one successful sync. Never updated.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Immutable
@Table(name = "scans", indexes = @Index(name = "idx_scans_project_date", columnList = "project_id, scan_date"))
public class ScansEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID scanId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private ProjectsEntity project;

    @Column(name = "scan_date", nullable = false)
    private Instant scanDate;

    @Column(name = "total_issues", nullable = false)
    private int totalIssues;

    @Column(name = "blocker_count", nullable = false)
    private int blockerCount;

    @Column(name = "critical_count", nullable = false)
    private int criticalCount;

    @Column(name = "major_count", nullable = false)
    private int majorCount;

    @Column(name = "minor_count", nullable = false)
    private int minorCount;

    @Column(name = "info_count", nullable = false)
    private int infoCount;

    @Column(name = "hotspot_count", nullable = false)
    private int hotspotCount;

    @Column(name = "quality_gate_status")
    private String qualityGateStatus;

    @Column(name = "coverage")
    private Double coverage;

    @Column(name = "server_version")
    private String serverVersion;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata;
}
