package com.automate.FindingSync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "projects",
        uniqueConstraints = @UniqueConstraint(columnNames = {"sonar_url", "sonar_component", "branch"}))
public class ProjectsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID projectId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "sonar_url", nullable = false)
    private String sonarUrl;

    @Column(name = "sonar_component", nullable = false)
    private String sonarComponent;

    @Column(name = "sonar_token")
    private String sonarToken;

    @Column(name = "sonar_username")
    private String sonarUsername;

    @Column(name = "sonar_password")
    private String sonarPassword;

    @Column(name = "sonar_organization")
    private String sonarOrganization;

    @Column(name = "branch", nullable = false)
    private String branch = "main";

    @Column(name = "sync_enabled", nullable = false)
    private boolean syncEnabled = true;

    @Column(name = "sync_interval_minutes", nullable = false)
    private int syncIntervalMinutes = 60;

    @Column(name = "last_sync_at")
    private Instant lastSyncAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
