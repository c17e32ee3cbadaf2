package com.automate.FindingSync.repository;

import com.automate.FindingSync.entity.SyncExecutionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SyncExecutionRepository extends JpaRepository<SyncExecutionEntity, UUID> {
    List<SyncExecutionEntity> findByProjectIdOrderByStartedAtDesc(UUID projectId, Pageable pageable);
    long countByProjectId(UUID projectId);
}
