package com.automate.FindingSync.repository;

import com.automate.FindingSync.entity.ScansEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ScansRepository extends JpaRepository<ScansEntity, UUID> {
    List<ScansEntity> findByProject_ProjectIdOrderByScanDateDesc(UUID projectId, Pageable pageable);
    Optional<ScansEntity> findFirstByProject_ProjectIdOrderByScanDateDesc(UUID projectId);
    List<ScansEntity> findByProject_ProjectIdAndScanDateGreaterThanEqualOrderByScanDateAsc(UUID projectId, Instant from);
    long countByProject_ProjectId(UUID projectId);
}
