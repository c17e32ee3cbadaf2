package com.automate.FindingSync.repository;

import com.automate.FindingSync.entity.FindingHistoryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FindingHistoryRepository extends JpaRepository<FindingHistoryEntity, UUID> {
    List<FindingHistoryEntity> findByFinding_FindingIdOrderByCreatedAtDesc(UUID findingId, Pageable pageable);
    long countByFinding_FindingId(UUID findingId);
}
