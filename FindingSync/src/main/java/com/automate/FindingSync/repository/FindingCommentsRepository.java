package com.automate.FindingSync.repository;

import com.automate.FindingSync.entity.FindingCommentsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FindingCommentsRepository extends JpaRepository<FindingCommentsEntity, UUID> {
    List<FindingCommentsEntity> findByFinding_FindingIdOrderByCreatedAtAsc(UUID findingId);
}
