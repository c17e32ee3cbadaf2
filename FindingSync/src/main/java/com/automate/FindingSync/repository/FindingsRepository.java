package com.automate.FindingSync.repository;

import com.automate.FindingSync.entity.FindingType;
import com.automate.FindingSync.entity.FindingsEntity;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FindingsRepository extends JpaRepository<FindingsEntity, UUID>, JpaSpecificationExecutor<FindingsEntity> {
    Optional<FindingsEntity> findByProject_ProjectIdAndSonarKey(UUID projectId, String sonarKey);
    List<FindingsEntity> findByProject_ProjectId(UUID projectId, Sort sort);
    long countByProject_ProjectId(UUID projectId);
    long countByProject_ProjectIdAndType(UUID projectId, FindingType type);

    /** Candidates for stale-marking: not seen since {@code cutoff} and still open upstream. */
    @Query("select f from FindingsEntity f where f.project.projectId = :projectId " +
            "and f.lastSeenAt < :cutoff and (f.status is null or f.status not in :terminal)")
    List<FindingsEntity> findStaleCandidates(@Param("projectId") UUID projectId,
                                             @Param("cutoff") Instant cutoff,
                                             @Param("terminal") Collection<String> terminalStatuses);
}
