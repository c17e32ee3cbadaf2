package com.automate.FindingSync.repository;

import com.automate.FindingSync.entity.ProjectsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProjectsRepository extends JpaRepository<ProjectsEntity, UUID> {
    List<ProjectsEntity> findBySyncEnabledTrue();
    List<ProjectsEntity> findAllByOrderByNameAsc();
    boolean existsBySonarUrlAndSonarComponentAndBranch(String sonarUrl, String sonarComponent, String branch);

    @Modifying
    @Query("update ProjectsEntity p set p.lastSyncAt = :at where p.projectId = :projectId")
    int updateLastSyncAt(@Param("projectId") UUID projectId, @Param("at") Instant at);
}
