package com.automate.FindingSync.Service;

import com.automate.FindingSync.dto.request.ProjectRequest;
import com.automate.FindingSync.dto.response.ProjectResponse;
import com.automate.FindingSync.dto.response.ProjectSummary;
import com.automate.FindingSync.entity.ProjectsEntity;
import com.automate.FindingSync.entity.ScansEntity;
import com.automate.FindingSync.exception.ProjectNotFoundException;
import com.automate.FindingSync.repository.ProjectsRepository;
import com.automate.FindingSync.repository.ScansRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import({ProjectService.class, FindingService.class, SyncRunRegistry.class})
class ProjectServiceTest {

    static final Instant NOW = Instant.parse("2024-05-03T09:30:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired private ProjectService service;
    @Autowired private ProjectsRepository projectsRepository;
    @Autowired private ScansRepository scansRepository;
    @Autowired private TestEntityManager em;

    private static ProjectRequest request(String component, String branch) {
        ProjectRequest req = new ProjectRequest();
        req.setName(" Payments ");
        req.setSonarUrl("https://sonar.example.com/");
        req.setSonarComponent(component);
        req.setBranch(branch);
        req.setSonarToken("squ_secret");
        return req;
    }

    @Test
    void createNormalizesAndHidesSecrets() {
        ProjectResponse created = service.createProject(request("org:payments", null));

        assertThat(created.name()).isEqualTo("Payments");
        assertThat(created.sonarUrl()).isEqualTo("https://sonar.example.com");
        assertThat(created.branch()).isEqualTo("main");
        assertThat(created.hasToken()).isTrue();
        assertThat(created.syncEnabled()).isTrue();
        assertThat(created.syncIntervalMinutes()).isEqualTo(60);
    }

    @Test
    void duplicateIdentityIsAConflict() {
        service.createProject(request("org:payments", "main"));

        assertThatThrownBy(() -> service.createProject(request("org:payments", " ")))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getStatusCode().value()).isEqualTo(409));
        assertThat(service.createProject(request("org:payments", "develop")).branch()).isEqualTo("develop");
    }

    @Test
    void updateWithoutSecretsKeepsStoredOnes() {
        UUID id = service.createProject(request("org:payments", null)).projectId();
        ProjectRequest update = request("org:payments", null);
        update.setSonarToken(null);
        update.setName("Payments API");
        update.setSyncIntervalMinutes(15);

        ProjectResponse updated = service.updateProject(id, update);

        assertThat(updated.name()).isEqualTo("Payments API");
        assertThat(updated.syncIntervalMinutes()).isEqualTo(15);
        assertThat(projectsRepository.findById(id).orElseThrow().getSonarToken()).isEqualTo("squ_secret");
    }

    @Test
    void deleteAndLookupOfUnknownProjectIsNotFound() {
        UUID id = service.createProject(request("org:payments", null)).projectId();

        service.deleteProject(id);
        em.flush();

        assertThatThrownBy(() -> service.getProject(id)).isInstanceOf(ProjectNotFoundException.class);
        assertThatThrownBy(() -> service.deleteProject(id)).isInstanceOf(ProjectNotFoundException.class);
    }

    @Test
    void dueProjectsAreNeverSyncedOrPastTheirInterval() {
        ProjectsEntity never = project("never", null, 60, true);
        ProjectsEntity recent = project("recent", NOW.minus(Duration.ofMinutes(10)), 60, true);
        ProjectsEntity overdue = project("overdue", NOW.minus(Duration.ofMinutes(60)), 60, true);
        project("disabled", null, 60, false);

        assertThat(service.findDueForSync(NOW)).extracting(ProjectsEntity::getName)
                .containsExactlyInAnyOrder("never", "overdue");
        assertThat(ProjectService.isDue(never, NOW)).isTrue();
        assertThat(ProjectService.isDue(recent, NOW)).isFalse();
        assertThat(ProjectService.isDue(overdue, NOW)).isTrue();
    }

    @Test
    void touchLastSyncTakesProjectOutOfTheDueList() {
        ProjectsEntity never = project("never", null, 60, true);

        service.touchLastSync(never.getProjectId(), NOW);
        em.clear();

        assertThat(projectsRepository.findById(never.getProjectId()).orElseThrow().getLastSyncAt()).isEqualTo(NOW);
        assertThat(service.findDueForSync(NOW)).isEmpty();
        assertThatThrownBy(() -> service.touchLastSync(UUID.randomUUID(), NOW))
                .isInstanceOf(ProjectNotFoundException.class);
    }

    @Test
    void summaryCarriesLatestScanStatisticsAndIdleStatus() {
        ProjectsEntity project = project("payments", null, 60, true);
        scansRepository.save(scan(project, NOW.minus(Duration.ofDays(40)), 9));
        scansRepository.save(scan(project, NOW.minus(Duration.ofDays(2)), 4));
        em.flush();

        ProjectSummary summary = service.getSummary(project.getProjectId());

        assertThat(summary.latestScan().totalIssues()).isEqualTo(4);
        assertThat(summary.statistics().total()).isZero();
        assertThat(summary.syncStatus().getStatus().json()).isEqualTo("idle");
        assertThat(service.getScanTrend(project.getProjectId(), 30)).hasSize(1);
        assertThat(service.getScans(project.getProjectId(), 10)).hasSize(2);
    }

    private ProjectsEntity project(String name, Instant lastSyncAt, int interval, boolean enabled) {
        ProjectsEntity p = new ProjectsEntity();
        p.setName(name);
        p.setSonarUrl("http://sonar.local");
        p.setSonarComponent(name);
        p.setLastSyncAt(lastSyncAt);
        p.setSyncIntervalMinutes(interval);
        p.setSyncEnabled(enabled);
        return projectsRepository.saveAndFlush(p);
    }

    private static ScansEntity scan(ProjectsEntity project, Instant date, int total) {
        ScansEntity s = new ScansEntity();
        s.setProject(project);
        s.setScanDate(date);
        s.setTotalIssues(total);
        return s;
    }
}
