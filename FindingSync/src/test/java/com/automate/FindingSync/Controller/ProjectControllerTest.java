package com.automate.FindingSync.Controller;

import com.automate.FindingSync.repository.ProjectsRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ProjectControllerTest {

    private static final String PROJECT = """
            {"name":"Payments","sonarUrl":"https://sonar.example.com","sonarComponent":"org:payments",
             "sonarToken":"squ_secret","syncIntervalMinutes":30}""";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ProjectsRepository projectsRepository;

    @AfterEach
    void tearDown() {
        projectsRepository.deleteAll();
    }

    @Test
    void createReturnsLocationAndHidesToken() throws Exception {
        mvc.perform(post("/api/projects").contentType(MediaType.APPLICATION_JSON).content(PROJECT))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", containsString("/api/projects/")))
                .andExpect(jsonPath("$.name").value("Payments"))
                .andExpect(jsonPath("$.hasToken").value(true))
                .andExpect(jsonPath("$.sonarToken").doesNotExist());
    }

    @Test
    void duplicateProjectIsConflict() throws Exception {
        mvc.perform(post("/api/projects").contentType(MediaType.APPLICATION_JSON).content(PROJECT))
                .andExpect(status().isCreated());

        mvc.perform(post("/api/projects").contentType(MediaType.APPLICATION_JSON).content(PROJECT))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message", startsWith("Project already exists for org:payments")));
    }

    @Test
    void invalidBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/projects").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"x\",\"sonarUrl\":\"ftp://host\",\"sonarComponent\":\"c\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("must be an http(s) URL"));
    }

    @Test
    void unknownIdsAreNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        mvc.perform(get("/api/projects/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Project not found: " + id))
                .andExpect(jsonPath("$.path").value("/api/projects/" + id));

        mvc.perform(post("/api/projects/{id}/sync", id))
                .andExpect(status().isNotFound());

        mvc.perform(patch("/api/findings/{id}/status", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"ACKNOWLEDGED\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Finding not found: " + id));
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        mvc.perform(get("/api/projects/not-a-uuid"))
                .andExpect(status().isBadRequest());
    }
}
