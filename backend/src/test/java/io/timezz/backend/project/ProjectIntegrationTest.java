package io.timezz.backend.project;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.timezz.backend.TestcontainersConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class ProjectIntegrationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  void projectRateDrivesEntryAmountAndSummary() throws Exception {
    var owner = "trello_pr_rate";
    String projectId = createProject(owner, "Rated", "{\"hourlyRate\": 120}");

    mockMvc
        .perform(
            post("/api/v1/time/entries")
                .with(ownerJwt(owner))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "cardId": "card-p",
                      "cardName": "Rated work",
                      "projectId": "%s",
                      "startTime": "2025-03-04T09:00:00Z",
                      "endTime": "2025-03-04T09:30:00Z"
                    }
                    """
                        .formatted(projectId)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.hourlyRate").value(120.0))
        .andExpect(jsonPath("$.amount").value(60.0));

    mockMvc
        .perform(get("/api/v1/projects/" + projectId).with(ownerJwt(owner)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalHours").value(0.5))
        .andExpect(jsonPath("$.entryCount").value(1));
  }

  @Test
  void freeTierStopsAtThreeActiveProjects() throws Exception {
    var owner = "trello_pr_limit";
    for (int i = 1; i <= 3; i++) {
      createProject(owner, "Project " + i, "{}");
    }

    mockMvc
        .perform(
            post("/api/v1/projects")
                .with(ownerJwt(owner))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Project 4"}
                    """))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("PLAN_LIMIT_EXCEEDED"));
  }

  @Test
  void projectsOfOtherUsersAreNotFound() throws Exception {
    String projectId = createProject("trello_pr_owner", "Mine", "{}");

    mockMvc
        .perform(get("/api/v1/projects/" + projectId).with(ownerJwt("trello_pr_other")))
        .andExpect(status().isNotFound());
  }

  @Test
  void updateReplacesEditableFields() throws Exception {
    var owner = "trello_pr_update";
    String projectId = createProject(owner, "Draft", "{}");

    mockMvc
        .perform(
            put("/api/v1/projects/" + projectId)
                .with(ownerJwt(owner))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Final", "color": "#112233", "status": "COMPLETED"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Final"))
        .andExpect(jsonPath("$.color").value("#112233"))
        .andExpect(jsonPath("$.status").value("COMPLETED"));

    mockMvc
        .perform(get("/api/v1/activity").with(ownerJwt(owner)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].action").value("project.updated"));
  }

  private String createProject(String owner, String name, String extraJson) throws Exception {
    String body =
        extraJson.equals("{}")
            ? "{\"name\": \"%s\"}".formatted(name)
            : "{\"name\": \"%s\", %s".formatted(name, extraJson.substring(1));
    var result =
        mockMvc
            .perform(
                post("/api/v1/projects")
                    .with(ownerJwt(owner))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private JwtRequestPostProcessor ownerJwt(String trelloId) {
    return jwt().jwt(j -> j.subject(trelloId));
  }
}
