package io.timezz.backend.report;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.timezz.backend.TestcontainersConfiguration;
import org.junit.jupiter.api.BeforeAll;
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
class ReportIntegrationTest {

  private static final String MEMBER = "trello_report_user";

  @Autowired private MockMvc mockMvc;

  @BeforeAll
  void seedEntries() throws Exception {
    recordEntry("card-1", "board-r", "2025-02-10T09:00:00Z", "2025-02-10T11:00:00Z", true);
    recordEntry("card-2", "board-r", "2025-02-12T13:00:00Z", "2025-02-12T14:00:00Z", false);
  }

  @Test
  void timeReportTotalsAndBuckets() throws Exception {
    mockMvc
        .perform(
            get("/api/v1/reports/time")
                .param("from", "2025-02-10")
                .param("to", "2025-02-12")
                .with(memberJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalMinutes").value(180.0))
        .andExpect(jsonPath("$.totalHours").value(3.0))
        .andExpect(jsonPath("$.totalAmount").value(100.0))
        .andExpect(jsonPath("$.billableMinutes").value(120.0))
        .andExpect(jsonPath("$.entryCount").value(2))
        .andExpect(jsonPath("$.daily.length()").value(3))
        .andExpect(jsonPath("$.daily[1].minutes").value(0.0))
        .andExpect(jsonPath("$.byCard[0].key").value("card-1"));
  }

  @Test
  void invertedRangeIsRejected() throws Exception {
    mockMvc
        .perform(
            get("/api/v1/reports/time")
                .param("from", "2025-02-12")
                .param("to", "2025-02-10")
                .with(memberJwt()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void boardReportRejectsOutOfRangeDays() throws Exception {
    mockMvc
        .perform(get("/api/v1/reports/board/board-r").param("days", "0").with(memberJwt()))
        .andExpect(status().isBadRequest());
  }

  @Test
  void dashboardReportsIdleTimer() throws Exception {
    mockMvc
        .perform(get("/api/v1/reports/dashboard").with(memberJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.timerRunning").value(false));
  }

  private void recordEntry(
      String cardId, String boardId, String start, String end, boolean billable)
      throws Exception {
    mockMvc
        .perform(
            post("/api/v1/time/entries")
                .with(memberJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "cardId": "%s",
                      "cardName": "Report card",
                      "boardId": "%s",
                      "startTime": "%s",
                      "endTime": "%s",
                      "hourlyRate": 50,
                      "billable": %s
                    }
                    """
                        .formatted(cardId, boardId, start, end, billable)))
        .andExpect(status().isCreated());
  }

  private JwtRequestPostProcessor memberJwt() {
    return jwt().jwt(j -> j.subject(MEMBER));
  }
}
