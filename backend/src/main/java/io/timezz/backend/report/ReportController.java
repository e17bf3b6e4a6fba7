package io.timezz.backend.report;

import io.timezz.backend.report.dto.BoardReport;
import io.timezz.backend.report.dto.DashboardSummary;
import io.timezz.backend.report.dto.TimeReport;
import io.timezz.backend.security.UserContext;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reports")
public class ReportController {

  private final ReportService reportService;

  public ReportController(ReportService reportService) {
    this.reportService = reportService;
  }

  @GetMapping("/time")
  public ResponseEntity<TimeReport> timeReport(
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
      @RequestParam(required = false) UUID projectId,
      @RequestParam(required = false) String boardId,
      @RequestParam(required = false) String cardId) {
    return ResponseEntity.ok(
        reportService.timeReport(
            UserContext.requireUserId(), from, to, projectId, boardId, cardId));
  }

  @GetMapping("/dashboard")
  public ResponseEntity<DashboardSummary> dashboard() {
    return ResponseEntity.ok(reportService.dashboard(UserContext.requireUserId()));
  }

  @GetMapping("/board/{boardId}")
  public ResponseEntity<BoardReport> boardReport(
      @PathVariable String boardId, @RequestParam(defaultValue = "30") int days) {
    return ResponseEntity.ok(
        reportService.boardReport(UserContext.requireUserId(), boardId, days));
  }
}
