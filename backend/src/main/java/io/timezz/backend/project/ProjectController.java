package io.timezz.backend.project;

import io.timezz.backend.report.ReportService;
import io.timezz.backend.report.dto.ProjectSummary;
import io.timezz.backend.security.UserContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

  private final ProjectService projectService;
  private final ReportService reportService;

  public ProjectController(ProjectService projectService, ReportService reportService) {
    this.projectService = projectService;
    this.reportService = reportService;
  }

  @GetMapping
  public ResponseEntity<List<ProjectResponse>> listProjects() {
    UUID userId = UserContext.requireUserId();
    var summaries = reportService.projectSummaries(userId);
    var projects =
        projectService.listProjects(userId).stream()
            .map(
                p ->
                    ProjectResponse.from(
                        p, summaries.getOrDefault(p.getId(), ProjectSummary.empty(p.getId()))))
            .toList();
    return ResponseEntity.ok(projects);
  }

  @PostMapping
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody ProjectRequest request) {
    var project = projectService.create(UserContext.requireUserId(), request.toFields());
    return ResponseEntity.created(URI.create("/api/v1/projects/" + project.getId()))
        .body(ProjectResponse.from(project, ProjectSummary.empty(project.getId())));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID id) {
    UUID userId = UserContext.requireUserId();
    var project = projectService.getProject(userId, id);
    var summary =
        reportService.projectSummaries(userId).getOrDefault(id, ProjectSummary.empty(id));
    return ResponseEntity.ok(ProjectResponse.from(project, summary));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID id, @Valid @RequestBody ProjectRequest request) {
    UUID userId = UserContext.requireUserId();
    var project = projectService.update(userId, id, request.toFields());
    var summary =
        reportService.projectSummaries(userId).getOrDefault(id, ProjectSummary.empty(id));
    return ResponseEntity.ok(ProjectResponse.from(project, summary));
  }

  // --- DTOs ---

  public record ProjectRequest(
      UUID clientId,
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      String description,
      @Size(max = 255) String trelloBoardId,
      @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "color must be a hex color like #0079bf")
          String color,
      @PositiveOrZero(message = "hourlyRate must not be negative")
          @DecimalMax(value = "100000.00", message = "hourlyRate must not exceed 100000.00")
          @Digits(integer = 6, fraction = 2, message = "hourlyRate has at most 2 decimals")
          BigDecimal hourlyRate,
      Boolean billableByDefault,
      @PositiveOrZero(message = "budgetHours must not be negative") Double budgetHours,
      ProjectStatus status) {

    ProjectService.ProjectFields toFields() {
      return new ProjectService.ProjectFields(
          clientId,
          name,
          description,
          trelloBoardId,
          color,
          hourlyRate,
          billableByDefault,
          budgetHours,
          status);
    }
  }

  public record ProjectResponse(
      UUID id,
      UUID clientId,
      String name,
      String description,
      String trelloBoardId,
      String color,
      BigDecimal hourlyRate,
      boolean billableByDefault,
      Double budgetHours,
      ProjectStatus status,
      double totalHours,
      BigDecimal totalEarnings,
      long entryCount,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(Project project, ProjectSummary summary) {
      return new ProjectResponse(
          project.getId(),
          project.getClientId(),
          project.getName(),
          project.getDescription(),
          project.getTrelloBoardId(),
          project.getColor(),
          project.getHourlyRate(),
          project.isBillableByDefault(),
          project.getBudgetHours(),
          project.getStatus(),
          summary.totalHours(),
          summary.totalEarnings(),
          summary.entryCount(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }
}
