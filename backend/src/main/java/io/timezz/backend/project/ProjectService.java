package io.timezz.backend.project;

import io.timezz.backend.activity.ActivityLogService;
import io.timezz.backend.client.ClientRepository;
import io.timezz.backend.exception.InvalidStateException;
import io.timezz.backend.exception.ResourceNotFoundException;
import io.timezz.backend.timeentry.BillingCalculator;
import io.timezz.backend.user.PlanLimitService;
import io.timezz.backend.user.UserRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;
  private final UserRepository userRepository;
  private final PlanLimitService planLimitService;
  private final ClientRepository clientRepository;
  private final ActivityLogService activityLogService;
  private final Clock clock;

  public ProjectService(
      ProjectRepository projectRepository,
      UserRepository userRepository,
      ClientRepository clientRepository,
      PlanLimitService planLimitService,
      ActivityLogService activityLogService,
      Clock clock) {
    this.projectRepository = projectRepository;
    this.userRepository = userRepository;
    this.clientRepository = clientRepository;
    this.planLimitService = planLimitService;
    this.activityLogService = activityLogService;
    this.clock = clock;
  }

  /**
   * Editable project attributes. {@code null} color and status fall back to the defaults; a
   * {@code null} client leaves the project unlinked.
   */
  public record ProjectFields(
      UUID clientId,
      String name,
      String description,
      String trelloBoardId,
      String color,
      BigDecimal hourlyRate,
      Boolean billableByDefault,
      Double budgetHours,
      ProjectStatus status) {}

  @Transactional
  public Project create(UUID ownerId, ProjectFields fields) {
    validate(fields);
    var owner =
        userRepository
            .findById(ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("User", ownerId));
    planLimitService.requireProjectAllowance(owner);
    requireOwnedClient(ownerId, fields.clientId());

    var now = clock.instant();
    var project =
        new Project(
            ownerId, fields.name().trim(), fields.description(), fields.trelloBoardId(), now);
    project.update(
        fields.name().trim(),
        fields.description(),
        fields.trelloBoardId(),
        fields.color(),
        BillingCalculator.snapshotRate(fields.hourlyRate()),
        fields.billableByDefault() == null || fields.billableByDefault(),
        fields.budgetHours(),
        fields.status());
    project.assignClient(fields.clientId());
    project = projectRepository.save(project);

    activityLogService.record(
        ownerId,
        "project.created",
        ActivityLogService.ENTITY_PROJECT,
        project.getId(),
        Map.of("name", project.getName()));
    log.info("Created project {} for user {}", project.getId(), ownerId);
    return project;
  }

  @Transactional(readOnly = true)
  public List<Project> listProjects(UUID ownerId) {
    return projectRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
  }

  /** Projects of other users are reported as missing. */
  @Transactional(readOnly = true)
  public Project getProject(UUID ownerId, UUID projectId) {
    return projectRepository
        .findByIdAndOwnerId(projectId, ownerId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  @Transactional
  public Project update(UUID ownerId, UUID projectId, ProjectFields fields) {
    validate(fields);
    var project = getProject(ownerId, projectId);
    requireOwnedClient(ownerId, fields.clientId());

    var details = new LinkedHashMap<String, Object>();
    if (!Objects.equals(project.getName(), fields.name().trim())) {
      details.put("name", Map.of("from", project.getName(), "to", fields.name().trim()));
    }
    if (fields.hourlyRate() != null
        && (project.getHourlyRate() == null
            || project.getHourlyRate().compareTo(fields.hourlyRate()) != 0)) {
      details.put("hourly_rate", fields.hourlyRate());
    }
    if (!Objects.equals(project.getClientId(), fields.clientId())) {
      details.put("client_id", String.valueOf(fields.clientId()));
    }

    project.update(
        fields.name().trim(),
        fields.description(),
        fields.trelloBoardId(),
        fields.color(),
        BillingCalculator.snapshotRate(fields.hourlyRate()),
        fields.billableByDefault() == null
            ? project.isBillableByDefault()
            : fields.billableByDefault(),
        fields.budgetHours(),
        fields.status());
    project.assignClient(fields.clientId());
    project.touch(clock.instant());
    project = projectRepository.save(project);

    activityLogService.record(
        ownerId, "project.updated", ActivityLogService.ENTITY_PROJECT, project.getId(), details);
    log.info("Updated project {} for user {}", project.getId(), ownerId);
    return project;
  }

  /** Clients of other users are reported as missing. */
  private void requireOwnedClient(UUID ownerId, UUID clientId) {
    if (clientId != null && clientRepository.findByIdAndOwnerId(clientId, ownerId).isEmpty()) {
      throw new ResourceNotFoundException("Client", clientId);
    }
  }

  private static void validate(ProjectFields fields) {
    if (fields.name() == null || fields.name().isBlank()) {
      throw new InvalidStateException("Invalid project", "Project name is required");
    }
    BillingCalculator.requireValidRate(fields.hourlyRate());
    if (fields.budgetHours() != null && fields.budgetHours() < 0) {
      throw new InvalidStateException("Invalid budget", "Budget hours must not be negative");
    }
  }
}
