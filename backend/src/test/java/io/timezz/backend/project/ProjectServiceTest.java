package io.timezz.backend.project;

import static io.timezz.backend.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.timezz.backend.MutableClock;
import io.timezz.backend.activity.ActivityLogService;
import io.timezz.backend.client.Client;
import io.timezz.backend.client.ClientRepository;
import io.timezz.backend.exception.InvalidStateException;
import io.timezz.backend.exception.PlanLimitExceededException;
import io.timezz.backend.exception.ResourceNotFoundException;
import io.timezz.backend.user.PlanLimitService;
import io.timezz.backend.user.User;
import io.timezz.backend.user.UserRepository;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProjectServiceTest {

  private static final UUID OWNER_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-03-05T10:00:00Z");

  @Mock private ProjectRepository projectRepository;
  @Mock private UserRepository userRepository;
  @Mock private ClientRepository clientRepository;
  @Mock private PlanLimitService planLimitService;
  @Mock private ActivityLogService activityLogService;

  private MutableClock clock;
  private ProjectService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    service =
        new ProjectService(
            projectRepository,
            userRepository,
            clientRepository,
            planLimitService,
            activityLogService,
            clock);
  }

  @Test
  void create_appliesDefaultsAndRecordsActivity() {
    var owner = withId(new User("trello-1", null, "Owner", null, NOW), OWNER_ID);
    when(userRepository.findById(OWNER_ID)).thenReturn(Optional.of(owner));
    when(projectRepository.save(any(Project.class)))
        .thenAnswer(inv -> withId(inv.getArgument(0, Project.class), UUID.randomUUID()));

    var project =
        service.create(
            OWNER_ID,
            new ProjectService.ProjectFields(
                null,
                "  Website  ",
                null,
                "board-1",
                null,
                new BigDecimal("80"),
                null,
                null,
                null));

    assertThat(project.getName()).isEqualTo("Website");
    assertThat(project.getColor()).isEqualTo(Project.DEFAULT_COLOR);
    assertThat(project.isBillableByDefault()).isTrue();
    assertThat(project.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
    assertThat(project.getClientId()).isNull();
    assertThat(project.getCreatedAt()).isEqualTo(NOW);
    assertThat(project.getUpdatedAt()).isEqualTo(NOW);
    verify(activityLogService)
        .record(
            eq(OWNER_ID),
            eq("project.created"),
            eq(ActivityLogService.ENTITY_PROJECT),
            eq(project.getId()),
            anyMap());
  }

  @Test
  void create_linksClientOfTheSameOwner() {
    var clientId = UUID.randomUUID();
    var owner = withId(new User("trello-1", null, "Owner", null, NOW), OWNER_ID);
    when(userRepository.findById(OWNER_ID)).thenReturn(Optional.of(owner));
    when(clientRepository.findByIdAndOwnerId(clientId, OWNER_ID))
        .thenReturn(Optional.of(withId(new Client(OWNER_ID, "Acme", NOW), clientId)));
    when(projectRepository.save(any(Project.class))).thenAnswer(inv -> inv.getArgument(0));

    var project =
        service.create(
            OWNER_ID,
            new ProjectService.ProjectFields(
                clientId, "Website", null, null, null, null, null, null, null));

    assertThat(project.getClientId()).isEqualTo(clientId);
  }

  @Test
  void create_rejectsClientOfAnotherUser() {
    var clientId = UUID.randomUUID();
    var owner = withId(new User("trello-1", null, "Owner", null, NOW), OWNER_ID);
    when(userRepository.findById(OWNER_ID)).thenReturn(Optional.of(owner));
    when(clientRepository.findByIdAndOwnerId(clientId, OWNER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                service.create(
                    OWNER_ID,
                    new ProjectService.ProjectFields(
                        clientId, "Website", null, null, null, null, null, null, null)))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(projectRepository, never()).save(any());
  }

  @Test
  void create_stopsAtPlanLimit() {
    var owner = withId(new User("trello-1", null, "Owner", null, NOW), OWNER_ID);
    when(userRepository.findById(OWNER_ID)).thenReturn(Optional.of(owner));
    doThrow(new PlanLimitExceededException("Project limit reached"))
        .when(planLimitService)
        .requireProjectAllowance(owner);

    assertThatThrownBy(() -> service.create(OWNER_ID, fields("Fourth")))
        .isInstanceOf(PlanLimitExceededException.class);
    verify(projectRepository, never()).save(any());
  }

  @Test
  void create_rejectsBlankName() {
    assertThatThrownBy(() -> service.create(OWNER_ID, fields(" ")))
        .isInstanceOf(InvalidStateException.class);
    verify(userRepository, never()).findById(any());
  }

  @Test
  void create_rejectsNegativeRate() {
    var fields =
        new ProjectService.ProjectFields(
            null, "Site", null, null, null, new BigDecimal("-1"), null, null, null);

    assertThatThrownBy(() -> service.create(OWNER_ID, fields))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void create_rejectsRateAboveMaximum() {
    var fields =
        new ProjectService.ProjectFields(
            null, "Site", null, null, null, new BigDecimal("1000000000000"), null, null, null);

    assertThatThrownBy(() -> service.create(OWNER_ID, fields))
        .isInstanceOf(InvalidStateException.class);
    verify(projectRepository, never()).save(any());
  }

  @Test
  void getProject_hidesProjectsOfOtherUsers() {
    var projectId = UUID.randomUUID();
    when(projectRepository.findByIdAndOwnerId(projectId, OWNER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getProject(OWNER_ID, projectId))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void update_keepsBillableDefaultWhenOmitted() {
    var projectId = UUID.randomUUID();
    var project = withId(new Project(OWNER_ID, "Old", null, null, NOW), projectId);
    project.update("Old", null, null, null, null, false, null, null);
    when(projectRepository.findByIdAndOwnerId(projectId, OWNER_ID))
        .thenReturn(Optional.of(project));
    when(projectRepository.save(project)).thenReturn(project);
    clock.advance(Duration.ofHours(2));

    var updated =
        service.update(
            OWNER_ID,
            projectId,
            new ProjectService.ProjectFields(
                null, "New", null, null, "#ff0000", null, null, 12.5, ProjectStatus.PAUSED));

    assertThat(updated.getName()).isEqualTo("New");
    assertThat(updated.isBillableByDefault()).isFalse();
    assertThat(updated.getColor()).isEqualTo("#ff0000");
    assertThat(updated.getBudgetHours()).isEqualTo(12.5);
    assertThat(updated.getStatus()).isEqualTo(ProjectStatus.PAUSED);
    assertThat(updated.getCreatedAt()).isEqualTo(NOW);
    assertThat(updated.getUpdatedAt()).isEqualTo(NOW.plus(Duration.ofHours(2)));
    verify(activityLogService)
        .record(
            eq(OWNER_ID),
            eq("project.updated"),
            eq(ActivityLogService.ENTITY_PROJECT),
            eq(projectId),
            anyMap());
  }

  private static ProjectService.ProjectFields fields(String name) {
    return new ProjectService.ProjectFields(null, name, null, null, null, null, null, null, null);
  }
}
