package io.timezz.backend.report;

import io.timezz.backend.config.TimezzProperties;
import io.timezz.backend.exception.InvalidStateException;
import io.timezz.backend.project.Project;
import io.timezz.backend.project.ProjectRepository;
import io.timezz.backend.report.dto.BoardReport;
import io.timezz.backend.report.dto.ClientSummary;
import io.timezz.backend.report.dto.DashboardSummary;
import io.timezz.backend.report.dto.ProjectSummary;
import io.timezz.backend.report.dto.RecentEntry;
import io.timezz.backend.report.dto.TimeReport;
import io.timezz.backend.timeentry.ProjectTotalsProjection;
import io.timezz.backend.timeentry.TimeEntry;
import io.timezz.backend.timeentry.TimeEntryRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only aggregation over closed time entries. Day boundaries follow the configured reporting
 * zone and an entry counts on the day it started. Nothing is cached.
 */
@Service
public class ReportService {

  static final int MAX_BOARD_DAYS = 365;

  private final TimeEntryRepository timeEntryRepository;
  private final ProjectRepository projectRepository;
  private final Clock clock;
  private final ZoneId zone;
  private final int maxRangeDays;

  public ReportService(
      TimeEntryRepository timeEntryRepository,
      ProjectRepository projectRepository,
      TimezzProperties properties,
      Clock clock) {
    this.timeEntryRepository = timeEntryRepository;
    this.projectRepository = projectRepository;
    this.clock = clock;
    this.zone = properties.reporting().zoneId();
    this.maxRangeDays = properties.reporting().maxRangeDays();
  }

  @Transactional(readOnly = true)
  public TimeReport timeReport(
      UUID userId,
      LocalDate from,
      LocalDate to,
      UUID projectId,
      String boardId,
      String cardId) {
    if (from == null || to == null) {
      throw new InvalidStateException("Invalid range", "Both from and to dates are required");
    }
    if (to.isBefore(from)) {
      throw new InvalidStateException("Invalid range", "'to' must not be before 'from'");
    }
    long days = ChronoUnit.DAYS.between(from, to) + 1;
    if (days > maxRangeDays) {
      throw new InvalidStateException(
          "Invalid range",
          "Report range of %d days exceeds the maximum of %d days".formatted(days, maxRangeDays));
    }

    var entries =
        timeEntryRepository.findClosedInRange(
            userId, startOf(from), startOf(to.plusDays(1)), projectId, boardId, cardId);
    Map<UUID, String> projectNames =
        projectRepository.findByOwnerIdOrderByCreatedAtDesc(userId).stream()
            .collect(Collectors.toMap(Project::getId, Project::getName));
    return TimeReportAggregator.aggregate(entries, from, to, zone, projectNames);
  }

  @Transactional(readOnly = true)
  public DashboardSummary dashboard(UUID userId) {
    LocalDate today = LocalDate.now(clock.withZone(zone));
    LocalDate weekStart = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));

    var entries =
        timeEntryRepository.findClosedInRange(
            userId, startOf(weekStart), startOf(today.plusDays(1)), null, null, null);
    var todayEntries = entries.stream().filter(e -> startedOn(e, today)).toList();

    BigDecimal weekEarnings =
        entries.stream()
            .map(TimeEntry::getAmount)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);

    return new DashboardSummary(
        TimeReportAggregator.hours(sumMinutes(todayEntries)),
        todayEntries.size(),
        TimeReportAggregator.hours(sumMinutes(entries)),
        weekEarnings,
        timeEntryRepository.countByUserIdAndEndTimeIsNull(userId) > 0);
  }

  @Transactional(readOnly = true)
  public BoardReport boardReport(UUID userId, String boardId, int days) {
    if (boardId == null || boardId.isBlank()) {
      throw new InvalidStateException("Missing board", "Board id is required");
    }
    if (days < 1 || days > MAX_BOARD_DAYS) {
      throw new InvalidStateException(
          "Invalid range", "days must be between 1 and " + MAX_BOARD_DAYS);
    }
    LocalDate today = LocalDate.now(clock.withZone(zone));
    LocalDate weekStart = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    LocalDate periodStart = today.minusDays(days - 1L);
    LocalDate earliest = periodStart.isBefore(weekStart) ? periodStart : weekStart;

    var entries =
        timeEntryRepository.findClosedInRange(
            userId, startOf(earliest), startOf(today.plusDays(1)), null, boardId, null);

    var period = entries.stream().filter(e -> !startDate(e).isBefore(periodStart)).toList();
    double periodHours = TimeReportAggregator.hours(sumMinutes(period));
    var recent =
        timeEntryRepository
            .findTop10ByUserIdAndBoardIdAndEndTimeIsNotNullOrderByStartTimeDesc(userId, boardId)
            .stream()
            .map(
                e ->
                    new RecentEntry(
                        e.getId(),
                        e.getCardId(),
                        e.getCardName(),
                        e.getStartTime(),
                        e.getEndTime(),
                        e.getDurationMinutes(),
                        e.getAmount()))
            .toList();

    return new BoardReport(
        boardId,
        days,
        TimeReportAggregator.hours(
            sumMinutes(entries.stream().filter(e -> startedOn(e, today)).toList())),
        TimeReportAggregator.hours(
            sumMinutes(
                entries.stream().filter(e -> !startDate(e).isBefore(weekStart)).toList())),
        periodHours,
        period.size(),
        BigDecimal.valueOf(periodHours / days).setScale(2, RoundingMode.HALF_UP).doubleValue(),
        recent);
  }

  /** One summary per project of the user, including projects without entries. */
  @Transactional(readOnly = true)
  public Map<UUID, ProjectSummary> projectSummaries(UUID userId) {
    Map<UUID, ProjectTotalsProjection> totals =
        timeEntryRepository.sumByProject(userId).stream()
            .collect(Collectors.toMap(ProjectTotalsProjection::getProjectId, Function.identity()));
    return projectRepository.findByOwnerIdOrderByCreatedAtDesc(userId).stream()
        .collect(
            Collectors.toMap(
                Project::getId,
                project -> {
                  var row = totals.get(project.getId());
                  if (row == null) {
                    return ProjectSummary.empty(project.getId());
                  }
                  double minutes = row.getTotalMinutes() != null ? row.getTotalMinutes() : 0.0;
                  BigDecimal amount =
                      row.getTotalAmount() != null
                          ? row.getTotalAmount().setScale(2, RoundingMode.HALF_UP)
                          : BigDecimal.ZERO.setScale(2);
                  return new ProjectSummary(
                      project.getId(),
                      TimeReportAggregator.hours(minutes),
                      amount,
                      row.getEntryCount() != null ? row.getEntryCount() : 0);
                }));
  }

  /**
   * One summary per client that has at least one linked project. Totals cover the closed entries
   * of all linked projects.
   */
  @Transactional(readOnly = true)
  public Map<UUID, ClientSummary> clientSummaries(UUID userId) {
    Map<UUID, ProjectTotalsProjection> totals =
        timeEntryRepository.sumByProject(userId).stream()
            .collect(Collectors.toMap(ProjectTotalsProjection::getProjectId, Function.identity()));
    Map<UUID, Long> projectCounts = new HashMap<>();
    Map<UUID, Double> minutes = new HashMap<>();
    Map<UUID, BigDecimal> amounts = new HashMap<>();
    for (var project : projectRepository.findByOwnerIdOrderByCreatedAtDesc(userId)) {
      UUID clientId = project.getClientId();
      if (clientId == null) {
        continue;
      }
      projectCounts.merge(clientId, 1L, Long::sum);
      var row = totals.get(project.getId());
      if (row != null && row.getTotalMinutes() != null) {
        minutes.merge(clientId, row.getTotalMinutes(), Double::sum);
      }
      if (row != null && row.getTotalAmount() != null) {
        amounts.merge(clientId, row.getTotalAmount(), BigDecimal::add);
      }
    }
    return projectCounts.entrySet().stream()
        .collect(
            Collectors.toMap(
                Map.Entry::getKey,
                e ->
                    new ClientSummary(
                        e.getKey(),
                        e.getValue(),
                        TimeReportAggregator.hours(minutes.getOrDefault(e.getKey(), 0.0)),
                        amounts
                            .getOrDefault(e.getKey(), BigDecimal.ZERO)
                            .setScale(2, RoundingMode.HALF_UP))));
  }

  private Instant startOf(LocalDate day) {
    return day.atStartOfDay(zone).toInstant();
  }

  private LocalDate startDate(TimeEntry entry) {
    return entry.getStartTime().atZone(zone).toLocalDate();
  }

  private boolean startedOn(TimeEntry entry, LocalDate day) {
    return startDate(entry).equals(day);
  }

  private static double sumMinutes(List<TimeEntry> entries) {
    return entries.stream().mapToDouble(TimeReportAggregator::minutesOf).sum();
  }
}
