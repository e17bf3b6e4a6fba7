package io.timezz.backend.user;

import io.timezz.backend.config.TimezzProperties;
import io.timezz.backend.exception.PlanLimitExceededException;
import io.timezz.backend.project.ProjectRepository;
import io.timezz.backend.project.ProjectStatus;
import io.timezz.backend.timeentry.TimeEntryRepository;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import org.springframework.stereotype.Service;

/** Enforces the FREE-tier allowances. PRO and ENTERPRISE users are never limited. */
@Service
public class PlanLimitService {

  private final ProjectRepository projectRepository;
  private final TimeEntryRepository timeEntryRepository;
  private final TimezzProperties.Plans plans;
  private final ZoneId zone;

  public PlanLimitService(
      ProjectRepository projectRepository,
      TimeEntryRepository timeEntryRepository,
      TimezzProperties properties) {
    this.projectRepository = projectRepository;
    this.timeEntryRepository = timeEntryRepository;
    this.plans = properties.plans();
    this.zone = properties.reporting().zoneId();
  }

  public void requireProjectAllowance(User user) {
    if (!user.getSubscriptionTier().isLimited()) {
      return;
    }
    long current =
        projectRepository.countByOwnerIdAndStatusNot(user.getId(), ProjectStatus.ARCHIVED);
    if (current >= plans.freeMaxProjects()) {
      throw new PlanLimitExceededException(
          "Project limit reached (%d/%d). Upgrade to add more projects."
              .formatted(current, plans.freeMaxProjects()));
    }
  }

  /** Rejects new tracking once the closed hours of the current calendar month reach the cap. */
  public void requireTrackingAllowance(User user, Instant now) {
    if (!user.getSubscriptionTier().isLimited()) {
      return;
    }
    YearMonth month = YearMonth.from(now.atZone(zone));
    Instant from = month.atDay(1).atStartOfDay(zone).toInstant();
    Instant to = month.plusMonths(1).atDay(1).atStartOfDay(zone).toInstant();
    double hours = timeEntryRepository.sumClosedMinutes(user.getId(), from, to) / 60.0;
    if (hours >= plans.freeMaxMonthlyHours()) {
      throw new PlanLimitExceededException(
          "Monthly tracking limit reached (%.1f/%.1f hours). Upgrade to keep tracking."
              .formatted(hours, plans.freeMaxMonthlyHours()));
    }
  }
}
