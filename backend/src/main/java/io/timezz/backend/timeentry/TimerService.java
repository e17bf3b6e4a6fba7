package io.timezz.backend.timeentry;

import io.timezz.backend.activity.ActivityLogService;
import io.timezz.backend.exception.ForbiddenException;
import io.timezz.backend.exception.InvalidStateException;
import io.timezz.backend.exception.ResourceConflictException;
import io.timezz.backend.exception.ResourceNotFoundException;
import io.timezz.backend.project.Project;
import io.timezz.backend.project.ProjectRepository;
import io.timezz.backend.user.PlanLimitService;
import io.timezz.backend.user.User;
import io.timezz.backend.user.UserRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the timer lifecycle: at most one open entry per user, duration and amount computed once
 * at close, and billed entries frozen.
 *
 * <p>Every mutation of a user's open entry first locks that user's row, so concurrent starts and
 * stops of one user serialize. The partial unique index on open entries backs this up; a start
 * that still trips it is retried once in a fresh transaction.
 */
@Service
public class TimerService {

  private static final Logger log = LoggerFactory.getLogger(TimerService.class);

  static final int MAX_PAGE_SIZE = 100;
  private static final Instant FAR_FUTURE = Instant.parse("9999-12-31T00:00:00Z");

  private final TimeEntryRepository timeEntryRepository;
  private final ProjectRepository projectRepository;
  private final UserRepository userRepository;
  private final PlanLimitService planLimitService;
  private final ActivityLogService activityLogService;
  private final TransactionTemplate txTemplate;
  private final Clock clock;

  public TimerService(
      TimeEntryRepository timeEntryRepository,
      ProjectRepository projectRepository,
      UserRepository userRepository,
      PlanLimitService planLimitService,
      ActivityLogService activityLogService,
      PlatformTransactionManager txManager,
      Clock clock) {
    this.timeEntryRepository = timeEntryRepository;
    this.projectRepository = projectRepository;
    this.userRepository = userRepository;
    this.planLimitService = planLimitService;
    this.activityLogService = activityLogService;
    this.txTemplate = new TransactionTemplate(txManager);
    this.clock = clock;
  }

  /**
   * Starts a timer on {@code subject}. An open entry of the same user is closed first at the same
   * instant.
   *
   * @param billable explicit billable flag, or {@code null} to use the project's default
   */
  public TimeEntry start(
      UUID userId,
      TimeEntrySubject subject,
      UUID projectId,
      String description,
      List<String> tags,
      Boolean billable) {
    if (subject == null) {
      throw new InvalidStateException("Missing card", "Card id is required");
    }
    try {
      return txTemplate.execute(
          status -> doStart(userId, subject, projectId, description, tags, billable));
    } catch (DataIntegrityViolationException first) {
      log.warn("Concurrent timer start for user {}, retrying once", userId);
      try {
        return txTemplate.execute(
            status -> doStart(userId, subject, projectId, description, tags, billable));
      } catch (DataIntegrityViolationException second) {
        throw new ResourceConflictException(
            "Timer already running", "Another timer was started concurrently. Please retry.");
      }
    }
  }

  /**
   * Stops the user's open timer.
   *
   * @param discard delete the entry instead of keeping it; the returned entry still carries the
   *     computed figures
   */
  public TimeEntry stop(UUID userId, boolean discard) {
    return txTemplate.execute(
        status -> {
          var user = lockUser(userId);
          var entry =
              timeEntryRepository
                  .findFirstByUserIdAndEndTimeIsNull(userId)
                  .orElseThrow(
                      () ->
                          ResourceNotFoundException.withDetail(
                              "No active timer", "No active timer found for the current user"));
          Instant now = clock.instant();
          closeEntry(entry, user, now);
          entry.touch(now);

          if (discard) {
            timeEntryRepository.delete(entry);
            activityLogService.record(
                userId,
                "time_entry.discarded",
                ActivityLogService.ENTITY_TIME_ENTRY,
                entry.getId(),
                closeDetails(entry));
            log.info("Discarded timer {} for user {}", entry.getId(), userId);
          } else {
            entry = timeEntryRepository.save(entry);
            activityLogService.record(
                userId,
                "timer.stopped",
                ActivityLogService.ENTITY_TIME_ENTRY,
                entry.getId(),
                closeDetails(entry));
            log.info(
                "Stopped timer {} for user {}: {} minutes, amount={}",
                entry.getId(),
                userId,
                entry.getDurationMinutes(),
                entry.getAmount());
          }
          return entry;
        });
  }

  /**
   * Records an already-finished interval.
   *
   * @param hourlyRate explicit rate; when positive it takes precedence over project and user rates
   * @param billable explicit billable flag, or {@code null} to use the project's default
   */
  public TimeEntry recordManual(
      UUID userId,
      TimeEntrySubject subject,
      Instant start,
      Instant end,
      UUID projectId,
      BigDecimal hourlyRate,
      Boolean billable,
      String description,
      List<String> tags) {
    if (subject == null) {
      throw new InvalidStateException("Missing card", "Card id is required");
    }
    if (start == null || end == null || !end.isAfter(start)) {
      throw new InvalidStateException("Invalid range", "End time must be after start time");
    }
    if (start.isBefore(Instant.EPOCH) || end.isAfter(FAR_FUTURE)) {
      throw new InvalidStateException("Invalid range", "Entry times are out of range");
    }
    if (BillingCalculator.durationMinutes(start, end) > BillingCalculator.MAX_ENTRY_MINUTES) {
      throw new InvalidStateException(
          "Invalid range",
          "Entry must not exceed " + (long) BillingCalculator.MAX_ENTRY_MINUTES + " minutes");
    }
    BillingCalculator.requireValidRate(hourlyRate);
    return txTemplate.execute(
        status -> {
          var user = lockUser(userId);
          Instant now = clock.instant();
          planLimitService.requireTrackingAllowance(user, now);
          var project = projectId != null ? requireOwnedProject(projectId, userId) : null;

          var entry =
              new TimeEntry(
                  userId,
                  subject,
                  projectId,
                  start,
                  description,
                  tags,
                  resolveBillable(billable, project),
                  true,
                  now);
          var resolved = RateResolver.resolve(user, project);
          BigDecimal rate =
              hourlyRate != null && hourlyRate.signum() > 0 ? hourlyRate : resolved.hourlyRate();
          entry.close(end, rate, resolved.currency());
          entry = timeEntryRepository.save(entry);

          activityLogService.record(
              userId,
              "time_entry.created",
              ActivityLogService.ENTITY_TIME_ENTRY,
              entry.getId(),
              closeDetails(entry));
          log.info(
              "Recorded manual entry {} for user {}: {} minutes on card {}",
              entry.getId(),
              userId,
              entry.getDurationMinutes(),
              entry.getCardId());
          return entry;
        });
  }

  @Transactional(readOnly = true)
  public Optional<ActiveTimer> getActive(UUID userId) {
    Instant now = clock.instant();
    return timeEntryRepository
        .findFirstByUserIdAndEndTimeIsNull(userId)
        .map(
            entry ->
                new ActiveTimer(
                    entry, BillingCalculator.durationMinutes(entry.getStartTime(), now)));
  }

  @Transactional
  public TimeEntry editClosed(UUID userId, UUID entryId, TimeEntryPatch patch) {
    var entry = requireEditable(userId, entryId);

    var details = new LinkedHashMap<String, Object>();
    if (patch.durationMinutes() != null) {
      double oldDuration = entry.getDurationMinutes();
      entry.applyDuration(patch.durationMinutes());
      details.put(
          "duration_minutes", Map.of("from", oldDuration, "to", entry.getDurationMinutes()));
    }
    if (patch.billable() != null && patch.billable() != entry.isBillable()) {
      details.put("billable", Map.of("from", entry.isBillable(), "to", patch.billable()));
      entry.changeBillable(patch.billable());
    }
    if (patch.description() != null
        && !Objects.equals(patch.description(), entry.getDescription())) {
      details.put("description", patch.description());
    }
    entry.updateNotes(patch.description(), patch.tags());
    entry.touch(clock.instant());
    entry = timeEntryRepository.save(entry);

    activityLogService.record(
        userId, "time_entry.updated", ActivityLogService.ENTITY_TIME_ENTRY, entry.getId(), details);
    log.info("Updated time entry {} for user {}", entry.getId(), userId);
    return entry;
  }

  @Transactional
  public void deleteClosed(UUID userId, UUID entryId) {
    var entry = requireEditable(userId, entryId);
    timeEntryRepository.delete(entry);
    activityLogService.record(
        userId,
        "time_entry.deleted",
        ActivityLogService.ENTITY_TIME_ENTRY,
        entryId,
        Map.of("card_id", entry.getCardId()));
    log.info("Deleted time entry {} for user {}", entryId, userId);
  }

  /**
   * Attaches closed entries to an invoice reference. All entries are checked before any is
   * changed; afterwards they can no longer be edited or deleted.
   */
  @Transactional
  public List<TimeEntry> markBilled(UUID userId, List<UUID> entryIds, String invoiceReference) {
    if (entryIds == null || entryIds.isEmpty()) {
      throw new InvalidStateException("No entries", "At least one time entry id is required");
    }
    if (invoiceReference == null || invoiceReference.isBlank()) {
      throw new InvalidStateException("Missing invoice", "Invoice reference is required");
    }
    List<TimeEntry> entries =
        entryIds.stream()
            .distinct()
            .map(
                id ->
                    timeEntryRepository
                        .findById(id)
                        .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", id)))
            .toList();
    for (var entry : entries) {
      if (!entry.getUserId().equals(userId)) {
        throw new ForbiddenException(
            "Cannot bill time entry", "Time entry " + entry.getId() + " belongs to another user");
      }
      if (entry.isOpen()) {
        throw new InvalidStateException(
            "Time entry is running", "Stop the timer before billing entry " + entry.getId());
      }
      if (entry.isBilled()) {
        throw new ResourceConflictException(
            "Time entry already billed",
            "Time entry " + entry.getId() + " is billed on " + entry.getInvoiceReference());
      }
    }

    Instant now = clock.instant();
    for (var entry : entries) {
      entry.markBilled(invoiceReference, now);
      entry.touch(now);
      activityLogService.record(
          userId,
          "time_entry.billed",
          ActivityLogService.ENTITY_TIME_ENTRY,
          entry.getId(),
          Map.of("invoice_reference", invoiceReference));
    }
    var saved = timeEntryRepository.saveAll(entries);
    log.info(
        "Marked {} time entries billed on {} for user {}", saved.size(), invoiceReference, userId);
    return saved;
  }

  /** Newest first. Page size is capped at {@value #MAX_PAGE_SIZE}. */
  @Transactional(readOnly = true)
  public Page<TimeEntry> listEntries(UUID userId, TimeEntryFilter filter, int page, int size) {
    var pageable =
        PageRequest.of(
            Math.max(page, 0),
            Math.max(1, Math.min(size, MAX_PAGE_SIZE)),
            Sort.by(Sort.Direction.DESC, "startTime"));
    var f = filter != null ? filter : TimeEntryFilter.none();
    return timeEntryRepository.findByFilters(
        userId,
        f.projectId(),
        f.boardId(),
        f.cardId(),
        f.from() != null ? f.from() : Instant.EPOCH,
        f.to() != null ? f.to() : FAR_FUTURE,
        pageable);
  }

  private TimeEntry doStart(
      UUID userId,
      TimeEntrySubject subject,
      UUID projectId,
      String description,
      List<String> tags,
      Boolean billable) {
    var user = lockUser(userId);
    Instant now = clock.instant();

    var open = timeEntryRepository.findFirstByUserIdAndEndTimeIsNull(userId);
    if (open.isPresent()) {
      var previous = open.get();
      closeEntry(previous, user, now);
      previous.touch(now);
      // Flush before the insert: Hibernate orders inserts ahead of updates at commit
      timeEntryRepository.saveAndFlush(previous);
      activityLogService.record(
          userId,
          "timer.auto_closed",
          ActivityLogService.ENTITY_TIME_ENTRY,
          previous.getId(),
          closeDetails(previous));
      log.info(
          "Auto-closed timer {} for user {} after {} minutes",
          previous.getId(),
          userId,
          previous.getDurationMinutes());
    }

    planLimitService.requireTrackingAllowance(user, now);
    var project = projectId != null ? requireOwnedProject(projectId, userId) : null;

    var entry =
        new TimeEntry(
            userId,
            subject,
            projectId,
            now,
            description,
            tags,
            resolveBillable(billable, project),
            false,
            now);
    entry = timeEntryRepository.saveAndFlush(entry);

    activityLogService.record(
        userId,
        "timer.started",
        ActivityLogService.ENTITY_TIME_ENTRY,
        entry.getId(),
        Map.of("card_id", subject.cardId(), "card_name", subject.cardName()));
    log.info("Started timer {} for user {} on card {}", entry.getId(), userId, subject.cardId());
    return entry;
  }

  /**
   * Closes at {@code now}. A clock that reads at or before the start (skew between nodes) closes
   * the entry one millisecond after its start instead of failing the stop.
   */
  private void closeEntry(TimeEntry entry, User user, Instant now) {
    Instant end = now;
    if (!now.isAfter(entry.getStartTime())) {
      end = entry.getStartTime().plusMillis(1);
      log.warn(
          "Clock at {} is not after start {} of entry {}, closing at {}",
          now,
          entry.getStartTime(),
          entry.getId(),
          end);
    }
    Project project =
        entry.getProjectId() != null
            ? projectRepository.findById(entry.getProjectId()).orElse(null)
            : null;
    var resolved = RateResolver.resolve(user, project);
    entry.close(end, resolved.hourlyRate(), resolved.currency());
  }

  private User lockUser(UUID userId) {
    return userRepository
        .findByIdForUpdate(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  private Project requireOwnedProject(UUID projectId, UUID userId) {
    return projectRepository
        .findByIdAndOwnerId(projectId, userId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  private TimeEntry requireEditable(UUID userId, UUID entryId) {
    var entry =
        timeEntryRepository
            .findById(entryId)
            .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", entryId));
    if (!entry.getUserId().equals(userId)) {
      throw new ForbiddenException(
          "Cannot modify time entry", "Time entry " + entryId + " belongs to another user");
    }
    if (entry.isOpen()) {
      throw new ForbiddenException(
          "Cannot modify time entry", "Time entry " + entryId + " is still running");
    }
    if (entry.isBilled()) {
      throw new ForbiddenException(
          "Time entry is billed",
          "Time entry " + entryId + " is billed on " + entry.getInvoiceReference());
    }
    return entry;
  }

  private static boolean resolveBillable(Boolean billable, Project project) {
    if (billable != null) {
      return billable;
    }
    return project == null || project.isBillableByDefault();
  }

  private static Map<String, Object> closeDetails(TimeEntry entry) {
    var details = new LinkedHashMap<String, Object>();
    details.put("card_id", entry.getCardId());
    details.put("duration_minutes", entry.getDurationMinutes());
    if (entry.getAmount() != null) {
      details.put("amount", entry.getAmount());
      details.put("currency", entry.getCurrency());
    }
    return details;
  }
}
