package io.timezz.backend.activity;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes and reads the per-user activity log.
 *
 * <p>{@code record()} participates in the caller's transaction. If the domain change rolls back,
 * its activity row rolls back too.
 */
@Service
public class ActivityLogService {

  public static final String ENTITY_TIME_ENTRY = "TIME_ENTRY";
  public static final String ENTITY_PROJECT = "PROJECT";
  public static final String ENTITY_CLIENT = "CLIENT";

  static final int MAX_LIMIT = 100;

  private static final Logger log = LoggerFactory.getLogger(ActivityLogService.class);

  private final ActivityLogRepository activityLogRepository;
  private final Clock clock;

  public ActivityLogService(ActivityLogRepository activityLogRepository, Clock clock) {
    this.activityLogRepository = activityLogRepository;
    this.clock = clock;
  }

  @Transactional
  public void record(
      UUID userId, String action, String entityType, UUID entityId, Map<String, Object> details) {
    var entry =
        new ActivityLog(
            userId,
            action,
            entityType,
            entityId,
            details != null ? new HashMap<>(details) : Map.of(),
            clock.instant());
    activityLogRepository.save(entry);
    log.debug("Recorded activity: action={}, entity={}/{}", action, entityType, entityId);
  }

  @Transactional(readOnly = true)
  public List<ActivityItem> recent(UUID userId, int limit) {
    int size = Math.max(1, Math.min(limit, MAX_LIMIT));
    return activityLogRepository
        .findByUserIdOrderByOccurredAtDesc(userId, PageRequest.of(0, size))
        .stream()
        .map(ActivityItem::from)
        .toList();
  }
}
