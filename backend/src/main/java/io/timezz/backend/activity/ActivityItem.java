package io.timezz.backend.activity;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ActivityItem(
    UUID id,
    String action,
    String entityType,
    UUID entityId,
    Map<String, Object> details,
    Instant occurredAt) {

  public static ActivityItem from(ActivityLog log) {
    return new ActivityItem(
        log.getId(),
        log.getAction(),
        log.getEntityType(),
        log.getEntityId(),
        log.getDetails(),
        log.getOccurredAt());
  }
}
