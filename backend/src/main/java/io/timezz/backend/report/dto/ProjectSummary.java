package io.timezz.backend.report.dto;

import java.math.BigDecimal;
import java.util.UUID;

/** All-time totals of one project's closed entries. */
public record ProjectSummary(
    UUID projectId, double totalHours, BigDecimal totalEarnings, long entryCount) {

  public static ProjectSummary empty(UUID projectId) {
    return new ProjectSummary(projectId, 0.0, BigDecimal.ZERO.setScale(2), 0);
  }
}
