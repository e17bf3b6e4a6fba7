package io.timezz.backend.report.dto;

import java.math.BigDecimal;
import java.util.UUID;

/** All-time totals over the closed entries of every project linked to one client. */
public record ClientSummary(
    UUID clientId, long projectCount, double totalHours, BigDecimal totalEarnings) {

  public static ClientSummary empty(UUID clientId) {
    return new ClientSummary(clientId, 0, 0.0, BigDecimal.ZERO.setScale(2));
  }
}
