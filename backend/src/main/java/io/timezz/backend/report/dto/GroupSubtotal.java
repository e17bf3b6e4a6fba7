package io.timezz.backend.report.dto;

import java.math.BigDecimal;

/**
 * Totals for one project, card or board. {@code key} is {@code null} for entries without that
 * grouping.
 */
public record GroupSubtotal(
    String key, String label, double minutes, double hours, BigDecimal amount, long entryCount) {}
