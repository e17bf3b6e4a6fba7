package io.timezz.backend.report.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate over the closed entries of one user whose start falls between {@code from} and {@code
 * to}, both inclusive. {@code daily} has exactly one bucket per day of that range.
 */
public record TimeReport(
    LocalDate from,
    LocalDate to,
    double totalMinutes,
    double totalHours,
    BigDecimal totalAmount,
    double billableMinutes,
    double billableRatio,
    long entryCount,
    double averageSessionMinutes,
    List<GroupSubtotal> byProject,
    List<GroupSubtotal> byCard,
    List<GroupSubtotal> byBoard,
    List<DailyBucket> daily) {}
