package io.timezz.backend.report.dto;

import java.math.BigDecimal;

/** Today and this ISO week (Monday start) for the calling user. */
public record DashboardSummary(
    double todayHours,
    long todayEntries,
    double weekHours,
    BigDecimal weekEarnings,
    boolean timerRunning) {}
