package io.timezz.backend.report.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Totals for one calendar day. Days without activity carry zeros. */
public record DailyBucket(
    LocalDate date, double minutes, double hours, BigDecimal amount, long entryCount) {}
