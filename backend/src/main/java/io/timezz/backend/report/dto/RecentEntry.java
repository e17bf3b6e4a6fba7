package io.timezz.backend.report.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record RecentEntry(
    UUID id,
    String cardId,
    String cardName,
    Instant startTime,
    Instant endTime,
    Double durationMinutes,
    BigDecimal amount) {}
