package io.timezz.backend.timeentry;

import java.time.Instant;
import java.util.UUID;

public record TimeEntryFilter(
    UUID projectId, String boardId, String cardId, Instant from, Instant to) {

  public static TimeEntryFilter none() {
    return new TimeEntryFilter(null, null, null, null, null);
  }
}
