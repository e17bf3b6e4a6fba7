package io.timezz.backend.timeentry;

import io.timezz.backend.exception.InvalidStateException;

/**
 * The Trello card a time entry is tracked against. Identifiers are opaque; only presence is
 * checked.
 */
public record TimeEntrySubject(String cardId, String cardName, String boardId, String listName) {

  public TimeEntrySubject {
    if (cardId == null || cardId.isBlank()) {
      throw new InvalidStateException("Missing card", "Card id is required");
    }
    if (cardName == null || cardName.isBlank()) {
      throw new InvalidStateException("Missing card", "Card name is required");
    }
  }
}
