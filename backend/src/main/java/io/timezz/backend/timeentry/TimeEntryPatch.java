package io.timezz.backend.timeentry;

import java.util.List;

/** Fields of a closed entry that may be edited. {@code null} leaves the field unchanged. */
public record TimeEntryPatch(
    String description, Double durationMinutes, Boolean billable, List<String> tags) {}
