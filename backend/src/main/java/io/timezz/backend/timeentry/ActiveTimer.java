package io.timezz.backend.timeentry;

/**
 * An open entry with its elapsed time as of the read. {@code elapsedMinutes} is computed per call
 * and never stored.
 */
public record ActiveTimer(TimeEntry entry, double elapsedMinutes) {}
