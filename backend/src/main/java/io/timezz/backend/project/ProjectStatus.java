package io.timezz.backend.project;

public enum ProjectStatus {
  ACTIVE,
  PAUSED,
  COMPLETED,
  ARCHIVED
}
