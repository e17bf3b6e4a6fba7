package io.timezz.backend.timeentry;

import java.math.BigDecimal;
import java.util.UUID;

public interface ProjectTotalsProjection {

  UUID getProjectId();

  Double getTotalMinutes();

  BigDecimal getTotalAmount();

  Long getEntryCount();
}
