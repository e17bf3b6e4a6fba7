package io.timezz.backend.timeentry;

import io.timezz.backend.project.Project;
import io.timezz.backend.user.User;
import java.math.BigDecimal;

/**
 * Resolves the hourly rate snapshotted onto an entry when it closes. Resolution order: project
 * rate, then the owner's default rate. The currency always comes from the owner.
 */
public final class RateResolver {

  private RateResolver() {}

  public record ResolvedRate(BigDecimal hourlyRate, String currency) {}

  public static ResolvedRate resolve(User owner, Project project) {
    if (project != null && project.effectiveRate() != null) {
      return new ResolvedRate(project.effectiveRate(), owner.getCurrency());
    }
    BigDecimal userRate = owner.getHourlyRate();
    if (userRate != null && userRate.signum() > 0) {
      return new ResolvedRate(userRate, owner.getCurrency());
    }
    return new ResolvedRate(null, owner.getCurrency());
  }
}
