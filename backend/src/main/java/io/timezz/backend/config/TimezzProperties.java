package io.timezz.backend.config;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the TimeZZ backend, bound once at startup from the {@code timezz.*}
 * namespace.
 *
 * @param security identity mode and session token settings
 * @param demo the single identity used when {@code security.mode=demo}
 * @param plans usage limits applied to FREE-tier users
 * @param reporting reporting zone and maximum report range
 */
@ConfigurationProperties(prefix = "timezz")
public record TimezzProperties(Security security, Demo demo, Plans plans, Reporting reporting) {

  public enum IdentityMode {
    JWT,
    DEMO
  }

  /**
   * @param mode how request identities are resolved
   * @param jwtSecret HS256 secret, at least 32 bytes
   * @param tokenTtl lifetime of issued session tokens
   * @param issuer {@code iss} claim of issued tokens, also validated on incoming tokens
   */
  public record Security(IdentityMode mode, String jwtSecret, Duration tokenTtl, String issuer) {}

  public record Demo(String trelloId, String name, String email) {}

  public record Plans(int freeMaxProjects, double freeMaxMonthlyHours) {}

  public record Reporting(String zone, int maxRangeDays) {

    public ZoneId zoneId() {
      return zone == null || zone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(zone);
    }
  }
}
