package io.timezz.backend.timeentry;

import io.timezz.backend.exception.InvalidStateException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/** Duration and amount arithmetic shared by every path that closes or edits a time entry. */
public final class BillingCalculator {

  /** Upper bound for any hourly rate accepted from a caller. */
  public static final BigDecimal MAX_HOURLY_RATE = new BigDecimal("100000.00");

  /** Longest duration a manual or edited entry may claim: one leap year. */
  public static final double MAX_ENTRY_MINUTES = 366 * 24 * 60;

  /** Integer digits of the {@code numeric(12, 2)} money columns. */
  static final int MONEY_INTEGER_DIGITS = 10;

  private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

  private BillingCalculator() {}

  /** Elapsed minutes between two instants, as a fractional value. */
  public static double durationMinutes(Instant start, Instant end) {
    return Duration.between(start, end).toMillis() / 60_000.0;
  }

  /** Rounds a rate to the two decimals it is stored with; {@code null} stays {@code null}. */
  public static BigDecimal snapshotRate(BigDecimal hourlyRate) {
    return hourlyRate != null ? hourlyRate.setScale(2, RoundingMode.HALF_UP) : null;
  }

  /**
   * @throws InvalidStateException if the rate is negative or above {@link #MAX_HOURLY_RATE}
   */
  public static void requireValidRate(BigDecimal hourlyRate) {
    if (hourlyRate == null) {
      return;
    }
    if (hourlyRate.signum() < 0) {
      throw new InvalidStateException("Invalid rate", "Hourly rate must not be negative");
    }
    if (hourlyRate.compareTo(MAX_HOURLY_RATE) > 0) {
      throw new InvalidStateException(
          "Invalid rate", "Hourly rate must not exceed " + MAX_HOURLY_RATE.toPlainString());
    }
  }

  /**
   * Computes {@code round((minutes / 60) * rate, 2)}. Returns {@code null} when the entry is not
   * billable or no positive rate applies, so that "not billable" stays distinguishable from a
   * zero amount.
   *
   * @throws InvalidStateException if the amount does not fit the stored money precision
   */
  public static BigDecimal amount(double durationMinutes, BigDecimal hourlyRate, boolean billable) {
    if (!billable || hourlyRate == null || hourlyRate.signum() <= 0) {
      return null;
    }
    BigDecimal amount =
        BigDecimal.valueOf(durationMinutes)
            .multiply(hourlyRate)
            .divide(MINUTES_PER_HOUR, 2, RoundingMode.HALF_UP);
    if (amount.precision() - amount.scale() > MONEY_INTEGER_DIGITS) {
      throw new InvalidStateException(
          "Amount out of range", "Computed amount " + amount.toPlainString() + " is too large");
    }
    return amount;
  }
}
