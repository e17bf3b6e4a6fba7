package io.timezz.backend.report;

import static org.assertj.core.api.Assertions.assertThat;

import io.timezz.backend.report.dto.DailyBucket;
import io.timezz.backend.timeentry.TimeEntry;
import io.timezz.backend.timeentry.TimeEntrySubject;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TimeReportAggregatorTest {

  private static final UUID USER_ID = UUID.randomUUID();
  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final LocalDate DAY_1 = LocalDate.of(2025, 3, 3);
  private static final LocalDate DAY_3 = LocalDate.of(2025, 3, 5);

  @Test
  void dayWithoutActivityIsZeroFilled() {
    var entries =
        List.of(
            closed("card-1", "board-1", PROJECT_ID, at(DAY_1, 9), 60, "60.00", true),
            closed("card-2", "board-1", null, at(DAY_3, 14), 30, "60.00", true));

    var report =
        TimeReportAggregator.aggregate(
            entries, DAY_1, DAY_3, ZoneOffset.UTC, Map.of(PROJECT_ID, "Client work"));

    assertThat(report.daily())
        .extracting(DailyBucket::date)
        .containsExactly(DAY_1, DAY_1.plusDays(1), DAY_3);
    var day2 = report.daily().get(1);
    assertThat(day2.minutes()).isZero();
    assertThat(day2.hours()).isZero();
    assertThat(day2.amount()).isEqualByComparingTo("0");
    assertThat(day2.entryCount()).isZero();
    assertThat(report.daily().get(0).minutes()).isEqualTo(60.0);
    assertThat(report.daily().get(2).amount()).isEqualByComparingTo("30.00");
  }

  @Test
  void totalsAndBillableRatio() {
    var entries =
        List.of(
            closed("card-1", "board-1", PROJECT_ID, at(DAY_1, 9), 90, "40.00", true),
            closed("card-1", "board-1", PROJECT_ID, at(DAY_1, 13), 30, "40.00", false),
            closed("card-2", null, null, at(DAY_3, 8), 60, null, true));

    var report =
        TimeReportAggregator.aggregate(
            entries, DAY_1, DAY_3, ZoneOffset.UTC, Map.of(PROJECT_ID, "Client work"));

    assertThat(report.totalMinutes()).isEqualTo(180.0);
    assertThat(report.totalHours()).isEqualTo(3.0);
    assertThat(report.totalAmount()).isEqualByComparingTo("60.00");
    assertThat(report.billableMinutes()).isEqualTo(150.0);
    assertThat(report.billableRatio()).isEqualTo(0.8333);
    assertThat(report.entryCount()).isEqualTo(3);
    assertThat(report.averageSessionMinutes()).isEqualTo(60.0);
  }

  @Test
  void subtotalsGroupByProjectCardAndBoard() {
    var entries =
        List.of(
            closed("card-1", "board-1", PROJECT_ID, at(DAY_1, 9), 90, "40.00", true),
            closed("card-1", "board-1", PROJECT_ID, at(DAY_1, 13), 30, "40.00", true),
            closed("card-2", null, null, at(DAY_3, 8), 60, null, true));

    var report =
        TimeReportAggregator.aggregate(
            entries, DAY_1, DAY_3, ZoneOffset.UTC, Map.of(PROJECT_ID, "Client work"));

    assertThat(report.byProject()).hasSize(2);
    assertThat(report.byProject().get(0).label()).isEqualTo("Client work");
    assertThat(report.byProject().get(0).minutes()).isEqualTo(120.0);
    assertThat(report.byProject().get(0).amount()).isEqualByComparingTo("80.00");
    assertThat(report.byProject().get(1).key()).isNull();
    assertThat(report.byProject().get(1).label()).isEqualTo(TimeReportAggregator.NO_PROJECT);

    assertThat(report.byCard()).hasSize(2);
    assertThat(report.byCard().get(0).key()).isEqualTo("card-1");
    assertThat(report.byCard().get(0).entryCount()).isEqualTo(2);

    assertThat(report.byBoard()).hasSize(2);
    assertThat(report.byBoard().get(1).label()).isEqualTo(TimeReportAggregator.NO_BOARD);
  }

  @Test
  void emptyRangeHasZeroRatioAndOneBucketPerDay() {
    var report =
        TimeReportAggregator.aggregate(
            List.of(), DAY_1, DAY_1.plusDays(6), ZoneOffset.UTC, Map.of());

    assertThat(report.daily()).hasSize(7);
    assertThat(report.totalMinutes()).isZero();
    assertThat(report.billableRatio()).isZero();
    assertThat(report.averageSessionMinutes()).isZero();
    assertThat(report.byProject()).isEmpty();
  }

  @Test
  void bucketsFollowReportingZone() {
    // 23:30 UTC on day 1 is already day 2 in Berlin
    var zone = ZoneId.of("Europe/Berlin");
    var entries =
        List.of(
            closed(
                "card-1",
                null,
                null,
                DAY_1.atTime(23, 30).toInstant(ZoneOffset.UTC),
                20,
                null,
                true));

    var report = TimeReportAggregator.aggregate(entries, DAY_1, DAY_3, zone, Map.of());

    assertThat(report.daily().get(0).entryCount()).isZero();
    assertThat(report.daily().get(1).entryCount()).isEqualTo(1);
  }

  private static Instant at(LocalDate day, int hour) {
    return day.atTime(hour, 0).toInstant(ZoneOffset.UTC);
  }

  private static TimeEntry closed(
      String cardId,
      String boardId,
      UUID projectId,
      Instant start,
      long minutes,
      String rate,
      boolean billable) {
    var entry =
        new TimeEntry(
            USER_ID,
            new TimeEntrySubject(cardId, "Card " + cardId, boardId, null),
            projectId,
            start,
            null,
            null,
            billable,
            false,
            start);
    entry.close(
        start.plus(Duration.ofMinutes(minutes)), rate != null ? new BigDecimal(rate) : null, "USD");
    return entry;
  }
}
