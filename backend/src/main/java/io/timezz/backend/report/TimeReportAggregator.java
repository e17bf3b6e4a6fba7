package io.timezz.backend.report;

import io.timezz.backend.report.dto.DailyBucket;
import io.timezz.backend.report.dto.GroupSubtotal;
import io.timezz.backend.report.dto.TimeReport;
import io.timezz.backend.timeentry.TimeEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Folds closed time entries into a {@link TimeReport}. Pure: reads only the figures already
 * computed at close time.
 */
final class TimeReportAggregator {

  static final String NO_PROJECT = "No project";
  static final String NO_BOARD = "No board";

  private TimeReportAggregator() {}

  static TimeReport aggregate(
      List<TimeEntry> entries,
      LocalDate from,
      LocalDate to,
      ZoneId zone,
      Map<UUID, String> projectNames) {
    var daily = new LinkedHashMap<LocalDate, Totals>();
    from.datesUntil(to.plusDays(1)).forEach(day -> daily.put(day, new Totals(null, null)));

    var byProject = new LinkedHashMap<String, Totals>();
    var byCard = new LinkedHashMap<String, Totals>();
    var byBoard = new LinkedHashMap<String, Totals>();
    var total = new Totals(null, null);
    double billableMinutes = 0;

    for (var entry : entries) {
      LocalDate day = entry.getStartTime().atZone(zone).toLocalDate();
      Totals bucket = daily.get(day);
      if (bucket == null) {
        continue;
      }
      bucket.add(entry);
      total.add(entry);
      if (entry.isBillable()) {
        billableMinutes += minutesOf(entry);
      }

      String projectKey = entry.getProjectId() != null ? entry.getProjectId().toString() : null;
      String projectLabel =
          entry.getProjectId() != null
              ? projectNames.getOrDefault(entry.getProjectId(), entry.getProjectId().toString())
              : NO_PROJECT;
      group(byProject, projectKey, projectLabel).add(entry);
      group(byCard, entry.getCardId(), entry.getCardName()).add(entry);
      group(byBoard, entry.getBoardId(), entry.getBoardId() != null ? entry.getBoardId() : NO_BOARD)
          .add(entry);
    }

    double ratio = total.minutes > 0 ? round(billableMinutes / total.minutes, 4) : 0.0;
    double average = total.count > 0 ? total.minutes / total.count : 0.0;

    return new TimeReport(
        from,
        to,
        total.minutes,
        hours(total.minutes),
        total.amount,
        billableMinutes,
        ratio,
        total.count,
        average,
        subtotals(byProject),
        subtotals(byCard),
        subtotals(byBoard),
        daily.entrySet().stream()
            .map(
                e ->
                    new DailyBucket(
                        e.getKey(),
                        e.getValue().minutes,
                        hours(e.getValue().minutes),
                        e.getValue().amount,
                        e.getValue().count))
            .toList());
  }

  static double hours(double minutes) {
    return round(minutes / 60.0, 2);
  }

  static double minutesOf(TimeEntry entry) {
    return entry.getDurationMinutes() != null ? entry.getDurationMinutes() : 0.0;
  }

  private static double round(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }

  // Entries without a grouping id share the empty key
  private static Totals group(Map<String, Totals> groups, String key, String label) {
    return groups.computeIfAbsent(key == null ? "" : key, k -> new Totals(key, label));
  }

  private static List<GroupSubtotal> subtotals(Map<String, Totals> groups) {
    Function<Totals, GroupSubtotal> toSubtotal =
        t -> new GroupSubtotal(t.key, t.label, t.minutes, hours(t.minutes), t.amount, t.count);
    return groups.values().stream()
        .sorted(Comparator.comparingDouble((Totals t) -> t.minutes).reversed())
        .map(toSubtotal)
        .toList();
  }

  private static final class Totals {

    private final String key;
    private final String label;
    private double minutes;
    private BigDecimal amount = BigDecimal.ZERO.setScale(2);
    private long count;

    private Totals(String key, String label) {
      this.key = key;
      this.label = label;
    }

    private void add(TimeEntry entry) {
      minutes += minutesOf(entry);
      if (entry.getAmount() != null) {
        amount = amount.add(entry.getAmount());
      }
      count++;
    }
  }
}
