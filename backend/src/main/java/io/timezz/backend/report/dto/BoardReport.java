package io.timezz.backend.report.dto;

import java.util.List;

public record BoardReport(
    String boardId,
    int periodDays,
    double todayHours,
    double weekHours,
    double periodHours,
    long entryCount,
    double dailyAverageHours,
    List<RecentEntry> recentEntries) {}
