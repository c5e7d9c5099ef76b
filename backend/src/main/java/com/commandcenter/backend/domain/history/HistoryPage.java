package com.commandcenter.backend.domain.history;

import com.commandcenter.backend.domain.Task;

import java.util.List;
import java.util.Map;

public record HistoryPage(
        List<WeekGroup> weeks,
        Stats stats,
        Pagination pagination
) {
    public record WeekGroup(String weekKey, String weekLabel, List<Task> tasks) {}

    /** Computed over every done/archive task, regardless of the query filters. */
    public record Stats(
            int totalCompleted,
            int thisWeek,
            int lastWeek,
            Map<String, Integer> byAgent,
            Map<String, Integer> byPriority,
            double avgCompletionTimeHours
    ) {}

    public record Pagination(int page, int limit, int total, boolean hasMore) {}
}
