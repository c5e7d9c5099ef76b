package com.commandcenter.backend.domain.history;

import java.util.List;
import java.util.Map;

public record TaskStats(
        int totalTasks,
        int totalCompleted,
        int totalArchived,
        int completedThisWeek,
        int completedLastWeek,
        Map<String, Integer> byAgent,
        Map<String, Integer> byPriority,
        Map<String, Integer> byStatus,
        List<TimelinePoint> timeline
) {
    public record TimelinePoint(String week, int count) {}
}
