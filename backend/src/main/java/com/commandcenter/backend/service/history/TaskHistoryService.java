package com.commandcenter.backend.service.history;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.domain.Task;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.domain.history.HistoryPage;
import com.commandcenter.backend.domain.history.HistoryQuery;
import com.commandcenter.backend.domain.history.TaskStats;
import com.commandcenter.backend.repo.TaskRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only views over completed work. Everything is computed from the current task list on each call.
 */
@Service
public class TaskHistoryService {

    private static final String DEFAULT_PRIORITY = "medium";
    private static final String UNKNOWN_STATUS = "unknown";

    private final TaskRepository tasks;
    private final Clock clock;
    private final String defaultAgent;

    public TaskHistoryService(TaskRepository tasks, Clock clock, DashboardProperties props) {
        this.tasks = tasks;
        this.clock = clock;
        this.defaultAgent = props.getDefaultAgentName();
    }

    public HistoryPage history(HistoryQuery query) {
        List<Task> all = tasks.findAll();

        List<Task> matching = new ArrayList<>();
        for (Task t : all) {
            if (matches(t, query)) matching.add(t);
        }
        matching.sort(Comparator.comparing(TaskHistoryService::effectiveInstant,
                Comparator.nullsLast(Comparator.reverseOrder())));

        int total = matching.size();
        long start = (long) (query.page() - 1) * query.limit();
        long end = start + query.limit();
        List<Task> page = start >= total
                ? List.of()
                : matching.subList((int) start, (int) Math.min(total, end));

        Map<String, List<Task>> byWeek = new TreeMap<>(Comparator.reverseOrder());
        for (Task t : page) {
            Instant when = effectiveInstant(t);
            String key = when == null ? IsoWeeks.UNKNOWN : IsoWeeks.keyOf(when);
            byWeek.computeIfAbsent(key, k -> new ArrayList<>()).add(t);
        }
        List<HistoryPage.WeekGroup> weeks = new ArrayList<>();
        byWeek.forEach((key, list) -> weeks.add(new HistoryPage.WeekGroup(key, IsoWeeks.label(key), list)));

        return new HistoryPage(
                weeks,
                completedStats(all),
                new HistoryPage.Pagination(query.page(), query.limit(), total, end < total)
        );
    }

    public TaskStats stats() {
        List<Task> all = tasks.findAll();
        String thisWeek = thisWeekKey();
        String lastWeek = lastWeekKey();

        Map<String, Integer> byStatus = new LinkedHashMap<>();
        Map<String, Integer> byAgent = new LinkedHashMap<>();
        Map<String, Integer> byPriority = new LinkedHashMap<>();
        Map<String, Integer> timeline = new TreeMap<>();
        int completedThisWeek = 0;
        int completedLastWeek = 0;

        for (Task t : all) {
            byStatus.merge(t.getStatus() == null ? UNKNOWN_STATUS : t.getStatus(), 1, Integer::sum);
            if (!t.isCompleted()) continue;

            byAgent.merge(attribution(t), 1, Integer::sum);
            byPriority.merge(priority(t), 1, Integer::sum);
            Instant when = effectiveInstant(t);
            if (when == null) continue;
            String key = IsoWeeks.keyOf(when);
            timeline.merge(key, 1, Integer::sum);
            if (key.equals(thisWeek)) completedThisWeek++;
            else if (key.equals(lastWeek)) completedLastWeek++;
        }

        List<TaskStats.TimelinePoint> points = new ArrayList<>();
        timeline.forEach((week, count) -> points.add(new TaskStats.TimelinePoint(week, count)));

        int done = byStatus.getOrDefault(Task.DONE, 0);
        int archived = byStatus.getOrDefault(Task.ARCHIVE, 0);
        return new TaskStats(all.size(), done + archived, archived, completedThisWeek, completedLastWeek,
                byAgent, byPriority, byStatus, points);
    }

    private HistoryPage.Stats completedStats(List<Task> all) {
        String thisWeek = thisWeekKey();
        String lastWeek = lastWeekKey();

        int total = 0;
        int thisWeekCount = 0;
        int lastWeekCount = 0;
        Map<String, Integer> byAgent = new LinkedHashMap<>();
        Map<String, Integer> byPriority = new LinkedHashMap<>();
        double hoursSum = 0;
        int timed = 0;

        for (Task t : all) {
            if (!t.isCompleted()) continue;
            total++;
            byAgent.merge(attribution(t), 1, Integer::sum);
            byPriority.merge(priority(t), 1, Integer::sum);

            Instant when = effectiveInstant(t);
            if (when != null) {
                String key = IsoWeeks.keyOf(when);
                if (key.equals(thisWeek)) thisWeekCount++;
                else if (key.equals(lastWeek)) lastWeekCount++;
            }

            Optional<Instant> started = Timestamps.parse(t.getStartedAt());
            Optional<Instant> completed = Timestamps.parse(t.getCompletedAt());
            if (started.isPresent() && completed.isPresent()) {
                hoursSum += Duration.between(started.get(), completed.get()).toMillis() / 3_600_000.0;
                timed++;
            }
        }

        double avg = timed == 0 ? 0 : Math.round(hoursSum / timed * 10) / 10.0;
        return new HistoryPage.Stats(total, thisWeekCount, lastWeekCount, byAgent, byPriority, avg);
    }

    private static boolean matches(Task t, HistoryQuery q) {
        if (t.getStatus() == null || !q.statuses().contains(t.getStatus())) return false;

        if (!Timestamps.isBlank(q.text())) {
            String haystack = (nz(t.getTitle()) + " " + nz(t.getDescription()) + " " + nz(t.getAssignedTo()))
                    .toLowerCase(Locale.ROOT);
            if (!haystack.contains(q.text().toLowerCase(Locale.ROOT))) return false;
        }
        if (!Timestamps.isBlank(q.assignee())
                && !nz(t.getAssignedTo()).toLowerCase(Locale.ROOT).contains(q.assignee().toLowerCase(Locale.ROOT))) {
            return false;
        }

        if (q.from() != null || q.to() != null) {
            Instant when = effectiveInstant(t);
            if (when == null) return false;
            LocalDate day = when.atZone(ZoneOffset.UTC).toLocalDate();
            if (q.from() != null && day.isBefore(q.from())) return false;
            if (q.to() != null && day.isAfter(q.to())) return false;
        }
        return true;
    }

    private String attribution(Task t) {
        if (!Timestamps.isBlank(t.getAssignedTo())) return t.getAssignedTo();
        if (!Timestamps.isBlank(t.getCompletedBy())) return t.getCompletedBy();
        return defaultAgent;
    }

    private static String priority(Task t) {
        return t.getPriority() == null ? DEFAULT_PRIORITY : t.getPriority();
    }

    private static Instant effectiveInstant(Task t) {
        return Timestamps.parse(t.effectiveDate()).orElse(null);
    }

    private String thisWeekKey() {
        return IsoWeeks.keyOf(Timestamps.today(clock));
    }

    private String lastWeekKey() {
        return IsoWeeks.keyOf(Timestamps.today(clock).minusWeeks(1));
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
