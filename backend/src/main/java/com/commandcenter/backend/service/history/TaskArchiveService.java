package com.commandcenter.backend.service.history;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.repo.TaskRepository;
import com.commandcenter.backend.service.ActivityService;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

@Service
public class TaskArchiveService {

    private static final Logger log = LoggerFactory.getLogger(TaskArchiveService.class);

    private final TaskRepository tasks;
    private final ActivityService activity;
    private final DashboardBroadcaster broadcaster;
    private final Clock clock;
    private final Duration after;

    public TaskArchiveService(TaskRepository tasks, ActivityService activity, DashboardBroadcaster broadcaster,
                              Clock clock, DashboardProperties props) {
        this.tasks = tasks;
        this.activity = activity;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.after = props.getArchive().getAfter();
    }

    /**
     * Archives done tasks completed before the retention window. A sweep that finds nothing
     * writes nothing and broadcasts nothing.
     *
     * @return number of tasks archived
     */
    public int archiveOld() {
        Instant cutoff = clock.instant().minus(after);
        int count = tasks.archiveCompletedBefore(cutoff);
        if (count > 0) {
            activity.append("📦 Auto-archived " + count + " completed tasks older than " + after.toDays() + " days");
            broadcaster.broadcast(EventType.TASKS_ARCHIVED, Map.of("count", count));
            log.info("Archived {} completed tasks (cutoff {})", count, cutoff);
        }
        return count;
    }
}
