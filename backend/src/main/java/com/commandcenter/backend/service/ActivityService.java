package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.ActivityEntry;
import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.repo.ActivityRepository;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ActivityService {

    private final ActivityRepository activity;
    private final DashboardBroadcaster broadcaster;

    public ActivityService(ActivityRepository activity, DashboardBroadcaster broadcaster) {
        this.activity = activity;
        this.broadcaster = broadcaster;
    }

    /** Persists the line, then pushes it to live clients. */
    public ActivityEntry append(String message) {
        ActivityEntry entry = activity.append(message);
        broadcaster.broadcast(EventType.ACTIVITY, entry);
        return entry;
    }

    public List<ActivityEntry> since(int index) {
        return activity.since(index);
    }
}
