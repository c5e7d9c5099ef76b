package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.domain.ScheduledItem;
import com.commandcenter.backend.repo.ScheduledRepository;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class ScheduledService {

    private final ScheduledRepository scheduled;
    private final DashboardBroadcaster broadcaster;

    public ScheduledService(ScheduledRepository scheduled, DashboardBroadcaster broadcaster) {
        this.scheduled = scheduled;
        this.broadcaster = broadcaster;
    }

    public List<ScheduledItem> list() {
        return scheduled.findAll();
    }

    public ScheduledItem add(String name, String schedule, String icon, Boolean enabled) {
        ScheduledItem item = scheduled.add(name, schedule, icon, enabled);
        broadcaster.broadcast(EventType.SCHEDULED_ADDED, item);
        return item;
    }

    public void delete(String id) {
        scheduled.delete(id);
        broadcaster.broadcast(EventType.SCHEDULED_DELETED, Map.of("id", id));
    }
}
