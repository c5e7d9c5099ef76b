package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.domain.Mood;
import com.commandcenter.backend.repo.MoodRepository;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

@Service
public class MoodService {

    private final MoodRepository mood;
    private final ActivityService activity;
    private final DashboardBroadcaster broadcaster;

    public MoodService(MoodRepository mood, ActivityService activity, DashboardBroadcaster broadcaster) {
        this.mood = mood;
        this.activity = activity;
        this.broadcaster = broadcaster;
    }

    public Mood get() {
        return mood.get();
    }

    public Mood set(String value) {
        Mood next = mood.set(value);
        activity.append("🧠 Mood updated to: " + value);
        broadcaster.broadcast(EventType.MOOD_UPDATED, next);
        return next;
    }
}
