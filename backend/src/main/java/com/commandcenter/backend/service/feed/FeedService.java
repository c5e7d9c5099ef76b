package com.commandcenter.backend.service.feed;

import com.commandcenter.backend.domain.DashboardEvent;
import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.domain.FeedEntry;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class FeedService {

    private final LiveFeedBuffer buffer;
    private final DashboardBroadcaster broadcaster;

    public FeedService(LiveFeedBuffer buffer, DashboardBroadcaster broadcaster) {
        this.buffer = buffer;
        this.broadcaster = broadcaster;
    }

    public FeedEntry post(String message, String type, String timestamp) {
        FeedEntry entry = buffer.post(message, type, timestamp);
        broadcaster.broadcast(EventType.FEED, entry);
        return entry;
    }

    public List<FeedEntry> read(String since, Integer limit) {
        return buffer.read(since, limit);
    }

    public int clear() {
        int cleared = buffer.clear();
        broadcaster.broadcast(DashboardEvent.of(EventType.FEED_CLEARED));
        return cleared;
    }
}
