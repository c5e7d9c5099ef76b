package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.domain.StatusUpdate;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

import java.time.Clock;

/** Quick agent status lines for live clients; nothing is stored. */
@Service
public class StatusService {

    private final DashboardBroadcaster broadcaster;
    private final Clock clock;

    public StatusService(DashboardBroadcaster broadcaster, Clock clock) {
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    public StatusUpdate publish(String agent, String status, String detail) {
        StatusUpdate update = new StatusUpdate(
                "status",
                agent == null ? "unknown" : agent,
                status == null ? "idle" : status,
                detail == null ? "" : detail,
                Timestamps.now(clock)
        );
        broadcaster.broadcast(EventType.STATUS_UPDATE, update);
        return update;
    }
}
