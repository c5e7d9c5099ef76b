package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.domain.Metrics;
import com.commandcenter.backend.domain.MetricsPatch;
import com.commandcenter.backend.repo.MetricsRepository;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

@Service
public class MetricsService {

    private final MetricsRepository metrics;
    private final DashboardBroadcaster broadcaster;

    public MetricsService(MetricsRepository metrics, DashboardBroadcaster broadcaster) {
        this.metrics = metrics;
        this.broadcaster = broadcaster;
    }

    public Metrics get() {
        return metrics.get();
    }

    public Metrics patch(MetricsPatch patch) {
        Metrics next = metrics.patch(patch);
        broadcaster.broadcast(EventType.METRICS_UPDATED, next);
        return next;
    }
}
