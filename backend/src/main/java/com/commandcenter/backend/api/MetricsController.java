package com.commandcenter.backend.api;

import com.commandcenter.backend.domain.Metrics;
import com.commandcenter.backend.domain.MetricsPatch;
import com.commandcenter.backend.service.MetricsService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/metrics")
public class MetricsController {

    private final MetricsService metrics;

    public MetricsController(MetricsService metrics) {
        this.metrics = metrics;
    }

    @GetMapping
    public Metrics get() {
        return metrics.get();
    }

    @PatchMapping
    public Map<String, Object> patch(@RequestBody MetricsPatch patch) {
        metrics.patch(patch);
        return Map.of("ok", true);
    }
}
