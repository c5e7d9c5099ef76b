package com.commandcenter.backend.api;

import com.commandcenter.backend.service.external.SystemMonitorService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Script output is passed through as-is. */
@RestController
@RequestMapping("/api/system")
public class SystemController {

    private final SystemMonitorService monitor;

    public SystemController(SystemMonitorService monitor) {
        this.monitor = monitor;
    }

    @GetMapping("/health")
    public JsonNode health() {
        return monitor.health();
    }

    @GetMapping("/usage")
    public JsonNode usage() {
        return monitor.usage();
    }
}
