package com.commandcenter.backend.service.external;

import com.commandcenter.backend.config.DashboardProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

/** Host health and model usage, both produced by external scripts. */
@Service
public class SystemMonitorService {

    private final ScriptRunner runner;
    private final DashboardProperties.SystemScripts config;

    public SystemMonitorService(ScriptRunner runner, DashboardProperties props) {
        this.runner = runner;
        this.config = props.getSystem();
    }

    public JsonNode health() {
        return runner.runJson(config.getHealthScript(), config.getHealthTimeout());
    }

    public JsonNode usage() {
        return runner.runJson(config.getUsageScript(), config.getUsageTimeout());
    }
}
