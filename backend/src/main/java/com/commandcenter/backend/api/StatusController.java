package com.commandcenter.backend.api;

import com.commandcenter.backend.api.dto.StatusUpdateRequest;
import com.commandcenter.backend.service.StatusService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/status-update")
public class StatusController {

    private final StatusService status;

    public StatusController(StatusService status) {
        this.status = status;
    }

    @PostMapping
    public Map<String, Object> publish(@RequestBody StatusUpdateRequest req) {
        status.publish(req.agent, req.status, req.detail);
        return Map.of("ok", true);
    }
}
