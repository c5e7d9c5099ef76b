package com.commandcenter.backend.api;

import com.commandcenter.backend.api.dto.ScheduledCreateRequest;
import com.commandcenter.backend.domain.ScheduledItem;
import com.commandcenter.backend.service.ScheduledService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/scheduled")
public class ScheduledController {

    private final ScheduledService scheduled;

    public ScheduledController(ScheduledService scheduled) {
        this.scheduled = scheduled;
    }

    @GetMapping
    public List<ScheduledItem> list() {
        return scheduled.list();
    }

    @PostMapping
    public ResponseEntity<ScheduledItem> add(@RequestBody ScheduledCreateRequest req) {
        ScheduledItem item = scheduled.add(req.name, req.schedule, req.icon, req.enabled);
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        scheduled.delete(id);
        return Map.of("ok", true);
    }
}
