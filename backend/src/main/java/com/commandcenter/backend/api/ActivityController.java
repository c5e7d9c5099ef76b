package com.commandcenter.backend.api;

import com.commandcenter.backend.api.dto.ActivityRequest;
import com.commandcenter.backend.domain.ActivityEntry;
import com.commandcenter.backend.service.ActivityService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/activity")
public class ActivityController {

    private final ActivityService activity;

    public ActivityController(ActivityService activity) {
        this.activity = activity;
    }

    @GetMapping
    public List<ActivityEntry> since(@RequestParam(defaultValue = "0") int since) {
        return activity.since(since);
    }

    @PostMapping
    public Map<String, Object> append(@RequestBody ActivityRequest req) {
        activity.append(req.message == null ? "" : req.message);
        return Map.of("ok", true);
    }
}
