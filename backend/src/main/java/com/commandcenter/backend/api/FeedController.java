package com.commandcenter.backend.api;

import com.commandcenter.backend.api.dto.FeedPostRequest;
import com.commandcenter.backend.domain.FeedEntry;
import com.commandcenter.backend.service.feed.FeedService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/feed")
public class FeedController {

    private final FeedService feed;

    public FeedController(FeedService feed) {
        this.feed = feed;
    }

    @GetMapping
    public List<FeedEntry> read(
            @RequestParam(required = false) String since,
            @RequestParam(required = false) Integer limit
    ) {
        return feed.read(since, limit);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> post(@RequestBody FeedPostRequest req) {
        FeedEntry entry = feed.post(req.message == null ? "" : req.message, req.type, req.timestamp);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("ok", true, "id", entry.id()));
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        return Map.of("ok", true, "cleared", feed.clear());
    }
}
