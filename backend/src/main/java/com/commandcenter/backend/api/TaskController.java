package com.commandcenter.backend.api;

import com.commandcenter.backend.domain.Task;
import com.commandcenter.backend.domain.TaskPatch;
import com.commandcenter.backend.domain.history.HistoryPage;
import com.commandcenter.backend.domain.history.HistoryQuery;
import com.commandcenter.backend.domain.history.TaskStats;
import com.commandcenter.backend.service.TaskService;
import com.commandcenter.backend.service.history.TaskArchiveService;
import com.commandcenter.backend.service.history.TaskHistoryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskService tasks;
    private final TaskHistoryService history;
    private final TaskArchiveService archive;

    public TaskController(TaskService tasks, TaskHistoryService history, TaskArchiveService archive) {
        this.tasks = tasks;
        this.history = history;
        this.archive = archive;
    }

    @GetMapping
    public List<Task> list(@RequestParam(required = false) String active) {
        return tasks.list("true".equalsIgnoreCase(active));
    }

    @PostMapping
    public ResponseEntity<Task> create(@RequestBody Task draft) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tasks.create(draft));
    }

    @PatchMapping("/{id}")
    public Map<String, Object> update(@PathVariable String id, @RequestBody TaskPatch patch) {
        tasks.update(id, patch);
        return Map.of("ok", true);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        tasks.delete(id);
        return Map.of("ok", true);
    }

    @GetMapping("/history")
    public HistoryPage history(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String agent,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(defaultValue = "done,archive") String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "" + HistoryQuery.DEFAULT_LIMIT) int limit
    ) {
        HistoryQuery query = new HistoryQuery(q, agent, date(from, "from"), date(to, "to"),
                statuses(status), page, limit);
        return history.history(query);
    }

    @GetMapping("/stats")
    public TaskStats stats() {
        return history.stats();
    }

    @PostMapping("/archive-old")
    public Map<String, Object> archiveOld() {
        return Map.of("archived", archive.archiveOld());
    }

    private static LocalDate date(String raw, String name) {
        if (raw == null || raw.isBlank()) return null;
        try {
            // accept a full timestamp too and keep the date part
            return LocalDate.parse(raw.length() > 10 ? raw.substring(0, 10) : raw);
        } catch (DateTimeParseException e) {
            throw bad("invalid_" + name);
        }
    }

    private static Set<String> statuses(String raw) {
        Set<String> out = new LinkedHashSet<>();
        Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(out::add);
        return out;
    }

    private static ResponseStatusException bad(String msg) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, msg);
    }
}
