package com.commandcenter.backend.api;

import com.commandcenter.backend.api.dto.NoteCreateRequest;
import com.commandcenter.backend.domain.Note;
import com.commandcenter.backend.service.NoteService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/notes")
public class NoteController {

    private final NoteService notes;

    public NoteController(NoteService notes) {
        this.notes = notes;
    }

    @GetMapping
    public List<Note> list() {
        return notes.list();
    }

    @PostMapping
    public ResponseEntity<Note> add(@RequestBody NoteCreateRequest req) {
        Note note = notes.add(req.content == null ? "" : req.content);
        return ResponseEntity.status(HttpStatus.CREATED).body(note);
    }

    @PatchMapping("/{id}/read")
    public Map<String, Object> markRead(@PathVariable String id) {
        notes.markRead(id);
        return Map.of("ok", true);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        notes.delete(id);
        return Map.of("ok", true);
    }
}
