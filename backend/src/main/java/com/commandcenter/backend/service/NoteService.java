package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.domain.Note;
import com.commandcenter.backend.repo.NoteRepository;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class NoteService {

    private static final int PREVIEW_CHARS = 50;

    private final NoteRepository notes;
    private final ActivityService activity;
    private final DashboardBroadcaster broadcaster;

    public NoteService(NoteRepository notes, ActivityService activity, DashboardBroadcaster broadcaster) {
        this.notes = notes;
        this.activity = activity;
        this.broadcaster = broadcaster;
    }

    public List<Note> list() {
        return notes.findAll();
    }

    public Note add(String content) {
        Note note = notes.add(content);
        String preview = note.content().length() > PREVIEW_CHARS ? note.content().substring(0, PREVIEW_CHARS) : note.content();
        activity.append("📝 Note added: " + preview + "...");
        broadcaster.broadcast(EventType.NOTE_ADDED, note);
        return note;
    }

    public Optional<Note> markRead(String id) {
        Optional<Note> note = notes.markRead(id);
        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put("id", id);
        delta.put("read", true);
        delta.put("readAt", note.map(Note::readAt).orElse(null));
        broadcaster.broadcast(EventType.NOTE_UPDATED, delta);
        return note;
    }

    public void delete(String id) {
        notes.delete(id);
        broadcaster.broadcast(EventType.NOTE_DELETED, Map.of("id", id));
    }
}
