package com.commandcenter.backend.repo;

import com.commandcenter.backend.domain.Note;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.service.storage.PersistentDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class NoteRepository {

    public static final String KEY = "notes";
    private static final TypeReference<List<Note>> TYPE = new TypeReference<>() {};

    private final PersistentDocument<List<Note>> doc;
    private final Clock clock;

    public NoteRepository(JsonCollectionStore store, Clock clock) {
        this.doc = new PersistentDocument<>(store, KEY, TYPE, ArrayList::new);
        this.clock = clock;
    }

    public List<Note> findAll() {
        return Collections.unmodifiableList(doc.read());
    }

    public Note add(String content) {
        return doc.update(notes -> {
            Note note = new Note(
                    ShortIds.next(notes.stream().map(Note::id).collect(Collectors.toSet())),
                    content == null ? "" : content,
                    Timestamps.now(clock),
                    false,
                    null
            );
            notes.add(note);
            return note;
        });
    }

    /** Marks the note read; readAt keeps its first value. Empty for an unknown id. */
    public Optional<Note> markRead(String id) {
        return doc.update(notes -> {
            for (int i = 0; i < notes.size(); i++) {
                Note prev = notes.get(i);
                if (id.equals(prev.id())) {
                    Note next = prev.markedRead(Timestamps.now(clock));
                    notes.set(i, next);
                    return Optional.of(next);
                }
            }
            return Optional.<Note>empty();
        }, Optional::isPresent);
    }

    public boolean delete(String id) {
        return doc.update(notes -> notes.removeIf(n -> id.equals(n.id())), removed -> removed);
    }
}
