package com.commandcenter.backend.repo;

import com.commandcenter.backend.domain.Mood;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.service.storage.PersistentDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class MoodRepository {

    public static final String KEY = "mood";
    private static final TypeReference<Mood> TYPE = new TypeReference<>() {};

    private final PersistentDocument<Mood> doc;
    private final Clock clock;

    public MoodRepository(JsonCollectionStore store, Clock clock) {
        this.doc = new PersistentDocument<>(store, KEY, TYPE, Mood::empty);
        this.clock = clock;
    }

    public Mood get() {
        return doc.read();
    }

    /** Replaces the whole record. */
    public Mood set(String mood) {
        Mood next = new Mood(mood, Timestamps.now(clock));
        doc.replace(next);
        return next;
    }
}
