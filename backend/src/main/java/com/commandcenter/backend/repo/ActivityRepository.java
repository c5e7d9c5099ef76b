package com.commandcenter.backend.repo;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.domain.ActivityEntry;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.service.storage.PersistentDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only narration log, trimmed to the newest {@code dashboard.activity-cap} entries.
 * <p>
 * Readers page with a plain list index. Trimming shifts every index, so a cursor older than the
 * window gets a different slice than it asked for; callers reload when that matters.
 */
@Component
public class ActivityRepository {

    public static final String KEY = "activity";
    private static final TypeReference<List<ActivityEntry>> TYPE = new TypeReference<>() {};

    private final PersistentDocument<List<ActivityEntry>> doc;
    private final Clock clock;
    private final int cap;

    public ActivityRepository(JsonCollectionStore store, Clock clock, DashboardProperties props) {
        this.doc = new PersistentDocument<>(store, KEY, TYPE, ArrayList::new);
        this.clock = clock;
        this.cap = props.getActivityCap();
    }

    public List<ActivityEntry> all() {
        return List.copyOf(doc.read());
    }

    /** Entries from {@code index} on; empty past the end, a negative index counts back from the end. */
    public List<ActivityEntry> since(int index) {
        List<ActivityEntry> all = doc.read();
        int from = index < 0 ? Math.max(0, all.size() + index) : index;
        if (from >= all.size()) return List.of();
        return List.copyOf(all.subList(from, all.size()));
    }

    public List<ActivityEntry> recent(int n) {
        List<ActivityEntry> all = doc.read();
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public ActivityEntry append(String message) {
        return doc.update(log -> {
            ActivityEntry entry = new ActivityEntry(Timestamps.now(clock), message == null ? "" : message);
            log.add(entry);
            if (log.size() > cap) {
                log.subList(0, log.size() - cap).clear();
            }
            return entry;
        });
    }
}
