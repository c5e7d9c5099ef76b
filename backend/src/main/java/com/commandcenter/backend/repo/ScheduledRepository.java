package com.commandcenter.backend.repo;

import com.commandcenter.backend.domain.ScheduledItem;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.service.storage.PersistentDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class ScheduledRepository {

    public static final String KEY = "scheduled";
    private static final TypeReference<List<ScheduledItem>> TYPE = new TypeReference<>() {};

    private final PersistentDocument<List<ScheduledItem>> doc;
    private final Clock clock;

    public ScheduledRepository(JsonCollectionStore store, Clock clock) {
        this.doc = new PersistentDocument<>(store, KEY, TYPE, ArrayList::new);
        this.clock = clock;
    }

    public List<ScheduledItem> findAll() {
        return Collections.unmodifiableList(doc.read());
    }

    public ScheduledItem add(String name, String schedule, String icon, Boolean enabled) {
        return doc.update(items -> {
            ScheduledItem item = new ScheduledItem(
                    ShortIds.next(items.stream().map(ScheduledItem::id).collect(Collectors.toSet())),
                    name == null ? "" : name,
                    schedule == null ? "daily" : schedule,
                    icon == null ? "📋" : icon,
                    enabled == null || enabled,
                    null,
                    Timestamps.now(clock)
            );
            items.add(item);
            return item;
        });
    }

    public boolean delete(String id) {
        return doc.update(items -> items.removeIf(i -> id.equals(i.id())), removed -> removed);
    }
}
