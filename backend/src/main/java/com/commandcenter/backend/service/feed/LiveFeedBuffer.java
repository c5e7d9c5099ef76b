package com.commandcenter.backend.service.feed;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.domain.FeedEntry;
import com.commandcenter.backend.domain.FeedType;
import com.commandcenter.backend.domain.Timestamps;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Same-day narration feed, memory only.
 * <p>
 * Every post and read first drops entries dated before the current UTC day. The buffer is also capped at
 * {@code dashboard.feed.capacity}, oldest first.
 */
@Component
public class LiveFeedBuffer {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    private record Slot(Instant at, FeedEntry entry) {}

    private final Clock clock;
    private final int capacity;
    private final List<Slot> slots = new ArrayList<>(); // guarded by this

    @Autowired
    public LiveFeedBuffer(Clock clock, DashboardProperties props) {
        this(clock, props.getFeed().getCapacity());
    }

    public LiveFeedBuffer(Clock clock, int capacity) {
        this.clock = clock;
        this.capacity = Math.max(1, capacity);
    }

    /**
     * @param timestamp caller timestamp, honoured when present; entries may therefore arrive out of order
     * @throws InvalidFeedTypeException for a type outside {@link FeedType}
     * @throws IllegalArgumentException for an unparseable timestamp
     */
    public synchronized FeedEntry post(String message, String type, String timestamp) {
        String typeName = type == null ? FeedType.WORKING.wire() : type;
        FeedType feedType = FeedType.fromWire(typeName).orElseThrow(() -> new InvalidFeedTypeException(typeName));

        String ts;
        Instant at;
        if (Timestamps.isBlank(timestamp)) {
            at = clock.instant();
            ts = Timestamps.format(at);
        } else {
            ts = timestamp;
            at = Timestamps.parse(timestamp).orElseThrow(() -> new IllegalArgumentException("invalid_timestamp"));
        }

        pruneBeforeToday();
        FeedEntry entry = new FeedEntry(UUID.randomUUID().toString().substring(0, 8),
                message == null ? "" : message, feedType, ts);
        slots.add(new Slot(at, entry));
        if (slots.size() > capacity) {
            slots.subList(0, slots.size() - capacity).clear();
        }
        return entry;
    }

    /**
     * Entries strictly after {@code since} (all when blank), at most {@code limit} of them: the most recent
     * ones, returned oldest first.
     */
    public synchronized List<FeedEntry> read(String since, Integer limit) {
        int lim = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, limit));
        Instant after = Timestamps.isBlank(since)
                ? null
                : Timestamps.parse(since).orElseThrow(() -> new IllegalArgumentException("invalid_since"));

        pruneBeforeToday();
        List<Slot> matching = slots.stream()
                .filter(s -> after == null || s.at().isAfter(after))
                .sorted(Comparator.comparing(Slot::at))
                .toList();
        return matching.subList(Math.max(0, matching.size() - lim), matching.size()).stream()
                .map(Slot::entry)
                .toList();
    }

    /** @return how many entries were dropped */
    public synchronized int clear() {
        int count = slots.size();
        slots.clear();
        return count;
    }

    public synchronized int size() {
        pruneBeforeToday();
        return slots.size();
    }

    private void pruneBeforeToday() {
        LocalDate today = Timestamps.today(clock);
        slots.removeIf(s -> LocalDate.ofInstant(s.at(), ZoneOffset.UTC).isBefore(today));
    }
}
