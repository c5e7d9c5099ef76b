package com.commandcenter.backend.domain.history;

import java.time.LocalDate;
import java.util.Set;

/**
 * Filters for the completed-work history view.
 *
 * @param text     case-insensitive substring over title, description and assignee
 * @param assignee case-insensitive substring over assignee
 * @param from     inclusive lower bound on completedAt (or createdAt)
 * @param to       inclusive upper bound, whole day
 * @param statuses allowed statuses
 * @param page     1-based page
 * @param limit    page size
 */
public record HistoryQuery(
        String text,
        String assignee,
        LocalDate from,
        LocalDate to,
        Set<String> statuses,
        int page,
        int limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 200;
    public static final Set<String> DEFAULT_STATUSES = Set.of("done", "archive");

    public HistoryQuery {
        statuses = (statuses == null || statuses.isEmpty()) ? DEFAULT_STATUSES : Set.copyOf(statuses);
        page = Math.max(1, page);
        limit = Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    public static HistoryQuery all() {
        return new HistoryQuery(null, null, null, null, null, 1, DEFAULT_LIMIT);
    }
}
