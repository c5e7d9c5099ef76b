package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A unit of work on the board.
 * <p>
 * Fields the dashboard does not know about are kept in {@link #getExtra()} and written back unchanged.
 * Timestamps are kept as strings since external agents write this document too.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Task {

    public static final String TODO = "todo";
    public static final String IN_PROGRESS = "in-progress";
    public static final String DONE = "done";
    public static final String ARCHIVE = "archive";

    public static final Set<String> COMPLETED_STATUSES = Set.of(DONE, ARCHIVE);
    public static final Set<String> ACTIVE_STATUSES = Set.of(TODO, IN_PROGRESS);

    private String id;
    private String title;
    private String description;
    private String status;
    private String priority;
    private String assignedTo;
    private String completedBy;
    private String createdAt;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String startedAt;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String completedAt;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public String getAssignedTo() { return assignedTo; }
    public void setAssignedTo(String assignedTo) { this.assignedTo = assignedTo; }

    public String getCompletedBy() { return completedBy; }
    public void setCompletedBy(String completedBy) { this.completedBy = completedBy; }

    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }

    public String getStartedAt() { return startedAt; }
    public void setStartedAt(String startedAt) { this.startedAt = startedAt; }

    public String getCompletedAt() { return completedAt; }
    public void setCompletedAt(String completedAt) { this.completedAt = completedAt; }

    @JsonAnyGetter
    public Map<String, Object> getExtra() { return extra; }

    @JsonAnySetter
    public void putExtra(String key, Object value) { extra.put(key, value); }

    /** Title for narration lines. */
    public String displayTitle() {
        return Timestamps.isBlank(title) ? "Untitled" : title;
    }

    /** completedAt, falling back to createdAt when completedAt is blank. */
    public String effectiveDate() {
        return Timestamps.isBlank(completedAt) ? createdAt : completedAt;
    }

    public boolean isCompleted() {
        return status != null && COMPLETED_STATUSES.contains(status);
    }
}
