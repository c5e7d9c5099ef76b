package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSetter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Partial task update. Only fields present in the request body are applied; an explicit
 * {@code null} clears the field. Unknown keys land in {@link #getExtra()}.
 */
public class TaskPatch {

    public enum Field { TITLE, DESCRIPTION, STATUS, PRIORITY, ASSIGNED_TO, COMPLETED_BY, CREATED_AT, STARTED_AT, COMPLETED_AT }

    private final EnumSet<Field> present = EnumSet.noneOf(Field.class);
    private final Map<String, Object> extra = new LinkedHashMap<>();

    private String title;
    private String description;
    private String status;
    private String priority;
    private String assignedTo;
    private String completedBy;
    private String createdAt;
    private String startedAt;
    private String completedAt;

    public void setTitle(String v) { title = v; present.add(Field.TITLE); }

    public void setDescription(String v) { description = v; present.add(Field.DESCRIPTION); }

    public void setStatus(String v) { status = v; present.add(Field.STATUS); }

    public void setPriority(String v) { priority = v; present.add(Field.PRIORITY); }

    public void setAssignedTo(String v) { assignedTo = v; present.add(Field.ASSIGNED_TO); }

    public void setCompletedBy(String v) { completedBy = v; present.add(Field.COMPLETED_BY); }

    public void setCreatedAt(String v) { createdAt = v; present.add(Field.CREATED_AT); }

    public void setStartedAt(String v) { startedAt = v; present.add(Field.STARTED_AT); }

    public void setCompletedAt(String v) { completedAt = v; present.add(Field.COMPLETED_AT); }

    /** The id lives in the path; a body id is ignored. */
    @JsonSetter("id")
    public void ignoreId(Object ignored) {}

    @JsonAnySetter
    public void putExtra(String key, Object value) { extra.put(key, value); }

    public boolean has(Field field) { return present.contains(field); }

    @JsonIgnore
    public Set<Field> getPresent() { return Collections.unmodifiableSet(present); }

    @JsonIgnore
    public Map<String, Object> getExtra() { return Collections.unmodifiableMap(extra); }

    /** New status when the patch carries a non-blank one, else null. */
    public String newStatus() {
        return has(Field.STATUS) && !Timestamps.isBlank(status) ? status : null;
    }

    public String assignedToValue() { return assignedTo; }

    public void applyTo(Task t) {
        if (has(Field.TITLE)) t.setTitle(title);
        if (has(Field.DESCRIPTION)) t.setDescription(description);
        if (has(Field.STATUS)) t.setStatus(status);
        if (has(Field.PRIORITY)) t.setPriority(priority);
        if (has(Field.ASSIGNED_TO)) t.setAssignedTo(assignedTo);
        if (has(Field.COMPLETED_BY)) t.setCompletedBy(completedBy);
        if (has(Field.CREATED_AT)) t.setCreatedAt(createdAt);
        if (has(Field.STARTED_AT)) t.setStartedAt(startedAt);
        if (has(Field.COMPLETED_AT)) t.setCompletedAt(completedAt);
        t.getExtra().putAll(extra);
    }

    /** The patch as a wire delta: {@code id}, then the fields that were present, then extras. */
    public Map<String, Object> toDelta(String id) {
        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put("id", id);
        if (has(Field.TITLE)) delta.put("title", title);
        if (has(Field.DESCRIPTION)) delta.put("description", description);
        if (has(Field.STATUS)) delta.put("status", status);
        if (has(Field.PRIORITY)) delta.put("priority", priority);
        if (has(Field.ASSIGNED_TO)) delta.put("assignedTo", assignedTo);
        if (has(Field.COMPLETED_BY)) delta.put("completedBy", completedBy);
        if (has(Field.CREATED_AT)) delta.put("createdAt", createdAt);
        if (has(Field.STARTED_AT)) delta.put("startedAt", startedAt);
        if (has(Field.COMPLETED_AT)) delta.put("completedAt", completedAt);
        delta.putAll(extra);
        return delta;
    }
}
