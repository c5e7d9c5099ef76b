package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** Message types pushed over the live channel. */
public enum EventType {
    INIT("init"),
    PONG("pong"),
    TASK_CREATED("task_created"),
    TASK_UPDATED("task_updated"),
    TASK_DELETED("task_deleted"),
    TASKS_ARCHIVED("tasks_archived"),
    AGENT_UPDATED("agent_updated"),
    AGENT_REMOVED("agent_removed"),
    NOTE_ADDED("note_added"),
    NOTE_UPDATED("note_updated"),
    NOTE_DELETED("note_deleted"),
    SCHEDULED_ADDED("scheduled_added"),
    SCHEDULED_DELETED("scheduled_deleted"),
    METRICS_UPDATED("metrics_updated"),
    MOOD_UPDATED("mood_updated"),
    ACTIVITY("activity"),
    FEED("feed"),
    FEED_CLEARED("feed_cleared"),
    STATUS_UPDATE("status_update");

    private final String wire;

    EventType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
