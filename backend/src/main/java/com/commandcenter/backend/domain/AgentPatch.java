package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonSetter;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status report from an agent. Same presence rules as {@link TaskPatch}.
 * {@code startedWorkingAt} is owned by the server and cannot be set from the body.
 */
public class AgentPatch {

    public enum Field { NAME, MODEL, ROLE, STATUS, STATUS_EMOJI, CURRENT_TASK }

    private final EnumSet<Field> present = EnumSet.noneOf(Field.class);
    private final Map<String, Object> extra = new LinkedHashMap<>();

    private String name;
    private String model;
    private String role;
    private String status;
    private String statusEmoji;
    private Object currentTask;

    public void setName(String v) { name = v; present.add(Field.NAME); }
    public void setModel(String v) { model = v; present.add(Field.MODEL); }
    public void setRole(String v) { role = v; present.add(Field.ROLE); }
    public void setStatus(String v) { status = v; present.add(Field.STATUS); }
    public void setStatusEmoji(String v) { statusEmoji = v; present.add(Field.STATUS_EMOJI); }
    public void setCurrentTask(Object v) { currentTask = v; present.add(Field.CURRENT_TASK); }

    @JsonSetter("id")
    public void ignoreId(Object ignored) {}

    @JsonSetter("startedWorkingAt")
    public void ignoreStartedWorkingAt(Object ignored) {}

    @JsonAnySetter
    public void putExtra(String key, Object value) { extra.put(key, value); }

    public boolean has(Field field) { return present.contains(field); }

    public String newStatus() {
        return has(Field.STATUS) && !Timestamps.isBlank(status) ? status : null;
    }

    public void applyTo(Agent a) {
        if (has(Field.NAME)) a.setName(name);
        if (has(Field.MODEL)) a.setModel(model);
        if (has(Field.ROLE)) a.setRole(role);
        if (has(Field.STATUS)) a.setStatus(status);
        if (has(Field.STATUS_EMOJI)) a.setStatusEmoji(statusEmoji);
        if (has(Field.CURRENT_TASK)) a.setCurrentTask(currentTask);
        a.getExtra().putAll(extra);
    }
}
