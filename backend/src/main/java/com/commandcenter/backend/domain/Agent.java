package com.commandcenter.backend.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Agent {

    /** Labels that count as "busy" for the elapsed-work timer. */
    public static final Set<String> BUSY_STATUSES =
            Set.of("Working", "Thinking", "Checking", "Typing", "Delegating", "Heartbeat", "Managing");

    /** Labels that stop the elapsed-work timer. */
    public static final Set<String> RESTING_STATUSES = Set.of("Idle", "Standby");

    private String id;
    private String name;
    private String model;
    private String role;
    private String status;
    private String statusEmoji;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Object currentTask;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String startedWorkingAt;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getStatusEmoji() { return statusEmoji; }
    public void setStatusEmoji(String statusEmoji) { this.statusEmoji = statusEmoji; }

    public Object getCurrentTask() { return currentTask; }
    public void setCurrentTask(Object currentTask) { this.currentTask = currentTask; }

    public String getStartedWorkingAt() { return startedWorkingAt; }
    public void setStartedWorkingAt(String startedWorkingAt) { this.startedWorkingAt = startedWorkingAt; }

    @JsonAnyGetter
    public Map<String, Object> getExtra() { return extra; }

    @JsonAnySetter
    public void putExtra(String key, Object value) { extra.put(key, value); }

    public static boolean isBusy(String status) {
        return status != null && BUSY_STATUSES.contains(status);
    }
}
