package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.domain.Task;
import com.commandcenter.backend.domain.TaskPatch;
import com.commandcenter.backend.repo.TaskRepository;
import com.commandcenter.backend.repo.TaskRepository.TaskChange;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Task mutations: persist, narrate, broadcast, and nudge the agent runner when work lands on an agent.
 * Unknown ids on update/delete are silent no-ops that still broadcast.
 */
@Service
public class TaskService {

    private final TaskRepository tasks;
    private final ActivityService activity;
    private final DashboardBroadcaster broadcaster;
    private final AgentTriggerClient trigger;

    public TaskService(TaskRepository tasks, ActivityService activity, DashboardBroadcaster broadcaster,
                       AgentTriggerClient trigger) {
        this.tasks = tasks;
        this.activity = activity;
        this.broadcaster = broadcaster;
        this.trigger = trigger;
    }

    public List<Task> list(boolean activeOnly) {
        return activeOnly ? tasks.findActive() : tasks.findAll();
    }

    public Task create(Task draft) {
        Task created = tasks.create(draft);
        activity.append("📥 New task: " + created.displayTitle());
        broadcaster.broadcast(EventType.TASK_CREATED, created);
        if (AgentTriggerClient.isAgentAssignee(created.getAssignedTo())) {
            trigger.notifyAssigned(created.getId());
        }
        return created;
    }

    public Optional<Task> update(String id, TaskPatch patch) {
        Optional<TaskChange> change = tasks.update(id, patch);
        if (change.isEmpty()) {
            broadcaster.broadcast(EventType.TASK_UPDATED, patch.toDelta(id));
            return Optional.empty();
        }

        Task task = change.get().task();
        if (change.get().statusChanged()) {
            activity.append("📋 Task moved to " + task.getStatus() + ": " + task.displayTitle());
        }
        broadcaster.broadcast(EventType.TASK_UPDATED, task);

        String assignee = task.getAssignedTo();
        if (!Objects.equals(assignee, change.get().previousAssignee()) && AgentTriggerClient.isAgentAssignee(assignee)) {
            trigger.notifyAssigned(task.getId());
        }
        return Optional.of(task);
    }

    public void delete(String id) {
        Optional<Task> removed = tasks.delete(id);
        removed.ifPresent(t -> activity.append("🗑️ Task deleted: " + t.displayTitle()));
        broadcaster.broadcast(EventType.TASK_DELETED, Map.of("id", id));
    }
}
