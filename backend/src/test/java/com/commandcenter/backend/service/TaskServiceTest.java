package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.ActivityEntry;
import com.commandcenter.backend.domain.Task;
import com.commandcenter.backend.domain.TaskPatch;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TaskServiceTest {

    @TempDir
    Path dir;

    private ServiceHarness h;
    private AgentTriggerClient trigger;
    private TaskService service;

    @BeforeEach
    void setUp() {
        h = new ServiceHarness(dir);
        trigger = mock(AgentTriggerClient.class);
        service = new TaskService(h.tasks, h.activity, h.broadcaster, trigger);
    }

    @Test
    void createNarratesThenBroadcasts() {
        Task draft = new Task();
        draft.setTitle("Write report");

        Task created = service.create(draft);

        assertThat(h.activityLog.all()).extracting(ActivityEntry::message).containsExactly("📥 New task: Write report");
        assertThat(h.eventTypes()).containsExactly("activity", "task_created");
        assertThat(h.events().get(1).path("data").path("id").asText()).isEqualTo(created.getId());
        verify(trigger, never()).notifyAssigned(anyString());
    }

    @Test
    void untitledTasksAreNarratedAsUntitled() {
        service.create(new Task());

        assertThat(h.activityLog.all()).extracting(ActivityEntry::message).containsExactly("📥 New task: Untitled");
    }

    @Test
    void agentAssignmentTriggersRunner() {
        Task draft = new Task();
        draft.setAssignedTo("Agent:coder");
        Task created = service.create(draft);
        verify(trigger).notifyAssigned(created.getId());

        TaskPatch same = new TaskPatch();
        same.setAssignedTo("Agent:coder");
        service.update(created.getId(), same);
        verify(trigger, times(1)).notifyAssigned(created.getId());

        TaskPatch human = new TaskPatch();
        human.setAssignedTo("Jarvis");
        service.update(created.getId(), human);
        TaskPatch other = new TaskPatch();
        other.setAssignedTo("Agent:reviewer");
        service.update(created.getId(), other);
        verify(trigger, times(2)).notifyAssigned(created.getId());
    }

    @Test
    void statusChangeIsNarratedAndFullTaskBroadcast() {
        Task draft = new Task();
        draft.setTitle("Write report");
        String id = service.create(draft).getId();

        TaskPatch patch = new TaskPatch();
        patch.setStatus(Task.IN_PROGRESS);
        service.update(id, patch);

        assertThat(h.activityLog.all()).extracting(ActivityEntry::message)
                .endsWith("📋 Task moved to in-progress: Write report");
        JsonNode updated = h.events().get(h.events().size() - 1);
        assertThat(updated.path("type").asText()).isEqualTo("task_updated");
        assertThat(updated.path("data").path("title").asText()).isEqualTo("Write report");
        assertThat(updated.path("data").path("startedAt").asText()).isEqualTo("2026-02-03T10:00:00.000Z");
    }

    @Test
    void unknownIdStillBroadcastsTheDelta() {
        TaskPatch patch = new TaskPatch();
        patch.setDescription("B");
        patch.putExtra("estimate", "1h");

        assertThat(service.update("ghost", patch)).isEmpty();

        JsonNode event = h.events().get(0);
        assertThat(event.path("type").asText()).isEqualTo("task_updated");
        assertThat(event.path("data").path("id").asText()).isEqualTo("ghost");
        assertThat(event.path("data").path("description").asText()).isEqualTo("B");
        assertThat(event.path("data").path("estimate").asText()).isEqualTo("1h");
        assertThat(h.activityLog.all()).isEmpty();
    }

    @Test
    void deleteNarratesOnlyExistingTasks() {
        Task draft = new Task();
        draft.setTitle("Temp");
        String id = service.create(draft).getId();

        service.delete(id);
        service.delete(id);

        assertThat(h.activityLog.all()).extracting(ActivityEntry::message)
                .containsExactly("📥 New task: Temp", "🗑️ Task deleted: Temp");
        assertThat(h.eventTypes()).containsExactly("activity", "task_created", "activity", "task_deleted", "task_deleted");
    }
}
