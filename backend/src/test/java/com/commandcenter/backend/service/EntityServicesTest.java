package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.ActivityEntry;
import com.commandcenter.backend.domain.AgentPatch;
import com.commandcenter.backend.domain.MetricsPatch;
import com.commandcenter.backend.domain.Note;
import com.commandcenter.backend.domain.StatusUpdate;
import com.commandcenter.backend.repo.MetricsRepository;
import com.commandcenter.backend.repo.MoodRepository;
import com.commandcenter.backend.repo.NoteRepository;
import com.commandcenter.backend.repo.ScheduledRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/** Narration and broadcast behaviour of the smaller services. */
class EntityServicesTest {

    @TempDir
    Path dir;

    private ServiceHarness h;

    @BeforeEach
    void setUp() {
        h = new ServiceHarness(dir);
    }

    @Test
    void noteAddNarratesPreview() {
        NoteService notes = new NoteService(new NoteRepository(h.store, h.clock), h.activity, h.broadcaster);
        String longText = "x".repeat(80);

        notes.add(longText);

        assertThat(h.activityLog.all()).extracting(ActivityEntry::message)
                .containsExactly("📝 Note added: " + "x".repeat(50) + "...");
        assertThat(h.eventTypes()).containsExactly("activity", "note_added");
    }

    @Test
    void noteReadBroadcastsDelta() {
        NoteService notes = new NoteService(new NoteRepository(h.store, h.clock), h.activity, h.broadcaster);
        Note note = notes.add("hi");

        notes.markRead(note.id());
        notes.markRead("missing");
        notes.delete("missing");

        JsonNode read = h.events().get(2);
        assertThat(read.path("type").asText()).isEqualTo("note_updated");
        assertThat(read.path("data").path("read").asBoolean()).isTrue();
        assertThat(read.path("data").path("readAt").asText()).isEqualTo("2026-02-03T10:00:00.000Z");
        assertThat(h.eventTypes()).endsWith("note_updated", "note_deleted");
    }

    @Test
    void scheduledAddAndDeleteBroadcast() {
        ScheduledService scheduled = new ScheduledService(new ScheduledRepository(h.store, h.clock), h.broadcaster);

        String id = scheduled.add("Weekly digest", "weekly", null, false).id();
        scheduled.delete(id);

        assertThat(h.eventTypes()).containsExactly("scheduled_added", "scheduled_deleted");
        assertThat(scheduled.list()).isEmpty();
    }

    @Test
    void agentReportBroadcastsFullAgent() {
        AgentService agents = new AgentService(h.agents, h.broadcaster);
        AgentPatch patch = new AgentPatch();
        patch.setStatus("Working");
        patch.setCurrentTask("Write report");

        agents.report("manager", patch);
        agents.remove("manager");

        JsonNode updated = h.events().get(0);
        assertThat(updated.path("type").asText()).isEqualTo("agent_updated");
        assertThat(updated.path("data").path("name").asText()).isEqualTo("Jarvis");
        assertThat(updated.path("data").path("startedWorkingAt").asText()).isEqualTo("2026-02-03T10:00:00.000Z");
        assertThat(h.events().get(1).path("data").path("id").asText()).isEqualTo("manager");
    }

    @Test
    void moodNarratesAndBroadcasts() {
        MoodService mood = new MoodService(new MoodRepository(h.store, h.clock), h.activity, h.broadcaster);

        mood.set("focused");

        assertThat(h.activityLog.all()).extracting(ActivityEntry::message).containsExactly("🧠 Mood updated to: focused");
        assertThat(h.eventTypes()).containsExactly("activity", "mood_updated");
    }

    @Test
    void metricsPatchBroadcastsMergedDocument() {
        MetricsService metrics = new MetricsService(new MetricsRepository(h.store, h.om, h.clock), h.broadcaster);
        MetricsPatch patch = new MetricsPatch();
        patch.setChatRemaining(12);

        metrics.patch(patch);

        JsonNode event = h.events().get(0);
        assertThat(event.path("type").asText()).isEqualTo("metrics_updated");
        assertThat(event.path("data").path("token_usage").path("chat_remaining").asInt()).isEqualTo(12);
        assertThat(event.path("data").path("token_usage").path("last_updated").asText())
                .isEqualTo("2026-02-03T10:00:00.000Z");
    }

    @Test
    void statusUpdateFillsDefaultsAndIsNotStored() {
        StatusService status = new StatusService(h.broadcaster, h.clock);

        StatusUpdate update = status.publish(null, null, null);

        assertThat(update).isEqualTo(new StatusUpdate("status", "unknown", "idle", "", "2026-02-03T10:00:00.000Z"));
        assertThat(h.eventTypes()).containsExactly("status_update");
        assertThat(h.activityLog.all()).isEmpty();
    }
}
