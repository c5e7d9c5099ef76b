package com.commandcenter.backend.service;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.repo.ActivityRepository;
import com.commandcenter.backend.repo.AgentRepository;
import com.commandcenter.backend.repo.TaskRepository;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import com.commandcenter.backend.service.realtime.RecordingSubscriber;
import com.commandcenter.backend.service.realtime.SnapshotProvider;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.support.MutableClock;
import com.commandcenter.backend.support.TestBeans;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/** Real repositories and broadcaster over a temp directory, with one recording subscriber attached. */
public class ServiceHarness {

    public final MutableClock clock = MutableClock.at("2026-02-03T10:00:00Z");
    public final ObjectMapper om = TestBeans.objectMapper();
    public final DashboardProperties props;
    public final JsonCollectionStore store;
    public final TaskRepository tasks;
    public final AgentRepository agents;
    public final ActivityRepository activityLog;
    public final DashboardBroadcaster broadcaster;
    public final ActivityService activity;
    public final RecordingSubscriber subscriber = new RecordingSubscriber("probe");

    public ServiceHarness(Path dir) {
        props = TestBeans.properties(dir);
        store = TestBeans.store(dir);
        tasks = new TaskRepository(store, clock);
        agents = new AgentRepository(store, clock, props);
        activityLog = new ActivityRepository(store, clock, props);
        broadcaster = new DashboardBroadcaster(om, new SnapshotProvider(tasks, agents, activityLog, props));
        activity = new ActivityService(activityLog, broadcaster);
        broadcaster.subscribe(subscriber);
    }

    /** Events received after the init snapshot. */
    public List<JsonNode> events() {
        List<String> raw = subscriber.received();
        return raw.subList(1, raw.size()).stream().map(this::parse).toList();
    }

    public List<String> eventTypes() {
        return events().stream().map(e -> e.path("type").asText()).toList();
    }

    private JsonNode parse(String json) {
        try {
            return om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
