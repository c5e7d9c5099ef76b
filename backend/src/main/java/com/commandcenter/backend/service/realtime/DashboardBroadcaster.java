package com.commandcenter.backend.service.realtime;

import com.commandcenter.backend.domain.DashboardEvent;
import com.commandcenter.backend.domain.EventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live subscribers and best-effort fan-out of dashboard events.
 * <p>
 * Sends go out under a single lock, so every subscriber sees events in the order broadcasts were issued,
 * and a new subscriber's init snapshot is never interleaved with a concurrent event. A failed or closed
 * subscriber is dropped; the failure never reaches the caller.
 */
@Component
public class DashboardBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(DashboardBroadcaster.class);

    private final ObjectMapper om;
    private final SnapshotProvider snapshots;
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Object sendLock = new Object();

    public DashboardBroadcaster(ObjectMapper om, SnapshotProvider snapshots) {
        this.om = om;
        this.snapshots = snapshots;
    }

    /** Registers {@code subscriber} and sends it the init snapshot as its first message. */
    public void subscribe(Subscriber subscriber) {
        synchronized (sendLock) {
            subscribers.put(subscriber.id(), subscriber);
            String init = serialize(new DashboardEvent(EventType.INIT, snapshots.snapshot()));
            if (init != null) {
                deliver(subscriber, init);
            }
        }
        log.debug("Subscriber {} connected ({} live)", subscriber.id(), subscribers.size());
    }

    public void unsubscribe(Subscriber subscriber) {
        if (subscribers.remove(subscriber.id()) != null) {
            log.debug("Subscriber {} disconnected ({} live)", subscriber.id(), subscribers.size());
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public void broadcast(EventType type, Object data) {
        broadcast(new DashboardEvent(type, data));
    }

    public void broadcast(DashboardEvent event) {
        if (subscribers.isEmpty()) return;
        String json = serialize(event);
        if (json == null) return;
        synchronized (sendLock) {
            for (Subscriber s : subscribers.values()) {
                deliver(s, json);
            }
        }
    }

    /** Sends to one subscriber only, e.g. a pong. */
    public void sendTo(Subscriber subscriber, DashboardEvent event) {
        String json = serialize(event);
        if (json == null) return;
        synchronized (sendLock) {
            deliver(subscriber, json);
        }
    }

    private void deliver(Subscriber s, String json) {
        if (!s.isOpen()) {
            subscribers.remove(s.id());
            return;
        }
        try {
            s.send(json);
        } catch (IOException | RuntimeException e) {
            log.debug("Dropping subscriber {} after failed send: {}", s.id(), e.toString());
            subscribers.remove(s.id());
        }
    }

    private String serialize(DashboardEvent event) {
        try {
            return om.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} event", event.type().wire(), e);
            return null;
        }
    }
}
