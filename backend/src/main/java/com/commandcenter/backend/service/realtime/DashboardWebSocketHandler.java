package com.commandcenter.backend.service.realtime;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.domain.DashboardEvent;
import com.commandcenter.backend.domain.EventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * /ws endpoint: init snapshot on connect, then every broadcast event. Clients may send
 * {@code {"type":"ping"}} and get {@code {"type":"pong"}} back.
 */
@Component
public class DashboardWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(DashboardWebSocketHandler.class);

    private final DashboardBroadcaster broadcaster;
    private final ObjectMapper om;
    private final DashboardProperties.WebSocket limits;
    private final Map<String, WebSocketSubscriber> bySession = new ConcurrentHashMap<>();

    public DashboardWebSocketHandler(DashboardBroadcaster broadcaster, ObjectMapper om, DashboardProperties props) {
        this.broadcaster = broadcaster;
        this.om = om;
        this.limits = props.getWebsocket();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSubscriber subscriber =
                new WebSocketSubscriber(session, limits.getSendTimeLimitMs(), limits.getBufferSizeLimit());
        bySession.put(session.getId(), subscriber);
        broadcaster.subscribe(subscriber);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode node;
        try {
            node = om.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON frame from {}", session.getId());
            return;
        }
        WebSocketSubscriber subscriber = bySession.get(session.getId());
        if (subscriber != null && "ping".equals(node.path("type").asText())) {
            broadcaster.sendTo(subscriber, DashboardEvent.of(EventType.PONG));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on {}: {}", session.getId(), exception.toString());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
    }

    private void release(WebSocketSession session) {
        WebSocketSubscriber subscriber = bySession.remove(session.getId());
        if (subscriber != null) {
            broadcaster.unsubscribe(subscriber);
        }
    }
}
