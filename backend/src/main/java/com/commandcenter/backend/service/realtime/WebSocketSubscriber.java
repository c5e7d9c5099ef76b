package com.commandcenter.backend.service.realtime;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Subscriber backed by a WebSocket session. The decorator buffers outgoing frames, so a slow client
 * fills its own buffer (and is dropped past the limit) instead of stalling the broadcast loop.
 */
public class WebSocketSubscriber implements Subscriber {

    private final WebSocketSession session;

    public WebSocketSubscriber(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String json) throws IOException {
        session.sendMessage(new TextMessage(json));
    }
}
