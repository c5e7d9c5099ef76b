package com.commandcenter.backend.service.realtime;

import java.io.IOException;

/**
 * A connected live client. Implementations must accept calls from any thread; the broadcaster
 * never calls {@link #send} concurrently for the same subscriber.
 */
public interface Subscriber {

    String id();

    boolean isOpen();

    void send(String json) throws IOException;
}
