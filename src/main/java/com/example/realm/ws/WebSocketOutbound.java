package com.example.realm.ws;

import com.example.realm.broadcast.OutboundChannel;
import com.example.realm.protocol.WorldEvent;
import com.example.realm.protocol.WsMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.Executor;

/**
 * Encodes on the calling (world) thread and sends on the I/O executor, so a slow client never stalls
 * a tick. The session is expected to be a {@code ConcurrentWebSocketSessionDecorator}.
 */
public class WebSocketOutbound implements OutboundChannel {
    private static final Logger log = LoggerFactory.getLogger(WebSocketOutbound.class);

    private final WebSocketSession session;
    private final ObjectMapper om;
    private final Executor io;

    public WebSocketOutbound(WebSocketSession session, ObjectMapper om, Executor io) {
        this.session = session;
        this.om = om;
        this.io = io;
    }

    @Override
    public void deliver(WorldEvent event) {
        String json;
        try {
            json = om.writeValueAsString(new WsMessage<>(event.type(), event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + event.type(), e);
        }
        io.execute(() -> send(json));
    }

    private void send(String json) {
        if (!session.isOpen()) return;
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | RuntimeException e) {
            log.debug("Send to session {} failed: {}", session.getId(), e.toString());
        }
    }
}
