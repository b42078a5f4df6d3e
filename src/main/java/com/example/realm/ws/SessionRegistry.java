package com.example.realm.ws;

import org.springframework.web.socket.WebSocketSession;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Transport-side bookkeeping: which websocket belongs to which user. Touched by websocket threads only. */
public class SessionRegistry {

    public record Binding(long userId, WebSocketSession session, WebSocketOutbound channel) {}

    private final Map<String, WebSocketSession> open = new ConcurrentHashMap<>();
    private final Map<String, Binding> bySession = new ConcurrentHashMap<>();
    private final Map<Long, Binding> byUser = new ConcurrentHashMap<>();

    public void open(String sessionId, WebSocketSession outbound) {
        open.put(sessionId, outbound);
    }

    public Optional<WebSocketSession> outbound(String sessionId) {
        return Optional.ofNullable(open.get(sessionId));
    }

    /** @return the binding this user had on another connection, if any */
    public Optional<Binding> bind(String sessionId, Binding binding) {
        bySession.put(sessionId, binding);
        Binding previous = byUser.put(binding.userId(), binding);
        return previous == null || previous.session().getId().equals(binding.session().getId())
                ? Optional.empty()
                : Optional.of(previous);
    }

    public Optional<Long> userOf(String sessionId) {
        return Optional.ofNullable(bySession.get(sessionId)).map(Binding::userId);
    }

    public Optional<Binding> close(String sessionId) {
        open.remove(sessionId);
        Binding b = bySession.remove(sessionId);
        if (b == null) return Optional.empty();
        byUser.remove(b.userId(), b);
        return Optional.of(b);
    }

    public int bound() {
        return byUser.size();
    }
}
