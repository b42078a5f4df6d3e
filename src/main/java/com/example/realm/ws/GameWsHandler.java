package com.example.realm.ws;

import com.example.realm.error.GameException;
import com.example.realm.logic.WorldExecutor;
import com.example.realm.protocol.MsgType;
import com.example.realm.protocol.WsMessage;
import com.example.realm.protocol.dto.AuthPayload;
import com.example.realm.protocol.dto.CastPayload;
import com.example.realm.protocol.dto.DropPayload;
import com.example.realm.protocol.dto.ErrorPayload;
import com.example.realm.protocol.dto.GoldPayload;
import com.example.realm.protocol.dto.HeadingPayload;
import com.example.realm.protocol.dto.SlotPayload;
import com.example.realm.protocol.dto.TargetPayload;
import com.example.realm.session.Command;
import com.example.realm.session.SessionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Decodes frames and hands them to the world thread. Nothing here reads or writes world state.
 * The first message of a connection must be AUTH.
 */
public class GameWsHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(GameWsHandler.class);

    private final WorldExecutor worldExecutor;
    private final SessionService sessions;
    private final SessionRegistry reg;
    private final ObjectMapper om;
    private final Executor io;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public GameWsHandler(WorldExecutor worldExecutor, SessionService sessions, SessionRegistry reg,
                         ObjectMapper om, Executor io, int sendTimeLimitMs, int bufferSizeLimit) {
        this.worldExecutor = worldExecutor;
        this.sessions = sessions;
        this.reg = reg;
        this.om = om;
        this.io = io;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        // the player is created on AUTH, not here
        reg.open(session.getId(), new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));
    }

    private void sendError(WebSocketSession session, String message) {
        WebSocketSession out = reg.outbound(session.getId()).orElse(session);
        try {
            out.sendMessage(new TextMessage(om.writeValueAsString(new WsMessage<>(MsgType.ERROR, new ErrorPayload(message)))));
        } catch (IOException e) {
            log.debug("Error reply to {} failed: {}", session.getId(), e.toString());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode root;
        MsgType type;
        try {
            root = om.readTree(message.getPayload());
            type = MsgType.valueOf(root.path("type").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            sendError(session, "malformed message");
            return;
        }
        JsonNode payload = root.get("payload");

        if (type == MsgType.AUTH) {
            // duplicate AUTH on an authenticated connection is ignored
            if (reg.userOf(session.getId()).isPresent()) return;
            try {
                authenticate(session, payload(payload, AuthPayload.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                sendError(session, "bad AUTH payload");
            }
            return;
        }

        Optional<Long> userId = reg.userOf(session.getId());
        if (userId.isEmpty()) {
            sendError(session, "AUTH first");
            return;
        }

        Command cmd;
        try {
            cmd = decode(type, payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            sendError(session, "bad " + type + " payload");
            return;
        }
        if (cmd == null) {
            sendError(session, "unsupported message " + type);
            return;
        }
        long user = userId.get();
        worldExecutor.execute(() -> sessions.handle(user, cmd));
    }

    private void authenticate(WebSocketSession session, AuthPayload ap) {
        if (ap.userId <= 0) throw new IllegalArgumentException("invalid user id");
        long userId = ap.userId;
        WebSocketSession out = reg.outbound(session.getId()).orElseThrow(() -> new IllegalStateException("connection not open"));
        WebSocketOutbound channel = new WebSocketOutbound(out, om, io);

        // an older connection of the same user is closed; its player is replaced on the world thread
        reg.bind(session.getId(), new SessionRegistry.Binding(userId, session, channel)).ifPresent(old -> {
            try {
                if (old.session().isOpen()) old.session().close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Closing old connection of user {} failed: {}", userId, e.toString());
            }
        });

        worldExecutor.execute(() -> {
            try {
                sessions.login(userId, ap.name, channel);
            } catch (GameException e) {
                log.info("Login of user {} refused: {}", userId, e.reason());
                sendError(session, e.reason());
                closeQuietly(session);
            }
        });
    }

    private Command decode(MsgType type, JsonNode payload) throws JsonProcessingException {
        return switch (type) {
            case MOVE -> new Command.Move(payload(payload, HeadingPayload.class).heading);
            case HEADING -> new Command.ChangeHeading(payload(payload, HeadingPayload.class).heading);
            case ATTACK -> new Command.Attack(payload(payload, TargetPayload.class).targetId);
            case CAST -> {
                CastPayload p = payload(payload, CastPayload.class);
                yield new Command.Cast(p.spellId, p.targetId);
            }
            case DROP -> {
                DropPayload p = payload(payload, DropPayload.class);
                yield new Command.Drop(p.slot, p.qty);
            }
            case DROP_GOLD -> new Command.DropGold(payload(payload, GoldPayload.class).qty);
            case USE -> new Command.UseItem(payload(payload, SlotPayload.class).slot);
            case PICKUP -> new Command.Pickup();
            default -> null;
        };
    }

    private <T> T payload(JsonNode payload, Class<T> type) throws JsonProcessingException {
        if (payload == null || payload.isNull()) throw new IllegalArgumentException("missing payload");
        return om.treeToValue(payload, type);
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.POLICY_VIOLATION);
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", session.getId(), e.toString());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        reg.close(session.getId()).ifPresent(b ->
                worldExecutor.execute(() -> sessions.disconnect(b.userId(), b.channel())));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on {}: {}", session.getId(), exception.toString());
    }
}
