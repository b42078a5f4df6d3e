package com.example.realm.session;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.broadcast.OutboundChannel;
import com.example.realm.content.ContentCatalog;
import com.example.realm.content.MapDefinition;
import com.example.realm.error.GameException;
import com.example.realm.error.OccupancyConflictException;
import com.example.realm.error.ValidationException;
import com.example.realm.logic.npc.NpcRegistry;
import com.example.realm.protocol.WorldEvent;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.store.PersistenceService;
import com.example.realm.store.PlayerRecord;
import com.example.realm.world.Entity;
import com.example.realm.world.ItemStack;
import com.example.realm.world.Npc;
import com.example.realm.world.Player;
import com.example.realm.world.Point;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the mapping from users to their player entities. All methods run on the world thread; the
 * transport only decodes frames and hands them over.
 */
public class SessionService {
    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private static final int LOGIN_SEARCH_RADIUS = 10;

    private final WorldIndex world;
    private final BroadcastService broadcast;
    private final ContentCatalog content;
    private final NpcRegistry npcs;
    private final CommandHandler commands;
    private final PersistenceService persistence;
    private final Clock clock;
    private final PlayerRules rules;
    private final long tickIntervalMs;
    private final Map<Long, PlayerSession> sessions = new LinkedHashMap<>();

    public SessionService(WorldIndex world, BroadcastService broadcast, ContentCatalog content, NpcRegistry npcs,
                          CommandHandler commands, PersistenceService persistence, Clock clock,
                          PlayerRules rules, long tickIntervalMs) {
        this.world = world;
        this.broadcast = broadcast;
        this.content = content;
        this.npcs = npcs;
        this.commands = commands;
        this.persistence = persistence;
        this.clock = clock;
        this.rules = rules;
        this.tickIntervalMs = tickIntervalMs;
    }

    /**
     * Logs the user in with its latest state: the player it already has online, or else what the store
     * holds, unsaved writes included. Runs on the world thread so a save queued by an earlier disconnect
     * is always seen.
     */
    public PlayerSession login(long userId, String name, OutboundChannel channel) {
        Optional<PlayerRecord> restored = player(userId).map(PlayerRecord::of);
        if (restored.isEmpty()) restored = persistence.load(userId);
        return login(userId, name, restored, channel);
    }

    /**
     * Puts the user's player into the world. A user that is already online is logged out first.
     *
     * @param restored last stored state, or empty for a fresh character
     * @throws OccupancyConflictException when no free tile is found near the saved position
     */
    public PlayerSession login(long userId, String name, Optional<PlayerRecord> restored, OutboundChannel channel) {
        if (sessions.containsKey(userId)) {
            log.info("User {} logged in again, replacing the old session", userId);
            disconnect(userId);
        }

        String playerName = name != null && !name.isBlank() ? name
                : restored.map(PlayerRecord::name).orElse("player" + userId);
        Player p = new Player(world.nextId(), userId, playerName, rules.maxHp(), rules.maxMana(),
                rules.inventorySlots(), rules.visibilityRadius());
        p.attackIntervalMs = rules.attackIntervalMs();

        MapDefinition start = content.map(rules.startMapId())
                .orElseThrow(() -> new ValidationException("start map is not loaded"));
        int mapId = start.id();
        Point want = start.respawn();
        if (restored.isPresent()) {
            PlayerRecord r = restored.get();
            r.applyTo(p);
            if (world.map(r.mapId()).filter(m -> m.inBounds(r.x(), r.y())).isPresent()) {
                mapId = r.mapId();
                want = new Point(r.x(), r.y());
            }
        }
        if (!p.isAlive()) p.setHp(p.maxHp());

        Point at = world.findNearestFree(mapId, want.x(), want.y(), LOGIN_SEARCH_RADIUS, true)
                .orElseThrow(() -> new OccupancyConflictException("no free tile to enter the world"));
        world.add(p, mapId, at.x(), at.y()).requireOk();

        PlayerSession session = new PlayerSession(userId, p.id, channel, clock.millis());
        sessions.put(userId, session);
        broadcast.attach(p.id, channel);
        broadcast.sendTo(p.id, new WorldEvent.Welcome(p.id, p.mapId(), p.x(), p.y(), tickIntervalMs));
        broadcast.privateStats(p);
        for (int i = 0; i < p.inventory.size(); i++) {
            Optional<ItemStack> s = p.inventory.slot(i);
            if (s.isPresent()) broadcast.sendTo(p.id, new WorldEvent.InventoryChanged(i, s.get().itemId(), s.get().quantity()));
        }
        broadcast.sendSnapshot(p);
        broadcast.spawned(p);

        log.info("User {} entered as {} (#{}) at {}:{},{}", userId, p.name, p.id, p.mapId(), p.x(), p.y());
        return session;
    }

    /**
     * Runs one command. A rejected command is reported to the issuing session only.
     *
     * @return whether the command was applied
     */
    public boolean handle(long userId, Command cmd) {
        PlayerSession session = sessions.get(userId);
        if (session == null) {
            log.debug("Dropping {} from user {} without a session", cmd.name(), userId);
            return false;
        }
        Optional<Player> player = world.get(session.playerId(), Player.class);
        if (player.isEmpty()) return false;

        try {
            commands.execute(player.get(), cmd, clock.millis());
            return true;
        } catch (GameException e) {
            log.debug("{} rejected for {}: {}", cmd.name(), player.get().name, e.reason());
            broadcast.sendTo(session.playerId(), new WorldEvent.CommandRejected(cmd.name(), e.reason()));
            return false;
        }
    }

    public boolean disconnect(long userId) {
        PlayerSession session = sessions.remove(userId);
        if (session == null) return false;

        for (Npc n : npcs.targeting(session.playerId())) n.calmDown();
        Optional<Entity> removed = world.remove(session.playerId());
        broadcast.detach(session.playerId());
        if (removed.isPresent() && removed.get() instanceof Player p) {
            broadcast.despawned(p, DespawnReason.REMOVED);
            persistence.save(p);
            log.info("User {} left ({})", userId, p.name);
        }
        return true;
    }

    /** Disconnects only when {@code channel} is still the user's current one. */
    public boolean disconnect(long userId, OutboundChannel channel) {
        PlayerSession session = sessions.get(userId);
        if (session == null || session.channel() != channel) return false;
        return disconnect(userId);
    }

    public Optional<PlayerSession> session(long userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    public Optional<Player> player(long userId) {
        return session(userId).flatMap(s -> world.get(s.playerId(), Player.class));
    }

    public int online() {
        return sessions.size();
    }

    public int saveAll() {
        List<Player> online = new ArrayList<>();
        for (PlayerSession s : sessions.values()) world.get(s.playerId(), Player.class).ifPresent(online::add);
        online.forEach(persistence::save);
        return online.size();
    }
}
