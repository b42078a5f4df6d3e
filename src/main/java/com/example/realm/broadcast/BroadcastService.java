package com.example.realm.broadcast;

import com.example.realm.protocol.EntityView;
import com.example.realm.protocol.WorldEvent;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.protocol.WorldEvent.SpawnReason;
import com.example.realm.world.Aoi;
import com.example.realm.world.Entity;
import com.example.realm.world.GroundItem;
import com.example.realm.world.Npc;
import com.example.realm.world.Player;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Works out which sessions observe a change and hands each one its delta. A viewer observes a tile
 * when the tile lies within the viewer's own visibility radius. Delivery to one session never affects
 * delivery to the others.
 */
public class BroadcastService {
    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    private final WorldIndex world;
    private final int maxRadius;
    private final Map<Long, OutboundChannel> channels = new HashMap<>();

    public BroadcastService(WorldIndex world, int maxRadius) {
        this.world = world;
        this.maxRadius = maxRadius;
    }

    public void attach(long playerId, OutboundChannel channel) {
        channels.put(playerId, channel);
    }

    public void detach(long playerId) {
        channels.remove(playerId);
    }

    public boolean isAttached(long playerId) {
        return channels.containsKey(playerId);
    }

    public void sendTo(long playerId, WorldEvent event) {
        OutboundChannel ch = channels.get(playerId);
        if (ch == null) return;
        try {
            ch.deliver(event);
        } catch (RuntimeException e) {
            log.warn("Delivery of {} to player {} failed: {}", event.type(), playerId, e.toString());
        }
    }

    public List<Player> observers(int mapId, int x, int y) {
        List<Player> out = new ArrayList<>();
        for (Player p : world.rangeQuery(mapId, x, y, maxRadius, Player.class)) {
            if (channels.containsKey(p.id) && Aoi.covers(p, mapId, x, y, p.visibilityRadius())) out.add(p);
        }
        return out;
    }

    /** Delivers to every observer of the tile except {@code exceptId}; returns the number of observers. */
    public int publishAt(int mapId, int x, int y, WorldEvent event, long exceptId) {
        int n = 0;
        for (Player p : observers(mapId, x, y)) {
            if (p.id == exceptId) continue;
            sendTo(p.id, event);
            n++;
        }
        return n;
    }

    // ===== entity lifecycle =====

    public void spawned(Entity e) {
        publishAt(e.mapId(), e.x(), e.y(), spawnEvent(e, SpawnReason.APPEARED), e.id);
    }

    /** Must be called with the entity's last position still set, i.e. right after removal from the index. */
    public void despawned(Entity e, DespawnReason reason) {
        publishAt(e.mapId(), e.x(), e.y(), despawnEvent(e, reason), e.id);
    }

    /** A ground stack kept its id but not its size. */
    public void itemChanged(GroundItem item) {
        publishAt(item.mapId(), item.x(), item.y(), new WorldEvent.ItemChanged(item.id, item.quantity()), 0);
    }

    public void statChanged(Entity e) {
        if (e instanceof Player p) {
            publishAt(p.mapId(), p.x(), p.y(), WorldEvent.StatChanged.publicOf(p), p.id);
            sendTo(p.id, WorldEvent.StatChanged.privateOf(p));
        } else if (e instanceof Npc n) {
            publishAt(n.mapId(), n.x(), n.y(), WorldEvent.StatChanged.of(n), 0);
        }
    }

    /** Stats only the player itself cares about (food, water, gold, mana). */
    public void privateStats(Player p) {
        sendTo(p.id, WorldEvent.StatChanged.privateOf(p));
    }

    public void combat(Entity attacker, Entity target, boolean hit, boolean critical, int damage, int targetHp) {
        WorldEvent ev = new WorldEvent.CombatHit(attacker.id, target.id, hit, critical, damage, targetHp);
        publishAt(target.mapId(), target.x(), target.y(), ev, 0);
        if (attacker instanceof Player p && !Aoi.covers(p, target.mapId(), target.x(), target.y(), p.visibilityRadius())) {
            sendTo(p.id, ev);
        }
    }

    // ===== movement =====

    /**
     * Broadcasts a move within one map. Observers that saw both tiles get a move; observers that only
     * saw one get an explicit enter or leave. A moving player also gets enter/leave events for every
     * entity crossing its own visibility boundary.
     */
    public void moved(Entity e, int fromX, int fromY) {
        int mapId = e.mapId();
        WorldEvent move = moveEvent(e);

        Map<Long, Player> candidates = new LinkedHashMap<>();
        for (Player p : world.rangeQuery(mapId, fromX, fromY, maxRadius, Player.class)) candidates.put(p.id, p);
        for (Player p : world.rangeQuery(mapId, e.x(), e.y(), maxRadius, Player.class)) candidates.put(p.id, p);

        for (Player p : candidates.values()) {
            if (p.id == e.id || !channels.containsKey(p.id)) continue;
            boolean before = Aoi.covers(p, mapId, fromX, fromY, p.visibilityRadius());
            boolean now = Aoi.covers(p, mapId, e.x(), e.y(), p.visibilityRadius());
            if (before && now) {
                sendTo(p.id, move);
            } else if (now) {
                sendTo(p.id, spawnEvent(e, SpawnReason.ENTERED_VIEW));
            } else if (before) {
                sendTo(p.id, despawnEvent(e, DespawnReason.LEFT_VIEW));
            }
        }

        if (e instanceof Player mover && channels.containsKey(mover.id)) {
            sendTo(mover.id, move);
            int r = mover.visibilityRadius();
            Set<Entity> before = new LinkedHashSet<>(world.rangeQuery(mapId, fromX, fromY, r));
            Set<Entity> after = new LinkedHashSet<>(world.rangeQuery(mapId, mover.x(), mover.y(), r));
            for (Entity other : after) {
                if (other != mover && !before.contains(other)) sendTo(mover.id, spawnEvent(other, SpawnReason.ENTERED_VIEW));
            }
            for (Entity other : before) {
                if (other != mover && !after.contains(other)) sendTo(mover.id, despawnEvent(other, DespawnReason.LEFT_VIEW));
            }
        }
    }

    /** Broadcasts a jump between maps (or a teleport within one): leave for old observers, appear for new ones. */
    public void relocated(Entity e, int fromMapId, int fromX, int fromY) {
        publishAt(fromMapId, fromX, fromY, despawnEvent(e, DespawnReason.LEFT_VIEW), e.id);
        spawned(e);
        if (e instanceof Player p) {
            sendTo(p.id, moveEvent(p));
            sendSnapshot(p, fromMapId, fromX, fromY);
        }
    }

    public void sendSnapshot(Player p) {
        for (Entity other : world.rangeQuery(p.mapId(), p.x(), p.y(), p.visibilityRadius())) {
            if (other != p) sendTo(p.id, spawnEvent(other, SpawnReason.ENTERED_VIEW));
        }
    }

    private void sendSnapshot(Player p, int fromMapId, int fromX, int fromY) {
        for (Entity other : world.rangeQuery(fromMapId, fromX, fromY, p.visibilityRadius())) {
            if (other != p && !Aoi.covers(p, other.mapId(), other.x(), other.y(), p.visibilityRadius())) {
                sendTo(p.id, despawnEvent(other, DespawnReason.LEFT_VIEW));
            }
        }
        sendSnapshot(p);
    }

    private static WorldEvent moveEvent(Entity e) {
        return new WorldEvent.EntityMoved(e.id, e.mapId(), e.x(), e.y(),
                e instanceof Player p ? p.heading() : e instanceof Npc n ? n.heading() : null);
    }

    private static WorldEvent spawnEvent(Entity e, SpawnReason reason) {
        EntityView view = EntityView.of(e);
        return e instanceof GroundItem ? new WorldEvent.ItemSpawned(view, reason) : new WorldEvent.EntitySpawned(view, reason);
    }

    private static WorldEvent despawnEvent(Entity e, DespawnReason reason) {
        return e instanceof GroundItem ? new WorldEvent.ItemRemoved(e.id, reason) : new WorldEvent.EntityDespawned(e.id, reason);
    }
}
