package com.example.realm.logic.npc;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.content.ContentCatalog;
import com.example.realm.content.MapDefinition;
import com.example.realm.content.NpcTemplate;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.world.Npc;
import com.example.realm.world.Placement;
import com.example.realm.world.Point;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every NPC instance of the world, including those waiting to respawn (which are not in the
 * {@link WorldIndex} at that time).
 */
public class NpcRegistry {
    private static final Logger log = LoggerFactory.getLogger(NpcRegistry.class);
    private static final int SPAWN_SEARCH_RADIUS = 5;

    private final WorldIndex world;
    private final BroadcastService broadcast;
    private final Map<Long, Npc> npcs = new LinkedHashMap<>();

    public NpcRegistry(WorldIndex world, BroadcastService broadcast) {
        this.world = world;
        this.broadcast = broadcast;
    }

    /** Places a new instance at (x, y) or the nearest free tile, which becomes its spawn origin. */
    public Optional<Npc> spawn(NpcTemplate template, int mapId, int x, int y) {
        Optional<Point> spot = world.findNearestFree(mapId, x, y, SPAWN_SEARCH_RADIUS, true);
        if (spot.isEmpty()) {
            log.warn("No free tile to spawn {} around {}:{},{}", template.name(), mapId, x, y);
            return Optional.empty();
        }
        Point at = spot.get();
        Npc npc = new Npc(world.nextId(), template, mapId, at.x(), at.y());
        Placement p = world.add(npc, mapId, at.x(), at.y());
        if (!p.isOk()) {
            log.warn("Spawning {} at {} failed: {}", template.name(), at, p);
            return Optional.empty();
        }
        npcs.put(npc.id, npc);
        broadcast.spawned(npc);
        return Optional.of(npc);
    }

    public int spawnAll(ContentCatalog content) {
        int n = 0;
        for (MapDefinition m : content.maps()) {
            for (MapDefinition.Spawn s : m.spawns()) {
                NpcTemplate t = content.npc(s.npcId()).orElseThrow();
                for (int i = 0; i < s.countOrOne(); i++) {
                    if (spawn(t, m.id(), s.x(), s.y()).isPresent()) n++;
                }
            }
        }
        log.info("Spawned {} npcs", n);
        return n;
    }

    public Optional<Npc> get(long id) {
        return Optional.ofNullable(npcs.get(id));
    }

    public List<Npc> all() {
        return new ArrayList<>(npcs.values());
    }

    public List<Npc> targeting(long playerId) {
        List<Npc> out = new ArrayList<>();
        for (Npc n : npcs.values()) {
            if (n.targetId() == playerId) out.add(n);
        }
        return out;
    }

    public Optional<Npc> forget(long id) {
        Npc npc = npcs.remove(id);
        if (npc == null) return Optional.empty();
        if (world.remove(id).isPresent()) broadcast.despawned(npc, DespawnReason.REMOVED);
        return Optional.of(npc);
    }

    public int size() {
        return npcs.size();
    }
}
