package com.example.realm.world;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Authoritative registry of every entity placed in the world, partitioned per map.
 *
 * <p>Not thread-safe. All calls must come from the single world thread; every operation runs to
 * completion without suspending, so no locking is needed. Each entity is registered at exactly one
 * position while present, and each tile holds at most one blocking entity.
 */
public class WorldIndex {
    private static final Logger log = LoggerFactory.getLogger(WorldIndex.class);

    private final int cellSize;
    private final int maxItemsPerTile;
    private final AtomicLong idGen = new AtomicLong(1000);

    private final Map<Integer, MapState> maps = new LinkedHashMap<>();
    private final Map<Long, Entity> entities = new LinkedHashMap<>();
    private final Map<EntityKind, Map<Long, Entity>> byKind = new EnumMap<>(EntityKind.class);

    public WorldIndex(int cellSize, int maxItemsPerTile) {
        this.cellSize = cellSize;
        this.maxItemsPerTile = maxItemsPerTile;
        for (EntityKind k : EntityKind.values()) byKind.put(k, new LinkedHashMap<>());
    }

    public void registerMap(GridMap map) {
        if (maps.containsKey(map.id)) throw new IllegalArgumentException("map already registered: " + map.id);
        maps.put(map.id, new MapState(map, cellSize, maxItemsPerTile));
        log.debug("Registered map {} ({}x{})", map.id, map.w, map.h);
    }

    public Optional<GridMap> map(int mapId) {
        MapState m = maps.get(mapId);
        return m == null ? Optional.empty() : Optional.of(m.terrain);
    }

    public List<GridMap> maps() {
        List<GridMap> out = new ArrayList<>();
        for (MapState m : maps.values()) out.add(m.terrain);
        return out;
    }

    /** Ids are unique across players, NPCs and ground items. */
    public long nextId() {
        return idGen.incrementAndGet();
    }

    // ===== mutations =====

    public Placement add(Entity e, int mapId, int x, int y) {
        if (entities.containsKey(e.id)) return Placement.ALREADY_PRESENT;
        MapState m = maps.get(mapId);
        if (m == null) return Placement.UNKNOWN_MAP;

        Placement p = m.check(x, y, e.isBlocking(), e.id);
        if (!p.isOk()) return p;

        e.place(mapId, x, y);
        m.put(e);
        entities.put(e.id, e);
        byKind.get(e.kind()).put(e.id, e);
        return Placement.OK;
    }

    public Optional<Entity> remove(long id) {
        Entity e = entities.remove(id);
        if (e == null) return Optional.empty();
        byKind.get(e.kind()).remove(id);
        maps.get(e.mapId()).take(e);
        return Optional.of(e);
    }

    /** Removes the blocking occupant of a tile, if any. */
    public Optional<Entity> removeAt(int mapId, int x, int y) {
        return occupantAt(mapId, x, y).flatMap(e -> remove(e.id));
    }

    /** Check-then-move within the entity's current map. On failure the entity stays where it was. */
    public Placement move(long id, int toX, int toY) {
        Entity e = entities.get(id);
        if (e == null) return Placement.UNKNOWN_ENTITY;
        MapState m = maps.get(e.mapId());

        Placement p = m.check(toX, toY, e.isBlocking(), e.id);
        if (!p.isOk()) return p;

        m.take(e);
        e.place(e.mapId(), toX, toY);
        m.put(e);
        return Placement.OK;
    }

    /**
     * Moves an entity to another map. The destination is checked first and the entity is taken off the
     * source map before it is put on the destination, so it is never registered on both.
     */
    public Placement transfer(long id, int toMapId, int toX, int toY) {
        Entity e = entities.get(id);
        if (e == null) return Placement.UNKNOWN_ENTITY;
        if (e.mapId() == toMapId) return move(id, toX, toY);

        MapState dest = maps.get(toMapId);
        if (dest == null) return Placement.UNKNOWN_MAP;
        Placement p = dest.check(toX, toY, e.isBlocking(), e.id);
        if (!p.isOk()) return p;

        maps.get(e.mapId()).take(e);
        e.place(toMapId, toX, toY);
        dest.put(e);
        return Placement.OK;
    }

    // ===== queries =====

    public Placement check(int mapId, int x, int y, boolean blocking) {
        MapState m = maps.get(mapId);
        return m == null ? Placement.UNKNOWN_MAP : m.check(x, y, blocking, 0);
    }

    public boolean isFree(int mapId, int x, int y) {
        return check(mapId, x, y, true).isOk();
    }

    public Optional<Entity> occupantAt(int mapId, int x, int y) {
        MapState m = maps.get(mapId);
        if (m == null) return Optional.empty();
        Long id = m.occupantId(x, y);
        return id == null ? Optional.empty() : Optional.ofNullable(entities.get(id));
    }

    public List<GroundItem> itemsAt(int mapId, int x, int y) {
        MapState m = maps.get(mapId);
        return m == null ? List.of() : m.itemsAt(x, y);
    }

    /** Every entity within Chebyshev distance {@code radius} of (x, y). */
    public List<Entity> rangeQuery(int mapId, int x, int y, int radius) {
        MapState m = maps.get(mapId);
        if (m == null) return List.of();
        List<Entity> out = new ArrayList<>();
        m.collect(x, y, radius, out);
        return out;
    }

    public <T extends Entity> List<T> rangeQuery(int mapId, int x, int y, int radius, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Entity e : rangeQuery(mapId, x, y, radius)) {
            if (type.isInstance(e)) out.add(type.cast(e));
        }
        return out;
    }

    /**
     * Nearest tile, ring by ring, where an entity of the given blocking kind could be placed.
     */
    public Optional<Point> findNearestFree(int mapId, int x, int y, int maxRadius, boolean blocking) {
        MapState m = maps.get(mapId);
        if (m == null) return Optional.empty();
        if (m.check(x, y, blocking, 0).isOk()) return Optional.of(new Point(x, y));

        for (int r = 1; r <= maxRadius; r++) {
            for (int dx = -r; dx <= r; dx++) {
                if (m.check(x + dx, y - r, blocking, 0).isOk()) return Optional.of(new Point(x + dx, y - r));
                if (m.check(x + dx, y + r, blocking, 0).isOk()) return Optional.of(new Point(x + dx, y + r));
            }
            for (int dy = -r + 1; dy <= r - 1; dy++) {
                if (m.check(x - r, y + dy, blocking, 0).isOk()) return Optional.of(new Point(x - r, y + dy));
                if (m.check(x + r, y + dy, blocking, 0).isOk()) return Optional.of(new Point(x + r, y + dy));
            }
        }
        return Optional.empty();
    }

    public boolean contains(long id) {
        return entities.containsKey(id);
    }

    public Optional<Entity> get(long id) {
        return Optional.ofNullable(entities.get(id));
    }

    public <T extends Entity> Optional<T> get(long id, Class<T> type) {
        Entity e = entities.get(id);
        return type.isInstance(e) ? Optional.of(type.cast(e)) : Optional.empty();
    }

    public List<Player> players() {
        return snapshot(EntityKind.PLAYER, Player.class);
    }

    public List<Npc> npcs() {
        return snapshot(EntityKind.NPC, Npc.class);
    }

    public List<GroundItem> groundItems() {
        return snapshot(EntityKind.ITEM, GroundItem.class);
    }

    private <T extends Entity> List<T> snapshot(EntityKind kind, Class<T> type) {
        Collection<Entity> values = byKind.get(kind).values();
        List<T> out = new ArrayList<>(values.size());
        for (Entity e : values) out.add(type.cast(e));
        return out;
    }

    public int size() {
        return entities.size();
    }
}
