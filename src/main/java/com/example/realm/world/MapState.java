package com.example.realm.world;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Occupancy of one map: at most one blocking occupant per tile, a drop-ordered list of ground items per
 * tile, and a coarse cell grid so range queries only look at nearby entities.
 */
final class MapState {
    final GridMap terrain;
    private final int cellSize;
    private final int maxItemsPerTile;

    private final Map<Integer, Long> occ = new HashMap<>(); // tileKey -> blocking entity id
    private final Map<Integer, List<GroundItem>> items = new HashMap<>(); // tileKey -> items, oldest first
    private final Map<Integer, Set<Entity>> cells = new HashMap<>(); // cellKey -> entities

    MapState(GridMap terrain, int cellSize, int maxItemsPerTile) {
        this.terrain = terrain;
        this.cellSize = Math.max(1, cellSize);
        this.maxItemsPerTile = maxItemsPerTile;
    }

    static int key(int x, int y) {
        return (x << 16) ^ (y & 0xFFFF);
    }

    private int cellKey(int x, int y) {
        return key(x / cellSize, y / cellSize);
    }

    Placement check(int x, int y, boolean blocking, long selfId) {
        if (!terrain.inBounds(x, y)) return Placement.OUT_OF_BOUNDS;
        if (!terrain.isWalkable(x, y)) return Placement.BLOCKED;
        if (blocking) {
            Long occupant = occ.get(key(x, y));
            if (occupant != null && occupant != selfId) return Placement.OCCUPIED;
        } else {
            List<GroundItem> here = items.get(key(x, y));
            if (here != null && here.size() >= maxItemsPerTile) return Placement.TILE_FULL;
        }
        return Placement.OK;
    }

    void put(Entity e) {
        int k = key(e.x(), e.y());
        if (e.isBlocking()) {
            occ.put(k, e.id);
        } else if (e instanceof GroundItem item) {
            items.computeIfAbsent(k, ignored -> new ArrayList<>()).add(item);
        }
        cells.computeIfAbsent(cellKey(e.x(), e.y()), ignored -> new LinkedHashSet<>()).add(e);
    }

    void take(Entity e) {
        int k = key(e.x(), e.y());
        if (e.isBlocking()) {
            occ.remove(k, e.id);
        } else {
            List<GroundItem> here = items.get(k);
            if (here != null) {
                here.remove(e);
                if (here.isEmpty()) items.remove(k);
            }
        }
        int ck = cellKey(e.x(), e.y());
        Set<Entity> cell = cells.get(ck);
        if (cell != null) {
            cell.remove(e);
            if (cell.isEmpty()) cells.remove(ck);
        }
    }

    Long occupantId(int x, int y) {
        return occ.get(key(x, y));
    }

    List<GroundItem> itemsAt(int x, int y) {
        List<GroundItem> here = items.get(key(x, y));
        return here == null ? List.of() : List.copyOf(here);
    }

    void collect(int x, int y, int radius, Collection<Entity> out) {
        if (radius < 0) return;
        int cx1 = Math.max(0, x - radius) / cellSize;
        int cy1 = Math.max(0, y - radius) / cellSize;
        int cx2 = Math.min(terrain.w - 1, x + radius) / cellSize;
        int cy2 = Math.min(terrain.h - 1, y + radius) / cellSize;
        for (int cx = cx1; cx <= cx2; cx++) {
            for (int cy = cy1; cy <= cy2; cy++) {
                Set<Entity> cell = cells.get(key(cx, cy));
                if (cell == null) continue;
                for (Entity e : cell) {
                    if (Aoi.chebyshev(x, y, e.x(), e.y()) <= radius) out.add(e);
                }
            }
        }
    }
}
