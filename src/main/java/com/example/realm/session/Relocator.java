package com.example.realm.session;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.world.Entity;
import com.example.realm.world.Placement;
import com.example.realm.world.Point;
import com.example.realm.world.WorldIndex;

import java.util.Optional;

/** Teleports, map transitions and death respawns: one index transfer plus the matching broadcast. */
public class Relocator {
    private final WorldIndex world;
    private final BroadcastService broadcast;

    public Relocator(WorldIndex world, BroadcastService broadcast) {
        this.world = world;
        this.broadcast = broadcast;
    }

    /** Moves the entity to (x, y) on {@code mapId}, or to the nearest free tile within {@code searchRadius}. */
    public Placement relocate(Entity e, int mapId, int x, int y, int searchRadius) {
        if (world.map(mapId).isEmpty()) return Placement.UNKNOWN_MAP;
        Optional<Point> spot = world.findNearestFree(mapId, x, y, searchRadius, e.isBlocking());
        if (spot.isEmpty()) return world.check(mapId, x, y, e.isBlocking());

        int fromMap = e.mapId();
        int fromX = e.x();
        int fromY = e.y();
        Placement p = world.transfer(e.id, mapId, spot.get().x(), spot.get().y());
        if (p.isOk()) broadcast.relocated(e, fromMap, fromX, fromY);
        return p;
    }
}
