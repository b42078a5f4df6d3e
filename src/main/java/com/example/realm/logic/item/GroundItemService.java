package com.example.realm.logic.item;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.world.GroundItem;
import com.example.realm.world.Placement;
import com.example.realm.world.Point;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public class GroundItemService {
    private static final Logger log = LoggerFactory.getLogger(GroundItemService.class);
    private static final int SPREAD_RADIUS = 3;

    private final WorldIndex world;
    private final BroadcastService broadcast;
    private final long expiryMs;
    private final long ownerProtectionMs;

    public GroundItemService(WorldIndex world, BroadcastService broadcast, long expiryMs, long ownerProtectionMs) {
        this.world = world;
        this.broadcast = broadcast;
        this.expiryMs = expiryMs;
        this.ownerProtectionMs = ownerProtectionMs;
    }

    /**
     * Drops a stack on (x, y), or on the closest tile that still has room.
     *
     * @param ownerId player that may pick it up exclusively for a while, or 0
     * @return the new item, or empty when there is no room anywhere near
     */
    public Optional<GroundItem> place(int mapId, int x, int y, int itemId, int quantity, long ownerId, long now) {
        if (quantity <= 0) return Optional.empty();
        Optional<Point> spot = world.findNearestFree(mapId, x, y, SPREAD_RADIUS, false);
        if (spot.isEmpty()) {
            log.warn("No room for {}x item {} around {}:{},{}; dropped stack is lost", quantity, itemId, mapId, x, y);
            return Optional.empty();
        }
        GroundItem item = new GroundItem(world.nextId(), itemId, quantity, now, now + expiryMs);
        if (ownerId != 0) item.reserveFor(ownerId, now + ownerProtectionMs);

        Placement p = world.add(item, mapId, spot.get().x(), spot.get().y());
        if (!p.isOk()) {
            log.warn("Placing item {} at {} failed: {}", itemId, spot.get(), p);
            return Optional.empty();
        }
        broadcast.spawned(item);
        return Optional.of(item);
    }

    public void remove(GroundItem item, DespawnReason reason) {
        if (world.remove(item.id).isPresent()) {
            broadcast.despawned(item, reason);
        }
    }
}
