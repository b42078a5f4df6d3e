package com.example.realm.admin;

import com.example.realm.content.ContentCatalog;
import com.example.realm.content.NpcTemplate;
import com.example.realm.error.OccupancyConflictException;
import com.example.realm.error.ValidationException;
import com.example.realm.logic.TickScheduler;
import com.example.realm.logic.item.GroundItemService;
import com.example.realm.logic.npc.NpcRegistry;
import com.example.realm.protocol.EntityView;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.session.Relocator;
import com.example.realm.session.SessionService;
import com.example.realm.world.Entity;
import com.example.realm.world.GroundItem;
import com.example.realm.world.Npc;
import com.example.realm.world.Player;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Operator actions. Same index operations and broadcasts as gameplay; world thread only. */
public class AdminService {
    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private final WorldIndex world;
    private final ContentCatalog content;
    private final SessionService sessions;
    private final NpcRegistry npcs;
    private final GroundItemService groundItems;
    private final Relocator relocator;
    private final TickScheduler scheduler;

    public AdminService(WorldIndex world, ContentCatalog content, SessionService sessions, NpcRegistry npcs,
                        GroundItemService groundItems, Relocator relocator, TickScheduler scheduler) {
        this.world = world;
        this.content = content;
        this.sessions = sessions;
        this.npcs = npcs;
        this.groundItems = groundItems;
        this.relocator = relocator;
        this.scheduler = scheduler;
    }

    public record Status(long tick, int online, int npcs, int groundItems, int entities) {}

    public EntityView teleport(long userId, int mapId, int x, int y) {
        Player p = sessions.player(userId).orElseThrow(() -> new ValidationException("user is not online"));
        relocator.relocate(p, mapId, x, y, 0).requireOk();
        log.info("Admin teleported {} to {}:{},{}", p.name, mapId, x, y);
        return EntityView.of(p);
    }

    public EntityView spawnNpc(int templateId, int mapId, int x, int y) {
        NpcTemplate t = content.npc(templateId).orElseThrow(() -> new ValidationException("unknown npc template"));
        if (world.map(mapId).filter(m -> m.inBounds(x, y)).isEmpty()) throw new ValidationException("out of bounds");
        Npc npc = npcs.spawn(t, mapId, x, y).orElseThrow(() -> new OccupancyConflictException("no free tile nearby"));
        log.info("Admin spawned {} #{} at {}:{},{}", t.name(), npc.id, npc.mapId(), npc.x(), npc.y());
        return EntityView.of(npc);
    }

    /** Removes an NPC (for good) or a ground item. Players have to disconnect instead. */
    public void despawn(long entityId) {
        Entity e = world.get(entityId).orElse(null);
        if (e instanceof GroundItem item) {
            groundItems.remove(item, DespawnReason.REMOVED);
        } else if (e instanceof Player) {
            throw new ValidationException("players cannot be despawned");
        } else if (npcs.forget(entityId).isEmpty()) {
            throw new ValidationException("no such entity");
        }
        log.info("Admin despawned entity {}", entityId);
    }

    public Status status() {
        return new Status(scheduler.currentTick(), sessions.online(), npcs.size(),
                world.groundItems().size(), world.size());
    }
}
