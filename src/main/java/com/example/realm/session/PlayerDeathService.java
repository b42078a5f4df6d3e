package com.example.realm.session;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.content.ContentCatalog;
import com.example.realm.content.MapDefinition;
import com.example.realm.logic.combat.PlayerDeathListener;
import com.example.realm.logic.item.GroundItemService;
import com.example.realm.logic.npc.NpcRegistry;
import com.example.realm.store.PersistenceService;
import com.example.realm.world.Npc;
import com.example.realm.world.Placement;
import com.example.realm.world.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Death penalty and respawn of a player: part of the experience and gold is lost, the gold lands on
 * the death tile, and the player comes back at its map's respawn point with full hp and mana.
 */
public class PlayerDeathService implements PlayerDeathListener {
    private static final Logger log = LoggerFactory.getLogger(PlayerDeathService.class);

    static final long EXP_PENALTY_THRESHOLD = 100;
    static final int EXP_PENALTY_PERCENT = 5;
    static final int GOLD_DROP_PERCENT = 10;
    private static final int RESPAWN_SEARCH_RADIUS = 10;

    private final ContentCatalog content;
    private final BroadcastService broadcast;
    private final NpcRegistry npcs;
    private final GroundItemService groundItems;
    private final Relocator relocator;
    private final PersistenceService persistence;
    private final int goldItemId;

    public PlayerDeathService(ContentCatalog content, BroadcastService broadcast, NpcRegistry npcs,
                              GroundItemService groundItems, Relocator relocator,
                              PersistenceService persistence, int goldItemId) {
        this.content = content;
        this.broadcast = broadcast;
        this.npcs = npcs;
        this.groundItems = groundItems;
        this.relocator = relocator;
        this.persistence = persistence;
        this.goldItemId = goldItemId;
    }

    @Override
    public void onPlayerDeath(Player p, long now) {
        log.info("{} died at {}:{},{}", p.name, p.mapId(), p.x(), p.y());

        if (p.exp > EXP_PENALTY_THRESHOLD) {
            p.exp -= p.exp * EXP_PENALTY_PERCENT / 100;
        }
        long lostGold = p.gold * GOLD_DROP_PERCENT / 100;
        if (lostGold > 0) {
            p.gold -= lostGold;
            groundItems.place(p.mapId(), p.x(), p.y(), goldItemId, (int) Math.min(lostGold, Integer.MAX_VALUE), 0, now);
        }

        for (Npc n : npcs.targeting(p.id)) n.calmDown();
        p.poisonedUntil = 0;
        p.setHp(p.maxHp());
        p.setMana(p.maxMana());

        MapDefinition map = content.map(p.mapId()).orElse(null);
        if (map != null) {
            Placement placed = relocator.relocate(p, map.id(), map.respawn().x(), map.respawn().y(), RESPAWN_SEARCH_RADIUS);
            if (!placed.isOk()) log.warn("Could not move {} to the respawn point: {}", p.name, placed);
        }
        broadcast.statChanged(p);
        persistence.save(p);
    }
}
