package com.example.realm.logic.combat;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.content.NpcTemplate;
import com.example.realm.logic.item.GroundItemService;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.store.PersistenceService;
import com.example.realm.world.Aoi;
import com.example.realm.world.GroundItem;
import com.example.realm.world.ItemStack;
import com.example.realm.world.Leveling;
import com.example.realm.world.Npc;
import com.example.realm.world.Player;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Applies what happens when an NPC reaches 0 hp: rewards, loot on the death tile, removal from the
 * world and a respawn deadline. Runs at most once per life of an NPC.
 */
public class NpcDeathService {
    private static final Logger log = LoggerFactory.getLogger(NpcDeathService.class);

    private final WorldIndex world;
    private final BroadcastService broadcast;
    private final GroundItemService groundItems;
    private final PersistenceService persistence;
    private final RandomGenerator rng;
    private final int expShareDistance;

    public NpcDeathService(WorldIndex world, BroadcastService broadcast, GroundItemService groundItems,
                           PersistenceService persistence, RandomGenerator rng, int expShareDistance) {
        this.world = world;
        this.broadcast = broadcast;
        this.groundItems = groundItems;
        this.persistence = persistence;
        this.rng = rng;
        this.expShareDistance = expShareDistance;
    }

    /** @return the kill report, or empty if this NPC was already dead */
    public Optional<KillReport> kill(Npc npc, Player killer, long now) {
        if (!npc.markDead()) return Optional.empty();

        NpcTemplate t = npc.template();
        int mapId = npc.mapId();
        int x = npc.x();
        int y = npc.y();

        world.remove(npc.id);
        broadcast.despawned(npc, DespawnReason.DIED);

        List<Player> group = rewardGroup(npc, killer);
        List<Long> ids = new ArrayList<>();
        for (Player p : group) ids.add(p.id);

        long gold = t.maxGold() > t.minGold() ? rng.nextLong(t.minGold(), t.maxGold() + 1L) : t.minGold();
        List<RewardCalculator.Share> shares = RewardCalculator.split(t.experience(), gold, killer.id, ids);
        for (RewardCalculator.Share share : shares) {
            world.get(share.playerId(), Player.class).ifPresent(p -> reward(p, t, share));
        }

        List<GroundItem> drops = new ArrayList<>();
        for (ItemStack stack : LootRoller.roll(t.loot(), rng)) {
            groundItems.place(mapId, x, y, stack.itemId(), stack.quantity(), killer.id, now).ifPresent(drops::add);
        }

        long respawnAt = now + t.respawnMs();
        npc.awaitRespawn(respawnAt);
        log.debug("{} #{} killed by {} ({} shares, {} drops), respawn at {}", t.name(), npc.id, killer.name,
                shares.size(), drops.size(), respawnAt);
        return Optional.of(new KillReport(npc.id, killer.id, shares, drops, respawnAt));
    }

    private List<Player> rewardGroup(Npc npc, Player killer) {
        List<Player> group = new ArrayList<>();
        for (Long id : npc.damageBy().keySet()) {
            if (id == killer.id) continue;
            world.get(id, Player.class)
                    .filter(Player::isAlive)
                    .filter(p -> Aoi.inRange(npc, p, expShareDistance))
                    .ifPresent(group::add);
        }
        group.add(killer);
        return group;
    }

    private void reward(Player p, NpcTemplate t, RewardCalculator.Share share) {
        long exp = Leveling.scaleKillExp(p.level, t.level(), share.exp());
        int levels = Leveling.addExpAndLevelUp(p, exp);
        p.gold += share.gold();
        broadcast.statChanged(p);
        if (levels > 0) {
            log.info("{} reached level {}", p.name, p.level);
            persistence.save(p);
        }
    }
}
