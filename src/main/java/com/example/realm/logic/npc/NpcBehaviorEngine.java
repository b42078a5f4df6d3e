package com.example.realm.logic.npc;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.logic.AStar;
import com.example.realm.logic.combat.CombatService;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.world.Aoi;
import com.example.realm.world.GridMap;
import com.example.realm.world.Heading;
import com.example.realm.world.Npc;
import com.example.realm.world.Placement;
import com.example.realm.world.Player;
import com.example.realm.world.Point;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Per-NPC state machine, advanced once per tick:
 * <pre>
 *   IDLE       -> AGGROED     hostile and a living player within aggro range
 *   AGGROED    -> ATTACKING   target adjacent and attack cooldown elapsed
 *   ATTACKING  -> AGGROED     next tick
 *   AGGROED    -> IDLE        target gone, dead, or beyond disengage range
 *   DEAD       -> RESPAWNING  immediately
 *   RESPAWNING -> IDLE        deadline passed and spawn tile free (else deadline += retry)
 * </pre>
 * Movement is at most one tile per tick, re-planned every tick against current occupancy.
 */
public class NpcBehaviorEngine {
    private static final Logger log = LoggerFactory.getLogger(NpcBehaviorEngine.class);

    private final WorldIndex world;
    private final BroadcastService broadcast;
    private final CombatService combat;
    private final RandomGenerator rng;
    private final long respawnRetryMs;
    private final int pathSearchLimit;
    private final double wanderChance;

    public NpcBehaviorEngine(WorldIndex world, BroadcastService broadcast, CombatService combat, RandomGenerator rng,
                             long respawnRetryMs, int pathSearchLimit, double wanderChance) {
        this.world = world;
        this.broadcast = broadcast;
        this.combat = combat;
        this.rng = rng;
        this.respawnRetryMs = respawnRetryMs;
        this.pathSearchLimit = pathSearchLimit;
        this.wanderChance = wanderChance;
    }

    public void tick(Npc npc, long now) {
        switch (npc.state()) {
            case IDLE -> idle(npc);
            case AGGROED -> aggroed(npc, now);
            case ATTACKING -> {
                npc.resumeChase();
                aggroed(npc, now);
            }
            case DEAD -> dead(npc, now);
            case RESPAWNING -> respawn(npc, now);
        }
    }

    private void idle(Npc npc) {
        if (npc.template().hostile() && npc.aggroRange() > 0) {
            Optional<Player> target = nearestPlayer(npc, npc.aggroRange());
            if (target.isPresent()) {
                npc.aggro(target.get().id);
                log.debug("{} #{} aggroed on {}", npc.template().name(), npc.id, target.get().name);
                return;
            }
        }
        if (npc.template().wanders() && wanderChance > 0 && rng.nextDouble() < wanderChance) {
            Heading h = Heading.values()[rng.nextInt(Heading.values().length)];
            step(npc, npc.position().step(h));
        }
    }

    private void aggroed(Npc npc, long now) {
        Optional<Player> target = world.get(npc.targetId(), Player.class)
                .filter(Player::isAlive)
                .filter(p -> Aoi.inRange(npc, p, npc.template().disengageRange()));
        if (target.isEmpty()) {
            log.debug("{} #{} lost its target", npc.template().name(), npc.id);
            npc.calmDown();
            return;
        }

        Player p = target.get();
        if (Aoi.adjacent(npc, p)) {
            npc.setHeading(Heading.of(p.x() - npc.x(), p.y() - npc.y(), npc.heading()));
            if (npc.attackReady(now)) combat.npcAttacksPlayer(npc, p, now);
            return;
        }
        chase(npc, p.position());
    }

    private void chase(Npc npc, Point goal) {
        GridMap map = world.map(npc.mapId()).orElseThrow();
        int mapId = npc.mapId();
        Optional<Point> next = AStar.nextStep(map, npc.position(), goal,
                (x, y) -> world.isFree(mapId, x, y), pathSearchLimit);
        if (next.isEmpty() || next.get().equals(goal)) {
            // no path this tick; stay aggroed and try again next tick
            log.trace("{} #{} found no path to {}", npc.template().name(), npc.id, goal);
            return;
        }
        step(npc, next.get());
    }

    private boolean step(Npc npc, Point to) {
        int fromX = npc.x();
        int fromY = npc.y();
        Placement p = world.move(npc.id, to.x(), to.y());
        if (!p.isOk()) return false;
        npc.setHeading(Heading.of(to.x() - fromX, to.y() - fromY, npc.heading()));
        broadcast.moved(npc, fromX, fromY);
        return true;
    }

    private void dead(Npc npc, long now) {
        if (world.remove(npc.id).isPresent()) broadcast.despawned(npc, DespawnReason.DIED);
        npc.awaitRespawn(now + npc.template().respawnMs());
    }

    private void respawn(Npc npc, long now) {
        if (now < npc.respawnAt()) return;

        Placement p = world.add(npc, npc.spawnMapId, npc.spawnX, npc.spawnY);
        if (!p.isOk()) {
            npc.awaitRespawn(now + respawnRetryMs);
            log.debug("{} #{} respawn delayed: {}", npc.template().name(), npc.id, p);
            return;
        }
        npc.respawned();
        broadcast.spawned(npc);
        log.debug("{} #{} respawned at {}:{},{}", npc.template().name(), npc.id, npc.spawnMapId, npc.spawnX, npc.spawnY);
    }

    private Optional<Player> nearestPlayer(Npc npc, int range) {
        return world.rangeQuery(npc.mapId(), npc.x(), npc.y(), range, Player.class).stream()
                .filter(Player::isAlive)
                .min(Comparator.<Player>comparingInt(p -> Aoi.chebyshev(npc.x(), npc.y(), p.x(), p.y()))
                        .thenComparingLong(p -> p.id));
    }
}
