package com.example.realm.world;

import com.example.realm.content.NpcTemplate;
import com.example.realm.logic.combat.CombatStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One NPC instance. Behavior parameters live in the referenced {@link NpcTemplate}; this object only
 * holds what changes at runtime. The target is stored as an entity id and resolved through the
 * {@link WorldIndex} when used.
 */
public class Npc extends Entity {
    private final NpcTemplate template;
    public final int spawnMapId;
    public final int spawnX;
    public final int spawnY;

    private int hp;
    private NpcState state = NpcState.IDLE;
    private long targetId = 0;
    private long lastAttackAt = -1;
    private long respawnAt = 0;
    private Heading heading = Heading.SOUTH;
    private final Map<Long, Integer> damageBy = new LinkedHashMap<>();

    public Npc(long id, NpcTemplate template, int spawnMapId, int spawnX, int spawnY) {
        super(id);
        this.template = template;
        this.spawnMapId = spawnMapId;
        this.spawnX = spawnX;
        this.spawnY = spawnY;
        this.hp = template.maxHp();
    }

    @Override
    public EntityKind kind() {
        return EntityKind.NPC;
    }

    public NpcTemplate template() { return template; }
    public int hp() { return hp; }
    public int maxHp() { return template.maxHp(); }
    public int aggroRange() { return template.aggroRange(); }
    public NpcState state() { return state; }
    public long targetId() { return targetId; }
    public boolean hasTarget() { return targetId != 0; }
    public long respawnAt() { return respawnAt; }
    public Heading heading() { return heading; }

    public boolean isAlive() {
        return state.isAlive() && hp > 0;
    }

    public CombatStats combatStats() {
        return new CombatStats(template.accuracy(), template.evasion(), template.minDamage(),
                template.maxDamage(), template.defense(), 0.0);
    }

    public void setHeading(Heading heading) {
        this.heading = heading;
    }

    /** Applies damage clamped to the remaining hp and returns the amount actually taken. */
    public int takeDamage(int damage, long fromPlayerId) {
        if (!isAlive() || damage <= 0) return 0;
        int taken = Math.min(hp, damage);
        hp -= taken;
        if (fromPlayerId != 0) damageBy.merge(fromPlayerId, taken, Integer::sum);
        return taken;
    }

    public Map<Long, Integer> damageBy() {
        return Collections.unmodifiableMap(damageBy);
    }

    public boolean attackReady(long now) {
        return lastAttackAt < 0 || now - lastAttackAt >= template.attackCooldownMs();
    }

    public void aggro(long playerId) {
        this.targetId = playerId;
        this.state = NpcState.AGGROED;
    }

    public void attacked(long now) {
        this.lastAttackAt = now;
        this.state = NpcState.ATTACKING;
    }

    public void calmDown() {
        this.targetId = 0;
        this.state = NpcState.IDLE;
    }

    public void resumeChase() {
        this.state = NpcState.AGGROED;
    }

    /**
     * Marks the NPC dead. Only the first call after a spawn succeeds, so death consequences are applied
     * once no matter how many hits land on the same tick.
     */
    public boolean markDead() {
        if (!state.isAlive()) return false;
        hp = 0;
        targetId = 0;
        state = NpcState.DEAD;
        return true;
    }

    public void awaitRespawn(long at) {
        this.state = NpcState.RESPAWNING;
        this.respawnAt = at;
    }

    public void respawned() {
        this.hp = template.maxHp();
        this.state = NpcState.IDLE;
        this.targetId = 0;
        this.lastAttackAt = -1;
        this.respawnAt = 0;
        this.damageBy.clear();
    }
}
