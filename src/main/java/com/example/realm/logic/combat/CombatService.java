package com.example.realm.logic.combat;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.world.Npc;
import com.example.realm.world.NpcState;
import com.example.realm.world.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.random.RandomGenerator;

/**
 * Applies attack outcomes to live entities: hp changes, combat and stat deltas, aggro on the attacker
 * and death hand-off.
 */
public class CombatService {
    private static final Logger log = LoggerFactory.getLogger(CombatService.class);

    private final CombatResolver resolver;
    private final BroadcastService broadcast;
    private final NpcDeathService npcDeaths;
    private final PlayerDeathListener playerDeaths;
    private final RandomGenerator rng;
    private final long poisonDurationMs;

    public CombatService(CombatResolver resolver, BroadcastService broadcast, NpcDeathService npcDeaths,
                         PlayerDeathListener playerDeaths, RandomGenerator rng, long poisonDurationMs) {
        this.resolver = resolver;
        this.broadcast = broadcast;
        this.npcDeaths = npcDeaths;
        this.playerDeaths = playerDeaths;
        this.rng = rng;
        this.poisonDurationMs = poisonDurationMs;
    }

    public AttackOutcome playerAttacksNpc(Player attacker, Npc target, long now) {
        attacker.lastAttackAt = now;
        AttackOutcome o = resolver.resolveAttack(attacker.combatStats(), target.combatStats(), rng);
        int dealt = o.hit() ? target.takeDamage(o.damage(), attacker.id) : 0;
        broadcast.combat(attacker, target, o.hit(), o.critical(), dealt, target.hp());
        afterNpcHit(attacker, target, dealt, now);
        return o;
    }

    public AttackOutcome npcAttacksPlayer(Npc attacker, Player target, long now) {
        attacker.attacked(now);
        AttackOutcome o = resolver.resolveAttack(attacker.combatStats(), target.combatStats(), rng);
        int dealt = 0;
        if (o.hit()) {
            int before = target.hp();
            target.setHp(before - o.damage());
            dealt = before - target.hp();
            double poison = attacker.template().poisonChance();
            if (target.isAlive() && poison > 0 && rng.nextDouble() < poison) {
                target.poisonedUntil = now + poisonDurationMs;
                log.debug("{} poisoned by {} #{}", target.name, attacker.template().name(), attacker.id);
            }
        }
        broadcast.combat(attacker, target, o.hit(), o.critical(), dealt, target.hp());
        if (o.hit()) {
            broadcast.statChanged(target);
            if (!target.isAlive()) playerDeaths.onPlayerDeath(target, now);
        }
        return o;
    }

    /** Spell damage always lands. Returns the hp actually removed. */
    public int spellDamage(Player caster, Npc target, int amount, long now) {
        int dealt = target.takeDamage(amount, caster.id);
        broadcast.combat(caster, target, true, false, dealt, target.hp());
        afterNpcHit(caster, target, dealt, now);
        return dealt;
    }

    /** Damage with no attacker (poison, environment). */
    public void damagePlayer(Player target, int amount, long now) {
        if (!target.isAlive() || amount <= 0) return;
        target.setHp(target.hp() - amount);
        broadcast.statChanged(target);
        if (!target.isAlive()) playerDeaths.onPlayerDeath(target, now);
    }

    private void afterNpcHit(Player attacker, Npc target, int dealt, long now) {
        if (target.hp() == 0 && target.state().isAlive()) {
            npcDeaths.kill(target, attacker, now);
            return;
        }
        if (target.template().hostile() && target.state() == NpcState.IDLE) {
            target.aggro(attacker.id);
        }
        if (dealt > 0) broadcast.statChanged(target);
    }
}
