package com.example.realm.logic.combat;

import java.util.random.RandomGenerator;

public class CombatResolver {
    private final CombatRules rules;

    public CombatResolver(CombatRules rules) {
        this.rules = rules;
    }

    public double hitChance(CombatStats attacker, CombatStats defender) {
        double chance = rules.baseHitChance() + (attacker.accuracy() - defender.evasion()) * rules.hitChancePerPoint();
        return Math.max(rules.minHitChance(), Math.min(rules.maxHitChance(), chance));
    }

    public double criticalChance(CombatStats attacker) {
        return Math.min(rules.maxCriticalChance(), rules.baseCriticalChance() + Math.max(0, attacker.criticalBonus()));
    }

    /**
     * One attack. Rolls hit first, then an independent critical roll, then damage in
     * [minDamage, maxDamage] reduced by the defender's defense but never below 1 on a hit.
     */
    public AttackOutcome resolveAttack(CombatStats attacker, CombatStats defender, RandomGenerator rng) {
        if (rng.nextDouble() >= hitChance(attacker, defender)) return AttackOutcome.MISS;

        boolean critical = rng.nextDouble() < criticalChance(attacker);
        int raw = attacker.maxDamage() > attacker.minDamage()
                ? rng.nextInt(attacker.minDamage(), attacker.maxDamage() + 1)
                : attacker.minDamage();
        int damage = Math.max(1, raw - defender.defense());
        if (critical) damage = (int) Math.round(damage * rules.criticalMultiplier());
        return new AttackOutcome(true, critical, damage);
    }
}
