package com.example.realm.logic.combat;

/**
 * Tuning for {@link CombatResolver}. Hit chance is {@code baseHitChance + (accuracy - evasion) *
 * hitChancePerPoint}, clamped to [minHitChance, maxHitChance]. Critical chance is
 * {@code baseCriticalChance + attacker bonus}, capped at maxCriticalChance.
 */
public record CombatRules(
        double baseHitChance,
        double hitChancePerPoint,
        double minHitChance,
        double maxHitChance,
        double baseCriticalChance,
        double maxCriticalChance,
        double criticalMultiplier,
        int expShareDistance
) {
    public static CombatRules defaults() {
        return new CombatRules(0.75, 0.01, 0.05, 0.95, 0.10, 0.5, 2.0, 30);
    }
}
