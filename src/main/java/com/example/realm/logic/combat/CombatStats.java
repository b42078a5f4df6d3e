package com.example.realm.logic.combat;

public record CombatStats(int accuracy, int evasion, int minDamage, int maxDamage, int defense, double criticalBonus) {
    public CombatStats {
        if (maxDamage < minDamage) maxDamage = minDamage;
    }
}
