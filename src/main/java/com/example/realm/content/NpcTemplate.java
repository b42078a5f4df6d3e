package com.example.realm.content;

import java.util.List;

/**
 * Behavior parameters of one kind of NPC. Instances reference their template and never copy it, so
 * anything derived from it (max hp, ranges, loot) is the same before and after a respawn.
 */
public record NpcTemplate(
        int id,
        String name,
        boolean hostile,
        int level,
        int maxHp,
        int minDamage,
        int maxDamage,
        int accuracy,
        int evasion,
        int defense,
        int aggroRange,
        int disengageRange,
        long attackCooldownMs,
        int respawnSeconds,
        int experience,
        int minGold,
        int maxGold,
        boolean wanders,
        double poisonChance,
        List<LootEntry> loot
) {
    public NpcTemplate {
        loot = loot == null ? List.of() : List.copyOf(loot);
        if (maxDamage < minDamage) maxDamage = minDamage;
        if (maxGold < minGold) maxGold = minGold;
        if (disengageRange < aggroRange) disengageRange = aggroRange;
    }

    public long respawnMs() {
        return respawnSeconds * 1000L;
    }
}
