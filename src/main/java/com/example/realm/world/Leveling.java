package com.example.realm.world;

public final class Leveling {
    public static final int MAX_LEVEL = 50;

    private Leveling() {}

    // experience needed to go from this level to the next
    public static long requiredExp(int level) {
        // quick early levels, heavier later on
        return 80L + (long) level * level * 40L;
    }

    // kill experience scales with the level gap between player and npc
    public static float levelDiffMultiplier(int playerLevel, int npcLevel) {
        int diff = npcLevel - playerLevel;

        if (diff >= 5) return 1.50f;
        if (diff == 4) return 1.35f;
        if (diff == 3) return 1.25f;
        if (diff == 2) return 1.15f;
        if (diff == 1) return 1.07f;
        if (diff == 0) return 1.00f;
        if (diff == -1) return 0.90f;
        if (diff == -2) return 0.80f;
        if (diff == -3) return 0.70f;
        if (diff == -4) return 0.55f;

        // grey mobs still give a little
        return 0.40f;
    }

    public static long scaleKillExp(int playerLevel, int npcLevel, long baseExp) {
        long raw = Math.round(baseExp * levelDiffMultiplier(playerLevel, npcLevel));
        return Math.max(0, raw);
    }

    /** Adds experience and applies every level-up it pays for. Returns the number of levels gained. */
    public static int addExpAndLevelUp(Player p, long gainExp) {
        if (gainExp <= 0) return 0;

        p.exp += gainExp;

        int gained = 0;
        while (p.level < MAX_LEVEL) {
            long need = requiredExp(p.level);
            if (p.exp < need) break;
            p.exp -= need;
            p.level++;
            p.onLevelUp();
            gained++;
        }
        return gained;
    }
}
