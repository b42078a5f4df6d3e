package com.example.realm.session;

public record PlayerRules(
        int maxHp,
        int maxMana,
        long attackIntervalMs,
        int inventorySlots,
        int startMapId,
        int visibilityRadius,
        int goldItemId
) {
    public static PlayerRules defaults() {
        return new PlayerRules(100, 50, 1000, 20, 1, 15, 12);
    }
}
