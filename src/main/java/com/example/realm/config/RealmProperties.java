package com.example.realm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("realm")
public record RealmProperties(
        @DefaultValue Tick tick,
        @DefaultValue World world,
        @DefaultValue Visibility visibility,
        @DefaultValue Npc npc,
        @DefaultValue Combat combat,
        @DefaultValue Player player,
        @DefaultValue Items items,
        @DefaultValue Effects effects,
        @DefaultValue Store store,
        @DefaultValue Content content,
        @DefaultValue Websocket websocket
) {
    public record Tick(@DefaultValue("1000") long intervalMs) {}

    public record World(@DefaultValue("8") int cellSize, @DefaultValue("10") int maxItemsPerTile) {}

    public record Visibility(@DefaultValue("15") int defaultRadius, @DefaultValue("20") int maxRadius) {}

    public record Npc(
            @DefaultValue("5000") long respawnRetryMs,
            @DefaultValue("400") int pathSearchLimit,
            @DefaultValue("0.2") double wanderChance
    ) {}

    public record Combat(
            @DefaultValue("0.75") double baseHitChance,
            @DefaultValue("0.01") double hitChancePerPoint,
            @DefaultValue("0.05") double minHitChance,
            @DefaultValue("0.95") double maxHitChance,
            @DefaultValue("0.10") double baseCriticalChance,
            @DefaultValue("0.5") double maxCriticalChance,
            @DefaultValue("2.0") double criticalMultiplier,
            @DefaultValue("30") int expShareDistance
    ) {}

    public record Player(
            @DefaultValue("100") int maxHp,
            @DefaultValue("50") int maxMana,
            @DefaultValue("1000") long attackIntervalMs,
            @DefaultValue("20") int inventorySlots,
            @DefaultValue("1") int startMapId
    ) {}

    public record Items(
            @DefaultValue("12") int goldItemId,
            @DefaultValue("300") long expirySeconds,
            @DefaultValue("30") long ownerProtectionSeconds
    ) {}

    public record Effects(
            @DefaultValue Hunger hunger,
            @DefaultValue GoldDecay goldDecay,
            @DefaultValue Regeneration regeneration,
            @DefaultValue Poison poison
    ) {}

    public record Hunger(@DefaultValue("180") int intervalTicks, @DefaultValue("10") int amount) {}

    public record GoldDecay(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("1.0") double percentage,
            @DefaultValue("60") int intervalTicks
    ) {}

    public record Regeneration(@DefaultValue("5") int intervalTicks, @DefaultValue("5") int percent) {}

    public record Poison(
            @DefaultValue("2") int intervalTicks,
            @DefaultValue("5") int damage,
            @DefaultValue("30") long durationSeconds
    ) {}

    public record Store(@DefaultValue("data/players") String directory) {}

    public record Content(@DefaultValue("content/") String location) {}

    public record Websocket(
            @DefaultValue("/ws") String path,
            @DefaultValue("5000") int sendTimeLimitMs,
            @DefaultValue("524288") int bufferSizeLimit
    ) {}
}
