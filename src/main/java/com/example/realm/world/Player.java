package com.example.realm.world;

import com.example.realm.logic.combat.CombatStats;

public class Player extends Entity {
    public static final int MAX_SUSTENANCE = 100;

    public final long userId;
    public final String name;
    public final Inventory inventory;
    private Heading heading = Heading.SOUTH;
    private final int visibilityRadius;

    // ===== level / experience =====
    public int level = 1;
    public long exp = 0; // within the current level

    // ===== vitals =====
    private int hp, maxHp;
    private int mana, maxMana;
    public int food = MAX_SUSTENANCE;
    public int water = MAX_SUSTENANCE;
    public long gold = 0;
    public long poisonedUntil = 0;

    // ===== combat =====
    public int strength = 10;
    public int agility = 10;
    public long attackIntervalMs;
    public long lastAttackAt = -1;

    public Player(long id, long userId, String name, int maxHp, int maxMana, int inventorySlots, int visibilityRadius) {
        super(id);
        this.userId = userId;
        this.name = name;
        this.maxHp = maxHp;
        this.hp = maxHp;
        this.maxMana = maxMana;
        this.mana = maxMana;
        this.inventory = new Inventory(inventorySlots);
        this.visibilityRadius = visibilityRadius;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.PLAYER;
    }

    public boolean isAlive() {
        return hp > 0;
    }

    public int hp() { return hp; }
    public int maxHp() { return maxHp; }
    public int mana() { return mana; }
    public int maxMana() { return maxMana; }
    public Heading heading() { return heading; }
    public int visibilityRadius() { return visibilityRadius; }

    public void setHeading(Heading heading) {
        this.heading = heading;
    }

    public void setHp(int hp) {
        this.hp = Math.max(0, Math.min(maxHp, hp));
    }

    public void setMana(int mana) {
        this.mana = Math.max(0, Math.min(maxMana, mana));
    }

    public void eat(int amount) {
        food = Math.min(MAX_SUSTENANCE, food + Math.max(0, amount));
    }

    public void drink(int amount) {
        water = Math.min(MAX_SUSTENANCE, water + Math.max(0, amount));
    }

    public boolean isStarving() {
        return food <= 0;
    }

    public boolean isThirsty() {
        return water <= 0;
    }

    public boolean isPoisoned(long now) {
        return poisonedUntil > now;
    }

    public boolean attackReady(long now) {
        return lastAttackAt < 0 || now - lastAttackAt >= attackIntervalMs;
    }

    public CombatStats combatStats() {
        return new CombatStats(
                10 + agility + level * 2,
                agility + level,
                2 + level,
                6 + level * 2 + strength / 3,
                level / 3,
                agility * 0.002);
    }

    public void onLevelUp() {
        // more hp and mana every level, part of the hp restored right away
        this.maxHp += 10;
        this.maxMana += 5;
        this.hp = Math.min(this.maxHp, this.hp + 15);
        this.mana = this.maxMana;
        this.strength += 1;
        this.agility += 1;
    }

    public void restoreMaxima(int maxHp, int maxMana) {
        this.maxHp = Math.max(1, maxHp);
        this.maxMana = Math.max(0, maxMana);
        setHp(hp);
        setMana(mana);
    }
}
