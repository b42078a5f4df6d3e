package com.example.realm.store;

import com.example.realm.world.ItemStack;
import com.example.realm.world.Player;

import java.util.ArrayList;
import java.util.List;

/** Durable snapshot of a player. Taken on the world thread, written elsewhere. */
public record PlayerRecord(
        long userId,
        String name,
        int mapId,
        int x,
        int y,
        int level,
        long exp,
        int hp,
        int maxHp,
        int mana,
        int maxMana,
        int food,
        int water,
        long gold,
        int strength,
        int agility,
        List<Slot> inventory
) {
    public PlayerRecord {
        inventory = inventory == null ? List.of() : List.copyOf(inventory);
    }

    public record Slot(int slot, int itemId, int quantity) {}

    public static PlayerRecord of(Player p) {
        List<Slot> slots = new ArrayList<>();
        for (int i = 0; i < p.inventory.size(); i++) {
            final int slot = i;
            p.inventory.slot(i).ifPresent(s -> slots.add(new Slot(slot, s.itemId(), s.quantity())));
        }
        return new PlayerRecord(p.userId, p.name, p.mapId(), p.x(), p.y(), p.level, p.exp,
                p.hp(), p.maxHp(), p.mana(), p.maxMana(), p.food, p.water, p.gold,
                p.strength, p.agility, slots);
    }

    /** Copies the stored stats onto a freshly created player. Position is applied by the index. */
    public void applyTo(Player p) {
        p.level = Math.max(1, level);
        p.exp = Math.max(0, exp);
        p.restoreMaxima(maxHp, maxMana);
        p.setHp(hp);
        p.setMana(mana);
        p.food = Math.max(0, Math.min(Player.MAX_SUSTENANCE, food));
        p.water = Math.max(0, Math.min(Player.MAX_SUSTENANCE, water));
        p.gold = Math.max(0, gold);
        p.strength = strength;
        p.agility = agility;
        for (Slot s : inventory) {
            if (p.inventory.isValidSlot(s.slot()) && s.quantity() > 0) {
                p.inventory.set(s.slot(), new ItemStack(s.itemId(), s.quantity()));
            }
        }
    }
}
