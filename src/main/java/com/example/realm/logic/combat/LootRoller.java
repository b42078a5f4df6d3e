package com.example.realm.logic.combat;

import com.example.realm.content.LootEntry;
import com.example.realm.world.ItemStack;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/** Each loot entry is rolled on its own; an entry with probability 1.0 always drops. */
public final class LootRoller {
    private LootRoller() {}

    public static List<ItemStack> roll(List<LootEntry> table, RandomGenerator rng) {
        List<ItemStack> drops = new ArrayList<>();
        for (LootEntry e : table) {
            if (e.probability() <= 0 || rng.nextDouble() >= e.probability()) continue;
            int qty = e.maxQuantity() > e.minQuantity()
                    ? rng.nextInt(e.minQuantity(), e.maxQuantity() + 1)
                    : e.minQuantity();
            drops.add(new ItemStack(e.itemId(), qty));
        }
        return drops;
    }
}
