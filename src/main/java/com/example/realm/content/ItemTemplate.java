package com.example.realm.content;

/** {@code use} is null for items that cannot be consumed. */
public record ItemTemplate(int id, String name, boolean stackable, int maxStack, Use use) {
    public ItemTemplate {
        if (!stackable || maxStack <= 0) maxStack = stackable ? Integer.MAX_VALUE : 1;
    }

    /** What consuming one unit does. Amounts are added and clamped to the player's maxima. */
    public record Use(int food, int drink, int hp, int mana, boolean curesPoison) {}

    public boolean usable() {
        return use != null;
    }
}
