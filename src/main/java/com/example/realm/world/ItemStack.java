package com.example.realm.world;

public record ItemStack(int itemId, int quantity) {
    public ItemStack withQuantity(int q) {
        return new ItemStack(itemId, q);
    }
}
