package com.example.realm.content;

public record LootEntry(int itemId, double probability, int minQuantity, int maxQuantity) {
    public LootEntry {
        if (minQuantity <= 0) minQuantity = 1;
        if (maxQuantity < minQuantity) maxQuantity = minQuantity;
    }
}
