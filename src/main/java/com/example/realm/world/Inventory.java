package com.example.realm.world;

import com.example.realm.content.ItemTemplate;
import com.example.realm.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class Inventory {
    private final ItemStack[] slots;

    public Inventory(int size) {
        this.slots = new ItemStack[size];
    }

    public record AddResult(int added, List<Integer> touchedSlots) {
        public boolean isEmpty() {
            return added == 0;
        }
    }

    public int size() {
        return slots.length;
    }

    public Optional<ItemStack> slot(int slot) {
        return isValidSlot(slot) ? Optional.ofNullable(slots[slot]) : Optional.empty();
    }

    public boolean isValidSlot(int slot) {
        return slot >= 0 && slot < slots.length;
    }

    /** Puts as much of the stack as fits: existing stacks of the same item first, then empty slots. */
    public AddResult add(ItemTemplate item, int quantity) {
        int left = quantity;
        List<Integer> touched = new ArrayList<>();
        if (item.stackable()) {
            for (int i = 0; i < slots.length && left > 0; i++) {
                ItemStack s = slots[i];
                if (s == null || s.itemId() != item.id() || s.quantity() >= item.maxStack()) continue;
                int put = Math.min(left, item.maxStack() - s.quantity());
                slots[i] = s.withQuantity(s.quantity() + put);
                left -= put;
                touched.add(i);
            }
        }
        for (int i = 0; i < slots.length && left > 0; i++) {
            if (slots[i] != null) continue;
            int put = Math.min(left, item.maxStack());
            slots[i] = new ItemStack(item.id(), put);
            left -= put;
            touched.add(i);
        }
        return new AddResult(quantity - left, touched);
    }

    /**
     * Takes {@code quantity} out of a slot.
     *
     * @throws ValidationException when the slot is empty, out of range or holds less than asked
     */
    public ItemStack remove(int slot, int quantity) {
        if (!isValidSlot(slot)) throw new ValidationException("invalid slot");
        ItemStack s = slots[slot];
        if (s == null) throw new ValidationException("slot is empty");
        if (quantity <= 0 || quantity > s.quantity()) throw new ValidationException("invalid quantity");
        slots[slot] = quantity == s.quantity() ? null : s.withQuantity(s.quantity() - quantity);
        return s.withQuantity(quantity);
    }

    public void set(int slot, ItemStack stack) {
        if (!isValidSlot(slot)) throw new ValidationException("invalid slot");
        slots[slot] = stack;
    }

    public int count(int itemId) {
        int n = 0;
        for (ItemStack s : slots) {
            if (s != null && s.itemId() == itemId) n += s.quantity();
        }
        return n;
    }
}
