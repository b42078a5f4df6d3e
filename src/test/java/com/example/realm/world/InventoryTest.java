package com.example.realm.world;

import com.example.realm.content.ItemTemplate;
import com.example.realm.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InventoryTest {
    private static final ItemTemplate APPLE = new ItemTemplate(1, "Apple", true, 10, null);
    private static final ItemTemplate DAGGER = new ItemTemplate(3, "Dagger", false, 1, null);

    @Test
    void stackableItemsMergeBeforeUsingEmptySlots() {
        Inventory inv = new Inventory(4);
        inv.add(APPLE, 6);

        Inventory.AddResult r = inv.add(APPLE, 7);

        assertThat(r.added()).isEqualTo(7);
        assertThat(r.touchedSlots()).containsExactly(0, 1);
        assertThat(inv.slot(0)).contains(new ItemStack(1, 10));
        assertThat(inv.slot(1)).contains(new ItemStack(1, 3));
    }

    @Test
    void addStopsWhenSlotsRunOut() {
        Inventory inv = new Inventory(2);

        Inventory.AddResult r = inv.add(DAGGER, 3);

        assertThat(r.added()).isEqualTo(2);
        assertThat(inv.count(3)).isEqualTo(2);
        assertThat(inv.add(APPLE, 1).isEmpty()).isTrue();
    }

    @Test
    void removeValidatesSlotAndQuantity() {
        Inventory inv = new Inventory(3);
        inv.add(APPLE, 5);

        assertThatThrownBy(() -> inv.remove(1, 1)).isInstanceOf(ValidationException.class).hasMessage("slot is empty");
        assertThatThrownBy(() -> inv.remove(7, 1)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> inv.remove(0, 6)).isInstanceOf(ValidationException.class);

        assertThat(inv.remove(0, 2)).isEqualTo(new ItemStack(1, 2));
        assertThat(inv.slot(0)).contains(new ItemStack(1, 3));
        inv.remove(0, 3);
        assertThat(inv.slot(0)).isEmpty();
    }
}
