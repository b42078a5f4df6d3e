package com.example.realm.logic.effect;

import com.example.realm.logic.item.GroundItemService;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.world.GroundItem;

import java.util.Collection;

/** Removes expired ground stacks and lifts owner protection once it runs out. */
public class GroundItemDecayEffect implements Effect<GroundItem> {
    private final GroundItemService groundItems;

    public GroundItemDecayEffect(GroundItemService groundItems) {
        this.groundItems = groundItems;
    }

    @Override
    public String name() {
        return "ground-item-decay";
    }

    @Override
    public Collection<GroundItem> eligible(TickContext ctx) {
        return ctx.world().groundItems();
    }

    @Override
    public void apply(GroundItem item, TickContext ctx) {
        if (item.isExpired(ctx.now())) {
            groundItems.remove(item, DespawnReason.REMOVED);
        } else if (item.ownerId() != 0 && ctx.now() >= item.ownerUntil()) {
            item.clearOwner();
        }
    }
}
