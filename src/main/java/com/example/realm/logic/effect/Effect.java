package com.example.realm.logic.effect;

import com.example.realm.world.Entity;

import java.util.Collection;

/**
 * A periodic per-entity update. Registered once with the {@link com.example.realm.logic.TickScheduler}
 * and applied every tick to every entity returned by {@link #eligible}. Implementations keep no
 * per-entity state of their own; whatever must survive between ticks is stored on the entity.
 */
public interface Effect<E extends Entity> {

    String name();

    Collection<? extends E> eligible(TickContext ctx);

    void apply(E entity, TickContext ctx);
}
