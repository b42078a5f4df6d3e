package com.example.realm.logic.effect;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.world.WorldIndex;

/** What every effect sees during one tick. {@code now} is the tick's wall clock in epoch millis. */
public record TickContext(long tick, long now, WorldIndex world, BroadcastService broadcast) {
    public boolean every(int intervalTicks) {
        return intervalTicks <= 1 || tick % intervalTicks == 0;
    }
}
