package com.example.realm.logic.effect;

import com.example.realm.world.Player;

import java.util.Collection;
import java.util.List;

public class GoldDecayEffect implements Effect<Player> {
    private final boolean enabled;
    private final double percentage;
    private final int intervalTicks;

    public GoldDecayEffect(boolean enabled, double percentage, int intervalTicks) {
        this.enabled = enabled;
        this.percentage = percentage;
        this.intervalTicks = intervalTicks;
    }

    @Override
    public String name() {
        return "gold-decay";
    }

    @Override
    public Collection<Player> eligible(TickContext ctx) {
        return enabled && ctx.every(intervalTicks) ? ctx.world().players() : List.of();
    }

    @Override
    public void apply(Player p, TickContext ctx) {
        if (p.gold <= 0) return;
        long loss = (long) Math.floor(p.gold * percentage / 100.0);
        if (loss <= 0) return;
        p.gold -= loss;
        ctx.broadcast().privateStats(p);
    }
}
