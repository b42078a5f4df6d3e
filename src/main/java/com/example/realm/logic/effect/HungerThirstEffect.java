package com.example.realm.logic.effect;

import com.example.realm.world.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

public class HungerThirstEffect implements Effect<Player> {
    private static final Logger log = LoggerFactory.getLogger(HungerThirstEffect.class);

    private final int intervalTicks;
    private final int amount;

    public HungerThirstEffect(int intervalTicks, int amount) {
        this.intervalTicks = intervalTicks;
        this.amount = amount;
    }

    @Override
    public String name() {
        return "hunger-thirst";
    }

    @Override
    public Collection<Player> eligible(TickContext ctx) {
        return ctx.every(intervalTicks) ? ctx.world().players() : List.of();
    }

    @Override
    public void apply(Player p, TickContext ctx) {
        if (!p.isAlive() || (p.food == 0 && p.water == 0)) return;

        boolean wasStarving = p.isStarving();
        boolean wasThirsty = p.isThirsty();
        p.food = Math.max(0, p.food - amount);
        p.water = Math.max(0, p.water - amount);

        if (!wasStarving && p.isStarving()) log.debug("{} is starving", p.name);
        if (!wasThirsty && p.isThirsty()) log.debug("{} is thirsty", p.name);
        ctx.broadcast().privateStats(p);
    }
}
