package com.example.realm.logic.effect;

import com.example.realm.world.Player;

import java.util.Collection;
import java.util.List;

/** Fed, watered, unpoisoned players regain a percentage of max hp and mana. */
public class RegenerationEffect implements Effect<Player> {
    private final int intervalTicks;
    private final int percent;

    public RegenerationEffect(int intervalTicks, int percent) {
        this.intervalTicks = intervalTicks;
        this.percent = percent;
    }

    @Override
    public String name() {
        return "regeneration";
    }

    @Override
    public Collection<Player> eligible(TickContext ctx) {
        return ctx.every(intervalTicks) ? ctx.world().players() : List.of();
    }

    @Override
    public void apply(Player p, TickContext ctx) {
        if (!p.isAlive() || p.isStarving() || p.isThirsty() || p.isPoisoned(ctx.now())) return;
        if (p.hp() == p.maxHp() && p.mana() == p.maxMana()) return;

        int hpBefore = p.hp();
        p.setHp(p.hp() + Math.max(1, p.maxHp() * percent / 100));
        p.setMana(p.mana() + Math.max(1, p.maxMana() * percent / 100));
        if (p.hp() != hpBefore) {
            ctx.broadcast().statChanged(p);
        } else {
            ctx.broadcast().privateStats(p);
        }
    }
}
