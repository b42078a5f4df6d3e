package com.example.realm.logic.effect;

import com.example.realm.logic.combat.CombatService;
import com.example.realm.world.Player;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Poisoned players lose hp every {@code intervalTicks} until the poison wears off. */
public class PoisonEffect implements Effect<Player> {
    private final CombatService combat;
    private final int intervalTicks;
    private final int damage;

    public PoisonEffect(CombatService combat, int intervalTicks, int damage) {
        this.combat = combat;
        this.intervalTicks = intervalTicks;
        this.damage = damage;
    }

    @Override
    public String name() {
        return "poison";
    }

    @Override
    public Collection<Player> eligible(TickContext ctx) {
        if (!ctx.every(intervalTicks)) return List.of();
        List<Player> poisoned = new ArrayList<>();
        for (Player p : ctx.world().players()) {
            if (p.poisonedUntil > 0) poisoned.add(p);
        }
        return poisoned;
    }

    @Override
    public void apply(Player p, TickContext ctx) {
        if (!p.isPoisoned(ctx.now()) || !p.isAlive()) {
            p.poisonedUntil = 0;
            return;
        }
        combat.damagePlayer(p, damage, ctx.now());
    }
}
