package com.example.realm.logic.npc;

import com.example.realm.logic.effect.Effect;
import com.example.realm.logic.effect.TickContext;
import com.example.realm.world.Npc;

import java.util.Collection;

public class NpcBehaviorEffect implements Effect<Npc> {
    private final NpcRegistry npcs;
    private final NpcBehaviorEngine engine;

    public NpcBehaviorEffect(NpcRegistry npcs, NpcBehaviorEngine engine) {
        this.npcs = npcs;
        this.engine = engine;
    }

    @Override
    public String name() {
        return "npc-behavior";
    }

    @Override
    public Collection<Npc> eligible(TickContext ctx) {
        return npcs.all();
    }

    @Override
    public void apply(Npc npc, TickContext ctx) {
        engine.tick(npc, ctx.now());
    }
}
