package com.example.realm.protocol;

import com.example.realm.world.Entity;
import com.example.realm.world.EntityKind;
import com.example.realm.world.GroundItem;
import com.example.realm.world.Heading;
import com.example.realm.world.Npc;
import com.example.realm.world.Player;

public record EntityView(
        long id,
        EntityKind kind,
        int mapId,
        int x,
        int y,
        Heading heading,
        String name,
        int templateId,
        int hp,
        int maxHp,
        int quantity,
        String state
) {
    public static EntityView of(Entity e) {
        if (e instanceof Player p) {
            return new EntityView(p.id, p.kind(), p.mapId(), p.x(), p.y(), p.heading(), p.name,
                    0, p.hp(), p.maxHp(), 0, p.isAlive() ? "ALIVE" : "DEAD");
        }
        if (e instanceof Npc n) {
            return new EntityView(n.id, n.kind(), n.mapId(), n.x(), n.y(), n.heading(), n.template().name(),
                    n.template().id(), n.hp(), n.maxHp(), 0, n.state().name());
        }
        if (e instanceof GroundItem g) {
            return new EntityView(g.id, g.kind(), g.mapId(), g.x(), g.y(), null, null,
                    g.itemId, 0, 0, g.quantity(), null);
        }
        throw new IllegalArgumentException("unknown entity type: " + e);
    }
}
