package com.example.realm.protocol;

import com.example.realm.world.Heading;
import com.example.realm.world.Npc;
import com.example.realm.world.Player;

public sealed interface WorldEvent {

    MsgType type();

    enum SpawnReason { APPEARED, ENTERED_VIEW }

    enum DespawnReason { LEFT_VIEW, REMOVED, DIED }

    record Welcome(long playerId, int mapId, int x, int y, long tickIntervalMs) implements WorldEvent {
        public MsgType type() { return MsgType.WELCOME; }
    }

    record EntityMoved(long entityId, int mapId, int x, int y, Heading heading) implements WorldEvent {
        public MsgType type() { return MsgType.ENTITY_MOVED; }
    }

    record EntitySpawned(EntityView entity, SpawnReason reason) implements WorldEvent {
        public MsgType type() { return MsgType.ENTITY_SPAWNED; }
    }

    record EntityDespawned(long entityId, DespawnReason reason) implements WorldEvent {
        public MsgType type() { return MsgType.ENTITY_DESPAWNED; }
    }

    /** Vital stats. Observers other than the player itself only get hp fields filled in. */
    record StatChanged(long entityId, int hp, int maxHp, int mana, int maxMana,
                       int food, int water, long gold, int level, long exp) implements WorldEvent {
        public MsgType type() { return MsgType.STAT_CHANGED; }

        public static StatChanged of(Npc n) {
            return new StatChanged(n.id, n.hp(), n.maxHp(), 0, 0, 0, 0, 0, n.template().level(), 0);
        }

        public static StatChanged publicOf(Player p) {
            return new StatChanged(p.id, p.hp(), p.maxHp(), 0, 0, 0, 0, 0, p.level, 0);
        }

        public static StatChanged privateOf(Player p) {
            return new StatChanged(p.id, p.hp(), p.maxHp(), p.mana(), p.maxMana(),
                    p.food, p.water, p.gold, p.level, p.exp);
        }
    }

    record ItemSpawned(EntityView item, SpawnReason reason) implements WorldEvent {
        public MsgType type() { return MsgType.ITEM_SPAWNED; }
    }

    record ItemRemoved(long itemEntityId, DespawnReason reason) implements WorldEvent {
        public MsgType type() { return MsgType.ITEM_REMOVED; }
    }

    record ItemChanged(long itemEntityId, int quantity) implements WorldEvent {
        public MsgType type() { return MsgType.ITEM_CHANGED; }
    }

    record CombatHit(long attackerId, long targetId, boolean hit, boolean critical, int damage, int targetHp)
            implements WorldEvent {
        public MsgType type() { return MsgType.COMBAT; }
    }

    record InventoryChanged(int slot, int itemId, int quantity) implements WorldEvent {
        public MsgType type() { return MsgType.INVENTORY; }
    }

    record CommandRejected(String command, String reason) implements WorldEvent {
        public MsgType type() { return MsgType.REJECTED; }
    }
}
