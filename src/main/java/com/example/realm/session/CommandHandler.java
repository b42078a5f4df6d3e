package com.example.realm.session;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.content.ContentCatalog;
import com.example.realm.content.ItemTemplate;
import com.example.realm.content.MapDefinition;
import com.example.realm.content.SpellTemplate;
import com.example.realm.error.OccupancyConflictException;
import com.example.realm.error.ValidationException;
import com.example.realm.logic.combat.CombatService;
import com.example.realm.logic.item.GroundItemService;
import com.example.realm.protocol.WorldEvent;
import com.example.realm.protocol.WorldEvent.DespawnReason;
import com.example.realm.world.Aoi;
import com.example.realm.world.Entity;
import com.example.realm.world.GroundItem;
import com.example.realm.world.Heading;
import com.example.realm.world.Inventory;
import com.example.realm.world.ItemStack;
import com.example.realm.world.Npc;
import com.example.realm.world.Placement;
import com.example.realm.world.Player;
import com.example.realm.world.Point;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Executes player commands on the world thread. Every rejection is thrown as a
 * {@link com.example.realm.error.GameException} before any state was changed.
 */
public class CommandHandler {
    private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);
    private static final int TRANSITION_SEARCH_RADIUS = 5;
    private static final int DROP_SPREAD_RADIUS = 3;

    private final WorldIndex world;
    private final BroadcastService broadcast;
    private final ContentCatalog content;
    private final CombatService combat;
    private final GroundItemService groundItems;
    private final Relocator relocator;
    private final RandomGenerator rng;
    private final int goldItemId;
    private final Map<Integer, Map<Point, MapDefinition.Transition>> transitions = new HashMap<>();

    public CommandHandler(WorldIndex world, BroadcastService broadcast, ContentCatalog content, CombatService combat,
                          GroundItemService groundItems, Relocator relocator, RandomGenerator rng, int goldItemId) {
        this.world = world;
        this.broadcast = broadcast;
        this.content = content;
        this.combat = combat;
        this.groundItems = groundItems;
        this.relocator = relocator;
        this.rng = rng;
        this.goldItemId = goldItemId;
        for (MapDefinition m : content.maps()) {
            Map<Point, MapDefinition.Transition> byTile = new HashMap<>();
            for (MapDefinition.Transition t : m.transitions()) byTile.put(new Point(t.x(), t.y()), t);
            transitions.put(m.id(), byTile);
        }
    }

    public void execute(Player p, Command cmd, long now) {
        if (!p.isAlive()) throw new ValidationException("you are dead");
        if (cmd instanceof Command.Move m) {
            move(p, m.heading());
        } else if (cmd instanceof Command.ChangeHeading h) {
            changeHeading(p, h.heading());
        } else if (cmd instanceof Command.Attack a) {
            attack(p, a.target(), now);
        } else if (cmd instanceof Command.Cast c) {
            cast(p, c.spell(), c.target(), now);
        } else if (cmd instanceof Command.Drop d) {
            drop(p, d.slot(), d.qty(), now);
        } else if (cmd instanceof Command.DropGold g) {
            dropGold(p, g.qty(), now);
        } else if (cmd instanceof Command.UseItem u) {
            useItem(p, u.slot());
        } else if (cmd instanceof Command.Pickup) {
            pickup(p, now);
        }
    }

    // ===== movement =====

    void move(Player p, Heading heading) {
        if (heading == null) throw new ValidationException("missing heading");
        int fromX = p.x();
        int fromY = p.y();
        Point to = p.position().step(heading);

        world.move(p.id, to.x(), to.y()).requireOk();
        p.setHeading(heading);
        broadcast.moved(p, fromX, fromY);

        MapDefinition.Transition t = transitions.getOrDefault(p.mapId(), Map.of()).get(p.position());
        if (t != null) travel(p, t);
    }

    private void travel(Player p, MapDefinition.Transition t) {
        Placement result = relocator.relocate(p, t.toMap(), t.toX(), t.toY(), TRANSITION_SEARCH_RADIUS);
        if (result.isOk()) {
            log.debug("{} travelled to map {} at {},{}", p.name, p.mapId(), p.x(), p.y());
        } else {
            log.info("{} could not enter map {}: {}", p.name, t.toMap(), result.reason());
        }
    }

    void changeHeading(Player p, Heading heading) {
        if (heading == null) throw new ValidationException("missing heading");
        p.setHeading(heading);
        broadcast.publishAt(p.mapId(), p.x(), p.y(),
                new WorldEvent.EntityMoved(p.id, p.mapId(), p.x(), p.y(), heading), p.id);
    }

    // ===== combat =====

    void attack(Player p, long targetId, long now) {
        Entity target = world.get(targetId).orElseThrow(() -> new ValidationException("invalid target"));
        if (!(target instanceof Npc npc) || !npc.isAlive()) throw new ValidationException("invalid target");
        if (!Aoi.adjacent(p, npc)) throw new ValidationException("target is not in reach");
        if (!p.attackReady(now)) throw new ValidationException("too soon to attack again");

        p.setHeading(Heading.of(npc.x() - p.x(), npc.y() - p.y(), p.heading()));
        combat.playerAttacksNpc(p, npc, now);
    }

    void cast(Player p, int spellId, long targetId, long now) {
        SpellTemplate spell = content.spell(spellId).orElseThrow(() -> new ValidationException("unknown spell"));
        if (p.mana() < spell.manaCost()) throw new ValidationException("not enough mana");
        Entity target = world.get(targetId).orElseThrow(() -> new ValidationException("invalid target"));
        if (!Aoi.inRange(p, target, spell.range())) throw new ValidationException("target out of range");

        switch (spell.kind()) {
            case DAMAGE -> {
                if (!(target instanceof Npc npc) || !npc.isAlive()) throw new ValidationException("invalid target");
                p.setMana(p.mana() - spell.manaCost());
                broadcast.privateStats(p);
                combat.spellDamage(p, npc, power(spell), now);
            }
            case HEAL -> {
                if (!(target instanceof Player healed) || !healed.isAlive()) throw new ValidationException("invalid target");
                p.setMana(p.mana() - spell.manaCost());
                healed.setHp(healed.hp() + power(spell));
                broadcast.statChanged(healed);
                if (healed != p) broadcast.privateStats(p);
            }
        }
    }

    private int power(SpellTemplate spell) {
        return spell.maxPower() > spell.minPower()
                ? rng.nextInt(spell.minPower(), spell.maxPower() + 1)
                : spell.minPower();
    }

    // ===== items =====

    void drop(Player p, int slot, int qty, long now) {
        ItemStack before = p.inventory.slot(slot).orElseThrow(() -> new ValidationException("slot is empty"));
        if (qty <= 0 || qty > before.quantity()) throw new ValidationException("invalid quantity");
        if (world.findNearestFree(p.mapId(), p.x(), p.y(), DROP_SPREAD_RADIUS, false).isEmpty()) {
            throw new OccupancyConflictException("no room to drop here");
        }

        ItemStack dropped = p.inventory.remove(slot, qty);
        Optional<GroundItem> placed = groundItems.place(p.mapId(), p.x(), p.y(), dropped.itemId(), dropped.quantity(), 0, now);
        if (placed.isEmpty()) {
            p.inventory.set(slot, before);
            throw new OccupancyConflictException("no room to drop here");
        }
        sendSlot(p, slot);
    }

    void dropGold(Player p, int qty, long now) {
        if (qty <= 0 || qty > p.gold) throw new ValidationException("invalid quantity");
        if (groundItems.place(p.mapId(), p.x(), p.y(), goldItemId, qty, 0, now).isEmpty()) {
            throw new OccupancyConflictException("no room to drop here");
        }
        p.gold -= qty;
        broadcast.privateStats(p);
    }

    void useItem(Player p, int slot) {
        ItemStack stack = p.inventory.slot(slot).orElseThrow(() -> new ValidationException("slot is empty"));
        ItemTemplate item = content.item(stack.itemId()).orElseThrow(() -> new ValidationException("unknown item"));
        if (!item.usable()) throw new ValidationException("item cannot be used");

        p.inventory.remove(slot, 1);
        ItemTemplate.Use use = item.use();
        p.eat(use.food());
        p.drink(use.drink());
        if (use.hp() > 0) p.setHp(p.hp() + use.hp());
        if (use.mana() > 0) p.setMana(p.mana() + use.mana());
        if (use.curesPoison()) p.poisonedUntil = 0;

        if (use.hp() > 0) {
            broadcast.statChanged(p);
        } else {
            broadcast.privateStats(p);
        }
        sendSlot(p, slot);
        log.debug("{} used {}", p.name, item.name());
    }

    void pickup(Player p, long now) {
        List<GroundItem> here = world.itemsAt(p.mapId(), p.x(), p.y());
        if (here.isEmpty()) throw new ValidationException("nothing to pick up");
        GroundItem item = null;
        for (int i = here.size() - 1; i >= 0; i--) {
            if (!here.get(i).isReservedAgainst(p.id, now)) {
                item = here.get(i);
                break;
            }
        }
        if (item == null) throw new ValidationException("item belongs to someone else");

        if (item.itemId == goldItemId) {
            p.gold += item.quantity();
            groundItems.remove(item, DespawnReason.REMOVED);
            broadcast.privateStats(p);
            return;
        }

        ItemTemplate template = content.item(item.itemId).orElseThrow(() -> new ValidationException("unknown item"));
        Inventory.AddResult added = p.inventory.add(template, item.quantity());
        if (added.isEmpty()) throw new ValidationException("inventory is full");

        if (added.added() == item.quantity()) {
            groundItems.remove(item, DespawnReason.REMOVED);
        } else {
            item.take(added.added());
            broadcast.itemChanged(item);
        }
        for (int slot : added.touchedSlots()) sendSlot(p, slot);
    }

    private void sendSlot(Player p, int slot) {
        Optional<ItemStack> s = p.inventory.slot(slot);
        broadcast.sendTo(p.id, new WorldEvent.InventoryChanged(slot,
                s.map(ItemStack::itemId).orElse(0), s.map(ItemStack::quantity).orElse(0)));
    }
}
