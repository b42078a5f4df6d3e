package com.example.realm.support;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.content.ContentCatalog;
import com.example.realm.content.ItemTemplate;
import com.example.realm.content.LootEntry;
import com.example.realm.content.MapDefinition;
import com.example.realm.content.NpcTemplate;
import com.example.realm.content.SpellTemplate;
import com.example.realm.logic.combat.CombatResolver;
import com.example.realm.logic.combat.CombatRules;
import com.example.realm.logic.combat.CombatService;
import com.example.realm.logic.combat.NpcDeathService;
import com.example.realm.logic.item.GroundItemService;
import com.example.realm.logic.npc.NpcBehaviorEngine;
import com.example.realm.logic.npc.NpcRegistry;
import com.example.realm.session.CommandHandler;
import com.example.realm.session.PlayerDeathService;
import com.example.realm.session.PlayerRules;
import com.example.realm.session.PlayerSession;
import com.example.realm.session.Relocator;
import com.example.realm.session.SessionService;
import com.example.realm.store.PersistenceService;
import com.example.realm.world.GridMap;
import com.example.realm.world.Npc;
import com.example.realm.world.Player;
import com.example.realm.world.Point;
import com.example.realm.world.WorldIndex;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fully wired world over a small hand-made content set, with a settable clock, scripted dice and
 * recording channels. Map 1 is 40x40 with a rock at (10,10) and an exit at (39,20) into map 2 (20x20).
 */
public class TestWorld {
    public static final int FIELD = 1;
    public static final int CAVE = 2;
    public static final int APPLE = 1;
    public static final int DAGGER = 3;
    public static final int WATER = 4;
    public static final int POTION = 5;
    public static final int ANTIDOTE = 6;
    public static final int GOLD = 12;
    public static final int MISSILE = 1;
    public static final int HEAL = 2;

    public static final NpcTemplate GOBLIN = new NpcTemplate(1, "Goblin", true, 1, 30, 2, 4, 10, 5, 0,
            3, 10, 1000, 60, 20, 5, 5, false, 0.0, List.of(new LootEntry(APPLE, 1.0, 2, 2)));
    public static final NpcTemplate CHICKEN = new NpcTemplate(2, "Chicken", false, 1, 5, 1, 1, 0, 0, 0,
            0, 0, 1000, 30, 2, 0, 0, false, 0.0, List.of());
    public static final NpcTemplate SPIDER = new NpcTemplate(3, "Spider", true, 2, 40, 3, 3, 50, 5, 0,
            4, 12, 1000, 90, 40, 0, 0, false, 1.0, List.of());

    public final MutableClock clock = new MutableClock(1_000_000L);
    public final ScriptedRandom rng = new ScriptedRandom();
    public final InMemoryWorldStore store = new InMemoryWorldStore();
    public final ContentCatalog content;
    public final WorldIndex world = new WorldIndex(8, 10);
    public final BroadcastService broadcast = new BroadcastService(world, 20);
    public final PersistenceService persistence = new PersistenceService(store);
    public final GroundItemService groundItems = new GroundItemService(world, broadcast, 300_000, 30_000);
    public final NpcRegistry npcs = new NpcRegistry(world, broadcast);
    public final Relocator relocator = new Relocator(world, broadcast);
    public final PlayerDeathService playerDeaths;
    public final NpcDeathService npcDeaths;
    public final CombatService combat;
    public final NpcBehaviorEngine engine;
    public final CommandHandler commands;
    public final SessionService sessions;
    public final PlayerRules rules = PlayerRules.defaults();

    private final Map<Long, RecordingChannel> channels = new HashMap<>();

    public TestWorld() {
        content = new ContentCatalog(
                List.of(
                        new MapDefinition(FIELD, "Field", 40, 40, new Point(5, 5),
                                List.of(new MapDefinition.Rect(10, 10, 10, 10)),
                                List.of(),
                                List.of(new MapDefinition.Transition(39, 20, CAVE, 2, 2))),
                        new MapDefinition(CAVE, "Cave", 20, 20, new Point(10, 10), List.of(), List.of(), List.of())),
                List.of(GOBLIN, CHICKEN, SPIDER),
                List.of(new ItemTemplate(APPLE, "Apple", true, 10, new ItemTemplate.Use(20, 0, 0, 0, false)),
                        new ItemTemplate(DAGGER, "Dagger", false, 1, null),
                        new ItemTemplate(WATER, "Water", true, 10, new ItemTemplate.Use(0, 30, 0, 0, false)),
                        new ItemTemplate(POTION, "Potion", true, 10, new ItemTemplate.Use(0, 0, 30, 10, false)),
                        new ItemTemplate(ANTIDOTE, "Antidote", true, 10, new ItemTemplate.Use(0, 0, 0, 0, true)),
                        new ItemTemplate(GOLD, "Gold", true, 0, null)),
                List.of(new SpellTemplate(MISSILE, "Missile", SpellTemplate.Kind.DAMAGE, 5, 6, 10, 10),
                        new SpellTemplate(HEAL, "Heal", SpellTemplate.Kind.HEAL, 5, 6, 20, 20)))
                .validate(GOLD);
        for (MapDefinition m : content.maps()) world.registerMap(GridMap.from(m));

        playerDeaths = new PlayerDeathService(content, broadcast, npcs, groundItems, relocator, persistence, GOLD);
        npcDeaths = new NpcDeathService(world, broadcast, groundItems, persistence, rng, 30);
        combat = new CombatService(new CombatResolver(CombatRules.defaults()), broadcast, npcDeaths, playerDeaths,
                rng, 30_000);
        engine = new NpcBehaviorEngine(world, broadcast, combat, rng, 5_000, 400, 0.0);
        commands = new CommandHandler(world, broadcast, content, combat, groundItems, relocator, rng, GOLD);
        sessions = new SessionService(world, broadcast, content, npcs, commands, persistence, clock, rules, 1000);
    }

    public long now() {
        return clock.millis();
    }

    /** Logs a fresh character in and moves it to (x, y) on the field. */
    public Player login(long userId, int x, int y) {
        RecordingChannel ch = new RecordingChannel();
        channels.put(userId, ch);
        PlayerSession s = sessions.login(userId, "user" + userId, Optional.empty(), ch);
        Player p = world.get(s.playerId(), Player.class).orElseThrow();
        if (p.x() != x || p.y() != y) world.move(p.id, x, y).requireOk();
        ch.clear();
        return p;
    }

    public RecordingChannel channel(long userId) {
        return channels.get(userId);
    }

    public Npc spawn(NpcTemplate template, int x, int y) {
        return npcs.spawn(template, FIELD, x, y).orElseThrow();
    }
}
