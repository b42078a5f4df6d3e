package com.example.realm.ws;

import com.example.realm.admin.AdminService;
import com.example.realm.broadcast.BroadcastService;
import com.example.realm.config.RealmProperties;
import com.example.realm.content.ContentCatalog;
import com.example.realm.content.ContentLoader;
import com.example.realm.content.MapDefinition;
import com.example.realm.logic.TickScheduler;
import com.example.realm.logic.WorldExecutor;
import com.example.realm.logic.combat.CombatResolver;
import com.example.realm.logic.combat.CombatRules;
import com.example.realm.logic.combat.CombatService;
import com.example.realm.logic.combat.NpcDeathService;
import com.example.realm.logic.effect.GoldDecayEffect;
import com.example.realm.logic.effect.GroundItemDecayEffect;
import com.example.realm.logic.effect.HungerThirstEffect;
import com.example.realm.logic.effect.PoisonEffect;
import com.example.realm.logic.effect.RegenerationEffect;
import com.example.realm.logic.item.GroundItemService;
import com.example.realm.logic.npc.NpcBehaviorEffect;
import com.example.realm.logic.npc.NpcBehaviorEngine;
import com.example.realm.logic.npc.NpcRegistry;
import com.example.realm.session.CommandHandler;
import com.example.realm.session.PlayerDeathService;
import com.example.realm.session.PlayerRules;
import com.example.realm.session.Relocator;
import com.example.realm.session.SessionService;
import com.example.realm.store.JsonFileWorldStore;
import com.example.realm.store.PersistenceService;
import com.example.realm.world.GridMap;
import com.example.realm.world.WorldIndex;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.random.RandomGenerator;

@Configuration
public class WorldBeans {

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomGenerator worldRandom() {
        return RandomGenerator.getDefault();
    }

    @Bean(destroyMethod = "close")
    public WorldExecutor worldExecutor() {
        return new WorldExecutor();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService wsIo() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ws-io");
            t.setDaemon(true);
            return t;
        });
    }

    // ===== world =====

    @Bean
    public ContentCatalog contentCatalog(ObjectMapper om, RealmProperties props) {
        return new ContentLoader(om).load(props.content().location(), props.items().goldItemId());
    }

    @Bean
    public WorldIndex worldIndex(RealmProperties props, ContentCatalog content) {
        WorldIndex world = new WorldIndex(props.world().cellSize(), props.world().maxItemsPerTile());
        for (MapDefinition m : content.maps()) world.registerMap(GridMap.from(m));
        return world;
    }

    @Bean
    public BroadcastService broadcastService(WorldIndex world, RealmProperties props) {
        return new BroadcastService(world, props.visibility().maxRadius());
    }

    @Bean(destroyMethod = "close")
    public PersistenceService persistenceService(ObjectMapper om, RealmProperties props) {
        return new PersistenceService(new JsonFileWorldStore(Path.of(props.store().directory()), om));
    }

    @Bean
    public GroundItemService groundItemService(WorldIndex world, BroadcastService broadcast, RealmProperties props) {
        RealmProperties.Items items = props.items();
        return new GroundItemService(world, broadcast, items.expirySeconds() * 1000, items.ownerProtectionSeconds() * 1000);
    }

    @Bean
    public NpcRegistry npcRegistry(WorldIndex world, BroadcastService broadcast) {
        return new NpcRegistry(world, broadcast);
    }

    @Bean
    public Relocator relocator(WorldIndex world, BroadcastService broadcast) {
        return new Relocator(world, broadcast);
    }

    // ===== combat =====

    @Bean
    public PlayerDeathService playerDeathService(ContentCatalog content, BroadcastService broadcast, NpcRegistry npcs,
                                                 GroundItemService groundItems, Relocator relocator,
                                                 PersistenceService persistence, RealmProperties props) {
        return new PlayerDeathService(content, broadcast, npcs, groundItems, relocator, persistence,
                props.items().goldItemId());
    }

    @Bean
    public NpcDeathService npcDeathService(WorldIndex world, BroadcastService broadcast, GroundItemService groundItems,
                                           PersistenceService persistence, RandomGenerator rng, RealmProperties props) {
        return new NpcDeathService(world, broadcast, groundItems, persistence, rng, props.combat().expShareDistance());
    }

    @Bean
    public CombatService combatService(BroadcastService broadcast, NpcDeathService npcDeaths,
                                       PlayerDeathService playerDeaths, RandomGenerator rng, RealmProperties props) {
        RealmProperties.Combat c = props.combat();
        CombatRules rules = new CombatRules(c.baseHitChance(), c.hitChancePerPoint(), c.minHitChance(),
                c.maxHitChance(), c.baseCriticalChance(), c.maxCriticalChance(), c.criticalMultiplier(),
                c.expShareDistance());
        return new CombatService(new CombatResolver(rules), broadcast, npcDeaths, playerDeaths, rng,
                props.effects().poison().durationSeconds() * 1000);
    }

    @Bean
    public NpcBehaviorEngine npcBehaviorEngine(WorldIndex world, BroadcastService broadcast, CombatService combat,
                                               RandomGenerator rng, RealmProperties props) {
        RealmProperties.Npc npc = props.npc();
        return new NpcBehaviorEngine(world, broadcast, combat, rng,
                npc.respawnRetryMs(), npc.pathSearchLimit(), npc.wanderChance());
    }

    // ===== tick =====

    @Bean
    public TickScheduler tickScheduler(WorldExecutor executor, WorldIndex world, BroadcastService broadcast, Clock clock,
                                       CombatService combat, NpcRegistry npcs, NpcBehaviorEngine engine,
                                       GroundItemService groundItems, RealmProperties props) {
        TickScheduler scheduler = new TickScheduler(executor, world, broadcast, clock, props.tick().intervalMs());
        RealmProperties.Effects fx = props.effects();
        scheduler.register(new HungerThirstEffect(fx.hunger().intervalTicks(), fx.hunger().amount()));
        scheduler.register(new GoldDecayEffect(fx.goldDecay().enabled(), fx.goldDecay().percentage(),
                fx.goldDecay().intervalTicks()));
        scheduler.register(new RegenerationEffect(fx.regeneration().intervalTicks(), fx.regeneration().percent()));
        scheduler.register(new PoisonEffect(combat, fx.poison().intervalTicks(), fx.poison().damage()));
        scheduler.register(new NpcBehaviorEffect(npcs, engine));
        scheduler.register(new GroundItemDecayEffect(groundItems));
        return scheduler;
    }

    // ===== sessions =====

    @Bean
    public PlayerRules playerRules(RealmProperties props) {
        RealmProperties.Player p = props.player();
        return new PlayerRules(p.maxHp(), p.maxMana(), p.attackIntervalMs(), p.inventorySlots(), p.startMapId(),
                props.visibility().defaultRadius(), props.items().goldItemId());
    }

    @Bean
    public CommandHandler commandHandler(WorldIndex world, BroadcastService broadcast, ContentCatalog content,
                                         CombatService combat, GroundItemService groundItems, Relocator relocator,
                                         RandomGenerator rng, PlayerRules rules) {
        return new CommandHandler(world, broadcast, content, combat, groundItems, relocator, rng, rules.goldItemId());
    }

    @Bean
    public SessionService sessionService(WorldIndex world, BroadcastService broadcast, ContentCatalog content,
                                         NpcRegistry npcs, CommandHandler commands, PersistenceService persistence,
                                         Clock clock, PlayerRules rules, RealmProperties props) {
        return new SessionService(world, broadcast, content, npcs, commands, persistence, clock, rules,
                props.tick().intervalMs());
    }

    @Bean
    public AdminService adminService(WorldIndex world, ContentCatalog content, SessionService sessions,
                                     NpcRegistry npcs, GroundItemService groundItems, Relocator relocator,
                                     TickScheduler scheduler) {
        return new AdminService(world, content, sessions, npcs, groundItems, relocator, scheduler);
    }

    @Bean
    public WorldLifecycle worldLifecycle(WorldExecutor executor, TickScheduler scheduler, NpcRegistry npcs,
                                         ContentCatalog content, SessionService sessions, PersistenceService persistence) {
        return new WorldLifecycle(executor, scheduler, npcs, content, sessions, persistence);
    }

    // ===== transport =====

    @Bean
    public SessionRegistry sessionRegistry() {
        return new SessionRegistry();
    }

    @Bean
    public GameWsHandler gameWsHandler(WorldExecutor executor, SessionService sessions, SessionRegistry reg,
                                       ObjectMapper om, ExecutorService wsIo, RealmProperties props) {
        return new GameWsHandler(executor, sessions, reg, om, wsIo,
                props.websocket().sendTimeLimitMs(), props.websocket().bufferSizeLimit());
    }
}
