package com.example.realm.logic;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.content.NpcTemplate;
import com.example.realm.logic.effect.Effect;
import com.example.realm.logic.effect.HungerThirstEffect;
import com.example.realm.logic.effect.TickContext;
import com.example.realm.support.MutableClock;
import com.example.realm.world.Entity;
import com.example.realm.world.GridMap;
import com.example.realm.world.Npc;
import com.example.realm.world.Player;
import com.example.realm.world.WorldIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class TickSchedulerTest {
    private WorldIndex world;
    private TickScheduler scheduler;
    private final List<String> applied = new ArrayList<>();
    private Player alice;
    private Player bob;
    private Npc wolf;

    @BeforeEach
    void setUp() {
        world = new WorldIndex(8, 10);
        world.registerMap(new GridMap(1, "field", 30, 30));
        scheduler = new TickScheduler(mock(WorldExecutor.class), world, new BroadcastService(world, 20),
                new MutableClock(5_000), 1000);

        alice = new Player(world.nextId(), 1, "alice", 100, 50, 20, 15);
        bob = new Player(world.nextId(), 2, "bob", 100, 50, 20, 15);
        wolf = new Npc(world.nextId(), new NpcTemplate(2, "Wolf", true, 1, 20, 1, 2, 0, 0, 0, 3, 6, 1000, 60, 10,
                0, 0, false, 0.0, List.of()), 1, 9, 9);
        world.add(alice, 1, 1, 1);
        world.add(bob, 1, 2, 2);
        world.add(wolf, 1, 9, 9);
    }

    private <E extends Entity> Effect<E> recording(String name, Function<TickContext, Collection<E>> eligible, long failFor) {
        return new Effect<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Collection<E> eligible(TickContext ctx) {
                return eligible.apply(ctx);
            }

            @Override
            public void apply(E entity, TickContext ctx) {
                if (entity.id == failFor) throw new IllegalStateException("boom");
                applied.add(name + ":" + entity.id);
            }
        };
    }

    @Test
    void failingEntityDoesNotStopLaterEffectsOrEntities() {
        scheduler.register(recording("hunger", ctx -> ctx.world().players(), alice.id));
        scheduler.register(recording("gold-decay", ctx -> ctx.world().players(), -1));
        scheduler.register(recording("npc-behavior", ctx -> ctx.world().npcs(), -1));

        TickReport report = scheduler.runTick();

        assertThat(report.tick()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.applied()).isEqualTo(4);
        assertThat(applied).containsExactly(
                "hunger:" + bob.id,
                "gold-decay:" + alice.id,
                "gold-decay:" + bob.id,
                "npc-behavior:" + wolf.id);
    }

    @Test
    void failingEligibilityOnlySkipsThatEffect() {
        scheduler.register(recording("broken", ctx -> {
            throw new IllegalStateException("no list");
        }, -1));
        scheduler.register(recording("npc-behavior", ctx -> ctx.world().npcs(), -1));

        TickReport report = scheduler.runTick();

        assertThat(report.failed()).isEqualTo(1);
        assertThat(applied).containsExactly("npc-behavior:" + wolf.id);
    }

    @Test
    void effectsRunInRegistrationOrderAndNamesAreUnique() {
        scheduler.register(new HungerThirstEffect(1, 10));
        scheduler.register(recording("gold-decay", ctx -> List.<Player>of(), -1));

        assertThat(scheduler.effectNames()).containsExactly("hunger-thirst", "gold-decay");
        assertThatThrownBy(() -> scheduler.register(new HungerThirstEffect(5, 1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void intervalEffectsFireOnMultiplesOfTheirInterval() {
        scheduler.register(new HungerThirstEffect(3, 10));

        scheduler.runTick();
        scheduler.runTick();
        assertThat(alice.food).isEqualTo(100);

        scheduler.runTick();
        assertThat(alice.food).isEqualTo(90);
        assertThat(bob.water).isEqualTo(90);
        assertThat(scheduler.currentTick()).isEqualTo(3);
    }

    @Test
    void scheduledTicksNeverOverlapAndSurviveFailures() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        AtomicInteger clockReads = new AtomicInteger();
        CountDownLatch slowRuns = new CountDownLatch(8);
        MutableClock flaky = new MutableClock(5_000) {
            @Override
            public long millis() {
                if (clockReads.incrementAndGet() == 2) throw new IllegalStateException("clock unavailable");
                return super.millis();
            }
        };

        try (WorldExecutor executor = new WorldExecutor()) {
            TickScheduler live = new TickScheduler(executor, world, new BroadcastService(world, 20), flaky, 5);
            live.register(recording("failing", ctx -> ctx.world().players(), alice.id));
            live.register(new Effect<Player>() {
                @Override
                public String name() {
                    return "slow";
                }

                @Override
                public Collection<Player> eligible(TickContext ctx) {
                    return ctx.world().players();
                }

                @Override
                public void apply(Player entity, TickContext ctx) {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(15);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        running.decrementAndGet();
                        slowRuns.countDown();
                    }
                }
            });

            live.start();
            boolean done = slowRuns.await(5, TimeUnit.SECONDS);
            live.stop();

            assertThat(done).isTrue();
            assertThat(maxRunning.get()).isEqualTo(1);
            assertThat(clockReads.get()).isGreaterThanOrEqualTo(5);
            assertThat(live.currentTick()).isGreaterThanOrEqualTo(5);
        }
    }
}
