package com.example.realm.logic;

import com.example.realm.broadcast.BroadcastService;
import com.example.realm.logic.effect.Effect;
import com.example.realm.logic.effect.TickContext;
import com.example.realm.world.Entity;
import com.example.realm.world.WorldIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Fixed-interval driver for the registered {@link Effect}s. Effects run in registration order; a
 * failure for one entity is logged and skipped without aborting the rest of the tick.
 */
public class TickScheduler {
    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    private final WorldExecutor executor;
    private final WorldIndex world;
    private final BroadcastService broadcast;
    private final Clock clock;
    private final long intervalMs;

    private final List<Effect<?>> effects = new ArrayList<>();
    private volatile long tick = 0;
    private ScheduledFuture<?> handle;

    public TickScheduler(WorldExecutor executor, WorldIndex world, BroadcastService broadcast, Clock clock, long intervalMs) {
        this.executor = executor;
        this.world = world;
        this.broadcast = broadcast;
        this.clock = clock;
        this.intervalMs = intervalMs;
    }

    public synchronized void register(Effect<?> effect) {
        for (Effect<?> e : effects) {
            if (e.name().equals(effect.name())) throw new IllegalStateException("effect already registered: " + effect.name());
        }
        effects.add(effect);
        log.info("Effect registered: {}", effect.name());
    }

    public synchronized List<String> effectNames() {
        List<String> names = new ArrayList<>();
        for (Effect<?> e : effects) names.add(e.name());
        return names;
    }

    public long intervalMs() {
        return intervalMs;
    }

    public long currentTick() {
        return tick;
    }

    public synchronized void start() {
        if (handle != null) {
            log.warn("Tick scheduler already running");
            return;
        }
        handle = executor.scheduleAtFixedRate(this::safeTick, intervalMs);
        log.info("Tick scheduler started (interval {} ms, {} effects)", intervalMs, effects.size());
    }

    public synchronized void stop() {
        if (handle == null) return;
        handle.cancel(false);
        handle = null;
        log.info("Tick scheduler stopped at tick {}", tick);
    }

    private void safeTick() {
        try {
            TickReport r = runTick();
            if (r.durationMs() > intervalMs) {
                log.warn("Tick {} overran: {} ms (interval {} ms)", r.tick(), r.durationMs(), intervalMs);
            }
        } catch (RuntimeException e) {
            // never let an exception cancel the fixed-rate schedule
            log.error("Tick {} aborted", tick, e);
        }
    }

    /** Runs one tick on the calling thread. Must be called from the world thread (or a test). */
    public TickReport runTick() {
        long started = System.nanoTime();
        tick++;
        TickContext ctx = new TickContext(tick, clock.millis(), world, broadcast);

        int[] counts = new int[2];
        List<Effect<?>> ordered;
        synchronized (this) {
            ordered = List.copyOf(effects);
        }
        for (Effect<?> effect : ordered) {
            applyEffect(effect, ctx, counts);
        }

        long durationMs = (System.nanoTime() - started) / 1_000_000L;
        if (counts[1] > 0) log.debug("Tick {}: {} applications, {} failures", tick, counts[0], counts[1]);
        return new TickReport(tick, counts[0], counts[1], durationMs);
    }

    private <E extends Entity> void applyEffect(Effect<E> effect, TickContext ctx, int[] counts) {
        List<E> targets;
        try {
            targets = new ArrayList<>(effect.eligible(ctx));
        } catch (RuntimeException e) {
            counts[1]++;
            log.error("Effect {} could not list its entities on tick {}", effect.name(), ctx.tick(), e);
            return;
        }
        for (E entity : targets) {
            try {
                effect.apply(entity, ctx);
                counts[0]++;
            } catch (RuntimeException e) {
                counts[1]++;
                log.warn("Effect {} failed for {} on tick {}", effect.name(), entity, ctx.tick(), e);
            }
        }
    }
}
