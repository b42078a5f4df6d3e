package com.example.realm.logic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * The single world thread. Command handling and ticks both run here, so world state has exactly one
 * writer and a tick never overlaps another tick or a command.
 */
public class WorldExecutor implements Executor, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorldExecutor.class);

    private final ScheduledExecutorService ses;

    public WorldExecutor() {
        this.ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "world");
            t.setDaemon(true);
            return t;
        });
    }

    /** Runs the task on the world thread; a failing task is logged and does not affect later ones. */
    @Override
    public void execute(Runnable task) {
        ses.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("World task failed", e);
            }
        });
    }

    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, ses);
    }

    /**
     * Fixed-rate schedule on the world thread. A run that is still going when the next one is due
     * delays it; runs never overlap.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long periodMs) {
        return ses.scheduleAtFixedRate(task, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        ses.shutdown();
        try {
            if (!ses.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("World thread did not stop in time");
                ses.shutdownNow();
            }
        } catch (InterruptedException e) {
            ses.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
