package com.example.realm.ws;

import com.example.realm.content.ContentCatalog;
import com.example.realm.logic.TickScheduler;
import com.example.realm.logic.WorldExecutor;
import com.example.realm.logic.npc.NpcRegistry;
import com.example.realm.session.SessionService;
import com.example.realm.store.PersistenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Populates the world and starts ticking once the context is up; saves everyone on shutdown. */
public class WorldLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(WorldLifecycle.class);

    private final WorldExecutor executor;
    private final TickScheduler scheduler;
    private final NpcRegistry npcs;
    private final ContentCatalog content;
    private final SessionService sessions;
    private final PersistenceService persistence;
    private volatile boolean running;

    public WorldLifecycle(WorldExecutor executor, TickScheduler scheduler, NpcRegistry npcs, ContentCatalog content,
                          SessionService sessions, PersistenceService persistence) {
        this.executor = executor;
        this.scheduler = scheduler;
        this.npcs = npcs;
        this.content = content;
        this.sessions = sessions;
        this.persistence = persistence;
    }

    @Override
    public void start() {
        executor.submit(() -> npcs.spawnAll(content)).join();
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        running = false;
        scheduler.stop();
        try {
            int saved = executor.submit(sessions::saveAll).get(5, TimeUnit.SECONDS);
            log.info("Queued {} player save(s) on shutdown", saved);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Could not snapshot online players on shutdown", e);
        }
        persistence.flush();
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
