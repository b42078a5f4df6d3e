package com.example.realm.store;

import com.example.realm.error.StoreUnavailableException;
import com.example.realm.world.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort access to the {@link WorldStore}. Failures are logged and never reach gameplay. The latest
 * unsaved record of each user is kept and written again with the next save.
 */
public class PersistenceService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PersistenceService.class);

    private final WorldStore store;
    private final ExecutorService io = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "store-io");
        t.setDaemon(true);
        return t;
    });
    private final Map<Long, PlayerRecord> pending = new ConcurrentHashMap<>();

    public PersistenceService(WorldStore store) {
        this.store = store;
    }

    /** Last known state of a user, or empty when there is none or the store cannot be reached. */
    public Optional<PlayerRecord> load(long userId) {
        PlayerRecord unsaved = pending.get(userId);
        if (unsaved != null) return Optional.of(unsaved);
        try {
            return store.loadPlayer(userId);
        } catch (StoreUnavailableException e) {
            log.warn("Store unavailable, user {} starts from defaults: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    /** Snapshots the player on the calling thread and writes it in the background. */
    public CompletableFuture<Void> save(Player p) {
        return saveAsync(PlayerRecord.of(p));
    }

    public CompletableFuture<Void> saveAsync(PlayerRecord record) {
        pending.put(record.userId(), record);
        return CompletableFuture.runAsync(this::drain, io);
    }

    public int pendingCount() {
        return pending.size();
    }

    private void drain() {
        List<PlayerRecord> batch = new ArrayList<>(pending.values());
        for (PlayerRecord r : batch) {
            try {
                store.savePlayer(r);
                pending.remove(r.userId(), r);
            } catch (StoreUnavailableException e) {
                log.warn("Store unavailable, {} record(s) kept for retry: {}", pending.size(), e.getMessage());
                return;
            }
        }
    }

    public void flush() {
        try {
            CompletableFuture.runAsync(this::drain, io).get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Final store flush did not complete", e);
        }
        if (!pending.isEmpty()) log.warn("{} player record(s) could not be saved", pending.size());
    }

    @Override
    public void close() {
        flush();
        io.shutdown();
    }
}
