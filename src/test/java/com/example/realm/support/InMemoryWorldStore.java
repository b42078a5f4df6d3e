package com.example.realm.support;

import com.example.realm.error.StoreUnavailableException;
import com.example.realm.store.PlayerRecord;
import com.example.realm.store.WorldStore;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryWorldStore implements WorldStore {
    public final Map<Long, PlayerRecord> records = new ConcurrentHashMap<>();
    public final AtomicInteger writes = new AtomicInteger();
    public volatile boolean down;

    @Override
    public Optional<PlayerRecord> loadPlayer(long userId) throws StoreUnavailableException {
        if (down) throw new StoreUnavailableException("store is down", new IOException("connection refused"));
        return Optional.ofNullable(records.get(userId));
    }

    @Override
    public void savePlayer(PlayerRecord record) throws StoreUnavailableException {
        if (down) throw new StoreUnavailableException("store is down", new IOException("connection refused"));
        records.put(record.userId(), record);
        writes.incrementAndGet();
    }
}
