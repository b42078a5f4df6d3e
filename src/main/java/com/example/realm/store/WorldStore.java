package com.example.realm.store;

import com.example.realm.error.StoreUnavailableException;

import java.util.Optional;

public interface WorldStore {

    Optional<PlayerRecord> loadPlayer(long userId) throws StoreUnavailableException;

    void savePlayer(PlayerRecord record) throws StoreUnavailableException;
}
