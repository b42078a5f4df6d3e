package com.example.realm.store;

import com.example.realm.error.StoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/** One JSON file per user. Writes go to a temp file first and are moved into place. */
public class JsonFileWorldStore implements WorldStore {
    private final Path directory;
    private final ObjectMapper om;

    public JsonFileWorldStore(Path directory, ObjectMapper om) {
        this.directory = directory;
        this.om = om;
    }

    private Path file(long userId) {
        return directory.resolve("player-" + userId + ".json");
    }

    @Override
    public Optional<PlayerRecord> loadPlayer(long userId) throws StoreUnavailableException {
        Path f = file(userId);
        if (!Files.exists(f)) return Optional.empty();
        try {
            return Optional.of(om.readValue(f.toFile(), PlayerRecord.class));
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot read " + f, e);
        }
    }

    @Override
    public void savePlayer(PlayerRecord record) throws StoreUnavailableException {
        Path f = file(record.userId());
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, "player-" + record.userId(), ".tmp");
            om.writeValue(tmp.toFile(), record);
            Files.move(tmp, f, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreUnavailableException("cannot write " + f, e);
        }
    }
}
