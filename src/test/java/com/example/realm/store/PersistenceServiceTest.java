package com.example.realm.store;

import com.example.realm.support.InMemoryWorldStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PersistenceServiceTest {
    private final InMemoryWorldStore store = new InMemoryWorldStore();
    private final PersistenceService persistence = new PersistenceService(store);

    @AfterEach
    void tearDown() {
        persistence.close();
    }

    private static PlayerRecord record(long userId, long gold) {
        return new PlayerRecord(userId, "p" + userId, 1, 5, 5, 1, 0, 100, 100, 50, 50, 100, 100,
                gold, 10, 10, List.of());
    }

    @Test
    void loadFallsBackToEmptyWhenStoreIsDown() {
        store.records.put(7L, record(7, 10));
        store.down = true;

        assertThat(persistence.load(7)).isEmpty();
    }

    @Test
    void savedRecordReachesTheStore() throws Exception {
        persistence.saveAsync(record(7, 10)).get(5, TimeUnit.SECONDS);

        assertThat(store.records.get(7L).gold()).isEqualTo(10);
        assertThat(persistence.pendingCount()).isZero();
    }

    @Test
    void failedWriteIsKeptAndRetriedAfterRecovery() throws Exception {
        store.down = true;
        persistence.saveAsync(record(7, 10)).get(5, TimeUnit.SECONDS);

        assertThat(persistence.pendingCount()).isEqualTo(1);
        assertThat(store.records).isEmpty();

        store.down = false;
        persistence.saveAsync(record(8, 3)).get(5, TimeUnit.SECONDS);

        assertThat(store.records).containsKeys(7L, 8L);
        assertThat(persistence.pendingCount()).isZero();
    }

    @Test
    void unsavedRecordWinsOverStaleStoreContent() throws Exception {
        store.records.put(7L, record(7, 10));
        store.down = true;
        persistence.saveAsync(record(7, 99)).get(5, TimeUnit.SECONDS);
        store.down = false;

        assertThat(persistence.load(7)).hasValueSatisfying(r -> assertThat(r.gold()).isEqualTo(99));
    }

    @Test
    void flushWritesWhatIsPending() throws Exception {
        store.down = true;
        persistence.saveAsync(record(7, 10)).get(5, TimeUnit.SECONDS);
        store.down = false;

        persistence.flush();

        assertThat(store.records).containsKey(7L);
    }
}
