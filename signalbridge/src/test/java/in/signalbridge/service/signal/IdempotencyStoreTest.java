package in.signalbridge.service.signal;

import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import in.signalbridge.support.InMemoryProcessedSignalRepository;
import in.signalbridge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class IdempotencyStoreTest {

    private MutableClock clock;
    private InMemoryProcessedSignalRepository repository;
    private PipelineMetrics metrics;
    private IdempotencyStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T12:00:00Z"));
        repository = new InMemoryProcessedSignalRepository();
        metrics = mock(PipelineMetrics.class);
        store = new IdempotencyStore(repository,
            new IdempotencyStore.Settings(Duration.ofHours(24), 4, 2, Duration.ofMinutes(5)), metrics, clock);
    }

    @Test
    void testRecordThenHas() {
        assertFalse(store.has("sig-1", "1001"));

        assertTrue(store.record("sig-1", "1001"));

        assertTrue(store.has("sig-1", "1001"));
        assertFalse(store.has("sig-1", "1002"), "Same signal on another account is independent");
        assertEquals(1, repository.count());
    }

    @Test
    void testIdsContainingSeparatorDoNotCollide() {
        store.record("1700000000000_abc", "42");

        assertTrue(store.has("1700000000000_abc", "42"));
        assertFalse(store.has("1700000000000", "abc_42"), "Different pair sharing a joined form is not processed");
        assertFalse(store.has("1700000000000_abc_42", "x"));
    }

    @Test
    void testHasFallsBackToDurableStore() {
        repository.insert("sig-1", "1001", clock.instant());

        assertTrue(store.has("sig-1", "1001"), "Row written by an earlier process is found");
        assertEquals(1, store.cachedCount(), "Durable hit is cached");
    }

    @Test
    void testRebuildAfterRestart() {
        store.record("sig-1", "1001");
        store.record("sig-2", "1001");

        IdempotencyStore restarted = new IdempotencyStore(repository, IdempotencyStore.Settings.defaults(),
            metrics, clock);
        restarted.rebuildFromStore();

        assertEquals(2, restarted.cachedCount());
        repository.setFailing(true);
        assertTrue(restarted.has("sig-2", "1001"), "Answered from the rebuilt cache");
    }

    @Test
    void testLookupFailureThrows() {
        repository.setFailing(true);

        IdempotencyStoreException e = assertThrows(IdempotencyStoreException.class,
            () -> store.has("sig-1", "1001"));
        assertTrue(e.getMessage().contains("sig-1_1001"), e.getMessage());
    }

    @Test
    void testRecordSurvivesPersistenceFailure() {
        repository.setFailing(true);

        assertFalse(store.record("sig-1", "1001"), "Durable insert failed");
        assertTrue(store.has("sig-1", "1001"), "Marker still held in memory");
    }

    @Test
    void testExpiredCacheEntryRechecksStore() {
        store.record("sig-1", "1001");
        clock.advance(Duration.ofHours(24));
        repository.deleteOlderThan(clock.instant().minus(Duration.ofHours(24)).plusSeconds(1));

        assertFalse(store.has("sig-1", "1001"), "Entry older than retention is forgotten");
    }

    @Test
    void testSweepDeletesExpiredRows() {
        store.record("old", "1001");
        clock.advance(Duration.ofHours(25));
        store.record("new", "1001");

        int deleted = store.sweep();

        assertEquals(1, deleted);
        assertEquals(1, repository.count());
        assertEquals(1, store.cachedCount(), "Expired cache entry evicted");
        verify(metrics).recordIdempotencySweep(1);
    }

    @Test
    void testSweepTrimsToKeepRecords() {
        for (int i = 1; i <= 5; i++) {
            store.record("sig-" + i, "1001");
            clock.advance(Duration.ofMinutes(1));
        }

        int deleted = store.sweep();

        assertEquals(3, deleted, "5 rows over cap of 4, trimmed to 2");
        assertEquals(2, repository.count());
        assertTrue(store.has("sig-5", "1001"));
        assertTrue(store.has("sig-4", "1001"));
    }

    @Test
    void testSettingsValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new IdempotencyStore.Settings(Duration.ZERO, 10, 5, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new IdempotencyStore.Settings(Duration.ofHours(1), 5, 10, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new IdempotencyStore.Settings(Duration.ofHours(1), 10, 5, Duration.ZERO));
    }
}
