package in.signalbridge.service.signal;

import in.signalbridge.application.port.output.ProcessedSignalRepository;
import in.signalbridge.application.port.output.ProcessedSignalRepository.ProcessedSignal;
import in.signalbridge.domain.signal.SignalKey;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Record of (signalId, accountId) pairs that already produced an order.
 *
 * The processed_signals table is authoritative. The in-memory map is a cache
 * whose entries expire after the retention window; it is rebuilt from the table
 * at startup and merged with it after every sweep, never written back.
 *
 * Retention runs on a background thread only:
 * 1. delete rows older than the retention window
 * 2. if more than {@code maxRecords} remain, keep the {@code keepRecords} newest
 * 3. refresh the cache from the table
 */
public final class IdempotencyStore {
    private static final Logger log = LoggerFactory.getLogger(IdempotencyStore.class);

    private final ProcessedSignalRepository repository;
    private final Settings settings;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final Map<SignalKey, Instant> cache = new ConcurrentHashMap<>();

    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "idempotency-sweeper");
        t.setDaemon(true);
        return t;
    });

    public IdempotencyStore(ProcessedSignalRepository repository, Settings settings, PipelineMetrics metrics) {
        this(repository, settings, metrics, Clock.systemUTC());
    }

    public IdempotencyStore(ProcessedSignalRepository repository, Settings settings,
                            PipelineMetrics metrics, Clock clock) {
        this.repository = repository;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Rebuild the cache from the durable store and schedule retention sweeps.
     */
    public void start() {
        rebuildFromStore();
        long intervalMs = settings.sweepInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[IDEMPOTENCY] Started with {} cached markers, sweep every {}s",
            cache.size(), settings.sweepInterval().toSeconds());
    }

    public void shutdown() {
        sweeper.shutdownNow();
    }

    /**
     * @throws IdempotencyStoreException if the durable store cannot be read
     */
    public boolean has(String signalId, String accountId) {
        SignalKey key = new SignalKey(signalId, accountId);
        Instant cachedAt = cache.get(key);
        if (cachedAt != null && !isExpired(cachedAt)) {
            return true;
        }

        boolean exists;
        try {
            exists = repository.exists(signalId, accountId);
        } catch (RuntimeException e) {
            log.error("[IDEMPOTENCY] Durable lookup failed for {}: {}", key, e.getMessage());
            throw new IdempotencyStoreException("Idempotency lookup failed for " + key, e);
        }
        if (exists) {
            cache.put(key, clock.instant());
        }
        return exists;
    }

    /**
     * Mark the pair as processed. Called only after the order was opened.
     *
     * The cache entry is written even if the durable insert fails, so the running
     * process keeps rejecting the signal; the failure is logged.
     *
     * @return true if the durable insert succeeded
     */
    public boolean record(String signalId, String accountId) {
        SignalKey key = new SignalKey(signalId, accountId);
        Instant now = clock.instant();
        cache.put(key, now);
        try {
            repository.insert(signalId, accountId, now);
            log.debug("[IDEMPOTENCY] Recorded {}", key);
            return true;
        } catch (RuntimeException e) {
            log.error("[IDEMPOTENCY] Failed to persist marker {}; held in memory only: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Replace the cache with the newest rows of the durable store.
     */
    public void rebuildFromStore() {
        List<ProcessedSignal> recent = repository.findRecent(settings.maxRecords());
        cache.clear();
        for (ProcessedSignal row : recent) {
            cache.put(new SignalKey(row.signalId(), row.accountId()), row.processedAt());
        }
        log.info("[IDEMPOTENCY] Cache rebuilt with {} markers", cache.size());
    }

    /**
     * One retention pass.
     *
     * @return number of durable rows deleted
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(settings.retention());
        int deleted = repository.deleteOlderThan(cutoff);

        long remaining = repository.count();
        if (remaining > settings.maxRecords()) {
            int trimmed = repository.trimToMostRecent(settings.keepRecords());
            log.info("[IDEMPOTENCY] {} markers exceeded cap {}, trimmed {}", remaining, settings.maxRecords(), trimmed);
            deleted += trimmed;
        }

        cache.values().removeIf(this::isExpired);
        for (ProcessedSignal row : repository.findRecent(settings.maxRecords())) {
            cache.putIfAbsent(new SignalKey(row.signalId(), row.accountId()), row.processedAt());
        }

        metrics.recordIdempotencySweep(deleted);
        log.info("[IDEMPOTENCY] Sweep removed {} markers, {} cached", deleted, cache.size());
        return deleted;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("[IDEMPOTENCY] Sweep failed: {}", e.getMessage(), e);
        }
    }

    public int cachedCount() {
        return cache.size();
    }

    private boolean isExpired(Instant recordedAt) {
        return Duration.between(recordedAt, clock.instant()).compareTo(settings.retention()) >= 0;
    }

    /**
     * Retention settings. {@code retention} must exceed the longest plausible
     * redelivery delay of the upstream alerting system.
     */
    public record Settings(Duration retention, int maxRecords, int keepRecords, Duration sweepInterval) {
        public Settings {
            if (retention == null || retention.isNegative() || retention.isZero()) {
                throw new IllegalArgumentException("retention must be positive");
            }
            if (keepRecords <= 0 || maxRecords < keepRecords) {
                throw new IllegalArgumentException("require 0 < keepRecords <= maxRecords");
            }
            if (sweepInterval == null || sweepInterval.isNegative() || sweepInterval.isZero()) {
                throw new IllegalArgumentException("sweepInterval must be positive");
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofHours(24), 1000, 500, Duration.ofMinutes(5));
        }
    }
}
