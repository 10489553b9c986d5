package in.signalbridge.service.marketdata;

import in.signalbridge.domain.common.ValidationResult;
import in.signalbridge.domain.market.Quote;
import in.signalbridge.infrastructure.common.BackoffPolicy;
import in.signalbridge.infrastructure.marketdata.MarketDataChannel;
import in.signalbridge.infrastructure.marketdata.MarketDataTransport;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Quote cache and market-data connection manager.
 *
 * Owns the live connections (one per distinct instrument set) and the latest
 * quote per instrument on each. Execution callers use
 * {@link #getFreshQuote(String, Duration)}, which either returns a valid quote
 * younger than the freshness threshold or throws. It never substitutes a
 * last-known price.
 *
 * Connection replacement goes through {@link #ensureFreshConnection(String, String)}
 * only. It is invoked by the background reaper when a feed goes quiet or drops,
 * and by quote requests that find a stale quote.
 *
 * Connections nobody asked for within the idle timeout are closed and removed.
 */
public final class QuoteCache {
    private static final Logger log = LoggerFactory.getLogger(QuoteCache.class);

    private final MarketDataTransport transport;
    private final Settings settings;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final Map<String, MarketDataConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Object> keyLocks = new ConcurrentHashMap<>();
    private final AtomicLong totalReconnects = new AtomicLong();

    private final ScheduledExecutorService reaper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "quote-cache-reaper");
        t.setDaemon(true);
        return t;
    });

    public QuoteCache(MarketDataTransport transport, Settings settings, PipelineMetrics metrics) {
        this(transport, settings, metrics, Clock.systemUTC());
    }

    public QuoteCache(MarketDataTransport transport, Settings settings, PipelineMetrics metrics, Clock clock) {
        this.transport = transport;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void start() {
        long intervalMs = settings.reaperInterval().toMillis();
        reaper.scheduleAtFixedRate(this::reapSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[QUOTES] Quote cache started: freshness={}ms, idleTimeout={}ms",
            settings.freshnessThreshold().toMillis(), settings.idleTimeout().toMillis());
    }

    public void shutdown() {
        reaper.shutdownNow();
        for (MarketDataConnection connection : connections.values()) {
            connection.close("shutdown");
        }
        connections.clear();
        updateOpenConnections();
        log.info("[QUOTES] Quote cache stopped");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EXECUTION PATH
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Get a quote fit for pricing an order.
     *
     * @throws StaleQuoteException   the awaited quote is older than the freshness threshold
     * @throws QuoteTimeoutException nothing arrived within {@code timeout}
     * @throws QuoteUnavailableException connection failed or the quote is invalid
     */
    public Quote getFreshQuote(String instrument, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        String key = keyFor(List.of(instrument));

        MarketDataConnection connection = connections.get(key);
        if (connection != null && connection.isHealthy(settings.idleTimeout())) {
            connection.touch();
            Optional<Quote> cached = connection.quote(instrument);
            if (cached.isPresent() && isUsable(cached.get())) {
                metrics.recordQuoteRequest("cached");
                return cached.get();
            }
            if (cached.isPresent() && !cached.get().isFreshAt(clock.instant(), settings.freshnessThreshold())) {
                log.warn("[QUOTES] Stale quote for {} ({}ms old), replacing connection",
                    instrument, cached.get().ageAt(clock.instant()).toMillis());
                connection = ensureFreshConnection(key, "stale quote");
            }
        } else {
            connection = ensureConnection(List.of(instrument));
        }
        connection.touch();

        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            metrics.recordQuoteRequest("timeout");
            throw new QuoteTimeoutException(instrument, timeout);
        }

        Quote quote = awaitQuote(connection, instrument, remaining, timeout);

        Instant now = clock.instant();
        if (!quote.isFreshAt(now, settings.freshnessThreshold())) {
            metrics.recordQuoteRequest("stale");
            throw new StaleQuoteException(instrument, quote.ageAt(now), settings.freshnessThreshold());
        }
        ValidationResult validity = quote.validate();
        if (!validity.passed()) {
            metrics.recordQuoteRequest("invalid");
            throw new QuoteUnavailableException(instrument, "Invalid quote: " + validity.message());
        }
        metrics.recordQuoteRequest("fetched");
        return quote;
    }

    private Quote awaitQuote(MarketDataConnection connection, String instrument,
                             Duration remaining, Duration timeout) {
        CompletableFuture<Quote> waiter = connection.requestQuote(instrument);
        try {
            return waiter.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            connection.cancelWaiter(instrument, waiter);
            metrics.recordQuoteRequest("timeout");
            throw new QuoteTimeoutException(instrument, timeout);
        } catch (ExecutionException e) {
            metrics.recordQuoteRequest("error");
            Throwable cause = e.getCause();
            if (cause instanceof QuoteUnavailableException unavailable) {
                throw unavailable;
            }
            throw new QuoteUnavailableException(instrument, "Quote request failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.cancelWaiter(instrument, waiter);
            throw new QuoteUnavailableException(instrument, "Interrupted while waiting for quote", e);
        }
    }

    private boolean isUsable(Quote quote) {
        return quote.isFreshAt(clock.instant(), settings.freshnessThreshold()) && quote.validate().passed();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECTION MANAGEMENT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Return a healthy connection for the instrument set, creating or replacing one
     * if needed.
     */
    MarketDataConnection ensureConnection(Collection<String> instruments) {
        String key = keyFor(instruments);
        MarketDataConnection existing = connections.get(key);
        if (existing != null && existing.isHealthy(settings.idleTimeout())) {
            return existing;
        }
        synchronized (lockFor(key)) {
            existing = connections.get(key);
            if (existing != null && existing.isHealthy(settings.idleTimeout())) {
                return existing;
            }
            if (existing != null) {
                return replace(key, existing, "unhealthy");
            }
            MarketDataConnection created = connect(key, new TreeSet<>(instruments), 0);
            connections.put(key, created);
            updateOpenConnections();
            return created;
        }
    }

    /**
     * Close whatever connection serves {@code key} and open a new one. The single path
     * for reconnects, shared by idle detection and stale-quote detection.
     */
    MarketDataConnection ensureFreshConnection(String key, String reason) {
        synchronized (lockFor(key)) {
            MarketDataConnection existing = connections.get(key);
            if (existing == null) {
                MarketDataConnection created = connect(key, instrumentsOf(key), 0);
                connections.put(key, created);
                updateOpenConnections();
                return created;
            }
            return replace(key, existing, reason);
        }
    }

    private MarketDataConnection replace(String key, MarketDataConnection old, String reason) {
        log.info("[QUOTES] Replacing connection {} ({}), reconnect #{}", key, reason, old.reconnectCount() + 1);
        connections.remove(key, old);
        old.close("replaced: " + reason);
        totalReconnects.incrementAndGet();
        metrics.recordConnectionEvent("reconnect");

        MarketDataConnection fresh = connect(key, old.instruments(), old.reconnectCount() + 1);
        connections.put(key, fresh);
        updateOpenConnections();
        return fresh;
    }

    private MarketDataConnection connect(String key, Set<String> instruments, int reconnectCount) {
        BackoffPolicy policy = settings.connectBackoff();
        int attempt = 0;
        while (true) {
            attempt++;
            MarketDataConnection connection = new MarketDataConnection(key, instruments, reconnectCount, clock);
            try {
                MarketDataChannel channel = transport.open(connection)
                    .get(settings.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
                connection.open(channel);
                metrics.recordConnectionEvent("connected");
                log.info("[QUOTES] Connection {} open (attempt {})", key, attempt);
                return connection;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                connection.close("interrupted");
                throw new QuoteUnavailableException(key, "Interrupted while connecting", e);
            } catch (Exception e) {
                connection.close("connect failed");
                metrics.recordConnectionEvent("connect_failed");
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                log.warn("[QUOTES] Connection {} attempt {}/{} failed: {}",
                    key, attempt, policy.getMaxAttempts(), cause.toString());
                if (!policy.shouldRetry(attempt)) {
                    throw new QuoteUnavailableException(key,
                        "Failed to connect after " + attempt + " attempts", cause);
                }
                sleep(policy.delayAfter(attempt), key);
            }
        }
    }

    private void sleep(Duration delay, String key) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QuoteUnavailableException(key, "Interrupted during connect backoff", e);
        }
    }

    /**
     * Background pass: retire connections nobody used within the idle timeout, and
     * refresh in-use connections whose feed dropped or went quiet.
     */
    void reapIdleConnections() {
        for (MarketDataConnection connection : new ArrayList<>(connections.values())) {
            String key = connection.key();
            if (connection.isUnusedFor(settings.idleTimeout())) {
                synchronized (lockFor(key)) {
                    if (connections.remove(key, connection)) {
                        connection.close("idle timeout");
                        metrics.recordConnectionEvent("idle_close");
                        log.info("[QUOTES] Closed idle connection {}", key);
                    }
                }
            } else if (!connection.isHealthy(settings.idleTimeout())) {
                try {
                    ensureFreshConnection(key, "feed idle or closed");
                } catch (QuoteUnavailableException e) {
                    log.warn("[QUOTES] Proactive reconnect of {} failed: {}", key, e.getMessage());
                }
            }
        }
        updateOpenConnections();
    }

    private void reapSafely() {
        try {
            reapIdleConnections();
        } catch (RuntimeException e) {
            log.error("[QUOTES] Reaper pass failed", e);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // DISPLAY / MONITORING
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Open (or keep open) a connection over several instruments for display purposes.
     *
     * @return the connection key
     */
    public String connectForDashboard(Collection<String> instruments) {
        MarketDataConnection connection = ensureConnection(instruments);
        connection.touch();
        return connection.key();
    }

    /**
     * Latest quote for display. May be stale or invalid; never use for pricing orders.
     */
    public Optional<Quote> peekQuote(String instrument) {
        Quote latest = null;
        for (MarketDataConnection connection : connections.values()) {
            Optional<Quote> quote = connection.quote(instrument);
            if (quote.isPresent() && (latest == null || quote.get().observedAt().isAfter(latest.observedAt()))) {
                latest = quote.get();
            }
        }
        return Optional.ofNullable(latest);
    }

    public Optional<Duration> quoteAge(String instrument) {
        return peekQuote(instrument).map(q -> q.ageAt(clock.instant()));
    }

    public boolean isQuoteFresh(String instrument) {
        return peekQuote(instrument).map(q -> q.isFreshAt(clock.instant(), settings.freshnessThreshold())).orElse(false);
    }

    public ConnectionStats connectionStats() {
        List<ConnectionStats.ConnectionInfo> infos = new ArrayList<>();
        int healthy = 0;
        for (MarketDataConnection connection : connections.values()) {
            boolean isHealthy = connection.isHealthy(settings.idleTimeout());
            if (isHealthy) {
                healthy++;
            }
            infos.add(new ConnectionStats.ConnectionInfo(
                connection.key(),
                connection.state().name(),
                isHealthy,
                connection.instruments(),
                connection.reconnectCount(),
                connection.quoteCount(),
                connection.createdAt(),
                connection.lastActivityAt()));
        }
        return new ConnectionStats(infos.size(), healthy, totalReconnects.get(), infos);
    }

    private void updateOpenConnections() {
        metrics.setOpenConnections(connections.size());
    }

    private Object lockFor(String key) {
        return keyLocks.computeIfAbsent(key, k -> new Object());
    }

    static String keyFor(Collection<String> instruments) {
        return String.join(",", new TreeSet<>(instruments));
    }

    private static Set<String> instrumentsOf(String key) {
        return new TreeSet<>(Arrays.asList(key.split(",")));
    }

    /**
     * Tuning for the quote cache.
     */
    public record Settings(
        Duration freshnessThreshold,
        Duration idleTimeout,
        Duration connectTimeout,
        Duration reaperInterval,
        BackoffPolicy connectBackoff
    ) {
        public Settings {
            if (freshnessThreshold == null || freshnessThreshold.isNegative() || freshnessThreshold.isZero()) {
                throw new IllegalArgumentException("freshnessThreshold must be positive");
            }
            if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
                throw new IllegalArgumentException("idleTimeout must be positive");
            }
            if (connectTimeout == null || reaperInterval == null || connectBackoff == null) {
                throw new IllegalArgumentException("connectTimeout, reaperInterval and connectBackoff are required");
            }
        }

        public static Settings defaults() {
            return new Settings(
                Duration.ofSeconds(10),
                Duration.ofSeconds(30),
                Duration.ofSeconds(10),
                Duration.ofSeconds(5),
                BackoffPolicy.forQuoteConnection());
        }
    }
}
