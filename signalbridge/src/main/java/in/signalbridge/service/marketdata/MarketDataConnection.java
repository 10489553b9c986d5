package in.signalbridge.service.marketdata;

import in.signalbridge.domain.market.Quote;
import in.signalbridge.infrastructure.marketdata.MarketDataChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One market-data session over a fixed set of instruments.
 *
 * CONNECTING → OPEN → CLOSED. A closed connection is never reopened; the
 * {@link QuoteCache} replaces it with a new instance.
 */
final class MarketDataConnection implements MarketDataChannel.Listener {
    private static final Logger log = LoggerFactory.getLogger(MarketDataConnection.class);

    enum State {
        CONNECTING,
        OPEN,
        CLOSED
    }

    private final String key;
    private final Set<String> instruments;
    private final int reconnectCount;
    private final Clock clock;
    private final Instant createdAt;

    private final Map<String, Quote> quotes = new ConcurrentHashMap<>();
    // Lists are only mutated inside compute/remove on their key, so registration and drain are atomic.
    private final Map<String, List<CompletableFuture<Quote>>> waiters = new ConcurrentHashMap<>();
    private final AtomicLong requestIds = new AtomicLong();

    private volatile State state = State.CONNECTING;
    private volatile MarketDataChannel channel;
    private volatile Instant lastActivityAt;
    private volatile Instant lastUsedAt;

    MarketDataConnection(String key, Set<String> instruments, int reconnectCount, Clock clock) {
        this.key = key;
        this.instruments = Set.copyOf(instruments);
        this.reconnectCount = reconnectCount;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivityAt = createdAt;
        this.lastUsedAt = createdAt;
    }

    /**
     * Handshake finished: attach the channel and subscribe to every instrument.
     */
    void open(MarketDataChannel openedChannel) {
        if (state == State.CLOSED) {
            openedChannel.close();
            throw new IllegalStateException("Connection " + key + " closed during handshake");
        }
        this.channel = openedChannel;
        this.state = State.OPEN;
        this.lastActivityAt = clock.instant();
        for (String instrument : instruments) {
            openedChannel.subscribe(instrument, requestIds.incrementAndGet());
        }
    }

    /**
     * Register interest in the next quote for the instrument, then ask the feed for it.
     */
    CompletableFuture<Quote> requestQuote(String instrument) {
        CompletableFuture<Quote> waiter = new CompletableFuture<>();
        waiters.compute(instrument, (k, pending) -> {
            List<CompletableFuture<Quote>> list = pending != null ? pending : new ArrayList<>();
            list.add(waiter);
            return list;
        });
        MarketDataChannel current = channel;
        if (state != State.OPEN || current == null) {
            waiter.completeExceptionally(new QuoteUnavailableException(instrument, "Connection " + key + " not open"));
            return waiter;
        }
        try {
            current.requestLastPrice(instrument, requestIds.incrementAndGet());
        } catch (RuntimeException e) {
            waiter.completeExceptionally(new QuoteUnavailableException(instrument, "Price request failed", e));
        }
        return waiter;
    }

    /**
     * Stop waiting; used when the caller gave up.
     */
    void cancelWaiter(String instrument, CompletableFuture<Quote> waiter) {
        waiters.computeIfPresent(instrument, (k, pending) -> {
            pending.remove(waiter);
            return pending.isEmpty() ? null : pending;
        });
    }

    @Override
    public void onQuote(Quote quote) {
        lastActivityAt = clock.instant();
        quotes.put(quote.instrument(), quote);
        List<CompletableFuture<Quote>> pending = waiters.remove(quote.instrument());
        if (pending != null) {
            for (CompletableFuture<Quote> waiter : pending) {
                waiter.complete(quote);
            }
        }
    }

    @Override
    public void onClosed(int statusCode, String reason) {
        log.info("[QUOTES] Connection {} closed by feed: {} {}", key, statusCode, reason);
        markClosed("closed by feed: " + statusCode);
    }

    @Override
    public void onError(Throwable error) {
        log.warn("[QUOTES] Connection {} error: {}", key, error.getMessage());
        markClosed("feed error: " + error.getMessage());
    }

    /**
     * Close the underlying channel and fail anyone still waiting.
     */
    void close(String reason) {
        MarketDataChannel current = channel;
        markClosed(reason);
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.debug("[QUOTES] Error closing connection {}: {}", key, e.getMessage());
            }
        }
    }

    private void markClosed(String reason) {
        state = State.CLOSED;
        for (String instrument : waiters.keySet()) {
            List<CompletableFuture<Quote>> pending = waiters.remove(instrument);
            if (pending == null) {
                continue;
            }
            for (CompletableFuture<Quote> waiter : pending) {
                waiter.completeExceptionally(new QuoteUnavailableException(instrument,
                    "Connection " + key + " " + reason));
            }
        }
    }

    void touch() {
        lastUsedAt = clock.instant();
    }

    /**
     * Open and the feed has produced traffic within the idle window.
     */
    boolean isHealthy(Duration idleTimeout) {
        MarketDataChannel current = channel;
        return state == State.OPEN
            && current != null
            && current.isOpen()
            && Duration.between(lastActivityAt, clock.instant()).compareTo(idleTimeout) < 0;
    }

    boolean isUnusedFor(Duration idleTimeout) {
        return Duration.between(lastUsedAt, clock.instant()).compareTo(idleTimeout) >= 0;
    }

    Optional<Quote> quote(String instrument) {
        return Optional.ofNullable(quotes.get(instrument));
    }

    String key() {
        return key;
    }

    Set<String> instruments() {
        return instruments;
    }

    State state() {
        return state;
    }

    int reconnectCount() {
        return reconnectCount;
    }

    Instant createdAt() {
        return createdAt;
    }

    Instant lastActivityAt() {
        return lastActivityAt;
    }

    int quoteCount() {
        return quotes.size();
    }
}
