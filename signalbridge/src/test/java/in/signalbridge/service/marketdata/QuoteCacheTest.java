package in.signalbridge.service.marketdata;

import in.signalbridge.domain.market.Quote;
import in.signalbridge.infrastructure.common.BackoffPolicy;
import in.signalbridge.infrastructure.marketdata.MarketDataChannel;
import in.signalbridge.infrastructure.marketdata.MarketDataTransport;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import in.signalbridge.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for QuoteCache against an in-memory feed.
 *
 * Tests:
 * - Cached vs fetched quotes
 * - Stale quote replacement and rejection
 * - Timeouts and invalid quotes
 * - Connect retries
 * - Idle reaping and proactive reconnects
 */
class QuoteCacheTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);

    private MutableClock clock;
    private FakeTransport transport;
    private QuoteCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T15:00:00Z"));
        transport = new FakeTransport();
        transport.responder = instrument -> quote(instrument, "1.0999", "1.1001", clock.instant());
        QuoteCache.Settings settings = new QuoteCache.Settings(
            Duration.ofSeconds(10),
            Duration.ofSeconds(30),
            Duration.ofSeconds(1),
            Duration.ofSeconds(5),
            BackoffPolicy.builder()
                .mode(BackoffPolicy.Mode.LINEAR)
                .initialDelay(Duration.ofMillis(1))
                .maxDelay(Duration.ofMillis(10))
                .maxAttempts(2)
                .build());
        cache = new QuoteCache(transport, settings, mock(PipelineMetrics.class), clock);
    }

    @AfterEach
    void tearDown() {
        cache.shutdown();
    }

    @Test
    void testFirstRequestOpensConnectionAndFetches() {
        Quote quote = cache.getFreshQuote("EURUSD", TIMEOUT);

        assertEquals("EURUSD", quote.instrument());
        assertEquals(1, transport.channels.size(), "One connection opened");
        assertEquals(List.of("EURUSD"), transport.channels.get(0).subscribed, "Instrument subscribed on open");
        assertEquals(1, transport.channels.get(0).priceRequests, "Last price requested once");
    }

    @Test
    void testFreshCachedQuoteServedWithoutRequest() {
        cache.getFreshQuote("EURUSD", TIMEOUT);
        clock.advance(Duration.ofSeconds(5));

        Quote quote = cache.getFreshQuote("EURUSD", TIMEOUT);

        assertEquals(Instant.parse("2024-03-04T15:00:00Z"), quote.observedAt(), "Cached quote returned");
        assertEquals(1, transport.channels.get(0).priceRequests, "No second price request");
    }

    @Test
    void testStaleCachedQuoteReplacesConnection() {
        cache.getFreshQuote("EURUSD", TIMEOUT);
        clock.advance(Duration.ofSeconds(11));

        Quote quote = cache.getFreshQuote("EURUSD", TIMEOUT);

        assertEquals(clock.instant(), quote.observedAt(), "Fresh quote from the new connection");
        assertEquals(2, transport.channels.size(), "Connection replaced");
        assertFalse(transport.channels.get(0).open, "Old channel closed");
        assertEquals(1, cache.connectionStats().totalReconnects());
        assertEquals(1, cache.connectionStats().totalConnections());
    }

    @Test
    void testStaleQuoteFromFeedThrows() {
        transport.responder = instrument -> quote(instrument, "1.0999", "1.1001",
            clock.instant().minusSeconds(20));

        assertThrows(StaleQuoteException.class, () -> cache.getFreshQuote("EURUSD", TIMEOUT));
    }

    @Test
    void testSilentFeedTimesOut() {
        transport.responder = instrument -> null;

        QuoteTimeoutException e = assertThrows(QuoteTimeoutException.class,
            () -> cache.getFreshQuote("EURUSD", Duration.ofMillis(50)));
        assertEquals("EURUSD", e.getInstrument());
    }

    @Test
    void testInvalidQuoteRejected() {
        transport.responder = instrument -> quote(instrument, "1.1001", "1.0999", clock.instant());

        QuoteUnavailableException e = assertThrows(QuoteUnavailableException.class,
            () -> cache.getFreshQuote("EURUSD", TIMEOUT));
        assertTrue(e.getMessage().contains("Invalid quote"), e.getMessage());
    }

    @Test
    void testConnectFailureExhaustsAttempts() {
        transport.failOpen = true;

        assertThrows(QuoteUnavailableException.class, () -> cache.getFreshQuote("EURUSD", TIMEOUT));
        assertEquals(2, transport.openCalls, "Connect retried up to max attempts");
        assertEquals(0, cache.connectionStats().totalConnections());
    }

    @Test
    void testIdleConnectionReaped() {
        String key = cache.connectForDashboard(List.of("GBPUSD", "EURUSD"));
        assertEquals("EURUSD,GBPUSD", key, "Key is the sorted instrument set");

        clock.advance(Duration.ofSeconds(31));
        cache.reapIdleConnections();

        assertEquals(0, cache.connectionStats().totalConnections(), "Idle connection removed");
        assertFalse(transport.channels.get(0).open, "Idle channel closed");
    }

    @Test
    void testReaperReplacesDroppedConnection() {
        cache.getFreshQuote("EURUSD", TIMEOUT);
        transport.channels.get(0).open = false;

        cache.reapIdleConnections();

        assertEquals(2, transport.channels.size(), "Dropped feed reconnected");
        ConnectionStats stats = cache.connectionStats();
        assertEquals(1, stats.healthyConnections());
        assertEquals(1, stats.connections().get(0).reconnectCount());
    }

    @Test
    void testPeekQuoteForDisplay() {
        assertTrue(cache.peekQuote("EURUSD").isEmpty());

        cache.getFreshQuote("EURUSD", TIMEOUT);
        clock.advance(Duration.ofSeconds(15));

        assertTrue(cache.peekQuote("EURUSD").isPresent(), "Stale quote still visible for display");
        assertFalse(cache.isQuoteFresh("EURUSD"));
        assertEquals(Duration.ofSeconds(15), cache.quoteAge("EURUSD").orElseThrow());
    }

    private static Quote quote(String instrument, String bid, String ask, Instant at) {
        return new Quote(instrument, new BigDecimal(bid), new BigDecimal(ask), at);
    }

    private static final class FakeTransport implements MarketDataTransport {
        final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
        volatile Function<String, Quote> responder;
        volatile boolean failOpen;
        volatile int openCalls;

        @Override
        public CompletableFuture<MarketDataChannel> open(MarketDataChannel.Listener listener) {
            openCalls++;
            if (failOpen) {
                return CompletableFuture.failedFuture(new IllegalStateException("handshake refused"));
            }
            FakeChannel channel = new FakeChannel(listener, this);
            channels.add(channel);
            return CompletableFuture.completedFuture(channel);
        }
    }

    private static final class FakeChannel implements MarketDataChannel {
        final MarketDataChannel.Listener listener;
        final FakeTransport transport;
        final List<String> subscribed = new CopyOnWriteArrayList<>();
        volatile int priceRequests;
        volatile boolean open = true;

        FakeChannel(MarketDataChannel.Listener listener, FakeTransport transport) {
            this.listener = listener;
            this.transport = transport;
        }

        @Override
        public void subscribe(String instrument, long requestId) {
            subscribed.add(instrument);
        }

        @Override
        public void requestLastPrice(String instrument, long requestId) {
            priceRequests++;
            Quote quote = transport.responder.apply(instrument);
            if (quote != null) {
                listener.onQuote(quote);
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }
    }
}
