package in.signalbridge.service.execution;

import in.signalbridge.application.port.output.AccountPolicyRepository;
import in.signalbridge.application.port.output.ExecutionRecordRepository;
import in.signalbridge.domain.account.AccountTradingPolicy;
import in.signalbridge.domain.account.TradingMode;
import in.signalbridge.domain.account.TradingSession;
import in.signalbridge.domain.execution.ExecutionRecord;
import in.signalbridge.domain.execution.ExecutionResult;
import in.signalbridge.domain.execution.OutcomeType;
import in.signalbridge.domain.execution.RejectionRecord;
import in.signalbridge.domain.market.Quote;
import in.signalbridge.domain.order.OpenOrder;
import in.signalbridge.domain.order.OrderRequest;
import in.signalbridge.domain.order.OrderResponse;
import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.MarketMode;
import in.signalbridge.domain.signal.Signal;
import in.signalbridge.infrastructure.broker.order.BrokerQueryException;
import in.signalbridge.infrastructure.broker.order.OrderBroker;
import in.signalbridge.infrastructure.broker.order.OrderPlacementException;
import in.signalbridge.infrastructure.common.BackoffPolicy;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import in.signalbridge.security.SignalAuditLogger;
import in.signalbridge.service.marketdata.QuoteCache;
import in.signalbridge.service.marketdata.StaleQuoteException;
import in.signalbridge.service.signal.AccountSerializer;
import in.signalbridge.service.signal.IdempotencyStore;
import in.signalbridge.support.InMemoryProcessedSignalRepository;
import in.signalbridge.support.MutableClock;
import in.signalbridge.support.TestSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExecutionOrchestrator.
 *
 * Tests:
 * - Happy path placement and recording
 * - Duplicate suppression (replay, pending marker)
 * - Account policy rules
 * - Retry classification (quote, broker transient, broker refusal, exhaustion)
 * - Failures of the idempotency store and record persistence
 */
@ExtendWith(MockitoExtension.class)
class ExecutionOrchestratorTest {

    /** 10:00 New York time, inside the NEW_YORK session. */
    private static final Instant NOW = Instant.parse("2024-03-04T15:00:00Z");

    @Mock
    private AccountPolicyRepository policyRepository;

    @Mock
    private QuoteCache quoteCache;

    @Mock
    private OrderBroker broker;

    @Mock
    private ExecutionRecordRepository recordRepository;

    @Mock
    private PipelineMetrics metrics;

    private MutableClock clock;
    private InMemoryProcessedSignalRepository processedSignals;
    private IdempotencyStore idempotencyStore;
    private AccountSerializer serializer;
    private ExecutionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        processedSignals = new InMemoryProcessedSignalRepository();
        idempotencyStore = new IdempotencyStore(processedSignals, IdempotencyStore.Settings.defaults(), metrics, clock);
        serializer = new AccountSerializer(clock);

        BackoffPolicy fastPlacement = BackoffPolicy.builder()
            .mode(BackoffPolicy.Mode.LINEAR)
            .initialDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(10))
            .maxAttempts(3)
            .build();
        ExecutionOrchestrator.Settings settings = new ExecutionOrchestrator.Settings(
            Duration.ofSeconds(1), Duration.ofSeconds(1), fastPlacement, TradingSession.DEFAULT_ZONE);

        orchestrator = new ExecutionOrchestrator(
            idempotencyStore,
            serializer,
            policyRepository,
            quoteCache,
            broker,
            new InstrumentCatalog(),
            new PriceLevelCalculator(),
            new ExecutionRecorder(recordRepository, Runnable::run),
            new SignalAuditLogger(),
            metrics,
            settings,
            clock);

        lenient().when(policyRepository.getPolicy(anyString()))
            .thenAnswer(inv -> AccountTradingPolicy.defaults(inv.getArgument(0)));
        lenient().when(broker.getOpenOrders(anyString(), any(MarketMode.class)))
            .thenReturn(CompletableFuture.completedFuture(List.of()));
        lenient().when(quoteCache.getFreshQuote(eq("EURUSD"), any(Duration.class))).thenReturn(eurusdQuote());
        lenient().when(broker.getBrokerCode()).thenReturn("SIMPLEFX");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PLACEMENT
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testPlacesOrderAndRecordsExecution() {
        when(broker.placeOrder(any(OrderRequest.class))).thenReturn(filled("ord-1"));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.PLACED, result.outcome(), result.reason());
        assertEquals(1, result.attempts());

        ArgumentCaptor<OrderRequest> request = ArgumentCaptor.forClass(OrderRequest.class);
        verify(broker).placeOrder(request.capture());
        assertEquals("SB_sig-1_1", request.getValue().clientRequestId());
        assertEquals(new BigDecimal("1.10500"), request.getValue().takeProfit(), "TP 50 pips above the ask");
        assertNull(request.getValue().stopLoss());

        ExecutionRecord record = result.record();
        assertEquals("ord-1", record.orderId());
        assertEquals(new BigDecimal("1.10000"), record.entryPrice(), "Falls back to the ask without a fill price");
        assertEquals(0, new BigDecimal("2").compareTo(record.spreadAtOpen()), "Spread in pips");
        verify(recordRepository).recordExecution(record);
        assertTrue(idempotencyStore.has("sig-1", "1001"), "Marked processed after the fill");
        assertFalse(serializer.isPending("1001", Direction.BUY), "Marker released");
        verify(metrics).recordExecutionOutcome(eq(OutcomeType.PLACED), any(Duration.class));
    }

    @Test
    void testReplayedSignalIsDuplicate() {
        when(broker.placeOrder(any(OrderRequest.class))).thenReturn(filled("ord-1"));
        Signal signal = TestSignals.signal("sig-1", "1001");

        orchestrator.execute(signal);
        ExecutionResult replay = orchestrator.execute(signal);

        assertEquals(OutcomeType.DUPLICATE, replay.outcome());
        assertEquals("Signal sig-1 already processed for account 1001", replay.reason());
        verify(broker, times(1)).placeOrder(any(OrderRequest.class));
        verify(recordRepository, never()).recordRejection(any());
    }

    @Test
    void testPendingExecutionBlocksSameSide() {
        serializer.beginExecution("1001", Direction.BUY, "sig-0");

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.DUPLICATE, result.outcome());
        assertEquals("A BUY execution is already pending for account 1001", result.reason());
        verifyNoInteractions(quoteCache);
    }

    @Test
    void testTransientBrokerFailuresRetried() {
        when(broker.placeOrder(any(OrderRequest.class)))
            .thenReturn(brokerFailure(true))
            .thenReturn(brokerFailure(true))
            .thenReturn(filled("ord-3"));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.PLACED, result.outcome(), result.reason());
        assertEquals(3, result.attempts());
        ArgumentCaptor<OrderRequest> requests = ArgumentCaptor.forClass(OrderRequest.class);
        verify(broker, times(3)).placeOrder(requests.capture());
        assertEquals(List.of("SB_sig-1_1", "SB_sig-1_2", "SB_sig-1_3"),
            requests.getAllValues().stream().map(OrderRequest::clientRequestId).toList());
        verify(recordRepository, times(1)).recordExecution(any());
        verify(metrics).recordRetry("EXECUTION", 1, "BROKER");
        verify(metrics).recordRetry("EXECUTION", 2, "BROKER");
    }

    @Test
    void testRetriesExhaustedIsTerminal() {
        when(broker.placeOrder(any(OrderRequest.class))).thenAnswer(inv -> brokerFailure(true));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.TERMINAL_FAILURE, result.outcome());
        assertEquals(3, result.attempts());
        assertTrue(result.reason().startsWith("Failed after 3 attempts"), result.reason());
        assertFalse(result.isRetryable(), "Queue must not retry an exhausted execution");
        assertFalse(idempotencyStore.has("sig-1", "1001"));

        ArgumentCaptor<RejectionRecord> rejection = ArgumentCaptor.forClass(RejectionRecord.class);
        verify(recordRepository).recordRejection(rejection.capture());
        assertEquals(OutcomeType.TERMINAL_FAILURE, rejection.getValue().outcome());
    }

    @Test
    void testBrokerRefusalNotRetried() {
        when(broker.placeOrder(any(OrderRequest.class))).thenReturn(brokerFailure(false));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.TERMINAL_FAILURE, result.outcome());
        assertEquals(1, result.attempts());
        verify(broker, times(1)).placeOrder(any(OrderRequest.class));
    }

    @Test
    void testStaleQuoteRetried() {
        when(quoteCache.getFreshQuote(eq("EURUSD"), any(Duration.class)))
            .thenThrow(new StaleQuoteException("EURUSD", Duration.ofSeconds(12), Duration.ofSeconds(10)))
            .thenReturn(eurusdQuote());
        when(broker.placeOrder(any(OrderRequest.class))).thenReturn(filled("ord-2"));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.PLACED, result.outcome(), result.reason());
        assertEquals(2, result.attempts());
        verify(metrics).recordRetry("EXECUTION", 1, "QUOTE");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // POLICY
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testDisabledSessionRejectsWithoutQuote() {
        when(policyRepository.getPolicy("1001"))
            .thenReturn(AccountTradingPolicy.defaults("1001").withSession(TradingSession.NEW_YORK, false));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.POLICY_REJECTED, result.outcome());
        assertEquals("Trading disabled for NEW_YORK session (new_york_session)", result.reason());
        verifyNoInteractions(quoteCache);
        verify(broker, never()).placeOrder(any());
        verify(recordRepository).recordRejection(any(RejectionRecord.class));
    }

    @Test
    void testTradingModeRejectsDirection() {
        when(policyRepository.getPolicy("1001"))
            .thenReturn(AccountTradingPolicy.defaults("1001").withTradingMode(TradingMode.BUY_ONLY));
        Signal sell = TestSignals.eurusdBuy("sig-1", "1001").direction(Direction.SELL).build();

        ExecutionResult result = orchestrator.execute(sell);

        assertEquals(OutcomeType.POLICY_REJECTED, result.outcome());
        assertEquals("Trading mode BUY_ONLY does not allow SELL", result.reason());
    }

    @Test
    void testExclusiveModeRejectsWithOpenOrders() {
        when(policyRepository.getPolicy("1001"))
            .thenReturn(AccountTradingPolicy.defaults("1001").withExclusiveMode(true));
        openOrders(new OpenOrder("o-1", "GBPUSD", Direction.SELL, new BigDecimal("0.01")));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.POLICY_REJECTED, result.outcome());
        assertEquals("Exclusive mode: account already has 1 open order(s)", result.reason());
    }

    @Test
    void testSizeLimitRejects() {
        openOrders(new OpenOrder("o-1", "EURUSD", Direction.SELL, new BigDecimal("0.95")));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.POLICY_REJECTED, result.outcome());
        assertEquals("Open volume 0.95 + 0.1 exceeds size limit 1", result.reason());
    }

    @Test
    void testSameSideOpenOrderRejects() {
        openOrders(new OpenOrder("o-1", "US100", Direction.BUY, new BigDecimal("0.1")));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.POLICY_REJECTED, result.outcome());
        assertEquals("Account already has 1 open BUY order(s)", result.reason());
    }

    @Test
    void testOppositeSideOpenOrderAllowed() {
        openOrders(new OpenOrder("o-1", "EURUSD", Direction.SELL, new BigDecimal("0.1")));
        when(broker.placeOrder(any(OrderRequest.class))).thenReturn(filled("ord-1"));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.PLACED, result.outcome(), result.reason());
    }

    @Test
    void testOpenOrderQueryFailureIsTransient() {
        when(broker.getOpenOrders("1001", MarketMode.DEMO))
            .thenReturn(CompletableFuture.failedFuture(new BrokerQueryException("SIMPLEFX", "1001", "HTTP 503")));

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.TRANSIENT_FAILURE, result.outcome());
        assertTrue(result.isRetryable());
        assertFalse(serializer.isPending("1001", Direction.BUY), "Marker released on failure");
        verify(recordRepository, never()).recordRejection(any());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // VALIDATION
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testLevelValidationFailureNotRetried() {
        Signal tightTp = TestSignals.eurusdBuy("sig-1", "1001").takeProfitDistance("5").build();

        ExecutionResult result = orchestrator.execute(tightTp);

        assertEquals(OutcomeType.VALIDATION_REJECTED, result.outcome());
        assertEquals("Take profit distance 5 pips is below minimum 10 for EURUSD", result.reason());
        verify(quoteCache, times(1)).getFreshQuote(eq("EURUSD"), any(Duration.class));
        verify(broker, never()).placeOrder(any());
    }

    @Test
    void testInputValidationFailureSkipsQuote() {
        Signal tiny = TestSignals.eurusdBuy("sig-1", "1001").size("0.001").build();

        ExecutionResult result = orchestrator.execute(tiny);

        assertEquals(OutcomeType.VALIDATION_REJECTED, result.outcome());
        assertEquals(0, result.attempts());
        verifyNoInteractions(quoteCache);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // STORE FAILURES
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testRecordPersistenceFailureKeepsPlacement() {
        when(broker.placeOrder(any(OrderRequest.class))).thenReturn(filled("ord-1"));
        doThrow(new IllegalStateException("disk full")).when(recordRepository).recordExecution(any());

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.PLACED, result.outcome());
        assertTrue(idempotencyStore.has("sig-1", "1001"));
    }

    @Test
    void testIdempotencyStoreDownIsTransient() {
        processedSignals.setFailing(true);

        ExecutionResult result = orchestrator.execute(TestSignals.signal("sig-1", "1001"));

        assertEquals(OutcomeType.TRANSIENT_FAILURE, result.outcome());
        assertTrue(result.reason().startsWith("Idempotency store unavailable"), result.reason());
        verifyNoInteractions(broker);
    }

    private void openOrders(OpenOrder... orders) {
        when(broker.getOpenOrders("1001", MarketMode.DEMO))
            .thenReturn(CompletableFuture.completedFuture(List.of(orders)));
    }

    private static Quote eurusdQuote() {
        return new Quote("EURUSD", new BigDecimal("1.09980"), new BigDecimal("1.10000"), NOW);
    }

    private static CompletableFuture<OrderResponse> filled(String orderId) {
        return CompletableFuture.completedFuture(new OrderResponse(orderId, "EURUSD", Direction.BUY,
            new BigDecimal("0.1"), null, new BigDecimal("1.10500"), null, NOW));
    }

    private static CompletableFuture<OrderResponse> brokerFailure(boolean transientFailure) {
        OrderRequest request = new OrderRequest("1001", MarketMode.DEMO, "EURUSD", Direction.BUY,
            new BigDecimal("0.1"), new BigDecimal("1.10500"), null, "SB_sig-1_1");
        return CompletableFuture.failedFuture(new OrderPlacementException("SIMPLEFX", "1001", request,
            transientFailure ? "HTTP 503: busy" : "HTTP 400: Invalid volume", transientFailure,
            transientFailure ? 503 : 400));
    }
}
