package in.signalbridge.service.execution;

import in.signalbridge.application.port.output.AccountPolicyRepository;
import in.signalbridge.domain.account.AccountTradingPolicy;
import in.signalbridge.domain.account.TradingSession;
import in.signalbridge.domain.common.ValidationResult;
import in.signalbridge.domain.execution.ExecutionRecord;
import in.signalbridge.domain.execution.ExecutionResult;
import in.signalbridge.domain.execution.PendingExecution;
import in.signalbridge.domain.execution.RejectionRecord;
import in.signalbridge.domain.market.InstrumentSpec;
import in.signalbridge.domain.market.Quote;
import in.signalbridge.domain.order.OpenOrder;
import in.signalbridge.domain.order.OrderRequest;
import in.signalbridge.domain.order.OrderResponse;
import in.signalbridge.domain.signal.Signal;
import in.signalbridge.infrastructure.broker.order.BrokerQueryException;
import in.signalbridge.infrastructure.broker.order.OrderBroker;
import in.signalbridge.infrastructure.broker.order.OrderPlacementException;
import in.signalbridge.infrastructure.common.BackoffPolicy;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import in.signalbridge.security.SignalAuditLogger;
import in.signalbridge.service.marketdata.QuoteCache;
import in.signalbridge.service.marketdata.QuoteUnavailableException;
import in.signalbridge.service.signal.AccountSerializer;
import in.signalbridge.service.signal.IdempotencyStore;
import in.signalbridge.service.signal.IdempotencyStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Takes one signal to a terminal outcome for its account.
 *
 * Callers hold the account lock (see {@link in.signalbridge.service.signal.SignalExecutionProcessor}).
 * Steps:
 * 1. duplicate checks: idempotency store, then the PendingExecution marker
 * 2. account policy: session, trading mode, then exposure rules from open orders
 * 3. instrument resolution and input validation
 * 4. quote, price levels, level validation, order placement; steps in 4 are
 *    retried on transient failures with linear backoff
 * 5. on success, mark the idempotency store and record the execution
 *
 * {@link #execute} never throws; every path ends in an {@link ExecutionResult}.
 * The idempotency marker is written only after the broker confirmed the order.
 */
public final class ExecutionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    private final IdempotencyStore idempotencyStore;
    private final AccountSerializer serializer;
    private final AccountPolicyRepository policyRepository;
    private final QuoteCache quoteCache;
    private final OrderBroker broker;
    private final InstrumentCatalog instruments;
    private final PriceLevelCalculator calculator;
    private final ExecutionRecorder recorder;
    private final SignalAuditLogger audit;
    private final PipelineMetrics metrics;
    private final Settings settings;
    private final Clock clock;

    public ExecutionOrchestrator(
        IdempotencyStore idempotencyStore,
        AccountSerializer serializer,
        AccountPolicyRepository policyRepository,
        QuoteCache quoteCache,
        OrderBroker broker,
        InstrumentCatalog instruments,
        PriceLevelCalculator calculator,
        ExecutionRecorder recorder,
        SignalAuditLogger audit,
        PipelineMetrics metrics,
        Settings settings,
        Clock clock
    ) {
        this.idempotencyStore = idempotencyStore;
        this.serializer = serializer;
        this.policyRepository = policyRepository;
        this.quoteCache = quoteCache;
        this.broker = broker;
        this.instruments = instruments;
        this.calculator = calculator;
        this.recorder = recorder;
        this.audit = audit;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    public ExecutionResult execute(Signal signal) {
        Instant started = clock.instant();
        ExecutionResult result;
        try {
            result = executeChecked(signal);
        } catch (IdempotencyStoreException e) {
            log.error("[EXECUTION] Idempotency store unavailable for {}: {}", signal.signalId(), e.getMessage());
            result = ExecutionResult.transientFailure("Idempotency store unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[EXECUTION] Unexpected error for {} on {}: {}",
                signal.signalId(), signal.accountId(), e.getMessage(), e);
            result = ExecutionResult.transientFailure("Unexpected error: " + e.getMessage());
        }
        finish(signal, result, started);
        return result;
    }

    private ExecutionResult executeChecked(Signal signal) {
        if (idempotencyStore.has(signal.signalId(), signal.accountId())) {
            return ExecutionResult.duplicate("Signal " + signal.signalId() + " already processed for account "
                + signal.accountId());
        }

        Optional<PendingExecution> claimed = serializer.beginExecution(
            signal.accountId(), signal.direction(), signal.signalId());
        if (claimed.isEmpty()) {
            return ExecutionResult.duplicate("A " + signal.direction() + " execution is already pending for account "
                + signal.accountId());
        }

        try {
            Optional<String> policyViolation = checkPolicy(signal);
            if (policyViolation.isPresent()) {
                return ExecutionResult.policyRejected(policyViolation.get());
            }

            InstrumentSpec spec = instruments.resolve(signal.instrument());
            ValidationResult inputs = calculator.validateInputs(signal, spec);
            if (!inputs.passed()) {
                return ExecutionResult.validationRejected(inputs.message(), 0);
            }

            return placeWithRetry(signal, spec);
        } finally {
            serializer.endExecution(claimed.get());
        }
    }

    /**
     * @return the first violated rule, or empty when the signal may trade
     * @throws BrokerQueryException propagated as a transient failure by the caller
     */
    private Optional<String> checkPolicy(Signal signal) {
        AccountTradingPolicy policy = policyRepository.getPolicy(signal.accountId());

        TradingSession session = TradingSession.at(clock.instant(), settings.sessionZone());
        if (!policy.isSessionEnabled(session)) {
            return Optional.of("Trading disabled for " + session + " session (" + session.columnName() + ")");
        }

        if (!policy.allows(signal.direction())) {
            return Optional.of("Trading mode " + policy.tradingMode() + " does not allow " + signal.direction());
        }

        List<OpenOrder> openOrders = await(broker.getOpenOrders(signal.accountId(), signal.marketMode()),
            signal.accountId());

        if (policy.exclusiveMode() && !openOrders.isEmpty()) {
            return Optional.of("Exclusive mode: account already has " + openOrders.size() + " open order(s)");
        }

        BigDecimal openVolume = openOrders.stream()
            .map(OpenOrder::volume)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (openVolume.add(signal.size()).compareTo(signal.maxSize()) > 0) {
            return Optional.of("Open volume " + openVolume.toPlainString() + " + " + signal.size().toPlainString()
                + " exceeds size limit " + signal.maxSize().toPlainString());
        }

        long sameSide = openOrders.stream().filter(o -> o.direction() == signal.direction()).count();
        if (sameSide > 0) {
            return Optional.of("Account already has " + sameSide + " open " + signal.direction() + " order(s)");
        }
        return Optional.empty();
    }

    private ExecutionResult placeWithRetry(Signal signal, InstrumentSpec spec) {
        BackoffPolicy backoff = settings.placementBackoff();
        String lastFailure = "no attempt made";

        for (int attempt = 1; ; attempt++) {
            try {
                return attemptPlacement(signal, spec, attempt);
            } catch (QuoteUnavailableException e) {
                lastFailure = e.getMessage();
                metrics.recordRetry("EXECUTION", attempt, "QUOTE");
            } catch (OrderPlacementException e) {
                if (!e.isTransient()) {
                    log.error("[EXECUTION] Broker refused {} for {}: {}", signal.signalId(), signal.accountId(),
                        e.getMessage());
                    return ExecutionResult.terminalFailure(e.getMessage(), attempt);
                }
                lastFailure = e.getMessage();
                metrics.recordRetry("EXECUTION", attempt, "BROKER");
            }

            if (!backoff.shouldRetry(attempt)) {
                return ExecutionResult.terminalFailure(
                    "Failed after " + attempt + " attempts: " + lastFailure, attempt);
            }

            Duration delay = backoff.delayAfter(attempt);
            log.warn("[EXECUTION] Attempt {}/{} for {} failed: {}. Retrying in {}ms",
                attempt, backoff.getMaxAttempts(), signal.signalId(), lastFailure, delay.toMillis());
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ExecutionResult.terminalFailure("Interrupted after " + attempt + " attempts: " + lastFailure,
                    attempt);
            }
        }
    }

    private ExecutionResult attemptPlacement(Signal signal, InstrumentSpec spec, int attempt) {
        Quote quote = quoteCache.getFreshQuote(spec.symbol(), settings.quoteTimeout());

        PriceLevels levels = calculator.calculate(signal.direction(), quote,
            signal.takeProfitDistance(), signal.stopLossDistance(), spec);
        ValidationResult check = calculator.validate(signal.direction(), levels,
            signal.takeProfitDistance(), signal.stopLossDistance(), spec);
        if (!check.passed()) {
            return ExecutionResult.validationRejected(check.message(), attempt);
        }

        OrderRequest request = new OrderRequest(
            signal.accountId(),
            signal.marketMode(),
            spec.symbol(),
            signal.direction(),
            signal.size(),
            levels.takeProfit(),
            levels.stopLoss(),
            "SB_" + signal.signalId() + "_" + attempt
        );
        log.info("[EXECUTION] Attempt {} for {}: {} {} {} entry={} tp={} sl={}", attempt, signal.signalId(),
            request.direction(), request.size(), request.instrument(), levels.entry(), levels.takeProfit(),
            levels.stopLoss());

        OrderResponse response = awaitPlacement(broker.placeOrder(request), request);

        ExecutionRecord record = new ExecutionRecord(
            response.orderId(),
            signal.signalId(),
            signal.accountId(),
            signal.marketMode(),
            spec.symbol(),
            signal.direction(),
            response.size() != null ? response.size() : signal.size(),
            response.openPrice() != null ? response.openPrice() : levels.entry(),
            levels.takeProfit(),
            levels.stopLoss(),
            quote.bid(),
            quote.ask(),
            spec.toDistance(quote.spread()),
            signal.takeProfitDistance(),
            signal.stopLossDistance(),
            signal.timeframe(),
            attempt,
            response.openedAt() != null ? response.openedAt() : clock.instant(),
            null,
            null,
            null
        );

        idempotencyStore.record(signal.signalId(), signal.accountId());
        recorder.recordExecution(record);
        return ExecutionResult.placed(record);
    }

    private OrderResponse awaitPlacement(CompletableFuture<OrderResponse> future, OrderRequest request) {
        try {
            return future.get(settings.brokerTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof OrderPlacementException placement) {
                throw placement;
            }
            throw new OrderPlacementException(broker.getBrokerCode(), request.accountId(), request,
                String.valueOf(e.getCause()), true, e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OrderPlacementException(broker.getBrokerCode(), request.accountId(), request,
                "No broker response within " + settings.brokerTimeout().toMillis() + "ms", true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrderPlacementException(broker.getBrokerCode(), request.accountId(), request,
                "Interrupted waiting for broker", false, e);
        }
    }

    private <T> T await(CompletableFuture<T> future, String accountId) {
        try {
            return future.get(settings.brokerTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof BrokerQueryException query) {
                throw query;
            }
            throw new BrokerQueryException(broker.getBrokerCode(), accountId, "Open order query failed", e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BrokerQueryException(broker.getBrokerCode(), accountId, "Open order query timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerQueryException(broker.getBrokerCode(), accountId, "Interrupted querying open orders", e);
        }
    }

    private void finish(Signal signal, ExecutionResult result, Instant started) {
        metrics.recordExecutionOutcome(result.outcome(), Duration.between(started, clock.instant()));

        switch (result.outcome()) {
            case PLACED -> {
                log.info("[EXECUTION] Placed order {} for signal {} on {} after {} attempt(s)",
                    result.record().orderId(), signal.signalId(), signal.accountId(), result.attempts());
                audit.logPlaced(result.record());
            }
            case DUPLICATE -> {
                log.info("[EXECUTION] Duplicate {} on {}: {}", signal.signalId(), signal.accountId(), result.reason());
                audit.logDuplicate(signal, result.reason());
            }
            case TRANSIENT_FAILURE ->
                log.warn("[EXECUTION] Transient failure for {} on {}: {}",
                    signal.signalId(), signal.accountId(), result.reason());
            default -> {
                log.warn("[EXECUTION] {} for {} on {}: {}",
                    result.outcome(), signal.signalId(), signal.accountId(), result.reason());
                audit.logRejected(signal, result.outcome(), result.reason());
                recorder.recordRejection(RejectionRecord.of(signal, result.outcome(), result.reason(), clock.instant()));
            }
        }
    }

    /**
     * @param quoteTimeout     bounded wait for a fresh quote per attempt
     * @param brokerTimeout    bounded wait for any broker call
     * @param placementBackoff attempt cap and delay between placement attempts
     * @param sessionZone      zone the session windows are defined in
     */
    public record Settings(Duration quoteTimeout, Duration brokerTimeout, BackoffPolicy placementBackoff,
                           ZoneId sessionZone) {
        public Settings {
            if (quoteTimeout == null || quoteTimeout.isNegative() || quoteTimeout.isZero()) {
                throw new IllegalArgumentException("quoteTimeout must be positive");
            }
            if (brokerTimeout == null || brokerTimeout.isNegative() || brokerTimeout.isZero()) {
                throw new IllegalArgumentException("brokerTimeout must be positive");
            }
            if (placementBackoff == null) {
                throw new IllegalArgumentException("placementBackoff cannot be null");
            }
            if (sessionZone == null) {
                sessionZone = TradingSession.DEFAULT_ZONE;
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(8), Duration.ofSeconds(30),
                BackoffPolicy.forOrderPlacement(), TradingSession.DEFAULT_ZONE);
        }
    }
}
