package in.signalbridge.infrastructure.metrics;

import in.signalbridge.domain.execution.OutcomeType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of PipelineMetrics, exposed at /metrics.
 *
 * Key Metrics:
 * - signals_received_total{decision}
 * - signal_executions_total{outcome}, signal_execution_latency_seconds
 * - broker_orders_total{broker, status}, broker_order_latency_seconds{broker}
 * - pipeline_retries_total{component, reason}
 * - signal_queue_terminal_failures_total, signal_queue_depth
 * - quote_requests_total{result}, market_data_connection_events_total{event}
 */
public class PrometheusPipelineMetrics implements PipelineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusPipelineMetrics.class);

    private final CollectorRegistry registry;

    private final Counter signalsReceived;
    private final Counter executions;
    private final Histogram executionLatency;

    private final Counter orderCounter;
    private final Histogram orderLatency;
    private final Counter authCounter;

    private final Counter retryCounter;
    private final Histogram retryAttempts;
    private final Counter terminalFailures;
    private final Gauge queueDepth;

    private final Counter quoteRequests;
    private final Counter connectionEvents;
    private final Gauge openConnections;

    private final Counter idempotencySweepDeletes;

    public PrometheusPipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusPipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.signalsReceived = Counter.build()
            .name("signals_received_total")
            .help("Inbound signals by intake decision")
            .labelNames("decision")
            .register(registry);

        this.executions = Counter.build()
            .name("signal_executions_total")
            .help("Processed signals by outcome")
            .labelNames("outcome")
            .register(registry);

        this.executionLatency = Histogram.build()
            .name("signal_execution_latency_seconds")
            .help("Time from lock acquisition to outcome in seconds")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0)
            .register(registry);

        this.orderCounter = Counter.build()
            .name("broker_orders_total")
            .help("Total number of orders placed")
            .labelNames("broker", "status")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("broker_order_latency_seconds")
            .help("Order placement latency in seconds")
            .labelNames("broker")
            .buckets(0.01, 0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.authCounter = Counter.build()
            .name("broker_authentications_total")
            .help("Total number of token fetches")
            .labelNames("broker", "status")
            .register(registry);

        this.retryCounter = Counter.build()
            .name("pipeline_retries_total")
            .help("Total number of retry attempts")
            .labelNames("component", "reason")
            .register(registry);

        this.retryAttempts = Histogram.build()
            .name("pipeline_retry_attempts")
            .help("Attempt number of each retry")
            .labelNames("component")
            .buckets(1, 2, 3, 5, 10)
            .register(registry);

        this.terminalFailures = Counter.build()
            .name("signal_queue_terminal_failures_total")
            .help("Jobs dropped after exhausting retries")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("signal_queue_depth")
            .help("Jobs waiting in the signal queue")
            .register(registry);

        this.quoteRequests = Counter.build()
            .name("quote_requests_total")
            .help("Fresh quote requests by result")
            .labelNames("result")
            .register(registry);

        this.connectionEvents = Counter.build()
            .name("market_data_connection_events_total")
            .help("Market-data connection lifecycle events")
            .labelNames("event")
            .register(registry);

        this.openConnections = Gauge.build()
            .name("market_data_open_connections")
            .help("Market-data connections currently open")
            .register(registry);

        this.idempotencySweepDeletes = Counter.build()
            .name("idempotency_sweep_deleted_total")
            .help("Processed-signal markers removed by retention sweeps")
            .register(registry);

        log.info("[PrometheusPipelineMetrics] Initialized");
    }

    @Override
    public void recordSignalReceived(String decision) {
        signalsReceived.labels(decision).inc();
    }

    @Override
    public void recordExecutionOutcome(OutcomeType outcome, Duration latency) {
        executions.labels(outcome.name()).inc();
        executionLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordOrderPlacement(String brokerCode, boolean success, Duration latency) {
        orderCounter.labels(brokerCode, success ? "success" : "failure").inc();
        orderLatency.labels(brokerCode).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordAuthentication(String brokerCode, boolean success) {
        authCounter.labels(brokerCode, success ? "success" : "failure").inc();
    }

    @Override
    public void recordRetry(String component, int attemptNumber, String reason) {
        retryCounter.labels(component, reason).inc();
        retryAttempts.labels(component).observe(attemptNumber);
    }

    @Override
    public void recordTerminalFailure() {
        terminalFailures.inc();
    }

    @Override
    public void recordQuoteRequest(String result) {
        quoteRequests.labels(result).inc();
    }

    @Override
    public void recordConnectionEvent(String event) {
        connectionEvents.labels(event).inc();
    }

    @Override
    public void setQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    @Override
    public void setOpenConnections(int count) {
        openConnections.set(count);
    }

    @Override
    public void recordIdempotencySweep(int deleted) {
        idempotencySweepDeletes.inc(deleted);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
