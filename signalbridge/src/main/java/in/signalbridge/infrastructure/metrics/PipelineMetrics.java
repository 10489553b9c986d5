package in.signalbridge.infrastructure.metrics;

import in.signalbridge.domain.execution.OutcomeType;

import java.time.Duration;

/**
 * Metrics for the signal pipeline.
 *
 * Key metrics:
 * - Intake decisions (accepted, duplicate, invalid)
 * - Execution outcomes and end-to-end latency
 * - Broker order latency and authentication events
 * - Retries and terminal failures
 * - Quote requests and market-data connection events
 */
public interface PipelineMetrics {

    /**
     * @param decision accepted, duplicate or invalid
     */
    void recordSignalReceived(String decision);

    void recordExecutionOutcome(OutcomeType outcome, Duration latency);

    void recordOrderPlacement(String brokerCode, boolean success, Duration latency);

    void recordAuthentication(String brokerCode, boolean success);

    /**
     * @param component EXECUTION or SIGNAL_QUEUE
     * @param attemptNumber attempt that is about to run (2, 3, ...)
     */
    void recordRetry(String component, int attemptNumber, String reason);

    /**
     * A queued job exhausted its retries and was dropped.
     */
    void recordTerminalFailure();

    /**
     * @param result cached, fetched, stale, timeout or invalid
     */
    void recordQuoteRequest(String result);

    /**
     * @param event connected, connect_failed, reconnect, idle_close or error
     */
    void recordConnectionEvent(String event);

    void setQueueDepth(int depth);

    void setOpenConnections(int count);

    void recordIdempotencySweep(int deleted);
}
