package in.signalbridge.service.signal;

import in.signalbridge.domain.signal.Signal;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import in.signalbridge.security.SignalAuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsed webhook signals.
 *
 * Rejects signals the idempotency store already knows, then hands the rest to the
 * queue. An unreachable store does not block intake; the orchestrator checks
 * again before placing anything.
 */
public final class SignalIntakeService {
    private static final Logger log = LoggerFactory.getLogger(SignalIntakeService.class);

    private final IdempotencyStore idempotencyStore;
    private final SignalQueue queue;
    private final SignalAuditLogger audit;
    private final PipelineMetrics metrics;

    public SignalIntakeService(IdempotencyStore idempotencyStore, SignalQueue queue,
                               SignalAuditLogger audit, PipelineMetrics metrics) {
        this.idempotencyStore = idempotencyStore;
        this.queue = queue;
        this.audit = audit;
        this.metrics = metrics;
    }

    public EnqueueResult submit(Signal signal) {
        audit.logReceived(signal);

        try {
            if (idempotencyStore.has(signal.signalId(), signal.accountId())) {
                String reason = "Signal " + signal.signalId() + " already processed for account " + signal.accountId();
                audit.logDuplicate(signal, reason);
                metrics.recordSignalReceived("duplicate");
                return EnqueueResult.rejected(reason);
            }
        } catch (IdempotencyStoreException e) {
            log.warn("[INTAKE] Idempotency check unavailable for {}, deferring to execution: {}",
                signal.signalId(), e.getMessage());
        }

        EnqueueResult result = queue.enqueue(signal);
        if (result.accepted()) {
            metrics.recordSignalReceived("accepted");
        } else {
            audit.logDuplicate(signal, result.reason());
            metrics.recordSignalReceived("duplicate");
        }
        return result;
    }
}
