package in.signalbridge.domain.execution;

import in.signalbridge.domain.signal.Signal;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted reason a signal did not produce an order.
 */
public record RejectionRecord(
    String signalId,
    String accountId,
    String instrument,
    String direction,
    BigDecimal size,
    OutcomeType outcome,
    String reason,
    Instant recordedAt
) {
    public static RejectionRecord of(Signal signal, OutcomeType outcome, String reason, Instant at) {
        return new RejectionRecord(signal.signalId(), signal.accountId(), signal.instrument(),
            signal.direction().name(), signal.size(), outcome, reason, at);
    }
}
