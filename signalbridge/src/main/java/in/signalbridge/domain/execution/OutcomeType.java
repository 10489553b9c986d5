package in.signalbridge.domain.execution;

/**
 * Outcome categories of processing one signal.
 */
public enum OutcomeType {
    /** Order opened at the broker. */
    PLACED,
    /** Already processed or currently in flight; a no-op. */
    DUPLICATE,
    /** Trading mode, session, exposure or exclusive-mode rule violated. */
    POLICY_REJECTED,
    /** Inputs or computed price levels violate instrument rules. */
    VALIDATION_REJECTED,
    /** Retryable: stale/missing quote, network error, broker 5xx, token expiry. */
    TRANSIENT_FAILURE,
    /** Attempt cap exhausted or the broker refused the request outright. */
    TERMINAL_FAILURE;

    public boolean isRejection() {
        return this == POLICY_REJECTED || this == VALIDATION_REJECTED;
    }
}
