package in.signalbridge.domain.execution;

/**
 * Result returned by the execution orchestrator. Never carries an exception;
 * the outcome type decides whether the queue may retry.
 */
public record ExecutionResult(
    OutcomeType outcome,
    String reason,
    ExecutionRecord record,
    int attempts
) {
    public ExecutionResult {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
    }

    public static ExecutionResult placed(ExecutionRecord record) {
        return new ExecutionResult(OutcomeType.PLACED, null, record, record.attempts());
    }

    public static ExecutionResult duplicate(String reason) {
        return new ExecutionResult(OutcomeType.DUPLICATE, reason, null, 0);
    }

    public static ExecutionResult policyRejected(String reason) {
        return new ExecutionResult(OutcomeType.POLICY_REJECTED, reason, null, 0);
    }

    public static ExecutionResult validationRejected(String reason, int attempts) {
        return new ExecutionResult(OutcomeType.VALIDATION_REJECTED, reason, null, attempts);
    }

    public static ExecutionResult transientFailure(String reason) {
        return new ExecutionResult(OutcomeType.TRANSIENT_FAILURE, reason, null, 0);
    }

    public static ExecutionResult terminalFailure(String reason, int attempts) {
        return new ExecutionResult(OutcomeType.TERMINAL_FAILURE, reason, null, attempts);
    }

    public boolean isPlaced() {
        return outcome == OutcomeType.PLACED;
    }

    /**
     * Only transient failures are eligible for the queue's outer retry.
     */
    public boolean isRetryable() {
        return outcome == OutcomeType.TRANSIENT_FAILURE;
    }
}
