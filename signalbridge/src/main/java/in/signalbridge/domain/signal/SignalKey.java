package in.signalbridge.domain.signal;

/**
 * Identity of a signal delivery: the alert id scoped to one account.
 */
public record SignalKey(String signalId, String accountId) {

    public SignalKey {
        if (signalId == null || signalId.isBlank()) {
            throw new IllegalArgumentException("signalId cannot be blank");
        }
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId cannot be blank");
        }
    }

    @Override
    public String toString() {
        return signalId + "@" + accountId;
    }
}
