package in.signalbridge.infrastructure.broker.order;

/**
 * Exception thrown when a read-only broker query (open orders) fails.
 * Always retryable: nothing was changed on the account.
 */
public class BrokerQueryException extends RuntimeException {

    private final String brokerCode;
    private final String accountId;

    public BrokerQueryException(String brokerCode, String accountId, String message) {
        super(String.format("[%s:%s] %s", brokerCode, accountId, message));
        this.brokerCode = brokerCode;
        this.accountId = accountId;
    }

    public BrokerQueryException(String brokerCode, String accountId, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", brokerCode, accountId, message), cause);
        this.brokerCode = brokerCode;
        this.accountId = accountId;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public String getAccountId() {
        return accountId;
    }
}
