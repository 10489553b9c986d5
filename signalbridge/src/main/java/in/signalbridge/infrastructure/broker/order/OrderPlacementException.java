package in.signalbridge.infrastructure.broker.order;

import in.signalbridge.domain.order.OrderRequest;

/**
 * Exception thrown when order placement fails.
 *
 * Transient failures (network errors, timeouts, HTTP 5xx/429, expired token after
 * one refresh) may be retried. Anything else means the broker rejected the request
 * or its outcome is unknown, and it must not be resubmitted.
 */
public class OrderPlacementException extends RuntimeException {

    private final String brokerCode;
    private final String accountId;
    private final OrderRequest orderRequest;
    private final boolean transientFailure;
    private final int httpStatus;

    public OrderPlacementException(String brokerCode, String accountId, OrderRequest orderRequest,
                                   String message, boolean transientFailure, int httpStatus) {
        super(format(brokerCode, accountId, orderRequest, message));
        this.brokerCode = brokerCode;
        this.accountId = accountId;
        this.orderRequest = orderRequest;
        this.transientFailure = transientFailure;
        this.httpStatus = httpStatus;
    }

    public OrderPlacementException(String brokerCode, String accountId, OrderRequest orderRequest,
                                   String message, boolean transientFailure, Throwable cause) {
        super(format(brokerCode, accountId, orderRequest, message), cause);
        this.brokerCode = brokerCode;
        this.accountId = accountId;
        this.orderRequest = orderRequest;
        this.transientFailure = transientFailure;
        this.httpStatus = 0;
    }

    private static String format(String brokerCode, String accountId, OrderRequest request, String message) {
        return String.format("[%s:%s] Order placement failed for %s: %s",
            brokerCode, accountId, request.instrument(), message);
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public String getAccountId() {
        return accountId;
    }

    public OrderRequest getOrderRequest() {
        return orderRequest;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * @return HTTP status of the failed call, or 0 if no response was received
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
