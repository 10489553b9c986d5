package in.signalbridge.infrastructure.broker.order;

import in.signalbridge.domain.order.OpenOrder;
import in.signalbridge.domain.order.OrderRequest;
import in.signalbridge.domain.order.OrderResponse;
import in.signalbridge.domain.signal.MarketMode;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Order execution operations against a remote broker.
 *
 * Error Handling:
 * - All operations return CompletableFuture
 * - Placement failures complete exceptionally with {@link OrderPlacementException},
 *   whose {@code isTransient()} tells the caller whether a retry is safe
 * - Query failures complete exceptionally with {@link BrokerQueryException}
 * - Authentication (token fetch, refresh after 401) is internal to the implementation
 */
public interface OrderBroker {

    /**
     * Broker code for logging and metrics (e.g. "SIMPLEFX").
     */
    String getBrokerCode();

    /**
     * Submit a market order with take-profit and optional stop-loss.
     */
    CompletableFuture<OrderResponse> placeOrder(OrderRequest request);

    /**
     * Positions currently open on the account.
     */
    CompletableFuture<List<OpenOrder>> getOpenOrders(String accountId, MarketMode marketMode);
}
