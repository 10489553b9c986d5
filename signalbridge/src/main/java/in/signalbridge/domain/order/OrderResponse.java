package in.signalbridge.domain.order;

import in.signalbridge.domain.signal.Direction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Broker confirmation of an opened market order.
 */
public record OrderResponse(
    String orderId,
    String instrument,
    Direction direction,
    BigDecimal size,
    BigDecimal openPrice,
    BigDecimal takeProfit,
    BigDecimal stopLoss,
    Instant openedAt
) {
    public OrderResponse {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("orderId cannot be blank");
        }
    }
}
