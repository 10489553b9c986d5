package in.signalbridge.domain.order;

import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.MarketMode;

import java.math.BigDecimal;

/**
 * Market order submitted to the broker. Prices are absolute; {@code stopLoss} may be null.
 */
public record OrderRequest(
    String accountId,
    MarketMode marketMode,
    String instrument,
    Direction direction,
    BigDecimal size,
    BigDecimal takeProfit,
    BigDecimal stopLoss,
    String clientRequestId
) {
    public OrderRequest {
        if (accountId == null || instrument == null || direction == null) {
            throw new IllegalArgumentException("accountId, instrument and direction are required");
        }
        if (size == null || size.signum() <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        if (takeProfit == null) {
            throw new IllegalArgumentException("takeProfit is required");
        }
    }
}
