package in.signalbridge.domain.order;

import in.signalbridge.domain.signal.Direction;

import java.math.BigDecimal;

/**
 * Position currently open on the broker account.
 */
public record OpenOrder(String orderId, String instrument, Direction direction, BigDecimal volume) {}
