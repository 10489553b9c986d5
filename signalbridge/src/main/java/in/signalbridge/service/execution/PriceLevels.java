package in.signalbridge.service.execution;

import java.math.BigDecimal;

/**
 * Absolute order prices derived from a quote. {@code stopLoss} is null when the
 * signal carried no stop-loss distance.
 */
public record PriceLevels(BigDecimal entry, BigDecimal takeProfit, BigDecimal stopLoss,
                          BigDecimal bid, BigDecimal ask) {}
