package in.signalbridge.domain.market;

import in.signalbridge.domain.common.ValidationResult;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Best bid/ask observation for one instrument.
 */
public record Quote(String instrument, BigDecimal bid, BigDecimal ask, Instant observedAt) {

    /** Maximum spread as a percentage of the midpoint before a quote is treated as corrupt. */
    public static final BigDecimal MAX_SPREAD_PERCENT = new BigDecimal("5");

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Quote {
        if (instrument == null || bid == null || ask == null || observedAt == null) {
            throw new IllegalArgumentException("instrument, bid, ask and observedAt cannot be null");
        }
    }

    public BigDecimal spread() {
        return ask.subtract(bid);
    }

    public BigDecimal mid() {
        return bid.add(ask).divide(TWO, MathContext.DECIMAL64);
    }

    public Duration ageAt(Instant now) {
        return Duration.between(observedAt, now);
    }

    /**
     * A quote is fresh while its age is strictly below the threshold.
     */
    public boolean isFreshAt(Instant now, Duration threshold) {
        return ageAt(now).compareTo(threshold) < 0;
    }

    /**
     * Sanity check applied before a quote may price an execution.
     */
    public ValidationResult validate() {
        ValidationResult.Builder result = new ValidationResult.Builder()
            .check(bid.signum() > 0, "bid must be positive: " + bid)
            .check(ask.signum() > 0, "ask must be positive: " + ask)
            .check(ask.compareTo(bid) > 0, "ask " + ask + " must be above bid " + bid)
            .check(observedAt.toEpochMilli() > 0, "timestamp must be positive");
        if (!result.hasErrors()) {
            BigDecimal spreadPercent = spread().divide(mid(), MathContext.DECIMAL64).multiply(HUNDRED);
            result.check(spreadPercent.compareTo(MAX_SPREAD_PERCENT) <= 0,
                "spread " + spreadPercent.setScale(2, RoundingMode.HALF_UP) + "% exceeds "
                    + MAX_SPREAD_PERCENT + "% of mid");
        }
        return result.build();
    }
}
