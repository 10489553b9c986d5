package in.signalbridge.domain.market;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Static trading properties of an instrument.
 *
 * Distances (take-profit, stop-loss, spread) are expressed in units of {@code pipSize}:
 * pips for forex, points for indices.
 */
public record InstrumentSpec(
    String symbol,
    InstrumentType type,
    BigDecimal pipSize,
    int decimals,
    BigDecimal minTakeProfitDistance,
    BigDecimal minStopLossDistance,
    BigDecimal minLotSize
) {
    public InstrumentSpec {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be blank");
        }
        if (pipSize == null || pipSize.signum() <= 0) {
            throw new IllegalArgumentException("pipSize must be positive");
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals cannot be negative");
        }
    }

    /**
     * Convert a distance in pips/points to an absolute price offset.
     */
    public BigDecimal toPriceOffset(BigDecimal distance) {
        return distance.multiply(pipSize);
    }

    /**
     * Convert an absolute price difference to pips/points.
     */
    public BigDecimal toDistance(BigDecimal priceDifference) {
        return priceDifference.abs().divide(pipSize, 1, RoundingMode.HALF_UP);
    }

    public BigDecimal round(BigDecimal price) {
        return price.setScale(decimals, RoundingMode.HALF_UP);
    }
}
