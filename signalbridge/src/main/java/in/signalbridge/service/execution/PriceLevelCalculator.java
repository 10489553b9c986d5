package in.signalbridge.service.execution;

import in.signalbridge.domain.common.ValidationResult;
import in.signalbridge.domain.market.InstrumentSpec;
import in.signalbridge.domain.market.InstrumentType;
import in.signalbridge.domain.market.Quote;
import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.Signal;

import java.math.BigDecimal;

/**
 * Turns pip/point distances into absolute take-profit and stop-loss prices and
 * checks them against the instrument's minimums.
 *
 * BUY enters at the ask, SELL at the bid.
 */
public final class PriceLevelCalculator {

    /**
     * Checks that need no quote.
     */
    public ValidationResult validateInputs(Signal signal, InstrumentSpec spec) {
        ValidationResult.Builder result = new ValidationResult.Builder();
        result.check(signal.takeProfitDistance().signum() > 0,
            "Take profit distance must be positive, got " + signal.takeProfitDistance().toPlainString());
        if (signal.hasStopLoss()) {
            result.check(signal.stopLossDistance().signum() > 0,
                "Stop loss distance must be positive, got " + signal.stopLossDistance().toPlainString());
        }
        result.check(signal.size().compareTo(spec.minLotSize()) >= 0,
            "Volume " + signal.size().toPlainString() + " is below minimum "
                + spec.minLotSize().toPlainString() + " for " + spec.symbol());
        return result.build();
    }

    public PriceLevels calculate(Direction direction, Quote quote,
                                 BigDecimal takeProfitDistance, BigDecimal stopLossDistance,
                                 InstrumentSpec spec) {
        boolean buy = direction == Direction.BUY;
        BigDecimal entry = buy ? quote.ask() : quote.bid();

        BigDecimal tpOffset = spec.toPriceOffset(takeProfitDistance);
        BigDecimal takeProfit = spec.round(buy ? entry.add(tpOffset) : entry.subtract(tpOffset));

        BigDecimal stopLoss = null;
        if (stopLossDistance != null) {
            BigDecimal slOffset = spec.toPriceOffset(stopLossDistance);
            stopLoss = spec.round(buy ? entry.subtract(slOffset) : entry.add(slOffset));
        }
        return new PriceLevels(entry, takeProfit, stopLoss, quote.bid(), quote.ask());
    }

    public ValidationResult validate(Direction direction, PriceLevels levels,
                                     BigDecimal takeProfitDistance, BigDecimal stopLossDistance,
                                     InstrumentSpec spec) {
        ValidationResult.Builder result = new ValidationResult.Builder();
        String unit = spec.type() == InstrumentType.INDEX ? "points" : "pips";

        result.check(takeProfitDistance.compareTo(spec.minTakeProfitDistance()) >= 0,
            "Take profit distance " + takeProfitDistance.toPlainString() + " " + unit + " is below minimum "
                + spec.minTakeProfitDistance().toPlainString() + " for " + spec.symbol());
        if (stopLossDistance != null) {
            result.check(stopLossDistance.compareTo(spec.minStopLossDistance()) >= 0,
                "Stop loss distance " + stopLossDistance.toPlainString() + " " + unit + " is below minimum "
                    + spec.minStopLossDistance().toPlainString() + " for " + spec.symbol());
        }

        int tpVsEntry = levels.takeProfit().compareTo(levels.entry());
        if (direction == Direction.BUY) {
            result.check(tpVsEntry > 0, "BUY TP must be above entry price");
        } else {
            result.check(tpVsEntry < 0, "SELL TP must be below entry price");
        }

        if (levels.stopLoss() != null) {
            int slVsEntry = levels.stopLoss().compareTo(levels.entry());
            if (direction == Direction.BUY) {
                result.check(slVsEntry < 0, "BUY SL must be below entry price");
            } else {
                result.check(slVsEntry > 0, "SELL SL must be above entry price");
            }
        }
        return result.build();
    }
}
