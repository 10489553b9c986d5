package in.signalbridge.domain.execution;

import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.MarketMode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted fact of an opened order. Close fields stay null until the position
 * is reconciled by reporting, which lives outside this service.
 */
public record ExecutionRecord(
    String orderId,
    String signalId,
    String accountId,
    MarketMode marketMode,
    String instrument,
    Direction direction,
    BigDecimal size,
    BigDecimal entryPrice,
    BigDecimal takeProfitPrice,
    BigDecimal stopLossPrice,
    BigDecimal bidAtOpen,
    BigDecimal askAtOpen,
    BigDecimal spreadAtOpen,
    BigDecimal requestedTakeProfitDistance,
    BigDecimal requestedStopLossDistance,
    String timeframe,
    int attempts,
    Instant openedAt,
    BigDecimal closePrice,
    Instant closedAt,
    Long durationMinutes
) {}
