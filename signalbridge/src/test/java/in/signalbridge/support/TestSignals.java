package in.signalbridge.support;

import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.MarketMode;
import in.signalbridge.domain.signal.Signal;

import java.time.Instant;

/**
 * Signal fixtures.
 */
public final class TestSignals {

    private TestSignals() {}

    /**
     * EURUSD BUY 0.1 lots, TP 50 pips, no SL, demo.
     */
    public static Signal.Builder eurusdBuy(String signalId, String accountId) {
        return Signal.builder()
            .signalId(signalId)
            .accountId(accountId)
            .direction(Direction.BUY)
            .instrument("EURUSD")
            .size("0.1")
            .takeProfitDistance("50")
            .maxSize("1")
            .marketMode(MarketMode.DEMO)
            .receivedAt(Instant.parse("2024-03-04T15:00:00Z"));
    }

    public static Signal signal(String signalId, String accountId) {
        return eurusdBuy(signalId, accountId).build();
    }
}
