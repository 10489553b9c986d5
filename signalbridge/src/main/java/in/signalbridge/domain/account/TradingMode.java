package in.signalbridge.domain.account;

import in.signalbridge.domain.signal.Direction;

/**
 * Which directions an account is allowed to open.
 */
public enum TradingMode {
    NORMAL,
    BUY_ONLY,
    SELL_ONLY;

    public boolean allows(Direction direction) {
        return switch (this) {
            case NORMAL -> true;
            case BUY_ONLY -> direction == Direction.BUY;
            case SELL_ONLY -> direction == Direction.SELL;
        };
    }

    /**
     * Lenient parse; unknown or empty values fall back to NORMAL.
     */
    public static TradingMode parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return TradingMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
