package in.signalbridge.domain.signal;

/**
 * Trade direction of a signal or an open order.
 */
public enum Direction {
    BUY,
    SELL;

    /**
     * Parse the direction codes used by alert payloads and the broker API:
     * "B"/"BUY" and "S"/"SELL", case-insensitive.
     */
    public static Direction fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Direction code cannot be null");
        }
        return switch (code.trim().toUpperCase()) {
            case "B", "BUY" -> BUY;
            case "S", "SELL" -> SELL;
            default -> throw new IllegalArgumentException("Unknown direction code: " + code);
        };
    }

    public Direction opposite() {
        return this == BUY ? SELL : BUY;
    }
}
