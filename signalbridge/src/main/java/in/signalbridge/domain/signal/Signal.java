package in.signalbridge.domain.signal;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One inbound trading instruction.
 *
 * Created at ingress and immutable afterwards. {@code stopLossDistance} is optional;
 * distances are expressed in pips (forex) or points (indices).
 */
public record Signal(
    String signalId,
    boolean synthesizedId,
    String accountId,
    Direction direction,
    String instrument,
    BigDecimal size,
    BigDecimal takeProfitDistance,
    BigDecimal stopLossDistance,
    BigDecimal maxSize,
    String timeframe,
    MarketMode marketMode,
    Map<String, String> metadata,
    Instant receivedAt
) {
    public static final BigDecimal DEFAULT_MAX_SIZE = new BigDecimal("0.01");

    public Signal {
        if (signalId == null || signalId.isBlank()) {
            throw new IllegalArgumentException("signalId cannot be blank");
        }
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId cannot be blank");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        if (instrument == null || instrument.isBlank()) {
            throw new IllegalArgumentException("instrument cannot be blank");
        }
        if (size == null || size.signum() <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        if (takeProfitDistance == null) {
            throw new IllegalArgumentException("takeProfitDistance cannot be null");
        }
        if (maxSize == null) {
            maxSize = DEFAULT_MAX_SIZE;
        }
        if (marketMode == null) {
            marketMode = MarketMode.DEMO;
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }

    /**
     * Identifier used when the alert did not carry one: {@code <epochMillis>_<random>}.
     */
    public static String synthesizeId(Instant now) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return now.toEpochMilli() + "_" + suffix.substring(0, Math.min(9, suffix.length()));
    }

    public boolean hasStopLoss() {
        return stopLossDistance != null;
    }

    /**
     * Key used for idempotency and duplicate suppression.
     */
    public SignalKey dedupKey() {
        return new SignalKey(signalId, accountId);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder used by ingress mappers and tests.
     */
    public static class Builder {
        private String signalId;
        private String accountId;
        private Direction direction;
        private String instrument;
        private BigDecimal size;
        private BigDecimal takeProfitDistance;
        private BigDecimal stopLossDistance;
        private BigDecimal maxSize;
        private String timeframe;
        private MarketMode marketMode;
        private Map<String, String> metadata;
        private Instant receivedAt;

        public Builder signalId(String signalId) { this.signalId = signalId; return this; }
        public Builder accountId(String accountId) { this.accountId = accountId; return this; }
        public Builder direction(Direction direction) { this.direction = direction; return this; }
        public Builder instrument(String instrument) { this.instrument = instrument; return this; }
        public Builder size(BigDecimal size) { this.size = size; return this; }
        public Builder size(String size) { this.size = new BigDecimal(size); return this; }
        public Builder takeProfitDistance(BigDecimal distance) { this.takeProfitDistance = distance; return this; }
        public Builder takeProfitDistance(String distance) { this.takeProfitDistance = new BigDecimal(distance); return this; }
        public Builder stopLossDistance(BigDecimal distance) { this.stopLossDistance = distance; return this; }
        public Builder stopLossDistance(String distance) { this.stopLossDistance = new BigDecimal(distance); return this; }
        public Builder maxSize(BigDecimal maxSize) { this.maxSize = maxSize; return this; }
        public Builder maxSize(String maxSize) { this.maxSize = new BigDecimal(maxSize); return this; }
        public Builder timeframe(String timeframe) { this.timeframe = timeframe; return this; }
        public Builder marketMode(MarketMode marketMode) { this.marketMode = marketMode; return this; }
        public Builder metadata(Map<String, String> metadata) { this.metadata = metadata; return this; }
        public Builder receivedAt(Instant receivedAt) { this.receivedAt = receivedAt; return this; }

        public Signal build() {
            Instant at = receivedAt != null ? receivedAt : Instant.now();
            String id = signalId;
            boolean synthesized = false;
            if (id == null || id.isBlank()) {
                id = synthesizeId(at);
                synthesized = true;
            }
            return new Signal(id, synthesized, accountId, direction, instrument, size,
                takeProfitDistance, stopLossDistance, maxSize, timeframe, marketMode, metadata, at);
        }
    }
}
