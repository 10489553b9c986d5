package in.signalbridge.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.MarketMode;
import in.signalbridge.domain.signal.Signal;
import in.signalbridge.service.execution.InstrumentCatalog;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Maps the charting platform's alert payload to a {@link Signal}.
 *
 * Field codes:
 * <pre>
 * a   action, B or S                  (required)
 * t   take-profit distance, pips      (required)
 * s   stop-loss distance, pips        (optional)
 * l   account login                   (falls back to the configured default account)
 * z   size in lots                    (required)
 * m   account size limit              (default 0.01)
 * r   1 for live, anything else demo
 * sy  symbol, may carry EXCHANGE:     (default EURUSD)
 * tf  timeframe
 * id  alert id                        (synthesized when absent)
 * </pre>
 * Every other top-level field is kept as metadata.
 */
public final class SignalPayloadMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_SYMBOL = "EURUSD";

    private static final Set<String> KNOWN_FIELDS = Set.of("a", "t", "s", "l", "z", "m", "r", "sy", "tf", "id");

    private final String defaultAccountId;
    private final Clock clock;

    /**
     * @param defaultAccountId account used when the payload has no {@code l}; may be null
     */
    public SignalPayloadMapper(String defaultAccountId, Clock clock) {
        this.defaultAccountId = defaultAccountId;
        this.clock = clock;
    }

    /**
     * @throws InvalidPayloadException body is not a JSON object or a required field is missing or malformed
     */
    public Signal map(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new InvalidPayloadException("Invalid JSON in request body", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidPayloadException("Request body must be a JSON object");
        }

        String accountId = text(root, "l");
        if (accountId == null) {
            accountId = defaultAccountId;
        }
        if (accountId == null) {
            throw new InvalidPayloadException("Missing account login (l)");
        }

        String action = text(root, "a");
        if (action == null) {
            throw new InvalidPayloadException("Missing action (a)");
        }
        Direction direction;
        try {
            direction = Direction.fromCode(action);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException("Invalid action (a): " + action);
        }

        String symbol = text(root, "sy");
        String instrument = InstrumentCatalog.normalize(symbol != null ? symbol : DEFAULT_SYMBOL);
        if (instrument.isEmpty()) {
            throw new InvalidPayloadException("Invalid symbol (sy): " + symbol);
        }

        BigDecimal size = requiredDecimal(root, "z", "size");
        BigDecimal takeProfit = requiredDecimal(root, "t", "take profit");
        BigDecimal stopLoss = optionalDecimal(root, "s", "stop loss");
        BigDecimal maxSize = optionalDecimal(root, "m", "max size");
        if (size.signum() <= 0) {
            throw new InvalidPayloadException("Size (z) must be positive");
        }

        try {
            return Signal.builder()
                .signalId(text(root, "id"))
                .accountId(accountId)
                .direction(direction)
                .instrument(instrument)
                .size(size)
                .takeProfitDistance(takeProfit)
                .stopLossDistance(stopLoss)
                .maxSize(maxSize)
                .timeframe(text(root, "tf"))
                .marketMode(MarketMode.fromFlag(text(root, "r")))
                .metadata(metadata(root))
                .receivedAt(clock.instant())
                .build();
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(e.getMessage());
        }
    }

    private static Map<String, String> metadata(JsonNode root) {
        Map<String, String> metadata = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey()) && !field.getValue().isNull()) {
                JsonNode value = field.getValue();
                metadata.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        }
        return metadata;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static BigDecimal requiredDecimal(JsonNode root, String field, String label) {
        BigDecimal value = optionalDecimal(root, field, label);
        if (value == null) {
            throw new InvalidPayloadException("Missing " + label + " (" + field + ")");
        }
        return value;
    }

    private static BigDecimal optionalDecimal(JsonNode root, String field, String label) {
        String value = text(root, field);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new InvalidPayloadException("Invalid " + label + " (" + field + "): " + value);
        }
    }

    public static class InvalidPayloadException extends RuntimeException {
        public InvalidPayloadException(String message) {
            super(message);
        }

        public InvalidPayloadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
