package in.signalbridge.service.execution;

import in.signalbridge.domain.market.InstrumentSpec;
import in.signalbridge.domain.market.InstrumentType;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static instrument table keyed by normalized symbol.
 *
 * Symbols not listed get the standard forex defaults (0.0001 pip, 5 decimals),
 * whatever their currencies.
 */
public final class InstrumentCatalog {

    private static final Set<String> INDICES = Set.of(
        "US100", "US30", "NAS100", "SPX500", "GER40", "UK100", "JPN225", "US500", "TECH100"
    );

    private static final Set<String> FOREX = Set.of(
        "EURUSD", "GBPUSD", "USDJPY", "AUDUSD", "USDCAD", "NZDUSD", "EURGBP", "EURJPY", "GBPJPY"
    );

    private static final BigDecimal INDEX_POINT = BigDecimal.ONE;
    private static final BigDecimal INDEX_MIN_DISTANCE = new BigDecimal("20");
    private static final BigDecimal INDEX_MIN_LOT = new BigDecimal("0.1");

    private static final BigDecimal PIP = new BigDecimal("0.0001");
    private static final BigDecimal JPY_PIP = new BigDecimal("0.01");
    private static final BigDecimal FOREX_MIN_DISTANCE = new BigDecimal("10");
    private static final BigDecimal FOREX_MIN_LOT = new BigDecimal("0.01");

    private final Map<String, InstrumentSpec> specs;

    public InstrumentCatalog() {
        Map<String, InstrumentSpec> table = new HashMap<>();
        for (String symbol : INDICES) {
            table.put(symbol, index(symbol));
        }
        for (String symbol : FOREX) {
            table.put(symbol, forex(symbol));
        }
        this.specs = Map.copyOf(table);
    }

    /**
     * Strip an {@code EXCHANGE:} prefix and upper-case, e.g. {@code "fx:eurusd"} becomes {@code "EURUSD"}.
     */
    public static String normalize(String symbol) {
        if (symbol == null) {
            return "";
        }
        String trimmed = symbol.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon >= 0) {
            trimmed = trimmed.substring(colon + 1);
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    public InstrumentSpec resolve(String symbol) {
        String normalized = normalize(symbol);
        InstrumentSpec spec = specs.get(normalized);
        return spec != null ? spec : unlisted(normalized);
    }

    public boolean isKnown(String symbol) {
        return specs.containsKey(normalize(symbol));
    }

    public Set<String> symbols() {
        return specs.keySet();
    }

    private static InstrumentSpec index(String symbol) {
        return new InstrumentSpec(symbol, InstrumentType.INDEX, INDEX_POINT, 1,
            INDEX_MIN_DISTANCE, INDEX_MIN_DISTANCE, INDEX_MIN_LOT);
    }

    private static InstrumentSpec unlisted(String symbol) {
        return new InstrumentSpec(symbol, InstrumentType.FOREX, PIP, 5,
            FOREX_MIN_DISTANCE, FOREX_MIN_DISTANCE, FOREX_MIN_LOT);
    }

    private static InstrumentSpec forex(String symbol) {
        boolean jpy = symbol.contains("JPY");
        return new InstrumentSpec(symbol, InstrumentType.FOREX, jpy ? JPY_PIP : PIP, jpy ? 3 : 5,
            FOREX_MIN_DISTANCE, FOREX_MIN_DISTANCE, FOREX_MIN_LOT);
    }
}
