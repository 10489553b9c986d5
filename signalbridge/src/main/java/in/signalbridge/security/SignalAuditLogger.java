package in.signalbridge.security;

import in.signalbridge.domain.execution.ExecutionRecord;
import in.signalbridge.domain.execution.OutcomeType;
import in.signalbridge.domain.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Audit trail of every signal: intake, duplicates, placements and rejections.
 *
 * Writes to the {@code SIGNAL_AUDIT} logger, which logback routes to its own file.
 * Webhook metadata is passed through verbatim by the charting platform, so any
 * field that looks like a credential is masked before it is logged.
 */
public class SignalAuditLogger {
    private static final Logger audit = LoggerFactory.getLogger("SIGNAL_AUDIT");

    private static final Set<String> SENSITIVE_FIELDS = Set.of(
        "password", "passwd", "pwd", "secret", "apikey", "api_key", "api-key",
        "token", "authorization", "bearer", "session", "cookie", "key"
    );

    private static final Pattern BEARER_TOKEN_PATTERN =
        Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);

    private static final Pattern SECRET_PARAM_PATTERN =
        Pattern.compile("(api[_-]?key|token|access[_-]?token|secret|password)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    public void logReceived(Signal signal) {
        audit.info("[RECEIVED] signal={} account={} action={} symbol={} size={} tp={} sl={} max={} reality={} tf={} synthesized_id={} meta={}",
            signal.signalId(), signal.accountId(), signal.direction(), signal.instrument(), signal.size(),
            signal.takeProfitDistance(), signal.stopLossDistance(), signal.maxSize(), signal.marketMode(),
            signal.timeframe(), signal.synthesizedId(), sanitizeParams(signal.metadata()));
    }

    public void logDuplicate(Signal signal, String reason) {
        audit.info("[DUPLICATE] signal={} account={} reason={}",
            signal.signalId(), signal.accountId(), sanitize(reason));
    }

    public void logPlaced(ExecutionRecord record) {
        audit.info("[PLACED] signal={} account={} order={} {} {} {} entry={} tp={} sl={} spread={} attempts={}",
            record.signalId(), record.accountId(), record.orderId(), record.direction(), record.size(),
            record.instrument(), record.entryPrice(), record.takeProfitPrice(), record.stopLossPrice(),
            record.spreadAtOpen(), record.attempts());
    }

    public void logRejected(Signal signal, OutcomeType outcome, String reason) {
        audit.warn("[{}] signal={} account={} {} {} {} reason={}",
            outcome, signal.signalId(), signal.accountId(), signal.direction(), signal.size(),
            signal.instrument(), sanitize(reason));
    }

    public String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }
        String result = BEARER_TOKEN_PATTERN.matcher(input).replaceAll("Bearer ****");
        return SECRET_PARAM_PATTERN.matcher(result).replaceAll("$1=****");
    }

    /**
     * Copy of {@code params} with credential-like values masked, sorted by key.
     */
    public Map<String, String> sanitizeParams(Map<String, String> params) {
        Map<String, String> sanitized = new TreeMap<>();
        if (params == null) {
            return sanitized;
        }
        for (Map.Entry<String, String> entry : params.entrySet()) {
            String value = isSensitiveField(entry.getKey()) ? maskValue(entry.getValue()) : entry.getValue();
            sanitized.put(entry.getKey(), value);
        }
        return sanitized;
    }

    private static boolean isSensitiveField(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String lower = fieldName.toLowerCase();
        for (String sensitive : SENSITIVE_FIELDS) {
            if (lower.contains(sensitive)) {
                return true;
            }
        }
        return false;
    }

    // First 4 characters kept.
    private static String maskValue(String value) {
        if (value == null || value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }
}
