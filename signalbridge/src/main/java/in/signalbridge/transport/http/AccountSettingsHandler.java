package in.signalbridge.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.signalbridge.application.port.output.AccountPolicyRepository;
import in.signalbridge.domain.account.AccountTradingPolicy;
import in.signalbridge.domain.account.TradingMode;
import in.signalbridge.domain.account.TradingSession;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Operator endpoints for per-account trading settings.
 *
 * - GET  /api/account-settings/{accountId}
 * - POST /api/account-settings/{accountId}
 *   body fields are all optional: tradingMode (NORMAL, BUY_ONLY, SELL_ONLY),
 *   exclusive_mode, asia_session, london_session, new_york_session, limbo_session
 *   (booleans or 0/1). Omitted fields keep their stored value.
 */
public final class AccountSettingsHandler {
    private static final Logger log = LoggerFactory.getLogger(AccountSettingsHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final AccountPolicyRepository repository;

    public AccountSettingsHandler(AccountPolicyRepository repository) {
        this.repository = repository;
    }

    public void getSettings(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::getSettings);
            return;
        }
        String accountId = accountId(exchange);
        try {
            sendJson(exchange, StatusCodes.OK, render(repository.getPolicy(accountId)));
        } catch (Exception e) {
            log.error("[ACCOUNT_SETTINGS] Failed to load settings for {}: {}", accountId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to load account settings");
        }
    }

    public void updateSettings(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::updateSettings);
            return;
        }
        String accountId = accountId(exchange);
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            JsonNode root;
            try {
                root = MAPPER.readTree(body);
            } catch (Exception e) {
                sendError(exch, StatusCodes.BAD_REQUEST, "Invalid JSON in request body");
                return;
            }
            if (root == null || !root.isObject()) {
                sendError(exch, StatusCodes.BAD_REQUEST, "Body must be a JSON object");
                return;
            }

            try {
                AccountTradingPolicy updated = apply(repository.getPolicy(accountId), root);
                repository.upsert(updated);
                log.info("[ACCOUNT_SETTINGS] {} updated: mode={}, exclusive={}, sessions={}",
                    accountId, updated.tradingMode(), updated.exclusiveMode(), updated.enabledSessions());
                sendJson(exch, StatusCodes.OK, render(updated));
            } catch (IllegalArgumentException e) {
                log.warn("[ACCOUNT_SETTINGS] Rejected update for {}: {}", accountId, e.getMessage());
                sendError(exch, StatusCodes.BAD_REQUEST, e.getMessage());
            } catch (Exception e) {
                log.error("[ACCOUNT_SETTINGS] Failed to update {}: {}", accountId, e.getMessage(), e);
                sendError(exch, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to update account settings");
            }
        }, StandardCharsets.UTF_8);
    }

    static AccountTradingPolicy apply(AccountTradingPolicy current, JsonNode body) {
        AccountTradingPolicy policy = current;
        JsonNode mode = body.get("tradingMode");
        if (mode != null && !mode.isNull()) {
            policy = policy.withTradingMode(parseMode(mode.asText()));
        }
        JsonNode exclusive = body.get("exclusive_mode");
        if (exclusive != null && !exclusive.isNull()) {
            policy = policy.withExclusiveMode(flag(exclusive, "exclusive_mode"));
        }
        for (TradingSession session : TradingSession.values()) {
            JsonNode toggle = body.get(session.columnName());
            if (toggle != null && !toggle.isNull()) {
                policy = policy.withSession(session, flag(toggle, session.columnName()));
            }
        }
        return policy;
    }

    private static TradingMode parseMode(String value) {
        try {
            return TradingMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid trading mode. Must be NORMAL, BUY_ONLY, or SELL_ONLY");
        }
    }

    private static boolean flag(JsonNode node, String field) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.intValue() != 0;
        }
        throw new IllegalArgumentException(field + " must be a boolean or 0/1");
    }

    private static Map<String, Object> render(AccountTradingPolicy policy) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountId", policy.accountId());
        body.put("tradingMode", policy.tradingMode());
        body.put("exclusive_mode", policy.exclusiveMode());
        for (TradingSession session : TradingSession.values()) {
            body.put(session.columnName(), policy.isSessionEnabled(session));
        }
        body.put("updatedAt", policy.updatedAt());
        return body;
    }

    private static String accountId(HttpServerExchange exchange) {
        return exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY).getParameters().get("accountId");
    }

    private void sendJson(HttpServerExchange exchange, int status, Object data) {
        try {
            String json = MAPPER.writeValueAsString(data);
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("[ACCOUNT_SETTINGS] Failed to serialize response: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to serialize response");
        }
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
