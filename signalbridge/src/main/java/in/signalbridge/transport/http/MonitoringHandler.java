package in.signalbridge.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.signalbridge.domain.market.Quote;
import in.signalbridge.service.marketdata.QuoteCache;
import in.signalbridge.service.marketdata.QuoteUnavailableException;
import in.signalbridge.service.signal.AccountSerializer;
import in.signalbridge.service.signal.SignalQueue;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only operational endpoints:
 * - GET  /health
 * - GET  /api/queue-status
 * - GET  /api/quote-connections
 * - POST /api/quote-connections   body {"instruments":["EURUSD","GBPUSD"]}
 * - GET  /api/quotes/{instrument}  last cached quote, possibly stale
 */
public final class MonitoringHandler {
    private static final Logger log = LoggerFactory.getLogger(MonitoringHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final SignalQueue queue;
    private final AccountSerializer serializer;
    private final QuoteCache quoteCache;

    public MonitoringHandler(SignalQueue queue, AccountSerializer serializer, QuoteCache quoteCache) {
        this.queue = queue;
        this.serializer = serializer;
        this.quoteCache = quoteCache;
    }

    public void getHealth(HttpServerExchange exchange) {
        sendJson(exchange, StatusCodes.OK, Map.of("status", "UP"));
    }

    public void getQueueStatus(HttpServerExchange exchange) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("queue", queue.status());
        status.put("pendingExecutions", serializer.pendingExecutions());
        sendJson(exchange, StatusCodes.OK, status);
    }

    public void getQuoteConnections(HttpServerExchange exchange) {
        sendJson(exchange, StatusCodes.OK, quoteCache.connectionStats());
    }

    public void openQuoteConnection(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::openQuoteConnection);
            return;
        }
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            List<String> instruments = new ArrayList<>();
            try {
                JsonNode root = MAPPER.readTree(body);
                JsonNode list = root == null ? null : root.get("instruments");
                if (list == null || !list.isArray() || list.isEmpty()) {
                    sendError(exch, StatusCodes.BAD_REQUEST, "Body must contain a non-empty instruments array");
                    return;
                }
                list.forEach(node -> instruments.add(node.asText()));
            } catch (Exception e) {
                sendError(exch, StatusCodes.BAD_REQUEST, "Invalid JSON in request body");
                return;
            }

            try {
                String key = quoteCache.connectForDashboard(instruments);
                sendJson(exch, StatusCodes.OK, Map.of("connection", key));
            } catch (QuoteUnavailableException e) {
                log.warn("[MONITORING] Dashboard connection for {} failed: {}", instruments, e.getMessage());
                sendError(exch, StatusCodes.SERVICE_UNAVAILABLE, e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    public void getQuote(HttpServerExchange exchange) {
        String instrument = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY)
            .getParameters().get("instrument");
        Optional<Quote> quote = quoteCache.peekQuote(instrument);
        if (quote.isEmpty()) {
            sendError(exchange, StatusCodes.NOT_FOUND, "No quote cached for " + instrument);
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("quote", quote.get());
        body.put("ageMillis", quoteCache.quoteAge(instrument).map(Duration::toMillis).orElse(null));
        body.put("fresh", quoteCache.isQuoteFresh(instrument));
        sendJson(exchange, StatusCodes.OK, body);
    }

    private void sendJson(HttpServerExchange exchange, int status, Object data) {
        try {
            String json = MAPPER.writeValueAsString(data);
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("[MONITORING] Failed to serialize response: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to serialize response");
        }
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
