package in.signalbridge.infrastructure.broker.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.signalbridge.domain.order.OpenOrder;
import in.signalbridge.domain.order.OrderRequest;
import in.signalbridge.domain.order.OrderResponse;
import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.MarketMode;
import in.signalbridge.infrastructure.broker.common.TokenRefreshManager;
import in.signalbridge.infrastructure.broker.common.TokenRefreshManager.TokenInfo;
import in.signalbridge.infrastructure.broker.common.TokenRefreshManager.TokenRefreshException;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * SimpleFX Order Broker.
 *
 * REST endpoints used:
 * - POST /auth/key              client credentials → bearer token (valid one hour)
 * - POST /trading/orders/market open a market order with TP/SL
 * - POST /trading/orders/active list open positions of an account
 *
 * Two credential sets are supported. Accounts listed in {@code secondaryAccounts}
 * authenticate with the secondary key pair, all others with the primary one.
 *
 * A 401 response triggers one forced token refresh and a single resend.
 */
public class SimpleFxOrderBroker implements OrderBroker {
    private static final Logger log = LoggerFactory.getLogger(SimpleFxOrderBroker.class);

    public static final String BROKER_CODE = "SIMPLEFX";
    private static final Duration TOKEN_TTL = Duration.ofHours(1);
    private static final String ACTIVITY = "Signal Bridge Order";
    private static final int OPEN_ORDERS_PAGE_SIZE = 100;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String baseUrl;
    private final TokenRefreshManager primaryTokens;
    private final TokenRefreshManager secondaryTokens;
    private final Set<String> secondaryAccounts;
    private final PipelineMetrics metrics;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    /**
     * @param secondaryTokens token manager for the secondary key pair (nullable)
     * @param metrics metrics collector (nullable)
     */
    public SimpleFxOrderBroker(
        String baseUrl,
        TokenRefreshManager primaryTokens,
        TokenRefreshManager secondaryTokens,
        Set<String> secondaryAccounts,
        PipelineMetrics metrics,
        Duration requestTimeout,
        HttpClient httpClient
    ) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.primaryTokens = primaryTokens;
        this.secondaryTokens = secondaryTokens;
        this.secondaryAccounts = secondaryAccounts == null ? Set.of() : Set.copyOf(secondaryAccounts);
        this.metrics = metrics;
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
    }

    /**
     * Token fetcher for {@link TokenRefreshManager}: exchanges client credentials at /auth/key.
     */
    public static Supplier<TokenInfo> tokenFetcher(HttpClient httpClient, String baseUrl,
                                                   String clientId, String clientSecret,
                                                   PipelineMetrics metrics) {
        return () -> {
            try {
                ObjectNode body = objectMapper.createObjectNode();
                body.put("clientId", clientId);
                body.put("clientSecret", clientSecret);

                HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/auth/key"))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .timeout(Duration.ofSeconds(10))
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() != 200) {
                    log.error("[SIMPLEFX_AUTH] Token request HTTP {}", response.statusCode());
                    recordAuthentication(metrics, false);
                    throw new TokenRefreshException(BROKER_CODE, maskKey(clientId),
                        "Token request failed with HTTP " + response.statusCode());
                }

                String token = objectMapper.readTree(response.body()).path("data").path("token").asText("");
                if (token.isEmpty()) {
                    recordAuthentication(metrics, false);
                    throw new TokenRefreshException(BROKER_CODE, maskKey(clientId), "Token missing in response");
                }
                recordAuthentication(metrics, true);
                return new TokenInfo(token, Instant.now().plus(TOKEN_TTL));

            } catch (IOException e) {
                recordAuthentication(metrics, false);
                throw new TokenRefreshException(BROKER_CODE, maskKey(clientId), "Token request failed", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TokenRefreshException(BROKER_CODE, maskKey(clientId), "Token request interrupted", e);
            }
        };
    }

    @Override
    public String getBrokerCode() {
        return BROKER_CODE;
    }

    @Override
    public CompletableFuture<OrderResponse> placeOrder(OrderRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            Instant startTime = Instant.now();

            ObjectNode body = objectMapper.createObjectNode();
            body.put("Reality", request.marketMode().brokerReality());
            putLogin(body, "Login", request.accountId());
            body.put("Symbol", request.instrument());
            body.put("Side", request.direction().name());
            body.put("Volume", request.size());
            body.put("TakeProfit", request.takeProfit());
            if (request.stopLoss() != null) {
                body.put("StopLoss", request.stopLoss());
            } else {
                body.putNull("StopLoss");
            }
            body.put("IsFIFO", false);
            body.put("RequestId", request.clientRequestId());
            body.put("Activity", ACTIVITY);

            log.info("[SIMPLEFX_ORDER] Placing order: account={} {} {} size={} tp={} sl={} requestId={}",
                request.accountId(), request.direction(), request.instrument(), request.size(),
                request.takeProfit(), request.stopLoss(), request.clientRequestId());

            HttpResponse<String> response;
            try {
                response = postWithAuth(request.accountId(), "/trading/orders/market", body);
            } catch (TokenRefreshException e) {
                recordOrder(false, startTime);
                throw new OrderPlacementException(BROKER_CODE, request.accountId(), request,
                    "Authentication failed: " + e.getMessage(), true, e);
            } catch (IOException e) {
                recordOrder(false, startTime);
                throw new OrderPlacementException(BROKER_CODE, request.accountId(), request,
                    "Network error: " + e.getMessage(), true, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                recordOrder(false, startTime);
                throw new OrderPlacementException(BROKER_CODE, request.accountId(), request,
                    "Interrupted while waiting for broker", true, e);
            }

            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                recordOrder(false, startTime);
                boolean retryable = isRetryableStatus(status);
                String message = brokerMessage(response.body());
                log.error("[SIMPLEFX_ORDER] Order placement HTTP {} (retryable={}): {}", status, retryable, message);
                throw new OrderPlacementException(BROKER_CODE, request.accountId(), request,
                    "HTTP " + status + ": " + message, retryable, status);
            }

            JsonNode order;
            try {
                order = objectMapper.readTree(response.body())
                    .path("data").path("marketOrders").path(0).path("order");
            } catch (IOException e) {
                recordOrder(false, startTime);
                // The broker accepted the call; the order may exist, so this is not retryable
                throw new OrderPlacementException(BROKER_CODE, request.accountId(), request,
                    "Unreadable broker response", false, e);
            }
            if (order.isMissingNode() || !order.hasNonNull("id")) {
                recordOrder(false, startTime);
                throw new OrderPlacementException(BROKER_CODE, request.accountId(), request,
                    "No market orders returned", false, status);
            }

            OrderResponse result = new OrderResponse(
                order.path("id").asText(),
                request.instrument(),
                parseSide(order.path("side").asText(null), request.direction()),
                decimalOr(order.path("volume"), request.size()),
                decimalOr(order.path("openPrice"), null),
                decimalOr(order.path("takeProfit"), request.takeProfit()),
                decimalOr(order.path("stopLoss"), request.stopLoss()),
                order.path("openTime").asLong(0) > 0
                    ? Instant.ofEpochMilli(order.path("openTime").asLong())
                    : Instant.now()
            );

            recordOrder(true, startTime);
            log.info("[SIMPLEFX_ORDER] Order placed: id={} account={} {} {} @ {}",
                result.orderId(), request.accountId(), result.direction(), result.instrument(), result.openPrice());
            return result;
        });
    }

    @Override
    public CompletableFuture<List<OpenOrder>> getOpenOrders(String accountId, MarketMode marketMode) {
        return CompletableFuture.supplyAsync(() -> {
            ObjectNode body = objectMapper.createObjectNode();
            putLogin(body, "login", accountId);
            body.put("reality", marketMode.brokerReality());
            body.put("page", 1);
            body.put("limit", OPEN_ORDERS_PAGE_SIZE);

            HttpResponse<String> response;
            try {
                response = postWithAuth(accountId, "/trading/orders/active", body);
            } catch (TokenRefreshException e) {
                throw new BrokerQueryException(BROKER_CODE, accountId, "Authentication failed", e);
            } catch (IOException e) {
                throw new BrokerQueryException(BROKER_CODE, accountId, "Open orders request failed", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerQueryException(BROKER_CODE, accountId, "Interrupted", e);
            }

            if (response.statusCode() != 200) {
                throw new BrokerQueryException(BROKER_CODE, accountId,
                    "Open orders HTTP " + response.statusCode() + ": " + brokerMessage(response.body()));
            }

            List<OpenOrder> orders = new ArrayList<>();
            try {
                JsonNode marketOrders = objectMapper.readTree(response.body()).path("data").path("marketOrders");
                for (JsonNode node : marketOrders) {
                    String side = node.path("side").asText("");
                    if (side.isEmpty()) {
                        continue;
                    }
                    orders.add(new OpenOrder(
                        node.path("id").asText(),
                        node.path("symbol").asText(),
                        Direction.fromCode(side),
                        decimalOr(node.path("volume"), BigDecimal.ZERO)));
                }
            } catch (IOException e) {
                throw new BrokerQueryException(BROKER_CODE, accountId, "Unreadable open orders response", e);
            }
            log.debug("[SIMPLEFX_ORDER] Account {} has {} open orders", accountId, orders.size());
            return orders;
        });
    }

    private HttpResponse<String> postWithAuth(String accountId, String path, ObjectNode body)
            throws IOException, InterruptedException {
        TokenRefreshManager tokens = tokensFor(accountId);
        String payload = objectMapper.writeValueAsString(body);

        HttpResponse<String> response = send(path, payload, tokens.getToken());
        if (response.statusCode() == 401) {
            log.warn("[SIMPLEFX_ORDER] 401 on {} for account {}, refreshing token and retrying once", path, accountId);
            response = send(path, payload, tokens.forceRefresh());
        }
        return response;
    }

    private HttpResponse<String> send(String path, String payload, String token)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .header("Authorization", "Bearer " + token)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    TokenRefreshManager tokensFor(String accountId) {
        if (secondaryTokens != null && secondaryAccounts.contains(accountId)) {
            return secondaryTokens;
        }
        return primaryTokens;
    }

    static boolean isRetryableStatus(int status) {
        return status == 401 || status == 408 || status == 429 || status >= 500;
    }

    private static void putLogin(ObjectNode body, String field, String accountId) {
        try {
            body.put(field, Long.parseLong(accountId));
        } catch (NumberFormatException e) {
            body.put(field, accountId);
        }
    }

    private static Direction parseSide(String side, Direction fallback) {
        if (side == null || side.isBlank()) {
            return fallback;
        }
        try {
            return Direction.fromCode(side);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private static BigDecimal decimalOr(JsonNode node, BigDecimal fallback) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText());
    }

    private static String brokerMessage(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json.hasNonNull("message")) {
                return json.get("message").asText();
            }
        } catch (IOException e) {
            log.debug("[SIMPLEFX_ORDER] Non-JSON error body");
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private static String maskKey(String key) {
        if (key == null || key.length() <= 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }

    private void recordOrder(boolean success, Instant startTime) {
        if (metrics != null) {
            metrics.recordOrderPlacement(BROKER_CODE, success, Duration.between(startTime, Instant.now()));
        }
    }

    private static void recordAuthentication(PipelineMetrics metrics, boolean success) {
        if (metrics != null) {
            metrics.recordAuthentication(BROKER_CODE, success);
        }
    }
}
