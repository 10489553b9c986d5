package in.signalbridge.infrastructure.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.signalbridge.domain.market.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket transport for the SimpleFX quotes feed.
 *
 * Outbound:
 * <pre>
 * {"p":"/subscribe/addList","i":1,"d":["EURUSD"]}
 * {"p":"/lastprices/list","i":2,"d":["EURUSD"]}
 * </pre>
 * Inbound quote messages have {@code p} = "/quotes/subscribed" or "/lastprices/list"
 * and carry {@code d[0] = {"s":symbol,"b":bid,"a":ask,"t":timestamp}}. Timestamps
 * below 10^12 are in seconds.
 */
public final class SimpleFxQuoteTransport implements MarketDataTransport {
    private static final Logger log = LoggerFactory.getLogger(SimpleFxQuoteTransport.class);

    public static final String DEFAULT_URL = "wss://web-quotes-core.simplefx.com/websocket/quotes";

    static final String PATH_SUBSCRIBE = "/subscribe/addList";
    static final String PATH_LAST_PRICES = "/lastprices/list";
    static final String PATH_QUOTES = "/quotes/subscribed";

    private static final long SECONDS_THRESHOLD = 1_000_000_000_000L;
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String url;
    private final Duration connectTimeout;
    private final HttpClient httpClient;

    public SimpleFxQuoteTransport(String url, Duration connectTimeout) {
        this.url = url;
        this.connectTimeout = connectTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    @Override
    public CompletableFuture<MarketDataChannel> open(MarketDataChannel.Listener listener) {
        log.info("[QUOTE_FEED] Connecting to {}", url);

        return httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(URI.create(url), new WebSocket.Listener() {
                private final StringBuilder buf = new StringBuilder();

                @Override
                public void onOpen(WebSocket webSocket) {
                    log.info("[QUOTE_FEED] ✅ Connected");
                    webSocket.request(1);
                }

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    buf.append(data);
                    if (last) {
                        String msg = buf.toString();
                        buf.setLength(0);
                        parseQuoteMessage(msg).ifPresent(listener::onQuote);
                    }
                    webSocket.request(1);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                    log.warn("[QUOTE_FEED] Disconnected: {} {}", statusCode, reason);
                    listener.onClosed(statusCode, reason);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public void onError(WebSocket webSocket, Throwable error) {
                    log.error("[QUOTE_FEED] WebSocket error: {}", error.getMessage());
                    listener.onError(error);
                }
            })
            .thenApply(WebSocketChannel::new);
    }

    /**
     * Parse an inbound frame. Frames that are not quote updates, or are malformed,
     * yield empty.
     */
    static Optional<Quote> parseQuoteMessage(String message) {
        try {
            JsonNode root = objectMapper.readTree(message);
            String path = root.path("p").asText("");
            if (!PATH_QUOTES.equals(path) && !PATH_LAST_PRICES.equals(path)) {
                return Optional.empty();
            }
            JsonNode data = root.path("d").path(0);
            if (!data.hasNonNull("s") || !data.hasNonNull("b") || !data.hasNonNull("a")) {
                return Optional.empty();
            }
            long t = data.path("t").asLong(0);
            Instant observedAt = t <= 0
                ? Instant.EPOCH
                : Instant.ofEpochMilli(t < SECONDS_THRESHOLD ? t * 1000 : t);
            return Optional.of(new Quote(
                data.get("s").asText().toUpperCase(),
                new BigDecimal(data.get("b").asText()),
                new BigDecimal(data.get("a").asText()),
                observedAt));
        } catch (IOException | NumberFormatException e) {
            log.debug("[QUOTE_FEED] Ignoring unparseable frame: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String buildRequest(String path, long requestId, String instrument) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("p", path);
        node.put("i", requestId);
        node.putArray("d").add(instrument);
        return node.toString();
    }

    /**
     * Channel over an open WebSocket. Sends are serialized because the JDK
     * WebSocket rejects a send while the previous one is still pending.
     */
    private static final class WebSocketChannel implements MarketDataChannel {
        private final WebSocket webSocket;

        WebSocketChannel(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public void subscribe(String instrument, long requestId) {
            send(buildRequest(PATH_SUBSCRIBE, requestId, instrument));
        }

        @Override
        public void requestLastPrice(String instrument, long requestId) {
            send(buildRequest(PATH_LAST_PRICES, requestId, instrument));
        }

        @Override
        public boolean isOpen() {
            return !webSocket.isOutputClosed() && !webSocket.isInputClosed();
        }

        @Override
        public void close() {
            if (!webSocket.isOutputClosed()) {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
            }
        }

        private synchronized void send(String text) {
            try {
                webSocket.sendText(text, true).get(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while sending to quote feed", e);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to send to quote feed: " + e.getMessage(), e);
            }
        }
    }
}
