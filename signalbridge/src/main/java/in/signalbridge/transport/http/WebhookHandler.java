package in.signalbridge.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.signalbridge.domain.signal.Signal;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import in.signalbridge.service.signal.EnqueueResult;
import in.signalbridge.service.signal.SignalIntakeService;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /webhook
 *
 * Parses the alert, hands it to intake and answers immediately; execution
 * happens on the queue's workers. Any well-formed alert gets 200 with
 * {@code accepted}, {@code jobId} or {@code reason}. Malformed bodies get 400.
 */
public final class WebhookHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(WebhookHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SignalPayloadMapper payloadMapper;
    private final SignalIntakeService intake;
    private final PipelineMetrics metrics;

    public WebhookHandler(SignalPayloadMapper payloadMapper, SignalIntakeService intake, PipelineMetrics metrics) {
        this.payloadMapper = payloadMapper;
        this.intake = intake;
        this.metrics = metrics;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        // Intake may hit the database; keep it off the IO thread
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            Signal signal;
            try {
                signal = payloadMapper.map(body);
            } catch (SignalPayloadMapper.InvalidPayloadException e) {
                log.warn("[WEBHOOK] Rejected payload: {}", e.getMessage());
                metrics.recordSignalReceived("invalid");
                sendJson(exch, StatusCodes.BAD_REQUEST, Map.of("accepted", false, "error", e.getMessage()));
                return;
            }

            try {
                EnqueueResult result = intake.submit(signal);
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("accepted", result.accepted());
                response.put("signalId", signal.signalId());
                response.put("account", signal.accountId());
                if (result.jobId() != null) {
                    response.put("jobId", result.jobId());
                }
                if (result.reason() != null) {
                    response.put("reason", result.reason());
                }
                sendJson(exch, StatusCodes.OK, response);
            } catch (Exception e) {
                log.error("[WEBHOOK] Failed to queue signal {}: {}", signal.signalId(), e.getMessage(), e);
                sendJson(exch, StatusCodes.INTERNAL_SERVER_ERROR,
                    Map.of("accepted", false, "error", "Failed to queue signal: " + e.getMessage()));
            }
        }, StandardCharsets.UTF_8);
    }

    private static void sendJson(HttpServerExchange exchange, int status, Map<String, Object> body) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (Exception e) {
            log.error("[WEBHOOK] Failed to serialize response: {}", e.getMessage(), e);
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            json = "{\"accepted\":false}";
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }
}
