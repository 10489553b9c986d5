package in.signalbridge.bootstrap;

import in.signalbridge.domain.account.TradingSession;
import in.signalbridge.infrastructure.common.BackoffPolicy;
import in.signalbridge.infrastructure.marketdata.SimpleFxQuoteTransport;
import in.signalbridge.service.execution.ExecutionOrchestrator;
import in.signalbridge.service.marketdata.QuoteCache;
import in.signalbridge.service.signal.IdempotencyStore;
import in.signalbridge.service.signal.SignalQueue;
import in.signalbridge.util.Env;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Process configuration, read once at startup from the environment.
 *
 * Durations are given in milliseconds ({@code *_MS}).
 */
public record PipelineConfig(
    int port,

    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,

    String brokerBaseUrl,
    String primaryClientId,
    String primaryClientSecret,
    String secondaryClientId,
    String secondaryClientSecret,
    Set<String> secondaryAccounts,
    Duration brokerRequestTimeout,

    String quoteUrl,
    Duration quoteFreshness,
    Duration quoteIdleTimeout,
    Duration quoteConnectTimeout,
    Duration quoteReaperInterval,
    int quoteConnectAttempts,

    Duration quoteTimeout,
    Duration brokerTimeout,
    int placementAttempts,
    Duration placementBaseDelay,
    ZoneId sessionZone,

    Duration duplicateWindow,
    int workerThreads,
    int maxQueueRetries,
    Duration queueRetryBaseDelay,

    Duration idempotencyRetention,
    int idempotencyMaxRecords,
    int idempotencyKeepRecords,
    Duration idempotencySweepInterval,

    String defaultAccountId,
    int recorderThreads
) {

    public static PipelineConfig fromEnv() {
        return new PipelineConfig(
            Env.getInt("PORT", 8080),

            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/signalbridge"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10),

            Env.get("SIMPLEFX_API_URL", "https://rest.simplefx.com/api/v3"),
            Env.get("SIMPLEFX_API_KEY", null),
            Env.get("SIMPLEFX_API_SECRET", null),
            Env.get("SIMPLEFX_API_KEY2", null),
            Env.get("SIMPLEFX_API_SECRET2", null),
            parseList(Env.get("SIMPLEFX_SECONDARY_ACCOUNTS", "")),
            Env.getMillis("BROKER_REQUEST_TIMEOUT_MS", Duration.ofSeconds(15)),

            Env.get("QUOTES_WS_URL", SimpleFxQuoteTransport.DEFAULT_URL),
            Env.getMillis("QUOTE_FRESHNESS_MS", Duration.ofSeconds(10)),
            Env.getMillis("QUOTE_IDLE_TIMEOUT_MS", Duration.ofSeconds(30)),
            Env.getMillis("QUOTE_CONNECT_TIMEOUT_MS", Duration.ofSeconds(10)),
            Env.getMillis("QUOTE_REAPER_INTERVAL_MS", Duration.ofSeconds(5)),
            Env.getInt("QUOTE_CONNECT_ATTEMPTS", 3),

            Env.getMillis("QUOTE_TIMEOUT_MS", Duration.ofSeconds(8)),
            Env.getMillis("BROKER_TIMEOUT_MS", Duration.ofSeconds(30)),
            Env.getInt("ORDER_ATTEMPTS", 3),
            Env.getMillis("ORDER_RETRY_BASE_MS", Duration.ofSeconds(2)),
            ZoneId.of(Env.get("SESSION_ZONE", TradingSession.DEFAULT_ZONE.getId())),

            Env.getMillis("DUPLICATE_WINDOW_MS", Duration.ofSeconds(30)),
            Env.getInt("QUEUE_WORKERS", 4),
            Env.getInt("QUEUE_MAX_RETRIES", 3),
            Env.getMillis("QUEUE_RETRY_BASE_MS", Duration.ofSeconds(2)),

            Env.getMillis("IDEMPOTENCY_RETENTION_MS", Duration.ofHours(24)),
            Env.getInt("IDEMPOTENCY_MAX_RECORDS", 1000),
            Env.getInt("IDEMPOTENCY_KEEP_RECORDS", 500),
            Env.getMillis("IDEMPOTENCY_SWEEP_INTERVAL_MS", Duration.ofMinutes(5)),

            Env.get("DEFAULT_ACCOUNT", null),
            Env.getInt("RECORDER_THREADS", 2)
        );
    }

    public boolean hasSecondaryCredentials() {
        return secondaryClientId != null && secondaryClientSecret != null;
    }

    public QuoteCache.Settings quoteCacheSettings() {
        BackoffPolicy connectBackoff = BackoffPolicy.builder()
            .mode(BackoffPolicy.Mode.LINEAR)
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(10))
            .maxAttempts(quoteConnectAttempts)
            .build();
        return new QuoteCache.Settings(quoteFreshness, quoteIdleTimeout, quoteConnectTimeout,
            quoteReaperInterval, connectBackoff);
    }

    public ExecutionOrchestrator.Settings orchestratorSettings() {
        BackoffPolicy placementBackoff = BackoffPolicy.builder()
            .mode(BackoffPolicy.Mode.LINEAR)
            .initialDelay(placementBaseDelay)
            .maxDelay(placementBaseDelay.multipliedBy(Math.max(1, placementAttempts)))
            .maxAttempts(placementAttempts)
            .build();
        return new ExecutionOrchestrator.Settings(quoteTimeout, brokerTimeout, placementBackoff, sessionZone);
    }

    public SignalQueue.Settings queueSettings() {
        BackoffPolicy retryBackoff = BackoffPolicy.builder()
            .mode(BackoffPolicy.Mode.EXPONENTIAL)
            .initialDelay(queueRetryBaseDelay)
            .multiplier(2.0)
            .maxDelay(Duration.ofMinutes(1))
            .maxAttempts(maxQueueRetries)
            .build();
        return new SignalQueue.Settings(duplicateWindow, workerThreads, retryBackoff);
    }

    public IdempotencyStore.Settings idempotencySettings() {
        return new IdempotencyStore.Settings(idempotencyRetention, idempotencyMaxRecords,
            idempotencyKeepRecords, idempotencySweepInterval);
    }

    private static Set<String> parseList(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }
}
