package in.signalbridge.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Refuses to start the process with configuration that could only fail later,
 * at order time.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException listing every problem found
     */
    public static void validate(PipelineConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");

        List<String> problems = new ArrayList<>();

        if (isBlank(config.primaryClientId()) || isBlank(config.primaryClientSecret())) {
            problems.add("SIMPLEFX_API_KEY and SIMPLEFX_API_SECRET are required");
        }
        if (!config.secondaryAccounts().isEmpty() && !config.hasSecondaryCredentials()) {
            problems.add("SIMPLEFX_SECONDARY_ACCOUNTS is set but SIMPLEFX_API_KEY2/SIMPLEFX_API_SECRET2 are missing");
        }
        if (isBlank(config.brokerBaseUrl()) || !config.brokerBaseUrl().startsWith("http")) {
            problems.add("SIMPLEFX_API_URL must be an http(s) URL, got " + config.brokerBaseUrl());
        }
        if (isBlank(config.quoteUrl()) || !config.quoteUrl().startsWith("ws")) {
            problems.add("QUOTES_WS_URL must be a ws(s) URL, got " + config.quoteUrl());
        }
        if (config.port() <= 0 || config.port() > 65535) {
            problems.add("PORT out of range: " + config.port());
        }

        positive(problems, "QUOTE_FRESHNESS_MS", config.quoteFreshness());
        positive(problems, "QUOTE_IDLE_TIMEOUT_MS", config.quoteIdleTimeout());
        positive(problems, "QUOTE_CONNECT_TIMEOUT_MS", config.quoteConnectTimeout());
        positive(problems, "QUOTE_REAPER_INTERVAL_MS", config.quoteReaperInterval());
        positive(problems, "QUOTE_TIMEOUT_MS", config.quoteTimeout());
        positive(problems, "BROKER_TIMEOUT_MS", config.brokerTimeout());
        positive(problems, "BROKER_REQUEST_TIMEOUT_MS", config.brokerRequestTimeout());
        positive(problems, "ORDER_RETRY_BASE_MS", config.placementBaseDelay());
        positive(problems, "QUEUE_RETRY_BASE_MS", config.queueRetryBaseDelay());
        positive(problems, "IDEMPOTENCY_RETENTION_MS", config.idempotencyRetention());
        positive(problems, "IDEMPOTENCY_SWEEP_INTERVAL_MS", config.idempotencySweepInterval());

        if (config.queueRetryBaseDelay().compareTo(Duration.ofMinutes(1)) > 0) {
            problems.add("QUEUE_RETRY_BASE_MS cannot exceed one minute");
        }
        if (config.brokerRequestTimeout().compareTo(config.brokerTimeout()) > 0) {
            problems.add("BROKER_REQUEST_TIMEOUT_MS must not exceed BROKER_TIMEOUT_MS");
        }
        if (config.placementAttempts() < 1 || config.quoteConnectAttempts() < 1
            || config.maxQueueRetries() < 1 || config.workerThreads() < 1 || config.recorderThreads() < 1) {
            problems.add("ORDER_ATTEMPTS, QUOTE_CONNECT_ATTEMPTS, QUEUE_MAX_RETRIES, QUEUE_WORKERS and "
                + "RECORDER_THREADS must be at least 1");
        }
        if (config.idempotencyKeepRecords() < 1
            || config.idempotencyKeepRecords() > config.idempotencyMaxRecords()) {
            problems.add("IDEMPOTENCY_KEEP_RECORDS must be between 1 and IDEMPOTENCY_MAX_RECORDS");
        }

        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("INVALID CONFIG: {}", p));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }

        log.info("Startup config validation passed (default account: {}, secondary accounts: {})",
            config.defaultAccountId() != null ? config.defaultAccountId() : "none",
            config.secondaryAccounts().size());
        log.info("════════════════════════════════════════════════════════");
    }

    private static void positive(List<String> problems, String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            problems.add(name + " must be positive");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private StartupConfigValidator() {}
}
