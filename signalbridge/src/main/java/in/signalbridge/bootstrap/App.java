package in.signalbridge.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.signalbridge.domain.execution.OutcomeType;
import in.signalbridge.domain.execution.RejectionRecord;
import in.signalbridge.infrastructure.broker.common.TokenRefreshManager;
import in.signalbridge.infrastructure.broker.order.SimpleFxOrderBroker;
import in.signalbridge.infrastructure.marketdata.SimpleFxQuoteTransport;
import in.signalbridge.infrastructure.metrics.PrometheusMetricsHandler;
import in.signalbridge.infrastructure.metrics.PrometheusPipelineMetrics;
import in.signalbridge.infrastructure.persistence.PostgresAccountPolicyRepository;
import in.signalbridge.infrastructure.persistence.PostgresExecutionRecordRepository;
import in.signalbridge.infrastructure.persistence.PostgresProcessedSignalRepository;
import in.signalbridge.migration.PipelineSchemaMigration;
import in.signalbridge.security.SignalAuditLogger;
import in.signalbridge.service.execution.ExecutionOrchestrator;
import in.signalbridge.service.execution.ExecutionRecorder;
import in.signalbridge.service.execution.InstrumentCatalog;
import in.signalbridge.service.execution.PriceLevelCalculator;
import in.signalbridge.service.marketdata.QuoteCache;
import in.signalbridge.service.signal.AccountSerializer;
import in.signalbridge.service.signal.IdempotencyStore;
import in.signalbridge.service.signal.SignalExecutionProcessor;
import in.signalbridge.service.signal.SignalIntakeService;
import in.signalbridge.service.signal.SignalJob;
import in.signalbridge.service.signal.SignalQueue;
import in.signalbridge.transport.http.AccountSettingsHandler;
import in.signalbridge.transport.http.MonitoringHandler;
import in.signalbridge.transport.http.SignalPayloadMapper;
import in.signalbridge.transport.http.WebhookHandler;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Duration TOKEN_REFRESH_MARGIN = Duration.ofMinutes(5);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== SignalBridge Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        PipelineConfig config = PipelineConfig.fromEnv();
        StartupConfigValidator.validate(config);
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new PipelineSchemaMigration(dataSource).migrate();

        PostgresProcessedSignalRepository processedSignalRepo = new PostgresProcessedSignalRepository(dataSource);
        PostgresAccountPolicyRepository policyRepo = new PostgresAccountPolicyRepository(dataSource);
        PostgresExecutionRecordRepository executionRepo = new PostgresExecutionRecordRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusPipelineMetrics metrics = new PrometheusPipelineMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Broker (SimpleFX REST)
        // ═══════════════════════════════════════════════════════════════
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

        TokenRefreshManager primaryTokens = new TokenRefreshManager(
            SimpleFxOrderBroker.BROKER_CODE, "primary",
            SimpleFxOrderBroker.tokenFetcher(httpClient, config.brokerBaseUrl(),
                config.primaryClientId(), config.primaryClientSecret(), metrics),
            TOKEN_REFRESH_MARGIN);

        TokenRefreshManager secondaryTokens = null;
        if (config.hasSecondaryCredentials()) {
            secondaryTokens = new TokenRefreshManager(
                SimpleFxOrderBroker.BROKER_CODE, "secondary",
                SimpleFxOrderBroker.tokenFetcher(httpClient, config.brokerBaseUrl(),
                    config.secondaryClientId(), config.secondaryClientSecret(), metrics),
                TOKEN_REFRESH_MARGIN);
        }

        SimpleFxOrderBroker broker = new SimpleFxOrderBroker(
            config.brokerBaseUrl(), primaryTokens, secondaryTokens, config.secondaryAccounts(),
            metrics, config.brokerRequestTimeout(), httpClient);
        log.info("✓ Broker {} at {}", broker.getBrokerCode(), config.brokerBaseUrl());

        // ═══════════════════════════════════════════════════════════════
        // Market Data (quote cache over the SimpleFX quotes socket)
        // ═══════════════════════════════════════════════════════════════
        QuoteCache quoteCache = new QuoteCache(
            new SimpleFxQuoteTransport(config.quoteUrl(), config.quoteConnectTimeout()),
            config.quoteCacheSettings(), metrics, clock);
        quoteCache.start();

        // ═══════════════════════════════════════════════════════════════
        // Signal Pipeline
        // ═══════════════════════════════════════════════════════════════
        IdempotencyStore idempotencyStore = new IdempotencyStore(
            processedSignalRepo, config.idempotencySettings(), metrics, clock);
        idempotencyStore.start();

        AccountSerializer serializer = new AccountSerializer(clock);
        SignalAuditLogger audit = new SignalAuditLogger();

        ExecutorService recorderPool = Executors.newFixedThreadPool(config.recorderThreads(), daemonThreads("execution-recorder"));
        ExecutionRecorder recorder = new ExecutionRecorder(executionRepo, recorderPool);

        ExecutionOrchestrator orchestrator = new ExecutionOrchestrator(
            idempotencyStore,
            serializer,
            policyRepo,
            quoteCache,
            broker,
            new InstrumentCatalog(),
            new PriceLevelCalculator(),
            recorder,
            audit,
            metrics,
            config.orchestratorSettings(),
            clock);

        SignalQueue queue = new SignalQueue(
            new SignalExecutionProcessor(serializer, orchestrator), config.queueSettings(), metrics, clock);
        queue.addListener(new SignalQueue.Listener() {
            @Override
            public void onJobFailed(SignalJob job, String reason) {
                audit.logRejected(job.signal(), OutcomeType.TERMINAL_FAILURE, reason);
                recorder.recordRejection(
                    RejectionRecord.of(job.signal(), OutcomeType.TERMINAL_FAILURE, reason, clock.instant()));
            }
        });
        queue.start();

        SignalIntakeService intake = new SignalIntakeService(idempotencyStore, queue, audit, metrics);

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        WebhookHandler webhookHandler = new WebhookHandler(
            new SignalPayloadMapper(config.defaultAccountId(), clock), intake, metrics);
        MonitoringHandler monitoringHandler = new MonitoringHandler(queue, serializer, quoteCache);
        AccountSettingsHandler accountSettingsHandler = new AccountSettingsHandler(policyRepo);

        RoutingHandler routes = new RoutingHandler()
            .post("/webhook", webhookHandler)
            .get("/health", monitoringHandler::getHealth)
            .get("/api/queue-status", monitoringHandler::getQueueStatus)
            .get("/api/quote-connections", monitoringHandler::getQuoteConnections)
            .post("/api/quote-connections", monitoringHandler::openQuoteConnection)
            .get("/api/quotes/{instrument}", monitoringHandler::getQuote)
            .get("/api/account-settings/{accountId}", accountSettingsHandler::getSettings)
            .post("/api/account-settings/{accountId}", accountSettingsHandler::updateSettings)
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "SignalBridge\n\n" +
                    "POST /webhook\n" +
                    "GET  /health, /metrics, /api/queue-status, /api/quote-connections, /api/quotes/{instrument}\n" +
                    "GET/POST /api/account-settings/{accountId}\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down SignalBridge");
            server.stop();
            queue.shutdown();
            idempotencyStore.shutdown();
            quoteCache.shutdown();
            recorderPool.shutdown();
            try {
                if (!recorderPool.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("Execution recorder did not drain within 10s");
                    recorderPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                recorderPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
            dataSource.close();
            log.info("SignalBridge stopped");
        }, "shutdown-hook"));
    }

    private static HikariDataSource createDataSource(PipelineConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("signalbridge-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger ids = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + ids.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
