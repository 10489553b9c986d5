package in.signalbridge.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Creates the pipeline tables on startup if they do not exist.
 *
 * - processed_signals: durable idempotency markers
 * - account_settings: per-account trading policy
 * - execution_records: opened orders
 * - signal_rejections: rejected and failed signals
 */
public final class PipelineSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(PipelineSchemaMigration.class);

    private final DataSource dataSource;

    public PipelineSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[SCHEMA MIGRATION] Starting pipeline schema migration");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "processed_signals", """
                CREATE TABLE processed_signals (
                    id BIGSERIAL PRIMARY KEY,
                    signal_id VARCHAR(128) NOT NULL,
                    account_id VARCHAR(64) NOT NULL,
                    processed_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    UNIQUE (signal_id, account_id)
                );
                CREATE INDEX idx_processed_signals_processed_at ON processed_signals (processed_at DESC);
                """);

            createIfMissing(conn, "account_settings", """
                CREATE TABLE account_settings (
                    account_id VARCHAR(64) PRIMARY KEY,
                    trading_mode VARCHAR(16) NOT NULL DEFAULT 'NORMAL',
                    exclusive_mode BOOLEAN NOT NULL DEFAULT FALSE,
                    asia_session BOOLEAN NOT NULL DEFAULT TRUE,
                    london_session BOOLEAN NOT NULL DEFAULT TRUE,
                    new_york_session BOOLEAN NOT NULL DEFAULT TRUE,
                    limbo_session BOOLEAN NOT NULL DEFAULT TRUE,
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                );
                """);

            createIfMissing(conn, "execution_records", """
                CREATE TABLE execution_records (
                    order_id VARCHAR(64) PRIMARY KEY,
                    signal_id VARCHAR(128) NOT NULL,
                    account_id VARCHAR(64) NOT NULL,
                    market_mode VARCHAR(8) NOT NULL,
                    instrument VARCHAR(32) NOT NULL,
                    direction VARCHAR(8) NOT NULL,
                    size NUMERIC(18, 4) NOT NULL,
                    entry_price NUMERIC(18, 6) NOT NULL,
                    take_profit_price NUMERIC(18, 6),
                    stop_loss_price NUMERIC(18, 6),
                    bid_at_open NUMERIC(18, 6),
                    ask_at_open NUMERIC(18, 6),
                    spread_at_open NUMERIC(12, 2),
                    requested_tp_distance NUMERIC(12, 2),
                    requested_sl_distance NUMERIC(12, 2),
                    timeframe VARCHAR(16),
                    attempts INT NOT NULL DEFAULT 1,
                    opened_at TIMESTAMPTZ NOT NULL,
                    close_price NUMERIC(18, 6),
                    closed_at TIMESTAMPTZ,
                    duration_minutes BIGINT
                );
                CREATE INDEX idx_execution_records_account ON execution_records (account_id, opened_at DESC);
                """);

            createIfMissing(conn, "signal_rejections", """
                CREATE TABLE signal_rejections (
                    id BIGSERIAL PRIMARY KEY,
                    signal_id VARCHAR(128) NOT NULL,
                    account_id VARCHAR(64) NOT NULL,
                    instrument VARCHAR(32),
                    direction VARCHAR(8),
                    size NUMERIC(18, 4),
                    outcome VARCHAR(32) NOT NULL,
                    reason TEXT,
                    recorded_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                );
                CREATE INDEX idx_signal_rejections_account ON signal_rejections (account_id, recorded_at DESC);
                """);

            log.info("[SCHEMA MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[SCHEMA MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Pipeline schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String ddl) throws Exception {
        if (tableExists(conn, table)) {
            log.info("[SCHEMA MIGRATION] {} table already exists", table);
            return;
        }
        log.info("[SCHEMA MIGRATION] Creating {} table...", table);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
        log.info("[SCHEMA MIGRATION] ✓ {} table created", table);
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
