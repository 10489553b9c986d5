package in.signalbridge.infrastructure.persistence;

import in.signalbridge.application.port.output.ExecutionRecordRepository;
import in.signalbridge.domain.execution.ExecutionRecord;
import in.signalbridge.domain.execution.RejectionRecord;
import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.MarketMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of ExecutionRecordRepository.
 *
 * Executions are upserted by order id so a re-delivered confirmation does not
 * create a second row.
 */
public final class PostgresExecutionRecordRepository implements ExecutionRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresExecutionRecordRepository.class);

    private final DataSource dataSource;

    public PostgresExecutionRecordRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void recordExecution(ExecutionRecord record) {
        String sql = """
                INSERT INTO execution_records (
                    order_id, signal_id, account_id, market_mode, instrument, direction, size,
                    entry_price, take_profit_price, stop_loss_price, bid_at_open, ask_at_open,
                    spread_at_open, requested_tp_distance, requested_sl_distance, timeframe,
                    attempts, opened_at, close_price, closed_at, duration_minutes
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (order_id) DO UPDATE SET
                    entry_price = EXCLUDED.entry_price,
                    take_profit_price = EXCLUDED.take_profit_price,
                    stop_loss_price = EXCLUDED.stop_loss_price
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, record.orderId());
            ps.setString(i++, record.signalId());
            ps.setString(i++, record.accountId());
            ps.setString(i++, record.marketMode().name());
            ps.setString(i++, record.instrument());
            ps.setString(i++, record.direction().name());
            ps.setBigDecimal(i++, record.size());
            ps.setBigDecimal(i++, record.entryPrice());
            ps.setBigDecimal(i++, record.takeProfitPrice());
            ps.setBigDecimal(i++, record.stopLossPrice());
            ps.setBigDecimal(i++, record.bidAtOpen());
            ps.setBigDecimal(i++, record.askAtOpen());
            ps.setBigDecimal(i++, record.spreadAtOpen());
            ps.setBigDecimal(i++, record.requestedTakeProfitDistance());
            ps.setBigDecimal(i++, record.requestedStopLossDistance());
            ps.setString(i++, record.timeframe());
            ps.setInt(i++, record.attempts());
            ps.setTimestamp(i++, Timestamp.from(record.openedAt()));
            ps.setBigDecimal(i++, record.closePrice());
            ps.setTimestamp(i++, record.closedAt() != null ? Timestamp.from(record.closedAt()) : null);
            if (record.durationMinutes() != null) {
                ps.setLong(i, record.durationMinutes());
            } else {
                ps.setNull(i, Types.BIGINT);
            }
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to record execution {} for signal {}: {}",
                    record.orderId(), record.signalId(), e.getMessage());
            throw new RuntimeException("Failed to record execution", e);
        }
    }

    @Override
    public void recordRejection(RejectionRecord rejection) {
        String sql = """
                INSERT INTO signal_rejections (
                    signal_id, account_id, instrument, direction, size, outcome, reason, recorded_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, rejection.signalId());
            ps.setString(2, rejection.accountId());
            ps.setString(3, rejection.instrument());
            ps.setString(4, rejection.direction());
            ps.setBigDecimal(5, rejection.size());
            ps.setString(6, rejection.outcome().name());
            ps.setString(7, rejection.reason());
            ps.setTimestamp(8, Timestamp.from(rejection.recordedAt()));
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to record rejection for signal {}: {}", rejection.signalId(), e.getMessage());
            throw new RuntimeException("Failed to record rejection", e);
        }
    }

    @Override
    public List<ExecutionRecord> findRecentExecutions(String accountId, int limit) {
        String sql = """
                SELECT * FROM execution_records
                WHERE account_id = ?
                ORDER BY opened_at DESC
                LIMIT ?
                """;

        List<ExecutionRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, accountId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to load executions for account {}: {}", accountId, e.getMessage());
            throw new RuntimeException("Failed to load executions", e);
        }
        return records;
    }

    private ExecutionRecord mapRow(ResultSet rs) throws Exception {
        Timestamp closedAt = rs.getTimestamp("closed_at");
        long duration = rs.getLong("duration_minutes");
        Long durationMinutes = rs.wasNull() ? null : duration;
        BigDecimal closePrice = rs.getBigDecimal("close_price");
        return new ExecutionRecord(
                rs.getString("order_id"),
                rs.getString("signal_id"),
                rs.getString("account_id"),
                MarketMode.valueOf(rs.getString("market_mode")),
                rs.getString("instrument"),
                Direction.valueOf(rs.getString("direction")),
                rs.getBigDecimal("size"),
                rs.getBigDecimal("entry_price"),
                rs.getBigDecimal("take_profit_price"),
                rs.getBigDecimal("stop_loss_price"),
                rs.getBigDecimal("bid_at_open"),
                rs.getBigDecimal("ask_at_open"),
                rs.getBigDecimal("spread_at_open"),
                rs.getBigDecimal("requested_tp_distance"),
                rs.getBigDecimal("requested_sl_distance"),
                rs.getString("timeframe"),
                rs.getInt("attempts"),
                rs.getTimestamp("opened_at").toInstant(),
                closePrice,
                closedAt != null ? closedAt.toInstant() : null,
                durationMinutes);
    }
}
