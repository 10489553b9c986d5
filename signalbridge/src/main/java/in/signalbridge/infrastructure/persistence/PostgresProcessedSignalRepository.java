package in.signalbridge.infrastructure.persistence;

import in.signalbridge.application.port.output.ProcessedSignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of ProcessedSignalRepository.
 *
 * Uniqueness of (signal_id, account_id) is enforced by the table; concurrent
 * inserts of the same pair resolve through ON CONFLICT DO NOTHING.
 */
public final class PostgresProcessedSignalRepository implements ProcessedSignalRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresProcessedSignalRepository.class);

    private final DataSource dataSource;

    public PostgresProcessedSignalRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean exists(String signalId, String accountId) {
        String sql = """
                SELECT 1 FROM processed_signals
                WHERE signal_id = ? AND account_id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, signalId);
            ps.setString(2, accountId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (Exception e) {
            log.error("Failed to check processed signal {} for account {}: {}",
                    signalId, accountId, e.getMessage());
            throw new RuntimeException("Failed to check processed signal", e);
        }
    }

    @Override
    public boolean insert(String signalId, String accountId, Instant processedAt) {
        String sql = """
                INSERT INTO processed_signals (signal_id, account_id, processed_at)
                VALUES (?, ?, ?)
                ON CONFLICT (signal_id, account_id) DO NOTHING
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, signalId);
            ps.setString(2, accountId);
            ps.setTimestamp(3, Timestamp.from(processedAt));
            return ps.executeUpdate() == 1;
        } catch (Exception e) {
            log.error("Failed to insert processed signal {} for account {}: {}",
                    signalId, accountId, e.getMessage());
            throw new RuntimeException("Failed to insert processed signal", e);
        }
    }

    @Override
    public List<ProcessedSignal> findRecent(int limit) {
        String sql = """
                SELECT signal_id, account_id, processed_at
                FROM processed_signals
                ORDER BY processed_at DESC
                LIMIT ?
                """;

        List<ProcessedSignal> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new ProcessedSignal(
                            rs.getString("signal_id"),
                            rs.getString("account_id"),
                            rs.getTimestamp("processed_at").toInstant()));
                }
            }
        } catch (Exception e) {
            log.error("Failed to load recent processed signals: {}", e.getMessage());
            throw new RuntimeException("Failed to load processed signals", e);
        }
        return result;
    }

    @Override
    public long count() {
        String sql = "SELECT COUNT(*) FROM processed_signals";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (Exception e) {
            log.error("Failed to count processed signals: {}", e.getMessage());
            throw new RuntimeException("Failed to count processed signals", e);
        }
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        String sql = "DELETE FROM processed_signals WHERE processed_at < ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to delete processed signals older than {}: {}", cutoff, e.getMessage());
            throw new RuntimeException("Failed to delete processed signals", e);
        }
    }

    @Override
    public int trimToMostRecent(int keep) {
        String sql = """
                DELETE FROM processed_signals
                WHERE id NOT IN (
                    SELECT id FROM processed_signals
                    ORDER BY processed_at DESC
                    LIMIT ?
                )
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, keep);
            return ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to trim processed signals to {}: {}", keep, e.getMessage());
            throw new RuntimeException("Failed to trim processed signals", e);
        }
    }
}
