package in.signalbridge.infrastructure.persistence;

import in.signalbridge.application.port.output.AccountPolicyRepository;
import in.signalbridge.domain.account.AccountTradingPolicy;
import in.signalbridge.domain.account.TradingMode;
import in.signalbridge.domain.account.TradingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumSet;

/**
 * PostgreSQL implementation of AccountPolicyRepository over account_settings.
 *
 * One boolean column per session window, see {@link TradingSession#columnName()}.
 */
public final class PostgresAccountPolicyRepository implements AccountPolicyRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAccountPolicyRepository.class);

    private final DataSource dataSource;

    public PostgresAccountPolicyRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public AccountTradingPolicy getPolicy(String accountId) {
        String sql = """
                SELECT account_id, trading_mode, exclusive_mode,
                       asia_session, london_session, new_york_session, limbo_session,
                       updated_at
                FROM account_settings
                WHERE account_id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, accountId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return mapRow(rs);
                }
            }
        } catch (Exception e) {
            log.error("Failed to load policy for account {}: {}", accountId, e.getMessage());
            throw new RuntimeException("Failed to load account policy", e);
        }
        log.debug("No stored policy for account {}, using defaults", accountId);
        return AccountTradingPolicy.defaults(accountId);
    }

    @Override
    public void upsert(AccountTradingPolicy policy) {
        String sql = """
                INSERT INTO account_settings (account_id, trading_mode, exclusive_mode,
                    asia_session, london_session, new_york_session, limbo_session, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (account_id) DO UPDATE SET
                    trading_mode = EXCLUDED.trading_mode,
                    exclusive_mode = EXCLUDED.exclusive_mode,
                    asia_session = EXCLUDED.asia_session,
                    london_session = EXCLUDED.london_session,
                    new_york_session = EXCLUDED.new_york_session,
                    limbo_session = EXCLUDED.limbo_session,
                    updated_at = EXCLUDED.updated_at
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, policy.accountId());
            ps.setString(2, policy.tradingMode().name());
            ps.setBoolean(3, policy.exclusiveMode());
            ps.setBoolean(4, policy.isSessionEnabled(TradingSession.ASIA));
            ps.setBoolean(5, policy.isSessionEnabled(TradingSession.LONDON));
            ps.setBoolean(6, policy.isSessionEnabled(TradingSession.NEW_YORK));
            ps.setBoolean(7, policy.isSessionEnabled(TradingSession.LIMBO));
            ps.setTimestamp(8, Timestamp.from(policy.updatedAt() != null ? policy.updatedAt() : Instant.now()));
            ps.executeUpdate();
            log.info("Account policy saved: account={}, mode={}, exclusive={}, sessions={}",
                    policy.accountId(), policy.tradingMode(), policy.exclusiveMode(), policy.enabledSessions());
        } catch (Exception e) {
            log.error("Failed to save policy for account {}: {}", policy.accountId(), e.getMessage());
            throw new RuntimeException("Failed to save account policy", e);
        }
    }

    private AccountTradingPolicy mapRow(ResultSet rs) throws Exception {
        EnumSet<TradingSession> sessions = EnumSet.noneOf(TradingSession.class);
        for (TradingSession session : TradingSession.values()) {
            if (rs.getBoolean(session.columnName())) {
                sessions.add(session);
            }
        }
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new AccountTradingPolicy(
                rs.getString("account_id"),
                TradingMode.parse(rs.getString("trading_mode")),
                rs.getBoolean("exclusive_mode"),
                sessions,
                updatedAt != null ? updatedAt.toInstant() : null);
    }
}
