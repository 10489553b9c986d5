package in.signalbridge.domain.account;

import in.signalbridge.domain.signal.Direction;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-account trading configuration. Read-only from the execution path.
 */
public record AccountTradingPolicy(
    String accountId,
    TradingMode tradingMode,
    boolean exclusiveMode,
    Set<TradingSession> enabledSessions,
    Instant updatedAt
) {
    public AccountTradingPolicy {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId cannot be blank");
        }
        if (tradingMode == null) {
            tradingMode = TradingMode.NORMAL;
        }
        enabledSessions = enabledSessions == null || enabledSessions.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(enabledSessions));
    }

    /**
     * Policy applied to accounts without stored settings: both directions,
     * no exclusive mode, every session enabled.
     */
    public static AccountTradingPolicy defaults(String accountId) {
        return new AccountTradingPolicy(accountId, TradingMode.NORMAL, false,
            EnumSet.allOf(TradingSession.class), null);
    }

    public boolean allows(Direction direction) {
        return tradingMode.allows(direction);
    }

    public boolean isSessionEnabled(TradingSession session) {
        return enabledSessions.contains(session);
    }

    public AccountTradingPolicy withTradingMode(TradingMode mode) {
        return new AccountTradingPolicy(accountId, mode, exclusiveMode, enabledSessions, Instant.now());
    }

    public AccountTradingPolicy withExclusiveMode(boolean exclusive) {
        return new AccountTradingPolicy(accountId, tradingMode, exclusive, enabledSessions, Instant.now());
    }

    public AccountTradingPolicy withSession(TradingSession session, boolean enabled) {
        EnumSet<TradingSession> sessions = enabledSessions.isEmpty()
            ? EnumSet.noneOf(TradingSession.class)
            : EnumSet.copyOf(enabledSessions);
        if (enabled) {
            sessions.add(session);
        } else {
            sessions.remove(session);
        }
        return new AccountTradingPolicy(accountId, tradingMode, exclusiveMode, sessions, Instant.now());
    }
}
