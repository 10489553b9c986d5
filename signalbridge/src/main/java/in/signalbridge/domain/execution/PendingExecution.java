package in.signalbridge.domain.execution;

import in.signalbridge.domain.signal.Direction;

import java.time.Instant;

/**
 * Marker for "(accountId, direction) is currently being acted upon".
 */
public record PendingExecution(String accountId, Direction direction, String signalId, Instant startedAt) {

    public String key() {
        return key(accountId, direction);
    }

    public static String key(String accountId, Direction direction) {
        return accountId + ":" + direction;
    }
}
