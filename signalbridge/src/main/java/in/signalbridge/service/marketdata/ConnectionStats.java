package in.signalbridge.service.marketdata;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Snapshot of the market-data connections for monitoring endpoints.
 */
public record ConnectionStats(
    int totalConnections,
    int healthyConnections,
    long totalReconnects,
    List<ConnectionInfo> connections
) {
    public record ConnectionInfo(
        String key,
        String state,
        boolean healthy,
        Set<String> instruments,
        int reconnectCount,
        int quoteCount,
        Instant createdAt,
        Instant lastActivityAt
    ) {}
}
