package in.signalbridge.application.port.output;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the processed_signals table: durable idempotency markers.
 *
 * ENFORCEMENT:
 * - Unique constraint: (signal_id, account_id)
 * - Rows are written only after an order was opened
 */
public interface ProcessedSignalRepository {

    /**
     * @return true if (signalId, accountId) has been recorded
     */
    boolean exists(String signalId, String accountId);

    /**
     * Insert a marker. Inserting an existing pair is a no-op.
     *
     * @return true if a new row was written
     */
    boolean insert(String signalId, String accountId, Instant processedAt);

    /**
     * Most recent markers first, used to rebuild the in-memory mirror.
     */
    List<ProcessedSignal> findRecent(int limit);

    long count();

    /**
     * @return number of rows deleted
     */
    int deleteOlderThan(Instant cutoff);

    /**
     * Delete everything except the {@code keep} most recent rows.
     *
     * @return number of rows deleted
     */
    int trimToMostRecent(int keep);

    record ProcessedSignal(String signalId, String accountId, Instant processedAt) {}
}
