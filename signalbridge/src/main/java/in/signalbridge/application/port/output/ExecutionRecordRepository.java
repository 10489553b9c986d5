package in.signalbridge.application.port.output;

import in.signalbridge.domain.execution.ExecutionRecord;
import in.signalbridge.domain.execution.RejectionRecord;

import java.util.List;

/**
 * Repository for execution_records and signal_rejections.
 */
public interface ExecutionRecordRepository {

    void recordExecution(ExecutionRecord record);

    void recordRejection(RejectionRecord rejection);

    /**
     * Latest executions for an account, newest first.
     */
    List<ExecutionRecord> findRecentExecutions(String accountId, int limit);
}
