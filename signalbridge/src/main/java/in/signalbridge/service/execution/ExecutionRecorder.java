package in.signalbridge.service.execution;

import in.signalbridge.application.port.output.ExecutionRecordRepository;
import in.signalbridge.domain.execution.ExecutionRecord;
import in.signalbridge.domain.execution.RejectionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Writes execution and rejection records off the execution thread.
 *
 * Persistence failures never affect an order that was already placed; they are
 * logged and dropped.
 */
public final class ExecutionRecorder {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRecorder.class);

    private final ExecutionRecordRepository repository;
    private final Executor executor;

    public ExecutionRecorder(ExecutionRecordRepository repository, Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    public void recordExecution(ExecutionRecord record) {
        submit("execution " + record.orderId(), () -> repository.recordExecution(record));
    }

    public void recordRejection(RejectionRecord rejection) {
        submit("rejection of " + rejection.signalId(), () -> repository.recordRejection(rejection));
    }

    private void submit(String what, Runnable write) {
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.error("[EXECUTION] Failed to persist {}: {}", what, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("[EXECUTION] Recorder closed, {} not persisted", what);
        }
    }
}
