package in.signalbridge.service.signal;

import in.signalbridge.domain.execution.ExecutionResult;
import in.signalbridge.domain.signal.Signal;
import in.signalbridge.service.execution.ExecutionOrchestrator;

/**
 * Queue processor that runs each signal through the orchestrator under its
 * account's lock.
 */
public final class SignalExecutionProcessor implements SignalQueue.Processor {

    private final AccountSerializer serializer;
    private final ExecutionOrchestrator orchestrator;

    public SignalExecutionProcessor(AccountSerializer serializer, ExecutionOrchestrator orchestrator) {
        this.serializer = serializer;
        this.orchestrator = orchestrator;
    }

    @Override
    public ExecutionResult process(Signal signal) {
        return serializer.withAccountLock(signal.accountId(), () -> orchestrator.execute(signal));
    }
}
