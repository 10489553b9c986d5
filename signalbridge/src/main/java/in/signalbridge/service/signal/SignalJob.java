package in.signalbridge.service.signal;

import in.signalbridge.domain.signal.Signal;

import java.time.Instant;

/**
 * A queued signal. The job id and enqueue time survive retries.
 */
public record SignalJob(String jobId, Signal signal, Instant enqueuedAt, int retries) {

    public static SignalJob of(Signal signal, Instant enqueuedAt) {
        String jobId = signal.signalId() + "_" + signal.accountId() + "_" + enqueuedAt.toEpochMilli();
        return new SignalJob(jobId, signal, enqueuedAt, 0);
    }

    public SignalJob withRetry() {
        return new SignalJob(jobId, signal, enqueuedAt, retries + 1);
    }
}
