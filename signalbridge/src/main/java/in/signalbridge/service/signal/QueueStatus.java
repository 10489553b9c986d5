package in.signalbridge.service.signal;

public record QueueStatus(
    int queueLength,
    boolean processing,
    int inFlight,
    int awaitingRetry,
    int trackedJobs,
    long processedCount
) {}
