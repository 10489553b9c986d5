package in.signalbridge.service.signal;

import in.signalbridge.domain.execution.ExecutionResult;
import in.signalbridge.domain.signal.Signal;
import in.signalbridge.infrastructure.common.BackoffPolicy;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffers accepted signals and feeds them to a {@link Processor}.
 *
 * One dispatcher thread drains the FIFO into per-account lanes. Each account holds
 * at most one worker at a time, so a backlog on one account never occupies the
 * pool while other accounts wait. The account lock downstream remains the
 * mutual-exclusion boundary.
 *
 * Jobs whose result is retryable are re-queued after an exponential delay until
 * the retry limit is reached, then listeners receive {@link Listener#onJobFailed}.
 * A job stays tracked (for duplicate detection) from enqueue until it completes or
 * is dropped.
 */
public final class SignalQueue {
    private static final Logger log = LoggerFactory.getLogger(SignalQueue.class);

    /**
     * Runs one signal to an outcome. Must not throw; an exception is treated as a
     * transient failure.
     */
    @FunctionalInterface
    public interface Processor {
        ExecutionResult process(Signal signal);
    }

    public interface Listener {
        default void onJobCompleted(SignalJob job, ExecutionResult result) {}

        default void onJobFailed(SignalJob job, String reason) {}
    }

    private final Processor processor;
    private final Settings settings;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final BlockingQueue<SignalJob> pending = new LinkedBlockingQueue<>();
    private final Map<String, SignalJob> tracked = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Object enqueueLock = new Object();

    // account id -> jobs waiting behind that account's running job; guarded by laneLock
    private final Map<String, ArrayDeque<SignalJob>> lanes = new HashMap<>();
    private final Object laneLock = new Object();
    private final AtomicInteger parked = new AtomicInteger();

    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger awaitingRetry = new AtomicInteger();
    private final AtomicLong processedCount = new AtomicLong();

    private final ExecutorService workers;
    private final ScheduledExecutorService retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "signal-queue-retry");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running = false;
    private Thread dispatcher;

    public SignalQueue(Processor processor, Settings settings, PipelineMetrics metrics) {
        this(processor, settings, metrics, Clock.systemUTC());
    }

    public SignalQueue(Processor processor, Settings settings, PipelineMetrics metrics, Clock clock) {
        this.processor = processor;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
            Thread t = new Thread(r, "signal-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public void start() {
        if (running) {
            log.warn("[SIGNAL_QUEUE] Already running");
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "signal-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("[SIGNAL_QUEUE] Started with {} workers, duplicate window {}s, max retries {}",
            settings.workerThreads(), settings.duplicateWindow().toSeconds(),
            settings.retryBackoff().getMaxAttempts());
    }

    public void shutdown() {
        if (!running) {
            return;
        }
        log.info("[SIGNAL_QUEUE] Stopping with {} queued, {} in flight", pending.size(), inFlight.get());
        running = false;
        dispatcher.interrupt();
        retryScheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Accept a signal unless an equivalent one is already queued or in flight.
     */
    public EnqueueResult enqueue(Signal signal) {
        SignalJob job;
        synchronized (enqueueLock) {
            Optional<String> duplicate = findDuplicate(signal);
            if (duplicate.isPresent()) {
                log.info("[SIGNAL_QUEUE] Rejected {} for {}: {}",
                    signal.signalId(), signal.accountId(), duplicate.get());
                return EnqueueResult.rejected(duplicate.get());
            }
            job = SignalJob.of(signal, clock.instant());
            tracked.put(job.jobId(), job);
            pending.add(job);
        }
        metrics.setQueueDepth(pending.size());
        log.info("[SIGNAL_QUEUE] Enqueued {} ({} {} {} on {}), queue length {}",
            job.jobId(), signal.direction(), signal.size(), signal.instrument(),
            signal.accountId(), pending.size());
        return EnqueueResult.accepted(job.jobId());
    }

    public boolean isDuplicate(Signal signal) {
        synchronized (enqueueLock) {
            return findDuplicate(signal).isPresent();
        }
    }

    private Optional<String> findDuplicate(Signal signal) {
        Instant windowStart = clock.instant().minus(settings.duplicateWindow());
        for (SignalJob job : tracked.values()) {
            if (job.enqueuedAt().isBefore(windowStart)) {
                continue;
            }
            Signal other = job.signal();
            if (other.dedupKey().equals(signal.dedupKey())) {
                return Optional.of("Duplicate signal " + signal.signalId() + " already queued as " + job.jobId());
            }
        }
        for (SignalJob job : tracked.values()) {
            if (job.enqueuedAt().isBefore(windowStart)) {
                continue;
            }
            Signal other = job.signal();
            if (other.accountId().equals(signal.accountId())
                && other.instrument().equalsIgnoreCase(signal.instrument())
                && other.direction() == signal.direction()
                && other.size().compareTo(signal.size()) == 0) {
                return Optional.of("Equivalent signal " + other.signalId() + " already queued as " + job.jobId());
            }
        }
        return Optional.empty();
    }

    private void dispatchLoop() {
        while (running) {
            SignalJob job;
            try {
                job = pending.poll(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (job == null) {
                continue;
            }
            metrics.setQueueDepth(pending.size());
            String accountId = job.signal().accountId();
            boolean laneBusy;
            synchronized (laneLock) {
                ArrayDeque<SignalJob> lane = lanes.get(accountId);
                laneBusy = lane != null;
                if (laneBusy) {
                    lane.addLast(job);
                    parked.incrementAndGet();
                } else {
                    lanes.put(accountId, new ArrayDeque<>());
                }
            }
            if (laneBusy) {
                log.debug("[SIGNAL_QUEUE] {} waiting behind running job for {}", job.jobId(), accountId);
            } else {
                submit(job);
            }
        }
        log.info("[SIGNAL_QUEUE] Dispatcher stopped");
    }

    private void submit(SignalJob job) {
        inFlight.incrementAndGet();
        try {
            workers.execute(() -> runJob(job));
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            log.warn("[SIGNAL_QUEUE] Worker pool closed, dropping {}", job.jobId());
        }
    }

    private void runJob(SignalJob job) {
        ExecutionResult result;
        try {
            result = processor.process(job.signal());
        } catch (RuntimeException e) {
            log.error("[SIGNAL_QUEUE] Processor threw for {}: {}", job.jobId(), e.getMessage(), e);
            result = ExecutionResult.transientFailure("Unexpected error: " + e.getMessage());
        } finally {
            inFlight.decrementAndGet();
        }

        try {
            if (result.isRetryable()) {
                scheduleRetry(job, result.reason());
            } else {
                complete(job, result);
            }
        } finally {
            releaseLane(job.signal().accountId());
        }
    }

    /**
     * Hand the account's next parked job to the pool, or close the lane.
     */
    private void releaseLane(String accountId) {
        SignalJob next;
        synchronized (laneLock) {
            ArrayDeque<SignalJob> lane = lanes.get(accountId);
            next = lane != null ? lane.pollFirst() : null;
            if (next == null) {
                lanes.remove(accountId);
            } else {
                parked.decrementAndGet();
            }
        }
        if (next != null) {
            submit(next);
        }
    }

    private void scheduleRetry(SignalJob job, String reason) {
        BackoffPolicy backoff = settings.retryBackoff();
        if (!backoff.shouldRetry(job.retries()) || !running) {
            fail(job, "Retries exhausted after " + job.retries() + " retries: " + reason);
            return;
        }

        SignalJob retry = job.withRetry();
        Duration delay = backoff.delayAfter(retry.retries());
        metrics.recordRetry("SIGNAL_QUEUE", retry.retries(), "TRANSIENT");
        log.warn("[SIGNAL_QUEUE] {} failed transiently ({}), retry {}/{} in {}ms",
            job.jobId(), reason, retry.retries(), backoff.getMaxAttempts(), delay.toMillis());

        tracked.put(retry.jobId(), retry);
        awaitingRetry.incrementAndGet();
        try {
            retryScheduler.schedule(() -> {
                awaitingRetry.decrementAndGet();
                pending.add(retry);
                metrics.setQueueDepth(pending.size());
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            awaitingRetry.decrementAndGet();
            fail(retry, "Queue stopped before retry: " + reason);
        }
    }

    private void complete(SignalJob job, ExecutionResult result) {
        tracked.remove(job.jobId());
        processedCount.incrementAndGet();
        log.info("[SIGNAL_QUEUE] {} finished: {}{}", job.jobId(), result.outcome(),
            result.reason() != null ? " (" + result.reason() + ")" : "");
        for (Listener listener : listeners) {
            try {
                listener.onJobCompleted(job, result);
            } catch (RuntimeException e) {
                log.error("[SIGNAL_QUEUE] Listener failed on completion of {}: {}", job.jobId(), e.getMessage(), e);
            }
        }
    }

    private void fail(SignalJob job, String reason) {
        tracked.remove(job.jobId());
        processedCount.incrementAndGet();
        metrics.recordTerminalFailure();
        log.error("[SIGNAL_QUEUE] {} dropped: {}", job.jobId(), reason);
        for (Listener listener : listeners) {
            try {
                listener.onJobFailed(job, reason);
            } catch (RuntimeException e) {
                log.error("[SIGNAL_QUEUE] Listener failed on failure of {}: {}", job.jobId(), e.getMessage(), e);
            }
        }
    }

    public QueueStatus status() {
        return new QueueStatus(
            pending.size() + parked.get(),
            inFlight.get() > 0,
            inFlight.get(),
            awaitingRetry.get(),
            tracked.size(),
            processedCount.get()
        );
    }

    public record Settings(Duration duplicateWindow, int workerThreads, BackoffPolicy retryBackoff) {
        public Settings {
            if (duplicateWindow == null || duplicateWindow.isNegative()) {
                throw new IllegalArgumentException("duplicateWindow cannot be negative");
            }
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive");
            }
            if (retryBackoff == null) {
                throw new IllegalArgumentException("retryBackoff cannot be null");
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(30), 4, BackoffPolicy.forQueueRetry());
        }
    }
}
