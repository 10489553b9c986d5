package in.signalbridge.service.signal;

import in.signalbridge.domain.execution.ExecutionResult;
import in.signalbridge.domain.signal.Direction;
import in.signalbridge.domain.signal.Signal;
import in.signalbridge.infrastructure.common.BackoffPolicy;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import in.signalbridge.support.MutableClock;
import in.signalbridge.support.TestSignals;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for SignalQueue.
 *
 * Tests:
 * - Duplicate suppression (same id, equivalent trade, window expiry)
 * - Completion and listener notification
 * - Transient retries and exhaustion
 * - Per-account lanes keep a busy account from holding the whole pool
 */
@ExtendWith(MockitoExtension.class)
class SignalQueueTest {

    private static final BackoffPolicy FAST_RETRY = BackoffPolicy.builder()
        .mode(BackoffPolicy.Mode.EXPONENTIAL)
        .initialDelay(Duration.ofMillis(5))
        .maxDelay(Duration.ofMillis(50))
        .multiplier(2.0)
        .maxAttempts(3)
        .build();

    @Mock
    private PipelineMetrics metrics;

    private MutableClock clock;
    private SignalQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T15:00:00Z"));
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    @Test
    void testSameSignalIdRejectedWhileQueued() {
        queue = newQueue(signal -> ExecutionResult.duplicate("unused"));

        EnqueueResult first = queue.enqueue(TestSignals.signal("sig-1", "1001"));
        EnqueueResult second = queue.enqueue(TestSignals.signal("sig-1", "1001"));

        assertTrue(first.accepted());
        assertNotNull(first.jobId());
        assertFalse(second.accepted(), "Same id and account is a duplicate");
        assertTrue(second.reason().contains("sig-1"), second.reason());
        assertTrue(queue.enqueue(TestSignals.signal("sig-1", "1002")).accepted(), "Other account accepted");
    }

    @Test
    void testEquivalentTradeRejectedWhileQueued() {
        queue = newQueue(signal -> ExecutionResult.duplicate("unused"));
        queue.enqueue(TestSignals.signal("sig-1", "1001"));

        Signal sameTrade = TestSignals.eurusdBuy("sig-2", "1001").instrument("eurusd").size("0.10").build();
        Signal otherSide = TestSignals.eurusdBuy("sig-3", "1001").direction(Direction.SELL).build();
        Signal otherSize = TestSignals.eurusdBuy("sig-4", "1001").size("0.2").build();

        assertFalse(queue.enqueue(sameTrade).accepted(), "Same account, instrument, side and size");
        assertTrue(queue.isDuplicate(sameTrade));
        assertTrue(queue.enqueue(otherSide).accepted());
        assertTrue(queue.enqueue(otherSize).accepted());
        assertEquals(3, queue.status().queueLength());
    }

    @Test
    void testDuplicateWindowExpires() {
        queue = newQueue(signal -> ExecutionResult.duplicate("unused"));
        queue.enqueue(TestSignals.signal("sig-1", "1001"));

        clock.advance(Duration.ofSeconds(31));

        assertTrue(queue.enqueue(TestSignals.signal("sig-1", "1001")).accepted(),
            "Jobs older than the window no longer block");
    }

    @Test
    void testCompletedJobNotifiesListenerAndUntracks() throws Exception {
        queue = newQueue(signal -> ExecutionResult.policyRejected("Trading disabled"));
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<ExecutionResult> seen = new AtomicReference<>();
        queue.addListener(new SignalQueue.Listener() {
            @Override
            public void onJobCompleted(SignalJob job, ExecutionResult result) {
                seen.set(result);
                done.countDown();
            }
        });
        queue.start();

        queue.enqueue(TestSignals.signal("sig-1", "1001"));

        assertTrue(done.await(5, TimeUnit.SECONDS), "Job should complete");
        assertEquals("Trading disabled", seen.get().reason());
        QueueStatus status = queue.status();
        assertEquals(0, status.trackedJobs());
        assertEquals(1, status.processedCount());
        assertTrue(queue.enqueue(TestSignals.signal("sig-1", "1001")).accepted(),
            "Finished job no longer blocks the same id at the queue");
    }

    @Test
    void testTransientFailureRetriedUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        queue = newQueue(signal -> calls.incrementAndGet() < 3
            ? ExecutionResult.transientFailure("quote stale")
            : ExecutionResult.duplicate("done"));
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<SignalJob> finished = new AtomicReference<>();
        queue.addListener(new SignalQueue.Listener() {
            @Override
            public void onJobCompleted(SignalJob job, ExecutionResult result) {
                finished.set(job);
                done.countDown();
            }
        });
        queue.start();

        queue.enqueue(TestSignals.signal("sig-1", "1001"));

        assertTrue(done.await(5, TimeUnit.SECONDS), "Job should complete after retries");
        assertEquals(3, calls.get(), "Initial run plus two retries");
        assertEquals(2, finished.get().retries());
        verify(metrics).recordRetry("SIGNAL_QUEUE", 1, "TRANSIENT");
        verify(metrics).recordRetry("SIGNAL_QUEUE", 2, "TRANSIENT");
    }

    @Test
    void testRetriesExhaustedNotifiesFailure() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        queue = newQueue(signal -> {
            calls.incrementAndGet();
            throw new IllegalStateException("broker down");
        });
        CountDownLatch failed = new CountDownLatch(1);
        AtomicReference<String> reason = new AtomicReference<>();
        queue.addListener(new SignalQueue.Listener() {
            @Override
            public void onJobFailed(SignalJob job, String why) {
                reason.set(why);
                failed.countDown();
            }
        });
        queue.start();

        queue.enqueue(TestSignals.signal("sig-1", "1001"));

        assertTrue(failed.await(5, TimeUnit.SECONDS), "Job should be dropped");
        assertEquals(4, calls.get(), "Initial run plus three retries");
        assertTrue(reason.get().contains("broker down"), reason.get());
        verify(metrics, times(3)).recordRetry(eq("SIGNAL_QUEUE"), anyInt(), eq("TRANSIENT"));
        verify(metrics).recordTerminalFailure();
        assertEquals(0, queue.status().trackedJobs());
    }

    @Test
    void testBusyAccountDoesNotStarveOtherAccounts() throws Exception {
        AccountSerializer serializer = new AccountSerializer();
        CountDownLatch releaseA = new CountDownLatch(1);
        CountDownLatch accountBDone = new CountDownLatch(1);
        CountDownLatch accountADone = new CountDownLatch(3);
        AtomicInteger concurrentA = new AtomicInteger();
        AtomicInteger maxConcurrentA = new AtomicInteger();
        queue = newQueue(signal -> serializer.withAccountLock(signal.accountId(), () -> {
            if (signal.accountId().equals("1001")) {
                maxConcurrentA.accumulateAndGet(concurrentA.incrementAndGet(), Math::max);
                try {
                    releaseA.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    concurrentA.decrementAndGet();
                }
            }
            return ExecutionResult.policyRejected("Trading disabled");
        }));
        queue.addListener(new SignalQueue.Listener() {
            @Override
            public void onJobCompleted(SignalJob job, ExecutionResult result) {
                if (job.signal().accountId().equals("1001")) {
                    accountADone.countDown();
                } else {
                    accountBDone.countDown();
                }
            }
        });
        queue.start();

        queue.enqueue(TestSignals.eurusdBuy("sig-a1", "1001").instrument("EURUSD").build());
        queue.enqueue(TestSignals.eurusdBuy("sig-a2", "1001").instrument("GBPUSD").build());
        queue.enqueue(TestSignals.eurusdBuy("sig-a3", "1001").instrument("USDJPY").build());
        queue.enqueue(TestSignals.signal("sig-b1", "2002"));

        assertTrue(accountBDone.await(2, TimeUnit.SECONDS),
            "Account 2002 should finish while 1001 holds its lock");
        assertEquals(1, queue.status().inFlight(), "Only one job of 1001 holds a worker");
        assertEquals(2, queue.status().queueLength(), "Remaining 1001 jobs wait in their lane");

        releaseA.countDown();
        assertTrue(accountADone.await(5, TimeUnit.SECONDS), "All 1001 jobs complete once released");
        assertEquals(1, maxConcurrentA.get(), "1001 jobs never overlap");
    }

    @Test
    void testSettingsValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new SignalQueue.Settings(Duration.ofSeconds(-1), 1, FAST_RETRY));
        assertThrows(IllegalArgumentException.class,
            () -> new SignalQueue.Settings(Duration.ofSeconds(30), 0, FAST_RETRY));
        assertThrows(IllegalArgumentException.class,
            () -> new SignalQueue.Settings(Duration.ofSeconds(30), 1, null));
    }

    private SignalQueue newQueue(SignalQueue.Processor processor) {
        return new SignalQueue(processor, new SignalQueue.Settings(Duration.ofSeconds(30), 2, FAST_RETRY),
            metrics, clock);
    }
}
