package in.signalbridge.service.signal;

import in.signalbridge.domain.signal.Signal;
import in.signalbridge.infrastructure.metrics.PipelineMetrics;
import in.signalbridge.security.SignalAuditLogger;
import in.signalbridge.support.TestSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SignalIntakeServiceTest {

    @Mock
    private IdempotencyStore idempotencyStore;

    @Mock
    private SignalQueue queue;

    @Mock
    private SignalAuditLogger audit;

    @Mock
    private PipelineMetrics metrics;

    private SignalIntakeService intake;
    private final Signal signal = TestSignals.signal("sig-1", "1001");

    @BeforeEach
    void setUp() {
        intake = new SignalIntakeService(idempotencyStore, queue, audit, metrics);
    }

    @Test
    void testNewSignalEnqueued() {
        when(idempotencyStore.has("sig-1", "1001")).thenReturn(false);
        when(queue.enqueue(signal)).thenReturn(EnqueueResult.accepted("sig-1_1001_1"));

        EnqueueResult result = intake.submit(signal);

        assertTrue(result.accepted());
        assertEquals("sig-1_1001_1", result.jobId());
        verify(audit).logReceived(signal);
        verify(metrics).recordSignalReceived("accepted");
    }

    @Test
    void testProcessedSignalRejectedBeforeQueue() {
        when(idempotencyStore.has("sig-1", "1001")).thenReturn(true);

        EnqueueResult result = intake.submit(signal);

        assertFalse(result.accepted());
        assertEquals("Signal sig-1 already processed for account 1001", result.reason());
        verify(queue, never()).enqueue(any());
        verify(audit).logDuplicate(signal, result.reason());
        verify(metrics).recordSignalReceived("duplicate");
    }

    @Test
    void testQueueDuplicateReported() {
        when(idempotencyStore.has("sig-1", "1001")).thenReturn(false);
        when(queue.enqueue(signal)).thenReturn(EnqueueResult.rejected("Duplicate signal sig-1 already queued"));

        EnqueueResult result = intake.submit(signal);

        assertFalse(result.accepted());
        verify(audit).logDuplicate(signal, "Duplicate signal sig-1 already queued");
        verify(metrics).recordSignalReceived("duplicate");
    }

    @Test
    void testStoreOutageDoesNotBlockIntake() {
        when(idempotencyStore.has("sig-1", "1001"))
            .thenThrow(new IdempotencyStoreException("lookup failed", new IllegalStateException("db down")));
        when(queue.enqueue(signal)).thenReturn(EnqueueResult.accepted("job-1"));

        EnqueueResult result = intake.submit(signal);

        assertTrue(result.accepted(), "Execution re-checks the store before placing");
        verify(queue).enqueue(signal);
    }
}
