package in.signalbridge.infrastructure.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void testLinearDelays() {
        BackoffPolicy policy = BackoffPolicy.builder()
            .mode(BackoffPolicy.Mode.LINEAR)
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(30))
            .maxAttempts(3)
            .build();

        assertEquals(Duration.ofSeconds(2), policy.delayAfter(1), "First retry waits the base delay");
        assertEquals(Duration.ofSeconds(4), policy.delayAfter(2), "Second retry waits twice the base delay");
        assertEquals(Duration.ofSeconds(6), policy.delayAfter(3));
    }

    @Test
    void testExponentialDelays() {
        BackoffPolicy policy = BackoffPolicy.forQueueRetry();

        assertEquals(Duration.ofSeconds(2), policy.delayAfter(1));
        assertEquals(Duration.ofSeconds(4), policy.delayAfter(2));
        assertEquals(Duration.ofSeconds(8), policy.delayAfter(3));
    }

    @Test
    void testMaxDelayRespected() {
        BackoffPolicy policy = BackoffPolicy.builder()
            .mode(BackoffPolicy.Mode.EXPONENTIAL)
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(3.0)
            .maxAttempts(10)
            .build();

        assertEquals(Duration.ofSeconds(10), policy.delayAfter(1));
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(2), "10s * 3 hits the cap");
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(5), "Still capped");
    }

    @Test
    void testNoDelayBeforeFirstFailure() {
        assertEquals(Duration.ZERO, BackoffPolicy.forOrderPlacement().delayAfter(0));
    }

    @Test
    void testAttemptCap() {
        BackoffPolicy policy = BackoffPolicy.forOrderPlacement();

        assertTrue(policy.shouldRetry(1), "Retry after first failure");
        assertTrue(policy.shouldRetry(2), "Retry after second failure");
        assertFalse(policy.shouldRetry(3), "Three failed attempts exhaust the policy");
        assertEquals(3, policy.getMaxAttempts());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () ->
            BackoffPolicy.builder().initialDelay(Duration.ofSeconds(-1)).build());

        assertThrows(IllegalArgumentException.class, () ->
            BackoffPolicy.builder().initialDelay(Duration.ZERO).build());

        assertThrows(IllegalArgumentException.class, () ->
            BackoffPolicy.builder().multiplier(0.5).build());

        assertThrows(IllegalArgumentException.class, () ->
            BackoffPolicy.builder().maxAttempts(0).build());

        assertThrows(IllegalArgumentException.class, () ->
            BackoffPolicy.builder()
                .initialDelay(Duration.ofMinutes(10))
                .maxDelay(Duration.ofMinutes(5))
                .build());
    }
}
