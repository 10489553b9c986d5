package in.signalbridge.service.signal;

import in.signalbridge.domain.execution.PendingExecution;
import in.signalbridge.domain.signal.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-account mutual exclusion and the PendingExecution markers.
 *
 * One fair {@link ReentrantLock} per account id, created on first use and kept
 * for the life of the process. Only one account lock is ever held by an
 * execution path, so there is no lock ordering to respect.
 */
public final class AccountSerializer {
    private static final Logger log = LoggerFactory.getLogger(AccountSerializer.class);

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, PendingExecution> pending = new ConcurrentHashMap<>();
    private final Clock clock;

    public AccountSerializer() {
        this(Clock.systemUTC());
    }

    public AccountSerializer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Run {@code fn} while holding the account's lock. The lock is released on every
     * exit path, including exceptions.
     */
    public <T> T withAccountLock(String accountId, Supplier<T> fn) {
        ReentrantLock lock = locks.computeIfAbsent(accountId, k -> new ReentrantLock(true));
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("[SERIALIZER] Waiting for lock on account {}", accountId);
        }
        lock.lock();
        try {
            return fn.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claim (accountId, direction).
     *
     * @return the marker, or empty if the pair is already pending
     */
    public Optional<PendingExecution> beginExecution(String accountId, Direction direction, String signalId) {
        PendingExecution marker = new PendingExecution(accountId, direction, signalId, clock.instant());
        PendingExecution existing = pending.putIfAbsent(marker.key(), marker);
        if (existing != null) {
            log.warn("[SERIALIZER] {} {} already pending with signal {}, rejecting {}",
                accountId, direction, existing.signalId(), signalId);
            return Optional.empty();
        }
        return Optional.of(marker);
    }

    /**
     * Release a marker obtained from {@link #beginExecution}.
     */
    public void endExecution(PendingExecution marker) {
        pending.remove(marker.key(), marker);
    }

    public boolean isPending(String accountId, Direction direction) {
        return pending.containsKey(PendingExecution.key(accountId, direction));
    }

    public List<PendingExecution> pendingExecutions() {
        return List.copyOf(pending.values());
    }

    public int knownAccounts() {
        return locks.size();
    }
}
