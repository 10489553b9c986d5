package in.signalbridge.service.signal;

/**
 * The durable idempotency store could not answer. Callers must not treat this as
 * "not processed"; the execution path maps it to a transient failure.
 */
public class IdempotencyStoreException extends RuntimeException {

    public IdempotencyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
