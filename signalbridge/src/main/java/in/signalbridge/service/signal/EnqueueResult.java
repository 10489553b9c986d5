package in.signalbridge.service.signal;

/**
 * Answer given to the webhook caller.
 */
public record EnqueueResult(boolean accepted, String jobId, String reason) {

    public static EnqueueResult accepted(String jobId) {
        return new EnqueueResult(true, jobId, null);
    }

    public static EnqueueResult rejected(String reason) {
        return new EnqueueResult(false, null, reason);
    }
}
