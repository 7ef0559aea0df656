package io.quiby.client.http;

/**
 * Thrown when the {@link CallContext} of a call ends before the call completes.
 * <p>
 * Cancellation takes precedence over retrying: a call whose context is done never
 * reports {@link MaxRetriesExceededException}.
 */
public class RequestCancelledException extends HttpClientException {

    /**
     * Why the context ended.
     */
    public enum Reason {
        /** {@link CallContext#cancel()} was called. */
        CANCELLED("context canceled"),
        /** The context deadline passed. */
        DEADLINE_EXCEEDED("context deadline exceeded"),
        /** The calling thread was interrupted. */
        INTERRUPTED("calling thread interrupted");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public RequestCancelledException(final Reason reason) {
        super(reason.description());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
