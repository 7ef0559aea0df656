package io.quiby.client.http;

import java.util.OptionalInt;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when every attempt allowed by {@link HttpClientConfig#maxRetries()} ended with a
 * retryable outcome.
 * <p>
 * When the last attempt received a retryable status, {@link #getLastStatus()} reports it
 * and there is no cause. When the last attempt failed with a transport or body-read error,
 * that error is the cause.
 */
public class MaxRetriesExceededException extends HttpClientException {

    private final int attempts;
    @Nullable
    private final Integer lastStatus;

    /**
     * Creates an exception for a retryable status received on the last attempt.
     *
     * @param attempts the number of attempts made
     * @param lastStatus the status code of the last response
     */
    public MaxRetriesExceededException(final int attempts, final int lastStatus) {
        super("Max retries reached: retryable status " + lastStatus + " after " + attempts + " attempts");
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    /**
     * Creates an exception for an error raised by the last attempt.
     *
     * @param attempts the number of attempts made
     * @param cause the error of the last attempt
     */
    public MaxRetriesExceededException(final int attempts, final Throwable cause) {
        super("Max retries reached after " + attempts + " attempts: " + cause.getMessage(), cause);
        this.attempts = attempts;
        this.lastStatus = null;
    }

    public int getAttempts() {
        return attempts;
    }

    public OptionalInt getLastStatus() {
        return lastStatus == null ? OptionalInt.empty() : OptionalInt.of(lastStatus);
    }
}
