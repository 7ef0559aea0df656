package io.quiby.client.http;

import org.jspecify.annotations.Nullable;

/**
 * Decides whether an attempt outcome is worth another attempt.
 * <p>
 * When set on {@link HttpClientConfig}, the predicate replaces the status-code allow-list
 * entirely, including the rule that any error is retryable.
 */
@FunctionalInterface
public interface RetryPredicate {

    /**
     * @param status the response status code, or {@code 0} when no response was received
     * @param error the transport or body-read error, or {@code null} if the attempt produced a full response
     * @return {@code true} to retry the request if attempts remain
     */
    boolean shouldRetry(int status, @Nullable Throwable error);
}
