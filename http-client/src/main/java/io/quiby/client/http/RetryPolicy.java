package io.quiby.client.http;

import java.util.Set;

import io.quiby.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Retry decision derived from an {@link HttpClientConfig}.
 * <p>
 * Precedence: a configured {@link RetryPredicate} decides alone; otherwise any error is
 * retryable and a received status is retryable when it belongs to
 * {@link HttpClientConfig#retryStatus()}.
 */
public final class RetryPolicy {

    private final Set<Integer> retryStatus;
    private final @Nullable RetryPredicate retryOn;

    private RetryPolicy(Set<Integer> retryStatus, @Nullable RetryPredicate retryOn) {
        this.retryStatus = retryStatus;
        this.retryOn = retryOn;
    }

    public static RetryPolicy from(HttpClientConfig config) {
        Assert.checkNotNullParam("config", config);
        return new RetryPolicy(config.retryStatus(), config.retryOn());
    }

    /**
     * @param status the received status code, {@code 0} if there was no response
     * @param error the error of the attempt, if any
     * @return whether the attempt outcome should be retried
     */
    public boolean shouldRetry(int status, @Nullable Throwable error) {
        if (retryOn != null) {
            return retryOn.shouldRetry(status, error);
        }
        if (error != null) {
            return true;
        }
        return retryStatus.contains(status);
    }
}
