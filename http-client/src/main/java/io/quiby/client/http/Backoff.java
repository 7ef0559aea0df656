package io.quiby.client.http;

import java.time.Duration;
import java.util.Random;

import io.quiby.util.Assert;

/**
 * Exponential backoff with additive jitter.
 * <p>
 * The delay before retry number {@code attempt} (zero-based, so the first retry uses
 * {@code attempt = 0}) is {@code backoffInitial * 2^attempt} plus a uniform jitter in
 * {@code [0, 250ms)}, capped at {@code backoffMax}.
 */
public final class Backoff {

    /** Exclusive upper bound of the jitter added to every delay. */
    public static final Duration MAX_JITTER = Duration.ofMillis(250);

    private final long initialNanos;
    private final long maxNanos;
    private final Random random;

    public Backoff(Duration initial, Duration max, Random random) {
        this.initialNanos = Assert.checkNotNullParam("initial", initial).toNanos();
        this.maxNanos = Assert.checkNotNullParam("max", max).toNanos();
        this.random = Assert.checkNotNullParam("random", random);
    }

    public static Backoff from(HttpClientConfig config, Random random) {
        return new Backoff(config.backoffInitial(), config.backoffMax(), random);
    }

    /**
     * @param attempt zero-based index of the attempt that just failed
     * @return the delay to wait before the next attempt
     */
    public Duration delay(int attempt) {
        long jitterNanos = Duration.ofMillis(random.nextInt((int) MAX_JITTER.toMillis())).toNanos();
        // saturate instead of overflowing on large attempt counts
        if (attempt >= Long.SIZE - 1 || initialNanos > (Long.MAX_VALUE - jitterNanos) >> attempt) {
            return Duration.ofNanos(maxNanos);
        }
        long delayNanos = (initialNanos << attempt) + jitterNanos;
        return Duration.ofNanos(Math.min(delayNanos, maxNanos));
    }
}
