package io.quiby.client.http;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;

/**
 * Configuration of an {@link HttpClient}.
 *
 * <p>The canonical constructor normalizes every field, so an instance is always ready to use
 * and building a config from an already normalized one yields an equal config:
 * <ul>
 *   <li>{@code timeout} - per-attempt deadline, 10s when absent or not positive</li>
 *   <li>{@code maxRetries} - attempts after the first one, 0 when negative</li>
 *   <li>{@code backoffInitial} - base retry delay, 1s when absent or not positive</li>
 *   <li>{@code backoffMax} - retry delay ceiling, 30s when absent or not positive</li>
 *   <li>{@code userAgents} - User-Agent pool; when empty {@link HttpClient#DEFAULT_USER_AGENT} is sent</li>
 *   <li>{@code baseHeaders} - headers applied to every request before the request's own headers</li>
 *   <li>{@code retryStatus} - retryable status codes; 429 and 500-599 when neither this nor
 *       {@code retryOn} is given</li>
 *   <li>{@code retryOn} - optional predicate replacing the status list</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClientConfig config = HttpClientConfig.builder()
 *     .timeout(Duration.ofSeconds(5))
 *     .maxRetries(2)
 *     .userAgents(List.of("agent-a", "agent-b"))
 *     .retryOn((status, error) -> error != null || status == 503)
 *     .build();
 * }</pre>
 *
 * @param timeout per-attempt deadline
 * @param maxRetries number of additional attempts after the first one
 * @param backoffInitial base delay before exponential growth
 * @param backoffMax ceiling on a computed delay
 * @param userAgents candidate User-Agent values
 * @param baseHeaders headers applied to every request
 * @param retryStatus retryable status codes
 * @param retryOn optional retry predicate overriding {@code retryStatus}
 */
public record HttpClientConfig(
        Duration timeout,
        int maxRetries,
        Duration backoffInitial,
        Duration backoffMax,
        List<String> userAgents,
        Map<String, String> baseHeaders,
        Set<Integer> retryStatus,
        @Nullable RetryPredicate retryOn) {

    /** Default per-attempt timeout: 10s. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /** Default base backoff: 1s. */
    public static final Duration DEFAULT_BACKOFF_INITIAL = Duration.ofSeconds(1);

    /** Default backoff ceiling: 30s. */
    public static final Duration DEFAULT_BACKOFF_MAX = Duration.ofSeconds(30);

    /** Status codes retried when no retry policy is configured: 429 and the whole 5xx range. */
    public static final Set<Integer> DEFAULT_RETRY_STATUS = defaultRetryStatus();

    public HttpClientConfig {
        timeout = positiveOrDefault(timeout, DEFAULT_TIMEOUT);
        maxRetries = Math.max(maxRetries, 0);
        backoffInitial = positiveOrDefault(backoffInitial, DEFAULT_BACKOFF_INITIAL);
        backoffMax = positiveOrDefault(backoffMax, DEFAULT_BACKOFF_MAX);
        userAgents = userAgents == null ? List.of() : List.copyOf(userAgents);
        baseHeaders = baseHeaders == null ? Map.of() : Map.copyOf(baseHeaders);
        if ((retryStatus == null || retryStatus.isEmpty()) && retryOn == null) {
            retryStatus = DEFAULT_RETRY_STATUS;
        } else {
            retryStatus = retryStatus == null ? Set.of() : Set.copyOf(retryStatus);
        }
    }

    /**
     * @return a configuration with every default applied
     */
    public static HttpClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .timeout(timeout)
                .maxRetries(maxRetries)
                .backoffInitial(backoffInitial)
                .backoffMax(backoffMax)
                .userAgents(userAgents)
                .baseHeaders(baseHeaders)
                .retryStatus(retryStatus)
                .retryOn(retryOn);
    }

    private static Duration positiveOrDefault(@Nullable Duration value, Duration defaultValue) {
        if (value == null || value.isZero() || value.isNegative()) {
            return defaultValue;
        }
        return value;
    }

    private static Set<Integer> defaultRetryStatus() {
        Set<Integer> codes = new HashSet<>();
        codes.add(429);
        for (int code = 500; code <= 599; code++) {
            codes.add(code);
        }
        return Set.copyOf(codes);
    }

    /**
     * Builder for {@link HttpClientConfig}. Unset values fall back to the defaults.
     */
    public static final class Builder {
        private @Nullable Duration timeout;
        private int maxRetries;
        private @Nullable Duration backoffInitial;
        private @Nullable Duration backoffMax;
        private final List<String> userAgents = new ArrayList<>();
        private final Map<String, String> baseHeaders = new HashMap<>();
        private final Set<Integer> retryStatus = new HashSet<>();
        private @Nullable RetryPredicate retryOn;

        private Builder() {
        }

        public Builder timeout(@Nullable Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffInitial(@Nullable Duration backoffInitial) {
            this.backoffInitial = backoffInitial;
            return this;
        }

        public Builder backoffMax(@Nullable Duration backoffMax) {
            this.backoffMax = backoffMax;
            return this;
        }

        /**
         * Replaces the User-Agent pool.
         *
         * @param userAgents candidate values, one is picked at random for every attempt
         * @return this builder
         */
        public Builder userAgents(@Nullable List<String> userAgents) {
            this.userAgents.clear();
            if (userAgents != null) {
                this.userAgents.addAll(userAgents);
            }
            return this;
        }

        public Builder baseHeaders(@Nullable Map<String, String> baseHeaders) {
            this.baseHeaders.clear();
            if (baseHeaders != null) {
                this.baseHeaders.putAll(baseHeaders);
            }
            return this;
        }

        public Builder baseHeader(String name, String value) {
            this.baseHeaders.put(name, value);
            return this;
        }

        /**
         * Replaces the set of retryable status codes.
         *
         * @param retryStatus retryable codes; empty restores the default set unless a
         *                    {@link #retryOn(RetryPredicate) predicate} is configured
         * @return this builder
         */
        public Builder retryStatus(@Nullable Set<Integer> retryStatus) {
            this.retryStatus.clear();
            if (retryStatus != null) {
                this.retryStatus.addAll(retryStatus);
            }
            return this;
        }

        public Builder retryOn(@Nullable RetryPredicate retryOn) {
            this.retryOn = retryOn;
            return this;
        }

        public HttpClientConfig build() {
            return new HttpClientConfig(timeout, maxRetries, backoffInitial, backoffMax,
                    userAgents, baseHeaders, retryStatus, retryOn);
        }
    }
}
