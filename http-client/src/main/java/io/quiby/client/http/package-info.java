/**
 * Resilient HTTP client.
 *
 * <p>This package provides a blocking HTTP client that retries failed exchanges with
 * exponential backoff and jitter, fills in baseline request headers, and reports failures
 * through a small checked exception hierarchy.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.quiby.client.http.HttpClient} - the client interface</li>
 *   <li>{@link io.quiby.client.http.HttpClientConfig} - immutable, normalized client configuration</li>
 *   <li>{@link io.quiby.client.http.HttpRequest} / {@link io.quiby.client.http.HttpResponse} - request and response shapes</li>
 *   <li>{@link io.quiby.client.http.CallContext} - per-call cancellation and deadline</li>
 *   <li>{@link io.quiby.client.http.RetryPolicy} and {@link io.quiby.client.http.Backoff} - retry decisions and delays</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.create(HttpClientConfig.builder()
 *     .timeout(Duration.ofSeconds(5))
 *     .maxRetries(3)
 *     .backoffInitial(Duration.ofMillis(200))
 *     .build());
 *
 * HttpResponse response = client.get(CallContext.withTimeout(Duration.ofSeconds(30)),
 *     "https://example.com/api", Map.of("page", "1"), Map.of("Authorization", "Bearer token"));
 * }</pre>
 *
 * <p>The default implementation lives in {@link io.quiby.client.http.jdk} and is backed by
 * the JDK {@code java.net.http.HttpClient}.
 */
@NullMarked
package io.quiby.client.http;

import org.jspecify.annotations.NullMarked;
