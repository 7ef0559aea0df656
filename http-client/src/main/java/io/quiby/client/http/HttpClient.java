package io.quiby.client.http;

import java.util.Map;

import io.quiby.client.http.jdk.JdkHttpClientBuilder;
import org.jspecify.annotations.Nullable;

/**
 * Blocking HTTP client that retries transient failures.
 *
 * <p>Each call runs its attempts sequentially on the calling thread. Between attempts the
 * thread sleeps for the {@link Backoff} delay. Calls stop as soon as the supplied
 * {@link CallContext} ends. Implementations are safe for concurrent use by multiple threads.
 *
 * @see HttpClientConfig
 * @see HttpClientBuilder
 */
public interface HttpClient {

    /** HTTP User-Agent header name. */
    String USER_AGENT = "User-Agent";
    /** HTTP Accept header name. */
    String ACCEPT = "Accept";
    /** HTTP Accept-Language header name. */
    String ACCEPT_LANGUAGE = "Accept-Language";

    /** Accept value sent unless the request supplies one. */
    String DEFAULT_ACCEPT = "*/*";
    /** Accept-Language value sent unless the request supplies one. */
    String DEFAULT_ACCEPT_LANGUAGE = "en-US,en;q=0.9";
    /** User-Agent sent when the configured pool is empty. */
    String DEFAULT_USER_AGENT = "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X) "
            + "AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.0 Mobile/15E148 Safari/604.1";

    /**
     * Creates a client backed by the default transport.
     *
     * @param config the client configuration
     * @return a new client
     */
    static HttpClient create(HttpClientConfig config) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(config);
    }

    /**
     * Creates a client backed by the given JDK client, or by a default one when it is {@code null}.
     *
     * @param config the client configuration
     * @param transport the JDK client to send requests with, may be {@code null}
     * @return a new client
     */
    static HttpClient create(HttpClientConfig config, java.net.http.@Nullable HttpClient transport) {
        return new JdkHttpClientBuilder().transport(transport).create(config);
    }

    /**
     * Sends a request, retrying it according to the client's retry policy.
     *
     * @param ctx the call context; ending it aborts the call
     * @param request the request to send
     * @return the response of the last attempt, whatever its status, when that status is not retried
     * @throws EmptyUrlException if the request has no URL
     * @throws InvalidUrlException if the URL cannot be parsed or resolved
     * @throws MaxRetriesExceededException if every allowed attempt had a retryable outcome
     * @throws RequestCancelledException if {@code ctx} ended before the call completed
     * @throws HttpClientException for any other failure of the last attempt
     */
    HttpResponse send(CallContext ctx, HttpRequest request) throws HttpClientException;

    /**
     * Sends a GET request.
     *
     * @param ctx the call context
     * @param url the request URL
     * @param params query parameters merged into the URL, may be {@code null}
     * @param headers request headers, may be {@code null}
     * @return the response
     * @throws HttpClientException as described for {@link #send(CallContext, HttpRequest)}
     */
    default HttpResponse get(CallContext ctx, String url, @Nullable Map<String, String> params,
                             @Nullable Map<String, String> headers) throws HttpClientException {
        return send(ctx, HttpRequest.builder()
                .method(HttpRequest.GET)
                .url(url)
                .params(params)
                .headers(headers)
                .build());
    }
}
