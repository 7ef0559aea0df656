package io.quiby.client.http.jdk;

import java.io.InputStream;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscribers;
import java.net.http.HttpResponse.ResponseInfo;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import io.quiby.client.http.Backoff;
import io.quiby.client.http.CallContext;
import io.quiby.client.http.HttpClient;
import io.quiby.client.http.HttpClientConfig;
import io.quiby.client.http.HttpClientException;
import io.quiby.client.http.HttpRequest;
import io.quiby.client.http.HttpResponse;
import io.quiby.client.http.MaxRetriesExceededException;
import io.quiby.client.http.RequestUrls;
import io.quiby.client.http.RetryPolicy;
import io.quiby.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdkHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClient.class);

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Headers the JDK client sets itself and refuses from callers. They are skipped instead of
     * failing the request.
     */
    static final Set<String> RESTRICTED_HEADERS = restrictedHeaders();

    private final java.net.http.HttpClient httpClient;
    private final HttpClientConfig config;
    private final RetryPolicy retryPolicy;
    private final Backoff backoff;
    private final Random random;

    JdkHttpClient(java.net.http.HttpClient httpClient, HttpClientConfig config, Random random) {
        this.httpClient = httpClient;
        this.config = config;
        this.retryPolicy = RetryPolicy.from(config);
        this.backoff = Backoff.from(config, random);
        this.random = random;
    }

    static java.net.http.HttpClient defaultTransport() {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT);
        ProxySelector proxySelector = ProxySelector.getDefault();
        if (proxySelector != null) {
            builder.proxy(proxySelector);
        }
        return builder.build();
    }

    java.net.http.HttpClient getTransport() {
        return httpClient;
    }

    HttpClientConfig getConfig() {
        return config;
    }

    @Override
    public HttpResponse send(CallContext ctx, HttpRequest request) throws HttpClientException {
        Assert.checkNotNullParam("ctx", ctx);
        Assert.checkNotNullParam("request", request);

        String url = RequestUrls.resolve(request.url(), request.params());
        URI uri = URI.create(url);
        int maxRetries = config.maxRetries();

        for (int attempt = 0; ; attempt++) {
            ctx.checkActive();
            java.net.http.HttpRequest httpRequest = buildRequest(uri, request);

            AtomicReference<ResponseInfo> responseInfo = new AtomicReference<>();
            java.net.http.HttpResponse<byte[]> response;
            try {
                response = exchange(ctx, httpRequest, responseInfo);
            } catch (ExecutionException e) {
                ctx.checkActive();
                Throwable cause = unwrap(e);
                ResponseInfo info = responseInfo.get();
                // a known status means the headers arrived and reading the body failed
                int status = info == null ? 0 : info.statusCode();
                boolean retryable = retryPolicy.shouldRetry(status, cause);
                if (retryable && attempt < maxRetries) {
                    pause(ctx, request, attempt, cause.toString());
                    continue;
                }
                if (retryable && maxRetries > 0) {
                    throw new MaxRetriesExceededException(attempt + 1, cause);
                }
                String what = info == null ? "Request failed" : "Failed to read body (status " + status + ")";
                throw new HttpClientException(what + ": " + cause.getMessage(), cause);
            }

            int status = response.statusCode();
            if (retryPolicy.shouldRetry(status, null)) {
                if (attempt < maxRetries) {
                    pause(ctx, request, attempt, "status " + status);
                    continue;
                }
                if (maxRetries > 0) {
                    throw new MaxRetriesExceededException(attempt + 1, status);
                }
            }
            return new HttpResponse(status, response.body(), response.headers().map(), url);
        }
    }

    private java.net.http.HttpResponse<byte[]> exchange(CallContext ctx, java.net.http.HttpRequest httpRequest,
                                                         AtomicReference<ResponseInfo> responseInfo)
            throws HttpClientException, ExecutionException {
        BodyHandler<byte[]> bodyHandler = info -> {
            responseInfo.set(info);
            return BodySubscribers.ofByteArray();
        };
        CompletableFuture<java.net.http.HttpResponse<byte[]>> exchange = httpClient.sendAsync(httpRequest, bodyHandler);
        CompletableFuture<java.net.http.HttpResponse<byte[]>> future = exchange
                .orTimeout(config.timeout().toNanos(), TimeUnit.NANOSECONDS);
        try {
            return ctx.await(future);
        } catch (ExecutionException | HttpClientException e) {
            // a timed out or cancelled attempt must release its connection
            exchange.cancel(true);
            throw e;
        }
    }

    private java.net.http.HttpRequest buildRequest(URI uri, HttpRequest request) throws HttpClientException {
        try {
            java.net.http.HttpRequest.Builder builder = java.net.http.HttpRequest.newBuilder(uri)
                    .method(request.method(), bodyPublisher(request.body()))
                    .timeout(config.timeout());
            requestHeaders(request.headers()).forEach((name, value) -> {
                if (RESTRICTED_HEADERS.contains(name)) {
                    LOGGER.debug("Dropping header {} managed by the transport", name);
                } else {
                    builder.header(name, value);
                }
            });
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new HttpClientException("Failed to build request: " + e.getMessage(), e);
        }
    }

    private static Set<String> restrictedHeaders() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(List.of("Connection", "Content-Length", "Expect", "Host", "Upgrade"));
        return Collections.unmodifiableSet(names);
    }

    private static BodyPublisher bodyPublisher(@Nullable Supplier<InputStream> body) {
        return body == null ? BodyPublishers.noBody() : BodyPublishers.ofInputStream(body);
    }

    /**
     * Base headers first, then the defaults the caller did not supply, then the caller's own
     * headers. Names are compared case-insensitively.
     */
    Map<String, String> requestHeaders(Map<String, String> custom) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(config.baseHeaders());
        if (!containsHeader(custom, USER_AGENT)) {
            headers.put(USER_AGENT, pickUserAgent());
        }
        if (!containsHeader(custom, ACCEPT)) {
            headers.put(ACCEPT, DEFAULT_ACCEPT);
        }
        if (!containsHeader(custom, ACCEPT_LANGUAGE)) {
            headers.put(ACCEPT_LANGUAGE, DEFAULT_ACCEPT_LANGUAGE);
        }
        headers.putAll(custom);
        return headers;
    }

    String pickUserAgent() {
        List<String> userAgents = config.userAgents();
        if (userAgents.isEmpty()) {
            return DEFAULT_USER_AGENT;
        }
        return userAgents.get(random.nextInt(userAgents.size()));
    }

    private void pause(CallContext ctx, HttpRequest request, int attempt, String reason) throws HttpClientException {
        Duration delay = backoff.delay(attempt);
        LOGGER.debug("Attempt {}/{} of {} failed ({}), retrying in {} ms",
                attempt + 1, config.maxRetries() + 1, request, reason, delay.toMillis());
        ctx.sleep(delay);
    }

    private Throwable unwrap(ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        if (cause instanceof TimeoutException) {
            HttpTimeoutException timeout = new HttpTimeoutException(
                    "request timed out after " + config.timeout().toMillis() + " ms");
            timeout.initCause(cause);
            return timeout;
        }
        return cause;
    }

    private static boolean containsHeader(Map<String, String> headers, String name) {
        for (String key : headers.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }
}
