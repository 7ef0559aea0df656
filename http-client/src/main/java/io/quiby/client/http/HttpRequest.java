package io.quiby.client.http;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

/**
 * Request descriptor accepted by {@link HttpClient#send(CallContext, HttpRequest)}.
 *
 * <p>The body is held as a stream supplier so that each retry sends a fresh copy of it.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpRequest request = HttpRequest.builder()
 *     .method("POST")
 *     .url("https://example.com/items")
 *     .param("dryRun", "true")
 *     .header("Content-Type", "application/json")
 *     .body("{\"name\": \"item\"}")
 *     .build();
 * }</pre>
 */
public final class HttpRequest {

    public static final String GET = "GET";

    private final String method;
    private final String url;
    private final Map<String, String> params;
    private final Map<String, String> headers;
    private final @Nullable Supplier<InputStream> body;

    private HttpRequest(Builder builder) {
        this.method = builder.method == null || builder.method.isEmpty() ? GET : builder.method;
        this.url = builder.url == null ? "" : builder.url;
        this.params = Map.copyOf(builder.params);
        this.headers = Map.copyOf(builder.headers);
        this.body = builder.body;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the HTTP method, {@code GET} when none was set
     */
    public String method() {
        return method;
    }

    /**
     * @return the raw URL, empty when none was set
     */
    public String url() {
        return url;
    }

    public Map<String, String> params() {
        return params;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public @Nullable Supplier<InputStream> body() {
        return body;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }

    public static final class Builder {
        private @Nullable String method;
        private @Nullable String url;
        private final Map<String, String> params = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable Supplier<InputStream> body;

        private Builder() {
        }

        public Builder method(@Nullable String method) {
            this.method = method;
            return this;
        }

        public Builder url(@Nullable String url) {
            this.url = url;
            return this;
        }

        public Builder param(String name, String value) {
            this.params.put(name, value);
            return this;
        }

        public Builder params(@Nullable Map<String, String> params) {
            if (params != null) {
                this.params.putAll(params);
            }
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(@Nullable Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        /**
         * Sets the body from a stream factory. The factory is invoked once per attempt.
         *
         * @param body the body stream factory, or {@code null} for no body
         * @return this builder
         */
        public Builder body(@Nullable Supplier<InputStream> body) {
            this.body = body;
            return this;
        }

        public Builder body(byte[] body) {
            byte[] copy = body.clone();
            this.body = () -> new ByteArrayInputStream(copy);
            return this;
        }

        public Builder body(String body) {
            return body(body.getBytes(StandardCharsets.UTF_8));
        }

        public HttpRequest build() {
            return new HttpRequest(this);
        }
    }
}
