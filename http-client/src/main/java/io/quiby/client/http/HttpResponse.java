package io.quiby.client.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fully read response of an {@link HttpClient} call.
 *
 * <p>A response is returned for any status the retry policy does not retry, so callers must
 * check {@link #status()} or {@link #success()} themselves.
 */
public final class HttpResponse {

    private final int status;
    private final byte[] body;
    private final Map<String, List<String>> headers;
    private final String url;

    /**
     * @param status the status code
     * @param body the raw body bytes
     * @param headers the response headers; names are matched case-insensitively
     * @param url the resolved request URL, including merged query parameters
     */
    public HttpResponse(int status, byte[] body, Map<String, List<String>> headers, String url) {
        this.status = status;
        this.body = body.clone();
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = Collections.unmodifiableMap(copy);
        this.url = url;
    }

    public int status() {
        return status;
    }

    public boolean success() {
        return status >= 200 && status < 300;
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> firstHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public String url() {
        return url;
    }

    @Override
    public String toString() {
        return "HttpResponse[status=" + status + ", url=" + url + ", bodyLength=" + body.length + "]";
    }
}
