package io.quiby.client.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

import org.jspecify.annotations.Nullable;

/**
 * Resolves the final URL of a request.
 */
public final class RequestUrls {

    private RequestUrls() {
    }

    /**
     * Validates {@code rawUrl} and merges {@code params} into its query string.
     * <p>
     * Without parameters the URL is returned unchanged. Otherwise existing query pairs and
     * {@code params} are combined, a parameter replacing every existing value of the same
     * name, and the query is re-encoded with keys in alphabetical order.
     *
     * @param rawUrl the URL supplied by the caller
     * @param params query parameters to merge, may be {@code null}
     * @return the resolved URL
     * @throws EmptyUrlException if {@code rawUrl} is {@code null} or empty
     * @throws InvalidUrlException if {@code rawUrl} is not an absolute http(s) URL or its query cannot be decoded
     */
    public static String resolve(@Nullable String rawUrl, @Nullable Map<String, String> params)
            throws EmptyUrlException, InvalidUrlException {
        if (rawUrl == null || rawUrl.isEmpty()) {
            throw new EmptyUrlException();
        }
        URI uri;
        try {
            uri = new URI(rawUrl);
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(rawUrl, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null) {
            throw new InvalidUrlException(rawUrl, "missing scheme");
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidUrlException(rawUrl, "unsupported scheme " + scheme);
        }
        if (uri.getRawAuthority() == null || uri.getHost() == null) {
            throw new InvalidUrlException(rawUrl, "missing host");
        }
        if (params == null || params.isEmpty()) {
            return rawUrl;
        }

        Map<String, StringJoiner> query = new TreeMap<>();
        try {
            decodeQuery(uri.getRawQuery(), query);
        } catch (IllegalArgumentException e) {
            throw new InvalidUrlException(rawUrl, e);
        }
        for (Map.Entry<String, String> param : params.entrySet()) {
            StringJoiner values = new StringJoiner("&");
            values.add(encode(param.getKey()) + "=" + encode(param.getValue()));
            query.put(param.getKey(), values);
        }

        StringJoiner encoded = new StringJoiner("&");
        query.values().forEach(values -> encoded.add(values.toString()));

        StringBuilder url = new StringBuilder()
                .append(uri.getScheme()).append("://").append(uri.getRawAuthority());
        if (uri.getRawPath() != null) {
            url.append(uri.getRawPath());
        }
        url.append('?').append(encoded);
        if (uri.getRawFragment() != null) {
            url.append('#').append(uri.getRawFragment());
        }
        return url.toString();
    }

    private static void decodeQuery(@Nullable String rawQuery, Map<String, StringJoiner> query) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            if (key.isEmpty()) {
                continue;
            }
            query.computeIfAbsent(key, k -> new StringJoiner("&")).add(encode(key) + "=" + encode(value));
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
