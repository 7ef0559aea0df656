package io.quiby.client.http;

/**
 * Thrown before any network attempt when a URL cannot be parsed, is not an absolute
 * {@code http}/{@code https} URL, or cannot be combined with the request's query parameters.
 */
public class InvalidUrlException extends HttpClientException {

    private final String url;

    public InvalidUrlException(final String url, final String reason) {
        super("Invalid URL [" + url + "]: " + reason);
        this.url = url;
    }

    public InvalidUrlException(final String url, final Throwable cause) {
        super("Invalid URL [" + url + "]: " + cause.getMessage(), cause);
        this.url = url;
    }

    /**
     * @return the URL as supplied by the caller
     */
    public String getUrl() {
        return url;
    }
}
