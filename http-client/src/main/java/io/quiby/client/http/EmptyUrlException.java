package io.quiby.client.http;

/**
 * Thrown before any network attempt when a request has no URL.
 */
public class EmptyUrlException extends HttpClientException {

    public EmptyUrlException() {
        super("URL is empty");
    }
}
