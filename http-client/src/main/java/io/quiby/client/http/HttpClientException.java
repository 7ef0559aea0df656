package io.quiby.client.http;

/**
 * Base exception for failures reported by {@link HttpClient}.
 * <p>
 * Instances of this exact type carry transport, body-read and request-building
 * failures that were not retried, or that the retry policy declared non-retryable.
 * Specialized subclasses let callers tell apart the cases they can act on:
 * <ul>
 *   <li>{@link EmptyUrlException} - no URL was given</li>
 *   <li>{@link InvalidUrlException} - the URL could not be parsed or resolved</li>
 *   <li>{@link MaxRetriesExceededException} - every allowed attempt failed</li>
 *   <li>{@link RequestCancelledException} - the caller's {@link CallContext} ended</li>
 * </ul>
 * The underlying cause is always preserved.
 */
public class HttpClientException extends Exception {

    /**
     * Creates a new HttpClientException with the specified message.
     *
     * @param msg the exception message
     */
    public HttpClientException(final String msg) {
        super(msg);
    }

    /**
     * Creates a new HttpClientException with the specified message and cause.
     *
     * @param msg the exception message
     * @param cause the underlying cause
     */
    public HttpClientException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
