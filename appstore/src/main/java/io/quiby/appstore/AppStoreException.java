package io.quiby.appstore;

/**
 * Base exception for App Store helper failures.
 */
public class AppStoreException extends Exception {

    public AppStoreException(final String msg) {
        super(msg);
    }

    public AppStoreException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
