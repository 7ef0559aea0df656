package io.quiby.appstore.landing;

import io.quiby.appstore.AppStoreException;

/**
 * Thrown by {@link LandingUrls#build(String, String, String)} when an input is missing or malformed.
 */
public class LandingUrlException extends AppStoreException {

    /**
     * Validation failures, in the order they are checked.
     */
    public enum Reason {
        COUNTRY_REQUIRED("country is required"),
        APP_NAME_REQUIRED("app name is required"),
        APP_ID_REQUIRED("app ID is required"),
        COUNTRY_INVALID("country must be a 2-letter ISO code"),
        APP_ID_INVALID("app ID must be numeric");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public LandingUrlException(final Reason reason) {
        super(reason.description());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
