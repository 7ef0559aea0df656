package io.quiby.appstore.landing;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

import io.quiby.util.Assert;

/**
 * Builds App Store landing page URLs of the form
 * {@code https://apps.apple.com/{country}/app/{appName}/id{appId}}.
 */
public final class LandingUrls {

    public static final String SCHEME = "https";
    public static final String HOST = "apps.apple.com";

    private static final Pattern COUNTRY_CODE = Pattern.compile("^[a-z]{2}$");
    private static final Pattern APP_ID = Pattern.compile("^[0-9]+$");

    private LandingUrls() {
    }

    /**
     * Builds the landing page URL of an app.
     * <p>
     * Inputs are trimmed and the country code is lower-cased. The app name is used as the
     * path slug and percent-encoded where needed.
     *
     * @param country two-letter ISO country code, any case
     * @param appName the app slug, e.g. {@code instagram}
     * @param appId the numeric App Store identifier
     * @return the landing page URL
     * @throws LandingUrlException if an input is missing or malformed
     */
    public static String build(String country, String appName, String appId) throws LandingUrlException {
        Assert.checkNotNullParam("country", country);
        Assert.checkNotNullParam("appName", appName);
        Assert.checkNotNullParam("appId", appId);

        String normalizedCountry = normalizeCountryCode(country);
        String slug = appName.trim();
        String id = appId.trim();

        if (normalizedCountry.isEmpty()) {
            throw new LandingUrlException(LandingUrlException.Reason.COUNTRY_REQUIRED);
        }
        if (slug.isEmpty()) {
            throw new LandingUrlException(LandingUrlException.Reason.APP_NAME_REQUIRED);
        }
        if (id.isEmpty()) {
            throw new LandingUrlException(LandingUrlException.Reason.APP_ID_REQUIRED);
        }
        if (!COUNTRY_CODE.matcher(normalizedCountry).matches()) {
            throw new LandingUrlException(LandingUrlException.Reason.COUNTRY_INVALID);
        }
        if (!APP_ID.matcher(id).matches()) {
            throw new LandingUrlException(LandingUrlException.Reason.APP_ID_INVALID);
        }

        String path = "/" + normalizedCountry + "/app/" + slug + "/id" + id;
        try {
            return new URI(SCHEME, HOST, path, null).toASCIIString();
        } catch (URISyntaxException e) {
            // the multi-argument constructor quotes illegal characters, a failure here is a bug
            throw new IllegalStateException("Cannot encode landing path " + path, e);
        }
    }

    public static String normalizeCountryCode(String country) {
        Assert.checkNotNullParam("country", country);
        return country.trim().toLowerCase(Locale.ROOT);
    }
}
