package io.quiby.appstore.token;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.quiby.util.Assert;

/**
 * Finds the media API bearer token in the HTML of an App Store landing page.
 * <p>
 * The token sits in the URL-encoded JSON of the
 * {@code <meta name="web-experience-app/config/environment">} tag, as
 * {@code "token":"<value>"}.
 */
public final class BearerTokenExtractor {

    static final String ENVIRONMENT_META = "web-experience-app/config/environment";
    static final String BEARER_PREFIX = "bearer ";

    private static final Pattern TOKEN = Pattern.compile("token%22%3A%22(.+?)%22");

    private BearerTokenExtractor() {
    }

    /**
     * Scans the page line by line and stops at the first line mentioning the environment config.
     *
     * @param html the landing page HTML
     * @return the token and the matching line; the line alone when it carries no token; an empty
     *         extraction when no line matches
     */
    public static TokenExtraction extract(String html) {
        Assert.checkNotNullParam("html", html);
        for (String line : html.split("\n", -1)) {
            if (!line.contains(ENVIRONMENT_META)) {
                continue;
            }
            Matcher matcher = TOKEN.matcher(line);
            if (matcher.find()) {
                return new TokenExtraction(BEARER_PREFIX + matcher.group(1), line);
            }
            return new TokenExtraction(null, line);
        }
        return TokenExtraction.EMPTY;
    }
}
