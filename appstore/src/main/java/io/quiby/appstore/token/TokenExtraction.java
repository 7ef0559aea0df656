package io.quiby.appstore.token;

import org.jspecify.annotations.Nullable;

/**
 * Result of {@link BearerTokenExtractor#extract(String)}.
 *
 * @param token the {@code Authorization} value, {@code "bearer "} followed by the token, or
 *              {@code null} when no token was found
 * @param line the page line holding the environment config, or {@code null} when the page has none
 */
public record TokenExtraction(@Nullable String token, @Nullable String line) {

    static final TokenExtraction EMPTY = new TokenExtraction(null, null);

    public boolean found() {
        return token != null;
    }
}
