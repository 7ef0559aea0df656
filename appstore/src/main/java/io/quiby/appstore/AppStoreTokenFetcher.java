package io.quiby.appstore;

import io.quiby.appstore.landing.LandingUrls;
import io.quiby.appstore.token.BearerTokenExtractor;
import io.quiby.appstore.token.TokenExtraction;
import io.quiby.client.http.CallContext;
import io.quiby.client.http.HttpClient;
import io.quiby.client.http.HttpClientException;
import io.quiby.client.http.HttpResponse;
import io.quiby.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches an app's landing page and extracts the web bearer token from it.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * AppStoreTokenFetcher fetcher = new AppStoreTokenFetcher(HttpClient.create(HttpClientConfig.defaults()));
 * String authorization = fetcher.fetchBearerToken(CallContext.withTimeout(Duration.ofSeconds(30)),
 *     "us", "instagram", "389801252");
 * }</pre>
 */
public class AppStoreTokenFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppStoreTokenFetcher.class);

    private final HttpClient httpClient;

    public AppStoreTokenFetcher(HttpClient httpClient) {
        this.httpClient = Assert.checkNotNullParam("httpClient", httpClient);
    }

    /**
     * @param ctx the call context of the page request
     * @param country two-letter ISO country code
     * @param appName the app slug
     * @param appId the numeric App Store identifier
     * @return the {@code Authorization} header value, {@code "bearer "} followed by the token
     * @throws io.quiby.appstore.landing.LandingUrlException if the landing URL cannot be built
     * @throws AppStoreException if the page cannot be fetched or carries no token
     * @throws HttpClientException if the page request fails
     */
    public String fetchBearerToken(CallContext ctx, String country, String appName, String appId)
            throws AppStoreException, HttpClientException {
        String url = LandingUrls.build(country, appName, appId);
        HttpResponse response = httpClient.get(ctx, url, null, null);
        if (!response.success()) {
            throw new AppStoreException("Landing page " + url + " returned status " + response.status());
        }

        TokenExtraction extraction = BearerTokenExtractor.extract(response.bodyAsString());
        String token = extraction.token();
        if (token == null) {
            if (extraction.line() != null) {
                LOGGER.debug("Environment config of {} has no token: {}", url, extraction.line());
            }
            throw new AppStoreException("No bearer token found on landing page " + url);
        }
        LOGGER.debug("Extracted bearer token from {}", url);
        return token;
    }
}
