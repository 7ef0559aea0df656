package io.quiby.client.http.jdk;

import java.util.Random;

import io.quiby.client.http.HttpClient;
import io.quiby.client.http.HttpClientBuilder;
import io.quiby.client.http.HttpClientConfig;
import io.quiby.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link HttpClient} instances backed by the JDK {@link java.net.http.HttpClient}.
 *
 * <p>Builders are immutable; {@link #transport} and {@link #random} return new instances.
 * Unless a transport is supplied, every created client owns one pooled JDK client, shared by
 * all its requests.
 */
public class JdkHttpClientBuilder implements HttpClientBuilder {

    private final java.net.http.@Nullable HttpClient transport;
    private final @Nullable Random random;

    public JdkHttpClientBuilder() {
        this(null, null);
    }

    private JdkHttpClientBuilder(java.net.http.@Nullable HttpClient transport, @Nullable Random random) {
        this.transport = transport;
        this.random = random;
    }

    /**
     * @param transport the JDK client to send requests with; {@code null} restores the default transport
     * @return a builder using the given transport
     */
    public JdkHttpClientBuilder transport(java.net.http.@Nullable HttpClient transport) {
        return new JdkHttpClientBuilder(transport, random);
    }

    /**
     * @param random the source of backoff jitter and User-Agent selection
     * @return a builder using the given random source
     */
    public JdkHttpClientBuilder random(Random random) {
        Assert.checkNotNullParam("random", random);
        return new JdkHttpClientBuilder(transport, random);
    }

    @Override
    public HttpClient create(HttpClientConfig config) {
        Assert.checkNotNullParam("config", config);
        return new JdkHttpClient(
                transport != null ? transport : JdkHttpClient.defaultTransport(),
                config,
                random != null ? random : new Random());
    }
}
