package io.quiby.client.http;

import io.quiby.client.http.jdk.JdkHttpClientBuilder;

/**
 * Factory of {@link HttpClient} instances.
 */
public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    HttpClient create(HttpClientConfig config);
}
