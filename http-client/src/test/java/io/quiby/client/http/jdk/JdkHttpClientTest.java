package io.quiby.client.http.jdk;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.moreThanOrExactly;
import static com.github.tomakehurst.wiremock.client.WireMock.ok;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import io.quiby.client.http.CallContext;
import io.quiby.client.http.EmptyUrlException;
import io.quiby.client.http.HttpClient;
import io.quiby.client.http.HttpClientConfig;
import io.quiby.client.http.HttpClientException;
import io.quiby.client.http.HttpRequest;
import io.quiby.client.http.HttpResponse;
import io.quiby.client.http.InvalidUrlException;
import io.quiby.client.http.MaxRetriesExceededException;
import io.quiby.client.http.RequestCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

public class JdkHttpClientTest {

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private String url(String path) {
        return "http://localhost:" + server.port() + path;
    }

    private static HttpClient client(HttpClientConfig.Builder config) {
        return new JdkHttpClientBuilder()
                .random(new Random(42))
                .create(config
                        .timeout(Duration.ofSeconds(5))
                        .backoffInitial(Duration.ofMillis(10))
                        .backoffMax(Duration.ofMillis(100))
                        .build());
    }

    @Test
    public void testGet() throws Exception {
        givenThat(get(urlEqualTo("/resource"))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "text/plain")
                        .withBody("response")));

        HttpResponse response = client(HttpClientConfig.builder())
                .get(CallContext.create(), url("/resource"), null, null);

        assertEquals(200, response.status());
        assertTrue(response.success());
        assertEquals("response", response.bodyAsString());
        assertEquals(url("/resource"), response.url());
        assertEquals("text/plain", response.firstHeader("content-type").orElseThrow());
        verify(1, getRequestedFor(urlEqualTo("/resource")));
    }

    @Test
    public void testMethodDefaultsToGet() throws Exception {
        givenThat(get(urlEqualTo("/default")).willReturn(ok("ok")));

        HttpResponse response = client(HttpClientConfig.builder())
                .send(CallContext.create(), HttpRequest.builder().url(url("/default")).build());

        assertEquals(200, response.status());
        verify(1, getRequestedFor(urlEqualTo("/default")));
    }

    @Test
    public void testPostWithBody() throws Exception {
        givenThat(post(urlEqualTo("/items")).willReturn(aResponse().withStatus(201)));

        HttpResponse response = client(HttpClientConfig.builder())
                .send(CallContext.create(), HttpRequest.builder()
                        .method("POST")
                        .url(url("/items"))
                        .header("Content-Type", "text/plain")
                        .body("test body")
                        .build());

        assertEquals(201, response.status());
        verify(postRequestedFor(urlEqualTo("/items")).withRequestBody(equalTo("test body")));
    }

    @Test
    public void testBodyIsResentOnEveryAttempt() throws Exception {
        givenThat(post(urlEqualTo("/replay")).willReturn(aResponse().withStatus(503)));

        HttpClient client = client(HttpClientConfig.builder().maxRetries(2));
        HttpRequest request = HttpRequest.builder()
                .method("POST")
                .url(url("/replay"))
                .body("payload")
                .build();

        assertThrows(MaxRetriesExceededException.class, () -> client.send(CallContext.create(), request));
        verify(3, postRequestedFor(urlEqualTo("/replay")).withRequestBody(equalTo("payload")));
    }

    @Test
    public void testRetriesUntilSuccess() throws Exception {
        givenThat(get(urlEqualTo("/flaky")).inScenario("flaky")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(500))
                .willSetStateTo("second"));
        givenThat(get(urlEqualTo("/flaky")).inScenario("flaky")
                .whenScenarioStateIs("second")
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("third"));
        givenThat(get(urlEqualTo("/flaky")).inScenario("flaky")
                .whenScenarioStateIs("third")
                .willReturn(ok("success")));

        HttpResponse response = client(HttpClientConfig.builder().maxRetries(3))
                .get(CallContext.create(), url("/flaky"), null, null);

        assertEquals(200, response.status());
        assertEquals("success", response.bodyAsString());
        verify(3, getRequestedFor(urlEqualTo("/flaky")));
    }

    @Test
    public void testRetryableStatusExhaustsRetries() {
        givenThat(get(urlEqualTo("/down")).willReturn(aResponse().withStatus(500)));

        HttpClient client = client(HttpClientConfig.builder().maxRetries(3));
        MaxRetriesExceededException e = assertThrows(MaxRetriesExceededException.class,
                () -> client.get(CallContext.create(), url("/down"), null, null));

        assertEquals(4, e.getAttempts());
        assertEquals(500, e.getLastStatus().orElseThrow());
        verify(4, getRequestedFor(urlEqualTo("/down")));
    }

    @Test
    public void testNoRetriesReturnsRetryableStatusAsResponse() throws Exception {
        givenThat(get(urlEqualTo("/down")).willReturn(aResponse().withStatus(500).withBody("oops")));

        HttpResponse response = client(HttpClientConfig.builder().maxRetries(0))
                .get(CallContext.create(), url("/down"), null, null);

        assertEquals(500, response.status());
        assertFalse(response.success());
        assertEquals("oops", response.bodyAsString());
        verify(1, getRequestedFor(urlEqualTo("/down")));
    }

    @Test
    public void testNonRetryableStatusIsReturnedWithoutRetry() throws Exception {
        givenThat(get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404)));

        HttpResponse response = client(HttpClientConfig.builder().maxRetries(3))
                .get(CallContext.create(), url("/missing"), null, null);

        assertEquals(404, response.status());
        verify(1, getRequestedFor(urlEqualTo("/missing")));
    }

    @Test
    public void testEmptyUrlMakesNoRequest() {
        HttpClient client = client(HttpClientConfig.builder().maxRetries(3));

        assertThrows(EmptyUrlException.class,
                () -> client.send(CallContext.create(), HttpRequest.builder().build()));
        assertThrows(EmptyUrlException.class,
                () -> client.get(CallContext.create(), "", Map.of("a", "b"), null));
        verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    public void testInvalidUrlMakesNoRequest() {
        HttpClient client = client(HttpClientConfig.builder().maxRetries(3));

        InvalidUrlException e = assertThrows(InvalidUrlException.class,
                () -> client.get(CallContext.create(), "://invalid", null, null));
        assertEquals("://invalid", e.getUrl());
        assertThrows(InvalidUrlException.class,
                () -> client.get(CallContext.create(), "localhost:" + server.port() + "/x", null, null));
        verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    public void testQueryParamsAreMerged() throws Exception {
        givenThat(get(urlPathEqualTo("/search")).willReturn(ok()));

        HttpResponse response = client(HttpClientConfig.builder())
                .get(CallContext.create(), url("/search?z=last"), Map.of("q", "a b&c", "a", "1"), null);

        assertEquals(url("/search?a=1&q=a+b%26c&z=last"), response.url());
        verify(getRequestedFor(urlPathEqualTo("/search"))
                .withQueryParam("q", equalTo("a b&c"))
                .withQueryParam("a", equalTo("1"))
                .withQueryParam("z", equalTo("last")));
    }

    @Test
    public void testDefaultHeaders() throws Exception {
        givenThat(get(urlEqualTo("/headers")).willReturn(ok()));

        client(HttpClientConfig.builder()).get(CallContext.create(), url("/headers"), null, null);

        verify(getRequestedFor(urlEqualTo("/headers"))
                .withHeader("User-Agent", equalTo(HttpClient.DEFAULT_USER_AGENT))
                .withHeader("Accept", equalTo("*/*"))
                .withHeader("Accept-Language", equalTo("en-US,en;q=0.9")));
    }

    @Test
    public void testCallerHeadersWin() throws Exception {
        givenThat(get(urlEqualTo("/headers")).willReturn(ok()));

        HttpClient client = client(HttpClientConfig.builder()
                .userAgents(List.of("pool-agent"))
                .baseHeader("X-Base", "base-value")
                .baseHeader("X-Shared", "from-base"));
        client.get(CallContext.create(), url("/headers"), null, Map.of(
                "user-agent", "caller-agent",
                "accept", "application/json",
                "X-Shared", "from-caller",
                "X-Custom", "value"));

        verify(getRequestedFor(urlEqualTo("/headers"))
                .withHeader("User-Agent", equalTo("caller-agent"))
                .withHeader("Accept", equalTo("application/json"))
                .withHeader("Accept-Language", equalTo("en-US,en;q=0.9"))
                .withHeader("X-Base", equalTo("base-value"))
                .withHeader("X-Shared", equalTo("from-caller"))
                .withHeader("X-Custom", equalTo("value")));
    }

    @Test
    public void testUserAgentIsPickedFromPool() throws Exception {
        givenThat(get(urlEqualTo("/ua")).willReturn(ok()));

        HttpClient client = client(HttpClientConfig.builder().userAgents(List.of("only-agent")));
        client.get(CallContext.create(), url("/ua"), null, null);

        verify(getRequestedFor(urlEqualTo("/ua")).withHeader("User-Agent", equalTo("only-agent")));
    }

    @Test
    public void testUserAgentIsPickedPerAttempt() {
        JdkHttpClient client = (JdkHttpClient) client(HttpClientConfig.builder()
                .userAgents(List.of("UA1", "UA2", "UA3")));

        List<String> picked = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            picked.add(client.pickUserAgent());
        }

        assertTrue(List.of("UA1", "UA2", "UA3").containsAll(picked));
        assertTrue(picked.stream().distinct().count() > 1);
    }

    @Test
    public void testBaseUserAgentIsReplacedByPool() {
        JdkHttpClient client = (JdkHttpClient) client(HttpClientConfig.builder()
                .userAgents(List.of("pool-agent"))
                .baseHeader("User-Agent", "base-agent"));

        Map<String, String> headers = client.requestHeaders(Map.of());

        assertEquals("pool-agent", headers.get("user-agent"));
    }

    @Test
    public void testCustomRetryPredicate() throws Exception {
        givenThat(get(urlEqualTo("/teapot")).willReturn(aResponse().withStatus(418)));
        givenThat(get(urlEqualTo("/error")).willReturn(aResponse().withStatus(500)));

        HttpClient client = client(HttpClientConfig.builder()
                .maxRetries(2)
                .retryOn((status, error) -> status == 418));

        HttpResponse response = client.get(CallContext.create(), url("/error"), null, null);
        assertEquals(500, response.status());
        verify(1, getRequestedFor(urlEqualTo("/error")));

        assertThrows(MaxRetriesExceededException.class,
                () -> client.get(CallContext.create(), url("/teapot"), null, null));
        verify(3, getRequestedFor(urlEqualTo("/teapot")));
    }

    @Test
    public void testTransportErrorIsRetried() {
        givenThat(get(urlEqualTo("/reset")).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        HttpClient client = client(HttpClientConfig.builder().maxRetries(2));
        MaxRetriesExceededException e = assertThrows(MaxRetriesExceededException.class,
                () -> client.get(CallContext.create(), url("/reset"), null, null));

        assertInstanceOf(IOException.class, e.getCause());
        assertTrue(e.getLastStatus().isEmpty());
        verify(moreThanOrExactly(3), getRequestedFor(urlEqualTo("/reset")));
    }

    @Test
    public void testTransportErrorWithoutRetries() {
        givenThat(get(urlEqualTo("/reset")).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        HttpClient client = client(HttpClientConfig.builder().maxRetries(0));
        HttpClientException e = assertThrows(HttpClientException.class,
                () -> client.get(CallContext.create(), url("/reset"), null, null));

        assertEquals(HttpClientException.class, e.getClass());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    public void testNonRetryableTransportErrorIsNotRetried() {
        givenThat(get(urlEqualTo("/reset")).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        HttpClient client = client(HttpClientConfig.builder()
                .maxRetries(3)
                .retryOn((status, error) -> false));
        HttpClientException e = assertThrows(HttpClientException.class,
                () -> client.get(CallContext.create(), url("/reset"), null, null));

        assertEquals(HttpClientException.class, e.getClass());
    }

    @Test
    public void testBodyReadErrorSeesResponseStatus() {
        givenThat(get(urlEqualTo("/broken")).willReturn(aResponse().withFault(Fault.MALFORMED_RESPONSE_CHUNK)));

        List<Integer> statuses = new ArrayList<>();
        HttpClient client = client(HttpClientConfig.builder()
                .maxRetries(1)
                .retryOn((status, error) -> {
                    if (error != null) {
                        statuses.add(status);
                    }
                    return error != null;
                }));

        assertThrows(MaxRetriesExceededException.class,
                () -> client.get(CallContext.create(), url("/broken"), null, null));
        assertTrue(statuses.contains(200), "statuses " + statuses);
    }

    @Test
    public void testAttemptTimeoutIsRetried() {
        givenThat(get(urlEqualTo("/slow")).willReturn(ok().withFixedDelay(2_000)));

        HttpClient client = new JdkHttpClientBuilder().create(HttpClientConfig.builder()
                .timeout(Duration.ofMillis(200))
                .maxRetries(1)
                .backoffInitial(Duration.ofMillis(10))
                .backoffMax(Duration.ofMillis(50))
                .build());

        MaxRetriesExceededException e = assertThrows(MaxRetriesExceededException.class,
                () -> client.get(CallContext.create(), url("/slow"), null, null));
        assertInstanceOf(HttpTimeoutException.class, e.getCause());
    }

    @Test
    public void testPreCancelledContextMakesNoRequest() {
        givenThat(get(urlEqualTo("/down")).willReturn(aResponse().withStatus(503)));

        CallContext ctx = CallContext.create();
        ctx.cancel();
        HttpClient client = client(HttpClientConfig.builder().maxRetries(3));

        RequestCancelledException e = assertThrows(RequestCancelledException.class,
                () -> client.get(ctx, url("/down"), null, null));
        assertEquals(RequestCancelledException.Reason.CANCELLED, e.getReason());
        verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    public void testDeadlineDuringBackoffSleep() {
        givenThat(get(urlEqualTo("/down")).willReturn(aResponse().withStatus(503)));

        HttpClient client = new JdkHttpClientBuilder().create(HttpClientConfig.builder()
                .maxRetries(5)
                .backoffInitial(Duration.ofSeconds(20))
                .backoffMax(Duration.ofSeconds(30))
                .build());

        long start = System.nanoTime();
        RequestCancelledException e = assertThrows(RequestCancelledException.class,
                () -> client.get(CallContext.withTimeout(Duration.ofMillis(300)), url("/down"), null, null));

        assertEquals(RequestCancelledException.Reason.DEADLINE_EXCEEDED, e.getReason());
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(10));
        verify(1, getRequestedFor(urlEqualTo("/down")));
    }

    @Test
    public void testCancelDuringRequest() throws Exception {
        givenThat(get(urlEqualTo("/slow")).willReturn(ok().withFixedDelay(3_000)));

        HttpClient client = client(HttpClientConfig.builder().maxRetries(3));
        CallContext ctx = CallContext.create();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<HttpResponse> call = executor.submit(() -> client.get(ctx, url("/slow"), null, null));
            Thread.sleep(200);
            long start = System.nanoTime();
            ctx.cancel();

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> call.get(5, TimeUnit.SECONDS));
            assertInstanceOf(RequestCancelledException.class, e.getCause());
            assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(2));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testConcurrentCallsShareOneClient() throws Exception {
        givenThat(get(urlPathEqualTo("/concurrent")).willReturn(ok("shared")));

        HttpClient client = client(HttpClientConfig.builder().maxRetries(1));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<HttpResponse>> calls = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                String id = String.valueOf(i);
                calls.add(() -> client.get(CallContext.create(), url("/concurrent"), Map.of("id", id), null));
            }
            for (Future<HttpResponse> result : executor.invokeAll(calls)) {
                assertEquals("shared", result.get().bodyAsString());
            }
        } finally {
            executor.shutdownNow();
        }
        verify(32, getRequestedFor(urlPathEqualTo("/concurrent")));
    }

    @Test
    public void testRetriesAreLogged() {
        givenThat(get(urlEqualTo("/down")).willReturn(aResponse().withStatus(502)));

        Logger logger = (Logger) LoggerFactory.getLogger(JdkHttpClient.class);
        ListAppender<ILoggingEvent> logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        Level previous = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        try {
            HttpClient client = client(HttpClientConfig.builder().maxRetries(2));
            assertThrows(MaxRetriesExceededException.class,
                    () -> client.get(CallContext.create(), url("/down"), null, null));
        } finally {
            logger.detachAppender(logAppender);
            logger.setLevel(previous);
        }

        AtomicInteger retries = new AtomicInteger();
        logAppender.list.forEach(event -> {
            if (event.getLevel() == Level.DEBUG && event.getFormattedMessage().contains("status 502")) {
                retries.incrementAndGet();
            }
        });
        assertEquals(2, retries.get());
    }

    @Test
    public void testCustomTransportIsUsed() {
        java.net.http.HttpClient transport = java.net.http.HttpClient.newHttpClient();

        JdkHttpClient client = (JdkHttpClient) HttpClient.create(HttpClientConfig.defaults(), transport);

        assertSame(transport, client.getTransport());
    }

    @Test
    public void testNullTransportFallsBackToDefault() {
        JdkHttpClient client = (JdkHttpClient) HttpClient.create(HttpClientConfig.defaults(), null);

        assertNotNull(client.getTransport());
        assertEquals(Duration.ofSeconds(5), client.getTransport().connectTimeout().orElseThrow());
    }

    @Test
    public void testConfigIsNormalizedOnce() {
        HttpClientConfig config = HttpClientConfig.builder()
                .timeout(Duration.ofSeconds(5))
                .maxRetries(2)
                .build();

        JdkHttpClient client = (JdkHttpClient) HttpClient.create(config);

        assertSame(config, client.getConfig());
        assertEquals(Duration.ofSeconds(5), client.getConfig().timeout());
    }

    @Test
    public void testTransportManagedHeadersAreSkipped() throws Exception {
        givenThat(get(urlEqualTo("/restricted")).willReturn(ok()));

        HttpClient client = client(HttpClientConfig.builder()
                .baseHeader("Connection", "keep-alive")
                .baseHeader("Host", "example.com")
                .baseHeader("X-Base", "base-value"));
        HttpResponse response = client.get(CallContext.create(), url("/restricted"), null,
                Map.of("expect", "100-continue"));

        assertEquals(200, response.status());
        verify(getRequestedFor(urlEqualTo("/restricted"))
                .withHeader("X-Base", equalTo("base-value"))
                .withHeader("Host", equalTo("localhost:" + server.port())));
    }

    @Test
    public void testTimedOutAttemptClosesConnection() throws Exception {
        try (ServerSocket hanging = new ServerSocket(0)) {
            CompletableFuture<Socket> accepted = CompletableFuture.supplyAsync(() -> {
                try {
                    return hanging.accept();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            HttpClient client = new JdkHttpClientBuilder().create(HttpClientConfig.builder()
                    .timeout(Duration.ofMillis(300))
                    .maxRetries(0)
                    .build());

            HttpClientException e = assertThrows(HttpClientException.class,
                    () -> client.get(CallContext.create(), "http://localhost:" + hanging.getLocalPort() + "/hang",
                            null, null));
            assertInstanceOf(HttpTimeoutException.class, e.getCause());

            try (Socket socket = accepted.get(5, TimeUnit.SECONDS)) {
                assertTrue(isClosedByPeer(socket, 3_000), "connection still open after the attempt timed out");
            }
        }
    }

    private static boolean isClosedByPeer(Socket socket, int timeoutMillis) throws IOException {
        socket.setSoTimeout(timeoutMillis);
        InputStream in = socket.getInputStream();
        byte[] buffer = new byte[1024];
        try {
            // drain the request, then wait for end of stream
            while (in.read(buffer) >= 0) {
                continue;
            }
            return true;
        } catch (SocketTimeoutException e) {
            return false;
        } catch (SocketException e) {
            // reset by the client
            return true;
        }
    }
}
