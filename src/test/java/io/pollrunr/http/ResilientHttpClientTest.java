package io.pollrunr.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResilientHttpClientTest {

    private static final String URL = "https://api.test/data/skills/records";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final AtomicInteger sessionsCreated = new AtomicInteger();
    private HttpClient httpClient;
    private ResilientHttpClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        client = new ResilientHttpClient(RetryPolicy.defaults(), objectMapper, sleeps::add,
                (policy, executor) -> {
                    sessionsCreated.incrementAndGet();
                    return httpClient;
                });
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    @Test
    void shouldReturnDecodedBodyOnSuccess() throws Exception {
        var stubbed = response(200, "{\"code\":200,\"data\":[{\"id\":\"42\"}]}");
        doReturn(stubbed).when(httpClient).send(any(), any());

        HttpResult result = client.post(URL, Map.of("server", "s1"));

        assertTrue(result.isSuccess());
        assertEquals(1, result.attempts());
        assertEquals("42", result.body().path("data").path(0).path("id").asText());
        assertTrue(sleeps.isEmpty());
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    void shouldTreatAny2xxAsSuccess() throws Exception {
        var stubbed = response(204, "");
        doReturn(stubbed).when(httpClient).send(any(), any());

        HttpResult result = client.get(URL);

        assertTrue(result.isSuccess());
        assertTrue(result.body().isNull());
    }

    @Test
    void shouldRaiseImmediatelyOnBadStatusWithoutRetrying() throws Exception {
        var stubbed = response(500, "server error");
        doReturn(stubbed).when(httpClient).send(any(), any());

        var error = assertThrows(FatalProtocolException.class, () -> client.post(URL, Map.of()));

        assertEquals(500, error.getStatus());
        assertEquals("server error", error.getBody());
        assertEquals("POST", error.getMethod());
        assertTrue(sleeps.isEmpty());
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    void shouldRetryConnectionFailuresWithExponentialBackoff() throws Exception {
        var ok = response(200, "{\"code\":200,\"data\":{\"id\":\"7\"}}");
        doThrow(new ConnectException("refused"))
                .doThrow(new ConnectException("refused"))
                .doReturn(ok)
                .when(httpClient).send(any(), any());

        HttpResult result = client.post(URL, Map.of("name", "x"));

        assertTrue(result.isSuccess());
        assertEquals(3, result.attempts());
        assertEquals(List.of(TransportFailure.CONNECTION, TransportFailure.CONNECTION), result.failures());
        assertEquals("7", result.body().path("data").path("id").asText());

        assertEquals(2, sleeps.size());
        assertDelayWithin(sleeps.get(0), Duration.ofMillis(500));
        assertDelayWithin(sleeps.get(1), Duration.ofMillis(1000));
        assertTrue(sleeps.get(0).plus(sleeps.get(1)).compareTo(Duration.ofMillis(1500)) >= 0);
    }

    @Test
    void shouldReportExhaustionInsteadOfThrowingWhenAllAttemptsTimeOut() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(httpClient).send(any(), any());

        HttpResult result = client.post(URL, Map.of());

        assertTrue(result.isExhausted());
        assertNull(result.body());
        assertEquals(3, result.attempts());
        assertEquals(List.of(TransportFailure.TIMEOUT, TransportFailure.TIMEOUT, TransportFailure.TIMEOUT),
                result.failures());
        verify(httpClient, times(3)).send(any(), any());
        assertEquals(3, sleeps.size());
        assertDelayWithin(sleeps.get(0), Duration.ofMillis(500));
        assertDelayWithin(sleeps.get(1), Duration.ofMillis(1000));
        assertDelayWithin(sleeps.get(2), Duration.ofMillis(2000));
        Duration total = sleeps.stream().reduce(Duration.ZERO, Duration::plus);
        assertTrue(total.compareTo(Duration.ofMillis(3500)) >= 0);
    }

    @Test
    void shouldRetryBrokenPayloads() throws Exception {
        var ok = response(200, "{\"ok\":true}");
        doThrow(new IOException("connection reset"))
                .doReturn(ok)
                .when(httpClient).send(any(), any());

        HttpResult result = client.get(URL);

        assertEquals(List.of(TransportFailure.PAYLOAD), result.failures());
        assertTrue(result.body().path("ok").asBoolean());
    }

    @Test
    void shouldCountRetriesPerRequest() throws Exception {
        var ok = response(200, "{}");
        doThrow(new ConnectException("refused"))
                .doThrow(new ConnectException("refused"))
                .doThrow(new ConnectException("refused"))
                .doReturn(ok)
                .when(httpClient).send(any(), any());

        assertTrue(client.get(URL).isExhausted());
        HttpResult second = client.get(URL);

        assertTrue(second.isSuccess());
        assertEquals(1, second.attempts());
        assertTrue(second.failures().isEmpty());
    }

    @Test
    void shouldRethrowMalformedJsonWithoutRetrying() throws Exception {
        var stubbed = response(200, "not json");
        doReturn(stubbed).when(httpClient).send(any(), any());

        assertThrows(JsonProcessingException.class, () -> client.get(URL));
        verify(httpClient, times(1)).send(any(), any());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRethrowUnexpectedErrorsUnchanged() throws Exception {
        var unexpected = new IllegalStateException("bug");
        doThrow(unexpected).when(httpClient).send(any(), any());

        var thrown = assertThrows(IllegalStateException.class, () -> client.get(URL));

        assertSame(unexpected, thrown);
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    void shouldRejectFormAndJsonTogether() {
        assertThrows(IllegalArgumentException.class,
                () -> client.post(URL, Map.of("a", "b"), Map.of("c", "d"), null));
        verifyNoInteractions(httpClient);
        assertEquals(0, sessionsCreated.get());
    }

    @Test
    void shouldSendFormPostWithHeadersAndTimeout() throws Exception {
        var stubbed = response(200, "{}");
        doReturn(stubbed).when(httpClient).send(any(), any());

        client.post(URL, Map.of("server", "s1"), null, Map.of("X-Trace", "abc"));

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertEquals("POST", request.getValue().method());
        assertEquals(URL, request.getValue().uri().toString());
        assertEquals("application/x-www-form-urlencoded",
                request.getValue().headers().firstValue("Content-Type").orElseThrow());
        assertEquals("abc", request.getValue().headers().firstValue("X-Trace").orElseThrow());
        assertEquals(Duration.ofSeconds(10), request.getValue().timeout().orElseThrow());
    }

    @Test
    void shouldSendJsonPost() throws Exception {
        var stubbed = response(200, "{}");
        doReturn(stubbed).when(httpClient).send(any(), any());

        client.post(URL, null, Map.of("id", 1), null);

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertEquals("application/json", request.getValue().headers().firstValue("Content-Type").orElseThrow());
    }

    @Test
    void shouldEncodeQueryParametersForGet() throws Exception {
        var stubbed = response(200, "{}");
        doReturn(stubbed).when(httpClient).send(any(), any());
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("num", 7);
        params.put("name", "two words");
        params.put("skipped", null);

        client.get(URL, params, null);

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertEquals("GET", request.getValue().method());
        assertEquals(URL + "?num=7&name=two+words", request.getValue().uri().toString());
    }

    @Test
    void shouldCreateSessionOnceUnderConcurrentFirstUse() throws Exception {
        var stubbed = response(200, "{}");
        doReturn(stubbed).when(httpClient).send(any(), any());
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<HttpResult>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return client.get(URL);
                }));
            }
            start.countDown();
            for (Future<HttpResult> result : results) {
                assertTrue(result.get(5, TimeUnit.SECONDS).isSuccess());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, sessionsCreated.get());
    }

    @Test
    void closeShouldDropSessionAndNextRequestShouldRecreateIt() throws Exception {
        var stubbed = response(200, "{}");
        doReturn(stubbed).when(httpClient).send(any(), any());

        client.get(URL);
        assertTrue(client.isOpen());

        client.close();
        client.close();
        assertFalse(client.isOpen());

        client.get(URL);
        assertTrue(client.isOpen());
        assertEquals(2, sessionsCreated.get());
    }

    @Test
    void shouldEncodeFormValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("server", "梦江南");
        values.put("num", 0);

        assertEquals("server=%E6%A2%A6%E6%B1%9F%E5%8D%97&num=0", ResilientHttpClient.encode(values));
    }

    private static void assertDelayWithin(Duration actual, Duration base) {
        assertTrue(actual.compareTo(base) >= 0, "delay " + actual + " below " + base);
        assertTrue(actual.compareTo(base.plusMillis(100)) < 0, "delay " + actual + " exceeds jitter bound");
    }
}
