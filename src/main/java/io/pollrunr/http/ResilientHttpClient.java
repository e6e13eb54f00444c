package io.pollrunr.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.pollrunr.support.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Shared outbound HTTP client with bounded retry and exponential backoff.
 *
 * <p>The underlying {@link HttpClient} (and its connection pool) is created on first use
 * under a lock, so concurrent first requests share one session. {@link #close()} drops it;
 * the next request creates a fresh one.</p>
 *
 * <p>Per request: a 2xx response is decoded and returned; any other status raises
 * {@link FatalProtocolException} at once. Connection, payload and timeout failures
 * ({@link TransportFailure}) are retried up to {@link RetryPolicy#maxRetries()} attempts in total.
 * Every such failure backs off before the next attempt, the last one included, and then an
 * {@link HttpResult.Outcome#EXHAUSTED EXHAUSTED} result is returned instead of throwing. Everything else is logged and rethrown unchanged.</p>
 */
public class ResilientHttpClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientHttpClient.class);

    /** Creates the pooled client for a new session. */
    @FunctionalInterface
    interface SessionFactory {
        HttpClient create(RetryPolicy policy, Executor executor);
    }

    private final RetryPolicy policy;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final SessionFactory sessionFactory;

    private final ReentrantLock sessionLock = new ReentrantLock();
    private volatile Session session;
    private final Map<String, Semaphore> hostPermits = new ConcurrentHashMap<>();

    public ResilientHttpClient(RetryPolicy policy, ObjectMapper objectMapper, Sleeper sleeper) {
        this(policy, objectMapper, sleeper, ResilientHttpClient::newHttpClient);
    }

    ResilientHttpClient(RetryPolicy policy, ObjectMapper objectMapper, Sleeper sleeper,
                        SessionFactory sessionFactory) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    }

    // --- Public API ---

    public HttpResult get(String url) throws IOException, InterruptedException {
        return get(url, null, null);
    }

    /**
     * Sends a GET with the given query parameters.
     *
     * @param params  query parameters; null values are skipped
     * @param headers extra request headers, may be null
     */
    public HttpResult get(String url, Map<String, ?> params, Map<String, String> headers)
            throws IOException, InterruptedException {
        URI uri = withQuery(url, params);
        return execute("GET", uri, HttpRequest.newBuilder(uri).GET(), headers);
    }

    public HttpResult post(String url, Map<String, ?> formData) throws IOException, InterruptedException {
        return post(url, formData, null, null);
    }

    /**
     * Sends a POST carrying either form data or a JSON body.
     *
     * @param formData sent as {@code application/x-www-form-urlencoded}, may be null
     * @param jsonBody serialized with Jackson and sent as {@code application/json}, may be null
     * @param headers  extra request headers, may be null
     * @throws IllegalArgumentException if both form data and a JSON body are given
     */
    public HttpResult post(String url, Map<String, ?> formData, Object jsonBody, Map<String, String> headers)
            throws IOException, InterruptedException {
        if (formData != null && jsonBody != null) {
            throw new IllegalArgumentException("Pass either form data or a JSON body, not both");
        }
        URI uri = URI.create(url);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri);
        if (jsonBody != null) {
            builder.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(jsonBody)));
        } else if (formData != null) {
            builder.header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(encode(formData)));
        } else {
            builder.POST(HttpRequest.BodyPublishers.noBody());
        }
        return execute("POST", uri, builder, headers);
    }

    /**
     * Tears down the shared session. Safe to call when no session exists.
     */
    public void close() {
        sessionLock.lock();
        try {
            if (session != null) {
                session.executor().shutdownNow();
                session = null;
                log.info("Closed shared HTTP session");
            }
        } finally {
            sessionLock.unlock();
        }
    }

    public boolean isOpen() {
        return session != null;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    // --- Request loop ---

    private HttpResult execute(String method, URI uri, HttpRequest.Builder builder, Map<String, String> headers)
            throws IOException, InterruptedException {
        builder.timeout(policy.timeout()).header("Accept", "application/json");
        if (headers != null) {
            headers.forEach(builder::header);
        }
        HttpRequest request = builder.build();
        HttpClient client = session();

        List<TransportFailure> failures = new ArrayList<>();
        int attempts = 0;
        while (attempts < policy.maxRetries()) {
            try {
                HttpResponse<String> response = send(client, request);
                int status = response.statusCode();
                if (status < 200 || status >= 300) {
                    throw new FatalProtocolException(method, uri, status, response.body());
                }
                return HttpResult.success(decode(response.body()), attempts + 1, failures);
            } catch (IOException e) {
                TransportFailure failure = TransportFailure.classify(e).orElse(null);
                if (failure == null) {
                    log.error("Non-retryable failure for {} {}: {}", method, uri, e.toString());
                    throw e;
                }
                failures.add(failure);
                Duration delay = policy.backoffDelay(attempts, ThreadLocalRandom.current().nextDouble());
                log.warn("{} {} failed ({}), backing off {} ms: {}",
                        method, uri, failure, delay.toMillis(), e.toString());
                sleeper.sleep(delay);
                attempts++;
            } catch (RuntimeException e) {
                log.error("Non-retryable failure for {} {}: {}", method, uri, e.toString());
                throw e;
            }
        }
        log.warn("{} {} gave up after {} attempts: {}", method, uri, attempts, failures);
        return HttpResult.exhausted(attempts, failures);
    }

    private HttpResponse<String> send(HttpClient client, HttpRequest request) throws IOException, InterruptedException {
        Semaphore permits = hostPermits.computeIfAbsent(hostKey(request.uri()),
                host -> new Semaphore(policy.maxConnectionsPerHost(), true));
        permits.acquire();
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } finally {
            permits.release();
        }
    }

    private JsonNode decode(String body) throws IOException {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        return objectMapper.readTree(body);
    }

    // --- Session ---

    HttpClient session() {
        Session current = session;
        if (current != null) {
            return current.client();
        }
        sessionLock.lock();
        try {
            if (session == null) {
                ExecutorService executor = Executors.newCachedThreadPool(daemonThreads());
                session = new Session(sessionFactory.create(policy, executor), executor);
                log.info("Created shared HTTP session (timeout {}, max {} connections per host)",
                        policy.timeout(), policy.maxConnectionsPerHost());
            }
            return session.client();
        } finally {
            sessionLock.unlock();
        }
    }

    static HttpClient newHttpClient(RetryPolicy policy, Executor executor) {
        return HttpClient.newBuilder()
                .connectTimeout(policy.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(executor)
                .build();
    }

    private record Session(HttpClient client, ExecutorService executor) {}

    // --- Helpers ---

    static URI withQuery(String url, Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return URI.create(url);
        }
        String query = encode(params);
        if (query.isEmpty()) {
            return URI.create(url);
        }
        return URI.create(url + (url.contains("?") ? "&" : "?") + query);
    }

    static String encode(Map<String, ?> values) {
        return values.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    private static String hostKey(URI uri) {
        return uri.getScheme() + "://" + uri.getHost() + ":" + uri.getPort();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "pollrunr-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
