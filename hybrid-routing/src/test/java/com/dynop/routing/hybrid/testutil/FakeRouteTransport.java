package com.dynop.routing.hybrid.testutil;

import com.dynop.routing.hybrid.client.RouteTransport;
import com.dynop.routing.hybrid.client.TransportResponse;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scripted transport. Queued replies are used in order; once exhausted the default reply is repeated.
 */
public final class FakeRouteTransport implements RouteTransport {

    private final Deque<Supplier<CompletableFuture<TransportResponse>>> script = new ArrayDeque<>();
    private final List<URI> uris = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();
    private final List<String> apiKeys = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private Supplier<CompletableFuture<TransportResponse>> defaultReply =
            () -> CompletableFuture.completedFuture(ok(1234.0, 180.0));

    /**
     * Provider payload with the given summary and a two-point geometry.
     */
    public static TransportResponse ok(double distanceMeters, double durationSeconds) {
        return new TransportResponse(200, String.format(Locale.ROOT,
                "{\"routes\":[{\"summary\":{\"distance\":%.1f,\"duration\":%.1f},"
                        + "\"geometry\":{\"coordinates\":[[144.9631,-37.8136],[144.97,-37.82]]},"
                        + "\"segments\":[{\"steps\":[{\"instruction\":\"Head south\"},{\"instruction\":\"Arrive\"}]}]}]}",
                distanceMeters, durationSeconds));
    }

    public static TransportResponse status(int statusCode) {
        return new TransportResponse(statusCode, "{\"error\":\"failure\"}");
    }

    public synchronized FakeRouteTransport thenReply(TransportResponse response) {
        script.add(() -> CompletableFuture.completedFuture(response));
        return this;
    }

    public synchronized FakeRouteTransport thenFail(Throwable error) {
        script.add(() -> CompletableFuture.failedFuture(error));
        return this;
    }

    public synchronized FakeRouteTransport thenReturn(CompletableFuture<TransportResponse> pending) {
        script.add(() -> pending);
        return this;
    }

    public synchronized FakeRouteTransport byDefault(TransportResponse response) {
        defaultReply = () -> CompletableFuture.completedFuture(response);
        return this;
    }

    public synchronized FakeRouteTransport failByDefault(Throwable error) {
        defaultReply = () -> CompletableFuture.failedFuture(error);
        return this;
    }

    @Override
    public synchronized CompletableFuture<TransportResponse> post(URI uri, String apiKey, String jsonBody,
                                                                  Duration timeout) {
        calls.incrementAndGet();
        uris.add(uri);
        bodies.add(jsonBody);
        apiKeys.add(apiKey);
        Supplier<CompletableFuture<TransportResponse>> next = script.poll();
        return (next != null ? next : defaultReply).get();
    }

    public int getCallCount() {
        return calls.get();
    }

    public synchronized List<URI> getUris() {
        return List.copyOf(uris);
    }

    public synchronized List<String> getBodies() {
        return List.copyOf(bodies);
    }

    public synchronized List<String> getApiKeys() {
        return List.copyOf(apiKeys);
    }
}
