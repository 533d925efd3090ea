package com.dynop.routing.hybrid.client;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.dynop.routing.hybrid.config.RoutingConfig;
import com.dynop.routing.hybrid.engine.DelayScheduler;
import com.dynop.routing.hybrid.engine.RequestRateLimiter;
import com.dynop.routing.hybrid.model.RouteQuery;
import com.dynop.routing.hybrid.model.RouteResult;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calls the remote routing provider with a per-attempt timeout and bounded retry.
 *
 * <p>Each attempt is one {@code POST {baseUrl}/{profile}}. Failed attempts are classified as
 * {@link RouteNetworkException} (timeout, connection failure) or {@link RouteProviderException}
 * (non-2xx status, unusable payload) and retried per {@link RetrySchedule}; once attempts are exhausted the
 * returned future fails with the last classified error. No state is kept between calls.
 *
 * <p>Every attempt, retries included, first takes a permit from the shared {@link RequestRateLimiter}, so the
 * limiter counts exactly the requests sent to the provider.
 */
public final class RouteClient {

    private static final Logger LOGGER = Logger.getLogger(RouteClient.class.getName());

    private final RouteTransport transport;
    private final RouteResponseCodec codec;
    private final DelayScheduler delays;
    private final RequestRateLimiter rateLimiter;
    private final URI baseUrl;
    @Nullable
    private final String apiKey;
    private final Duration defaultTimeout;
    private final int defaultMaxRetries;
    private final Duration backoffBase;
    private final Timer attemptLatency;
    private final Meter failedAttempts;

    public RouteClient(RouteTransport transport, RouteResponseCodec codec, DelayScheduler delays,
                       RequestRateLimiter rateLimiter, RoutingConfig config, MetricRegistry metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.delays = Objects.requireNonNull(delays, "delays");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        Objects.requireNonNull(config, "config");
        this.baseUrl = config.getBaseUrl();
        this.apiKey = config.getApiKey().orElse(null);
        this.defaultTimeout = config.getRequestTimeout();
        this.defaultMaxRetries = config.getMaxRetries();
        this.backoffBase = config.getRetryBackoffBase();
        Objects.requireNonNull(metrics, "metrics");
        this.attemptLatency = metrics.timer("routing.provider.latency");
        this.failedAttempts = metrics.meter("routing.provider.failures");
    }

    /**
     * Resolves with the configured timeout and retry count.
     */
    public CompletableFuture<RouteResult> resolve(RouteQuery query) {
        return resolve(query, defaultTimeout, defaultMaxRetries);
    }

    /**
     * @param query      origin, destination and profile
     * @param timeout    bound for each individual attempt
     * @param maxRetries attempts allowed after the first
     * @return future completing with the routed result, or failing with a {@link RouteResolutionException}
     * @throws IllegalStateException if no provider credential is configured
     */
    public CompletableFuture<RouteResult> resolve(RouteQuery query, Duration timeout, int maxRetries) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(timeout, "timeout");
        if (apiKey == null) {
            throw new IllegalStateException("No routing provider API key configured");
        }
        RetrySchedule schedule = new RetrySchedule(maxRetries, backoffBase);
        URI endpoint = endpointFor(query);
        String body = codec.encodeRequest(query);
        return attempt(query, endpoint, body, timeout, schedule, 1);
    }

    private CompletableFuture<RouteResult> attempt(RouteQuery query, URI endpoint, String body, Duration timeout,
                                                   RetrySchedule schedule, int attempt) {
        return rateLimiter.acquire(delays)
                .thenCompose(ignored -> callOnce(endpoint, body, timeout))
                .handle((result, error) -> {
                    if (error == null) {
                        if (attempt > 1) {
                            LOGGER.fine(() -> "Routing succeeded on attempt " + attempt + " for " + query);
                        }
                        return CompletableFuture.completedFuture(result);
                    }
                    RouteResolutionException failure = classify(error);
                    failedAttempts.mark();
                    LOGGER.log(Level.WARNING, () -> String.format("Routing attempt %d/%d failed for %s: %s",
                            attempt, schedule.getMaxAttempts(), query, failure.getMessage()));
                    if (!schedule.hasAttemptAfter(attempt)) {
                        return CompletableFuture.<RouteResult>failedFuture(failure);
                    }
                    Duration backoff = schedule.backoffBefore(attempt + 1);
                    return delays.delay(backoff)
                            .thenCompose(ignored -> attempt(query, endpoint, body, timeout, schedule, attempt + 1));
                })
                .thenCompose(Function.identity());
    }

    private CompletableFuture<RouteResult> callOnce(URI endpoint, String body, Duration timeout) {
        Timer.Context timerContext = attemptLatency.time();
        CompletableFuture<TransportResponse> call;
        try {
            call = transport.post(endpoint, apiKey, body, timeout);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, error) -> timerContext.stop())
                .thenApply(this::decode);
    }

    private RouteResult decode(TransportResponse response) {
        if (!response.isSuccessful()) {
            throw new RouteProviderException(RouteProviderException.HTTP_STATUS,
                    "Provider responded with status " + response.statusCode(), response.statusCode(), null);
        }
        return codec.decodeResponse(response.body());
    }

    private URI endpointFor(RouteQuery query) {
        return URI.create(baseUrl.toString() + "/" + query.getProfile().getProviderProfile());
    }

    static RouteResolutionException classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RouteResolutionException) {
            return (RouteResolutionException) cause;
        }
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return new RouteNetworkException(RouteNetworkException.TIMEOUT, "Request timed out", cause);
        }
        if (cause instanceof IOException) {
            return new RouteNetworkException(RouteNetworkException.CONNECTION_FAILED,
                    String.valueOf(cause.getMessage()), cause);
        }
        return new RouteNetworkException(RouteNetworkException.CONNECTION_FAILED,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
