package com.dynop.routing.hybrid.client;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Network seam under {@link RouteClient}: posts one JSON request to the provider.
 *
 * <p>Implementations must not block the calling thread. Connection problems complete the future
 * exceptionally with an {@link java.io.IOException}; any HTTP status, including errors, completes it normally.
 */
public interface RouteTransport {

    /**
     * @param uri      provider endpoint
     * @param apiKey   value of the {@code Authorization} header
     * @param jsonBody request body
     * @param timeout  bound for this single request
     */
    CompletableFuture<TransportResponse> post(URI uri, String apiKey, String jsonBody, Duration timeout);
}
