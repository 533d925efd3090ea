package com.dynop.routing.hybrid.engine;

import com.dynop.routing.hybrid.model.RouteResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pending remote resolution shared by every caller asking for the same key.
 */
final class InFlightRequest {

    private final String key;
    private final CompletableFuture<RouteResult> pending = new CompletableFuture<>();
    private final AtomicInteger subscriberCount = new AtomicInteger(1);

    InFlightRequest(String key) {
        this.key = key;
    }

    String getKey() {
        return key;
    }

    CompletableFuture<RouteResult> getPending() {
        return pending;
    }

    int subscribe() {
        return subscriberCount.incrementAndGet();
    }

    int getSubscriberCount() {
        return subscriberCount.get();
    }
}
