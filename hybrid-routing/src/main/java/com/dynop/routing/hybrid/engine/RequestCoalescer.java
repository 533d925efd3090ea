package com.dynop.routing.hybrid.engine;

import com.dynop.routing.hybrid.model.RouteResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Registry of in-flight resolutions guaranteeing at most one concurrent remote call per key.
 *
 * <p>The first caller for a key registers an {@link InFlightRequest} and runs the factory; callers arriving
 * while it is pending share its outcome. The entry is removed exactly once, as soon as the factory's
 * future settles, before waiters are completed. A factory that throws settles the entry exceptionally.
 *
 * <p>Each caller receives its own dependent future, so cancelling one does not affect the others.
 */
public final class RequestCoalescer {

    private static final Logger LOGGER = Logger.getLogger(RequestCoalescer.class.getName());

    private final ConcurrentMap<String, InFlightRequest> inFlight = new ConcurrentHashMap<>();

    /**
     * @param key     coalescing key
     * @param factory starts the remote resolution; invoked only by the first caller for a pending key
     * @return a future completing with the shared outcome
     */
    public CompletableFuture<RouteResult> coalesce(String key, Supplier<CompletableFuture<RouteResult>> factory) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(factory, "factory");

        InFlightRequest created = new InFlightRequest(key);
        InFlightRequest existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            int subscribers = existing.subscribe();
            LOGGER.fine(() -> "Joined in-flight request " + key + " (" + subscribers + " subscribers)");
            return existing.getPending().copy();
        }

        CompletableFuture<RouteResult> source;
        try {
            source = Objects.requireNonNull(factory.get(), "factory returned null");
        } catch (RuntimeException e) {
            settle(created, null, e);
            return created.getPending().copy();
        }
        source.whenComplete((result, error) -> settle(created, result, error));
        return created.getPending().copy();
    }

    /**
     * @return number of keys currently being resolved
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * @return callers sharing the pending request for {@code key}, or 0 if none is pending
     */
    public int subscriberCount(String key) {
        InFlightRequest request = inFlight.get(key);
        return request == null ? 0 : request.getSubscriberCount();
    }

    private void settle(InFlightRequest request, RouteResult result, Throwable error) {
        inFlight.remove(request.getKey(), request);
        if (error != null) {
            request.getPending().completeExceptionally(error);
        } else {
            request.getPending().complete(result);
        }
    }
}
