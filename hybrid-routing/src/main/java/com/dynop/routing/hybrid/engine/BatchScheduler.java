package com.dynop.routing.hybrid.engine;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.Destination;
import com.dynop.routing.hybrid.model.ResolutionMethod;
import com.dynop.routing.hybrid.model.RouteQuery;
import com.dynop.routing.hybrid.model.RouteResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves one origin against many destinations under the provider's concurrency and rate ceiling.
 *
 * <p>Destinations that {@link DecisionPolicy#decide} resolves geometrically are answered immediately. The
 * rest are split into groups of {@code batchSize}; a group is dispatched concurrently once the previous
 * group has settled and {@code interBatchDelay} has elapsed. Provider calls made on behalf of a group are
 * paced by the {@link RequestRateLimiter} inside {@link com.dynop.routing.hybrid.client.RouteClient}, so
 * destinations answered from the cache or joined to an in-flight call cost no permit. A failure for one
 * destination falls back to its own estimate and never affects its siblings.
 */
public final class BatchScheduler {

    private static final Logger LOGGER = Logger.getLogger(BatchScheduler.class.getName());

    private final DecisionPolicy policy;
    private final DelayScheduler delays;
    private final Timer batchLatency;
    private final Meter dispatchedGroups;

    public BatchScheduler(DecisionPolicy policy, DelayScheduler delays, MetricRegistry metrics) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.delays = Objects.requireNonNull(delays, "delays");
        Objects.requireNonNull(metrics, "metrics");
        this.batchLatency = metrics.timer("routing.batch.latency");
        this.dispatchedGroups = metrics.meter("routing.batch.groups");
    }

    /**
     * @param origin       shared origin
     * @param destinations identified destinations; ids must be unique
     * @param options      profile, batching and per-query options
     * @return future completing with one result per destination, in input order; it never fails
     * @throws IllegalArgumentException if two destinations share an id
     */
    public CompletableFuture<Map<String, RouteResult>> resolveMany(Coordinate origin, List<Destination> destinations,
                                                                    BatchOptions options) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destinations, "destinations");
        Objects.requireNonNull(options, "options");
        requireUniqueIds(destinations);

        if (destinations.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyMap());
        }

        Map<String, RouteResult> results = new ConcurrentHashMap<>();
        List<Destination> routed = new ArrayList<>();
        ResolveOptions resolveOptions = options.getResolveOptions();
        for (Destination destination : destinations) {
            RouteQuery query = RouteQuery.of(origin, destination.getCoordinate(), options.getProfile());
            if (policy.decide(query, resolveOptions) == ResolutionState.GEOMETRY_ONLY) {
                results.put(destination.getId(), policy.estimate(query, ResolutionMethod.GEOMETRY));
            } else {
                routed.add(destination);
            }
        }

        List<List<Destination>> groups = partition(routed, options.getBatchSize());
        LOGGER.fine(() -> String.format("Batch of %d destinations: %d geometric, %d routed in %d groups",
                destinations.size(), destinations.size() - routed.size(), routed.size(), groups.size()));

        Timer.Context timerContext = batchLatency.time();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int i = 0; i < groups.size(); i++) {
            List<Destination> group = groups.get(i);
            int groupIndex = i;
            chain = chain
                    .thenCompose(ignored -> groupIndex == 0
                            ? CompletableFuture.<Void>completedFuture(null)
                            : delays.delay(options.getInterBatchDelay()))
                    .thenCompose(ignored -> dispatch(origin, group, groupIndex, options, results));
        }

        return chain.handle((ignored, error) -> {
            timerContext.stop();
            if (error != null) {
                // pacing failed (e.g. scheduler shut down); estimate whatever is still missing
                LOGGER.log(Level.WARNING, "Batch dispatch interrupted: " + error.getMessage(), error);
                for (Destination destination : routed) {
                    results.computeIfAbsent(destination.getId(), id -> fallbackFor(origin, destination, options));
                }
            }
            return inInputOrder(destinations, results);
        });
    }

    private CompletableFuture<Void> dispatch(Coordinate origin, List<Destination> group, int groupIndex,
                                             BatchOptions options, Map<String, RouteResult> results) {
        dispatchedGroups.mark();
        LOGGER.fine(() -> "Dispatching batch group " + groupIndex + " with " + group.size() + " destinations");
        List<CompletableFuture<Void>> pending = new ArrayList<>(group.size());
        for (Destination destination : group) {
            RouteQuery query = RouteQuery.of(origin, destination.getCoordinate(), options.getProfile());
            CompletableFuture<Void> item = policy.resolve(query, options.getResolveOptions())
                    .exceptionally(error -> {
                        LOGGER.log(Level.WARNING, () -> "Routing failed for destination " + destination.getId()
                                + ": " + error.getMessage());
                        return policy.estimate(query, ResolutionMethod.ROUTED_FALLBACK);
                    })
                    .thenAccept(result -> results.put(destination.getId(), result));
            pending.add(item);
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
    }

    private RouteResult fallbackFor(Coordinate origin, Destination destination, BatchOptions options) {
        return policy.estimate(RouteQuery.of(origin, destination.getCoordinate(), options.getProfile()),
                ResolutionMethod.ROUTED_FALLBACK);
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> groups = new ArrayList<>((items.size() + size - 1) / size);
        for (int start = 0; start < items.size(); start += size) {
            groups.add(List.copyOf(items.subList(start, Math.min(start + size, items.size()))));
        }
        return groups;
    }

    private static void requireUniqueIds(List<Destination> destinations) {
        Set<String> seen = new HashSet<>();
        for (Destination destination : destinations) {
            if (!seen.add(destination.getId())) {
                throw new IllegalArgumentException("Duplicate destination id: " + destination.getId());
            }
        }
    }

    private static Map<String, RouteResult> inInputOrder(List<Destination> destinations,
                                                         Map<String, RouteResult> results) {
        Map<String, RouteResult> ordered = new LinkedHashMap<>();
        for (Destination destination : destinations) {
            ordered.put(destination.getId(), results.get(destination.getId()));
        }
        return Collections.unmodifiableMap(ordered);
    }
}
