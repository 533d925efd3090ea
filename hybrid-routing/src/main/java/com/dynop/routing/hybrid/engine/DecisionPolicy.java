package com.dynop.routing.hybrid.engine;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.dynop.routing.hybrid.cache.CacheStats;
import com.dynop.routing.hybrid.cache.RouteCache;
import com.dynop.routing.hybrid.cache.RouteCacheKeys;
import com.dynop.routing.hybrid.client.RouteClient;
import com.dynop.routing.hybrid.config.RoutingConfig;
import com.dynop.routing.hybrid.model.ResolutionMethod;
import com.dynop.routing.hybrid.model.RouteQuery;
import com.dynop.routing.hybrid.model.RouteResult;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chooses between a great-circle estimate and a routed answer for each query, and orchestrates the cache,
 * the request coalescer and the route client.
 *
 * <p>Rules, evaluated in order:
 * <ol>
 *   <li>Routing disabled or no credential: {@link ResolutionState#GEOMETRY_ONLY}</li>
 *   <li>Origin equals destination, or straight-line distance at most the threshold without forced
 *       routing: {@link ResolutionState#GEOMETRY_ONLY}</li>
 *   <li>Otherwise {@link ResolutionState#ATTEMPT_ROUTE}: a cache hit is returned as is (forced routing
 *       skips the read)</li>
 *   <li>On a miss the provider call is coalesced per cache key</li>
 *   <li>Success: {@link ResolutionState#ROUTED}, cached for the routed TTL</li>
 *   <li>Failure: {@link ResolutionState#FALLBACK}, a {@link ResolutionMethod#ROUTED_FALLBACK} estimate
 *       cached for the shorter fallback TTL</li>
 * </ol>
 *
 * <p>The policy exclusively owns its {@link RouteCache} and {@link RequestCoalescer}.
 */
public final class DecisionPolicy {

    private static final Logger LOGGER = Logger.getLogger(DecisionPolicy.class.getName());

    private final RoutingConfig config;
    private final GeometryCalculator geometry;
    private final RouteCache cache;
    private final RequestCoalescer coalescer;
    private final RouteClient client;
    private final Meter geometryResolutions;
    private final Meter routedResolutions;
    private final Meter fallbackResolutions;

    public DecisionPolicy(RoutingConfig config, GeometryCalculator geometry, RouteCache cache,
                          RequestCoalescer coalescer, RouteClient client, MetricRegistry metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.coalescer = Objects.requireNonNull(coalescer, "coalescer");
        this.client = Objects.requireNonNull(client, "client");
        Objects.requireNonNull(metrics, "metrics");
        this.geometryResolutions = metrics.meter("routing.resolutions.geometry");
        this.routedResolutions = metrics.meter("routing.resolutions.routed");
        this.fallbackResolutions = metrics.meter("routing.resolutions.fallback");
    }

    /**
     * Evaluates the rules that need no cache or network access.
     *
     * @return {@link ResolutionState#GEOMETRY_ONLY} or {@link ResolutionState#ATTEMPT_ROUTE}
     */
    public ResolutionState decide(RouteQuery query, ResolveOptions options) {
        if (!config.isRoutingAvailable()) {
            return ResolutionState.GEOMETRY_ONLY;
        }
        if (query.isDegenerate()) {
            return ResolutionState.GEOMETRY_ONLY;
        }
        if (!options.isForceRouting()) {
            double thresholdKm = options.getThresholdKm().orElse(config.getStraightLineThresholdKm());
            if (GeometryCalculator.distanceKm(query.getFrom(), query.getTo()) <= thresholdKm) {
                return ResolutionState.GEOMETRY_ONLY;
            }
        }
        return ResolutionState.ATTEMPT_ROUTE;
    }

    public CompletableFuture<RouteResult> resolve(RouteQuery query) {
        return resolve(query, ResolveOptions.defaults());
    }

    /**
     * Resolves a query without blocking.
     *
     * @return future completing with the result; it fails only with {@link RoutingUnavailableException},
     * when forced routing with fallback disabled exhausts its retries
     */
    public CompletableFuture<RouteResult> resolve(RouteQuery query, ResolveOptions options) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(options, "options");

        if (decide(query, options) == ResolutionState.GEOMETRY_ONLY) {
            geometryResolutions.mark();
            return CompletableFuture.completedFuture(geometry.estimate(query, ResolutionMethod.GEOMETRY));
        }

        String key = RouteCacheKeys.of(query);
        if (config.isCacheEnabled() && !options.isForceRouting()) {
            Optional<RouteResult> cached = cache.get(key);
            if (cached.isPresent()) {
                RouteResult hit = cached.get();
                LOGGER.fine(() -> "Cache hit for " + query + " resolved "
                        + (hit.getMethod() == ResolutionMethod.ROUTED
                        ? ResolutionState.ROUTED : ResolutionState.GEOMETRY_ONLY));
                return CompletableFuture.completedFuture(shape(hit, options));
            }
        }

        return coalescer.coalesce(key, () -> routeAndCache(query, key))
                .handle((result, error) -> {
                    if (error == null) {
                        return shape(result, options);
                    }
                    return fallbackOrFail(query, options, unwrap(error));
                });
    }

    /**
     * Great-circle estimate for a query, tagged with {@code method}.
     */
    public RouteResult estimate(RouteQuery query, ResolutionMethod method) {
        return geometry.estimate(query, method);
    }

    public RoutingStatus describe() {
        return new RoutingStatus(
                config.isRoutingAvailable(),
                config.isApiKeyConfigured(),
                config.isCacheEnabled(),
                config.getStraightLineThresholdKm(),
                coalescer.inFlightCount());
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * @return number of expired cache entries removed
     */
    public int purgeExpiredCache() {
        return cache.purgeExpired();
    }

    private CompletableFuture<RouteResult> routeAndCache(RouteQuery query, String key) {
        return client.resolve(query).whenComplete((result, error) -> {
            if (error == null) {
                routedResolutions.mark();
                if (config.isCacheEnabled()) {
                    cache.put(key, result, config.getCacheTtl());
                }
                return;
            }
            fallbackResolutions.mark();
            LOGGER.log(Level.WARNING, () -> "All routing attempts failed for " + query + ": " + unwrap(error).getMessage());
            if (config.isCacheEnabled()) {
                cache.put(key, geometry.estimate(query, ResolutionMethod.ROUTED_FALLBACK), config.getFallbackCacheTtl());
            }
        });
    }

    private RouteResult fallbackOrFail(RouteQuery query, ResolveOptions options, Throwable cause) {
        if (options.isForceRouting() && !options.isEnableFallback()) {
            throw new RoutingUnavailableException(query, cause);
        }
        LOGGER.fine(() -> "Falling back to straight-line distance for " + query);
        return geometry.estimate(query, ResolutionMethod.ROUTED_FALLBACK);
    }

    private static RouteResult shape(RouteResult result, ResolveOptions options) {
        return options.isIncludeGeometry() ? result : result.withoutGeometry();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
