package com.dynop.routing.hybrid.config;

import com.codahale.metrics.MetricRegistry;
import com.dynop.routing.hybrid.cache.KeyValueStore;
import com.dynop.routing.hybrid.cache.RouteCache;
import com.dynop.routing.hybrid.client.RouteClient;
import com.dynop.routing.hybrid.client.RouteResponseCodec;
import com.dynop.routing.hybrid.client.RouteTransport;
import com.dynop.routing.hybrid.engine.BatchScheduler;
import com.dynop.routing.hybrid.engine.DecisionPolicy;
import com.dynop.routing.hybrid.engine.DelayScheduler;
import com.dynop.routing.hybrid.engine.GeometryCalculator;
import com.dynop.routing.hybrid.engine.RequestCoalescer;
import com.dynop.routing.hybrid.engine.RequestRateLimiter;
import com.dynop.routing.hybrid.engine.RoutingDiagnostics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Fully wired resolution engine.
 *
 * <p>Every collaborator is passed in explicitly; there is no process-wide instance. The Dropwizard bundle
 * builds one engine per application, tests build their own with fake transports and clocks.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RoutingEngine engine = RoutingEngine.create(config, transport, delays, objectMapper, clock, null, metrics);
 * engine.getPolicy().resolve(query).thenAccept(result -> ...);
 * }</pre>
 */
public final class RoutingEngine {

    private static final Logger LOGGER = Logger.getLogger(RoutingEngine.class.getName());

    private final RoutingConfig config;
    private final DecisionPolicy policy;
    private final BatchScheduler batchScheduler;
    private final RoutingDiagnostics diagnostics;

    private RoutingEngine(RoutingConfig config, DecisionPolicy policy, BatchScheduler batchScheduler,
                          RoutingDiagnostics diagnostics) {
        this.config = config;
        this.policy = policy;
        this.batchScheduler = batchScheduler;
        this.diagnostics = diagnostics;
    }

    /**
     * @param config       validated configuration
     * @param transport    network seam for provider calls
     * @param delays       non-blocking delay source for backoff and batch pacing
     * @param objectMapper mapper for provider payloads and persisted cache entries
     * @param clock        time source for cache expiry and rate limiting
     * @param store        optional cache persistence, may be null
     * @param metrics      registry for engine meters and timers
     */
    public static RoutingEngine create(RoutingConfig config, RouteTransport transport, DelayScheduler delays,
                                       ObjectMapper objectMapper, Clock clock, @Nullable KeyValueStore store,
                                       MetricRegistry metrics) {
        Objects.requireNonNull(config, "config");
        GeometryCalculator geometry = new GeometryCalculator(config.getEstimatedSpeedsKmh());
        RouteCache cache = new RouteCache(config.getMaxCacheEntries(), clock, objectMapper, store, metrics);
        RequestRateLimiter rateLimiter = new RequestRateLimiter(config.getRequestsPerMinute(), clock);
        RouteClient client = new RouteClient(transport, new RouteResponseCodec(objectMapper), delays, rateLimiter,
                config, metrics);
        DecisionPolicy policy = new DecisionPolicy(config, geometry, cache, new RequestCoalescer(), client, metrics);
        BatchScheduler batchScheduler = new BatchScheduler(policy, delays, metrics);

        if (!config.isApiKeyConfigured()) {
            LOGGER.warning("No routing provider API key configured. Routing will fall back to straight-line distance.");
        } else if (!config.isEnableRouting()) {
            LOGGER.info("Routing disabled by configuration; all distances are straight-line estimates");
        }
        return new RoutingEngine(config, policy, batchScheduler, new RoutingDiagnostics(policy, clock));
    }

    public RoutingConfig getConfig() {
        return config;
    }

    public DecisionPolicy getPolicy() {
        return policy;
    }

    public BatchScheduler getBatchScheduler() {
        return batchScheduler;
    }

    public RoutingDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
