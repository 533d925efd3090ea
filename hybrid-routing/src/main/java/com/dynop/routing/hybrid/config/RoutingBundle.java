package com.dynop.routing.hybrid.config;

import com.codahale.metrics.MetricRegistry;
import com.dynop.routing.hybrid.api.RouteResource;
import com.dynop.routing.hybrid.cache.CachePersistenceException;
import com.dynop.routing.hybrid.cache.DirectoryKeyValueStore;
import com.dynop.routing.hybrid.cache.KeyValueStore;
import com.dynop.routing.hybrid.client.JdkHttpRouteTransport;
import com.dynop.routing.hybrid.engine.BatchScheduler;
import com.dynop.routing.hybrid.engine.DecisionPolicy;
import com.dynop.routing.hybrid.engine.ExecutorDelayScheduler;
import com.dynop.routing.hybrid.engine.RoutingDiagnostics;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.Managed;
import org.glassfish.hk2.utilities.binding.AbstractBinder;
import org.jetbrains.annotations.Nullable;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dropwizard bundle that wires the routing worker pool, the resolution engine and the JAX-RS resource.
 *
 * <p>This bundle:
 * <ul>
 *   <li>Creates and manages the routing worker pool, used for HTTP I/O, retry backoff and batch pacing</li>
 *   <li>Opens the optional on-disk cache directory, degrading to memory-only on failure</li>
 *   <li>Schedules the periodic purge of expired cache entries</li>
 *   <li>Registers the engine with HK2 for injection into {@link RouteResource}</li>
 * </ul>
 */
public class RoutingBundle implements ConfiguredBundle<RoutingBundleConfiguration> {

    private static final Logger LOGGER = Logger.getLogger(RoutingBundle.class.getName());

    @Override
    public void initialize(Bootstrap<?> bootstrap) {
        // no-op
    }

    @Override
    public void run(RoutingBundleConfiguration configuration, Environment environment) {
        RoutingConfig routing = configuration.getRoutingConfig();
        int poolSize = resolvePoolSize(configuration);
        AtomicInteger threadCounter = new AtomicInteger(1);
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(poolSize, r -> {
            Thread thread = new Thread(r, "routing-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        environment.lifecycle().manage(new ManagedExecutor(executor, poolSize));

        MetricRegistry metrics = environment.metrics();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(routing.getRequestTimeout())
                .executor(executor)
                .build();

        RoutingEngine engine = RoutingEngine.create(
                routing,
                new JdkHttpRouteTransport(httpClient),
                new ExecutorDelayScheduler(executor),
                environment.getObjectMapper(),
                Clock.systemUTC(),
                openStore(routing),
                metrics);

        schedulePurge(executor, engine.getPolicy(), routing.getCacheCleanupInterval());
        environment.healthChecks().register("routing", new RoutingHealthCheck(engine.getPolicy()));

        environment.jersey().register(new AbstractBinder() {
            @Override
            protected void configure() {
                bind(routing).to(RoutingConfig.class);
                bind(engine.getPolicy()).to(DecisionPolicy.class);
                bind(engine.getBatchScheduler()).to(BatchScheduler.class);
                bind(engine.getDiagnostics()).to(RoutingDiagnostics.class);
                bind(metrics).to(MetricRegistry.class);
            }
        });
        environment.jersey().register(RouteResource.class);

        LOGGER.info(() -> String.format(
                "RoutingBundle initialized: poolSize=%d, routing=%s, cache=%s, thresholdKm=%.2f, provider=%s",
                poolSize,
                routing.isRoutingAvailable() ? "enabled" : "disabled",
                routing.isCacheEnabled() ? "enabled" : "disabled",
                routing.getStraightLineThresholdKm(),
                routing.getBaseUrl()));
    }

    private int resolvePoolSize(RoutingBundleConfiguration configuration) {
        int defaultSize = Runtime.getRuntime().availableProcessors();
        int poolSize = configuration.getRoutingWorkerThreads();
        return poolSize > 0 ? poolSize : defaultSize;
    }

    /**
     * Opens the configured cache directory; returns null (memory-only) when none is configured or it
     * cannot be used.
     */
    @Nullable
    private KeyValueStore openStore(RoutingConfig routing) {
        if (!routing.isCacheEnabled() || routing.getCacheDirectory().isEmpty()) {
            return null;
        }
        Path directory = Path.of(routing.getCacheDirectory().get());
        try {
            return new DirectoryKeyValueStore(directory);
        } catch (CachePersistenceException e) {
            LOGGER.log(Level.WARNING, "Route cache directory unavailable at " + directory
                    + ", continuing with memory-only cache", e);
            return null;
        }
    }

    private void schedulePurge(ScheduledExecutorService executor, DecisionPolicy policy, Duration interval) {
        long periodMillis = interval.toMillis();
        executor.scheduleAtFixedRate(() -> {
            try {
                int purged = policy.purgeExpiredCache();
                if (purged > 0) {
                    LOGGER.info(() -> "Purged " + purged + " expired route cache entries");
                }
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Route cache purge failed", e);
            }
        }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    private static final class ManagedExecutor implements Managed {
        private final ScheduledExecutorService delegate;
        private final int poolSize;

        private ManagedExecutor(ScheduledExecutorService delegate, int poolSize) {
            this.delegate = delegate;
            this.poolSize = poolSize;
        }

        @Override
        public void start() {
            LOGGER.info(() -> "Routing executor started with " + poolSize + " workers");
        }

        @Override
        public void stop() {
            delegate.shutdown();
            try {
                if (!delegate.awaitTermination(30, TimeUnit.SECONDS)) {
                    delegate.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                delegate.shutdownNow();
            }
            LOGGER.info("Routing executor stopped");
        }
    }
}
