package com.dynop.routing.hybrid;

import com.dynop.routing.hybrid.config.RoutingBundleConfiguration;
import com.dynop.routing.hybrid.config.RoutingConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;

/**
 * Configuration type for {@link HybridRoutingApplication}. Adds the {@code routing:} section and the
 * worker pool size to the standard Dropwizard server settings.
 */
public class HybridRoutingConfiguration extends Configuration implements RoutingBundleConfiguration {

    private RoutingConfig routing = RoutingConfig.defaults();

    private int routingWorkerThreads;

    @Override
    @JsonProperty("routing")
    public RoutingConfig getRoutingConfig() {
        return routing;
    }

    @JsonProperty("routing")
    public void setRoutingConfig(RoutingConfig routing) {
        this.routing = routing;
    }

    @Override
    @JsonProperty("routingWorkerThreads")
    public int getRoutingWorkerThreads() {
        return routingWorkerThreads;
    }

    @JsonProperty("routingWorkerThreads")
    public void setRoutingWorkerThreads(int routingWorkerThreads) {
        this.routingWorkerThreads = routingWorkerThreads;
    }
}
