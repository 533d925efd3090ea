package com.dynop.routing.hybrid.config;

/**
 * Bridge interface implemented by the Dropwizard configuration so {@link RoutingBundle} can read the
 * routing settings without depending on the concrete configuration class.
 */
public interface RoutingBundleConfiguration {

    /**
     * @return the validated {@code routing:} section
     */
    RoutingConfig getRoutingConfig();

    /**
     * @return size of the routing worker pool; non-positive values select the processor count
     */
    default int getRoutingWorkerThreads() {
        return 0;
    }
}
