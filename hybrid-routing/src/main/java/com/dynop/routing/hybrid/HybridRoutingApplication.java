package com.dynop.routing.hybrid;

import com.dynop.routing.hybrid.config.RoutingBundle;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Dropwizard application serving hybrid distance resolution through {@link RoutingBundle}.
 */
public final class HybridRoutingApplication extends Application<HybridRoutingConfiguration> {

    public static void main(String[] args) throws Exception {
        new HybridRoutingApplication().run(args);
    }

    @Override
    public String getName() {
        return "hybrid-routing";
    }

    @Override
    public void initialize(Bootstrap<HybridRoutingConfiguration> bootstrap) {
        // ${ORS_API_KEY} and friends; undefined variables resolve to their inline defaults
        bootstrap.setConfigurationSourceProvider(new SubstitutingSourceProvider(
                bootstrap.getConfigurationSourceProvider(), new EnvironmentVariableSubstitutor(false)));
        bootstrap.addBundle(new RoutingBundle());
    }

    @Override
    public void run(HybridRoutingConfiguration configuration, Environment environment) {
        // all resources are registered by RoutingBundle
    }
}
