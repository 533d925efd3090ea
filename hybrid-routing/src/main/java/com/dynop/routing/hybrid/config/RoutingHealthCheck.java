package com.dynop.routing.hybrid.config;

import com.codahale.metrics.health.HealthCheck;
import com.dynop.routing.hybrid.engine.DecisionPolicy;
import com.dynop.routing.hybrid.engine.RoutingStatus;

import java.util.Objects;

/**
 * Reports whether routed answers are available. Geometry-only operation is degraded, not unhealthy.
 */
public final class RoutingHealthCheck extends HealthCheck {

    private final DecisionPolicy policy;

    public RoutingHealthCheck(DecisionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    protected Result check() {
        RoutingStatus status = policy.describe();
        ResultBuilder builder = Result.builder()
                .healthy()
                .withDetail("routingEnabled", status.isRoutingEnabled())
                .withDetail("apiKeyConfigured", status.isApiKeyConfigured())
                .withDetail("inFlightRequests", status.getInFlightRequests());
        if (status.isRoutingEnabled()) {
            return builder.withMessage("Routing provider configured").build();
        }
        return builder.withMessage("Routing unavailable, serving straight-line estimates").build();
    }
}
