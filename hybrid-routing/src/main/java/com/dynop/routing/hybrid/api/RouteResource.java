package com.dynop.routing.hybrid.api;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.dynop.routing.hybrid.cache.CacheStats;
import com.dynop.routing.hybrid.config.RoutingConfig;
import com.dynop.routing.hybrid.engine.BatchOptions;
import com.dynop.routing.hybrid.engine.BatchScheduler;
import com.dynop.routing.hybrid.engine.DecisionPolicy;
import com.dynop.routing.hybrid.engine.RoutingDiagnostics;
import com.dynop.routing.hybrid.engine.RoutingStatus;
import com.dynop.routing.hybrid.engine.RoutingUnavailableException;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.AsyncResponse;
import jakarta.ws.rs.container.Suspended;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * REST resource exposing hybrid distance resolution.
 *
 * <p>Resolution endpoints suspend the request and resume it when the engine's future settles, so no
 * container thread waits on the routing provider.
 */
@Path("/routes")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RouteResource {

    private static final Logger LOGGER = Logger.getLogger(RouteResource.class.getName());

    private final DecisionPolicy policy;
    private final BatchScheduler batchScheduler;
    private final RoutingDiagnostics diagnostics;
    private final BatchOptions batchDefaults;
    private final Timer distanceLatency;
    private final Timer batchLatency;

    @Inject
    public RouteResource(DecisionPolicy policy,
                         BatchScheduler batchScheduler,
                         RoutingDiagnostics diagnostics,
                         RoutingConfig config,
                         MetricRegistry metrics) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.batchScheduler = Objects.requireNonNull(batchScheduler, "batchScheduler");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.batchDefaults = BatchOptions.from(Objects.requireNonNull(config, "config"));
        Objects.requireNonNull(metrics, "metrics");
        this.distanceLatency = metrics.timer("routes.requests.distance.latency");
        this.batchLatency = metrics.timer("routes.requests.batch.latency");
    }

    @POST
    @Path("/distance")
    public void distance(DistanceRequest request, @Suspended AsyncResponse asyncResponse) {
        if (request == null) {
            throw badRequest("Request body must not be null");
        }
        Timer.Context timerContext = distanceLatency.time();
        policy.resolve(request.toQuery(), request.toResolveOptions())
                .whenComplete((result, error) -> {
                    timerContext.stop();
                    if (error == null) {
                        asyncResponse.resume(result);
                    } else {
                        asyncResponse.resume(translate(error));
                    }
                });
    }

    @POST
    @Path("/batch")
    public void batch(BatchDistanceRequest request, @Suspended AsyncResponse asyncResponse) {
        if (request == null) {
            throw badRequest("Request body must not be null");
        }
        Timer.Context timerContext = batchLatency.time();
        batchScheduler.resolveMany(request.getOrigin(), request.getDestinations(), request.toBatchOptions(batchDefaults))
                .whenComplete((results, error) -> {
                    timerContext.stop();
                    if (error == null) {
                        asyncResponse.resume(new BatchDistanceResponse(results));
                    } else {
                        asyncResponse.resume(translate(error));
                    }
                });
    }

    @GET
    @Path("/cache/stats")
    public CacheStats cacheStats() {
        return policy.cacheStats();
    }

    @DELETE
    @Path("/cache")
    public Response clearCache() {
        policy.clearCache();
        LOGGER.info("Route cache cleared");
        return Response.noContent().build();
    }

    @GET
    @Path("/status")
    public RoutingStatus status() {
        return policy.describe();
    }

    @POST
    @Path("/diagnostics")
    public void diagnostics(@Suspended AsyncResponse asyncResponse) {
        diagnostics.probe().whenComplete((report, error) -> {
            if (error == null) {
                asyncResponse.resume(report);
            } else {
                asyncResponse.resume(translate(error));
            }
        });
    }

    private static WebApplicationException translate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof WebApplicationException) {
            return (WebApplicationException) cause;
        }
        if (cause instanceof RoutingUnavailableException) {
            return new WebApplicationException(errorResponse(Response.Status.SERVICE_UNAVAILABLE, cause.getMessage()));
        }
        if (cause instanceof IllegalArgumentException) {
            return new WebApplicationException(errorResponse(Response.Status.BAD_REQUEST, cause.getMessage()));
        }
        LOGGER.log(Level.WARNING, "Route resolution failed", cause);
        return new WebApplicationException(errorResponse(Response.Status.INTERNAL_SERVER_ERROR,
                "Route resolution failed: " + cause.getMessage()));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Response errorResponse(Response.Status status, String message) {
        return Response.status(status)
                .entity(Collections.singletonMap("message", message))
                .build();
    }

    private static WebApplicationException badRequest(String message) {
        return new WebApplicationException(errorResponse(Response.Status.BAD_REQUEST, message));
    }
}
