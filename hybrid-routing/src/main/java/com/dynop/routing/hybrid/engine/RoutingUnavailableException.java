package com.dynop.routing.hybrid.engine;

import com.dynop.routing.hybrid.model.RouteQuery;

/**
 * Thrown when forced routing with fallback disabled could not obtain a route.
 *
 * <p>This is the only failure the engine surfaces to its callers; every other configuration degrades to
 * a great-circle estimate.
 */
public class RoutingUnavailableException extends RuntimeException {

    private final RouteQuery query;

    public RoutingUnavailableException(RouteQuery query, Throwable cause) {
        super("Routing unavailable for " + query + ": " + cause.getMessage(), cause);
        this.query = query;
    }

    public RouteQuery getQuery() {
        return query;
    }
}
