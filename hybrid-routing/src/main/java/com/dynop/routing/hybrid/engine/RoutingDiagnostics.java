package com.dynop.routing.hybrid.engine;

import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.RouteQuery;
import com.dynop.routing.hybrid.model.RouteResult;
import com.dynop.routing.hybrid.model.TravelProfile;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

/**
 * Connectivity probe: resolves a short fixed route in the Melbourne CBD with forced routing and reports
 * which method answered and how long it took.
 */
public final class RoutingDiagnostics {

    private static final Logger LOGGER = Logger.getLogger(RoutingDiagnostics.class.getName());

    static final RouteQuery PROBE = RouteQuery.of(
            Coordinate.of(-37.8136, 144.9631),
            Coordinate.of(-37.8200, 144.9700),
            TravelProfile.DRIVING);

    private final DecisionPolicy policy;
    private final Clock clock;

    public RoutingDiagnostics(DecisionPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return future completing with the probe report; it never fails
     */
    public CompletableFuture<DiagnosticsReport> probe() {
        long start = clock.millis();
        CompletableFuture<RouteResult> resolution;
        try {
            resolution = policy.resolve(PROBE, ResolveOptions.defaults().withForceRouting(true));
        } catch (RuntimeException e) {
            resolution = CompletableFuture.failedFuture(e);
        }
        return resolution.handle((result, error) -> {
            long elapsed = clock.millis() - start;
            if (error == null) {
                LOGGER.info(() -> "Routing probe answered with " + result.getMethod().getWireName() + " in " + elapsed + "ms");
                return new DiagnosticsReport(true, result.getMethod().getWireName(), elapsed, null);
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            LOGGER.warning(() -> "Routing probe failed after " + elapsed + "ms: " + cause.getMessage());
            return new DiagnosticsReport(false, DiagnosticsReport.ERROR_METHOD, elapsed, String.valueOf(cause.getMessage()));
        });
    }
}
