package com.dynop.routing.hybrid.cache;

import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.RouteQuery;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derives cache and coalescing keys from route queries.
 *
 * <p>Coordinates are quantized to six decimal places (about 11 cm) so near-identical queries share an
 * entry. Format: {@code route_cache_{profile}_{lat},{lon}_{lat},{lon}}.
 */
public final class RouteCacheKeys {

    public static final String PREFIX = "route_cache_";

    private static final int PRECISION = 6;

    private RouteCacheKeys() {
        // Utility class
    }

    public static String of(RouteQuery query) {
        return PREFIX + query.getProfile().getId()
                + '_' + quantize(query.getFrom())
                + '_' + quantize(query.getTo());
    }

    private static String quantize(Coordinate coordinate) {
        return quantize(coordinate.getLatitude()) + ',' + quantize(coordinate.getLongitude());
    }

    private static String quantize(double degrees) {
        // BigDecimal drops the sign of a zero, so -0.0000001 and 0.0 share a key
        return BigDecimal.valueOf(degrees).setScale(PRECISION, RoundingMode.HALF_UP).toPlainString();
    }
}
