package com.dynop.routing.hybrid.config;

import java.util.List;

/**
 * Thrown when the routing configuration is invalid.
 *
 * <p>Raised once, at load time, and never swallowed: the application refuses to start with an invalid
 * provider URL, an unusable credential or out-of-range tuning values.
 */
public class RoutingConfigurationException extends RuntimeException {

    private final List<String> errors;

    public RoutingConfigurationException(List<String> errors) {
        super("Invalid routing configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return every validation error found, in discovery order
     */
    public List<String> getErrors() {
        return errors;
    }
}
