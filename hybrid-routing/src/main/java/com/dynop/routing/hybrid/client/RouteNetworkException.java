package com.dynop.routing.hybrid.client;

/**
 * Timeout or connection failure while calling the routing provider.
 */
public class RouteNetworkException extends RouteResolutionException {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String CONNECTION_FAILED = "CONNECTION_FAILED";

    public RouteNetworkException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
