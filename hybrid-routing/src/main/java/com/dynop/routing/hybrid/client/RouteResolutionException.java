package com.dynop.routing.hybrid.client;

/**
 * Failure of a single routing provider attempt.
 *
 * <p>Possible error codes:
 * <ul>
 *   <li>{@code TIMEOUT} - the attempt exceeded its timeout</li>
 *   <li>{@code CONNECTION_FAILED} - the provider could not be reached</li>
 *   <li>{@code HTTP_STATUS} - the provider answered with a non-2xx status</li>
 *   <li>{@code MALFORMED_PAYLOAD} - the response body could not be parsed</li>
 *   <li>{@code NO_ROUTES} - the response contained no route</li>
 * </ul>
 *
 * @see RouteNetworkException
 * @see RouteProviderException
 */
public abstract class RouteResolutionException extends RuntimeException {

    private final String errorCode;

    protected RouteResolutionException(String errorCode, String message, Throwable cause) {
        super(errorCode + ": " + message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return error code (e.g., "TIMEOUT")
     */
    public String getErrorCode() {
        return errorCode;
    }
}
