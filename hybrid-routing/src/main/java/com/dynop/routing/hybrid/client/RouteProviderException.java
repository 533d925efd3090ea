package com.dynop.routing.hybrid.client;

/**
 * Non-success response or unusable payload from the routing provider.
 */
public class RouteProviderException extends RouteResolutionException {

    public static final String HTTP_STATUS = "HTTP_STATUS";
    public static final String MALFORMED_PAYLOAD = "MALFORMED_PAYLOAD";
    public static final String NO_ROUTES = "NO_ROUTES";

    private final int statusCode;

    public RouteProviderException(String errorCode, String message) {
        this(errorCode, message, -1, null);
    }

    public RouteProviderException(String errorCode, String message, int statusCode, Throwable cause) {
        super(errorCode, message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status of the response, or -1 if not applicable
     */
    public int getStatusCode() {
        return statusCode;
    }
}
