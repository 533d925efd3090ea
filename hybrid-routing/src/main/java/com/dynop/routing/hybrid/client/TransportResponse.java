package com.dynop.routing.hybrid.client;

/**
 * Raw HTTP response from the routing provider.
 *
 * @param statusCode HTTP status
 * @param body       response body, never null
 */
public record TransportResponse(int statusCode, String body) {

    public TransportResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
