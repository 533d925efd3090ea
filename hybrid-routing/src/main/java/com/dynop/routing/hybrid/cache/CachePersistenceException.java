package com.dynop.routing.hybrid.cache;

/**
 * Exception thrown when the cache persistence store cannot be read or written.
 *
 * <p>Never surfaced to engine callers: {@link RouteCache} logs it and proceeds as if the entry were absent.
 */
public class CachePersistenceException extends RuntimeException {

    private final String key;

    public CachePersistenceException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * @return the key being accessed, or null for whole-store operations
     */
    public String getKey() {
        return key;
    }
}
