package com.dynop.routing.hybrid.cache;

import java.util.List;
import java.util.Optional;

/**
 * Byte-oriented key/value store used to persist cache entries across restarts.
 *
 * <p>Implementations signal failures with {@link CachePersistenceException}. Callers treat every failure
 * as non-fatal.
 */
public interface KeyValueStore {

    /**
     * @return stored bytes, empty if the key is absent
     */
    Optional<byte[]> get(String key);

    void set(String key, byte[] value);

    /**
     * Removes a key; removing an absent key is a no-op.
     */
    void delete(String key);

    /**
     * @return all keys starting with {@code prefix}, in no particular order
     */
    List<String> keys(String prefix);
}
