package com.dynop.routing.hybrid.testutil;

import com.dynop.routing.hybrid.cache.KeyValueStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local {@link KeyValueStore}; contents do not survive a restart.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, byte[]> values = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        byte[] value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void set(String key, byte[] value) {
        values.put(key, value.clone());
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    @Override
    public List<String> keys(String prefix) {
        List<String> matches = new ArrayList<>();
        for (String key : values.keySet()) {
            if (key.startsWith(prefix)) {
                matches.add(key);
            }
        }
        return matches;
    }

    public int size() {
        return values.size();
    }
}
