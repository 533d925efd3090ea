package com.dynop.routing.hybrid.cache;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.dynop.routing.hybrid.model.RouteResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expiring route result cache with an optional persistent backing store.
 *
 * <p>Behavior:
 * <ul>
 *   <li>Entries are never returned once their expiry instant has been reached. Each entry carries its own
 *       expiry, so routed and fallback results live for different periods</li>
 *   <li>The in-memory entry count never exceeds {@code maxEntries}</li>
 *   <li>With a {@link KeyValueStore}, writes go through to the store and in-memory misses read from it;
 *       store failures are logged and treated as misses</li>
 * </ul>
 *
 * <p>The in-memory layer is a Caffeine cache whose ticker follows the injected {@link Clock}. Store writes and
 * deletions for a key run inside Caffeine's atomic compute for that key, and a persisted copy is only deleted
 * after it has been read back and found expired or unreadable. Capacity evictions leave the store untouched.
 */
public final class RouteCache {

    private static final Logger LOGGER = Logger.getLogger(RouteCache.class.getName());

    private final int maxEntries;
    private final Clock clock;
    private final Instant origin;
    private final ObjectMapper objectMapper;
    @Nullable
    private final KeyValueStore store;
    private final Cache<String, StoredEntry> entries;
    private final Meter hits;
    private final Meter misses;
    private final Meter evictions;
    @Nullable
    private volatile Set<String> purging;

    /**
     * @param maxEntries   hard cap on in-memory entries
     * @param clock        time source for expiry checks
     * @param objectMapper mapper able to (de)serialize {@link java.time.Instant}
     * @param store        optional persistence, may be null
     * @param metrics      registry for hit/miss/eviction meters
     */
    public RouteCache(int maxEntries, Clock clock, ObjectMapper objectMapper,
                      @Nullable KeyValueStore store, MetricRegistry metrics) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.origin = clock.instant();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.store = store;
        Objects.requireNonNull(metrics, "metrics");
        this.hits = metrics.meter("routing.cache.hits");
        this.misses = metrics.meter("routing.cache.misses");
        this.evictions = metrics.meter("routing.cache.evictions");
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry())
                .ticker(() -> nanosSinceOrigin(clock.instant()))
                .executor(Runnable::run)
                .evictionListener(this::onEviction)
                .build();
    }

    /**
     * Looks up a live entry, reading through to the store on an in-memory miss.
     *
     * @return the cached result, empty if absent or expired
     */
    public Optional<RouteResult> get(String key) {
        StoredEntry stored = entries.get(key, this::loadPersisted);
        if (stored == null) {
            misses.mark();
            return Optional.empty();
        }
        hits.mark();
        return Optional.of(stored.entry().getResult());
    }

    /**
     * Stores a result for {@code ttl}, replacing any previous entry for the key.
     */
    public void put(String key, RouteResult result, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(result, "result");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(result, now, now.plus(ttl));
        byte[] serialized = serialize(key, entry);
        StoredEntry stored = new StoredEntry(entry, serialized == null ? 0 : serialized.length);
        entries.asMap().compute(key, (k, previous) -> {
            if (serialized != null) {
                persist(k, serialized);
            }
            return stored;
        });
    }

    /**
     * Removes every entry, including persisted ones.
     */
    public void clear() {
        entries.cleanUp();
        long removed = entries.estimatedSize();
        entries.invalidateAll();
        if (store != null) {
            try {
                List<String> keys = store.keys(RouteCacheKeys.PREFIX);
                for (String key : keys) {
                    store.delete(key);
                }
                removed = Math.max(removed, keys.size());
            } catch (CachePersistenceException e) {
                LOGGER.log(Level.WARNING, "Failed to clear persisted cache: " + e.getMessage(), e);
            }
        }
        long finalRemoved = removed;
        LOGGER.info(() -> "Cleared " + finalRemoved + " cached routes");
    }

    /**
     * Reclaims expired in-memory entries and deletes expired persisted copies.
     *
     * <p>Expired entries are already invisible to {@link #get}; purging only releases what they hold.
     *
     * @return number of distinct keys removed
     */
    public synchronized int purgeExpired() {
        Set<String> removed = ConcurrentHashMap.newKeySet();
        purging = removed;
        try {
            entries.cleanUp();
            if (store != null) {
                purgeStore(removed);
            }
        } finally {
            purging = null;
        }
        int count = removed.size();
        LOGGER.fine(() -> "Purged " + count + " expired cache entries");
        return count;
    }

    /**
     * @return count and serialized size of the live in-memory entries
     */
    public CacheStats stats() {
        Instant now = clock.instant();
        int count = 0;
        long bytes = 0;
        for (StoredEntry stored : entries.asMap().values()) {
            if (!stored.entry().isExpired(now)) {
                count++;
                bytes += stored.approximateBytes();
            }
        }
        return new CacheStats(count, bytes);
    }

    /**
     * @return number of in-memory entries after pending maintenance has run
     */
    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private void purgeStore(Set<String> removed) {
        List<String> keys;
        try {
            keys = store.keys(RouteCacheKeys.PREFIX);
        } catch (CachePersistenceException e) {
            LOGGER.log(Level.WARNING, "Failed to purge persisted cache: " + e.getMessage(), e);
            return;
        }
        for (String key : keys) {
            entries.asMap().compute(key, (k, live) -> {
                if (live != null) {
                    return live;
                }
                if (readPersisted(k, clock.instant()) == null) {
                    removed.add(k);
                }
                return null;
            });
        }
    }

    // runs inside Caffeine's compute for the key
    @Nullable
    private StoredEntry loadPersisted(String key) {
        return readPersisted(key, clock.instant());
    }

    /**
     * Reads a persisted entry, deleting it from the store when it is expired or unreadable. Callers hold the
     * key's compute lock.
     *
     * @return the live entry, or null when there is none
     */
    @Nullable
    private StoredEntry readPersisted(String key, Instant now) {
        if (store == null) {
            return null;
        }
        try {
            Optional<byte[]> bytes = store.get(key);
            if (bytes.isEmpty()) {
                return null;
            }
            CacheEntry entry = objectMapper.readValue(bytes.get(), CacheEntry.class);
            if (entry.isExpired(now)) {
                store.delete(key);
                return null;
            }
            return new StoredEntry(entry, bytes.get().length);
        } catch (CachePersistenceException e) {
            LOGGER.log(Level.WARNING, "Failed to read persisted cache entry " + key + ": " + e.getMessage(), e);
            return null;
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.log(Level.WARNING, "Discarding unreadable cache entry " + key + ": " + e.getMessage(), e);
            deletePersisted(key);
            return null;
        }
    }

    private void persist(String key, byte[] serialized) {
        if (store == null) {
            return;
        }
        try {
            store.set(key, serialized);
        } catch (CachePersistenceException e) {
            LOGGER.log(Level.WARNING, "Failed to persist cache entry " + key + ": " + e.getMessage(), e);
        }
    }

    private void deletePersisted(String key) {
        try {
            store.delete(key);
        } catch (CachePersistenceException e) {
            LOGGER.log(Level.WARNING, "Failed to delete persisted cache entry " + key + ": " + e.getMessage(), e);
        }
    }

    private void onEviction(@Nullable String key, @Nullable StoredEntry stored, RemovalCause cause) {
        if (cause == RemovalCause.SIZE) {
            evictions.mark();
            LOGGER.fine(() -> "Evicted " + key + " over capacity " + maxEntries);
        } else if (cause == RemovalCause.EXPIRED) {
            Set<String> collecting = purging;
            if (collecting != null && key != null) {
                collecting.add(key);
            }
        }
    }

    @Nullable
    private byte[] serialize(String key, CacheEntry entry) {
        try {
            return objectMapper.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.WARNING, "Failed to serialize cache entry " + key + ": " + e.getMessage(), e);
            return null;
        }
    }

    private long nanosSinceOrigin(Instant instant) {
        return Duration.between(origin, instant).toNanos();
    }

    private final class EntryExpiry implements Expiry<String, StoredEntry> {

        @Override
        public long expireAfterCreate(String key, StoredEntry stored, long currentTime) {
            return Math.max(0, nanosSinceOrigin(stored.entry().getExpiresAt()) - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, StoredEntry stored, long currentTime, long currentDuration) {
            return expireAfterCreate(key, stored, currentTime);
        }

        @Override
        public long expireAfterRead(String key, StoredEntry stored, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    private record StoredEntry(CacheEntry entry, long approximateBytes) {
    }
}
