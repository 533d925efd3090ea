package com.dynop.routing.hybrid.cache;

import com.codahale.metrics.MetricRegistry;
import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.ResolutionMethod;
import com.dynop.routing.hybrid.model.RouteResult;
import com.dynop.routing.hybrid.testutil.InMemoryKeyValueStore;
import com.dynop.routing.hybrid.testutil.MutableClock;
import io.dropwizard.jackson.Jackson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RouteCacheTest {

    private static final RouteResult ROUTED = RouteResult.routed(72.4, 55.0,
            List.of(Coordinate.of(-37.8136, 144.9631), Coordinate.of(-38.1499, 144.3617)), List.of("Head west"));
    private static final RouteResult FALLBACK = RouteResult.estimate(64.0, 128.0, ResolutionMethod.ROUTED_FALLBACK);

    private MutableClock clock;
    private MetricRegistry metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T08:00:00Z");
        metrics = new MetricRegistry();
    }

    @Test
    void entryIsVisibleStrictlyBeforeExpiry() {
        RouteCache cache = newCache(10, null);
        cache.put("route_cache_a", ROUTED, Duration.ofHours(24));

        clock.advance(Duration.ofHours(24).minusMillis(1));
        assertEquals(Optional.of(ROUTED), cache.get("route_cache_a"));

        clock.advance(Duration.ofMillis(1));
        assertEquals(Optional.empty(), cache.get("route_cache_a"));
        assertEquals(0, cache.size());
    }

    @Test
    void putReplacesPreviousEntry() {
        RouteCache cache = newCache(10, null);
        cache.put("route_cache_a", FALLBACK, Duration.ofMinutes(15));
        cache.put("route_cache_a", ROUTED, Duration.ofHours(1));

        assertEquals(Optional.of(ROUTED), cache.get("route_cache_a"));
        assertEquals(1, cache.size());
    }

    @Test
    void entryCountStaysWithinCapacity() {
        RouteCache cache = newCache(2, null);
        cache.put("route_cache_1", ROUTED, Duration.ofHours(1));
        cache.put("route_cache_2", ROUTED, Duration.ofHours(1));
        cache.put("route_cache_3", ROUTED, Duration.ofHours(1));

        assertEquals(2, cache.size());
        assertEquals(2, cache.stats().getCount());
        assertEquals(1, metrics.meter("routing.cache.evictions").getCount());
    }

    @Test
    void routedAndFallbackEntriesKeepTheirOwnTtl() {
        RouteCache cache = newCache(10, null);
        cache.put("route_cache_routed", ROUTED, Duration.ofHours(24));
        cache.put("route_cache_fallback", FALLBACK, Duration.ofMinutes(15));

        clock.advance(Duration.ofMinutes(15));

        assertTrue(cache.get("route_cache_fallback").isEmpty());
        assertEquals(Optional.of(ROUTED), cache.get("route_cache_routed"));
    }

    @Test
    void purgeRemovesOnlyExpiredEntries() {
        RouteCache cache = newCache(10, null);
        cache.put("route_cache_short", FALLBACK, Duration.ofMinutes(15));
        cache.put("route_cache_long", ROUTED, Duration.ofHours(24));

        clock.advance(Duration.ofMinutes(20));

        assertEquals(1, cache.purgeExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.get("route_cache_long").isPresent());
    }

    @Test
    void statsCountLiveEntriesAndTheirSerializedSize() {
        RouteCache cache = newCache(10, null);
        assertEquals(0, cache.stats().getCount());

        cache.put("route_cache_a", ROUTED, Duration.ofHours(1));
        cache.put("route_cache_b", FALLBACK, Duration.ofMinutes(1));
        CacheStats stats = cache.stats();

        assertEquals(2, stats.getCount());
        assertTrue(stats.getApproximateByteSize() > 0);

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, cache.stats().getCount());
    }

    @Test
    void hitsAndMissesAreMetered() {
        RouteCache cache = newCache(10, null);
        cache.get("route_cache_a");
        cache.put("route_cache_a", ROUTED, Duration.ofHours(1));
        cache.get("route_cache_a");

        assertEquals(1, metrics.meter("routing.cache.hits").getCount());
        assertEquals(1, metrics.meter("routing.cache.misses").getCount());
    }

    @Test
    void nonPositiveTtlIsRejected() {
        RouteCache cache = newCache(10, null);
        assertThrows(IllegalArgumentException.class, () -> cache.put("route_cache_a", ROUTED, Duration.ZERO));
    }

    @Test
    void persistedEntriesSurviveANewCacheInstance() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        newCache(10, store).put("route_cache_a", ROUTED, Duration.ofHours(1));

        RouteCache reloaded = newCache(10, store);

        assertEquals(Optional.of(ROUTED), reloaded.get("route_cache_a"));
        assertEquals(1, reloaded.size());
    }

    @Test
    void expiredPersistedEntriesAreDeletedOnRead() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        newCache(10, store).put("route_cache_a", ROUTED, Duration.ofHours(1));
        clock.advance(Duration.ofHours(1));

        assertTrue(newCache(10, store).get("route_cache_a").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void readThroughAtCapacityKeepsThePersistedCopy() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        newCache(1, store).put("route_cache_a", ROUTED, Duration.ofHours(1));
        RouteCache restarted = newCache(1, store);
        restarted.put("route_cache_b", FALLBACK, Duration.ofMinutes(15));

        assertEquals(Optional.of(ROUTED), restarted.get("route_cache_a"));
        assertEquals(Optional.of(ROUTED), restarted.get("route_cache_a"));
        assertTrue(store.get("route_cache_a").isPresent());
        assertTrue(store.get("route_cache_b").isPresent());
        assertEquals(1, restarted.size());
    }

    @Test
    void rewrittenEntryKeepsItsPersistedCopyAfterTheOldOneExpires() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        RouteCache cache = newCache(10, store);
        cache.put("route_cache_a", FALLBACK, Duration.ofMinutes(15));
        clock.advance(Duration.ofMinutes(15));

        assertTrue(cache.get("route_cache_a").isEmpty());
        cache.put("route_cache_a", ROUTED, Duration.ofHours(24));
        assertEquals(0, cache.purgeExpired());

        assertTrue(store.get("route_cache_a").isPresent());
        assertEquals(Optional.of(ROUTED), newCache(10, store).get("route_cache_a"));
    }

    @Test
    void purgeAlsoCleansTheStore() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        newCache(10, store).put("route_cache_a", FALLBACK, Duration.ofMinutes(15));
        RouteCache fresh = newCache(10, store);
        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, fresh.purgeExpired());
        assertEquals(0, store.size());
    }

    @Test
    void clearRemovesMemoryAndStoreEntries() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.set("unrelated", "x".getBytes(StandardCharsets.UTF_8));
        RouteCache cache = newCache(10, store);
        cache.put("route_cache_a", ROUTED, Duration.ofHours(1));

        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(List.of("unrelated"), store.keys(""));
    }

    @Test
    void unreadablePersistedEntryIsDiscarded() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.set("route_cache_a", "not json".getBytes(StandardCharsets.UTF_8));

        assertTrue(newCache(10, store).get("route_cache_a").isEmpty());
        assertTrue(store.get("route_cache_a").isEmpty());
    }

    @Test
    void storeFailuresAreNotFatal() {
        KeyValueStore store = mock(KeyValueStore.class);
        CachePersistenceException failure = new CachePersistenceException("disk full", "route_cache_a", null);
        doThrow(failure).when(store).set(anyString(), any(byte[].class));
        when(store.get(anyString())).thenThrow(failure);
        RouteCache cache = newCache(10, store);

        assertDoesNotThrow(() -> cache.put("route_cache_a", ROUTED, Duration.ofHours(1)));
        assertEquals(Optional.of(ROUTED), cache.get("route_cache_a"));
        assertFalse(cache.get("route_cache_b").isPresent());
    }

    private RouteCache newCache(int maxEntries, KeyValueStore store) {
        return new RouteCache(maxEntries, clock, Jackson.newObjectMapper(), store, metrics);
    }
}
