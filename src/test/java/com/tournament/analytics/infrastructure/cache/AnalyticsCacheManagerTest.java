package com.tournament.analytics.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.aggregation.PeriodBoundary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AnalyticsCacheManager against an in-memory store.
 */
class AnalyticsCacheManagerTest {

    private static final String KEY = "analytics:revenue:tenant-1:2024-06";

    private InMemoryCacheStore store;
    private AnalyticsCacheManager cacheManager;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        cacheManager = new AnalyticsCacheManager(store, new ObjectMapper().findAndRegisterModules(),
                new SimpleMeterRegistry(), Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC), 100);
    }

    @Test
    void testGetOrSet_SecondCallServedFromCache() {
        // Given
        AtomicInteger loads = new AtomicInteger();

        // When
        CacheResult<PeriodBoundary> first = cacheManager.getOrSetResult(KEY, PeriodBoundary.class, () -> {
            loads.incrementAndGet();
            return PeriodBoundary.containing(LocalDate.of(2024, 6, 15), PeriodType.MONTH);
        }, CacheTtl.SHORT);
        CacheResult<PeriodBoundary> second = cacheManager.getOrSetResult(KEY, PeriodBoundary.class, () -> {
            loads.incrementAndGet();
            return null;
        }, CacheTtl.SHORT);

        // Then
        assertEquals(1, loads.get());
        assertEquals(CacheResult.Status.COMPUTED, first.getStatus());
        assertTrue(second.isHit());
        assertEquals(LocalDate.of(2024, 6, 30), second.orElse(null).getEnd());
        assertEquals(Duration.ofSeconds(300), store.ttlOf(KEY));
    }

    @Test
    void testSetGetDelete_RoundTrip() {
        // Given
        PeriodBoundary june = PeriodBoundary.containing(LocalDate.of(2024, 6, 15), PeriodType.MONTH);

        // When
        CacheResult<Void> stored = cacheManager.set(KEY, june, CacheTtl.LONG);
        CacheResult<PeriodBoundary> afterSet = cacheManager.get(KEY, PeriodBoundary.class);
        CacheResult<Boolean> deleted = cacheManager.delete(KEY);
        CacheResult<PeriodBoundary> afterDelete = cacheManager.get(KEY, PeriodBoundary.class);

        // Then
        assertEquals(CacheResult.Status.OK, stored.getStatus());
        assertEquals(Duration.ofSeconds(3600), store.ttlOf(KEY));
        assertTrue(afterSet.isHit());
        assertEquals(june, afterSet.orElse(null));
        assertTrue(deleted.orElse(false));
        assertEquals(CacheResult.Status.MISS, afterDelete.getStatus());
        assertNull(afterDelete.orElse(null));
        assertFalse(store.values().containsKey(KEY));
    }

    @Test
    void testGetOrSet_TypeReference() {
        // When
        cacheManager.getOrSet(KEY, new TypeReference<List<String>>() { }, () -> List.of("a", "b"), CacheTtl.MEDIUM);
        List<String> cached = cacheManager.get(KEY, new TypeReference<List<String>>() { }).orElse(null);

        // Then
        assertEquals(List.of("a", "b"), cached);
    }

    @Test
    void testGetOrSet_NullValueIsNotCached() {
        // When
        String value = cacheManager.getOrSet(KEY, String.class, () -> null, CacheTtl.SHORT);

        // Then
        assertNull(value);
        assertTrue(store.values().isEmpty());
    }

    @Test
    void testGetOrSet_LoaderExceptionPropagates() {
        // When / Then
        assertThrows(NotFoundException.class, () -> cacheManager.getOrSet(KEY, String.class,
                () -> {
                    throw new NotFoundException("No revenue data");
                }, CacheTtl.SHORT));
        assertTrue(store.values().isEmpty());
    }

    @Test
    void testGetOrSet_StoreDown_ComputesDirectly() {
        // Given
        store.setAvailable(false);

        // When
        String value = cacheManager.getOrSet(KEY, String.class, () -> "fresh", CacheTtl.SHORT);

        // Then
        assertEquals("fresh", value);
        CacheStats stats = cacheManager.getStats();
        assertTrue(stats.getErrors() >= 2, "get and set failures should both be counted");
        assertNotNull(stats.getLastError());
        assertFalse(cacheManager.isHealthy());
    }

    @Test
    void testGet_StoreDown_ReturnsError() {
        // Given
        store.setAvailable(false);

        // When
        CacheResult<String> result = cacheManager.get(KEY, String.class);

        // Then
        assertTrue(result.isError());
        assertEquals("fallback", result.orElse("fallback"));
        assertTrue(result.error().isPresent());
    }

    @Test
    void testGetOrSet_ConcurrentCallersShareOneComputation() throws Exception {
        // Given
        int callers = 8;
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);

        try {
            // When
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> cacheManager.getOrSet(KEY, String.class, () -> {
                    loads.incrementAndGet();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "computed";
                }, CacheTtl.SHORT)));
            }
            Thread.sleep(200);
            release.countDown();

            // Then
            for (Future<String> future : futures) {
                assertEquals("computed", future.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, loads.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testGetOrSet_WaiterReceivesEqualCopyOfSharedValue() throws Exception {
        // Given
        PeriodBoundary june = PeriodBoundary.containing(LocalDate.of(2024, 6, 15), PeriodType.MONTH);
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            // When
            Future<PeriodBoundary> owner = executor.submit(() -> cacheManager.getOrSet(KEY, PeriodBoundary.class, () -> {
                loading.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return june;
            }, CacheTtl.SHORT));
            assertTrue(loading.await(5, TimeUnit.SECONDS));
            store.setAvailable(false);
            Future<PeriodBoundary> waiter = executor.submit(() -> cacheManager.getOrSet(KEY, PeriodBoundary.class,
                    () -> fail("waiter must not compute"), CacheTtl.SHORT));
            Thread.sleep(200);
            release.countDown();

            // Then
            assertSame(june, owner.get(5, TimeUnit.SECONDS));
            PeriodBoundary shared = waiter.get(5, TimeUnit.SECONDS);
            assertEquals(june, shared);
            assertNotSame(june, shared);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testInvalidate_TenantPatternsOnlyTouchThatTenant() {
        // Given
        cacheManager.set("analytics:cohorts:tenant-1", "x", CacheTtl.LONG);
        cacheManager.set("analytics:revenue:tenant-1:2024-06", "x", CacheTtl.SHORT);
        cacheManager.set("analytics:tournament:tenant-1:trends:MONTH:6", "x", CacheTtl.MEDIUM);
        cacheManager.set("analytics:revenue:tenant-2:2024-06", "x", CacheTtl.SHORT);

        // When
        long removed = cacheManager.invalidate("analytics:*:tenant-1").orElse(0L)
                + cacheManager.invalidate("analytics:*:tenant-1:*").orElse(0L);

        // Then
        assertEquals(3, removed);
        assertEquals(Map.of("analytics:revenue:tenant-2:2024-06", "\"x\""), store.values());
    }

    @Test
    void testGenerateCacheKey_SkipsEmptyParts() {
        // When
        String key = cacheManager.generateCacheKey("analytics:tournament", "tenant-1", null, "", "metrics", 6);

        // Then
        assertEquals("analytics:tournament:tenant-1:metrics:6", key);
    }

    @Test
    void testGetStats_HitRate() {
        // Given
        cacheManager.set(KEY, "value", CacheTtl.SHORT);

        // When
        cacheManager.get(KEY, String.class);
        cacheManager.get(KEY, String.class);
        cacheManager.get(KEY, String.class);
        cacheManager.get("analytics:missing:tenant-1", String.class);

        // Then
        CacheStats stats = cacheManager.getStats();
        assertEquals(3, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(75.0, stats.getHitRate());
    }
}
