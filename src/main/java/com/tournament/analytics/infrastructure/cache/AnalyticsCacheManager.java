package com.tournament.analytics.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tournament.analytics.domain.exception.UpstreamFailureException;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Cache manager for computed analytics.
 *
 * Values are stored as JSON under keys following the {@code namespace:tenant:params}
 * convention. Every operation fails open: store errors are counted, logged and returned
 * as {@link CacheResult.Status#ERROR}, never thrown.
 *
 * {@link #getOrSet} is single-flight per key within this process. The first caller for an
 * uncached key computes the value; concurrent callers for the same key wait on the same
 * future and receive its value or its exception. Across processes each instance computes
 * at most once.
 */
@Slf4j
@Service
public class AnalyticsCacheManager {

    public static final String ROOT_NAMESPACE = "analytics";

    private final CacheStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int scanBatchSize;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private volatile String lastError;
    private volatile Instant lastErrorAt;

    private final ConcurrentMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public AnalyticsCacheManager(CacheStore store,
                                 ObjectMapper objectMapper,
                                 MeterRegistry meterRegistry,
                                 Clock clock,
                                 @Value("${app.cache.scan-batch-size:100}") int scanBatchSize) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.scanBatchSize = scanBatchSize;

        FunctionCounter.builder("analytics.cache.requests", hits, AtomicLong::get)
                .tag("result", "hit")
                .register(meterRegistry);
        FunctionCounter.builder("analytics.cache.requests", misses, AtomicLong::get)
                .tag("result", "miss")
                .register(meterRegistry);
        FunctionCounter.builder("analytics.cache.writes", sets, AtomicLong::get)
                .register(meterRegistry);
        FunctionCounter.builder("analytics.cache.errors", errors, AtomicLong::get)
                .register(meterRegistry);
    }

    public <T> CacheResult<T> get(String key, Class<T> type) {
        return get(key, objectMapper.constructType(type));
    }

    public <T> CacheResult<T> get(String key, TypeReference<T> type) {
        return get(key, objectMapper.constructType(type));
    }

    private <T> CacheResult<T> get(String key, JavaType type) {
        try {
            Optional<String> raw = store.get(key);
            if (raw.isEmpty()) {
                misses.incrementAndGet();
                log.debug("Cache miss for key: {}", key);
                return CacheResult.miss();
            }
            T value = objectMapper.readValue(raw.get(), type);
            hits.incrementAndGet();
            log.debug("Cache hit for key: {}", key);
            return CacheResult.hit(value);
        } catch (Exception e) {
            return recordError("get", key, e);
        }
    }

    public CacheResult<Void> set(String key, Object value, CacheTtl ttl) {
        return set(key, value, ttl.toDuration());
    }

    public CacheResult<Void> set(String key, Object value, Duration ttl) {
        try {
            store.set(key, objectMapper.writeValueAsString(value), ttl);
            sets.incrementAndGet();
            log.debug("Cached value for key: {} (TTL: {}s)", key, ttl.toSeconds());
            return CacheResult.ok(null);
        } catch (Exception e) {
            return recordError("set", key, e);
        }
    }

    public CacheResult<Boolean> delete(String key) {
        try {
            boolean deleted = store.delete(key);
            log.debug("Deleted cache key: {} ({})", key, deleted);
            return CacheResult.ok(deleted);
        } catch (Exception e) {
            return recordError("delete", key, e);
        }
    }

    /**
     * Deletes every key matching a glob pattern such as {@code analytics:*:tenant-1:*}.
     */
    public CacheResult<Long> invalidate(String pattern) {
        try {
            long deleted = store.deleteMatching(pattern, scanBatchSize);
            log.info("Invalidated {} cache keys matching {}", deleted, pattern);
            return CacheResult.ok(deleted);
        } catch (Exception e) {
            return recordError("invalidate", pattern, e);
        }
    }

    /**
     * Batched read. The returned map only contains keys that were present.
     */
    public <T> CacheResult<Map<String, T>> multiGet(List<String> keys, Class<T> type) {
        try {
            List<String> raw = store.multiGet(keys);
            Map<String, T> found = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                String json = i < raw.size() ? raw.get(i) : null;
                if (json == null) {
                    misses.incrementAndGet();
                    continue;
                }
                found.put(keys.get(i), objectMapper.readValue(json, type));
                hits.incrementAndGet();
            }
            return CacheResult.ok(found);
        } catch (Exception e) {
            return recordError("mget", String.join(",", keys), e);
        }
    }

    public CacheResult<Void> multiSet(Map<String, ?> entries, CacheTtl ttl) {
        try {
            Map<String, String> serialized = new LinkedHashMap<>();
            for (Map.Entry<String, ?> entry : entries.entrySet()) {
                serialized.put(entry.getKey(), objectMapper.writeValueAsString(entry.getValue()));
            }
            store.multiSet(serialized, ttl.toDuration());
            sets.addAndGet(serialized.size());
            return CacheResult.ok(null);
        } catch (Exception e) {
            return recordError("mset", String.join(",", entries.keySet()), e);
        }
    }

    public <T> T getOrSet(String key, Class<T> type, Supplier<T> loader, CacheTtl ttl) {
        return getOrSetResult(key, type, loader, ttl).orElse(null);
    }

    public <T> T getOrSet(String key, TypeReference<T> type, Supplier<T> loader, CacheTtl ttl) {
        return getOrSetResult(key, type, loader, ttl).orElse(null);
    }

    public <T> CacheResult<T> getOrSetResult(String key, Class<T> type, Supplier<T> loader, CacheTtl ttl) {
        return getOrSetResult(key, objectMapper.constructType(type), loader, ttl);
    }

    public <T> CacheResult<T> getOrSetResult(String key, TypeReference<T> type, Supplier<T> loader, CacheTtl ttl) {
        return getOrSetResult(key, objectMapper.constructType(type), loader, ttl);
    }

    /**
     * Load-or-populate. Returns {@code HIT} when served from the cache and {@code COMPUTED}
     * otherwise. Exceptions thrown by the loader propagate unchanged to every waiting caller.
     * Waiters receive their own copy of the shared value, as they would from a cache hit.
     */
    private <T> CacheResult<T> getOrSetResult(String key, JavaType type, Supplier<T> loader, CacheTtl ttl) {
        CacheResult<T> cached = get(key, type);
        if (cached.isHit()) {
            return cached;
        }

        CompletableFuture<Object> flight = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, flight);
        if (existing != null) {
            log.debug("Joining in-flight computation for key: {}", key);
            T shared = objectMapper.convertValue(await(existing), type);
            return CacheResult.computed(shared);
        }

        try {
            Optional<T> late = peek(key, type);
            if (late.isPresent()) {
                flight.complete(late.get());
                return CacheResult.hit(late.get());
            }

            T value = loader.get();
            if (value != null) {
                set(key, value, ttl);
            }
            flight.complete(value);
            return CacheResult.computed(value);
        } catch (RuntimeException | Error e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, flight);
        }
    }

    /**
     * Escapes the glob metacharacters {@code * ? [ ] \} so a key part matches only itself
     * inside an {@link #invalidate} pattern.
     */
    public static String escapeGlob(String part) {
        StringBuilder escaped = new StringBuilder(part.length());
        for (char c : part.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Builds a key by joining non-empty parts with ':'.
     */
    public String generateCacheKey(String namespace, Object... params) {
        StringBuilder key = new StringBuilder(namespace);
        for (Object param : params) {
            if (param == null) {
                continue;
            }
            String part = param.toString();
            if (!part.isEmpty()) {
                key.append(':').append(part);
            }
        }
        return key.toString();
    }

    public CacheStats getStats() {
        long hitCount = hits.get();
        long missCount = misses.get();
        long reads = hitCount + missCount;
        double hitRate = reads == 0 ? 0.0 : Math.round(hitCount * 10000.0 / reads) / 100.0;

        return CacheStats.builder()
                .hits(hitCount)
                .misses(missCount)
                .sets(sets.get())
                .errors(errors.get())
                .hitRate(hitRate)
                .lastError(lastError)
                .lastErrorAt(lastErrorAt)
                .build();
    }

    public void resetStats() {
        hits.set(0);
        misses.set(0);
        sets.set(0);
        errors.set(0);
        lastError = null;
        lastErrorAt = null;
    }

    public boolean isHealthy() {
        try {
            return store.ping();
        } catch (Exception e) {
            recordError("ping", "-", e);
            return false;
        }
    }

    public CacheResult<Long> flushAnalyticsCache() {
        return invalidate(ROOT_NAMESPACE + ":*");
    }

    private <T> Optional<T> peek(String key, JavaType type) {
        try {
            Optional<String> raw = store.get(key);
            if (raw.isPresent()) {
                return Optional.of(objectMapper.readValue(raw.get(), type));
            }
        } catch (Exception e) {
            log.debug("Cache re-check failed for key {}: {}", key, e.getMessage());
        }
        return Optional.empty();
    }

    private Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new UpstreamFailureException("Shared computation failed", cause);
        }
    }

    private <T> CacheResult<T> recordError(String operation, String key, Exception e) {
        errors.incrementAndGet();
        lastError = operation + ": " + e.getMessage();
        lastErrorAt = clock.instant();
        log.warn("Cache {} failed for {}, continuing without cache: {}", operation, key, e.getMessage());
        return CacheResult.error(e);
    }
}
