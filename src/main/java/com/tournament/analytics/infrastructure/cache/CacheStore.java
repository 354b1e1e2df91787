package com.tournament.analytics.infrastructure.cache;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw string key/value backend with per-entry TTL.
 *
 * Implementations may throw on connectivity problems. {@link AnalyticsCacheManager}
 * converts those into {@link CacheResult} values.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * Values aligned with {@code keys}; missing entries are {@code null}.
     */
    List<String> multiGet(List<String> keys);

    void multiSet(Map<String, String> values, Duration ttl);

    /**
     * Deletes every key matching a glob pattern, enumerating incrementally in batches.
     *
     * @return number of deleted keys
     */
    long deleteMatching(String pattern, int batchSize);

    boolean ping();
}
