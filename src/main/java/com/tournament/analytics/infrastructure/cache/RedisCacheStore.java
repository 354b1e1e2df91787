package com.tournament.analytics.infrastructure.cache;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.types.Expiration;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redis-backed cache store.
 *
 * The connection factory behind {@link RedisTemplate} is created on startup and closed on
 * shutdown by the Spring context; this class holds no connection state of its own.
 * Every call runs through the {@code redis} circuit breaker, so an unreachable Redis
 * fails fast with {@code CallNotPermittedException} once the breaker opens.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    private final RedisTemplate<String, String> redisTemplate;

    @Override
    @CircuitBreaker(name = "redis")
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    @CircuitBreaker(name = "redis")
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    @CircuitBreaker(name = "redis")
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    @CircuitBreaker(name = "redis")
    public List<String> multiGet(List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        List<String> values = redisTemplate.opsForValue().multiGet(keys);
        return values != null ? values : new ArrayList<>(Collections.nCopies(keys.size(), null));
    }

    @Override
    @CircuitBreaker(name = "redis")
    public void multiSet(Map<String, String> values, Duration ttl) {
        if (values.isEmpty()) {
            return;
        }
        RedisSerializer<String> serializer = redisTemplate.getStringSerializer();
        Expiration expiration = Expiration.from(ttl);
        redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            values.forEach((key, value) -> connection.stringCommands().set(
                    serializer.serialize(key), serializer.serialize(value), expiration, SetOption.upsert()));
            return null;
        });
    }

    /**
     * Uses SCAN rather than KEYS so large keyspaces never block the server.
     */
    @Override
    @CircuitBreaker(name = "redis")
    public long deleteMatching(String pattern, int batchSize) {
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(batchSize).build();
        long deleted = 0;
        List<String> batch = new ArrayList<>(batchSize);

        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= batchSize) {
                    deleted += deleteBatch(batch);
                    batch.clear();
                }
            }
        }
        if (!batch.isEmpty()) {
            deleted += deleteBatch(batch);
        }

        log.debug("Deleted {} keys matching {}", deleted, pattern);
        return deleted;
    }

    @Override
    @CircuitBreaker(name = "redis")
    public boolean ping() {
        String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        return "PONG".equalsIgnoreCase(reply);
    }

    private long deleteBatch(List<String> keys) {
        Long count = redisTemplate.delete(keys);
        return count != null ? count : 0;
    }
}
