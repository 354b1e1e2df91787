package com.tournament.analytics.infrastructure.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Map-backed store for tests. TTLs are recorded but never expire entries.
 * Setting {@link #setAvailable(boolean)} to false makes every call throw, like an
 * unreachable Redis.
 */
public class InMemoryCacheStore implements CacheStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    private volatile boolean available = true;

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public Map<String, String> values() {
        return values;
    }

    public Duration ttlOf(String key) {
        return ttls.get(key);
    }

    @Override
    public Optional<String> get(String key) {
        check();
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        check();
        values.put(key, value);
        ttls.put(key, ttl);
    }

    @Override
    public boolean delete(String key) {
        check();
        ttls.remove(key);
        return values.remove(key) != null;
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        check();
        List<String> result = new ArrayList<>();
        for (String key : keys) {
            result.add(values.get(key));
        }
        return result;
    }

    @Override
    public void multiSet(Map<String, String> entries, Duration ttl) {
        check();
        entries.forEach((key, value) -> set(key, value, ttl));
    }

    @Override
    public long deleteMatching(String pattern, int batchSize) {
        check();
        Pattern regex = Pattern.compile(globToRegex(pattern));
        long deleted = 0;
        for (String key : new ArrayList<>(values.keySet())) {
            if (regex.matcher(key).matches()) {
                values.remove(key);
                ttls.remove(key);
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public boolean ping() {
        check();
        return true;
    }

    private void check() {
        if (!available) {
            throw new IllegalStateException("Connection refused");
        }
    }

    private static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        boolean escaped = false;
        for (char c : glob.toCharArray()) {
            if (escaped) {
                regex.append(Pattern.quote(String.valueOf(c)));
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
