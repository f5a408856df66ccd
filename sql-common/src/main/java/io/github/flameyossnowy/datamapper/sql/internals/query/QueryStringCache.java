package io.github.flameyossnowy.datamapper.sql.internals.query;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Memoizes rendered SQL fragments. Computing the same key twice yields the same text,
 * so concurrent callers never need to coordinate.
 *
 * @param <K> key type
 */
public final class QueryStringCache<K> {
    private final Map<K, String> cache;

    public QueryStringCache(int initialCapacity) {
        this.cache = new ConcurrentHashMap<>(initialCapacity);
    }

    public String get(K key) {
        return cache.get(key);
    }

    public String computeIfAbsent(K key, Function<? super K, String> mappingFunction) {
        String cached = cache.get(key);
        if (cached != null) return cached;
        return cache.computeIfAbsent(key, mappingFunction);
    }

    public void put(K key, String value) {
        cache.put(key, value);
    }

    public int size() {
        return cache.size();
    }
}
