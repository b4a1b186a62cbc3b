package com.secidx.common;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Small synchronized LRU cache. Used for read-only views that are cheap to
 * rebuild, so eviction never loses state.
 */
public class LRUCache<K, V> {
    private final int capacity;
    private final Map<K, V> cache;

    public LRUCache(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.cache = new LinkedHashMap<>(capacity, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > LRUCache.this.capacity;
            }
        };
    }

    public synchronized V get(K key) {
        return cache.get(key);
    }

    /**
     * Returns the cached value or computes, stores and returns it. The loader
     * runs under the cache lock and must not call back into the cache.
     */
    public synchronized V getOrLoad(K key, Function<? super K, ? extends V> loader) {
        V value = cache.get(key);
        if (value == null) {
            value = loader.apply(key);
            if (value != null) cache.put(key, value);
        }
        return value;
    }

    public synchronized int size() {
        return cache.size();
    }

    public synchronized void clear() {
        cache.clear();
    }
}
