package scadflow.runtime.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.function.Function;

/**
 * 基于 Caffeine 的有界缓存
 *
 * <p>两种键语义：按 equals 比较（解析缓存以源码为键），
 * 以及按对象同一性比较（AST 节点缓存，节点不可变且不重写 equals）。</p>
 */
public final class CaffeineCache<K, V> implements BoundedCache<K, V> {

    private final Cache<K, V> cache;
    private final long maximumSize;

    private CaffeineCache(Cache<K, V> cache, long maximumSize) {
        this.cache = cache;
        this.maximumSize = maximumSize;
    }

    /**
     * 按 equals 比较键的缓存
     *
     * @param maximumSize 最大条目数
     */
    public static <K, V> CaffeineCache<K, V> create(long maximumSize) {
        checkSize(maximumSize);
        Cache<K, V> cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
        return new CaffeineCache<>(cache, maximumSize);
    }

    /**
     * 按同一性比较键的缓存，键被回收后条目自动失效
     */
    public static <K, V> CaffeineCache<K, V> identityKeyed(long maximumSize) {
        checkSize(maximumSize);
        Cache<K, V> cache = Caffeine.newBuilder()
                .weakKeys()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
        return new CaffeineCache<>(cache, maximumSize);
    }

    private static void checkSize(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
    }

    @Override
    public V get(K key) {
        return cache.getIfPresent(key);
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        return cache.get(key, mappingFunction);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        long total = stats.hitCount() + stats.missCount();
        return new CacheStats(
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                total > 0 ? stats.hitRate() : 0.0,
                cache.estimatedSize(),
                maximumSize
        );
    }
}
