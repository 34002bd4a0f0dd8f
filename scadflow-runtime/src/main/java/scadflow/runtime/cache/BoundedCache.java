package scadflow.runtime.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 */
public interface BoundedCache<K, V> {

    /**
     * 获取缓存值
     *
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    void put(K key, V value);

    /**
     * 如果不存在则计算并缓存
     *
     * @param mappingFunction 计算函数，返回 null 时不缓存
     * @return 缓存值（可能是新计算的）
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    void invalidate(K key);

    long size();

    void clear();

    CacheStats getStats();
}
