package scadflow.runtime.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class CaffeineCacheTest {

    @Test
    @DisplayName("读写与命中统计")
    void testGetPutStats() {
        BoundedCache<String, Integer> cache = CaffeineCache.create(10);
        assertNull(cache.get("a"));
        cache.put("a", 1);
        assertEquals(Integer.valueOf(1), cache.get("a"));

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.getHitCount());
        assertEquals(1, stats.getMissCount());
        assertEquals(10, stats.getMaximumSize());
    }

    @Test
    @DisplayName("computeIfAbsent 只计算一次")
    void testComputeIfAbsent() {
        BoundedCache<String, Integer> cache = CaffeineCache.create(10);
        int[] calls = {0};
        cache.computeIfAbsent("k", k -> ++calls[0]);
        cache.computeIfAbsent("k", k -> ++calls[0]);
        assertEquals(1, calls[0]);
    }

    @Test
    @DisplayName("按同一性比较键")
    void testIdentityKeys() {
        BoundedCache<String, Integer> cache = CaffeineCache.identityKeyed(10);
        String key = new String("cube");
        cache.put(key, 1);
        assertEquals(Integer.valueOf(1), cache.get(key));
        assertNull(cache.get(new String("cube")));
    }

    @Test
    @DisplayName("失效与清空")
    void testInvalidateAndClear() {
        BoundedCache<String, Integer> cache = CaffeineCache.create(10);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.invalidate("a");
        assertNull(cache.get("a"));
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("容量必须为正")
    void testInvalidSize() {
        assertThatThrownBy(() -> CaffeineCache.create(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
