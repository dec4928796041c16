package com.minireport.backend.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.google.common.base.Ticker;
import com.minireport.common.Record;

public class QueryCacheTest {

    /** 手动推进的时钟 */
    static class FakeTicker extends Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(Duration d) {
            nanos.addAndGet(d.toNanos());
        }
    }

    private static List<Record> page(int n) {
        List<Record> list = new ArrayList<>();
        for(int i = 0; i < n; i++) {
            list.add(Record.of("id", i, "name", "row-" + i));
        }
        return list;
    }

    @Test
    public void testHitAndMiss() {
        QueryCache cache = new QueryCache(CacheConfig.defaults());
        assertFalse(cache.get("k1").isPresent());
        cache.put("k1", page(3));
        assertEquals(page(3), cache.get("k1").orElseThrow());

        CacheStats stats = cache.stats();
        assertEquals(1, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getEntryCount());
        assertEquals(0.5, stats.getHitRate(), 1e-9);
        assertTrue(stats.getSizeBytes() > 0);
    }

    @Test
    public void testExpiredEntryIsMissAndEvicted() {
        FakeTicker ticker = new FakeTicker();
        QueryCache cache = new QueryCache(CacheConfig.defaults(), ticker);
        cache.put("k", page(1), Duration.ofSeconds(10));

        ticker.advance(Duration.ofSeconds(9));
        assertTrue(cache.get("k").isPresent());

        ticker.advance(Duration.ofSeconds(1));
        assertFalse(cache.get("k").isPresent(), "entry past expiresAt must be a miss");
        CacheStats stats = cache.stats();
        assertEquals(0, stats.getEntryCount());
        assertEquals(1, stats.getEvictions());
        assertEquals(0, stats.getSizeBytes());
    }

    @Test
    public void testLruEvictionByEntryCount() {
        CacheConfig config = new CacheConfig(Duration.ofMinutes(5), 2, CacheConfig.DEFAULT_MAX_MEMORY,
                CacheConfig.DEFAULT_LOCK_TIMEOUT);
        QueryCache cache = new QueryCache(config);
        cache.put("a", page(1));
        cache.put("b", page(1));
        // touch a，b 成为最久未访问
        assertTrue(cache.get("a").isPresent());
        cache.put("c", page(1));

        assertTrue(cache.get("a").isPresent());
        assertFalse(cache.get("b").isPresent());
        assertTrue(cache.get("c").isPresent());
        assertEquals(2, cache.stats().getEntryCount());
        assertEquals(1, cache.stats().getEvictions());
    }

    @Test
    public void testEvictionByMemory() {
        long one = PageSizeEstimator.estimate(page(10));
        CacheConfig config = new CacheConfig(Duration.ofMinutes(5), 100, one * 2 + one / 2,
                CacheConfig.DEFAULT_LOCK_TIMEOUT);
        QueryCache cache = new QueryCache(config);
        cache.put("a", page(10));
        cache.put("b", page(10));
        cache.put("c", page(10));

        CacheStats stats = cache.stats();
        assertEquals(2, stats.getEntryCount());
        assertTrue(stats.getSizeBytes() <= config.getMaxMemoryBytes());
        assertFalse(cache.get("a").isPresent());
    }

    @Test
    public void testOversizedPageIsNotCached() {
        CacheConfig config = new CacheConfig(Duration.ofMinutes(5), 100, 64, CacheConfig.DEFAULT_LOCK_TIMEOUT);
        QueryCache cache = new QueryCache(config);
        cache.put("big", page(50));
        assertFalse(cache.get("big").isPresent());
        assertEquals(0, cache.stats().getEntryCount());
    }

    @Test
    public void testClearAndPurge() {
        FakeTicker ticker = new FakeTicker();
        QueryCache cache = new QueryCache(CacheConfig.defaults(), ticker);
        cache.put("short", page(1), Duration.ofSeconds(1));
        cache.put("long", page(1), Duration.ofMinutes(1));
        ticker.advance(Duration.ofSeconds(2));

        assertEquals(1, cache.purgeExpired());
        assertEquals(1, cache.stats().getEntryCount());

        cache.clear();
        assertEquals(0, cache.stats().getEntryCount());
        assertEquals(0, cache.stats().getSizeBytes());
    }

    @Test
    public void testCachedPageIsImmutable() {
        QueryCache cache = new QueryCache(CacheConfig.defaults());
        List<Record> original = page(2);
        cache.put("k", original);
        original.clear();
        List<Record> cached = cache.get("k").orElseThrow();
        assertEquals(2, cached.size());
        assertThrows(UnsupportedOperationException.class, () -> cached.add(Record.of("x", 1)));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    public void testConcurrentAccess() throws Exception {
        CacheConfig config = new CacheConfig(Duration.ofMinutes(5), 50, CacheConfig.DEFAULT_MAX_MEMORY,
                Duration.ofSeconds(5));
        QueryCache cache = new QueryCache(config);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for(int t = 0; t < 8; t++) {
            final int no = t;
            futures.add(pool.submit(() -> {
                for(int i = 0; i < 500; i++) {
                    String key = "k" + ((i * 7 + no) % 80);
                    if(!cache.get(key).isPresent()) {
                        cache.put(key, page(2));
                    }
                }
            }));
        }
        for (Future<?> f : futures) {
            f.get();
        }
        pool.shutdown();
        CacheStats stats = cache.stats();
        assertTrue(stats.getEntryCount() <= 50);
        assertEquals(8 * 500, stats.getHits() + stats.getMisses());
    }
}
