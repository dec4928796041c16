package com.minireport.backend.cache;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.minireport.common.Record;

/**
 * 查询结果缓存（TTL + LRU），key 为 {@link CacheKeys#fingerprint} 生成的指纹，value 为一页记录。
 * <p>
 * LinkedHashMap(accessOrder=true) 维护 LRU 顺序，命中会调整顺序 => 所有访问都需要持有 lruLock。
 * </p>
 * 约定：
 * 1) 多条流水线共享同一个实例，内部加锁
 * 2) 容量（条目数或估算字节数）满时，先淘汰最久未访问的条目再插入
 * 3) 过期条目在访问时按 miss 处理并惰性删除；{@link #purgeExpired()} 供定时清理
 * 4) 缓存永远"可以 miss"：拿不到锁或内部异常时退化为 miss / 跳过写入，不向调用方抛错
 */
public class QueryCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryCache.class);

    /** LRU 容器：accessOrder=true */
    private final LinkedHashMap<String, Entry> cache = new LinkedHashMap<>(16, 0.75f, true);

    /** 保护 LinkedHashMap 结构与 sizeBytes */
    private final ReentrantLock lruLock = new ReentrantLock();

    private final CacheConfig config;
    private final Ticker ticker;

    private long sizeBytes = 0;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    /** 缓存项：值 + 过期时间 + 估算大小，插入后不再修改 */
    private static final class Entry {
        final List<Record> value;
        final long expiresAtNanos;
        final long sizeBytes;

        Entry(List<Record> value, long expiresAtNanos, long sizeBytes) {
            this.value = value;
            this.expiresAtNanos = expiresAtNanos;
            this.sizeBytes = sizeBytes;
        }
    }

    public QueryCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    public QueryCache(CacheConfig config, Ticker ticker) {
        this.config = config;
        this.ticker = ticker;
    }

    /**
     * 查询缓存：命中时触发 LRU touch；过期则删除并记为 miss。
     */
    public Optional<List<Record>> get(String key) {
        if(!tryLock()) {
            misses.incrementAndGet();
            LOGGER.debug("QueryCache get timed out waiting for lock, treat as miss");
            return Optional.empty();
        }
        try {
            Entry e = cache.get(key);
            if(e == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            if(isExpired(e)) {
                cache.remove(key);
                sizeBytes -= e.sizeBytes;
                evictions.incrementAndGet();
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(e.value);
        } finally {
            lruLock.unlock();
        }
    }

    public void put(String key, List<Record> page) {
        put(key, page, config.getTtl());
    }

    /**
     * 写入缓存；单条大于内存上限的页直接跳过。
     */
    public void put(String key, List<Record> page, Duration ttl) {
        List<Record> value;
        long size;
        try {
            value = ImmutableList.copyOf(page);
            size = PageSizeEstimator.estimate(value);
        } catch (RuntimeException ex) {
            LOGGER.debug("QueryCache skip put for key {}: {}", key, ex.toString());
            return;
        }
        if(size > config.getMaxMemoryBytes()) {
            LOGGER.debug("QueryCache skip put for key {}: page too large ({} bytes)", key, size);
            return;
        }
        if(!tryLock()) {
            LOGGER.debug("QueryCache put timed out waiting for lock, skip caching key {}", key);
            return;
        }
        try {
            Entry old = cache.remove(key);
            if(old != null) {
                sizeBytes -= old.sizeBytes;
            }
            int evicted = 0;
            while (!cache.isEmpty()
                    && (cache.size() >= config.getMaxEntries() || sizeBytes + size > config.getMaxMemoryBytes())) {
                evictOne();
                evicted++;
            }
            if(evicted > 0) {
                LOGGER.debug("QueryCache evicted {} LRU entries", evicted);
            }
            cache.put(key, new Entry(value, ticker.read() + ttl.toNanos(), size));
            sizeBytes += size;
        } finally {
            lruLock.unlock();
        }
    }

    /**
     * 清空缓存，统计计数保留。
     */
    public void clear() {
        lruLock.lock();
        try {
            cache.clear();
            sizeBytes = 0;
        } finally {
            lruLock.unlock();
        }
    }

    /**
     * 清理所有已过期条目，返回清理数量。
     */
    public int purgeExpired() {
        lruLock.lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<String, Entry>> it = cache.entrySet().iterator();
            while (it.hasNext()) {
                Entry e = it.next().getValue();
                if(isExpired(e)) {
                    it.remove();
                    sizeBytes -= e.sizeBytes;
                    removed++;
                }
            }
            if(removed > 0) {
                evictions.addAndGet(removed);
                LOGGER.debug("QueryCache purged {} expired entries", removed);
            }
            return removed;
        } finally {
            lruLock.unlock();
        }
    }

    public CacheStats stats() {
        lruLock.lock();
        try {
            return new CacheStats(hits.get(), misses.get(), evictions.get(), cache.size(), sizeBytes);
        } finally {
            lruLock.unlock();
        }
    }

    /**
     * LRU 淘汰：移除最旧的条目。
     * 注意：必须在持有 lruLock 的情况下调用
     */
    private void evictOne() {
        Iterator<Map.Entry<String, Entry>> it = cache.entrySet().iterator();
        if(it.hasNext()) {
            Entry e = it.next().getValue();
            it.remove();
            sizeBytes -= e.sizeBytes;
            evictions.incrementAndGet();
        }
    }

    private boolean isExpired(Entry e) {
        return ticker.read() - e.expiresAtNanos >= 0;
    }

    private boolean tryLock() {
        try {
            return lruLock.tryLock(config.getLockTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
