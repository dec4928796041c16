package com.minireport.backend.cache;

/**
 * 缓存统计快照。
 */
public final class CacheStats {

    private final long hits;
    private final long misses;
    private final long evictions;
    private final int entryCount;
    private final long sizeBytes;

    public CacheStats(long hits, long misses, long evictions, int entryCount, long sizeBytes) {
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.entryCount = entryCount;
        this.sizeBytes = sizeBytes;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getEvictions() {
        return evictions;
    }

    public int getEntryCount() {
        return entryCount;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    /** 命中率 [0, 1]，没有任何访问时为 0 */
    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0d : (double) hits / total;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, evictions=%d, entries=%d, bytes=%d, hitRate=%.2f}",
                hits, misses, evictions, entryCount, sizeBytes, getHitRate());
    }
}
