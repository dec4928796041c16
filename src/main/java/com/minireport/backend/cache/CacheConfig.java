package com.minireport.backend.cache;

import java.time.Duration;

import com.google.common.base.Preconditions;

public final class CacheConfig {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_ENTRIES = 1000;
    public static final long DEFAULT_MAX_MEMORY = 100L * 1024 * 1024;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMillis(200);

    private final Duration ttl;
    private final int maxEntries;
    private final long maxMemoryBytes;
    private final Duration lockTimeout;

    public CacheConfig(Duration ttl, int maxEntries, long maxMemoryBytes, Duration lockTimeout) {
        Preconditions.checkArgument(ttl != null && !ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
        Preconditions.checkArgument(maxEntries > 0, "maxEntries must be positive");
        Preconditions.checkArgument(maxMemoryBytes > 0, "maxMemoryBytes must be positive");
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.maxMemoryBytes = maxMemoryBytes;
        this.lockTimeout = lockTimeout == null ? DEFAULT_LOCK_TIMEOUT : lockTimeout;
    }

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_TTL, DEFAULT_MAX_ENTRIES, DEFAULT_MAX_MEMORY, DEFAULT_LOCK_TIMEOUT);
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getMaxMemoryBytes() {
        return maxMemoryBytes;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }
}
