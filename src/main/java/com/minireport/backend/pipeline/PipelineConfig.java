package com.minireport.backend.pipeline;

import java.time.Duration;

import com.google.common.base.Preconditions;
import com.minireport.backend.cache.CacheConfig;
import com.minireport.backend.loader.LoadConfig;
import com.minireport.backend.loader.LoadStrategy;

/**
 * 单条流水线的不可变配置。
 */
public final class PipelineConfig {

    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_MIN_CHUNK_SIZE = 100;
    public static final long DEFAULT_MEMORY_LIMIT = 500L * 1024 * 1024;
    public static final double DEFAULT_DEGRADATION_THRESHOLD = 0.8;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_GROUPS = 10_000;
    public static final int DEFAULT_MAX_DEMAND = 4;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONSUMER_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_COUNT_TIMEOUT = Duration.ofSeconds(5);

    private final int chunkSize;
    private final int minChunkSize;
    private final long memoryLimit;
    private final double degradationThreshold;
    private final int maxRetries;
    private final Duration retryBaseDelay;
    private final int maxGroupsPerSpec;
    private final int maxDemand;
    private final Duration fetchTimeout;
    private final Duration consumerTimeout;
    private final Duration countTimeout;
    private final boolean enableCache;
    private final Duration cacheTtl;
    private final LoadConfig relationshipLoading;

    private PipelineConfig(Builder b) {
        this.chunkSize = b.chunkSize;
        this.minChunkSize = b.minChunkSize;
        this.memoryLimit = b.memoryLimit;
        this.degradationThreshold = b.degradationThreshold;
        this.maxRetries = b.maxRetries;
        this.retryBaseDelay = b.retryBaseDelay;
        this.maxGroupsPerSpec = b.maxGroupsPerSpec;
        this.maxDemand = b.maxDemand;
        this.fetchTimeout = b.fetchTimeout;
        this.consumerTimeout = b.consumerTimeout;
        this.countTimeout = b.countTimeout;
        this.enableCache = b.enableCache;
        this.cacheTtl = b.cacheTtl;
        this.relationshipLoading = b.relationshipLoading;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .chunkSize(chunkSize)
                .minChunkSize(minChunkSize)
                .memoryLimit(memoryLimit)
                .degradationThreshold(degradationThreshold)
                .maxRetries(maxRetries)
                .retryBaseDelay(retryBaseDelay)
                .maxGroupsPerSpec(maxGroupsPerSpec)
                .maxDemand(maxDemand)
                .fetchTimeout(fetchTimeout)
                .consumerTimeout(consumerTimeout)
                .countTimeout(countTimeout)
                .enableCache(enableCache)
                .cacheTtl(cacheTtl)
                .relationshipLoading(relationshipLoading);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getMinChunkSize() {
        return minChunkSize;
    }

    public long getMemoryLimit() {
        return memoryLimit;
    }

    public double getDegradationThreshold() {
        return degradationThreshold;
    }

    /** memoryLimit * degradationThreshold */
    public long getDegradationBytes() {
        return (long) (memoryLimit * degradationThreshold);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    /** 第 retryCount 次重试前的等待：retryBaseDelay * 2^retryCount */
    public Duration retryDelay(int retryCount) {
        return retryBaseDelay.multipliedBy(1L << Math.min(retryCount, 30));
    }

    public int getMaxGroupsPerSpec() {
        return maxGroupsPerSpec;
    }

    public int getMaxDemand() {
        return maxDemand;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public Duration getConsumerTimeout() {
        return consumerTimeout;
    }

    public Duration getCountTimeout() {
        return countTimeout;
    }

    public boolean isEnableCache() {
        return enableCache;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public LoadConfig getRelationshipLoading() {
        return relationshipLoading;
    }

    @Override
    public String toString() {
        return "PipelineConfig{chunkSize=" + chunkSize + ", minChunkSize=" + minChunkSize
                + ", memoryLimit=" + memoryLimit + ", degradationThreshold=" + degradationThreshold
                + ", maxRetries=" + maxRetries + ", retryBaseDelay=" + retryBaseDelay
                + ", maxGroupsPerSpec=" + maxGroupsPerSpec + ", maxDemand=" + maxDemand
                + ", enableCache=" + enableCache + ", relationshipLoading=" + relationshipLoading + "}";
    }

    public static final class Builder {
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int minChunkSize = DEFAULT_MIN_CHUNK_SIZE;
        private long memoryLimit = DEFAULT_MEMORY_LIMIT;
        private double degradationThreshold = DEFAULT_DEGRADATION_THRESHOLD;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryBaseDelay = DEFAULT_RETRY_BASE_DELAY;
        private int maxGroupsPerSpec = DEFAULT_MAX_GROUPS;
        private int maxDemand = DEFAULT_MAX_DEMAND;
        private Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;
        private Duration consumerTimeout = DEFAULT_CONSUMER_TIMEOUT;
        private Duration countTimeout = DEFAULT_COUNT_TIMEOUT;
        private boolean enableCache = true;
        private Duration cacheTtl = CacheConfig.DEFAULT_TTL;
        private LoadConfig relationshipLoading =
                new LoadConfig(LoadStrategy.SELECTIVE, LoadConfig.DEFAULT_MAX_DEPTH, null, null);

        private Builder() {}

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder minChunkSize(int minChunkSize) {
            this.minChunkSize = minChunkSize;
            return this;
        }

        public Builder memoryLimit(long memoryLimit) {
            this.memoryLimit = memoryLimit;
            return this;
        }

        public Builder degradationThreshold(double degradationThreshold) {
            this.degradationThreshold = degradationThreshold;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder maxGroupsPerSpec(int maxGroupsPerSpec) {
            this.maxGroupsPerSpec = maxGroupsPerSpec;
            return this;
        }

        public Builder maxDemand(int maxDemand) {
            this.maxDemand = maxDemand;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder consumerTimeout(Duration consumerTimeout) {
            this.consumerTimeout = consumerTimeout;
            return this;
        }

        public Builder countTimeout(Duration countTimeout) {
            this.countTimeout = countTimeout;
            return this;
        }

        public Builder enableCache(boolean enableCache) {
            this.enableCache = enableCache;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder relationshipLoading(LoadConfig relationshipLoading) {
            this.relationshipLoading = relationshipLoading;
            return this;
        }

        public PipelineConfig build() {
            Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive, got %s", chunkSize);
            Preconditions.checkArgument(minChunkSize > 0 && minChunkSize <= chunkSize,
                    "minChunkSize must be in [1, chunkSize], got %s", minChunkSize);
            Preconditions.checkArgument(memoryLimit > 0, "memoryLimit must be positive");
            Preconditions.checkArgument(degradationThreshold > 0 && degradationThreshold <= 1,
                    "degradationThreshold must be in (0, 1], got %s", degradationThreshold);
            Preconditions.checkArgument(maxRetries >= 0, "maxRetries must be >= 0");
            Preconditions.checkArgument(!retryBaseDelay.isNegative(), "retryBaseDelay must not be negative");
            Preconditions.checkArgument(maxGroupsPerSpec > 0, "maxGroupsPerSpec must be positive");
            Preconditions.checkArgument(maxDemand > 0, "maxDemand must be positive");
            Preconditions.checkArgument(!fetchTimeout.isNegative() && !fetchTimeout.isZero(), "fetchTimeout must be positive");
            Preconditions.checkArgument(!consumerTimeout.isNegative() && !consumerTimeout.isZero(),
                    "consumerTimeout must be positive");
            Preconditions.checkArgument(!countTimeout.isNegative(), "countTimeout must not be negative");
            Preconditions.checkNotNull(cacheTtl, "cacheTtl");
            Preconditions.checkNotNull(relationshipLoading, "relationshipLoading");
            return new PipelineConfig(this);
        }
    }
}
