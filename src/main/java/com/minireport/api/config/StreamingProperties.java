package com.minireport.api.config;

import java.time.Duration;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import com.minireport.backend.cache.CacheConfig;
import com.minireport.backend.loader.LoadConfig;
import com.minireport.backend.loader.LoadStrategy;
import com.minireport.backend.pipeline.HealthMonitor;
import com.minireport.backend.pipeline.PipelineConfig;
import com.minireport.backend.pipeline.PipelineManager;

@Validated
@ConfigurationProperties(prefix = "minireport.streaming")
public class StreamingProperties {

    /**
     * 每个 chunk 的记录数
     */
    @Min(1)
    private int chunkSize = PipelineConfig.DEFAULT_CHUNK_SIZE;

    /**
     * 降级时 chunk 大小的下限
     */
    @Min(1)
    private int minChunkSize = PipelineConfig.DEFAULT_MIN_CHUNK_SIZE;

    /**
     * 单条流水线的内存上限
     */
    @NotNull
    private DataSize memoryLimit = DataSize.ofBytes(PipelineConfig.DEFAULT_MEMORY_LIMIT);

    /**
     * 内存占用超过 memoryLimit 的该比例时开始降级
     */
    @DecimalMin("0.01")
    @DecimalMax("1.0")
    private double degradationThreshold = PipelineConfig.DEFAULT_DEGRADATION_THRESHOLD;

    @Min(0)
    private int maxRetries = PipelineConfig.DEFAULT_MAX_RETRIES;

    /**
     * 第 n 次重试前等待 retryBaseDelay * 2^n
     */
    @NotNull
    private Duration retryBaseDelay = PipelineConfig.DEFAULT_RETRY_BASE_DELAY;

    @Min(1)
    private int maxGroupsPerSpec = PipelineConfig.DEFAULT_MAX_GROUPS;

    /**
     * 每个阶段最多未处理的 chunk 数
     */
    @Min(1)
    private int maxDemand = PipelineConfig.DEFAULT_MAX_DEMAND;

    @NotNull
    private Duration fetchTimeout = PipelineConfig.DEFAULT_FETCH_TIMEOUT;

    @NotNull
    private Duration consumerTimeout = PipelineConfig.DEFAULT_CONSUMER_TIMEOUT;

    @NotNull
    private Duration countTimeout = PipelineConfig.DEFAULT_COUNT_TIMEOUT;

    private boolean enableCache = true;

    /**
     * 数据源 IO 线程数（所有流水线共享）
     */
    @Min(1)
    private int ioThreads = PipelineManager.DEFAULT_IO_THREADS;

    @Valid
    private final Health health = new Health();

    @Valid
    private final Cache cache = new Cache();

    @Valid
    private final RelationshipLoading relationshipLoading = new RelationshipLoading();

    public PipelineConfig toPipelineConfig() {
        return PipelineConfig.builder()
                .chunkSize(chunkSize)
                .minChunkSize(minChunkSize)
                .memoryLimit(memoryLimit.toBytes())
                .degradationThreshold(degradationThreshold)
                .maxRetries(maxRetries)
                .retryBaseDelay(retryBaseDelay)
                .maxGroupsPerSpec(maxGroupsPerSpec)
                .maxDemand(maxDemand)
                .fetchTimeout(fetchTimeout)
                .consumerTimeout(consumerTimeout)
                .countTimeout(countTimeout)
                .enableCache(enableCache)
                .cacheTtl(cache.getTtl())
                .relationshipLoading(new LoadConfig(relationshipLoading.getStrategy(),
                        relationshipLoading.getMaxDepth(), null, null))
                .build();
    }

    public CacheConfig toCacheConfig() {
        return new CacheConfig(cache.getTtl(), cache.getMaxEntries(), cache.getMaxMemory().toBytes(),
                cache.getLockTimeout());
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getMinChunkSize() {
        return minChunkSize;
    }

    public void setMinChunkSize(int minChunkSize) {
        this.minChunkSize = minChunkSize;
    }

    public DataSize getMemoryLimit() {
        return memoryLimit;
    }

    public void setMemoryLimit(DataSize memoryLimit) {
        this.memoryLimit = memoryLimit;
    }

    public double getDegradationThreshold() {
        return degradationThreshold;
    }

    public void setDegradationThreshold(double degradationThreshold) {
        this.degradationThreshold = degradationThreshold;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public int getMaxGroupsPerSpec() {
        return maxGroupsPerSpec;
    }

    public void setMaxGroupsPerSpec(int maxGroupsPerSpec) {
        this.maxGroupsPerSpec = maxGroupsPerSpec;
    }

    public int getMaxDemand() {
        return maxDemand;
    }

    public void setMaxDemand(int maxDemand) {
        this.maxDemand = maxDemand;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public Duration getConsumerTimeout() {
        return consumerTimeout;
    }

    public void setConsumerTimeout(Duration consumerTimeout) {
        this.consumerTimeout = consumerTimeout;
    }

    public Duration getCountTimeout() {
        return countTimeout;
    }

    public void setCountTimeout(Duration countTimeout) {
        this.countTimeout = countTimeout;
    }

    public boolean isEnableCache() {
        return enableCache;
    }

    public void setEnableCache(boolean enableCache) {
        this.enableCache = enableCache;
    }

    public int getIoThreads() {
        return ioThreads;
    }

    public void setIoThreads(int ioThreads) {
        this.ioThreads = ioThreads;
    }

    public Health getHealth() {
        return health;
    }

    public Cache getCache() {
        return cache;
    }

    public RelationshipLoading getRelationshipLoading() {
        return relationshipLoading;
    }

    public static class Health {

        /**
         * 巡检间隔
         */
        @NotNull
        private Duration interval = Duration.ofSeconds(30);

        @NotNull
        private Duration stallTimeout = HealthMonitor.DEFAULT_STALL_TIMEOUT;

        /**
         * 已结束的流水线保留多久后移除
         */
        @NotNull
        private Duration retention = HealthMonitor.DEFAULT_RETENTION;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getStallTimeout() {
            return stallTimeout;
        }

        public void setStallTimeout(Duration stallTimeout) {
            this.stallTimeout = stallTimeout;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class Cache {

        @NotNull
        private Duration ttl = CacheConfig.DEFAULT_TTL;

        @Min(1)
        private int maxEntries = CacheConfig.DEFAULT_MAX_ENTRIES;

        @NotNull
        private DataSize maxMemory = DataSize.ofBytes(CacheConfig.DEFAULT_MAX_MEMORY);

        @NotNull
        private Duration lockTimeout = CacheConfig.DEFAULT_LOCK_TIMEOUT;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public DataSize getMaxMemory() {
            return maxMemory;
        }

        public void setMaxMemory(DataSize maxMemory) {
            this.maxMemory = maxMemory;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class RelationshipLoading {

        @NotNull
        private LoadStrategy strategy = LoadStrategy.SELECTIVE;

        @Min(0)
        private int maxDepth = LoadConfig.DEFAULT_MAX_DEPTH;

        public LoadStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(LoadStrategy strategy) {
            this.strategy = strategy;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }
    }
}
