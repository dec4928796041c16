package com.minireport.backend.pipeline;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.minireport.backend.aggregator.AggregateContext;
import com.minireport.backend.aggregator.AggregatingStage;
import com.minireport.backend.aggregator.AggregationResult;
import com.minireport.backend.aggregator.AggregationSpec;
import com.minireport.backend.aggregator.CumulativeGrouping;
import com.minireport.backend.cache.CacheConfig;
import com.minireport.backend.cache.QueryCache;
import com.minireport.backend.loader.RelationshipLoader;
import com.minireport.backend.source.QueryDescriptor;
import com.minireport.common.Chunk;

/**
 * 流水线编排器：启动流水线并维护 streamId -> 运行时资源 的注册表，提供监控与生命周期操作。
 * <p>
 * QueryCache、RelationshipLoader 和数据源 IO 线程池在所有流水线之间共享；
 * 分组状态和运行状态归各自流水线所有，外部只能拿到快照或拷贝。
 * 失败不会自动重启，调用方通过 {@link #getPipelineInfo} 查询原因。
 * </p>
 */
public class PipelineManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineManager.class);

    public static final int DEFAULT_IO_THREADS = 8;
    private static final int IO_QUEUE_CAPACITY = 256;

    private final Map<String, PipelineHandle> pipelines = new ConcurrentHashMap<>();

    private final QueryCache cache;
    private final RelationshipLoader loader;
    private final MemoryProbe memoryProbe;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ThreadPoolExecutor ioPool;

    public PipelineManager() {
        this(new QueryCache(CacheConfig.defaults()), new RelationshipLoader(), MemoryProbe.runtime(),
                Sleeper.threadSleep(), Clock.systemUTC(), DEFAULT_IO_THREADS);
    }

    public PipelineManager(QueryCache cache, RelationshipLoader loader, MemoryProbe memoryProbe, Sleeper sleeper,
                           Clock clock, int ioThreads) {
        Preconditions.checkArgument(ioThreads > 0, "ioThreads must be positive");
        this.cache = Preconditions.checkNotNull(cache);
        this.loader = Preconditions.checkNotNull(loader);
        this.memoryProbe = Preconditions.checkNotNull(memoryProbe);
        this.sleeper = Preconditions.checkNotNull(sleeper);
        this.clock = Preconditions.checkNotNull(clock);
        this.ioPool = new ThreadPoolExecutor(ioThreads, ioThreads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(IO_QUEUE_CAPACITY),
                new ThreadFactoryBuilder().setNameFormat("minireport-io-%d").setDaemon(true).build());
        this.ioPool.allowCoreThreadTimeOut(true);
    }

    /**
     * 启动流水线。关联深度等配置错误在创建任何线程之前抛出。
     *
     * @throws com.minireport.backend.loader.RelationshipDepthException 关联深度超限
     */
    public StartedPipeline startPipeline(PipelineOptions options) {
        PipelineConfig config = options.getConfig();
        QueryDescriptor query = loader.applyLoadStrategy(options.getQuery(), config.getRelationshipLoading());
        List<AggregationSpec> specs = CumulativeGrouping.resolve(options.getGroups(), options.getFieldResolver());

        String streamId = UUID.randomUUID().toString();
        AggregateContext global = AggregateContext.of(options.getGlobalFunctions(), options.getGlobalFields());
        AggregatingStage stage = new AggregatingStage(streamId, specs, config.getMaxGroupsPerSpec(), global,
                options.getTransformer());
        PipelineState state = new PipelineState(streamId, options.getReportName(), options.getMetadata(),
                config.getChunkSize(), clock);
        PipelineControl control = new PipelineControl();
        DemandChannel<Chunk> producerChannel = new DemandChannel<>(streamId, config.getMaxDemand());
        DemandChannel<Chunk> outputChannel = new DemandChannel<>(streamId, config.getMaxDemand());
        Producer producer = new Producer(streamId, options.getDataSource(), query, config,
                config.isEnableCache() ? cache : null, ioPool, memoryProbe, sleeper, control, state, producerChannel);

        PipelineHandle handle = new PipelineHandle(streamId, config, state, control, stage, producerChannel,
                outputChannel, producer);
        pipelines.put(streamId, handle);
        handle.start();
        LOGGER.info("[{}] pipeline started: report={}, source={}, resource={}, levels={}, chunkSize={}",
                streamId, options.getReportName(), options.getDataSource().identity(), query.getResource(),
                specs.size(), config.getChunkSize());
        return new StartedPipeline(streamId, handle.getStream());
    }

    public PipelineInfo getPipelineInfo(String streamId) {
        return require(streamId).getState().toInfo();
    }

    /**
     * 按启动时间排序。
     */
    public List<PipelineInfo> listPipelines(PipelineFilter filter) {
        List<PipelineInfo> list = new ArrayList<>();
        for (PipelineHandle h : pipelines.values()) {
            PipelineInfo info = h.getState().toInfo();
            if(filter.matches(info)) {
                list.add(info);
            }
        }
        list.sort(Comparator.comparing(PipelineInfo::getStartedAt).thenComparing(PipelineInfo::getStreamId));
        return list;
    }

    /**
     * 各状态的流水线数量，所有状态都有对应的键。
     */
    public Map<PipelineStatus, Long> pipelineCounts() {
        Map<PipelineStatus, Long> counts = new EnumMap<>(PipelineStatus.class);
        for (PipelineStatus s : PipelineStatus.values()) {
            counts.put(s, 0L);
        }
        for (PipelineHandle h : pipelines.values()) {
            counts.merge(h.getState().getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * 暂停，在下一个 chunk 边界生效；已暂停时无操作。
     *
     * @throws IllegalStateException 流水线已结束
     */
    public void pausePipeline(String streamId) {
        PipelineHandle h = require(streamId);
        if(h.pause()) {
            LOGGER.info("[{}] pipeline paused", streamId);
            return;
        }
        PipelineStatus status = h.getState().getStatus();
        if(status != PipelineStatus.PAUSED) {
            throw new IllegalStateException("Cannot pause pipeline " + streamId + " in status " + status);
        }
    }

    /**
     * 恢复，从暂停时的 offset 继续；运行中时无操作。
     *
     * @throws IllegalStateException 流水线已结束
     */
    public void resumePipeline(String streamId) {
        PipelineHandle h = require(streamId);
        if(h.resume()) {
            LOGGER.info("[{}] pipeline resumed", streamId);
            return;
        }
        PipelineStatus status = h.getState().getStatus();
        if(status != PipelineStatus.RUNNING) {
            throw new IllegalStateException("Cannot resume pipeline " + streamId + " in status " + status);
        }
    }

    /**
     * 无条件停止并释放聚合状态，状态信息保留到 {@link #deregister}。
     */
    public void stopPipeline(String streamId) {
        require(streamId).stop();
    }

    /**
     * 运行中可随时调用；FAILED 的流水线返回失败前的部分状态。
     *
     * @throws AggregationNotReadyException 流水线已停止，状态已释放
     */
    public AggregationSnapshot getAggregationSnapshot(String streamId) {
        PipelineHandle h = require(streamId);
        AggregatingStage stage = h.getStage();
        PipelineInfo info = h.getState().toInfo();
        if(stage == null) {
            throw new AggregationNotReadyException(streamId, info.getStatus(), "aggregation state has been released");
        }
        AggregationResult result = stage.snapshot();
        return new AggregationSnapshot(streamId, info.getStatus(), result, info.getRecordsProcessed(),
                info.getPercentComplete(), info.getStatus() == PipelineStatus.COMPLETED);
    }

    /**
     * 最终聚合状态，只在 COMPLETED 后可用。
     *
     * @throws AggregationNotReadyException 流水线未完成
     */
    public AggregationResult getAggregationState(String streamId) {
        PipelineHandle h = require(streamId);
        PipelineStatus status = h.getState().getStatus();
        AggregatingStage stage = h.getStage();
        if(status != PipelineStatus.COMPLETED || stage == null) {
            throw new AggregationNotReadyException(streamId, status, "final state is only available once completed");
        }
        return stage.finalizeState();
    }

    /**
     * 从注册表移除；未结束的流水线先停止。
     *
     * @return 是否存在该流水线
     */
    public boolean deregister(String streamId) {
        PipelineHandle h = pipelines.remove(streamId);
        if(h == null) {
            return false;
        }
        if(!h.getState().getStatus().isTerminal() || h.isAlive()) {
            h.stop();
        }
        LOGGER.debug("[{}] pipeline deregistered", streamId);
        return true;
    }

    /**
     * 停止所有流水线并关闭 IO 线程池。
     */
    public void shutdown() {
        for (PipelineHandle h : pipelines.values()) {
            if(!h.getState().getStatus().isTerminal()) {
                h.stop();
            }
        }
        pipelines.clear();
        ioPool.shutdownNow();
        LOGGER.info("PipelineManager shut down");
    }

    public QueryCache getCache() {
        return cache;
    }

    private PipelineHandle require(String streamId) {
        PipelineHandle h = pipelines.get(streamId);
        if(h == null) {
            throw new PipelineNotFoundException(streamId);
        }
        return h;
    }
}
