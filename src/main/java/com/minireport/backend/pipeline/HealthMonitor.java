package com.minireport.backend.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * 定时巡检所有流水线：
 * 1) RUNNING 且超过 stallTimeout 没有任何进展的流水线只记 warn 日志，不改变状态。
 *    消费者读得慢或暂时不读时，流水线会停在背压上，这不是故障，缓冲中的 chunk 必须保留
 * 2) 以 debug 级别输出吞吐量
 * 3) 结束超过 retention 的流水线从注册表移除
 * 4) 清理查询缓存中已过期的条目
 * 内存压力由 producer 的降级处理，这里不做暂停。
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    public static final Duration DEFAULT_STALL_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private final PipelineManager manager;
    private final Clock clock;
    private final Duration stallTimeout;
    private final Duration retention;

    private ScheduledExecutorService scheduler;

    public HealthMonitor(PipelineManager manager, Clock clock, Duration stallTimeout, Duration retention) {
        this.manager = Preconditions.checkNotNull(manager);
        this.clock = Preconditions.checkNotNull(clock);
        Preconditions.checkArgument(!stallTimeout.isNegative() && !stallTimeout.isZero(), "stallTimeout must be positive");
        Preconditions.checkArgument(!retention.isNegative(), "retention must not be negative");
        this.stallTimeout = stallTimeout;
        this.retention = retention;
    }

    public synchronized void start(Duration interval) {
        if(scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("minireport-health").setDaemon(true).build());
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::checkQuietly, millis, millis, TimeUnit.MILLISECONDS);
        LOGGER.info("HealthMonitor started, interval={}ms, stallTimeout={}ms", millis, stallTimeout.toMillis());
    }

    /**
     * 执行一次巡检。
     *
     * @return 本次发现的 stalled 流水线数量
     */
    public int check() {
        Instant now = clock.instant();
        int stalled = 0;
        for (PipelineInfo info : manager.listPipelines(PipelineFilter.all())) {
            String id = info.getStreamId();
            if(info.getStatus() == PipelineStatus.RUNNING) {
                Duration idle = Duration.between(info.getLastUpdatedAt(), now);
                if(idle.compareTo(stallTimeout) > 0) {
                    LOGGER.warn("[{}] 流水线 {}ms 无进展（可能在等待消费者读取），processed {}",
                            id, idle.toMillis(), info.getRecordsProcessed());
                    stalled++;
                    continue;
                }
                if(LOGGER.isDebugEnabled()) {
                    long seconds = Math.max(1, Duration.between(info.getStartedAt(), now).getSeconds());
                    LOGGER.debug("[{}] throughput {} records/s, processed {}", id,
                            info.getRecordsProcessed() / seconds, info.getRecordsProcessed());
                }
            } else if(info.getStatus().isTerminal() && info.getFinishedAt() != null
                    && Duration.between(info.getFinishedAt(), now).compareTo(retention) > 0) {
                manager.deregister(id);
                LOGGER.debug("[{}] removed {} pipeline after retention", id, info.getStatus());
            }
        }
        manager.getCache().purgeExpired();
        return stalled;
    }

    @Override
    public synchronized void close() {
        if(scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void checkQuietly() {
        // 定时任务抛出异常会取消后续调度
        try {
            check();
        } catch (RuntimeException e) {
            LOGGER.warn("HealthMonitor check failed", e);
        }
    }
}
