package com.minireport.backend.pipeline;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单条流水线的运行状态。
 * <p>
 * 只由本流水线的 producer / transform / 消费线程以及编排器的生命周期操作修改；
 * 其他线程通过 {@link #toInfo()} 读取拷贝。状态迁移规则：
 * RUNNING <-> PAUSED；非终态 -> COMPLETED / FAILED；任意状态 -> STOPPED；终态之间除 STOPPED 外不再迁移。
 * </p>
 */
final class PipelineState {

    private final String streamId;
    private final String reportName;
    private final Map<String, Object> metadata;
    private final Clock clock;

    private PipelineStatus status = PipelineStatus.RUNNING;
    private long recordsFetched = 0;
    private long recordsProcessed = 0;
    private long chunksProcessed = 0;
    private long currentOffset = 0;
    private int currentChunkSize;
    private boolean degradedMode = false;
    private long memoryUsage = 0;
    private int retryCount = 0;
    private long totalRetries = 0;
    private Long totalRecords;
    private String failureReason;
    private final Instant startedAt;
    private Instant lastUpdatedAt;
    private Instant finishedAt;

    PipelineState(String streamId, String reportName, Map<String, Object> metadata, int chunkSize, Clock clock) {
        this.streamId = streamId;
        this.reportName = reportName;
        this.metadata = metadata == null ? Collections.emptyMap() : new LinkedHashMap<>(metadata);
        this.currentChunkSize = chunkSize;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.lastUpdatedAt = startedAt;
    }

    String getStreamId() {
        return streamId;
    }

    synchronized PipelineStatus getStatus() {
        return status;
    }

    synchronized void onPageFetched(long nextOffset, int records) {
        recordsFetched += records;
        currentOffset = nextOffset;
        touch();
    }

    synchronized void onChunkTransformed(long totalProcessed) {
        recordsProcessed = totalProcessed;
        chunksProcessed++;
        touch();
    }

    synchronized void onMemorySample(long used) {
        memoryUsage = used;
    }

    synchronized void setChunkSize(int chunkSize, boolean degraded) {
        this.currentChunkSize = chunkSize;
        this.degradedMode = degraded;
        touch();
    }

    synchronized void onRetry(int retryCount) {
        this.retryCount = retryCount;
        this.totalRetries++;
        touch();
    }

    synchronized void resetRetry() {
        this.retryCount = 0;
    }

    synchronized void setTotalRecords(Long totalRecords) {
        this.totalRecords = totalRecords;
    }

    synchronized boolean pause() {
        if(status != PipelineStatus.RUNNING) {
            return false;
        }
        status = PipelineStatus.PAUSED;
        touch();
        return true;
    }

    synchronized boolean resume() {
        if(status != PipelineStatus.PAUSED) {
            return false;
        }
        status = PipelineStatus.RUNNING;
        touch();
        return true;
    }

    synchronized boolean markCompleted() {
        if(status.isTerminal()) {
            return false;
        }
        status = PipelineStatus.COMPLETED;
        finish();
        return true;
    }

    /**
     * 记录失败原因；已经处于终态时忽略，保留第一次的原因。
     */
    synchronized boolean markFailed(String reason) {
        if(status.isTerminal()) {
            return false;
        }
        status = PipelineStatus.FAILED;
        failureReason = reason;
        finish();
        return true;
    }

    synchronized boolean markStopped() {
        if(status == PipelineStatus.STOPPED) {
            return false;
        }
        status = PipelineStatus.STOPPED;
        finish();
        return true;
    }

    synchronized PipelineInfo toInfo() {
        return new PipelineInfo(streamId, reportName, status, recordsFetched, recordsProcessed, chunksProcessed,
                currentOffset, currentChunkSize, degradedMode, memoryUsage, retryCount, totalRetries, totalRecords,
                failureReason, startedAt, lastUpdatedAt, finishedAt, metadata);
    }

    private void touch() {
        lastUpdatedAt = clock.instant();
    }

    private void finish() {
        touch();
        finishedAt = lastUpdatedAt;
    }
}
