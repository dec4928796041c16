package com.minireport.backend.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link PipelineState} 在某一时刻的不可变拷贝，供监控接口返回。
 */
public final class PipelineInfo {

    private final String streamId;
    private final String reportName;
    private final PipelineStatus status;
    private final long recordsFetched;
    private final long recordsProcessed;
    private final long chunksProcessed;
    private final long currentOffset;
    private final int currentChunkSize;
    private final boolean degradedMode;
    private final long memoryUsage;
    private final int retryCount;
    private final long totalRetries;
    private final Long totalRecords;
    private final String failureReason;
    private final Instant startedAt;
    private final Instant lastUpdatedAt;
    private final Instant finishedAt;
    private final Map<String, Object> metadata;

    PipelineInfo(String streamId, String reportName, PipelineStatus status, long recordsFetched,
                 long recordsProcessed, long chunksProcessed, long currentOffset, int currentChunkSize,
                 boolean degradedMode, long memoryUsage, int retryCount, long totalRetries, Long totalRecords,
                 String failureReason, Instant startedAt, Instant lastUpdatedAt, Instant finishedAt,
                 Map<String, Object> metadata) {
        this.streamId = streamId;
        this.reportName = reportName;
        this.status = status;
        this.recordsFetched = recordsFetched;
        this.recordsProcessed = recordsProcessed;
        this.chunksProcessed = chunksProcessed;
        this.currentOffset = currentOffset;
        this.currentChunkSize = currentChunkSize;
        this.degradedMode = degradedMode;
        this.memoryUsage = memoryUsage;
        this.retryCount = retryCount;
        this.totalRetries = totalRetries;
        this.totalRecords = totalRecords;
        this.failureReason = failureReason;
        this.startedAt = startedAt;
        this.lastUpdatedAt = lastUpdatedAt;
        this.finishedAt = finishedAt;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getStreamId() {
        return streamId;
    }

    public String getReportName() {
        return reportName;
    }

    public PipelineStatus getStatus() {
        return status;
    }

    public long getRecordsFetched() {
        return recordsFetched;
    }

    public long getRecordsProcessed() {
        return recordsProcessed;
    }

    public long getChunksProcessed() {
        return chunksProcessed;
    }

    public long getCurrentOffset() {
        return currentOffset;
    }

    public int getCurrentChunkSize() {
        return currentChunkSize;
    }

    public boolean isDegradedMode() {
        return degradedMode;
    }

    public long getMemoryUsage() {
        return memoryUsage;
    }

    /** 当前这一页已经重试的次数，成功后归零 */
    public int getRetryCount() {
        return retryCount;
    }

    public long getTotalRetries() {
        return totalRetries;
    }

    /** 数据源估算的总记录数，未知时为 null */
    public Long getTotalRecords() {
        return totalRecords;
    }

    /**
     * 完成百分比（0~100），总数未知时为 null；已完成的流水线总是 100。
     */
    public Double getPercentComplete() {
        if(status == PipelineStatus.COMPLETED) {
            return 100.0;
        }
        if(totalRecords == null) {
            return null;
        }
        if(totalRecords == 0) {
            return 100.0;
        }
        double pct = recordsProcessed * 100.0 / totalRecords;
        return Math.min(100.0, Math.round(pct * 100.0) / 100.0);
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "PipelineInfo{streamId=" + streamId + ", status=" + status + ", processed=" + recordsProcessed
                + ", chunks=" + chunksProcessed + ", degraded=" + degradedMode
                + (failureReason == null ? "" : ", failureReason=" + failureReason) + "}";
    }
}
