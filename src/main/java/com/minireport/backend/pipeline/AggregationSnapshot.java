package com.minireport.backend.pipeline;

import com.minireport.backend.aggregator.AggregationResult;

/**
 * 运行中的聚合快照 + 进度，供进度条轮询。stable 为 true 表示已是最终结果。
 */
public final class AggregationSnapshot {

    private final String streamId;
    private final PipelineStatus status;
    private final AggregationResult aggregations;
    private final long recordsProcessed;
    private final Double percentComplete;
    private final boolean stable;

    AggregationSnapshot(String streamId, PipelineStatus status, AggregationResult aggregations,
                        long recordsProcessed, Double percentComplete, boolean stable) {
        this.streamId = streamId;
        this.status = status;
        this.aggregations = aggregations;
        this.recordsProcessed = recordsProcessed;
        this.percentComplete = percentComplete;
        this.stable = stable;
    }

    public String getStreamId() {
        return streamId;
    }

    public PipelineStatus getStatus() {
        return status;
    }

    public AggregationResult getAggregations() {
        return aggregations;
    }

    public long getRecordsProcessed() {
        return recordsProcessed;
    }

    /** 总数未知时为 null */
    public Double getPercentComplete() {
        return percentComplete;
    }

    public boolean isStable() {
        return stable;
    }
}
