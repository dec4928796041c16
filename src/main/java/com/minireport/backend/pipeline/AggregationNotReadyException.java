package com.minireport.backend.pipeline;

/**
 * 聚合状态当前不可用：流水线尚未完成，或已停止并释放了状态。
 */
public class AggregationNotReadyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final PipelineStatus status;

    public AggregationNotReadyException(String streamId, PipelineStatus status, String detail) {
        super("Aggregation state of pipeline " + streamId + " is not available (" + status + "): " + detail);
        this.status = status;
    }

    public PipelineStatus getStatus() {
        return status;
    }
}
