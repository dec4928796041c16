package com.minireport.backend.pipeline;

/**
 * 流水线致命错误：重试耗尽、内存超限、消费者失败或超时。失败原因同时记录在 {@link PipelineInfo} 中。
 */
public class PipelineFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String streamId;

    public PipelineFailedException(String streamId, String reason) {
        super(reason);
        this.streamId = streamId;
    }

    public PipelineFailedException(String streamId, String reason, Throwable cause) {
        super(reason, cause);
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
