package com.minireport.backend.pipeline;

/**
 * startPipeline 的返回值：流水线 id + 输出流。
 */
public final class StartedPipeline {

    private final String streamId;
    private final PipelineStream stream;

    StartedPipeline(String streamId, PipelineStream stream) {
        this.streamId = streamId;
        this.stream = stream;
    }

    public String getStreamId() {
        return streamId;
    }

    public PipelineStream getStream() {
        return stream;
    }
}
