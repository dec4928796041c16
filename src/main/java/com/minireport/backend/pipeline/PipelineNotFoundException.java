package com.minireport.backend.pipeline;

public class PipelineNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineNotFoundException(String streamId) {
        super("Pipeline not found: " + streamId);
    }
}
