package com.minireport.backend.pipeline;

public enum PipelineStatus {
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    STOPPED;

    /** 终态之间不再迁移 */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }
}
