package com.minireport.backend.consumer;

/**
 * 包装消费函数抛出的任何异常（含 Error），由默认的 {@link ErrorHandler} 抛出。
 */
public class ConsumeChunkException extends Exception {

    private static final long serialVersionUID = 1L;

    private final long chunkIndex;
    private final int attempts;

    public ConsumeChunkException(long chunkIndex, int attempts, Throwable cause) {
        super("Consume chunk " + chunkIndex + " failed after " + attempts + " attempt(s): " + cause, cause);
        this.chunkIndex = chunkIndex;
        this.attempts = attempts;
    }

    public long getChunkIndex() {
        return chunkIndex;
    }

    public int getAttempts() {
        return attempts;
    }
}
