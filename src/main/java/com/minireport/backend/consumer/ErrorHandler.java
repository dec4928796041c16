package com.minireport.backend.consumer;

import com.minireport.common.Chunk;

/**
 * 重试用尽后的处理：可以返回替代状态继续消费，也可以抛出异常终止。
 */
@FunctionalInterface
public interface ErrorHandler<S> {

    S handle(Throwable error, Chunk chunk, S state, int attempts) throws Exception;

    static <S> ErrorHandler<S> rethrow() {
        return (error, chunk, state, attempts) -> {
            throw new ConsumeChunkException(chunk.getChunkIndex(), attempts, error);
        };
    }
}
