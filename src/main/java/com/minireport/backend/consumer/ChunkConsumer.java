package com.minireport.backend.consumer;

import com.minireport.common.Chunk;

/**
 * 下游消费者（渲染器、图表构建器等）实现的契约。
 * <p>
 * chunk 按产生顺序逐个投递，相互不重叠；每次调用都有超时限制。
 * </p>
 *
 * @param <S> 消费过程中传递的状态
 * @param <R> 最终结果
 */
public interface ChunkConsumer<S, R> {

    S consumeChunk(Chunk chunk, S state) throws Exception;

    R finalize(S state) throws Exception;
}
