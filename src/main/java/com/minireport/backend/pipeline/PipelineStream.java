package com.minireport.backend.pipeline;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.minireport.backend.consumer.ChunkConsumer;
import com.minireport.common.Chunk;
import com.minireport.common.Error;

/**
 * 流水线的输出流：按顺序给出聚合后的 chunk。
 * <p>
 * 既可以直接当 Iterator 遍历，也可以用 {@link #consume} 驱动一个 {@link ChunkConsumer}（每次调用带超时）。
 * 取走一个 chunk 才向上游补充一个信用，调用方不读取时整条流水线会因背压停住。
 * 非线程安全，只能由一个线程消费。
 * </p>
 */
public class PipelineStream implements Iterator<Chunk>, AutoCloseable {

    private final PipelineHandle handle;
    private final DemandChannel<Chunk> channel;
    private final int maxDemand;
    private final Duration consumerTimeout;

    private boolean granted = false;
    private boolean ended = false;
    private Chunk next;

    PipelineStream(PipelineHandle handle, DemandChannel<Chunk> channel, int maxDemand, Duration consumerTimeout) {
        this.handle = handle;
        this.channel = channel;
        this.maxDemand = maxDemand;
        this.consumerTimeout = consumerTimeout;
    }

    public String getStreamId() {
        return handle.getStreamId();
    }

    /**
     * @throws PipelineFailedException 流水线失败
     */
    @Override
    public boolean hasNext() {
        boolean has = hasNextInternal();
        if(!has && channel.isDrained()) {
            handle.onStreamDrained();
        }
        return has;
    }

    @Override
    public Chunk next() {
        if(!hasNext()) {
            throw new NoSuchElementException();
        }
        Chunk c = next;
        next = null;
        return c;
    }

    /**
     * 用消费者消费整个流，返回 finalize 的结果。
     * 任一次调用超时或抛错都会让流水线进入 FAILED，已聚合的部分状态仍可通过快照查询。
     *
     * @throws PipelineFailedException 消费者失败、超时或上游失败
     * @throws IllegalStateException 流水线在消费完成前被停止
     */
    public <S, R> R consume(ChunkConsumer<S, R> consumer, S initialState) {
        ExecutorService executor = handle.consumerExecutor();
        S acc = initialState;
        while (hasNextInternal()) {
            final Chunk chunk = next;
            next = null;
            final S current = acc;
            acc = callWithTimeout(executor, () -> consumer.consumeChunk(chunk, current),
                    "consumeChunk(chunk " + chunk.getChunkIndex() + ")");
        }
        if(!channel.isDrained()) {
            throw Error.PipelineStoppedException;
        }
        final S finalState = acc;
        R result = callWithTimeout(executor, () -> consumer.finalize(finalState), "finalize");
        handle.onStreamDrained();
        return result;
    }

    /**
     * 提前关闭：流尚未消费完时停止流水线。
     */
    @Override
    public void close() {
        if(!ended || !channel.isDrained()) {
            if(!handle.getState().getStatus().isTerminal()) {
                handle.stop();
            }
        }
        ended = true;
        next = null;
    }

    /** 与 hasNext 相同，但流结束时不标记完成，由 consume 在 finalize 之后标记 */
    private boolean hasNextInternal() {
        if(next != null) {
            return true;
        }
        if(ended) {
            return false;
        }
        next = pull();
        if(next == null) {
            ended = true;
            return false;
        }
        return true;
    }

    private Chunk pull() {
        try {
            if(!granted) {
                granted = true;
                channel.grant(maxDemand);
            }
            Chunk c = channel.take();
            if(c != null) {
                channel.grant(1);
            }
            return c;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PipelineFailedException(getStreamId(), "Interrupted while waiting for next chunk", ie);
        }
    }

    private <T> T callWithTimeout(ExecutorService executor, Callable<T> call, String what) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            throw fail("Consumer executor unavailable for " + what, e);
        }
        try {
            return future.get(consumerTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw fail("Consumer timed out after " + consumerTimeout.toMillis() + "ms in " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw fail("Consumer failed in " + what + ": " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw fail("Interrupted while waiting for consumer in " + what, e);
        }
    }

    private PipelineFailedException fail(String reason, Throwable cause) {
        ended = true;
        next = null;
        handle.fail(reason, cause);
        return new PipelineFailedException(getStreamId(), reason, cause);
    }
}
