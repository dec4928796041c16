package com.minireport.backend.consumer;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.minireport.common.Chunk;

/**
 * 给原始消费函数加上重试与统一错误处理。
 * <p>
 * 被包装的函数抛出的任何 Throwable（包括 Error）都会被捕获并进入重试；
 * 重试用尽后交给 {@link ErrorHandler}，默认包装成 {@link ConsumeChunkException} 抛出。
 * </p>
 */
public class ErrorHandlingConsumer<S, R> implements ChunkConsumer<S, R> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorHandlingConsumer.class);

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    /** 原始消费函数 */
    @FunctionalInterface
    public interface ConsumeFunction<S> {
        S apply(Chunk chunk, S state) throws Exception;
    }

    /** 可被测试替换的等待方式 */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    private final ConsumeFunction<S> delegate;
    private final ChunkConsumer<S, R> finalizer;
    private final int maxRetries;
    private final Duration retryDelay;
    private final ErrorHandler<S> errorHandler;
    private final Sleeper sleeper;

    private ErrorHandlingConsumer(Builder<S, R> b) {
        this.delegate = b.delegate;
        this.finalizer = b.finalizer;
        this.maxRetries = b.maxRetries;
        this.retryDelay = b.retryDelay;
        this.errorHandler = b.errorHandler;
        this.sleeper = b.sleeper;
    }

    public static <S, R> Builder<S, R> wrap(ConsumeFunction<S> delegate) {
        return new Builder<>(delegate);
    }

    /**
     * 包装已有的消费者：consumeChunk 带重试，finalize 直接委托。
     */
    public static <S, R> Builder<S, R> wrap(ChunkConsumer<S, R> consumer) {
        Builder<S, R> b = new Builder<>(consumer::consumeChunk);
        b.finalizer = consumer;
        return b;
    }

    @Override
    public S consumeChunk(Chunk chunk, S state) throws Exception {
        int attempts = 0;
        while (true) {
            attempts++;
            Throwable failure;
            try {
                return delegate.apply(chunk, state);
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                failure = e;
            } catch (java.lang.Error e) {
                // 断言失败、栈溢出等也按消费失败处理
                failure = e;
            }
            if(attempts > maxRetries) {
                LOGGER.warn("Consume chunk {} failed after {} attempt(s): {}", chunk.getChunkIndex(), attempts, failure.toString());
                return errorHandler.handle(failure, chunk, state, attempts);
            }
            LOGGER.debug("Consume chunk {} failed (attempt {}), retry in {}ms", chunk.getChunkIndex(), attempts,
                    retryDelay.toMillis());
            sleeper.sleep(retryDelay);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public R finalize(S state) throws Exception {
        if(finalizer == null) {
            return (R) state;
        }
        return finalizer.finalize(state);
    }

    public static final class Builder<S, R> {
        private final ConsumeFunction<S> delegate;
        private ChunkConsumer<S, R> finalizer;
        private int maxRetries = 0;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private ErrorHandler<S> errorHandler = ErrorHandler.rethrow();
        private Sleeper sleeper = d -> Thread.sleep(d.toMillis());

        private Builder(ConsumeFunction<S> delegate) {
            this.delegate = Preconditions.checkNotNull(delegate, "delegate");
        }

        public Builder<S, R> maxRetries(int maxRetries) {
            Preconditions.checkArgument(maxRetries >= 0, "maxRetries must be >= 0");
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder<S, R> retryDelay(Duration retryDelay) {
            Preconditions.checkArgument(!retryDelay.isNegative(), "retryDelay must not be negative");
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder<S, R> onError(ErrorHandler<S> errorHandler) {
            this.errorHandler = Preconditions.checkNotNull(errorHandler);
            return this;
        }

        public Builder<S, R> sleeper(Sleeper sleeper) {
            this.sleeper = Preconditions.checkNotNull(sleeper);
            return this;
        }

        public ErrorHandlingConsumer<S, R> build() {
            return new ErrorHandlingConsumer<>(this);
        }
    }
}
