package com.minireport.backend.pipeline;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.minireport.backend.aggregator.AggregatingStage;
import com.minireport.common.Chunk;

/**
 * 注册表中一条流水线的全部运行时资源：状态、控制信号、两段通道、两个阶段线程和消费线程。
 * 生命周期操作在本类上串行执行。
 */
class PipelineHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineHandle.class);

    private final String streamId;
    private final PipelineConfig config;
    private final PipelineState state;
    private final PipelineControl control;
    private final DemandChannel<Chunk> producerChannel;
    private final DemandChannel<Chunk> outputChannel;
    private final Thread producerThread;
    private final Thread transformThread;
    private final PipelineStream stream;

    /** 停止后置为 null，释放分组表 */
    private AggregatingStage stage;
    private ExecutorService consumerExecutor;

    PipelineHandle(String streamId, PipelineConfig config, PipelineState state, PipelineControl control,
                   AggregatingStage stage, DemandChannel<Chunk> producerChannel, DemandChannel<Chunk> outputChannel,
                   Producer producer) {
        this.streamId = streamId;
        this.config = config;
        this.state = state;
        this.control = control;
        this.stage = stage;
        this.producerChannel = producerChannel;
        this.outputChannel = outputChannel;
        this.producerThread = newThread("producer", producer);
        this.transformThread = newThread("transform", new TransformWorker(streamId, stage, producerChannel,
                outputChannel, state, control, config.getMaxDemand()));
        this.stream = new PipelineStream(this, outputChannel, config.getMaxDemand(), config.getConsumerTimeout());
    }

    void start() {
        transformThread.start();
        producerThread.start();
    }

    String getStreamId() {
        return streamId;
    }

    PipelineState getState() {
        return state;
    }

    PipelineStream getStream() {
        return stream;
    }

    PipelineConfig getConfig() {
        return config;
    }

    /** 已释放时为 null */
    synchronized AggregatingStage getStage() {
        return stage;
    }

    synchronized boolean pause() {
        if(state.pause()) {
            control.pause();
            return true;
        }
        return false;
    }

    synchronized boolean resume() {
        if(state.resume()) {
            control.resume();
            return true;
        }
        return false;
    }

    /**
     * 无条件停止：取消两个阶段、中断在途拉取、释放聚合状态，只保留轻量的状态信息。
     */
    synchronized void stop() {
        cancelStages();
        if(stage != null) {
            stage.release();
            stage = null;
        }
        if(state.markStopped()) {
            LOGGER.info("[{}] pipeline stopped", streamId);
        }
    }

    /**
     * 以失败结束：停止两个阶段，但保留已聚合的部分状态供诊断。
     */
    synchronized void fail(String reason, Throwable cause) {
        if(state.markFailed(reason)) {
            if(cause == null) {
                LOGGER.error("[{}] pipeline failed: {}", streamId, reason);
            } else {
                LOGGER.error("[{}] pipeline failed: {}", streamId, reason, cause);
            }
        }
        cancelStages();
    }

    /**
     * 输出流被完整消费后调用。
     */
    synchronized void onStreamDrained() {
        if(state.markCompleted()) {
            LOGGER.info("[{}] pipeline completed, {} records", streamId, state.toInfo().getRecordsProcessed());
        }
        shutdownConsumerExecutor();
    }

    synchronized ExecutorService consumerExecutor() {
        if(consumerExecutor == null) {
            ThreadFactory factory = new ThreadFactoryBuilder()
                    .setNameFormat("minireport-" + streamId + "-consumer")
                    .setDaemon(true)
                    .build();
            consumerExecutor = Executors.newSingleThreadExecutor(factory);
        }
        return consumerExecutor;
    }

    boolean isAlive() {
        return producerThread.isAlive() || transformThread.isAlive();
    }

    /**
     * 注意：调用方需持有 this 锁
     */
    private void cancelStages() {
        control.cancel();
        producerChannel.cancel();
        outputChannel.cancel();
        Thread current = Thread.currentThread();
        if(producerThread != current && producerThread.isAlive()) {
            producerThread.interrupt();
        }
        if(transformThread != current && transformThread.isAlive()) {
            transformThread.interrupt();
        }
        shutdownConsumerExecutor();
    }

    private void shutdownConsumerExecutor() {
        if(consumerExecutor != null) {
            consumerExecutor.shutdownNow();
            consumerExecutor = null;
        }
    }

    private Thread newThread(String role, Runnable task) {
        return new ThreadFactoryBuilder()
                .setNameFormat("minireport-" + streamId + "-" + role)
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) -> LOGGER.error("[{}] uncaught error in {}", streamId, t.getName(), e))
                .build()
                .newThread(task);
    }
}
