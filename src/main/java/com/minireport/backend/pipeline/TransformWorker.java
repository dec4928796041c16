package com.minireport.backend.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.minireport.backend.aggregator.AggregatingStage;
import com.minireport.common.Chunk;

/**
 * 聚合阶段的驱动线程：从上游通道取 chunk、聚合、转发到输出通道，并按处理进度向上游补充信用。
 */
class TransformWorker implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformWorker.class);

    private final String streamId;
    private final AggregatingStage stage;
    private final DemandChannel<Chunk> in;
    private final DemandChannel<Chunk> out;
    private final PipelineState state;
    private final PipelineControl control;
    private final int maxDemand;

    TransformWorker(String streamId, AggregatingStage stage, DemandChannel<Chunk> in, DemandChannel<Chunk> out,
                    PipelineState state, PipelineControl control, int maxDemand) {
        this.streamId = streamId;
        this.stage = stage;
        this.in = in;
        this.out = out;
        this.state = state;
        this.control = control;
        this.maxDemand = maxDemand;
    }

    @Override
    public void run() {
        try {
            in.grant(maxDemand);
            while (true) {
                Chunk chunk = in.take();
                if(chunk == null) {
                    break;
                }
                Chunk transformed = stage.consume(chunk);
                state.onChunkTransformed(chunk.getTotalProcessed());
                if(!out.awaitCredit()) {
                    LOGGER.debug("[{}] output closed, transform exits at chunk {}", streamId, chunk.getChunkIndex());
                    return;
                }
                out.send(transformed);
                in.grant(1);
            }
            if(in.isDrained()) {
                stage.finalizeState();
                out.complete();
                LOGGER.debug("[{}] transform finished, {} records aggregated", streamId, stage.getTotalTransformed());
            }
        } catch (PipelineFailedException e) {
            // 上游已记录失败原因，这里只负责向下游传递
            out.fail(e);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            if(!control.isCancelled()) {
                failHere("Transform interrupted", ie);
            }
        } catch (RuntimeException e) {
            if(control.isCancelled()) {
                LOGGER.debug("[{}] transform stopped: {}", streamId, e.toString());
                return;
            }
            failHere("Transform failed: " + e, e);
        }
    }

    private void failHere(String reason, Throwable cause) {
        if(state.markFailed(reason)) {
            LOGGER.error("[{}] pipeline failed: {}", streamId, reason, cause);
        }
        control.cancel();
        in.cancel();
        out.fail(new PipelineFailedException(streamId, reason, cause));
    }
}
