package com.minireport.api.controller;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import javax.validation.constraints.NotBlank;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.minireport.api.entity.response.ApiResponse;
import com.minireport.api.service.PipelineService;
import com.minireport.backend.pipeline.AggregationNotReadyException;
import com.minireport.backend.pipeline.PipelineInfo;
import com.minireport.backend.pipeline.PipelineNotFoundException;
import com.minireport.backend.pipeline.PipelineStatus;

/**
 * 流水线监控与生命周期接口，进度条按 500~1000ms 轮询 snapshot。
 */
@RestController
@RequestMapping("/api/pipelines")
@Validated
public class PipelineController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineService pipelineService;

    public PipelineController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<PipelineInfo>>> list(@RequestParam(required = false) PipelineStatus status,
                                                                @RequestParam(required = false) String reportName) {
        return ResponseEntity.ok(ApiResponse.success(pipelineService.list(status, reportName)));
    }

    @GetMapping("/counts")
    public ResponseEntity<ApiResponse<Map<PipelineStatus, Long>>> counts() {
        return ResponseEntity.ok(ApiResponse.success(pipelineService.counts()));
    }

    @GetMapping("/{streamId}")
    public ResponseEntity<ApiResponse<PipelineInfo>> info(@PathVariable @NotBlank String streamId) {
        return handle(() -> pipelineService.info(streamId));
    }

    @PostMapping("/{streamId}/pause")
    public ResponseEntity<ApiResponse<PipelineInfo>> pause(@PathVariable @NotBlank String streamId) {
        return handle(() -> pipelineService.pause(streamId));
    }

    @PostMapping("/{streamId}/resume")
    public ResponseEntity<ApiResponse<PipelineInfo>> resume(@PathVariable @NotBlank String streamId) {
        return handle(() -> pipelineService.resume(streamId));
    }

    @PostMapping("/{streamId}/stop")
    public ResponseEntity<ApiResponse<PipelineInfo>> stop(@PathVariable @NotBlank String streamId) {
        return handle(() -> pipelineService.stop(streamId));
    }

    @GetMapping("/{streamId}/snapshot")
    public ResponseEntity<ApiResponse<Map<String, Object>>> snapshot(@PathVariable @NotBlank String streamId) {
        return handle(() -> pipelineService.snapshot(streamId));
    }

    @GetMapping("/{streamId}/state")
    public ResponseEntity<ApiResponse<Map<String, Object>>> state(@PathVariable @NotBlank String streamId) {
        return handle(() -> pipelineService.state(streamId));
    }

    @DeleteMapping("/{streamId}")
    public ResponseEntity<Void> deregister(@PathVariable @NotBlank String streamId) {
        if(pipelineService.deregister(streamId)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
    }

    /**
     * 不存在 -> 404；状态不允许（未完成、已释放、已结束）-> 409
     */
    private <T> ResponseEntity<ApiResponse<T>> handle(Supplier<T> action) {
        try {
            return ResponseEntity.ok(ApiResponse.success(action.get()));
        } catch (PipelineNotFoundException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure(ex.getMessage()));
        } catch (AggregationNotReadyException | IllegalStateException ex) {
            LOGGER.debug("Request rejected: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.failure(ex.getMessage()));
        }
    }
}
