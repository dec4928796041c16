package com.minireport.api.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.minireport.api.entity.response.ApiResponse;
import com.minireport.api.service.PipelineService;
import com.minireport.backend.cache.CacheStats;

@RestController
@RequestMapping("/api/cache")
public class CacheController {

    private final PipelineService pipelineService;

    public CacheController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<CacheStats>> stats() {
        return ResponseEntity.ok(ApiResponse.success(pipelineService.cacheStats()));
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        pipelineService.clearCache();
        return ResponseEntity.noContent().build();
    }
}
