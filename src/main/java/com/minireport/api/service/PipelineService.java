package com.minireport.api.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.minireport.api.config.StreamingProperties;
import com.minireport.backend.aggregator.AggregationResult;
import com.minireport.backend.cache.CacheStats;
import com.minireport.backend.cache.QueryCache;
import com.minireport.backend.pipeline.AggregationSnapshot;
import com.minireport.backend.pipeline.PipelineFilter;
import com.minireport.backend.pipeline.PipelineInfo;
import com.minireport.backend.pipeline.PipelineManager;
import com.minireport.backend.pipeline.PipelineOptions;
import com.minireport.backend.pipeline.PipelineStatus;
import com.minireport.backend.pipeline.StartedPipeline;
import com.minireport.backend.source.DataSource;
import com.minireport.backend.source.QueryDescriptor;

/**
 * 监控与生命周期接口的业务层，聚合结果在这里转为可序列化的结构。
 */
@Service
public class PipelineService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineService.class);

    private final PipelineManager manager;
    private final QueryCache cache;
    private final StreamingProperties properties;

    public PipelineService(PipelineManager manager, QueryCache cache, StreamingProperties properties) {
        this.manager = manager;
        this.cache = cache;
        this.properties = properties;
    }

    /**
     * 以应用配置为默认值构建启动参数，供报表层在进程内启动流水线。
     */
    public PipelineOptions.Builder newOptions(DataSource dataSource, QueryDescriptor query) {
        return PipelineOptions.builder(dataSource, query).config(properties.toPipelineConfig());
    }

    public StartedPipeline start(PipelineOptions options) {
        return manager.startPipeline(options);
    }

    public List<PipelineInfo> list(PipelineStatus status, String reportName) {
        return manager.listPipelines(PipelineFilter.of(status, reportName));
    }

    public Map<PipelineStatus, Long> counts() {
        return manager.pipelineCounts();
    }

    public PipelineInfo info(String streamId) {
        return manager.getPipelineInfo(streamId);
    }

    public PipelineInfo pause(String streamId) {
        manager.pausePipeline(streamId);
        return manager.getPipelineInfo(streamId);
    }

    public PipelineInfo resume(String streamId) {
        manager.resumePipeline(streamId);
        return manager.getPipelineInfo(streamId);
    }

    public PipelineInfo stop(String streamId) {
        manager.stopPipeline(streamId);
        LOGGER.info("通过接口停止流水线 {}", streamId);
        return manager.getPipelineInfo(streamId);
    }

    public boolean deregister(String streamId) {
        return manager.deregister(streamId);
    }

    public Map<String, Object> snapshot(String streamId) {
        AggregationSnapshot snap = manager.getAggregationSnapshot(streamId);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("streamId", snap.getStreamId());
        out.put("status", snap.getStatus());
        out.put("recordsProcessed", snap.getRecordsProcessed());
        out.put("percentComplete", snap.getPercentComplete());
        out.put("stable", snap.isStable());
        out.put("aggregations", snap.getAggregations().toReport());
        return out;
    }

    public Map<String, Object> state(String streamId) {
        AggregationResult result = manager.getAggregationState(streamId);
        return result.toReport();
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
        LOGGER.info("Query cache cleared");
    }
}
