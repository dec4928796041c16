package com.minireport.api.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.minireport.backend.cache.QueryCache;
import com.minireport.backend.loader.RelationshipLoader;
import com.minireport.backend.pipeline.HealthMonitor;
import com.minireport.backend.pipeline.MemoryProbe;
import com.minireport.backend.pipeline.PipelineManager;
import com.minireport.backend.pipeline.Sleeper;

/**
 * 后端组件装配：后端本身不依赖 Spring，这里按配置创建共享实例。
 */
@Configuration
public class StreamingConfiguration {

    @Bean
    public QueryCache queryCache(StreamingProperties properties) {
        return new QueryCache(properties.toCacheConfig());
    }

    @Bean
    public RelationshipLoader relationshipLoader() {
        return new RelationshipLoader();
    }

    @Bean(destroyMethod = "shutdown")
    public PipelineManager pipelineManager(QueryCache queryCache, RelationshipLoader relationshipLoader,
                                           StreamingProperties properties) {
        return new PipelineManager(queryCache, relationshipLoader, MemoryProbe.runtime(), Sleeper.threadSleep(),
                Clock.systemUTC(), properties.getIoThreads());
    }

    @Bean(destroyMethod = "close")
    public HealthMonitor healthMonitor(PipelineManager pipelineManager, StreamingProperties properties) {
        StreamingProperties.Health health = properties.getHealth();
        HealthMonitor monitor = new HealthMonitor(pipelineManager, Clock.systemUTC(), health.getStallTimeout(),
                health.getRetention());
        monitor.start(health.getInterval());
        return monitor;
    }
}
