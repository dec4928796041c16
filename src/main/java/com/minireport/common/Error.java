package com.minireport.common;

/**
 * 公共异常常量：不携带上下文信息的错误统一在这里定义。
 * 需要携带 streamId / 深度等信息的错误请使用独立的异常类。
 */
public class Error {

    // pipeline
    public static final RuntimeException ChannelClosedException = new IllegalStateException("Demand channel is closed!");
    public static final RuntimeException StageFinalizedException = new IllegalStateException("Aggregating stage already finalized!");
    public static final RuntimeException PipelineStoppedException = new IllegalStateException("Pipeline has been stopped!");
    public static final RuntimeException MemoryLimitExceededException = new IllegalStateException("Memory limit exceeded at minimum chunk size!");

    // options
    public static final RuntimeException MissingDataSourceException = new IllegalArgumentException("Data source is required!");
    public static final RuntimeException MissingQueryException = new IllegalArgumentException("Query descriptor is required!");

    private Error() {}
}
