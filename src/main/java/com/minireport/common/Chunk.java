package com.minireport.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * 流水线中流动的一批有序记录及其位置元数据。
 * <p>
 * chunkIndex 在同一条流水线内单调递增；startOffset 为该批第一条记录在数据源中的偏移。
 * </p>
 */
public final class Chunk {

    private final List<Record> records;
    private final long chunkIndex;
    private final long startOffset;
    private final long totalProcessed;
    private final Map<String, Object> metadata;

    public Chunk(List<Record> records, long chunkIndex, long startOffset, long totalProcessed) {
        this(records, chunkIndex, startOffset, totalProcessed, Collections.emptyMap());
    }

    public Chunk(List<Record> records, long chunkIndex, long startOffset, long totalProcessed,
                 Map<String, Object> metadata) {
        this.records = ImmutableList.copyOf(records);
        this.chunkIndex = chunkIndex;
        this.startOffset = startOffset;
        this.totalProcessed = totalProcessed;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public List<Record> getRecords() {
        return records;
    }

    public long getChunkIndex() {
        return chunkIndex;
    }

    public int getChunkSize() {
        return records.size();
    }

    public long getStartOffset() {
        return startOffset;
    }

    /** 包含本批在内，到目前为止累计处理的记录数 */
    public long getTotalProcessed() {
        return totalProcessed;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * 替换记录并合并元数据，位置信息保持不变。
     */
    public Chunk with(List<Record> newRecords, long newTotalProcessed, Map<String, Object> extraMetadata) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extraMetadata);
        return new Chunk(newRecords, chunkIndex, startOffset, newTotalProcessed, merged);
    }

    @Override
    public String toString() {
        return "Chunk{index=" + chunkIndex + ", offset=" + startOffset + ", size=" + records.size()
                + ", totalProcessed=" + totalProcessed + "}";
    }
}
