package com.minireport.backend.aggregator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.minireport.common.Chunk;
import com.minireport.common.Error;
import com.minireport.common.Record;

/**
 * 聚合转换阶段：逐条记录更新各级分组表和全局聚合，并把 chunk 原样（顺序不变）转发给下游。
 * <p>
 * 并发约定：
 * 1) 只有所属流水线的 transform 线程调用 {@link #consume}，它是唯一的写者（持写锁）
 * 2) {@link #snapshot()} 持读锁做深拷贝，返回后与内部状态无共享
 * 3) {@link #finalizeState()} 之后状态冻结，再调用 consume 抛出 StageFinalizedException
 * </p>
 */
public class AggregatingStage {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregatingStage.class);

    public static final String META_GROUP_COUNTS = "groupCounts";
    public static final String META_REJECTED_GROUPS = "rejectedGroups";
    public static final String META_TOTAL_TRANSFORMED = "totalTransformed";

    private final String streamId;
    private final List<GroupTable> tables;
    private final AggregateContext global;
    private final Function<Record, Record> transformer;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    private long totalTransformed = 0;
    private long skippedRecords = 0;
    private boolean finalized = false;
    private boolean released = false;
    private AggregationResult finalResult;

    public AggregatingStage(String streamId, List<AggregationSpec> specs, int maxGroups) {
        this(streamId, specs, maxGroups, AggregateContext.of(Collections.emptySet(), Collections.emptyList()), null);
    }

    /**
     * @param transformer 可选，返回 null 表示过滤掉该记录
     */
    public AggregatingStage(String streamId, List<AggregationSpec> specs, int maxGroups,
                            AggregateContext global, Function<Record, Record> transformer) {
        if(maxGroups <= 0) {
            throw new IllegalArgumentException("maxGroups must be positive, got " + maxGroups);
        }
        this.streamId = streamId;
        List<AggregationSpec> sorted = new ArrayList<>(specs);
        sorted.sort((a, b) -> Integer.compare(a.getLevel(), b.getLevel()));
        this.tables = new ArrayList<>(sorted.size());
        for (AggregationSpec spec : sorted) {
            tables.add(new GroupTable(spec, maxGroups));
        }
        this.global = global;
        this.transformer = transformer;
    }

    /**
     * 聚合一个 chunk，返回记录相同（经 transformer 归一化）、顺序不变并附带聚合元数据的 chunk。
     */
    public Chunk consume(Chunk chunk) {
        writeLock.lock();
        try {
            if(finalized || released) {
                throw Error.StageFinalizedException;
            }
            List<Record> out = new ArrayList<>(chunk.getChunkSize());
            long[] rejectedBefore = new long[tables.size()];
            for(int i = 0; i < tables.size(); i++) {
                rejectedBefore[i] = tables.get(i).getRejectedRecords();
            }
            for (Record raw : chunk.getRecords()) {
                Record record = transform(raw, chunk);
                if(record == null) {
                    continue;
                }
                for (GroupTable table : tables) {
                    table.accept(record);
                }
                global.accept(record);
                out.add(record);
            }
            totalTransformed += out.size();

            Map<String, Object> groupCounts = new LinkedHashMap<>();
            Map<String, Object> rejected = new LinkedHashMap<>();
            for(int i = 0; i < tables.size(); i++) {
                GroupTable t = tables.get(i);
                String name = t.getSpec().getName();
                groupCounts.put(name, t.size());
                long delta = t.getRejectedRecords() - rejectedBefore[i];
                rejected.put(name, t.getRejectedRecords());
                if(delta > 0) {
                    // 每个 chunk 只记录一次
                    LOGGER.warn("[{}] 分组 {} 已达上限 {}，本批拒绝 {} 条新分组记录 (chunk {})",
                            streamId, name, t.size(), delta, chunk.getChunkIndex());
                }
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(META_GROUP_COUNTS, groupCounts);
            meta.put(META_REJECTED_GROUPS, rejected);
            meta.put(META_TOTAL_TRANSFORMED, totalTransformed);
            return chunk.with(out, chunk.getTotalProcessed(), meta);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 当前聚合状态的深拷贝，不阻塞数据源，只与正在处理的单个 chunk 互斥。
     */
    public AggregationResult snapshot() {
        readLock.lock();
        try {
            if(finalResult != null) {
                return finalResult;
            }
            return buildResult(false);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 冻结并返回最终聚合结果，重复调用返回同一结果。
     */
    public AggregationResult finalizeState() {
        writeLock.lock();
        try {
            if(released) {
                throw Error.StageFinalizedException;
            }
            if(!finalized) {
                finalized = true;
                finalResult = buildResult(true);
                LOGGER.debug("[{}] aggregation finalized: {} records, {} skipped", streamId, totalTransformed, skippedRecords);
            }
            return finalResult;
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isFinalized() {
        readLock.lock();
        try {
            return finalized;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 释放全部分组表，之后的 consume / finalize 均会失败。
     */
    public void release() {
        writeLock.lock();
        try {
            released = true;
            finalResult = null;
            for (GroupTable t : tables) {
                t.clear();
            }
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isReleased() {
        readLock.lock();
        try {
            return released;
        } finally {
            readLock.unlock();
        }
    }

    public long getTotalTransformed() {
        readLock.lock();
        try {
            return totalTransformed;
        } finally {
            readLock.unlock();
        }
    }

    private Record transform(Record raw, Chunk chunk) {
        if(transformer == null) {
            return raw;
        }
        try {
            return transformer.apply(raw);
        } catch (RuntimeException e) {
            skippedRecords++;
            LOGGER.warn("[{}] transformer failed on record in chunk {}, record skipped: {}",
                    streamId, chunk.getChunkIndex(), e.toString());
            return null;
        }
    }

    /**
     * 注意：调用方需持有读锁或写锁
     */
    private AggregationResult buildResult(boolean isFinal) {
        List<GroupTableSnapshot> snaps = new ArrayList<>(tables.size());
        for (GroupTable t : tables) {
            snaps.add(t.snapshot());
        }
        return new AggregationResult(snaps, global.toValueMap(), totalTransformed, isFinal);
    }
}
