package com.minireport.backend.consumer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.minireport.common.Record;

/**
 * 记录缓冲：攒满 batchSize 条后吐出一个完整批次，流结束时 {@link #flush()} 取出剩余部分。
 * 非线程安全，由单个消费者使用。
 */
public class RecordBuffer {

    public static final int DEFAULT_BATCH_SIZE = 100;

    private final int batchSize;
    private List<Record> pending;
    private long totalBuffered = 0;

    public RecordBuffer() {
        this(DEFAULT_BATCH_SIZE);
    }

    public RecordBuffer(int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive, got %s", batchSize);
        this.batchSize = batchSize;
        this.pending = new ArrayList<>(batchSize);
    }

    /**
     * 追加记录；攒够一批时返回该批次（恰好 batchSize 条），多出的记录留在缓冲中。
     * 一次追加超过两批时，除最后一个完整批次外的记录也一并返回，返回列表长度为 batchSize 的整数倍。
     */
    public Optional<List<Record>> add(List<Record> records) {
        pending.addAll(records);
        totalBuffered += records.size();
        if(pending.size() < batchSize) {
            return Optional.empty();
        }
        int full = pending.size() - pending.size() % batchSize;
        List<Record> batch = ImmutableList.copyOf(pending.subList(0, full));
        pending = new ArrayList<>(pending.subList(full, pending.size()));
        return Optional.of(batch);
    }

    /**
     * 取出剩余的不完整批次（可能为空列表）。
     */
    public List<Record> flush() {
        if(pending.isEmpty()) {
            return Collections.emptyList();
        }
        List<Record> rest = ImmutableList.copyOf(pending);
        pending = new ArrayList<>(batchSize);
        return rest;
    }

    public int pendingSize() {
        return pending.size();
    }

    /** 累计进入缓冲的记录数 */
    public long totalBuffered() {
        return totalBuffered;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
