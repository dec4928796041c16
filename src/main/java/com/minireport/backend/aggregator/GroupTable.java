package com.minireport.backend.aggregator;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.minireport.common.Record;

/**
 * 单个 {@link AggregationSpec} 的分组表：GroupKey -> GroupAccumulator。
 * <p>
 * 只由所属的 {@link AggregatingStage} 在写锁内修改，本类不加锁。
 * 达到 maxGroups 后拒绝新键，已有键照常更新。
 * </p>
 */
final class GroupTable {

    private final AggregationSpec spec;
    private final int maxGroups;
    private final Map<Object, GroupAccumulator> groups = new LinkedHashMap<>();
    private long rejectedRecords = 0;

    GroupTable(AggregationSpec spec, int maxGroups) {
        this.spec = spec;
        this.maxGroups = maxGroups;
    }

    /**
     * @return false 表示该记录属于新分组且分组数已满，被拒绝
     */
    boolean accept(Record record) {
        Object key = GroupKeys.extract(record, spec.getGroupByFields());
        GroupAccumulator acc = groups.get(key);
        if(acc == null) {
            if(groups.size() >= maxGroups) {
                rejectedRecords++;
                return false;
            }
            acc = new GroupAccumulator();
            groups.put(key, acc);
        }
        acc.accept(record, spec.getValueFields());
        return true;
    }

    AggregationSpec getSpec() {
        return spec;
    }

    int size() {
        return groups.size();
    }

    long getRejectedRecords() {
        return rejectedRecords;
    }

    GroupTableSnapshot snapshot() {
        Map<Object, GroupAccumulator> copy = new HashMap<>(groups.size() * 2);
        for (Map.Entry<Object, GroupAccumulator> en : groups.entrySet()) {
            copy.put(en.getKey(), en.getValue().copy());
        }
        return new GroupTableSnapshot(spec, copy, rejectedRecords);
    }

    void clear() {
        groups.clear();
    }
}
