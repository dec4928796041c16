package com.minireport.backend.aggregator;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.minireport.common.Record;

/**
 * 一个分组的聚合状态：记录数 + 每个数值字段的累加器。
 */
public final class GroupAccumulator {

    private long recordCount = 0;
    private final Map<String, FieldAccumulator> fields = new LinkedHashMap<>();

    /**
     * @param valueFields 为空时聚合记录中的全部数值字段
     */
    void accept(Record record, List<String> valueFields) {
        recordCount++;
        if(valueFields.isEmpty()) {
            for (Map.Entry<String, Object> en : record.asMap().entrySet()) {
                BigDecimal v = Numbers.toDecimal(en.getValue());
                if(v != null) {
                    fields.computeIfAbsent(en.getKey(), k -> new FieldAccumulator()).accept(v);
                }
            }
            return;
        }
        for (String f : valueFields) {
            BigDecimal v = Numbers.toDecimal(record.get(f));
            if(v != null) {
                fields.computeIfAbsent(f, k -> new FieldAccumulator()).accept(v);
            }
        }
    }

    GroupAccumulator copy() {
        GroupAccumulator c = new GroupAccumulator();
        c.recordCount = recordCount;
        for (Map.Entry<String, FieldAccumulator> en : fields.entrySet()) {
            c.fields.put(en.getKey(), en.getValue().copy());
        }
        return c;
    }

    public long getRecordCount() {
        return recordCount;
    }

    /** 字段从未出现数值时返回空累加器 */
    public FieldAccumulator field(String name) {
        FieldAccumulator acc = fields.get(name);
        return acc == null ? new FieldAccumulator() : acc;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    /**
     * 只输出配置的聚合函数：{"amount": {"sum": .., "count": ..}, "_count": n}
     */
    public Map<String, Object> toMap(Set<AggregateFunc> functions) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, FieldAccumulator> en : fields.entrySet()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (AggregateFunc f : functions) {
                values.put(f.name().toLowerCase(), en.getValue().value(f));
            }
            out.put(en.getKey(), values);
        }
        out.put("_count", recordCount);
        return out;
    }

    @Override
    public String toString() {
        return "{records=" + recordCount + ", fields=" + fields + "}";
    }
}
