package com.minireport.backend.aggregator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.minireport.common.Record;

/**
 * 全局（不分组）聚合器容器。
 * <p>
 * 未指定字段时按首次出现的数值字段动态创建聚合器，顺序与字段首次出现的顺序一致。
 * </p>
 */
public class AggregateContext {
    private final Set<AggregateFunc> functions;
    private final boolean discoverFields;
    private final Set<String> fields;
    private final List<Aggregator> aggregators;

    private AggregateContext(Set<AggregateFunc> functions, boolean discoverFields,
                             Set<String> fields, List<Aggregator> aggregators) {
        this.functions = functions;
        this.discoverFields = discoverFields;
        this.fields = fields;
        this.aggregators = aggregators;
    }

    public static AggregateContext of(Set<AggregateFunc> functions, List<String> valueFields) {
        Set<AggregateFunc> funcs = new LinkedHashSet<>(functions);
        List<Aggregator> list = new ArrayList<>();
        // COUNT 总是按记录计数
        if(funcs.contains(AggregateFunc.COUNT)) {
            list.add(new CountAggregator(null));
        }
        Set<String> fields = new LinkedHashSet<>();
        boolean discover = valueFields == null || valueFields.isEmpty();
        if(!discover) {
            for (String f : valueFields) {
                fields.add(f);
                list.addAll(create(funcs, f));
            }
        }
        return new AggregateContext(funcs, discover, fields, list);
    }

    public void accept(Record record) {
        if(functions.isEmpty()) {
            return;
        }
        if(discoverFields) {
            for (String name : record.fieldNames()) {
                if(!fields.contains(name) && Numbers.isNumeric(record.get(name))) {
                    fields.add(name);
                    aggregators.addAll(create(functions, name));
                }
            }
        }
        for (Aggregator agg : aggregators) {
            agg.accept(record);
        }
    }

    /**
     * 将当前聚合结果转为 label -> 值的新映射；值均为不可变对象，返回后与内部状态无共享。
     */
    public Map<String, Object> toValueMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Aggregator agg : aggregators) {
            map.put(agg.label(), agg.value());
        }
        return map;
    }

    private static List<Aggregator> create(Set<AggregateFunc> functions, String field) {
        List<Aggregator> list = new ArrayList<>();
        for (AggregateFunc function : functions) {
            switch (function) {
                case SUM:
                    list.add(new SumAggregator(field));
                    break;
                case AVG:
                    list.add(new AvgAggregator(field));
                    break;
                case MIN:
                    list.add(new MinAggregator(field));
                    break;
                case MAX:
                    list.add(new MaxAggregator(field));
                    break;
                case COUNT:
                    // 已由 COUNT(*) 覆盖
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported aggregate function: " + function);
            }
        }
        return list;
    }
}
