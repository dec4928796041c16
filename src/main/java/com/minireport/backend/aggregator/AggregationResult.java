package com.minireport.backend.aggregator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 聚合状态的只读视图：各级分组表快照（按级别升序）+ 全局聚合值。
 * finalized 为 true 时是最终结果，否则是运行中的快照。
 */
public final class AggregationResult {

    private final List<GroupTableSnapshot> tables;
    private final Map<String, Object> global;
    private final long totalTransformed;
    private final boolean finalized;

    AggregationResult(List<GroupTableSnapshot> tables, Map<String, Object> global,
                      long totalTransformed, boolean finalized) {
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        this.global = Collections.unmodifiableMap(new LinkedHashMap<>(global));
        this.totalTransformed = totalTransformed;
        this.finalized = finalized;
    }

    public List<GroupTableSnapshot> getTables() {
        return tables;
    }

    public Optional<GroupTableSnapshot> table(String name) {
        for (GroupTableSnapshot t : tables) {
            if(t.getSpec().getName().equals(name)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    public Optional<GroupTableSnapshot> tableAtLevel(int level) {
        for (GroupTableSnapshot t : tables) {
            if(t.getSpec().getLevel() == level) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /** 全局聚合：label -> 值，如 SUM(amount) -> 450 */
    public Map<String, Object> getGlobal() {
        return global;
    }

    public long getTotalTransformed() {
        return totalTransformed;
    }

    public boolean isFinalized() {
        return finalized;
    }

    /**
     * 转为便于序列化的结构：
     * {"groups": [{"name", "level", "groupBy", "rejectedRecords", "rows": [{"key", "values"}]}], "global": {...}}
     */
    public Map<String, Object> toReport() {
        List<Map<String, Object>> levels = new ArrayList<>();
        for (GroupTableSnapshot t : tables) {
            Map<String, Object> level = new LinkedHashMap<>();
            level.put("name", t.getSpec().getName());
            level.put("level", t.getSpec().getLevel());
            level.put("groupBy", t.getSpec().getGroupBy());
            level.put("rejectedRecords", t.getRejectedRecords());
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Map.Entry<Object, Map<String, Object>> en : t.toSortedMap().entrySet()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("key", en.getKey());
                row.put("values", en.getValue());
                rows.add(row);
            }
            level.put("rows", rows);
            levels.add(level);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("groups", levels);
        out.put("global", global);
        out.put("totalTransformed", totalTransformed);
        out.put("finalized", finalized);
        return out;
    }
}
