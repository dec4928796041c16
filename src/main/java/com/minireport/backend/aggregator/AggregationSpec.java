package com.minireport.backend.aggregator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 解析完成的一级分组聚合规格。
 * <p>
 * groupByFields 为第 1..n 级成功解析的字段按级别顺序拼接而成；
 * {@link #getGroupBy()} 对单字段返回 String，多字段返回 List。
 * </p>
 */
public final class AggregationSpec {

    private final String name;
    private final int level;
    private final List<String> groupByFields;
    private final Set<AggregateFunc> functions;
    private final List<String> valueFields;
    private final SortDirection sortDirection;

    public AggregationSpec(String name, int level, List<String> groupByFields, Set<AggregateFunc> functions,
                           List<String> valueFields, SortDirection sortDirection) {
        if(groupByFields.isEmpty()) {
            throw new IllegalArgumentException("groupByFields must not be empty");
        }
        this.name = name;
        this.level = level;
        this.groupByFields = Collections.unmodifiableList(new ArrayList<>(groupByFields));
        this.functions = Collections.unmodifiableSet(EnumSet.copyOf(functions));
        this.valueFields = Collections.unmodifiableList(new ArrayList<>(valueFields));
        this.sortDirection = sortDirection;
    }

    public String getName() {
        return name;
    }

    public int getLevel() {
        return level;
    }

    public List<String> getGroupByFields() {
        return groupByFields;
    }

    /**
     * @return 单字段时为 String，多字段时为不可变 List&lt;String&gt;
     */
    public Object getGroupBy() {
        return groupByFields.size() == 1 ? groupByFields.get(0) : groupByFields;
    }

    public boolean isComposite() {
        return groupByFields.size() > 1;
    }

    public Set<AggregateFunc> getFunctions() {
        return functions;
    }

    /** 为空表示聚合记录中的全部数值字段 */
    public List<String> getValueFields() {
        return valueFields;
    }

    public SortDirection getSortDirection() {
        return sortDirection;
    }

    @Override
    public String toString() {
        return "AggregationSpec{name=" + name + ", level=" + level + ", groupBy=" + getGroupBy()
                + ", functions=" + functions + "}";
    }
}
