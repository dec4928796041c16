package com.minireport.backend.aggregator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 某一时刻分组表的只读深拷贝，可以在任意线程中使用。
 */
public final class GroupTableSnapshot {

    private final AggregationSpec spec;
    private final Map<Object, GroupAccumulator> groups;
    private final long rejectedRecords;

    GroupTableSnapshot(AggregationSpec spec, Map<Object, GroupAccumulator> groups, long rejectedRecords) {
        this.spec = spec;
        this.groups = Collections.unmodifiableMap(groups);
        this.rejectedRecords = rejectedRecords;
    }

    public AggregationSpec getSpec() {
        return spec;
    }

    public int size() {
        return groups.size();
    }

    public long getRejectedRecords() {
        return rejectedRecords;
    }

    public Map<Object, GroupAccumulator> getGroups() {
        return groups;
    }

    /**
     * @param key 单字段分组传字段值；多字段分组传 List
     */
    public Optional<GroupAccumulator> group(Object key) {
        return Optional.ofNullable(groups.get(GroupKeys.normalize(key)));
    }

    /** 多字段分组的便捷查询：group("West", 1) */
    public Optional<GroupAccumulator> group(Object first, Object... rest) {
        if(rest.length == 0) {
            return group(first);
        }
        List<Object> key = new ArrayList<>(rest.length + 1);
        key.add(first);
        Collections.addAll(key, rest);
        return group((Object) key);
    }

    /**
     * 按 spec 的排序方向输出分组键有序的结果：key -> {field: {func: value}, _count: n}
     */
    public Map<Object, Map<String, Object>> toSortedMap() {
        List<Object> keys = new ArrayList<>(groups.keySet());
        Comparator<Object> cmp = GroupKeyOrdering.INSTANCE;
        if(spec.getSortDirection() == SortDirection.DESC) {
            cmp = cmp.reversed();
        }
        keys.sort(cmp);
        Map<Object, Map<String, Object>> out = new LinkedHashMap<>();
        for (Object k : keys) {
            out.put(k, groups.get(k).toMap(spec.getFunctions()));
        }
        return out;
    }

    /**
     * 分组键排序，全序：先按类型等级 null < 数值 < 字符串 < 布尔 < List < 其他，
     * 同一等级内再比较取值。数值按 BigDecimal 比较，NaN/Infinity 按 double 比较；
     * 其他类型先比较类名，同类 Comparable 用自然序，否则比较字符串形式。
     */
    enum GroupKeyOrdering implements Comparator<Object> {
        INSTANCE;

        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public int compare(Object a, Object b) {
            if(a == b) {
                return 0;
            }
            int ra = rank(a);
            int rb = rank(b);
            if(ra != rb) {
                return Integer.compare(ra, rb);
            }
            switch (ra) {
                case 0:
                    return 0;
                case 1:
                    return compareNumbers((Number) a, (Number) b);
                case 2:
                    return a.toString().compareTo(b.toString());
                case 3:
                    return Boolean.compare((Boolean) a, (Boolean) b);
                case 4: {
                    List<?> la = (List<?>) a;
                    List<?> lb = (List<?>) b;
                    for(int i = 0; i < Math.min(la.size(), lb.size()); i++) {
                        int c = compare(la.get(i), lb.get(i));
                        if(c != 0) {
                            return c;
                        }
                    }
                    return Integer.compare(la.size(), lb.size());
                }
                default: {
                    int c = a.getClass().getName().compareTo(b.getClass().getName());
                    if(c != 0) {
                        return c;
                    }
                    if(a instanceof Comparable) {
                        return ((Comparable) a).compareTo(b);
                    }
                    return String.valueOf(a).compareTo(String.valueOf(b));
                }
            }
        }

        private static int rank(Object v) {
            if(v == null) {
                return 0;
            }
            if(v instanceof Number) {
                return 1;
            }
            if(v instanceof CharSequence) {
                return 2;
            }
            if(v instanceof Boolean) {
                return 3;
            }
            if(v instanceof List) {
                return 4;
            }
            return 5;
        }

        private static int compareNumbers(Number a, Number b) {
            BigDecimal da = Numbers.toDecimal(a);
            BigDecimal db = Numbers.toDecimal(b);
            if(da != null && db != null) {
                return da.compareTo(db);
            }
            return Integer.compare(nonFiniteRank(a, da), nonFiniteRank(b, db));
        }

        /** -Infinity < 有限值 < +Infinity < NaN */
        private static int nonFiniteRank(Number v, BigDecimal decimal) {
            if(decimal != null) {
                return 0;
            }
            double d = v.doubleValue();
            if(Double.isNaN(d)) {
                return 2;
            }
            return d < 0 ? -1 : 1;
        }
    }
}
