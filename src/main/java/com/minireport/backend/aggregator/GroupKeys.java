package com.minireport.backend.aggregator;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.minireport.common.Record;

/**
 * 分组键：单字段为字段值本身，多字段为按字段顺序排列的不可变 List（允许 null 元素）。
 * <p>
 * 数值分量统一归一化：数值相等的键落在同一分组，1、1L、1.0 都是 Long 1；
 * 有小数部分的值为去掉末尾 0 的 BigDecimal。
 * </p>
 */
public final class GroupKeys {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private GroupKeys() {}

    public static Object extract(Record record, List<String> fields) {
        if(fields.size() == 1) {
            return normalizeValue(record.get(fields.get(0)));
        }
        Object[] values = new Object[fields.size()];
        for(int i = 0; i < values.length; i++) {
            values[i] = normalizeValue(record.get(fields.get(i)));
        }
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    /**
     * 把调用方传入的查询键转成与 {@link #extract} 相同的形式，List 逐元素处理。
     */
    public static Object normalize(Object key) {
        if(key instanceof List) {
            List<?> list = (List<?>) key;
            Object[] values = new Object[list.size()];
            for(int i = 0; i < values.length; i++) {
                values[i] = normalizeValue(list.get(i));
            }
            return Collections.unmodifiableList(Arrays.asList(values));
        }
        return normalizeValue(key);
    }

    private static Object normalizeValue(Object v) {
        if(v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if(!(v instanceof Number)) {
            return v;
        }
        BigDecimal d = Numbers.toDecimal(v);
        if(d == null) {
            // NaN / Infinity 保持原值
            return v;
        }
        d = d.stripTrailingZeros();
        if(d.scale() <= 0 && d.compareTo(LONG_MIN) >= 0 && d.compareTo(LONG_MAX) <= 0) {
            return d.longValueExact();
        }
        return d;
    }
}
