package com.minireport.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 一行源数据（可能已展开关联关系），字段有序且不可变。
 * <p>
 * 关联加载后的嵌套对象以 Map 形式存放，{@link #get(String)} 支持 "customer.region" 这样的点路径。
 * </p>
 */
public final class Record {

    private final Map<String, Object> fields;

    private Record(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static Record of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new Record(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * 便捷构造：of("region", "West", "amount", 100)
     */
    public static Record of(Object... keyValues) {
        if(keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must be name/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for(int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new Record(Collections.unmodifiableMap(map));
    }

    /**
     * 读取字段值；字段名不存在时先按点路径逐层查找嵌套 Map。
     */
    public Object get(String field) {
        if(fields.containsKey(field)) {
            return fields.get(field);
        }
        if(field.indexOf('.') < 0) {
            return null;
        }
        Object current = fields;
        for(String part : field.split("\\.")) {
            if(!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }

    public boolean has(String field) {
        if(fields.containsKey(field)) {
            return true;
        }
        return field.indexOf('.') > 0 && get(field) != null;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Record)) return false;
        return fields.equals(((Record) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
