package com.minireport.backend.loader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 关联预加载规格：关联名 -> 下一跳的规格，按声明顺序保存。
 */
public final class LoadSpec {

    private static final LoadSpec EMPTY = new LoadSpec(Collections.emptyMap());

    private final Map<String, LoadSpec> children;

    private LoadSpec(Map<String, LoadSpec> children) {
        this.children = children;
    }

    public static LoadSpec empty() {
        return EMPTY;
    }

    public static LoadSpec of(Map<String, LoadSpec> children) {
        if(children.isEmpty()) {
            return EMPTY;
        }
        return new LoadSpec(Collections.unmodifiableMap(new LinkedHashMap<>(children)));
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public Set<String> names() {
        return children.keySet();
    }

    public LoadSpec child(String name) {
        LoadSpec c = children.get(name);
        return c == null ? EMPTY : c;
    }

    public Map<String, LoadSpec> getChildren() {
        return children;
    }

    /** 最长路径上的跳数，空规格为 0 */
    public int depth() {
        int max = 0;
        for (LoadSpec c : children.values()) {
            max = Math.max(max, c.depth());
        }
        return children.isEmpty() ? 0 : max + 1;
    }

    /**
     * 合并两份规格，同名关联递归合并。
     */
    public LoadSpec merge(LoadSpec other) {
        if(other.isEmpty()) return this;
        if(this.isEmpty()) return other;
        Map<String, LoadSpec> merged = new LinkedHashMap<>(children);
        for (Map.Entry<String, LoadSpec> en : other.children.entrySet()) {
            merged.merge(en.getKey(), en.getValue(), LoadSpec::merge);
        }
        return new LoadSpec(Collections.unmodifiableMap(merged));
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof LoadSpec)) return false;
        return children.equals(((LoadSpec) o).children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return children.toString();
    }
}
