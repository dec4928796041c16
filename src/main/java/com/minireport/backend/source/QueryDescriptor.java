package com.minireport.backend.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.minireport.backend.loader.LoadSpec;

/**
 * 对数据源的查询描述：资源名 + 过滤条件 + 排序 + 关联预加载规格。
 * <p>
 * 分页参数（offset / limit）不属于描述本身，由 Producer 在每次取数时传入。
 * </p>
 */
public final class QueryDescriptor {

    private final String resource;
    private final Map<String, Object> filter;
    private final List<String> sort;
    private final LoadSpec load;

    private QueryDescriptor(String resource, Map<String, Object> filter, List<String> sort, LoadSpec load) {
        if(resource == null || resource.isEmpty()) {
            throw new IllegalArgumentException("resource must not be empty");
        }
        this.resource = resource;
        this.filter = Collections.unmodifiableMap(new LinkedHashMap<>(filter));
        this.sort = ImmutableList.copyOf(sort);
        this.load = load == null ? LoadSpec.empty() : load;
    }

    public static QueryDescriptor of(String resource) {
        return new QueryDescriptor(resource, Collections.emptyMap(), ImmutableList.of(), LoadSpec.empty());
    }

    public static QueryDescriptor of(String resource, Map<String, Object> filter, List<String> sort) {
        return new QueryDescriptor(resource, filter, sort, LoadSpec.empty());
    }

    public QueryDescriptor withFilter(String field, Object value) {
        Map<String, Object> f = new LinkedHashMap<>(filter);
        f.put(field, value);
        return new QueryDescriptor(resource, f, sort, load);
    }

    public QueryDescriptor withSort(String... fields) {
        return new QueryDescriptor(resource, filter, ImmutableList.copyOf(fields), load);
    }

    public QueryDescriptor withLoad(LoadSpec newLoad) {
        return new QueryDescriptor(resource, filter, sort, newLoad);
    }

    public String getResource() {
        return resource;
    }

    public Map<String, Object> getFilter() {
        return filter;
    }

    public List<String> getSort() {
        return sort;
    }

    public LoadSpec getLoad() {
        return load;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof QueryDescriptor)) return false;
        QueryDescriptor that = (QueryDescriptor) o;
        return resource.equals(that.resource) && filter.equals(that.filter)
                && sort.equals(that.sort) && load.equals(that.load);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resource, filter, sort, load);
    }

    @Override
    public String toString() {
        return "Query{" + resource + ", filter=" + filter + ", sort=" + sort + ", load=" + load + "}";
    }
}
