package com.minireport.backend.cache;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.hash.Hashing;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.minireport.backend.loader.LoadSpec;
import com.minireport.backend.source.QueryDescriptor;

/**
 * 缓存 key 生成：对 (数据源, 查询结构, offset, limit) 做规范化后取 SHA-256。
 * <p>
 * 过滤条件按字段名排序后再序列化，语义相同的查询无论字段插入顺序如何都得到同一个 key。
 * </p>
 */
public final class CacheKeys {

    private static final Gson GSON = new Gson();

    private CacheKeys() {}

    public static String fingerprint(String sourceIdentity, QueryDescriptor query, long offset, int limit) {
        JsonObject root = new JsonObject();
        root.addProperty("source", sourceIdentity);
        root.addProperty("resource", query.getResource());
        root.add("filter", canonical(query.getFilter()));
        JsonArray sort = new JsonArray();
        query.getSort().forEach(sort::add);
        root.add("sort", sort);
        root.add("load", canonical(query.getLoad()));
        root.addProperty("offset", offset);
        root.addProperty("limit", limit);
        String json = GSON.toJson(root);
        return Hashing.sha256().hashString(json, StandardCharsets.UTF_8).toString();
    }

    private static JsonElement canonical(Map<?, ?> map) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> en : map.entrySet()) {
            sorted.put(String.valueOf(en.getKey()), en.getValue());
        }
        JsonObject obj = new JsonObject();
        for (Map.Entry<String, Object> en : sorted.entrySet()) {
            obj.add(en.getKey(), canonicalValue(en.getValue()));
        }
        return obj;
    }

    private static JsonElement canonicalValue(Object v) {
        if(v == null) {
            return JsonNull.INSTANCE;
        }
        if(v instanceof Number) {
            return new JsonPrimitive((Number) v);
        }
        if(v instanceof Boolean) {
            return new JsonPrimitive((Boolean) v);
        }
        if(v instanceof Map) {
            return canonical((Map<?, ?>) v);
        }
        if(v instanceof Collection) {
            JsonArray arr = new JsonArray();
            for (Object o : (Collection<?>) v) {
                arr.add(canonicalValue(o));
            }
            return arr;
        }
        // 日期、枚举等按类型 + 文本表示，避免不同类型的同名文本冲突
        if(v instanceof String) {
            return new JsonPrimitive((String) v);
        }
        return new JsonPrimitive(v.getClass().getSimpleName() + ":" + v);
    }

    private static JsonElement canonical(LoadSpec spec) {
        // 关联加载顺序不影响语义，这里也按名字排序
        JsonObject obj = new JsonObject();
        for (String name : new TreeMap<>(spec.getChildren()).keySet()) {
            obj.add(name, canonical(spec.child(name)));
        }
        return obj;
    }
}
