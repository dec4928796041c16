package com.minireport.backend.source;

import java.util.List;
import java.util.Map;

/**
 * 分页数据源（外部协作方）。
 * <p>
 * 实现需要保证同一查询在不同 offset 上返回的记录顺序稳定，否则流水线无法保证"每条记录恰好一次"。
 * </p>
 */
public interface DataSource {

    /** 数据源标识，参与缓存 key 的计算 */
    String identity();

    /**
     * 读取 [offset, offset + limit) 范围内的记录；返回空列表表示已读完。
     */
    List<Map<String, Object>> fetch(QueryDescriptor query, long offset, int limit) throws Exception;

    /** 估算查询的总记录数，用于进度百分比 */
    long count(QueryDescriptor query) throws Exception;
}
