package com.minireport.backend.aggregator;

import com.minireport.common.Record;

/**
 * 聚合器接口，封装单个全局聚合函数的状态与运算。
 */
public interface Aggregator {
    /** 每条记录调用一次 */
    void accept(Record record);

    /** 聚合列名，如 COUNT(*)、SUM(amount) */
    String label();

    /** 聚合结果的原始值 */
    Object value();
}
