package com.minireport.backend.aggregator;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 数值转换工具：聚合统一用 BigDecimal 计算，避免 double 累加误差。
 */
final class Numbers {

    private Numbers() {}

    static boolean isNumeric(Object v) {
        return v instanceof Number;
    }

    /**
     * @return 非数值返回 null
     */
    static BigDecimal toDecimal(Object v) {
        if(v instanceof BigDecimal) {
            return (BigDecimal) v;
        }
        if(v instanceof BigInteger) {
            return new BigDecimal((BigInteger) v);
        }
        if(v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return BigDecimal.valueOf(((Number) v).longValue());
        }
        if(v instanceof Number) {
            double d = ((Number) v).doubleValue();
            if(Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        return null;
    }
}
