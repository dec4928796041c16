package com.minireport.backend.aggregator;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * 单个数值字段的累加器 {sum, count, min, max}，avg 在读取时由 sum / count 计算，不单独存储。
 */
public final class FieldAccumulator {

    private static final MathContext AVG_CONTEXT = MathContext.DECIMAL64;

    private BigDecimal sum = BigDecimal.ZERO;
    private long count = 0;
    private BigDecimal min;
    private BigDecimal max;

    void accept(BigDecimal v) {
        sum = sum.add(v);
        count++;
        if(min == null || v.compareTo(min) < 0) {
            min = v;
        }
        if(max == null || v.compareTo(max) > 0) {
            max = v;
        }
    }

    FieldAccumulator copy() {
        FieldAccumulator c = new FieldAccumulator();
        c.sum = sum;
        c.count = count;
        c.min = min;
        c.max = max;
        return c;
    }

    public BigDecimal getSum() {
        return sum;
    }

    public long getCount() {
        return count;
    }

    public BigDecimal getMin() {
        return min;
    }

    public BigDecimal getMax() {
        return max;
    }

    /** 没有数值时为 null */
    public BigDecimal getAvg() {
        return average(sum, count);
    }

    public Object value(AggregateFunc func) {
        switch (func) {
            case SUM:
                return sum;
            case COUNT:
                return count;
            case AVG:
                return getAvg();
            case MIN:
                return min;
            case MAX:
                return max;
            default:
                throw new IllegalArgumentException("Unsupported aggregate function: " + func);
        }
    }

    static BigDecimal average(BigDecimal sum, long count) {
        if(count == 0) {
            return null;
        }
        return sum.divide(BigDecimal.valueOf(count), AVG_CONTEXT);
    }

    @Override
    public String toString() {
        return "{sum=" + sum + ", count=" + count + ", min=" + min + ", max=" + max + "}";
    }
}
