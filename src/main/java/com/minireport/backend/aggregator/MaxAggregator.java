package com.minireport.backend.aggregator;

import java.math.BigDecimal;

import com.minireport.common.Record;

public class MaxAggregator implements Aggregator {
    private final String field;
    private final String label;
    private BigDecimal max;

    public MaxAggregator(String field) {
        this.field = field;
        this.label = "MAX(" + field + ")";
    }

    @Override
    public void accept(Record record) {
        BigDecimal v = Numbers.toDecimal(record.get(field));
        if(v == null) {
            return;
        }
        if(max == null || v.compareTo(max) > 0) {
            max = v;
        }
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        return max;
    }
}
