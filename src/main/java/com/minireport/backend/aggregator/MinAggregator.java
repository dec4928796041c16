package com.minireport.backend.aggregator;

import java.math.BigDecimal;

import com.minireport.common.Record;

public class MinAggregator implements Aggregator {
    private final String field;
    private final String label;
    private BigDecimal min;

    public MinAggregator(String field) {
        this.field = field;
        this.label = "MIN(" + field + ")";
    }

    @Override
    public void accept(Record record) {
        BigDecimal v = Numbers.toDecimal(record.get(field));
        if(v == null) {
            return;
        }
        if(min == null || v.compareTo(min) < 0) {
            min = v;
        }
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        return min;
    }
}
