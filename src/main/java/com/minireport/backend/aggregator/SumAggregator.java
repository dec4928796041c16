package com.minireport.backend.aggregator;

import java.math.BigDecimal;

import com.minireport.common.Record;

public class SumAggregator implements Aggregator {
    private final String field;
    private final String label;
    private BigDecimal sum = BigDecimal.ZERO;

    public SumAggregator(String field) {
        this.field = field;
        this.label = "SUM(" + field + ")";
    }

    @Override
    public void accept(Record record) {
        BigDecimal v = Numbers.toDecimal(record.get(field));
        if(v != null) {
            sum = sum.add(v);
        }
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        return sum;
    }
}
