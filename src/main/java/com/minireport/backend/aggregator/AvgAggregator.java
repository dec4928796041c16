package com.minireport.backend.aggregator;

import java.math.BigDecimal;

import com.minireport.common.Record;

public class AvgAggregator implements Aggregator {
    private final String field;
    private final String label;
    private BigDecimal sum = BigDecimal.ZERO;
    private long count = 0;

    public AvgAggregator(String field) {
        this.field = field;
        this.label = "AVG(" + field + ")";
    }

    @Override
    public void accept(Record record) {
        BigDecimal v = Numbers.toDecimal(record.get(field));
        if(v != null) {
            sum = sum.add(v);
            count++;
        }
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        return FieldAccumulator.average(sum, count);
    }
}
