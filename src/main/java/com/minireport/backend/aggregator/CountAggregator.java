package com.minireport.backend.aggregator;

import com.minireport.common.Record;

public class CountAggregator implements Aggregator {
    private final String field; // null for count(*)
    private final String label;
    private long count = 0;

    public CountAggregator(String field) {
        this.field = field;
        this.label = (field == null) ? "COUNT(*)" : "COUNT(" + field + ")";
    }

    @Override
    public void accept(Record record) {
        if(field == null) {
            count++;
        } else if(record.get(field) != null) {
            count++;
        }
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        return count;
    }
}
