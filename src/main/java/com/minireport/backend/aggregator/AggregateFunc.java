package com.minireport.backend.aggregator;

import java.util.Locale;

public enum AggregateFunc {
    SUM,
    COUNT,
    AVG,
    MIN,
    MAX;

    public static AggregateFunc from(String s) {
        String name = s.trim().toUpperCase(Locale.ROOT);
        if("AVERAGE".equals(name)) {
            return AVG;
        }
        return AggregateFunc.valueOf(name);
    }
}
