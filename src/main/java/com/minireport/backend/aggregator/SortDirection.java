package com.minireport.backend.aggregator;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    public static SortDirection from(String s) {
        return s == null ? ASC : SortDirection.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
