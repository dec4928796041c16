package com.minireport.backend.cache;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.minireport.common.Record;

/**
 * 粗略估算一页记录占用的堆内存，用于缓存的内存上限和流水线的内存估算。
 */
public final class PageSizeEstimator {

    private static final long OBJECT_OVERHEAD = 16;
    private static final long ENTRY_OVERHEAD = 32;
    private static final long REFERENCE = 8;

    private PageSizeEstimator() {}

    public static long estimate(List<Record> page) {
        long total = OBJECT_OVERHEAD + REFERENCE * page.size();
        for (Record r : page) {
            total += estimate(r);
        }
        return total;
    }

    public static long estimate(Record record) {
        return OBJECT_OVERHEAD + estimateMap(record.asMap());
    }

    private static long estimateMap(Map<?, ?> map) {
        long total = OBJECT_OVERHEAD;
        for (Map.Entry<?, ?> en : map.entrySet()) {
            total += ENTRY_OVERHEAD + estimateValue(en.getKey()) + estimateValue(en.getValue());
        }
        return total;
    }

    private static long estimateValue(Object v) {
        if(v == null) {
            return 0;
        }
        if(v instanceof CharSequence) {
            return 40 + 2L * ((CharSequence) v).length();
        }
        if(v instanceof Map) {
            return estimateMap((Map<?, ?>) v);
        }
        if(v instanceof Collection) {
            long total = OBJECT_OVERHEAD;
            for (Object o : (Collection<?>) v) {
                total += REFERENCE + estimateValue(o);
            }
            return total;
        }
        if(v instanceof Record) {
            return estimate((Record) v);
        }
        // 数字、布尔、日期等小对象
        return 24;
    }
}
