package com.minireport.backend.consumer;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

/**
 * 进度跟踪：已处理数、可选总数、耗时；计算完成百分比和预计剩余时间。
 */
public class ProgressTracker {

    /** 尚无处理速率时的剩余时间 */
    public static final Duration UNBOUNDED = ChronoUnit.FOREVER.getDuration();

    private final Long total;
    private final Stopwatch stopwatch;
    private long processed = 0;

    public ProgressTracker(Long total) {
        this(total, Ticker.systemTicker());
    }

    public ProgressTracker(Long total, Ticker ticker) {
        if(total != null && total < 0) {
            throw new IllegalArgumentException("total must be >= 0, got " + total);
        }
        this.total = total;
        this.stopwatch = Stopwatch.createStarted(ticker);
    }

    public void update(long processed) {
        this.processed = processed;
    }

    public void increment(long n) {
        this.processed += n;
    }

    public long getProcessed() {
        return processed;
    }

    public Optional<Long> getTotal() {
        return Optional.ofNullable(total);
    }

    public Duration elapsed() {
        return stopwatch.elapsed();
    }

    /**
     * 总数未知时为空；总数为 0 视为已完成。结果不超过 100。
     */
    public OptionalDouble percentage() {
        if(total == null) {
            return OptionalDouble.empty();
        }
        if(total == 0) {
            return OptionalDouble.of(100.0);
        }
        double pct = processed * 100.0 / total;
        return OptionalDouble.of(Math.min(100.0, Math.round(pct * 100.0) / 100.0));
    }

    /**
     * 按当前平均速率估算剩余时间；总数未知时为空，尚未处理任何记录时为无穷大（{@link #UNBOUNDED}）。
     */
    public Optional<Duration> estimateRemaining() {
        if(total == null) {
            return Optional.empty();
        }
        if(processed >= total) {
            return Optional.of(Duration.ZERO);
        }
        if(processed == 0) {
            return Optional.of(UNBOUNDED);
        }
        long elapsedNanos = stopwatch.elapsed(TimeUnit.NANOSECONDS);
        double nanosPerRecord = (double) elapsedNanos / processed;
        return Optional.of(Duration.ofNanos((long) (nanosPerRecord * (total - processed))));
    }

    /**
     * 结构化快照：processed / total / percentage / elapsedMs / remainingMs，未知的值为 null。
     */
    public Map<String, Object> summary() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("processed", processed);
        m.put("total", total);
        OptionalDouble pct = percentage();
        m.put("percentage", pct.isPresent() ? pct.getAsDouble() : null);
        m.put("elapsedMs", elapsed().toMillis());
        Optional<Duration> remaining = estimateRemaining();
        Long remainingMs = null;
        if(remaining.isPresent()) {
            Duration d = remaining.get();
            remainingMs = d.equals(UNBOUNDED) ? Long.MAX_VALUE : d.toMillis();
        }
        m.put("remainingMs", remainingMs);
        return m;
    }
}
