package com.minireport.backend.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.minireport.backend.cache.CacheKeys;
import com.minireport.backend.cache.QueryCache;
import com.minireport.backend.source.DataSource;
import com.minireport.backend.source.QueryDescriptor;
import com.minireport.common.Chunk;
import com.minireport.common.Error;
import com.minireport.common.Record;

/**
 * 生产者阶段：按 offset 顺序分页拉取数据，包装成 chunk 发往聚合阶段。
 * <p>
 * 每个 chunk 边界依次：拿信用 -> 检查暂停/停止 -> 采样内存并调整 chunkSize -> 查缓存 -> 拉取（超时 + 退避重试）。
 * 空页或不满一页表示数据读完。offset 按实际收到的记录数推进，保证不重不漏。
 * </p>
 */
class Producer implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Producer.class);

    public static final String META_REQUESTED_SIZE = "requestedSize";
    public static final String META_DEGRADED = "degraded";
    public static final String META_FROM_CACHE = "fromCache";

    private final String streamId;
    private final DataSource source;
    private final QueryDescriptor query;
    private final PipelineConfig config;
    private final QueryCache cache;
    private final ExecutorService ioPool;
    private final MemoryProbe memoryProbe;
    private final Sleeper sleeper;
    private final PipelineControl control;
    private final PipelineState state;
    private final DemandChannel<Chunk> out;

    /** 当前 chunk 大小，降级时减半 */
    private int chunkSize;
    private boolean degraded = false;

    /** 已拉取但尚未交给下游的页，失败时释放 */
    private List<Record> inFlight;

    Producer(String streamId, DataSource source, QueryDescriptor query, PipelineConfig config, QueryCache cache,
             ExecutorService ioPool, MemoryProbe memoryProbe, Sleeper sleeper, PipelineControl control,
             PipelineState state, DemandChannel<Chunk> out) {
        this.streamId = streamId;
        this.source = source;
        this.query = query;
        this.config = config;
        this.cache = cache;
        this.ioPool = ioPool;
        this.memoryProbe = memoryProbe;
        this.sleeper = sleeper;
        this.control = control;
        this.state = state;
        this.out = out;
        this.chunkSize = config.getChunkSize();
    }

    @Override
    public void run() {
        long offset = 0;
        long chunkIndex = 0;
        try {
            estimateTotal();
            while (true) {
                if(!out.awaitCredit()) {
                    break;
                }
                // chunk 边界：暂停在这里生效，恢复后从同一个 offset 继续
                if(!control.awaitRunnable()) {
                    break;
                }
                adjustChunkSize();
                int limit = chunkSize;
                Page page = fetchPage(offset, limit);
                inFlight = page.records;
                if(inFlight.isEmpty()) {
                    break;
                }
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put(META_REQUESTED_SIZE, limit);
                meta.put(META_DEGRADED, degraded);
                meta.put(META_FROM_CACHE, page.fromCache);
                Chunk chunk = new Chunk(inFlight, chunkIndex++, offset, offset + inFlight.size(), meta);
                offset += inFlight.size();
                state.onPageFetched(offset, inFlight.size());
                if(control.isCancelled()) {
                    break;
                }
                out.send(chunk);
                int received = inFlight.size();
                inFlight = null;
                if(received < limit) {
                    break;
                }
            }
            if(control.isCancelled()) {
                LOGGER.debug("[{}] producer cancelled at offset {}", streamId, offset);
                return;
            }
            LOGGER.debug("[{}] producer finished: {} chunks, {} records", streamId, chunkIndex, offset);
            out.complete();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            if(control.isCancelled()) {
                LOGGER.debug("[{}] producer interrupted by stop at offset {}", streamId, offset);
                return;
            }
            fail("Producer interrupted at offset " + offset, ie);
        } catch (PipelineFailedException e) {
            fail(e.getMessage(), e);
        } catch (RuntimeException e) {
            if(control.isCancelled()) {
                LOGGER.debug("[{}] producer stopped: {}", streamId, e.toString());
                return;
            }
            fail(e.getMessage() == null ? e.toString() : e.getMessage(), e);
        }
    }

    /**
     * 采样内存：超过阈值时 chunkSize 减半（不低于 minChunkSize）；
     * 已在下限且超过 memoryLimit 时致命失败；回落到阈值以下时恢复配置的大小。
     */
    private void adjustChunkSize() {
        long used = memoryProbe.usedBytes();
        state.onMemorySample(used);
        if(used > config.getDegradationBytes()) {
            if(chunkSize <= config.getMinChunkSize()) {
                if(used > config.getMemoryLimit()) {
                    throw new PipelineFailedException(streamId, Error.MemoryLimitExceededException.getMessage()
                            + " used=" + used + " limit=" + config.getMemoryLimit());
                }
                return;
            }
            int next = Math.max(chunkSize / 2, config.getMinChunkSize());
            LOGGER.warn("[{}] 内存占用 {} 超过阈值 {}，chunk 大小 {} -> {}", streamId, used,
                    config.getDegradationBytes(), chunkSize, next);
            chunkSize = next;
            degraded = true;
            state.setChunkSize(chunkSize, true);
        } else if(degraded) {
            LOGGER.info("[{}] 内存占用恢复到 {}，chunk 大小恢复为 {}", streamId, used, config.getChunkSize());
            chunkSize = config.getChunkSize();
            degraded = false;
            state.setChunkSize(chunkSize, false);
        }
    }

    private Page fetchPage(long offset, int limit) throws InterruptedException {
        String key = null;
        if(cache != null) {
            try {
                key = CacheKeys.fingerprint(source.identity(), query, offset, limit);
                Optional<List<Record>> hit = cache.get(key);
                if(hit.isPresent()) {
                    LOGGER.debug("[{}] cache hit at offset {}", streamId, offset);
                    return new Page(hit.get(), true);
                }
            } catch (RuntimeException e) {
                LOGGER.debug("[{}] cache lookup failed at offset {}, treat as miss: {}", streamId, offset, e.toString());
            }
        }
        List<Record> records = fetchWithRetry(offset, limit);
        if(key != null && !records.isEmpty()) {
            try {
                cache.put(key, records, config.getCacheTtl());
            } catch (RuntimeException e) {
                LOGGER.debug("[{}] cache put failed at offset {}: {}", streamId, offset, e.toString());
            }
        }
        return new Page(records, false);
    }

    /**
     * 拉取失败或超时后按 retryBaseDelay * 2^retryCount 退避，最多重试 maxRetries 次。
     */
    private List<Record> fetchWithRetry(long offset, int limit) throws InterruptedException {
        int retryCount = 0;
        while (true) {
            try {
                List<Map<String, Object>> rows = fetchOnce(offset, limit);
                if(retryCount > 0) {
                    LOGGER.info("[{}] fetch at offset {} succeeded after {} retries", streamId, offset, retryCount);
                }
                state.resetRetry();
                List<Record> records = new ArrayList<>(rows.size());
                for (Map<String, Object> row : rows) {
                    records.add(Record.of(row));
                }
                return records;
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                if(control.isCancelled()) {
                    throw Error.PipelineStoppedException;
                }
                if(retryCount >= config.getMaxRetries()) {
                    throw new PipelineFailedException(streamId, "Fetch at offset " + offset + " failed after "
                            + retryCount + " retries: " + e, e);
                }
                Duration delay = config.retryDelay(retryCount);
                retryCount++;
                state.onRetry(retryCount);
                LOGGER.warn("[{}] fetch at offset {} failed ({}), retry {}/{} in {}ms", streamId, offset,
                        e.toString(), retryCount, config.getMaxRetries(), delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }

    private List<Map<String, Object>> fetchOnce(long offset, int limit) throws Exception {
        Future<List<Map<String, Object>>> future = ioPool.submit(() -> source.fetch(query, offset, limit));
        try {
            List<Map<String, Object>> rows = future.get(config.getFetchTimeout().toNanos(), TimeUnit.NANOSECONDS);
            if(rows == null) {
                throw new IllegalStateException("data source returned null page");
            }
            return rows;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("fetch timed out after " + config.getFetchTimeout().toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if(cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    /**
     * 调用 count 估算总数；失败只影响进度百分比。
     */
    private void estimateTotal() throws InterruptedException {
        if(config.getCountTimeout().isZero()) {
            return;
        }
        Future<Long> future;
        try {
            future = ioPool.submit(() -> source.count(query));
        } catch (RejectedExecutionException e) {
            LOGGER.debug("[{}] count rejected by io pool, total unknown", streamId);
            return;
        }
        try {
            long total = future.get(config.getCountTimeout().toNanos(), TimeUnit.NANOSECONDS);
            if(total >= 0) {
                state.setTotalRecords(total);
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.debug("[{}] count timed out, total unknown", streamId);
        } catch (ExecutionException e) {
            LOGGER.debug("[{}] count failed, total unknown: {}", streamId, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * 致命错误：释放在途数据并触发一次 GC，再标记失败并通知下游。
     */
    private void fail(String reason, Throwable cause) {
        inFlight = null;
        System.gc();
        if(state.markFailed(reason)) {
            LOGGER.error("[{}] pipeline failed: {}", streamId, reason, cause);
        }
        out.fail(cause instanceof PipelineFailedException ? cause : new PipelineFailedException(streamId, reason, cause));
    }

    private static final class Page {
        final List<Record> records;
        final boolean fromCache;

        Page(List<Record> records, boolean fromCache) {
            this.records = records;
            this.fromCache = fromCache;
        }
    }
}
