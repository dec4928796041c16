package com.minireport.backend.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.minireport.backend.aggregator.AggregateFunc;
import com.minireport.backend.aggregator.AggregationResult;
import com.minireport.backend.aggregator.GroupDefinition;
import com.minireport.backend.aggregator.GroupTableSnapshot;
import com.minireport.backend.cache.CacheConfig;
import com.minireport.backend.cache.QueryCache;
import com.minireport.backend.consumer.ChunkConsumer;
import com.minireport.backend.loader.LoadConfig;
import com.minireport.backend.loader.LoadStrategy;
import com.minireport.backend.loader.Relationship;
import com.minireport.backend.loader.RelationshipDepthException;
import com.minireport.backend.loader.RelationshipLoader;
import com.minireport.backend.source.InMemoryDataSource;
import com.minireport.backend.source.QueryDescriptor;
import com.minireport.common.Chunk;
import com.minireport.common.Record;

@Timeout(20)
public class PipelineManagerTest {

    private static final String[] REGIONS = {"West", "East", "North"};
    private static final QueryDescriptor QUERY = QueryDescriptor.of("orders");

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final List<CountDownLatch> gates = new ArrayList<>();
    private PipelineManager manager;

    @AfterEach
    public void tearDown() {
        for (CountDownLatch gate : gates) {
            gate.countDown();
        }
        if(manager != null) {
            manager.shutdown();
        }
    }

    private PipelineManager newManager(MemoryProbe probe) {
        manager = new PipelineManager(new QueryCache(CacheConfig.defaults()), new RelationshipLoader(), probe,
                sleeps::add, Clock.systemUTC(), 4);
        return manager;
    }

    private PipelineManager newManager() {
        return newManager(() -> 0L);
    }

    private static PipelineConfig.Builder config() {
        return PipelineConfig.builder()
                .chunkSize(10)
                .minChunkSize(2)
                .retryBaseDelay(Duration.ofMillis(10))
                .consumerTimeout(Duration.ofSeconds(5))
                .enableCache(false);
    }

    private static PipelineOptions.Builder options(InMemoryDataSource source, PipelineConfig config) {
        return PipelineOptions.builder(source, QUERY)
                .groups(List.of(GroupDefinition.builder(1, "region").valueFields("amount").build()))
                .reportName("sales")
                .config(config);
    }

    private InMemoryDataSource blockingSource(int n) {
        CountDownLatch gate = new CountDownLatch(1);
        gates.add(gate);
        return InMemoryDataSource.tagged(n).blockUntil(gate);
    }

    private static List<Chunk> drain(PipelineStream stream) {
        List<Chunk> chunks = new ArrayList<>();
        while (stream.hasNext()) {
            chunks.add(stream.next());
        }
        return chunks;
    }

    /** tagged 数据源中各 region 的 amount 合计 */
    private static Map<String, Long> expectedSums(int n) {
        Map<String, Long> sums = new LinkedHashMap<>();
        for(int i = 0; i < n; i++) {
            sums.merge(REGIONS[i % REGIONS.length], (long) (i % 10) + 1, Long::sum);
        }
        return sums;
    }

    private static void assertRegionSums(AggregationResult result, int n) {
        GroupTableSnapshot table = result.tableAtLevel(1).orElseThrow();
        for (Map.Entry<String, Long> en : expectedSums(n).entrySet()) {
            BigDecimal sum = table.group(en.getKey()).orElseThrow().field("amount").getSum();
            assertEquals(0, BigDecimal.valueOf(en.getValue()).compareTo(sum), "sum of " + en.getKey());
        }
    }

    private static void assertOffsetsInOrder(List<Chunk> chunks, int n) {
        long expected = 0;
        for (Chunk c : chunks) {
            assertEquals(expected, c.getStartOffset());
            for (Record r : c.getRecords()) {
                assertEquals(expected, r.get("offset"));
                expected++;
            }
        }
        assertEquals(n, expected);
    }

    @Test
    public void testStreamsChunksInOrderAndCompletes() {
        InMemoryDataSource source = InMemoryDataSource.tagged(95);
        StartedPipeline started = newManager().startPipeline(options(source, config().build())
                .globalAggregations(EnumSet.of(AggregateFunc.SUM, AggregateFunc.COUNT), List.of("amount"))
                .build());

        List<Chunk> chunks = drain(started.getStream());
        assertEquals(10, chunks.size());
        assertEquals(5, chunks.get(9).getChunkSize());
        for(int i = 0; i < chunks.size(); i++) {
            assertEquals(i, chunks.get(i).getChunkIndex());
        }
        assertOffsetsInOrder(chunks, 95);

        String id = started.getStreamId();
        PipelineInfo info = manager.getPipelineInfo(id);
        assertEquals(PipelineStatus.COMPLETED, info.getStatus());
        assertEquals(95, info.getRecordsProcessed());
        assertEquals(95, info.getRecordsFetched());
        assertEquals(Long.valueOf(95), info.getTotalRecords());
        assertEquals(100.0, info.getPercentComplete(), 0.001);
        assertNotNull(info.getFinishedAt());

        AggregationResult result = manager.getAggregationState(id);
        assertTrue(result.isFinalized());
        assertRegionSums(result, 95);
        assertEquals(95L, result.getGlobal().get("COUNT(*)"));

        AggregationSnapshot snapshot = manager.getAggregationSnapshot(id);
        assertTrue(snapshot.isStable());
        assertEquals(95, snapshot.getRecordsProcessed());
    }

    @Test
    public void testExactMultipleOfChunkSizeEndsOnEmptyPage() {
        InMemoryDataSource source = InMemoryDataSource.tagged(30);
        StartedPipeline started = newManager().startPipeline(options(source, config().build()).build());
        List<Chunk> chunks = drain(started.getStream());
        assertEquals(3, chunks.size());
        assertOffsetsInOrder(chunks, 30);
        assertEquals(4, source.getFetchCalls().size());
        assertEquals(30, source.getFetchCalls().get(3)[0]);
        assertEquals(PipelineStatus.COMPLETED, manager.getPipelineInfo(started.getStreamId()).getStatus());
    }

    @Test
    public void testConsumeDrivesConsumerToCompletion() {
        InMemoryDataSource source = InMemoryDataSource.tagged(42);
        StartedPipeline started = newManager().startPipeline(options(source, config().build()).build());
        List<Long> seenIndexes = new ArrayList<>();
        Integer total = started.getStream().consume(new ChunkConsumer<Integer, Integer>() {
            @Override
            public Integer consumeChunk(Chunk chunk, Integer state) {
                seenIndexes.add(chunk.getChunkIndex());
                return state + chunk.getChunkSize();
            }

            @Override
            public Integer finalize(Integer state) {
                return state;
            }
        }, 0);
        assertEquals(42, total);
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L), seenIndexes);
        assertEquals(PipelineStatus.COMPLETED, manager.getPipelineInfo(started.getStreamId()).getStatus());
    }

    @Test
    public void testMemoryPressureHalvesChunkSizeWithoutLosingRecords() {
        long[] samples = {900, 900, 900, 100};
        AtomicInteger sample = new AtomicInteger();
        newManager(() -> samples[Math.min(sample.getAndIncrement(), samples.length - 1)]);
        InMemoryDataSource source = InMemoryDataSource.tagged(40);
        StartedPipeline started = manager.startPipeline(options(source, config().memoryLimit(1000).build()).build());

        List<Chunk> chunks = drain(started.getStream());
        List<Object> requested = new ArrayList<>();
        List<Object> degraded = new ArrayList<>();
        for (Chunk c : chunks) {
            requested.add(c.getMetadata().get(Producer.META_REQUESTED_SIZE));
            degraded.add(c.getMetadata().get(Producer.META_DEGRADED));
        }
        assertEquals(List.of(5, 2, 2, 10, 10, 10, 10), requested);
        assertEquals(List.of(true, true, true, false, false, false, false), degraded);
        assertOffsetsInOrder(chunks, 40);

        PipelineInfo info = manager.getPipelineInfo(started.getStreamId());
        assertEquals(PipelineStatus.COMPLETED, info.getStatus());
        assertFalse(info.isDegradedMode());
        assertEquals(10, info.getCurrentChunkSize());
        assertRegionSums(manager.getAggregationState(started.getStreamId()), 40);
    }

    @Test
    public void testMemoryLimitAtMinimumChunkSizeFails() {
        newManager(() -> 2000L);
        InMemoryDataSource source = InMemoryDataSource.tagged(100);
        StartedPipeline started = manager.startPipeline(options(source, config().memoryLimit(1000).build()).build());

        List<Chunk> received = new ArrayList<>();
        PipelineStream stream = started.getStream();
        assertThrows(PipelineFailedException.class, () -> {
            while (stream.hasNext()) {
                received.add(stream.next());
            }
        });
        assertEquals(2, received.size());

        PipelineInfo info = manager.getPipelineInfo(started.getStreamId());
        assertEquals(PipelineStatus.FAILED, info.getStatus());
        assertTrue(info.getFailureReason().contains("Memory limit exceeded"), info.getFailureReason());
        assertEquals(2000, info.getMemoryUsage());
        assertEquals(7, manager.getAggregationSnapshot(started.getStreamId()).getRecordsProcessed());
    }

    @Test
    public void testPauseAndResumeContinueFromSameOffset() throws Exception {
        InMemoryDataSource source = InMemoryDataSource.tagged(100).fetchDelay(20);
        StartedPipeline started = newManager().startPipeline(options(source, config().build()).build());
        String id = started.getStreamId();

        manager.pausePipeline(id);
        manager.pausePipeline(id);
        assertEquals(PipelineStatus.PAUSED, manager.getPipelineInfo(id).getStatus());
        Thread.sleep(150);
        long offset = manager.getPipelineInfo(id).getCurrentOffset();
        Thread.sleep(150);
        assertEquals(offset, manager.getPipelineInfo(id).getCurrentOffset());

        manager.resumePipeline(id);
        manager.resumePipeline(id);
        assertEquals(PipelineStatus.RUNNING, manager.getPipelineInfo(id).getStatus());

        List<Chunk> chunks = drain(started.getStream());
        assertOffsetsInOrder(chunks, 100);
        assertRegionSums(manager.getAggregationState(id), 100);
    }

    @Test
    public void testPauseOrResumeTerminalPipelineRejected() {
        StartedPipeline started = newManager().startPipeline(
                options(InMemoryDataSource.tagged(5), config().build()).build());
        drain(started.getStream());
        String id = started.getStreamId();
        assertThrows(IllegalStateException.class, () -> manager.pausePipeline(id));
        assertThrows(IllegalStateException.class, () -> manager.resumePipeline(id));
    }

    @Test
    public void testRetriesWithExponentialBackoffThenFails() {
        InMemoryDataSource source = InMemoryDataSource.tagged(50).failAlways();
        StartedPipeline started = newManager().startPipeline(
                options(source, config().maxRetries(3).build()).build());

        assertThrows(PipelineFailedException.class, () -> started.getStream().hasNext());

        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40)), sleeps);
        assertEquals(4, source.getFetchCalls().size());
        PipelineInfo info = manager.getPipelineInfo(started.getStreamId());
        assertEquals(PipelineStatus.FAILED, info.getStatus());
        assertEquals(3, info.getTotalRetries());
        assertTrue(info.getFailureReason().contains("failed after 3 retries"), info.getFailureReason());
    }

    @Test
    public void testTransientFetchFailureRecovers() {
        InMemoryDataSource source = InMemoryDataSource.tagged(25).failNext(2);
        StartedPipeline started = newManager().startPipeline(options(source, config().build()).build());
        List<Chunk> chunks = drain(started.getStream());

        assertOffsetsInOrder(chunks, 25);
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeps);
        PipelineInfo info = manager.getPipelineInfo(started.getStreamId());
        assertEquals(PipelineStatus.COMPLETED, info.getStatus());
        assertEquals(2, info.getTotalRetries());
        assertEquals(0, info.getRetryCount());
    }

    @Test
    public void testConsumerTimeoutFailsPipelineAndKeepsPartialState() {
        InMemoryDataSource source = InMemoryDataSource.tagged(100);
        StartedPipeline started = newManager().startPipeline(
                options(source, config().consumerTimeout(Duration.ofMillis(200)).build()).build());
        String id = started.getStreamId();

        PipelineFailedException e = assertThrows(PipelineFailedException.class,
                () -> started.getStream().consume(new ChunkConsumer<Integer, Integer>() {
                    @Override
                    public Integer consumeChunk(Chunk chunk, Integer state) throws Exception {
                        if(chunk.getChunkIndex() == 1) {
                            Thread.sleep(5000);
                        }
                        return state + 1;
                    }

                    @Override
                    public Integer finalize(Integer state) {
                        return state;
                    }
                }, 0));
        assertTrue(e.getMessage().contains("timed out"), e.getMessage());

        PipelineInfo info = manager.getPipelineInfo(id);
        assertEquals(PipelineStatus.FAILED, info.getStatus());
        AggregationSnapshot snapshot = manager.getAggregationSnapshot(id);
        assertEquals(PipelineStatus.FAILED, snapshot.getStatus());
        assertFalse(snapshot.isStable());
        assertTrue(snapshot.getAggregations().tableAtLevel(1).orElseThrow().size() > 0);
        assertThrows(AggregationNotReadyException.class, () -> manager.getAggregationState(id));
    }

    @Test
    public void testConsumerExceptionFailsPipeline() {
        InMemoryDataSource source = InMemoryDataSource.tagged(100);
        StartedPipeline started = newManager().startPipeline(options(source, config().build()).build());
        String id = started.getStreamId();

        assertThrows(PipelineFailedException.class,
                () -> started.getStream().consume(new ChunkConsumer<Integer, Integer>() {
                    @Override
                    public Integer consumeChunk(Chunk chunk, Integer state) {
                        if(chunk.getChunkIndex() == 2) {
                            throw new IllegalStateException("render failed");
                        }
                        return state + 1;
                    }

                    @Override
                    public Integer finalize(Integer state) {
                        return state;
                    }
                }, 0));

        PipelineInfo info = manager.getPipelineInfo(id);
        assertEquals(PipelineStatus.FAILED, info.getStatus());
        assertTrue(info.getFailureReason().contains("render failed"), info.getFailureReason());
        assertNotNull(manager.getAggregationSnapshot(id).getAggregations());
    }

    @Test
    public void testStopReleasesAggregationState() {
        StartedPipeline started = newManager().startPipeline(options(blockingSource(50), config().build()).build());
        String id = started.getStreamId();

        manager.stopPipeline(id);
        manager.stopPipeline(id);

        PipelineInfo info = manager.getPipelineInfo(id);
        assertEquals(PipelineStatus.STOPPED, info.getStatus());
        assertNotNull(info.getFinishedAt());
        assertThrows(AggregationNotReadyException.class, () -> manager.getAggregationSnapshot(id));
        assertThrows(AggregationNotReadyException.class, () -> manager.getAggregationState(id));

        PipelineStream stream = started.getStream();
        assertFalse(stream.hasNext());
        assertThrows(IllegalStateException.class, () -> stream.consume(new ChunkConsumer<Integer, Integer>() {
            @Override
            public Integer consumeChunk(Chunk chunk, Integer state) {
                return state;
            }

            @Override
            public Integer finalize(Integer state) {
                return state;
            }
        }, 0));
        assertEquals(PipelineStatus.STOPPED, manager.getPipelineInfo(id).getStatus());
    }

    @Test
    public void testStopCompletedPipeline() {
        StartedPipeline started = newManager().startPipeline(
                options(InMemoryDataSource.tagged(5), config().build()).build());
        drain(started.getStream());
        manager.stopPipeline(started.getStreamId());
        assertEquals(PipelineStatus.STOPPED, manager.getPipelineInfo(started.getStreamId()).getStatus());
        assertThrows(AggregationNotReadyException.class, () -> manager.getAggregationSnapshot(started.getStreamId()));
    }

    @Test
    public void testSnapshotWhileRunningIsNotStable() {
        StartedPipeline started = newManager().startPipeline(options(blockingSource(50), config().build()).build());
        AggregationSnapshot snapshot = manager.getAggregationSnapshot(started.getStreamId());
        assertEquals(PipelineStatus.RUNNING, snapshot.getStatus());
        assertFalse(snapshot.isStable());
        assertEquals(0, snapshot.getRecordsProcessed());
        assertThrows(AggregationNotReadyException.class, () -> manager.getAggregationState(started.getStreamId()));
    }

    @Test
    public void testUnknownPipeline() {
        newManager();
        assertThrows(PipelineNotFoundException.class, () -> manager.getPipelineInfo("missing"));
        assertThrows(PipelineNotFoundException.class, () -> manager.pausePipeline("missing"));
        assertThrows(PipelineNotFoundException.class, () -> manager.stopPipeline("missing"));
        assertThrows(PipelineNotFoundException.class, () -> manager.getAggregationSnapshot("missing"));
        assertFalse(manager.deregister("missing"));
    }

    @Test
    public void testCountsListAndDeregister() {
        newManager();
        StartedPipeline done = manager.startPipeline(options(InMemoryDataSource.tagged(5), config().build()).build());
        drain(done.getStream());
        StartedPipeline stopped = manager.startPipeline(options(blockingSource(5), config().build())
                .reportName("inventory").build());
        manager.stopPipeline(stopped.getStreamId());

        Map<PipelineStatus, Long> counts = manager.pipelineCounts();
        assertEquals(PipelineStatus.values().length, counts.size());
        assertEquals(1L, counts.get(PipelineStatus.COMPLETED));
        assertEquals(1L, counts.get(PipelineStatus.STOPPED));
        assertEquals(0L, counts.get(PipelineStatus.RUNNING));

        assertEquals(2, manager.listPipelines(PipelineFilter.all()).size());
        List<PipelineInfo> sales = manager.listPipelines(PipelineFilter.byReport("sales"));
        assertEquals(1, sales.size());
        assertEquals(done.getStreamId(), sales.get(0).getStreamId());
        assertEquals(1, manager.listPipelines(PipelineFilter.of(PipelineStatus.STOPPED, "inventory")).size());
        assertEquals(0, manager.listPipelines(PipelineFilter.of(PipelineStatus.RUNNING, "inventory")).size());

        assertTrue(manager.deregister(done.getStreamId()));
        assertThrows(PipelineNotFoundException.class, () -> manager.getPipelineInfo(done.getStreamId()));
        assertEquals(1, manager.listPipelines(PipelineFilter.all()).size());
    }

    @Test
    public void testRelationshipDepthRejectedBeforeStart() {
        newManager();
        LoadConfig loading = new LoadConfig(LoadStrategy.EAGER, 1,
                List.of(Relationship.of("customer", Relationship.of("region"))), null);
        PipelineOptions opts = options(InMemoryDataSource.tagged(5), config().relationshipLoading(loading).build())
                .build();
        assertThrows(RelationshipDepthException.class, () -> manager.startPipeline(opts));
        assertTrue(manager.listPipelines(PipelineFilter.all()).isEmpty());
    }

    @Test
    public void testMissingDataSourceOrQuery() {
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder(null, QUERY));
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder(InMemoryDataSource.tagged(1), null));
    }

    @Test
    public void testSecondRunIsServedFromCache() {
        newManager();
        InMemoryDataSource source = InMemoryDataSource.tagged(25);
        PipelineConfig cfg = config().enableCache(true).build();

        drain(manager.startPipeline(options(source, cfg).build()).getStream());
        assertEquals(3, source.getFetchCalls().size());

        List<Chunk> second = drain(manager.startPipeline(options(source, cfg).build()).getStream());
        assertEquals(3, source.getFetchCalls().size());
        assertOffsetsInOrder(second, 25);
        for (Chunk c : second) {
            assertEquals(Boolean.TRUE, c.getMetadata().get(Producer.META_FROM_CACHE));
        }
        assertTrue(manager.getCache().stats().getHits() >= 3);
    }
}
