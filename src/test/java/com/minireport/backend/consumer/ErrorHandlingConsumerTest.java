package com.minireport.backend.consumer;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.minireport.common.Chunk;
import com.minireport.common.Record;

public class ErrorHandlingConsumerTest {

    private static final Chunk CHUNK = new Chunk(List.of(Record.of("a", 1), Record.of("a", 2)), 3, 200, 202);

    private final List<Duration> sleeps = new ArrayList<>();

    @Test
    public void testPassesThroughOnSuccess() throws Exception {
        ErrorHandlingConsumer<Integer, Integer> consumer = ErrorHandlingConsumer
                .<Integer, Integer>wrap((chunk, state) -> state + chunk.getChunkSize())
                .build();
        assertEquals(12, consumer.consumeChunk(CHUNK, 10));
        assertEquals(12, consumer.finalize(12));
    }

    @Test
    public void testRetriesThenSucceeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ErrorHandlingConsumer<Integer, Integer> consumer = ErrorHandlingConsumer
                .<Integer, Integer>wrap((chunk, state) -> {
                    if(calls.incrementAndGet() < 3) {
                        throw new IllegalStateException("transient");
                    }
                    return state + 1;
                })
                .maxRetries(2)
                .retryDelay(Duration.ofMillis(5))
                .sleeper(sleeps::add)
                .build();
        assertEquals(1, consumer.consumeChunk(CHUNK, 0));
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(5), Duration.ofMillis(5)), sleeps);
    }

    @Test
    public void testDefaultHandlerWrapsFailure() {
        ErrorHandlingConsumer<Integer, Integer> consumer = ErrorHandlingConsumer
                .<Integer, Integer>wrap((chunk, state) -> {
                    throw new IllegalArgumentException("bad");
                })
                .maxRetries(1)
                .sleeper(sleeps::add)
                .build();
        ConsumeChunkException e = assertThrows(ConsumeChunkException.class, () -> consumer.consumeChunk(CHUNK, 0));
        assertEquals(3, e.getChunkIndex());
        assertEquals(2, e.getAttempts());
        assertTrue(e.getCause() instanceof IllegalArgumentException);
        assertEquals(1, sleeps.size());
    }

    @Test
    public void testErrorsAreCaughtToo() {
        ErrorHandlingConsumer<Integer, Integer> consumer = ErrorHandlingConsumer
                .<Integer, Integer>wrap((chunk, state) -> {
                    throw new AssertionError("invariant broken");
                })
                .build();
        ConsumeChunkException e = assertThrows(ConsumeChunkException.class, () -> consumer.consumeChunk(CHUNK, 0));
        assertTrue(e.getCause() instanceof AssertionError);
        assertEquals(1, e.getAttempts());
    }

    @Test
    public void testCustomHandlerCanRecover() throws Exception {
        List<Throwable> seen = new ArrayList<>();
        ErrorHandlingConsumer<Integer, Integer> consumer = ErrorHandlingConsumer
                .<Integer, Integer>wrap((chunk, state) -> {
                    throw new IllegalStateException("always");
                })
                .onError((error, chunk, state, attempts) -> {
                    seen.add(error);
                    return state - 1;
                })
                .build();
        assertEquals(9, consumer.consumeChunk(CHUNK, 10));
        assertEquals(1, seen.size());
    }

    @Test
    public void testInterruptIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        ErrorHandlingConsumer<Integer, Integer> consumer = ErrorHandlingConsumer
                .<Integer, Integer>wrap((chunk, state) -> {
                    calls.incrementAndGet();
                    throw new InterruptedException();
                })
                .maxRetries(3)
                .sleeper(sleeps::add)
                .build();
        assertThrows(InterruptedException.class, () -> consumer.consumeChunk(CHUNK, 0));
        assertEquals(1, calls.get());
    }

    @Test
    public void testWrapsExistingConsumerAndDelegatesFinalize() throws Exception {
        ChunkConsumer<List<Object>, Integer> inner = new ChunkConsumer<List<Object>, Integer>() {
            @Override
            public List<Object> consumeChunk(Chunk chunk, List<Object> state) {
                for (Record r : chunk.getRecords()) {
                    state.add(r.get("a"));
                }
                return state;
            }

            @Override
            public Integer finalize(List<Object> state) {
                return state.size();
            }
        };
        ErrorHandlingConsumer<List<Object>, Integer> consumer = ErrorHandlingConsumer.wrap(inner).build();
        List<Object> state = consumer.consumeChunk(CHUNK, new ArrayList<>());
        assertEquals(List.of(1, 2), state);
        assertEquals(2, consumer.finalize(state));
    }
}
