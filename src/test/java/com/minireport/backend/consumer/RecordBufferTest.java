package com.minireport.backend.consumer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.minireport.common.Record;

public class RecordBufferTest {

    private static List<Record> records(int from, int n) {
        List<Record> list = new ArrayList<>(n);
        for(int i = from; i < from + n; i++) {
            list.add(Record.of("i", i));
        }
        return list;
    }

    @Test
    public void testBuffersUntilBatchIsFull() {
        RecordBuffer buffer = new RecordBuffer(10);
        assertFalse(buffer.add(records(0, 6)).isPresent());
        assertEquals(6, buffer.pendingSize());

        Optional<List<Record>> batch = buffer.add(records(6, 7));
        assertTrue(batch.isPresent());
        assertEquals(10, batch.get().size());
        assertEquals(0, batch.get().get(0).get("i"));
        assertEquals(9, batch.get().get(9).get("i"));
        assertEquals(3, buffer.pendingSize());
        assertEquals(13, buffer.totalBuffered());
    }

    @Test
    public void testLargeAddReturnsWholeBatches() {
        RecordBuffer buffer = new RecordBuffer(10);
        List<Record> batch = buffer.add(records(0, 35)).orElseThrow();
        assertEquals(30, batch.size());
        assertEquals(5, buffer.pendingSize());
    }

    @Test
    public void testFlushReturnsRemainder() {
        RecordBuffer buffer = new RecordBuffer(10);
        buffer.add(records(0, 4));
        List<Record> rest = buffer.flush();
        assertEquals(4, rest.size());
        assertEquals(0, buffer.pendingSize());
        assertTrue(buffer.flush().isEmpty());
    }

    @Test
    public void testDefaultBatchSize() {
        assertEquals(100, new RecordBuffer().getBatchSize());
        assertThrows(IllegalArgumentException.class, () -> new RecordBuffer(0));
    }
}
