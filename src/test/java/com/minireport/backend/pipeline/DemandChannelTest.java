package com.minireport.backend.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

public class DemandChannelTest {

    @Test
    public void testSendRequiresCredit() {
        DemandChannel<Integer> ch = new DemandChannel<>("s", 2);
        assertThrows(IllegalStateException.class, () -> ch.send(1));
        ch.grant(2);
        ch.send(1);
        ch.send(2);
        assertThrows(IllegalStateException.class, () -> ch.send(3));
        assertEquals(2, ch.buffered());
    }

    @Test
    public void testGrantBeyondCapacityRejected() {
        DemandChannel<Integer> ch = new DemandChannel<>("s", 2);
        ch.grant(2);
        assertThrows(IllegalStateException.class, () -> ch.grant(1));
    }

    @Test
    @Timeout(5)
    public void testCompleteDrainsBufferFirst() throws Exception {
        DemandChannel<Integer> ch = new DemandChannel<>("s", 3);
        ch.grant(3);
        ch.send(1);
        ch.send(2);
        ch.complete();
        assertFalse(ch.isDrained());
        assertEquals(1, ch.take());
        assertEquals(2, ch.take());
        assertNull(ch.take());
        assertTrue(ch.isDrained());
        assertFalse(ch.awaitCredit());
    }

    @Test
    @Timeout(5)
    public void testFailureSurfacesAfterBufferedItems() throws Exception {
        DemandChannel<Integer> ch = new DemandChannel<>("s", 2);
        ch.grant(1);
        ch.send(7);
        ch.fail(new IllegalStateException("upstream broke"));
        assertEquals(7, ch.take());
        PipelineFailedException e = assertThrows(PipelineFailedException.class, ch::take);
        assertTrue(e.getMessage().contains("upstream broke"));
        assertFalse(ch.isDrained());
    }

    @Test
    @Timeout(5)
    public void testCancelWakesBothSides() throws Exception {
        DemandChannel<Integer> ch = new DemandChannel<>("s", 1);
        CountDownLatch waiting = new CountDownLatch(2);
        AtomicBoolean senderResult = new AtomicBoolean(true);
        List<Object> taken = new ArrayList<>();
        Thread sender = new Thread(() -> {
            try {
                waiting.countDown();
                senderResult.set(ch.awaitCredit());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Thread receiver = new Thread(() -> {
            try {
                waiting.countDown();
                taken.add(ch.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        sender.start();
        receiver.start();
        assertTrue(waiting.await(2, TimeUnit.SECONDS));
        Thread.sleep(50);
        ch.cancel();
        sender.join(2000);
        receiver.join(2000);
        assertFalse(senderResult.get());
        assertEquals(1, taken.size());
        assertNull(taken.get(0));
        assertTrue(ch.isCancelled());
        assertThrows(IllegalStateException.class, () -> ch.send(1));
    }

    @Test
    @Timeout(10)
    public void testBoundedHandOffPreservesOrder() throws Exception {
        int capacity = 3;
        int total = 500;
        DemandChannel<Integer> ch = new DemandChannel<>("s", capacity);
        Thread producer = new Thread(() -> {
            try {
                for(int i = 0; i < total; i++) {
                    if(!ch.awaitCredit()) {
                        return;
                    }
                    ch.send(i);
                }
                ch.complete();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        ch.grant(capacity);
        List<Integer> received = new ArrayList<>();
        Integer v;
        while ((v = ch.take()) != null) {
            assertTrue(ch.buffered() < capacity);
            received.add(v);
            ch.grant(1);
        }
        producer.join(2000);
        assertEquals(total, received.size());
        for(int i = 0; i < total; i++) {
            assertEquals(i, received.get(i));
        }
    }
}
