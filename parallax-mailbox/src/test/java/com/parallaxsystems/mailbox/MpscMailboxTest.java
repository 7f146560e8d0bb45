package com.parallaxsystems.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MpscMailboxTest {

    @Test
    void testOfferRejectsNull() {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }

    @Test
    void testPowerOfTwoRounding() {
        assertEquals(128, new MpscMailbox<String>().getChunkSize());
        assertEquals(16, new MpscMailbox<String>(10).getChunkSize());
        assertEquals(64, new MpscMailbox<String>(64).getChunkSize());
        assertEquals(2, new MpscMailbox<String>(0).getChunkSize());
        assertEquals(2, new MpscMailbox<String>(-5).getChunkSize());
    }

    @Test
    void testUnboundedBeyondChunkSize() {
        MpscMailbox<Integer> mailbox = new MpscMailbox<>(4);
        for (int i = 0; i < 1000; i++) {
            assertTrue(mailbox.offer(i));
        }
        assertEquals(1000, mailbox.size());
        for (int i = 0; i < 1000; i++) {
            assertEquals(i, mailbox.poll());
        }
        assertTrue(mailbox.isEmpty());
    }

    @Test
    void testDrainToPreservesOrder() {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        mailbox.offer("a");
        mailbox.offer("b");
        mailbox.offer("c");

        List<String> drained = new ArrayList<>();
        assertEquals(3, mailbox.drainTo(drained, Integer.MAX_VALUE));
        assertEquals(List.of("a", "b", "c"), drained);
        assertEquals(0, mailbox.drainTo(drained, 5));
    }

    @Test
    void testDrainToWithNegativeMaxElements() {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        mailbox.offer("a");
        assertEquals(0, mailbox.drainTo(new ArrayList<>(), -1));
        assertEquals(1, mailbox.size());
    }

    @Test
    @Timeout(10)
    void testMultipleProducersSingleConsumerOrdering() throws Exception {
        MpscMailbox<int[]> mailbox = new MpscMailbox<>();
        int producers = 4;
        int perProducer = 5_000;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);

        for (int p = 0; p < producers; p++) {
            int producerId = p;
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perProducer; i++) {
                    mailbox.offer(new int[]{producerId, i});
                }
                return null;
            });
        }
        start.countDown();

        Map<Integer, Integer> lastSeen = new HashMap<>();
        int received = 0;
        while (received < producers * perProducer) {
            int[] message = mailbox.poll();
            if (message == null) {
                Thread.onSpinWait();
                continue;
            }
            int previous = lastSeen.getOrDefault(message[0], -1);
            assertEquals(previous + 1, message[1], "Per-producer order must be preserved");
            lastSeen.put(message[0], message[1]);
            received++;
        }

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(mailbox.isEmpty());
    }

    @Test
    void testNewMailboxByType() {
        assertInstanceOf(LinkedMailbox.class, MailboxType.LINKED.newMailbox());
        assertInstanceOf(MpscMailbox.class, MailboxType.MPSC.newMailbox());
    }
}
