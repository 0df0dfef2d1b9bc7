package com.crosslink.endpoint;

import com.crosslink.InternalInconsistencyException;
import com.crosslink.SendFailedException;
import com.crosslink.helper.Ping;
import com.crosslink.pathway.LinkedPathway;
import com.crosslink.pathway.PathwayReceiver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.crosslink.helper.MessageTypes.*;
import static org.junit.jupiter.api.Assertions.*;

class ReceiverSlotTest {

    @Test
    void testTakeOnce() {
        LinkedPathway<Ping> pathway = new LinkedPathway<>(1);
        ReceiverSlot<Ping> slot = new ReceiverSlot<>(PING, pathway.receiver());

        assertFalse(slot.isClaimed());
        assertSame(pathway.receiver(), slot.take().orElseThrow());
        assertTrue(slot.isClaimed());
        assertEquals(Optional.empty(), slot.take());
    }

    @Test
    @Timeout(10)
    void testConcurrentClaimHasExactlyOneWinner() throws Exception {
        int claimers = 16;
        for (int round = 0; round < 50; round++) {
            ReceiverSlot<Ping> slot = new ReceiverSlot<>(PING, new LinkedPathway<Ping>(1).receiver());
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(claimers);
            try {
                List<Future<Optional<PathwayReceiver<Ping>>>> results = new ArrayList<>();
                for (int i = 0; i < claimers; i++) {
                    results.add(executor.submit(() -> {
                        start.await();
                        return slot.take();
                    }));
                }
                start.countDown();

                int winners = 0;
                for (Future<Optional<PathwayReceiver<Ping>>> result : results) {
                    if (result.get().isPresent()) {
                        winners++;
                    }
                }
                assertEquals(1, winners, "Round " + round);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Test
    void testDiscardClosesUnclaimedReceiver() {
        LinkedPathway<Ping> pathway = new LinkedPathway<>(1);
        ReceiverSlot<Ping> slot = new ReceiverSlot<>(PING, pathway.receiver());

        assertTrue(slot.discard());
        assertFalse(slot.discard());
        assertThrows(SendFailedException.class, () -> pathway.sender().send(new Ping(1)));
    }

    @Test
    void testDiscardLeavesClaimedReceiverOpen() throws InterruptedException {
        LinkedPathway<Ping> pathway = new LinkedPathway<>(1);
        ReceiverSlot<Ping> slot = new ReceiverSlot<>(PING, pathway.receiver());
        PathwayReceiver<Ping> claimed = slot.take().orElseThrow();

        assertFalse(slot.discard());
        pathway.sender().send(new Ping(1));
        assertEquals(new Ping(1), claimed.poll());
    }

    @Test
    void testNarrowChecksClass() {
        ReceiverSlot<?> slot = new ReceiverSlot<>(PING, new LinkedPathway<Ping>(1).receiver());

        assertSame(slot, slot.narrow(PING));
        assertThrows(InternalInconsistencyException.class, () -> slot.narrow(STATUS));
    }
}
