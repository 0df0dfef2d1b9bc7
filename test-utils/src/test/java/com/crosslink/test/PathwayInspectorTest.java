package com.crosslink.test;

import com.crosslink.config.PathwayType;
import com.crosslink.pathway.LinkedPathway;
import com.crosslink.pathway.MpscPathway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PathwayInspectorTest {

    @Test
    void testOccupancy() {
        LinkedPathway<Integer> pathway = new LinkedPathway<>(4);
        PathwayInspector inspector = PathwayInspector.create(pathway);

        assertTrue(inspector.isEmpty());
        pathway.sender().trySend(1);
        pathway.sender().trySend(2);

        assertEquals(2, inspector.size());
        assertEquals(4, inspector.capacity());
        assertEquals(0.5, inspector.fillRatio(), 0.001);
        assertFalse(inspector.isFull());
        assertTrue(inspector.exceedsThreshold(0.25));
        assertFalse(inspector.exceedsThreshold(0.75));
    }

    @Test
    void testFullPathway() {
        MpscPathway<Integer> pathway = new MpscPathway<>(2);
        PathwayInspector inspector = PathwayInspector.create(pathway);

        pathway.sender().trySend(1);
        pathway.sender().trySend(2);

        assertTrue(inspector.isFull());
        assertEquals(1.0, inspector.fillRatio(), 0.001);
        assertEquals(PathwayType.MPSC, inspector.metrics().pathwayType());
    }

    @Test
    @Timeout(5)
    void testRendezvousWithPendingHandOffCountsAsFull() throws Exception {
        LinkedPathway<String> pathway = new LinkedPathway<>(0);
        PathwayInspector inspector = PathwayInspector.create(pathway);
        assertEquals(0.0, inspector.fillRatio(), 0.001);

        CompletableFuture<Boolean> sending = CompletableFuture.supplyAsync(() -> {
            try {
                return pathway.sender().send("pending", 2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        assertTrue(inspector.awaitSize(1, Duration.ofSeconds(1)));
        assertTrue(inspector.isFull());
        assertEquals(1.0, inspector.fillRatio(), 0.001);

        assertEquals("pending", pathway.receiver().poll());
        assertTrue(sending.get(1, TimeUnit.SECONDS));
    }

    @Test
    @Timeout(5)
    void testAwaitEmpty() throws Exception {
        LinkedPathway<Integer> pathway = new LinkedPathway<>(4);
        PathwayInspector inspector = PathwayInspector.create(pathway);
        pathway.sender().send(1);

        assertFalse(inspector.awaitEmpty(Duration.ofMillis(30)));

        CompletableFuture.runAsync(() -> pathway.receiver().poll());
        assertTrue(inspector.awaitEmpty(Duration.ofSeconds(1)));
    }

    @Test
    void testMetricsSnapshot() {
        LinkedPathway<Integer> pathway = new LinkedPathway<>(8);
        pathway.sender().trySend(1);

        PathwayInspector.PathwayMetrics metrics = PathwayInspector.create(pathway).metrics();

        assertEquals(1, metrics.size());
        assertEquals(8, metrics.capacity());
        assertEquals(0.125, metrics.fillRatio(), 0.001);
        assertEquals(PathwayType.LINKED, metrics.pathwayType());
        assertTrue(metrics.toString().contains("capacity=8"));
    }
}
