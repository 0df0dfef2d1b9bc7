package com.crosslink;

import com.crosslink.endpoint.ReceiverSlot;
import com.crosslink.helper.Ping;
import com.crosslink.helper.Pong;
import com.crosslink.helper.Status;
import com.crosslink.pathway.LinkedPathway;
import com.crosslink.pathway.PathwayReceiver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.crosslink.helper.MessageTypes.*;
import static org.junit.jupiter.api.Assertions.*;

class RouterTest {

    private static final EndpointId<Status> MONITOR = EndpointId.of("Monitor", STATUS);

    private Router router;

    @BeforeEach
    void setUp() {
        router = new Router();
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    void testRegisterAndSendByIdentity() throws InterruptedException {
        LinkedPathway<Status> pathway = new LinkedPathway<>(4);
        router.registerSender(MONITOR, pathway.sender());
        router.registerReceiver(MONITOR, pathway.receiver());

        router.send(MONITOR, new Status("up"));

        PathwayReceiver<Status> receiver = router.takeReceiver(MONITOR);
        assertEquals(Optional.of(new Status("up")), receiver.receive());
    }

    @Test
    void testDuplicateSenderRegistrationRejected() {
        LinkedPathway<Status> first = new LinkedPathway<>(1);
        LinkedPathway<Status> second = new LinkedPathway<>(1);
        router.registerSender(MONITOR, first.sender());

        DuplicateRegistrationException e = assertThrows(DuplicateRegistrationException.class,
                () -> router.registerSender(MONITOR, second.sender()));
        assertEquals("Monitor", e.getSubject());
        assertInstanceOf(RegistrationException.class, e);
    }

    @Test
    void testDuplicateReceiverRegistrationRejected() {
        router.registerReceiver(MONITOR, new LinkedPathway<Status>(1).receiver());

        assertThrows(DuplicateRegistrationException.class,
                () -> router.registerReceiver(MONITOR, new LinkedPathway<Status>(1).receiver()));
    }

    @Test
    void testSenderAndReceiverNamespacesAreSeparate() {
        LinkedPathway<Status> pathway = new LinkedPathway<>(1);
        router.registerSender(MONITOR, pathway.sender());

        assertDoesNotThrow(() -> router.registerReceiver(MONITOR, pathway.receiver()));
        assertEquals(Set.of("Monitor"), router.senderIdentities());
        assertEquals(Set.of("Monitor"), router.receiverIdentities());
    }

    @Test
    void testTakeReceiverOnlyOnce() {
        router.registerReceiver(MONITOR, new LinkedPathway<Status>(1).receiver());

        assertNotNull(router.takeReceiver(MONITOR));
        assertTrue(router.isClaimed("Monitor"));

        AlreadyClaimedException e = assertThrows(AlreadyClaimedException.class, () -> router.takeReceiver(MONITOR));
        assertEquals("Monitor", e.getSubject());
    }

    @Test
    void testTakeReceiverWithWrongTypeFailsWithoutClaiming() {
        router.registerReceiver(MONITOR, new LinkedPathway<Status>(1).receiver());

        TypeMismatchException e = assertThrows(TypeMismatchException.class,
                () -> router.takeReceiver(EndpointId.of("Monitor", PING)));
        assertEquals("Status", e.getRegisteredType());
        assertEquals("Ping", e.getRequestedType());
        assertFalse(router.isClaimed("Monitor"));
        assertNotNull(router.takeReceiver(MONITOR));
    }

    @Test
    void testTypeMismatchReportedBeforeAlreadyClaimed() {
        router.registerReceiver(MONITOR, new LinkedPathway<Status>(1).receiver());
        router.takeReceiver(MONITOR);

        assertThrows(TypeMismatchException.class, () -> router.takeReceiver("Monitor", PING));
    }

    @Test
    void testTakeUnknownReceiver() {
        PathwayNotFoundException e = assertThrows(PathwayNotFoundException.class,
                () -> router.takeReceiver(EndpointId.of("Nobody", STATUS)));
        assertEquals("Nobody", e.getSubject());
    }

    @Test
    void testClaimReturnsResult() {
        router.registerReceiver(MONITOR, new LinkedPathway<Status>(1).receiver());

        Result<PathwayReceiver<Status>> first = router.claim(MONITOR);
        Result<PathwayReceiver<Status>> second = router.claim(MONITOR);
        Result<PathwayReceiver<Ping>> unknown = router.claim("Elsewhere", PING);

        assertTrue(first.isSuccess());
        assertInstanceOf(AlreadyClaimedException.class, second.error().orElseThrow());
        assertInstanceOf(PathwayNotFoundException.class, unknown.error().orElseThrow());
    }

    @Test
    void testSendToUnknownIdentity() {
        assertThrows(PathwayNotFoundException.class, () -> router.send(MONITOR, new Status("lost")));
    }

    @Test
    void testWrongTypeSendLeavesPathwayUnchanged() {
        LinkedPathway<Status> pathway = new LinkedPathway<>(4);
        router.registerSender(MONITOR, pathway.sender());

        TypeMismatchException e = assertThrows(TypeMismatchException.class,
                () -> router.send("Monitor", new Ping(1)));

        assertEquals("Monitor", e.getSubject());
        assertEquals(0, pathway.size());
    }

    @Test
    void testSendThroughIdWithDifferentTagFails() {
        LinkedPathway<Status> pathway = new LinkedPathway<>(4);
        router.registerSender(MONITOR, pathway.sender());
        EndpointId<Status> renamed = EndpointId.of("Monitor", MessageType.named("status-v2", Status.class));

        assertThrows(TypeMismatchException.class, () -> router.send(renamed, new Status("x")));
        assertEquals(0, pathway.size());
    }

    @Test
    @Timeout(5)
    void testSendBlocksAtCapacityUntilDequeue() throws Exception {
        LinkedPathway<Status> pathway = new LinkedPathway<>(2);
        router.registerSender(MONITOR, pathway.sender());
        router.registerReceiver(MONITOR, pathway.receiver());
        PathwayReceiver<Status> receiver = router.takeReceiver(MONITOR);

        router.send(MONITOR, new Status("1"));
        router.send(MONITOR, new Status("2"));

        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean completed = new AtomicBoolean(false);
        Thread producer = new Thread(() -> {
            started.countDown();
            try {
                router.send(MONITOR, new Status("3"));
                completed.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();
        started.await();
        Thread.sleep(100);
        assertFalse(completed.get(), "Third send should wait for space");

        assertEquals(Optional.of(new Status("1")), receiver.receive());
        producer.join(1000);
        assertTrue(completed.get());
        assertEquals(Optional.of(new Status("2")), receiver.receive());
        assertEquals(Optional.of(new Status("3")), receiver.receive());
    }

    @Test
    void testTrySendAndTimedSend() throws InterruptedException {
        LinkedPathway<Status> pathway = new LinkedPathway<>(1);
        router.registerSender(MONITOR, pathway.sender());

        assertTrue(router.trySend(MONITOR, new Status("a")));
        assertFalse(router.trySend("Monitor", new Status("b")));
        assertFalse(router.send(MONITOR, new Status("c"), 50, TimeUnit.MILLISECONDS));
        assertEquals(1, pathway.size());
    }

    @Test
    @Timeout(5)
    void testSendFailsOnceReceiverClosedWithoutClaim() throws InterruptedException {
        LinkedPathway<Status> pathway = new LinkedPathway<>(1);
        router.registerSender(MONITOR, pathway.sender());
        router.registerReceiver(MONITOR, pathway.receiver());
        router.send(MONITOR, new Status("buffered"));

        pathway.receiver().close();

        SendFailedException e = assertThrows(SendFailedException.class,
                () -> router.send(MONITOR, new Status("never")));
        assertEquals("Monitor", e.getSubject());
        assertInstanceOf(SendFailedException.class, e.getCause());
    }

    @Test
    void testRegistrationAfterSealFails() {
        router.registerSender(MONITOR, new LinkedPathway<Status>(1).sender());
        router.seal();
        router.seal();

        assertTrue(router.isSealed());
        assertThrows(IllegalStateException.class,
                () -> router.registerSender(EndpointId.of("Other", STATUS), new LinkedPathway<Status>(1).sender()));
        assertThrows(IllegalStateException.class,
                () -> router.registerReceiver("Other", new ReceiverSlot<>(STATUS, new LinkedPathway<Status>(1).receiver())));
        assertThrows(IllegalStateException.class,
                () -> router.registerPathway("L", "a", "b", PING, new LinkedPathway<Ping>(1).sender()));
        assertEquals(Set.of("Monitor"), router.senderIdentities());
    }

    @Test
    @Timeout(5)
    void testSealedRouterIsSharedAcrossThreads() throws Exception {
        LinkedPathway<Ping> pings = new LinkedPathway<>(8);
        EndpointId<Ping> id = EndpointId.of("Pinger", PING);
        router.registerSender(id, pings.sender());
        router.registerReceiver(id, pings.receiver());
        router.seal();

        CompletableFuture<Void> producer = CompletableFuture.runAsync(() -> {
            try {
                for (int i = 0; i < 20; i++) {
                    router.send(id, new Ping(i));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        PathwayReceiver<Ping> receiver = router.takeReceiver(id);
        for (int i = 0; i < 20; i++) {
            assertEquals(Optional.of(new Ping(i)), receiver.receive());
        }
        producer.get(1, TimeUnit.SECONDS);
    }

    @Test
    @Timeout(5)
    void testCloseEndsClaimedStreamsAndDiscardsUnclaimed() throws InterruptedException {
        LinkedPathway<Ping> pings = new LinkedPathway<>(4);
        LinkedPathway<Pong> pongs = new LinkedPathway<>(4);
        EndpointId<Ping> pingId = EndpointId.of("Pinger", PING);
        EndpointId<Pong> pongId = EndpointId.of("Ponger", PONG);
        router.registerSender(pingId, pings.sender());
        router.registerReceiver(pingId, pings.receiver());
        router.registerSender(pongId, pongs.sender());
        router.registerReceiver(pongId, pongs.receiver());

        PathwayReceiver<Ping> claimed = router.takeReceiver(pingId);
        router.send(pingId, new Ping(1));
        router.close();

        assertTrue(router.isClosed());
        assertEquals(Optional.of(new Ping(1)), claimed.receive());
        assertEquals(Optional.empty(), claimed.receive());
        assertTrue(router.isClaimed("Ponger"), "Unclaimed receivers are discarded on close");
        assertThrows(SendFailedException.class, () -> router.send(pingId, new Ping(2)));
        assertThrows(IllegalStateException.class,
                () -> router.registerSender(EndpointId.of("Late", PING), new LinkedPathway<Ping>(1).sender()));
    }

    @Test
    void testBlankIdentityRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EndpointId<>(" ", STATUS));
        assertThrows(IllegalArgumentException.class,
                () -> router.registerReceiver("", new ReceiverSlot<>(STATUS, new LinkedPathway<Status>(1).receiver())));
    }

    @Test
    void testNullMessageRejected() {
        router.registerSender(MONITOR, new LinkedPathway<Status>(1).sender());
        assertThrows(NullPointerException.class, () -> router.send(MONITOR, null));
    }
}
