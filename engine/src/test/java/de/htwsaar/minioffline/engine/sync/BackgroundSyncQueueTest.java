package de.htwsaar.minioffline.engine.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.minioffline.common.messaging.EngineEvent;
import de.htwsaar.minioffline.common.messaging.EngineEventType;
import de.htwsaar.minioffline.common.serialization.JacksonCodec;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import de.htwsaar.minioffline.engine.storage.InMemoryBlobStore;
import de.htwsaar.minioffline.engine.support.FakeNetworkClient;
import de.htwsaar.minioffline.engine.support.MutableClock;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Replay-Semantik der Sync-Queue: FIFO, genau ein Fehlversuch pro Durchlauf, Aufgabe nach maxRetries.
 */
class BackgroundSyncQueueTest {

    private InMemoryBlobStore blobs;
    private FakeNetworkClient network;
    private MutableClock clock;
    private HostEventBus bus;
    private List<EngineEvent> events;
    private BackgroundSyncQueue queue;

    @BeforeEach
    void setUp() {
        blobs = new InMemoryBlobStore();
        network = new FakeNetworkClient();
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        bus = new HostEventBus(clock);
        events = new CopyOnWriteArrayList<>();
        bus.subscribe(events::add);
        queue = newQueue();
    }

    private BackgroundSyncQueue newQueue() {
        return new BackgroundSyncQueue(blobs, network, bus, clock, Duration.ofMillis(200), 3, Runnable::run);
    }

    @Test
    void successfulReplayShouldEmptyQueueAndReportCount() {
        network.respond("/api/items", 201, "created");
        queue.enqueue(post("/api/items", "{\"n\":1}"), "offline");
        queue.enqueue(post("/api/items", "{\"n\":2}"), "offline");

        ReplayReport report = queue.replay();

        assertEquals(2, report.completed());
        assertTrue(queue.isEmpty());
        assertTrue(blobs.list(BackgroundSyncQueue.QUEUE_PREFIX).isEmpty());
        EngineEvent completed = lastOf(EngineEventType.SYNC_COMPLETED);
        assertEquals(2, completed.data().get("count"));
    }

    @Test
    void replayShouldSendMutationsInEnqueueOrder() {
        network.respond("/api/a", 200, "");
        network.respond("/api/b", 200, "");
        network.respond("/api/c", 200, "");
        queue.enqueue(post("/api/a", "1"), "offline");
        queue.enqueue(new ResourceRequest("PUT", "/api/b", Map.of(), "2".getBytes(StandardCharsets.UTF_8)), "offline");
        queue.enqueue(new ResourceRequest("DELETE", "/api/c", Map.of(), null), "offline");

        queue.replay();

        List<String> sent = network.requests().stream()
                .map(r -> r.method() + " " + r.target())
                .collect(Collectors.toList());
        assertEquals(List.of("POST /api/a", "PUT /api/b", "DELETE /api/c"), sent);
    }

    @Test
    void failureShouldIncrementRetryOnceAndStopThePass() {
        network.respond("/api/a", 500, "boom");
        network.respond("/api/b", 200, "");
        queue.enqueue(post("/api/a", "1"), "offline");
        queue.enqueue(post("/api/b", "2"), "offline");

        ReplayReport report = queue.replay();

        assertEquals(0, report.completed());
        assertEquals(1, report.requeued());
        assertEquals(2, report.remaining());
        PendingMutation head = queue.pending().get(0);
        assertEquals(1, head.retryCount());
        assertEquals(MutationState.REQUEUED, head.state());
        assertEquals("HTTP 500", head.lastError());
        assertEquals(0, network.calls("/api/b"), "Spätere Mutation darf die frühere nicht überholen");
        assertEquals(1, countOf(EngineEventType.SYNC_FAILED));
    }

    @Test
    void mutationShouldBeAbandonedAfterMaxRetriesWithExactlyOneExhaustedEvent() {
        network.setOffline(true);
        PendingMutation m = queue.enqueue(post("/api/a", "1"), "offline");

        queue.replay();
        queue.replay();
        ReplayReport last = queue.replay();

        assertEquals(1, last.abandoned());
        assertTrue(queue.isEmpty());
        assertEquals(3, countOf(EngineEventType.SYNC_FAILED));
        assertEquals(1, countOf(EngineEventType.REPLAY_EXHAUSTED));
        EngineEvent exhausted = lastOf(EngineEventType.REPLAY_EXHAUSTED);
        assertEquals(m.id(), exhausted.data().get("id"));
        assertEquals(3, exhausted.data().get("retryCount"));

        List<PendingMutation> abandoned = queue.abandoned();
        assertEquals(1, abandoned.size());
        assertEquals(MutationState.ABANDONED, abandoned.get(0).state());

        queue.replay();
        assertEquals(1, countOf(EngineEventType.REPLAY_EXHAUSTED), "Aufgegebene Mutation wird nicht erneut gemeldet");
        assertTrue(queue.discardAbandoned(m.id()));
        assertTrue(queue.abandoned().isEmpty());
    }

    @Test
    void abandonedHeadShouldUnblockFollowingMutationsInNextPass() {
        network.respond("/api/a", 500, "boom");
        network.respond("/api/b", 200, "");
        queue.enqueue(post("/api/a", "1"), "offline");
        queue.enqueue(post("/api/b", "2"), "offline");

        queue.replay();
        queue.replay();
        queue.replay();
        ReplayReport report = queue.replay();

        assertEquals(1, report.completed());
        assertTrue(queue.isEmpty());
    }

    @Test
    void restoreShouldReloadQueueInOrderAndResetInterruptedReplay() {
        PendingMutation first = queue.enqueue(post("/api/a", "1"), "offline");
        queue.enqueue(post("/api/b", "2"), "offline");
        blobs.put(BackgroundSyncQueue.QUEUE_PREFIX + first.id(),
                JacksonCodec.toBytes(first.withState(MutationState.REPLAYING)));

        BackgroundSyncQueue restarted = newQueue();
        int loaded = restarted.restore();

        assertEquals(2, loaded);
        List<PendingMutation> pending = restarted.pending();
        assertEquals("/api/a", pending.get(0).url());
        assertEquals(MutationState.QUEUED, pending.get(0).state());
        assertEquals("/api/b", pending.get(1).url());
        assertEquals("1", new String(pending.get(0).body(), StandardCharsets.UTF_8));
    }

    @Test
    void enqueueShouldRejectNonMutatingRequests() {
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(ResourceRequest.get("/api/a"), "x"));
    }

    @Test
    void triggersBeforeThePassStartsShouldShareOnePass() throws Exception {
        List<Runnable> tasks = new ArrayList<>();
        BackgroundSyncQueue deferred =
                new BackgroundSyncQueue(blobs, network, bus, clock, Duration.ofMillis(200), 3, tasks::add);
        network.respond("/api/a", 200, "");
        deferred.enqueue(post("/api/a", "1"), "offline");

        CompletableFuture<ReplayReport> first = deferred.replayNow();
        CompletableFuture<ReplayReport> second = deferred.replayNow();

        assertSame(first, second);
        assertEquals(1, tasks.size());
        assertFalse(first.isDone());
        tasks.get(0).run();
        assertEquals(1, first.get(1, TimeUnit.SECONDS).completed());
    }

    private long countOf(EngineEventType type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    private EngineEvent lastOf(EngineEventType type) {
        EngineEvent last = null;
        for (EngineEvent e : events) {
            if (e.type() == type) last = e;
        }
        return last;
    }

    private static ResourceRequest post(String target, String body) {
        return new ResourceRequest("POST", target,
                Map.of("Content-Type", List.of("application/json")), body.getBytes(StandardCharsets.UTF_8));
    }
}
