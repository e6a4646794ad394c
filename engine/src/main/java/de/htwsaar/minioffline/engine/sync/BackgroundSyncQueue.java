package de.htwsaar.minioffline.engine.sync;

import de.htwsaar.minioffline.common.messaging.EngineEventType;
import de.htwsaar.minioffline.common.serialization.JacksonCodec;
import de.htwsaar.minioffline.common.serialization.MiniOfflineSerializationException;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import de.htwsaar.minioffline.engine.storage.BlobStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dauerhafte FIFO-Queue für mutierende Anfragen, die offline gescheitert sind.
 *
 * <p>Replay läuft ausschließlich auf dem Sync-Executor (ein Thread) und arbeitet die Queue
 * ältestes-zuerst ab. Ein Fehlschlag erhöht {@code retryCount} genau einmal und beendet den
 * Durchlauf, damit keine spätere Mutation eine frühere überholt.</p>
 */
public class BackgroundSyncQueue {

    private static final Logger log = LoggerFactory.getLogger(BackgroundSyncQueue.class);

    static final String QUEUE_PREFIX = "sync/queue/";
    static final String ABANDONED_PREFIX = "sync/abandoned/";

    private final BlobStore blobStore;
    private final NetworkClient network;
    private final HostEventBus events;
    private final Clock clock;
    private final Duration timeout;
    private final int maxRetries;
    private final Executor syncExecutor;

    private final LinkedList<PendingMutation> queue = new LinkedList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<CompletableFuture<ReplayReport>> scheduled = new AtomicReference<>();

    /**
     * @param blobStore    dauerhafter Speicher
     * @param network      Netzwerk-Port
     * @param events       Event-Bus
     * @param clock        Zeitquelle
     * @param timeout      Frist pro Replay-Request
     * @param maxRetries   Fehlversuche bis zur Aufgabe
     * @param syncExecutor Executor mit genau einem Thread
     */
    public BackgroundSyncQueue(
            BlobStore blobStore,
            NetworkClient network,
            HostEventBus events,
            Clock clock,
            Duration timeout,
            int maxRetries,
            Executor syncExecutor) {
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore must not be null");
        this.network = Objects.requireNonNull(network, "network must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.syncExecutor = Objects.requireNonNull(syncExecutor, "syncExecutor must not be null");
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        this.maxRetries = maxRetries;
    }

    /**
     * Stellt eine gescheiterte Mutation zurück.
     *
     * @param request mutierende Anfrage
     * @param cause   Grund des Scheiterns
     * @return gespeicherte Mutation
     */
    public PendingMutation enqueue(ResourceRequest request, String cause) {
        if (!request.isMutating()) {
            throw new IllegalArgumentException("Only mutating requests can be queued, got " + request.method());
        }
        PendingMutation m = PendingMutation.of(
                UUID.randomUUID().toString(), request, clock.instant(), sequence.incrementAndGet(), cause);
        synchronized (this) {
            queue.addLast(m);
            persist(m);
        }
        log.info("Queued {} {} for background sync as {} ({})", m.method(), m.url(), m.id(), cause);
        return m;
    }

    /**
     * Stößt einen Replay-Durchlauf auf dem Sync-Executor an.
     * Mehrere Auslöser vor Beginn des Durchlaufs teilen sich denselben Durchlauf.
     *
     * @return Future mit dem Ergebnis
     */
    public CompletableFuture<ReplayReport> replayNow() {
        CompletableFuture<ReplayReport> fresh = new CompletableFuture<>();
        CompletableFuture<ReplayReport> existing = scheduled.compareAndExchange(null, fresh);
        if (existing != null) {
            return existing;
        }
        try {
            syncExecutor.execute(() -> {
                scheduled.compareAndSet(fresh, null);
                try {
                    fresh.complete(replay());
                } catch (RuntimeException ex) {
                    log.error("Background sync pass failed", ex);
                    fresh.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            scheduled.compareAndSet(fresh, null);
            fresh.completeExceptionally(ex);
        }
        return fresh;
    }

    /**
     * Ein Durchlauf über die Queue. Nur vom Sync-Executor (oder in Tests direkt) aufrufen.
     *
     * @return Ergebnis
     */
    ReplayReport replay() {
        int completed = 0;
        int requeued = 0;
        int abandoned = 0;
        while (true) {
            PendingMutation head = head();
            if (head == null) break;

            updateHead(head.withState(MutationState.REPLAYING));
            String failure = attempt(head);
            if (failure == null) {
                removeHead(head);
                blobStore.delete(QUEUE_PREFIX + head.id());
                completed++;
                log.info("Replayed {} {} ({})", head.method(), head.url(), head.id());
                continue;
            }

            PendingMutation failed = head.failed(failure, MutationState.REQUEUED);
            events.publish(EngineEventType.SYNC_FAILED, Map.of(
                    "id", failed.id(),
                    "url", failed.url(),
                    "reason", failure,
                    "retryCount", failed.retryCount()));

            if (failed.retryCount() >= maxRetries) {
                abandon(failed.withState(MutationState.ABANDONED));
                abandoned++;
            } else {
                updateHead(failed);
                requeued++;
                log.warn("Replay of {} failed ({}), attempt {}/{}", failed.id(), failure, failed.retryCount(), maxRetries);
            }
            break;
        }
        if (completed > 0) {
            events.publish(EngineEventType.SYNC_COMPLETED, Map.of("count", completed));
        }
        return new ReplayReport(completed, requeued, abandoned, size());
    }

    /**
     * @return {@code null} bei Erfolg (2xx/3xx), sonst Fehlergrund
     */
    private String attempt(PendingMutation m) {
        try {
            ResourceResponse resp = network.fetch(m.toRequest(), timeout)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
            if (resp.status() >= 200 && resp.status() < 400) {
                return null;
            }
            return "HTTP " + resp.status();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        }
    }

    private void abandon(PendingMutation m) {
        synchronized (this) {
            queue.removeIf(q -> q.id().equals(m.id()));
            blobStore.put(ABANDONED_PREFIX + m.id(), JacksonCodec.toBytes(m));
            blobStore.delete(QUEUE_PREFIX + m.id());
        }
        ReplayExhaustedException ex = new ReplayExhaustedException(m);
        log.error("Abandoned mutation {}: {}", m.id(), ex.getMessage());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", m.id());
        data.put("url", m.url());
        data.put("method", m.method());
        data.put("retryCount", m.retryCount());
        data.put("lastError", m.lastError());
        data.put("message", ex.getMessage());
        events.publish(EngineEventType.REPLAY_EXHAUSTED, data);
    }

    /** @return wartende Mutationen, älteste zuerst */
    public synchronized List<PendingMutation> pending() {
        return new ArrayList<>(queue);
    }

    /** @return Anzahl wartender Mutationen */
    public synchronized int size() {
        return queue.size();
    }

    /** @return {@code true}, wenn nichts wartet */
    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Aufgegebene Mutationen zur manuellen Nachbearbeitung.
     *
     * @return älteste zuerst
     */
    public List<PendingMutation> abandoned() {
        List<PendingMutation> out = new ArrayList<>();
        for (String key : blobStore.list(ABANDONED_PREFIX)) {
            PendingMutation m = read(key);
            if (m != null) out.add(m);
        }
        out.sort(Comparator.comparingLong(PendingMutation::sequence));
        return out;
    }

    /**
     * Verwirft eine aufgegebene Mutation endgültig.
     *
     * @param id Mutations-ID
     * @return {@code true}, wenn sie existierte
     */
    public boolean discardAbandoned(String id) {
        return blobStore.delete(ABANDONED_PREFIX + id);
    }

    /**
     * Lädt die Queue aus dem Blob-Store (nach Neustart).
     *
     * @return Anzahl geladener Mutationen
     */
    public synchronized int restore() {
        List<PendingMutation> loaded = new ArrayList<>();
        for (String key : blobStore.list(QUEUE_PREFIX)) {
            PendingMutation m = read(key);
            if (m != null) loaded.add(m.state() == MutationState.REPLAYING ? m.withState(MutationState.QUEUED) : m);
        }
        loaded.sort(Comparator.comparingLong(PendingMutation::sequence));
        queue.clear();
        queue.addAll(loaded);
        long maxSeq = sequence.get();
        for (PendingMutation m : loaded) maxSeq = Math.max(maxSeq, m.sequence());
        for (PendingMutation m : abandoned()) maxSeq = Math.max(maxSeq, m.sequence());
        sequence.set(maxSeq);
        log.info("Restored {} pending mutation(s)", loaded.size());
        return loaded.size();
    }

    private synchronized PendingMutation head() {
        return queue.peekFirst();
    }

    private synchronized void updateHead(PendingMutation m) {
        if (!queue.isEmpty() && queue.getFirst().id().equals(m.id())) {
            queue.set(0, m);
            persist(m);
        }
    }

    private synchronized void removeHead(PendingMutation m) {
        if (!queue.isEmpty() && queue.getFirst().id().equals(m.id())) {
            queue.removeFirst();
        }
    }

    private void persist(PendingMutation m) {
        blobStore.put(QUEUE_PREFIX + m.id(), JacksonCodec.toBytes(m));
    }

    private PendingMutation read(String key) {
        byte[] raw = blobStore.get(key);
        if (raw == null) return null;
        try {
            return JacksonCodec.fromBytes(raw, PendingMutation.class);
        } catch (MiniOfflineSerializationException ex) {
            log.warn("Skipping unreadable mutation {}: {}", key, ex.getMessage());
            return null;
        }
    }
}
