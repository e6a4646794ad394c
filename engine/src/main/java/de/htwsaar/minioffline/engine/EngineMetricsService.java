package de.htwsaar.minioffline.engine;

import de.htwsaar.minioffline.engine.domain.ResponseSource;
import de.htwsaar.minioffline.engine.strategy.Strategy;
import java.time.Clock;
import java.util.Deque;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Erfasst Laufzeitmetriken der Engine: Antworten je Herkunft, Anfragen je Strategie und
 * Requests pro Zeitfenster.
 *
 * <p>Die Werte liegen nur im Speicher der laufenden Instanz. Zeitstempel älter als
 * {@link #MAX_WINDOW_SECONDS} werden schon beim Erfassen verworfen.
 */
public class EngineMetricsService {

    /** Größtes abfragbares Zeitfenster in Sekunden. */
    public static final int MAX_WINDOW_SECONDS = 3600;

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);
    private final Map<ResponseSource, AtomicLong> bySource = new EnumMap<>(ResponseSource.class);
    private final Map<Strategy, AtomicLong> byStrategy = new EnumMap<>(Strategy.class);
    private final Deque<Long> requestTimestampsMs = new ConcurrentLinkedDeque<>();
    private final Clock clock;

    /**
     * Erstellt den Service mit einer expliziten Uhr (nützlich für Tests).
     *
     * @param clock Zeitquelle
     */
    public EngineMetricsService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (ResponseSource s : ResponseSource.values()) {
            bySource.put(s, new AtomicLong(0));
        }
        for (Strategy s : Strategy.values()) {
            byStrategy.put(s, new AtomicLong(0));
        }
    }

    /**
     * Erfasst eine ausgelieferte Antwort.
     *
     * @param source Herkunft
     */
    public void record(ResponseSource source) {
        totalRequests.incrementAndGet();
        bySource.get(source).incrementAndGet();
        stamp();
    }

    /**
     * Zählt eine Anfrage, die mit der gegebenen Strategie beantwortet wird.
     *
     * @param strategy gewählte Strategie
     */
    public void recordStrategy(Strategy strategy) {
        byStrategy.get(strategy).incrementAndGet();
    }

    /** Erfasst eine Anfrage, die ohne Antwort scheiterte. */
    public void recordFailure() {
        totalRequests.incrementAndGet();
        failures.incrementAndGet();
        stamp();
    }

    private void stamp() {
        long now = clock.millis();
        requestTimestampsMs.addLast(now);
        purgeOlderThan(now - MAX_WINDOW_SECONDS * 1000L);
    }

    /**
     * Liefert eine Momentaufnahme inklusive exakter Request-Zahl im Zeitfenster.
     *
     * @param windowSeconds  Zeitfenster in Sekunden, begrenzt auf 1 bis {@link #MAX_WINDOW_SECONDS}
     * @param pendingSync    wartende Mutationen
     * @return Snapshot
     */
    public EngineStatsSnapshot snapshot(int windowSeconds, long pendingSync) {
        int safeWindow = Math.min(MAX_WINDOW_SECONDS, Math.max(1, windowSeconds));
        long now = clock.millis();
        purgeOlderThan(now - MAX_WINDOW_SECONDS * 1000L);
        long threshold = now - safeWindow * 1000L;
        long inWindow = 0;
        for (Long ts : requestTimestampsMs) {
            if (ts >= threshold) inWindow++;
        }

        Map<Strategy, Long> strategies = new LinkedHashMap<>();
        byStrategy.forEach((strategy, count) -> strategies.put(strategy, count.get()));

        long hits = bySource.get(ResponseSource.CACHE).get();
        long misses = bySource.get(ResponseSource.NETWORK).get();
        long decisions = hits + misses;
        double hitRatio = decisions == 0 ? 0.0 : (double) hits / decisions;

        return new EngineStatsSnapshot(
                totalRequests.get(),
                inWindow,
                hits,
                misses,
                bySource.get(ResponseSource.FALLBACK).get(),
                bySource.get(ResponseSource.QUEUED).get(),
                failures.get(),
                hitRatio,
                Math.max(0, pendingSync),
                Collections.unmodifiableMap(strategies));
    }

    /** @return gehaltene Zeitstempel, höchstens so viele wie im größten Fenster anfallen */
    int retainedTimestamps() {
        return requestTimestampsMs.size();
    }

    private void purgeOlderThan(long threshold) {
        while (true) {
            Long first = requestTimestampsMs.peekFirst();
            if (first == null || first >= threshold) {
                break;
            }
            requestTimestampsMs.pollFirst();
        }
    }

    /**
     * Unveränderlicher Snapshot der Engine-Metriken.
     *
     * @param totalRequests     Gesamtanzahl Requests seit Start
     * @param requestsPerWindow exakte Anzahl Requests im Zeitfenster
     * @param cacheHits         Antworten aus dem Cache
     * @param networkResponses  Antworten vom Netz
     * @param fallbacks         Offline-Ersatzantworten
     * @param queued            zurückgestellte Mutationen
     * @param failures          Anfragen ohne Antwort
     * @param cacheHitRatio     Trefferquote zwischen 0 und 1 (Cache vs. Netz)
     * @param pendingSync       aktuell wartende Mutationen
     * @param byStrategy        beantwortete GET-Anfragen je Strategie
     */
    public record EngineStatsSnapshot(
            long totalRequests,
            long requestsPerWindow,
            long cacheHits,
            long networkResponses,
            long fallbacks,
            long queued,
            long failures,
            double cacheHitRatio,
            long pendingSync,
            Map<Strategy, Long> byStrategy) {}
}
