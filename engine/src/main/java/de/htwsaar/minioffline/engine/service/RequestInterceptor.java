package de.htwsaar.minioffline.engine.service;

import de.htwsaar.minioffline.common.serialization.JacksonCodec;
import de.htwsaar.minioffline.engine.EngineMetricsService;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.NetworkException;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.domain.ResponseSource;
import de.htwsaar.minioffline.engine.lifecycle.EngineInstance;
import de.htwsaar.minioffline.engine.lifecycle.LifecycleManager;
import de.htwsaar.minioffline.engine.routing.RouteDecision;
import de.htwsaar.minioffline.engine.strategy.CacheMissException;
import de.htwsaar.minioffline.engine.strategy.Strategy;
import de.htwsaar.minioffline.engine.strategy.StrategyExecutors;
import de.htwsaar.minioffline.engine.sync.BackgroundSyncQueue;
import de.htwsaar.minioffline.engine.sync.PendingMutation;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Einziger Einstiegspunkt für abgefangene Anfragen.
 *
 * <p>Mutierende Anfragen gehen direkt ans Netz und landen bei Verbindungsfehlern in der
 * Sync-Queue. GET läuft über Router und Strategie der aktiven Version; scheitert sie ohne
 * Upstream-Status, wird der Offline-Fallback versucht.</p>
 */
public class RequestInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RequestInterceptor.class);

    private final LifecycleManager lifecycle;
    private final StrategyExecutors executors;
    private final NetworkClient network;
    private final BackgroundSyncQueue syncQueue;
    private final EngineMetricsService metrics;
    private final Duration mutationTimeout;

    public RequestInterceptor(
            LifecycleManager lifecycle,
            StrategyExecutors executors,
            NetworkClient network,
            BackgroundSyncQueue syncQueue,
            EngineMetricsService metrics,
            Duration mutationTimeout) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.executors = Objects.requireNonNull(executors, "executors must not be null");
        this.network = Objects.requireNonNull(network, "network must not be null");
        this.syncQueue = Objects.requireNonNull(syncQueue, "syncQueue must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.mutationTimeout = Objects.requireNonNull(mutationTimeout, "mutationTimeout must not be null");
    }

    /**
     * Beantwortet eine abgefangene Anfrage.
     *
     * <p>Das zurückgegebene Future gehört dem Aufrufer; sein Abbruch beeinflusst laufende
     * Hintergrund-Revalidierungen nicht.</p>
     *
     * @param request Anfrage
     * @return Future mit der Antwort; scheitert mit {@link ResourceUnavailableException}
     */
    public CompletableFuture<ResourceResponse> handle(ResourceRequest request) {
        if (request.isMutating()) {
            return handleMutation(request);
        }
        EngineInstance instance = lifecycle.active();
        RouteDecision decision = instance.router().route(request);
        String store = instance.qualify(decision.storeName());
        metrics.recordStrategy(decision.strategy());

        CompletableFuture<ResourceResponse> run;
        try {
            run = executors.forStrategy(decision.strategy()).execute(request, store);
        } catch (RuntimeException ex) {
            run = CompletableFuture.failedFuture(ex);
        }

        CompletableFuture<ResourceResponse> result = new CompletableFuture<>();
        run.whenComplete((resp, ex) -> {
            if (ex == null) {
                metrics.record(resp.source());
                result.complete(resp);
                return;
            }
            try {
                ResourceResponse fallback = recover(request, instance, decision.strategy(), unwrap(ex));
                metrics.record(fallback.source());
                result.complete(fallback);
            } catch (RuntimeException failure) {
                metrics.recordFailure();
                result.completeExceptionally(failure);
            }
        });
        return result;
    }

    private ResourceResponse recover(ResourceRequest request, EngineInstance instance, Strategy strategy, Throwable cause) {
        if (cause instanceof NetworkException && !((NetworkException) cause).isConnectivityFailure()) {
            NetworkException ne = (NetworkException) cause;
            throw new ResourceUnavailableException(ResourceUnavailableException.Reason.UPSTREAM_ERROR,
                    request.target(), strategy, ne.getMessage(), ne.getStatusCode(), ne);
        }
        if (!(cause instanceof NetworkException) && !(cause instanceof CacheMissException)) {
            throw cause instanceof RuntimeException
                    ? (RuntimeException) cause
                    : new IllegalStateException("Unexpected failure for " + request.target(), cause);
        }
        ResourceResponse fallback = instance.fallbackResolver().resolve(request.path());
        if (fallback != null) {
            log.info("Serving offline fallback for {} ({})", request.target(), cause.getMessage());
            return fallback;
        }
        throw new ResourceUnavailableException(ResourceUnavailableException.Reason.OFFLINE,
                request.target(), strategy, cause.getMessage(), 0, cause);
    }

    private CompletableFuture<ResourceResponse> handleMutation(ResourceRequest request) {
        return network.fetch(request, mutationTimeout)
                .orTimeout(mutationTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((resp, ex) -> {
                    if (ex == null) {
                        metrics.record(resp.source());
                        return resp;
                    }
                    Throwable cause = unwrap(ex);
                    boolean connectivity = cause instanceof TimeoutException
                            || (cause instanceof NetworkException && ((NetworkException) cause).isConnectivityFailure());
                    if (!connectivity) {
                        metrics.recordFailure();
                        throw cause instanceof RuntimeException
                                ? (RuntimeException) cause
                                : new CompletionException(cause);
                    }
                    PendingMutation queued = syncQueue.enqueue(request, describe(cause));
                    metrics.record(ResponseSource.QUEUED);
                    return queuedResponse(queued);
                });
    }

    private static ResourceResponse queuedResponse(PendingMutation m) {
        byte[] body = JacksonCodec.toBytes(Map.of("queued", true, "id", m.id()));
        return new ResourceResponse(202, Map.of("Content-Type", List.of("application/json")), body, ResponseSource.QUEUED);
    }

    private static String describe(Throwable cause) {
        return cause instanceof TimeoutException ? "timeout" : cause.getMessage();
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
