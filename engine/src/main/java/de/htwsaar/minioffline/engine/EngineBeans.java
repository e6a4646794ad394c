package de.htwsaar.minioffline.engine;

import de.htwsaar.minioffline.engine.adapter.http.HttpNetworkClient;
import de.htwsaar.minioffline.engine.cache.CacheStoreManager;
import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.lifecycle.LifecycleManager;
import de.htwsaar.minioffline.engine.messaging.ConnectivityAwareNetworkClient;
import de.htwsaar.minioffline.engine.messaging.ConnectivityMonitor;
import de.htwsaar.minioffline.engine.messaging.EngineMessageHandler;
import de.htwsaar.minioffline.engine.messaging.HostEventBus;
import de.htwsaar.minioffline.engine.push.EventPublishingPresenter;
import de.htwsaar.minioffline.engine.push.PushNotificationDispatcher;
import de.htwsaar.minioffline.engine.service.RequestInterceptor;
import de.htwsaar.minioffline.engine.storage.BlobStore;
import de.htwsaar.minioffline.engine.storage.InMemoryBlobStore;
import de.htwsaar.minioffline.engine.storage.SqliteBlobStore;
import de.htwsaar.minioffline.engine.strategy.StrategyExecutors;
import de.htwsaar.minioffline.engine.sync.BackgroundSyncQueue;
import de.htwsaar.minioffline.engine.sync.SyncScheduler;
import java.net.URI;
import java.net.http.HttpClient;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Zentrale Spring-Verdrahtung der Engine-Komponenten.
 *
 * <p>Schichtung: Controller → Service → Domain/Ports → Adapter/Infrastructure</p>
 */
@Configuration
public class EngineBeans {

    /**
     * Systemuhr für den gesamten Engine-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Dauerhafter Zustand: SQLite (Standard) oder flüchtig im Speicher.
     *
     * @param type    {@code sqlite} oder {@code memory}
     * @param jdbcUrl JDBC-URL für SQLite
     * @return Blob-Store
     * @throws SQLException wenn SQLite nicht geöffnet werden kann
     */
    @Bean
    public BlobStore blobStore(
            @Value("${engine.storage.type:sqlite}") String type,
            @Value("${engine.storage.jdbc-url:jdbc:sqlite:mini-offline.db}") String jdbcUrl) throws SQLException {
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "memory" -> new InMemoryBlobStore();
            case "sqlite" -> new SqliteBlobStore(jdbcUrl);
            default -> throw new IllegalArgumentException("Unknown engine.storage.type: " + type);
        };
    }

    /**
     * Cache-Stores inkl. Wiederherstellung aus dem Blob-Store.
     */
    @Bean
    public CacheStoreManager cacheStoreManager(BlobStore blobStore, Clock clock) {
        CacheStoreManager manager = new CacheStoreManager(blobStore, clock);
        manager.restore();
        return manager;
    }

    @Bean
    public HostEventBus hostEventBus(Clock clock) {
        return new HostEventBus(clock);
    }

    @Bean
    public ConnectivityMonitor connectivityMonitor(HostEventBus events) {
        return new ConnectivityMonitor(events);
    }

    /**
     * HTTP-Client für Upstream-Zugriffe.
     *
     * @param connectTimeoutMs Verbindungsaufbau-Frist in ms (Standard: 3000)
     * @return JDK-HttpClient
     */
    @Bean
    public HttpClient httpClient(@Value("${engine.network.connect-timeout-ms:3000}") long connectTimeoutMs) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1, connectTimeoutMs)))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * Adapter-Implementierung des {@link NetworkClient}-Ports via HTTP, beobachtet vom
     * {@link ConnectivityMonitor}.
     *
     * @param httpClient      HTTP-Client
     * @param upstreamBaseUrl Basis-URL des Upstream-Servers
     * @param monitor         Konnektivitätsbeobachter
     * @return dekorierter Netzwerk-Port
     */
    @Bean
    public NetworkClient networkClient(
            HttpClient httpClient,
            @Value("${engine.upstream.base-url}") String upstreamBaseUrl,
            ConnectivityMonitor monitor) {
        return new ConnectivityAwareNetworkClient(new HttpNetworkClient(httpClient, URI.create(upstreamBaseUrl)), monitor);
    }

    /** Geteilter Executor für Push-Anzeige und Hintergrundarbeit. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService engineExecutor(@Value("${engine.executor.threads:4}") int threads) {
        return Executors.newFixedThreadPool(Math.max(1, threads));
    }

    /** Genau ein Thread für das Sync-Replay. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService syncExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "engine-sync");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public StrategyExecutors strategyExecutors(
            CacheStoreManager caches,
            NetworkClient networkClient,
            HostEventBus events,
            @Value("${engine.network.timeout-ms:5000}") long timeoutMs) {
        return new StrategyExecutors(caches, networkClient, Duration.ofMillis(timeoutMs), events);
    }

    /**
     * Lebenszyklus inkl. Start der konfigurierten (oder gespeicherten) Version.
     */
    @Bean
    public LifecycleManager lifecycleManager(
            CacheStoreManager caches,
            NetworkClient networkClient,
            BlobStore blobStore,
            HostEventBus events,
            EngineProperties properties,
            @Value("${engine.network.timeout-ms:5000}") long timeoutMs) {
        LifecycleManager lifecycle = new LifecycleManager(
                caches, networkClient, blobStore, events, properties.getCachePrefix(), Duration.ofMillis(timeoutMs));
        lifecycle.bootstrap(properties.toRelease());
        return lifecycle;
    }

    /**
     * Sync-Queue; wird beim Übergang nach online automatisch abgespielt.
     */
    @Bean
    public BackgroundSyncQueue backgroundSyncQueue(
            BlobStore blobStore,
            NetworkClient networkClient,
            HostEventBus events,
            Clock clock,
            ConnectivityMonitor monitor,
            @Qualifier("syncExecutor") ExecutorService syncExecutor,
            @Value("${engine.network.mutation-timeout-ms:10000}") long mutationTimeoutMs,
            @Value("${engine.sync.max-retries:3}") int maxRetries) {
        BackgroundSyncQueue queue = new BackgroundSyncQueue(
                blobStore, networkClient, events, clock, Duration.ofMillis(mutationTimeoutMs), maxRetries, syncExecutor);
        queue.restore();
        monitor.onReconnect(queue::replayNow);
        return queue;
    }

    @Bean
    public SyncScheduler syncScheduler(BackgroundSyncQueue queue) {
        return new SyncScheduler(queue);
    }

    @Bean
    public EventPublishingPresenter eventPublishingPresenter(HostEventBus events) {
        return new EventPublishingPresenter(events);
    }

    @Bean
    public PushNotificationDispatcher pushNotificationDispatcher(
            EventPublishingPresenter presenter, @Qualifier("engineExecutor") ExecutorService engineExecutor) {
        return new PushNotificationDispatcher(presenter, presenter, engineExecutor);
    }

    @Bean
    public EngineMessageHandler engineMessageHandler(
            LifecycleManager lifecycle,
            CacheStoreManager caches,
            NetworkClient networkClient,
            @Value("${engine.network.timeout-ms:5000}") long timeoutMs) {
        return new EngineMessageHandler(lifecycle, caches, networkClient, Duration.ofMillis(timeoutMs));
    }

    @Bean
    public EngineMetricsService engineMetricsService(Clock clock) {
        return new EngineMetricsService(clock);
    }

    @Bean
    public RequestInterceptor requestInterceptor(
            LifecycleManager lifecycle,
            StrategyExecutors executors,
            NetworkClient networkClient,
            BackgroundSyncQueue syncQueue,
            EngineMetricsService metrics,
            @Value("${engine.network.mutation-timeout-ms:10000}") long mutationTimeoutMs) {
        return new RequestInterceptor(
                lifecycle, executors, networkClient, syncQueue, metrics, Duration.ofMillis(mutationTimeoutMs));
    }
}
