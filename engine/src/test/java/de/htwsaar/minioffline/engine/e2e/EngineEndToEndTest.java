package de.htwsaar.minioffline.engine.e2e;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import de.htwsaar.minioffline.engine.EngineApp;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Startet die Engine gegen einen lokalen Fake-Upstream und prüft den Offline-Ablauf über HTTP.
 *
 * <p>Offline wird simuliert, indem der Upstream Verbindungen ohne Antwort schließt.</p>
 */
class EngineEndToEndTest {

    private static final AtomicBoolean UPSTREAM_OFFLINE = new AtomicBoolean();
    private static final List<String> RECEIVED_MUTATIONS = new CopyOnWriteArrayList<>();

    private static HttpServer upstream;
    private static ConfigurableApplicationContext engineCtx;
    private static String engineBase;
    private static final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

    @BeforeAll
    static void startEngine() throws Exception {
        upstream = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        upstream.createContext("/", exchange -> {
            if (UPSTREAM_OFFLINE.get()) {
                exchange.close();
                return;
            }
            String path = exchange.getRequestURI().getPath();
            byte[] requestBody = exchange.getRequestBody().readAllBytes();
            int status = 200;
            String body;
            if ("GET".equals(exchange.getRequestMethod())) {
                body = path.equals("/offline-api.json") ? "{\"offline\":true}" : "content of " + path;
            } else {
                RECEIVED_MUTATIONS.add(exchange.getRequestMethod() + " " + path + " "
                        + new String(requestBody, StandardCharsets.UTF_8));
                status = 201;
                body = "{\"saved\":true}";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        upstream.start();

        engineCtx = new SpringApplicationBuilder(EngineApp.class)
                .properties(
                        "server.port=0",
                        "engine.storage.type=memory",
                        "engine.upstream.base-url=http://127.0.0.1:" + upstream.getAddress().getPort(),
                        "engine.network.timeout-ms=2000",
                        "engine.network.mutation-timeout-ms=2000")
                .run();
        engineBase = "http://localhost:" + engineCtx.getEnvironment().getProperty("local.server.port");
    }

    @AfterAll
    static void stopEngine() {
        if (engineCtx != null) {
            engineCtx.close();
            engineCtx = null;
        }
        if (upstream != null) {
            upstream.stop(0);
        }
    }

    @Test
    @DisplayName("Offline: Cache, Fallback und Sync-Queue; online: automatisches Replay")
    void offlineFlowShouldServeCacheFallbackAndReplayQueuedMutations() throws Exception {
        HttpResponse<String> online = get("/api/items");
        assertEquals(200, online.statusCode());
        assertEquals("MISS", online.headers().firstValue("X-Cache").orElse(""));

        UPSTREAM_OFFLINE.set(true);
        try {
            HttpResponse<String> cached = get("/api/items");
            assertEquals("HIT", cached.headers().firstValue("X-Cache").orElse(""));
            assertEquals("content of /api/items", cached.body());

            HttpResponse<String> fallback = get("/api/never-seen");
            assertEquals("FALLBACK", fallback.headers().firstValue("X-Cache").orElse(""));
            assertEquals("{\"offline\":true}", fallback.body());

            HttpResponse<String> queued = send(HttpRequest.newBuilder(URI.create(engineBase + "/api/items"))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString("{\"name\":\"offline-item\"}"))
                    .build());
            assertEquals(202, queued.statusCode());
            assertTrue(get("/_engine/sync/pending").body().contains("/api/items"));
        } finally {
            UPSTREAM_OFFLINE.set(false);
        }

        // Erste erfolgreiche Antwort schaltet auf online und stößt das Replay an
        get("/api/items");
        long deadline = System.currentTimeMillis() + 5_000;
        while (!"[]".equals(get("/_engine/sync/pending").body()) && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }

        assertEquals("[]", get("/_engine/sync/pending").body());
        assertTrue(RECEIVED_MUTATIONS.contains("POST /api/items {\"name\":\"offline-item\"}"), RECEIVED_MUTATIONS.toString());
    }

    @Test
    void cacheStatsMessageShouldListPrecachedResources() throws Exception {
        HttpResponse<String> reply = send(HttpRequest.newBuilder(URI.create(engineBase + "/_engine/messages"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(
                        "{\"correlationId\":\"e2e-1\",\"type\":\"GET_CACHE_STATS\",\"data\":{}}"))
                .build());

        assertEquals(200, reply.statusCode());
        assertTrue(reply.body().contains("\"correlationId\":\"e2e-1\""), reply.body());
        assertTrue(reply.body().contains("mini-offline-v1-static"), reply.body());
        assertTrue(reply.body().contains("/offline.html"), reply.body());
    }

    @Test
    void probesShouldReportReadyEngine() throws Exception {
        assertEquals("ok", get("/_engine/health").body());
        assertEquals("ready", get("/_engine/ready").body());
        assertTrue(get("/_engine/releases/active").body().contains("\"storePrefix\":\"mini-offline-v1-\""));
    }

    private static HttpResponse<String> get(String path) throws Exception {
        return send(HttpRequest.newBuilder(URI.create(engineBase + path)).GET().build());
    }

    private static HttpResponse<String> send(HttpRequest request) throws Exception {
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
