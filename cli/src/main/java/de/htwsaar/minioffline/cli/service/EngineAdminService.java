package de.htwsaar.minioffline.cli.service;

import de.htwsaar.minioffline.cli.dto.HttpCallResult;
import de.htwsaar.minioffline.cli.util.HttpUtils;
import de.htwsaar.minioffline.cli.util.UriUtils;
import de.htwsaar.minioffline.common.serialization.JacksonCodec;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * REST-Aufrufe gegen die Verwaltungsendpunkte der Engine ({@code /_engine/...}).
 */
public final class EngineAdminService {

    private final HttpClient httpClient;
    private final URI baseUrl;
    private final Duration timeout;

    public EngineAdminService(HttpClient httpClient, URI baseUrl, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public HttpCallResult health() {
        return get("_engine/health");
    }

    public HttpCallResult ready() {
        return get("_engine/ready");
    }

    /**
     * @param windowSec Zeitfenster der Request-Rate in Sekunden
     */
    public HttpCallResult stats(int windowSec) {
        return get("_engine/stats?windowSec=" + windowSec);
    }

    /** Aktive und ggf. wartende Version. */
    public HttpCallResult activeRelease() {
        return get("_engine/releases/active");
    }

    /**
     * Installiert eine neue Version.
     *
     * @param releaseJson Release-Konfiguration als JSON
     */
    public HttpCallResult installRelease(String releaseJson) {
        return post("_engine/releases", releaseJson);
    }

    public HttpCallResult pendingMutations() {
        return get("_engine/sync/pending");
    }

    public HttpCallResult abandonedMutations() {
        return get("_engine/sync/abandoned");
    }

    public HttpCallResult discardAbandoned(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        HttpRequest request = builder("_engine/sync/abandoned/" + URLEncoder.encode(id, StandardCharsets.UTF_8))
                .DELETE()
                .build();
        return HttpUtils.sendForStringBody(httpClient, request);
    }

    public HttpCallResult replaySync() {
        return post("_engine/sync/replay", "");
    }

    /**
     * Stellt eine Push-Nachricht zu.
     *
     * @param title Titel
     * @param body Text
     * @param url optionales Ziel beim Klick
     */
    public HttpCallResult push(String title, String body, String url) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("body", body);
        if (url != null && !url.isBlank()) {
            payload.put("data", Map.of("url", url));
        }
        return post("_engine/push", JacksonCodec.toJson(payload));
    }

    private HttpCallResult get(String path) {
        return HttpUtils.sendForStringBody(httpClient, builder(path).GET().build());
    }

    private HttpCallResult post(String path, String json) {
        return HttpUtils.sendForStringBody(httpClient, HttpUtils.jsonPost(builder(path), json));
    }

    private HttpRequest.Builder builder(String path) {
        return HttpRequest.newBuilder(UriUtils.resolve(baseUrl, path)).timeout(timeout);
    }
}
