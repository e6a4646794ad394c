package de.htwsaar.minioffline.engine.adapter.http;

import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.NetworkException;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.domain.ResponseSource;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP-Adapter zum Upstream-Server via {@link HttpClient}.
 *
 * <p>Enthält alle HTTP-Details (Headerfilter, URL-Bau, Fehlerabbildung).
 * Die Strategien hängen ausschließlich am {@link NetworkClient}-Port.</p>
 */
public final class HttpNetworkClient implements NetworkClient {

    /** Header, die der JDK-Client selbst setzt oder verbietet, plus Hop-by-Hop-Header. */
    private static final Set<String> SKIPPED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade", "keep-alive",
            "transfer-encoding", "te", "trailer", "proxy-connection", "http2-settings");

    private final HttpClient httpClient;
    private final URI upstreamBaseUri;

    /**
     * @param httpClient      HTTP-Client (darf nicht {@code null} sein)
     * @param upstreamBaseUri Basis-URI des Upstreams, z. B. {@code http://localhost:8081}
     */
    public HttpNetworkClient(HttpClient httpClient, URI upstreamBaseUri) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.upstreamBaseUri = Objects.requireNonNull(upstreamBaseUri, "upstreamBaseUri must not be null");
    }

    @Override
    public CompletableFuture<ResourceResponse> fetch(ResourceRequest request, Duration timeout) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(request, timeout);
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .handle((resp, ex) -> {
                    if (ex != null) {
                        throw toNetworkException(request, ex);
                    }
                    return new ResourceResponse(
                            resp.statusCode(), copyHeaders(resp.headers().map()), resp.body(), ResponseSource.NETWORK);
                });
    }

    private HttpRequest buildRequest(ResourceRequest request, Duration timeout) {
        byte[] body = request.body();
        HttpRequest.BodyPublisher publisher = body.length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);
        HttpRequest.Builder b = HttpRequest.newBuilder(targetUri(request.target()))
                .timeout(timeout)
                .method(request.method(), publisher);
        request.headers().forEach((name, values) -> {
            if (!isSkipped(name)) {
                values.forEach(v -> b.header(name, v));
            }
        });
        return b.build();
    }

    /**
     * Baut die vollständige Upstream-URI für den gegebenen Pfad inkl. Query.
     * Schema und Authority stammen immer aus der Basis-URI; ein Ziel wie {@code //host/x} bleibt Pfad.
     */
    private URI targetUri(String target) {
        return URI.create(upstreamBaseUri.getScheme() + "://" + upstreamBaseUri.getRawAuthority() + target);
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> raw) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        raw.forEach((name, values) -> {
            if (!name.startsWith(":") && !isSkipped(name)) {
                out.put(name, List.copyOf(values));
            }
        });
        return out;
    }

    private static boolean isSkipped(String name) {
        return SKIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }

    private static NetworkException toNetworkException(ResourceRequest request, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof HttpTimeoutException) {
            return new NetworkException(NetworkException.Kind.TIMEOUT,
                    "Timed out fetching " + request.target(), cause);
        }
        if (cause instanceof IOException) {
            return new NetworkException(NetworkException.Kind.OFFLINE,
                    "Upstream unreachable for " + request.target() + ": " + cause.getMessage(), cause);
        }
        return new NetworkException(NetworkException.Kind.OFFLINE,
                "Fetching " + request.target() + " failed: " + cause, cause);
    }
}
