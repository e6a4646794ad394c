package de.htwsaar.minioffline.engine.web;

import de.htwsaar.minioffline.common.serialization.JacksonCodec;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import de.htwsaar.minioffline.engine.service.RequestInterceptor;
import de.htwsaar.minioffline.engine.service.ResourceUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter für abgefangene Anfragen: alles außerhalb von {@code /_engine/**}.
 *
 * <p>Kein Fachcode hier – nur HTTP-Mapping und Fehlerbehandlung.</p>
 */
@RestController
public class EngineProxyController {

    static final String X_CACHE = "X-Cache";
    static final String ENGINE_PREFIX = "/_engine/";

    private static final Set<String> SKIPPED_RESPONSE_HEADERS = Set.of("content-length", "transfer-encoding", "connection");

    private final RequestInterceptor interceptor;

    /**
     * Constructor Injection.
     *
     * @param interceptor fachlicher Einstiegspunkt
     */
    public EngineProxyController(RequestInterceptor interceptor) {
        this.interceptor = interceptor;
    }

    /**
     * Beantwortet eine beliebige Anfrage über die Engine.
     *
     * @param servletRequest eingehende Anfrage
     * @return Antwort mit {@code X-Cache}-Header
     * @throws IOException wenn der Body nicht gelesen werden kann
     */
    @RequestMapping("/**")
    public CompletableFuture<ResponseEntity<byte[]>> intercept(HttpServletRequest servletRequest) throws IOException {
        String path = servletRequest.getRequestURI();
        if (path.startsWith(ENGINE_PREFIX)) {
            return CompletableFuture.completedFuture(ResponseEntity.notFound().build());
        }
        ResourceRequest request = toResourceRequest(servletRequest);
        return interceptor.handle(request).handle((resp, ex) -> {
            if (ex == null) {
                return toEntity(resp);
            }
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof ResourceUnavailableException) {
                return errorEntity((ResourceUnavailableException) cause);
            }
            throw cause instanceof RuntimeException ? (RuntimeException) cause : new CompletionException(cause);
        });
    }

    private static ResourceRequest toResourceRequest(HttpServletRequest req) throws IOException {
        String target = req.getRequestURI() + (req.getQueryString() != null ? "?" + req.getQueryString() : "");
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(req.getHeaderNames())) {
            headers.put(name, Collections.list(req.getHeaders(name)));
        }
        return new ResourceRequest(req.getMethod(), target, headers, req.getInputStream().readAllBytes());
    }

    private static ResponseEntity<byte[]> toEntity(ResourceResponse resp) {
        HttpHeaders h = new HttpHeaders();
        resp.headers().forEach((name, values) -> {
            if (!SKIPPED_RESPONSE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                h.put(name, values);
            }
        });
        h.set(X_CACHE, resp.source().headerValue());
        return ResponseEntity.status(resp.status()).headers(h).body(resp.body());
    }

    private static ResponseEntity<byte[]> errorEntity(ResourceUnavailableException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("url", ex.getUrl());
        body.put("strategy", ex.getStrategy() != null ? ex.getStrategy().id() : null);
        body.put("reason", ex.getReason().name());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(ex.getStatusCode())
                .contentType(MediaType.APPLICATION_JSON)
                .body(JacksonCodec.toBytes(body));
    }
}
