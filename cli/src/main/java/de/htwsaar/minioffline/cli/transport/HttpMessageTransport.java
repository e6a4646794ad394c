package de.htwsaar.minioffline.cli.transport;

import de.htwsaar.minioffline.cli.util.HttpUtils;
import de.htwsaar.minioffline.cli.util.UriUtils;
import de.htwsaar.minioffline.common.messaging.EngineMessage;
import de.htwsaar.minioffline.common.messaging.EngineReply;
import de.htwsaar.minioffline.common.messaging.MessageTransport;
import de.htwsaar.minioffline.common.serialization.JacksonCodec;
import de.htwsaar.minioffline.common.serialization.MiniOfflineSerializationException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stellt Nachrichten per {@code POST /_engine/messages} zu.
 *
 * <p>Transportfehler und Nicht-2xx-Antworten werden als fehlgeschlagene {@link EngineReply}
 * mit der Correlation-ID der Nachricht gemeldet, damit der Aufrufer nicht erst in den Timeout läuft.</p>
 */
public final class HttpMessageTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpMessageTransport.class);

    private final HttpClient httpClient;
    private final URI messagesUri;
    private final Duration requestTimeout;

    public HttpMessageTransport(HttpClient httpClient, URI engineBaseUrl, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.messagesUri = UriUtils.resolve(Objects.requireNonNull(engineBaseUrl, "engineBaseUrl must not be null"),
                "_engine/messages");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    @Override
    public void post(EngineMessage message, Consumer<EngineReply> replySink) {
        HttpRequest request = HttpUtils.jsonPost(
                HttpRequest.newBuilder(messagesUri).timeout(requestTimeout), JacksonCodec.toJson(message));

        httpClient
                .sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .whenComplete((resp, ex) -> replySink.accept(toReply(message, resp, ex)));
    }

    private static EngineReply toReply(EngineMessage message, HttpResponse<String> resp, Throwable ex) {
        String id = message.correlationId();
        if (ex != null) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.debug("Posting {} failed: {}", message.type(), cause.toString());
            return EngineReply.failure(id, "transport error: " + cause.getMessage());
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            return EngineReply.failure(id, "HTTP " + resp.statusCode());
        }
        try {
            return JacksonCodec.fromJson(resp.body(), EngineReply.class);
        } catch (MiniOfflineSerializationException e) {
            return EngineReply.failure(id, "malformed reply");
        }
    }
}
