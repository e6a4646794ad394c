package de.htwsaar.minioffline.common.messaging;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host-seitiger Request/Response-Kanal zur Engine auf Basis von Correlation-IDs.
 *
 * <p>Jede Anfrage erhält genau eine Antwort oder scheitert nach {@code timeout}
 * mit {@link MessageTimeoutException}. Verspätete oder doppelte Antworten werden verworfen.</p>
 */
public final class CorrelatingMessenger {

    private static final Logger log = LoggerFactory.getLogger(CorrelatingMessenger.class);

    /** Standardfrist für eine Antwort der Engine. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final MessageTransport transport;
    private final Duration timeout;
    private final Supplier<String> idGenerator;
    private final Map<String, CompletableFuture<EngineReply>> pending = new ConcurrentHashMap<>();

    /**
     * Erstellt den Messenger mit Standard-Timeout und UUID-Correlation-IDs.
     *
     * @param transport Transport zur Engine
     */
    public CorrelatingMessenger(MessageTransport transport) {
        this(transport, DEFAULT_TIMEOUT, () -> UUID.randomUUID().toString());
    }

    /**
     * Erstellt den Messenger mit expliziter Frist und ID-Erzeugung (nützlich für Tests).
     *
     * @param transport   Transport zur Engine
     * @param timeout     Antwortfrist
     * @param idGenerator Quelle für Correlation-IDs
     */
    public CorrelatingMessenger(MessageTransport transport, Duration timeout, Supplier<String> idGenerator) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    /**
     * Sendet eine Nachricht und liefert die zugehörige Antwort asynchron.
     *
     * @param type Nachrichtentyp
     * @param data Nutzdaten (darf {@code null} sein)
     * @return Future mit der Antwort; scheitert mit {@link MessageTimeoutException} nach Fristablauf
     */
    public CompletableFuture<EngineReply> send(MessageType type, Map<String, Object> data) {
        String correlationId = idGenerator.get();
        CompletableFuture<EngineReply> inFlight = new CompletableFuture<>();
        CompletableFuture<EngineReply> result = new CompletableFuture<>();
        pending.put(correlationId, inFlight);

        inFlight.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((reply, ex) -> {
            pending.remove(correlationId);
            if (ex == null) {
                result.complete(reply);
                return;
            }
            Throwable cause = unwrap(ex);
            if (cause instanceof TimeoutException) {
                result.completeExceptionally(new MessageTimeoutException(type, correlationId, timeout));
            } else {
                result.completeExceptionally(cause);
            }
        });

        try {
            transport.post(new EngineMessage(correlationId, type, data), this::onReply);
        } catch (RuntimeException ex) {
            inFlight.completeExceptionally(ex);
        }
        return result;
    }

    /**
     * Blockierende Variante von {@link #send(MessageType, Map)}.
     *
     * @param type Nachrichtentyp
     * @param data Nutzdaten
     * @return Antwort der Engine
     * @throws MessageTimeoutException wenn keine Antwort innerhalb der Frist eintrifft
     */
    public EngineReply sendAndWait(MessageType type, Map<String, Object> data) {
        try {
            return send(type, data).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + type, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Message " + type + " failed", cause);
        }
    }

    /**
     * Nimmt eine Antwort des Transports entgegen und ordnet sie per Correlation-ID zu.
     *
     * @param reply Antwort der Engine
     */
    public void onReply(EngineReply reply) {
        if (reply == null || reply.correlationId() == null) return;
        CompletableFuture<EngineReply> waiting = pending.remove(reply.correlationId());
        if (waiting == null) {
            log.debug("Ignoring late or unknown reply {}", reply.correlationId());
            return;
        }
        waiting.complete(reply);
    }

    /**
     * Anzahl noch offener Anfragen.
     *
     * @return offene Anfragen
     */
    public int pendingCount() {
        return pending.size();
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }
}
