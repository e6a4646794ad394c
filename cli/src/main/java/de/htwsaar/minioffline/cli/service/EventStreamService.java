package de.htwsaar.minioffline.cli.service;

import de.htwsaar.minioffline.cli.util.UriUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Liest den Server-Sent-Events-Strom {@code GET /_engine/events}.
 *
 * <p>Ein Ereignis endet mit einer Leerzeile; {@code event:} liefert den Typ, {@code data:} den JSON-Inhalt.
 * Mehrere {@code data:}-Zeilen werden mit Zeilenumbruch zusammengefügt.</p>
 */
public final class EventStreamService {

    /** Ein empfangenes Ereignis. */
    public record StreamedEvent(String name, String data) {}

    private final HttpClient httpClient;
    private final URI eventsUri;

    public EventStreamService(HttpClient httpClient, URI baseUrl) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.eventsUri = UriUtils.resolve(Objects.requireNonNull(baseUrl, "baseUrl must not be null"), "_engine/events");
    }

    /**
     * Blockiert, bis {@code limit} Ereignisse empfangen wurden oder der Strom endet.
     *
     * @param limit maximale Anzahl Ereignisse, {@code 0} = unbegrenzt
     * @param sink Empfänger je Ereignis
     * @return Anzahl empfangener Ereignisse
     * @throws IOException wenn die Verbindung scheitert oder der Status nicht 200 ist
     * @throws InterruptedException bei Unterbrechung
     */
    public int watch(int limit, Consumer<StreamedEvent> sink) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(eventsUri)
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> resp = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        if (resp.statusCode() != 200) {
            resp.body().close();
            throw new IOException("Event stream returned HTTP " + resp.statusCode());
        }

        int received = 0;
        try (Stream<String> lines = resp.body()) {
            Iterator<String> it = lines.iterator();
            String name = null;
            StringBuilder data = new StringBuilder();
            while (it.hasNext()) {
                String line = it.next();
                if (line.isEmpty()) {
                    if (data.length() > 0) {
                        sink.accept(new StreamedEvent(name == null ? "message" : name, data.toString()));
                        received++;
                        if (limit > 0 && received >= limit) {
                            break;
                        }
                    }
                    name = null;
                    data.setLength(0);
                } else if (line.startsWith("event:")) {
                    name = line.substring("event:".length()).trim();
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) data.append('\n');
                    data.append(line.substring("data:".length()).trim());
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return received;
    }
}
