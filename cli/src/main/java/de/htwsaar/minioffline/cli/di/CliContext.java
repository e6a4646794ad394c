package de.htwsaar.minioffline.cli.di;

import java.io.PrintWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import org.jline.terminal.Terminal;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Bündelt Terminal, Ausgabekanäle, den HTTP-Client und die Basisadresse der Engine.
 * Fachliche Services gehören nicht hierher; Commands bauen sie aus diesen Bausteinen.
 */
public final class CliContext {

    /** Umgebungsvariable für die Engine-Adresse. */
    public static final String ENGINE_URL_ENV = "MINIOFFLINE_ENGINE_URL";

    /** System-Property für die Engine-Adresse (Vorrang vor der Umgebungsvariable). */
    public static final String ENGINE_URL_PROPERTY = "minioffline.engine.url";

    public static final String DEFAULT_ENGINE_URL = "http://localhost:8080";

    private final Terminal terminal;
    private final PrintWriter out;
    private final PrintWriter err;
    private final HttpClient httpClient;
    private final Duration defaultRequestTimeout;
    private final URI engineBaseUrl;

    /**
     * @param terminal JLine-Terminal für die interaktive Shell
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param httpClient gemeinsamer HTTP-Client
     * @param defaultRequestTimeout Standard-Timeout für Requests und Nachrichten
     * @param engineBaseUrl Basisadresse der Engine
     */
    public CliContext(
            Terminal terminal,
            PrintWriter out,
            PrintWriter err,
            HttpClient httpClient,
            Duration defaultRequestTimeout,
            URI engineBaseUrl) {
        this.terminal = Objects.requireNonNull(terminal, "terminal");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.defaultRequestTimeout = Objects.requireNonNull(defaultRequestTimeout, "defaultRequestTimeout");
        this.engineBaseUrl = Objects.requireNonNull(engineBaseUrl, "engineBaseUrl");
    }

    /**
     * Ermittelt die Engine-Adresse: System-Property, dann Umgebungsvariable, dann {@link #DEFAULT_ENGINE_URL}.
     *
     * @return Basisadresse
     */
    public static URI resolveEngineBaseUrl() {
        String raw = System.getProperty(ENGINE_URL_PROPERTY);
        if (raw == null || raw.isBlank()) {
            raw = System.getenv(ENGINE_URL_ENV);
        }
        if (raw == null || raw.isBlank()) {
            raw = DEFAULT_ENGINE_URL;
        }
        return URI.create(raw.trim());
    }

    public Terminal terminal() {
        return terminal;
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public Duration defaultRequestTimeout() {
        return defaultRequestTimeout;
    }

    public URI engineBaseUrl() {
        return engineBaseUrl;
    }
}
