package de.htwsaar.minioffline.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Ordnet jede Anfrage an die Engine einer Trace-ID und einem Kanal zu.
 *
 * <p>Kanal {@value #CHANNEL_CONTROL} für Host-Nachrichten, Releases, Events und Stats unter dem
 * Steuerpfad, {@value #CHANNEL_PROXY} für alle abgefangenen Ressourcen-Anfragen. Eine vom Host
 * mitgeschickte Trace-ID wird nur übernommen, wenn sie {@link #ACCEPTED_TRACE_ID} entspricht;
 * sonst wird eine neue erzeugt. Beide Werte liegen während der Anfrage im MDC.</p>
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** Schlüsselname des Kanals im Logging-Kontext */
    public static final String CHANNEL_KEY = "channel";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen und in den sie gespiegelt wird */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    public static final String CHANNEL_CONTROL = "control";
    public static final String CHANNEL_PROXY = "proxy";

    /** Zulässige Trace-IDs von außen. */
    public static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private final String controlPathPrefix;

    /**
     * @param controlPathPrefix Pfadpräfix der Steuerendpunkte, z. B. {@code /_engine/}
     */
    public TraceIdFilter(String controlPathPrefix) {
        this.controlPathPrefix = Objects.requireNonNull(controlPathPrefix, "controlPathPrefix must not be null");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = request.getHeader(TRACE_ID_HEADER);
        if (traceId == null || !ACCEPTED_TRACE_ID.matcher(traceId).matches()) {
            traceId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(CHANNEL_KEY, channelOf(request));
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(CHANNEL_KEY);
        }
    }

    String channelOf(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path != null && path.startsWith(controlPathPrefix) ? CHANNEL_CONTROL : CHANNEL_PROXY;
    }
}
