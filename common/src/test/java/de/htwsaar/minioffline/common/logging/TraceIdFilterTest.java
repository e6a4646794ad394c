package de.htwsaar.minioffline.common.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import jakarta.servlet.ServletException;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Tests für {@link TraceIdFilter}: Trace-ID und Kanal im MDC während der Anfrage, Spiegelung im
 * Response-Header und Aufräumen danach.
 */
class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter("/_engine/");

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void shouldPropagateIncomingTraceIdToMdcAndResponse() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/dashboard/summary");
        MockHttpServletResponse response = new MockHttpServletResponse();
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "host-42");
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, resp) -> seen.set(MDC.get(TraceIdFilter.TRACE_ID_KEY)));

        assertEquals("host-42", seen.get());
        assertEquals("host-42", response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
        assertNull(MDC.get(TraceIdFilter.TRACE_ID_KEY));
    }

    @Test
    void shouldGenerateUuidForMissingOrBlankHeader() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/_engine/messages");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "  ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, resp) -> seen.set(MDC.get(TraceIdFilter.TRACE_ID_KEY)));

        assertNotNull(UUID.fromString(seen.get()));
        assertEquals(seen.get(), response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
    }

    @Test
    void shouldReplaceStaleMdcValueAndClearItWhenChainFails() {
        MDC.put(TraceIdFilter.TRACE_ID_KEY, "stale");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/static/app.js");
        MockHttpServletResponse response = new MockHttpServletResponse();

        RuntimeException thrown = assertThrows(
                RuntimeException.class,
                () -> filter.doFilter(request, response, (req, resp) -> {
                    assertNotEquals("stale", MDC.get(TraceIdFilter.TRACE_ID_KEY));
                    throw new RuntimeException("upstream exploded");
                }));

        assertEquals("upstream exploded", thrown.getMessage());
        assertNull(MDC.get(TraceIdFilter.TRACE_ID_KEY));
    }

    @Test
    void shouldTagControlAndProxyChannels() throws ServletException, IOException {
        AtomicReference<String> control = new AtomicReference<>();
        AtomicReference<String> proxy = new AtomicReference<>();

        filter.doFilter(new MockHttpServletRequest("POST", "/_engine/messages"), new MockHttpServletResponse(),
                (req, resp) -> control.set(MDC.get(TraceIdFilter.CHANNEL_KEY)));
        filter.doFilter(new MockHttpServletRequest("GET", "/_engineering/notes.html"), new MockHttpServletResponse(),
                (req, resp) -> proxy.set(MDC.get(TraceIdFilter.CHANNEL_KEY)));

        assertEquals(TraceIdFilter.CHANNEL_CONTROL, control.get());
        assertEquals(TraceIdFilter.CHANNEL_PROXY, proxy.get());
        assertNull(MDC.get(TraceIdFilter.CHANNEL_KEY));
    }

    @Test
    void shouldReplaceTraceIdsThatCouldForgeLogLines() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/items");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "abc\n2026-01-01 INFO fake entry");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, resp) -> seen.set(MDC.get(TraceIdFilter.TRACE_ID_KEY)));

        assertNotNull(UUID.fromString(seen.get()));
        assertEquals(seen.get(), response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
    }

    @Test
    void loggingConfigShouldNormalizeControlPath() throws ServletException, IOException {
        TraceIdFilter configured = new LoggingConfig().traceIdFilter("/control");
        AtomicReference<String> channel = new AtomicReference<>();

        configured.doFilter(new MockHttpServletRequest("GET", "/control/stats"), new MockHttpServletResponse(),
                (req, resp) -> channel.set(MDC.get(TraceIdFilter.CHANNEL_KEY)));

        assertEquals(TraceIdFilter.CHANNEL_CONTROL, channel.get());
        assertNotEquals(new LoggingConfig().traceIdFilter("/x"), new LoggingConfig().traceIdFilter("/x"));
    }
}
