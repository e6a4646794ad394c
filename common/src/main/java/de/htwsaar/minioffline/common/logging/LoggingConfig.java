package de.htwsaar.minioffline.common.logging;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registriert den {@link TraceIdFilter} der Engine.
 *
 * <p>{@code minioffline.logging.control-path} legt fest, welche Anfragen als Steuerkanal
 * geloggt werden (Standard {@code /_engine/}).</p>
 */
@Configuration
public class LoggingConfig {

    public static final String DEFAULT_CONTROL_PATH = "/_engine/";

    @Bean
    public TraceIdFilter traceIdFilter(
            @Value("${minioffline.logging.control-path:" + DEFAULT_CONTROL_PATH + "}") String controlPath) {
        return new TraceIdFilter(controlPath.endsWith("/") ? controlPath : controlPath + "/");
    }
}
