package de.htwsaar.minioffline.cli.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.minioffline.common.serialization.JacksonCodec;

public final class JsonUtils {
    private JsonUtils() {}

    /**
     * Rückt JSON für die Konsolenausgabe ein. Alles, was kein JSON ist, wird unverändert zurückgegeben.
     */
    public static String formatJson(String json) {
        if (json == null) return "";
        String trimmed = json.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return json;
        }
        try {
            JsonNode tree = JacksonCodec.mapper().readTree(trimmed);
            return JacksonCodec.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            return json;
        }
    }

    /** Rückt ein beliebiges Objekt als JSON ein. */
    public static String formatObject(Object value) {
        return formatJson(JacksonCodec.toJson(value));
    }
}
