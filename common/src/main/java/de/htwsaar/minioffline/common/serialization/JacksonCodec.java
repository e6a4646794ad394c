package de.htwsaar.minioffline.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

public final class JacksonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        // Instants als ISO-String, unbekannte Felder älterer Versionen tolerieren
        MAPPER.registerModule(new JavaTimeModule());
        MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private JacksonCodec() {
        // Utility
    }

    /**
     * Gemeinsamer, vorkonfigurierter Mapper (z. B. für {@code readTree}).
     *
     * @return geteilte {@link ObjectMapper}-Instanz
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new MiniOfflineSerializationException("Failed to serialize object to the JSON format !", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new MiniOfflineSerializationException(
                    "Failed to deserialize JSON format to : [" + clazz.getSimpleName() + "]", e);
        }
    }

    /**
     * Serialisiert ein Objekt als UTF-8-JSON-Bytes (Format des Blob-Stores).
     *
     * @param obj zu serialisierendes Objekt
     * @return JSON-Bytes
     */
    public static byte[] toBytes(Object obj) {
        try {
            return MAPPER.writeValueAsBytes(obj);
        } catch (JsonProcessingException e) {
            throw new MiniOfflineSerializationException("Failed to serialize object to JSON bytes !", e);
        }
    }

    /**
     * Deserialisiert UTF-8-JSON-Bytes.
     *
     * @param bytes JSON-Bytes
     * @param clazz Zieltyp
     * @param <T>   Zieltyp
     * @return deserialisiertes Objekt
     */
    public static <T> T fromBytes(byte[] bytes, Class<T> clazz) {
        try {
            return MAPPER.readValue(bytes, clazz);
        } catch (IOException e) {
            throw new MiniOfflineSerializationException(
                    "Failed to deserialize JSON bytes to : [" + clazz.getSimpleName() + "]", e);
        }
    }
}
