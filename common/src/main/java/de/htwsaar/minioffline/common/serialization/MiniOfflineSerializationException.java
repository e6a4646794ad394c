package de.htwsaar.minioffline.common.serialization;

public class MiniOfflineSerializationException extends RuntimeException {

    public MiniOfflineSerializationException(String message) {

        super(message);
    }

    public MiniOfflineSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
