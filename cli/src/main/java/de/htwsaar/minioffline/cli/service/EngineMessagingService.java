package de.htwsaar.minioffline.cli.service;

import de.htwsaar.minioffline.common.messaging.CorrelatingMessenger;
import de.htwsaar.minioffline.common.messaging.EngineReply;
import de.htwsaar.minioffline.common.messaging.MessageType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fachliche Nachrichten an die Engine über einen {@link CorrelatingMessenger}.
 * Jede Methode blockiert bis zur Antwort oder bis zum Timeout des Messengers.
 */
public final class EngineMessagingService {

    private final CorrelatingMessenger messenger;

    public EngineMessagingService(CorrelatingMessenger messenger) {
        this.messenger = Objects.requireNonNull(messenger, "messenger must not be null");
    }

    /** @return Antwort mit {@code {storeName: {size, urls}}} */
    public EngineReply cacheStats() {
        return messenger.sendAndWait(MessageType.GET_CACHE_STATS, Map.of());
    }

    /**
     * @param cacheName Store-Name oder {@code null} für alle Stores
     */
    public EngineReply clearCache(String cacheName) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (cacheName != null && !cacheName.isBlank()) {
            data.put("cacheName", cacheName);
        }
        return messenger.sendAndWait(MessageType.CLEAR_CACHE, data);
    }

    /**
     * @param urls in den Default-Store zu ladende URLs
     */
    public EngineReply cacheUrls(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new IllegalArgumentException("at least one url is required");
        }
        return messenger.sendAndWait(MessageType.CACHE_URLS, Map.of("urls", List.copyOf(urls)));
    }

    public EngineReply skipWaiting() {
        return messenger.sendAndWait(MessageType.SKIP_WAITING, Map.of());
    }
}
