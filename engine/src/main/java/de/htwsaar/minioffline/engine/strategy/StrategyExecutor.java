package de.htwsaar.minioffline.engine.strategy;

import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Führt genau eine Caching-Strategie aus.
 */
public interface StrategyExecutor {

    /** @return umgesetzte Strategie */
    Strategy strategy();

    /**
     * Beantwortet die Anfrage gemäß der Strategie.
     *
     * @param request   Anfrage (GET)
     * @param storeName versionsqualifizierter Ziel-Store
     * @return Future mit der Antwort; scheitert mit {@link de.htwsaar.minioffline.engine.domain.NetworkException}
     *         oder {@link CacheMissException}
     */
    CompletableFuture<ResourceResponse> execute(ResourceRequest request, String storeName);
}
