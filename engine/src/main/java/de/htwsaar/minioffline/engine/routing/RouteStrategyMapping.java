package de.htwsaar.minioffline.engine.routing;

import de.htwsaar.minioffline.engine.strategy.Strategy;
import java.util.Objects;

/**
 * Eine Zeile der Routentabelle.
 *
 * @param pathPrefix Pfad-Präfix, z. B. {@code /api/}
 * @param strategy   Strategie für passende Anfragen
 * @param storeName  Store-Name ohne Versionspräfix
 */
public record RouteStrategyMapping(String pathPrefix, Strategy strategy, String storeName) {

    public RouteStrategyMapping {
        Objects.requireNonNull(pathPrefix, "pathPrefix must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(storeName, "storeName must not be null");
    }
}
