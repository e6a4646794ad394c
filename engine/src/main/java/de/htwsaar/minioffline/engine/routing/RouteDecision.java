package de.htwsaar.minioffline.engine.routing;

import de.htwsaar.minioffline.engine.strategy.Strategy;

/**
 * Ergebnis des Routings.
 *
 * @param strategy      gewählte Strategie
 * @param storeName     Store-Name ohne Versionspräfix
 * @param matchedPrefix passendes Präfix oder {@code null} beim Default
 */
public record RouteDecision(Strategy strategy, String storeName, String matchedPrefix) {}
