package de.htwsaar.minioffline.engine.routing;

import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.strategy.Strategy;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Wählt die Strategie einer Anfrage.
 *
 * <p>Regel: längster passender Prefix gewinnt; Fallback ist {@code network-first} in den
 * Default-Store. Nur GET wird über die Tabelle geroutet, HEAD und OPTIONS gehen
 * {@code network-only} ans Netz. Die Tabelle ist unveränderlich.</p>
 */
public final class StrategyRouter {

    private final List<RouteStrategyMapping> routes;
    private final String defaultStore;

    /**
     * @param routes       Routentabelle
     * @param defaultStore Store für nicht gemappte Pfade
     */
    public StrategyRouter(List<RouteStrategyMapping> routes, String defaultStore) {
        this.routes = List.copyOf(Objects.requireNonNull(routes, "routes must not be null"));
        this.defaultStore = Objects.requireNonNull(defaultStore, "defaultStore must not be null");
    }

    /**
     * Bestimmt Strategie und Store.
     *
     * @param request Anfrage (nicht mutierend)
     * @return Entscheidung
     * @throws IllegalArgumentException für mutierende Methoden
     */
    public RouteDecision route(ResourceRequest request) {
        if (request.isMutating()) {
            throw new IllegalArgumentException(request.method() + " requests bypass the strategy router");
        }
        if (!"GET".equals(request.method())) {
            return new RouteDecision(Strategy.NETWORK_ONLY, defaultStore, null);
        }
        String path = request.path();
        return routes.stream()
                .filter(r -> path.startsWith(r.pathPrefix()))
                .max(Comparator.comparingInt(r -> r.pathPrefix().length()))
                .map(r -> new RouteDecision(r.strategy(), r.storeName(), r.pathPrefix()))
                .orElse(new RouteDecision(Strategy.NETWORK_FIRST, defaultStore, null));
    }

    /** @return Routentabelle */
    public List<RouteStrategyMapping> routes() {
        return routes;
    }

    public String defaultStore() {
        return defaultStore;
    }
}
