package de.htwsaar.minioffline.engine;

import de.htwsaar.minioffline.engine.cache.CacheStoreConfig;
import de.htwsaar.minioffline.engine.fallback.FallbackMapping;
import de.htwsaar.minioffline.engine.lifecycle.EngineRelease;
import de.htwsaar.minioffline.engine.routing.RouteStrategyMapping;
import de.htwsaar.minioffline.engine.strategy.Strategy;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tabellen der konfigurierten Engine-Version aus {@code application.yml} (Präfix {@code engine}).
 * Einzelwerte wie Timeouts werden in {@link EngineBeans} per {@code @Value} gelesen.
 */
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private String cachePrefix = "mini-offline";
    private int version = 1;
    private String defaultStore = "static";
    private List<Store> stores = new ArrayList<>();
    private List<Route> routes = new ArrayList<>();
    private List<Fallback> fallbacks = new ArrayList<>();
    private List<String> precache = new ArrayList<>();

    /**
     * Wandelt die Properties in ein unveränderliches Release.
     *
     * @return Release der konfigurierten Version
     */
    public EngineRelease toRelease() {
        List<CacheStoreConfig> storeConfigs = new ArrayList<>();
        for (Store s : stores) {
            storeConfigs.add(new CacheStoreConfig(s.getName(), s.getMaxEntries(), s.getMaxAgeSeconds()));
        }
        List<RouteStrategyMapping> routeMappings = new ArrayList<>();
        for (Route r : routes) {
            routeMappings.add(new RouteStrategyMapping(r.getPrefix(), Strategy.fromId(r.getStrategy()), r.getStore()));
        }
        List<FallbackMapping> fallbackMappings = new ArrayList<>();
        for (Fallback f : fallbacks) {
            fallbackMappings.add(new FallbackMapping(f.getPrefix(), f.getResource()));
        }
        return new EngineRelease(version, storeConfigs, routeMappings, defaultStore, fallbackMappings, precache);
    }

    public String getCachePrefix() {
        return cachePrefix;
    }

    public void setCachePrefix(String cachePrefix) {
        this.cachePrefix = cachePrefix;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public String getDefaultStore() {
        return defaultStore;
    }

    public void setDefaultStore(String defaultStore) {
        this.defaultStore = defaultStore;
    }

    public List<Store> getStores() {
        return stores;
    }

    public void setStores(List<Store> stores) {
        this.stores = stores;
    }

    public List<Route> getRoutes() {
        return routes;
    }

    public void setRoutes(List<Route> routes) {
        this.routes = routes;
    }

    public List<Fallback> getFallbacks() {
        return fallbacks;
    }

    public void setFallbacks(List<Fallback> fallbacks) {
        this.fallbacks = fallbacks;
    }

    public List<String> getPrecache() {
        return precache;
    }

    public void setPrecache(List<String> precache) {
        this.precache = precache;
    }

    /** Ein Cache-Store. */
    public static class Store {
        private String name;
        private int maxEntries;
        private long maxAgeSeconds;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public long getMaxAgeSeconds() {
            return maxAgeSeconds;
        }

        public void setMaxAgeSeconds(long maxAgeSeconds) {
            this.maxAgeSeconds = maxAgeSeconds;
        }
    }

    /** Eine Route: Präfix → Strategie und Store. */
    public static class Route {
        private String prefix;
        private String strategy;
        private String store;

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }
    }

    /** Ein Offline-Fallback: Präfix → Ressource. */
    public static class Fallback {
        private String prefix;
        private String resource;

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getResource() {
            return resource;
        }

        public void setResource(String resource) {
            this.resource = resource;
        }
    }
}
