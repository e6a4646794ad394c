package de.htwsaar.minioffline.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.htwsaar.minioffline.engine.lifecycle.EngineRelease;
import de.htwsaar.minioffline.engine.strategy.Strategy;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class EnginePropertiesTest {

    @Test
    void boundPropertiesShouldBecomeRelease() {
        Map<String, Object> source = new HashMap<>();
        source.put("engine.cache-prefix", "shop");
        source.put("engine.version", "7");
        source.put("engine.default-store", "static");
        source.put("engine.stores[0].name", "api");
        source.put("engine.stores[0].max-entries", "200");
        source.put("engine.stores[0].max-age-seconds", "300");
        source.put("engine.routes[0].prefix", "/api/");
        source.put("engine.routes[0].strategy", "network-first");
        source.put("engine.routes[0].store", "api");
        source.put("engine.routes[1].prefix", "/fonts/");
        source.put("engine.routes[1].strategy", "CACHE_FIRST");
        source.put("engine.routes[1].store", "fonts");
        source.put("engine.fallbacks[0].prefix", "/api/");
        source.put("engine.fallbacks[0].resource", "/offline-api.json");
        source.put("engine.precache[0]", "/offline-api.json");

        EngineProperties props = new Binder(new MapConfigurationPropertySource(source))
                .bind("engine", EngineProperties.class)
                .get();
        EngineRelease release = props.toRelease();

        assertEquals("shop", props.getCachePrefix());
        assertEquals(7, release.version());
        assertEquals(200, release.storeConfig("api").maxEntries());
        assertEquals(0, release.storeConfig("fonts").maxEntries(), "Nicht konfigurierte Stores sind unbegrenzt");
        assertEquals(Strategy.NETWORK_FIRST, release.routes().get(0).strategy());
        assertEquals(Strategy.CACHE_FIRST, release.routes().get(1).strategy());
        assertEquals("/offline-api.json", release.fallbacks().get(0).resource());
        assertEquals(List.of("/offline-api.json"), release.precacheUrls());
    }

    @Test
    void unknownStrategyShouldFailFast() {
        EngineProperties props = new EngineProperties();
        EngineProperties.Route route = new EngineProperties.Route();
        route.setPrefix("/x/");
        route.setStrategy("cache-sometimes");
        route.setStore("static");
        props.setRoutes(List.of(route));

        assertThrows(IllegalArgumentException.class, props::toRelease);
    }
}
