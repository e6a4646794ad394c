package de.htwsaar.minioffline.engine.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import de.htwsaar.minioffline.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ReleaseControllerTest {

    private static final String RELEASE_V2 = """
            {
              "version": 2,
              "stores": [{"name": "static", "maxEntries": 0, "maxAgeSeconds": 0}],
              "routes": [{"pathPrefix": "/api/", "strategy": "network-first", "storeName": "api"}],
              "defaultStore": "static",
              "fallbacks": [{"pathPrefix": "/", "resource": "/offline.html"}],
              "precacheUrls": ["/offline.html"]
            }
            """;

    private EngineFixture engine;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        mvc = MockMvcBuilders.standaloneSetup(new ReleaseController(engine.lifecycle)).build();
    }

    @Test
    void installWithoutClientsShouldActivateImmediately() throws Exception {
        mvc.perform(post("/_engine/releases").contentType(MediaType.APPLICATION_JSON).content(RELEASE_V2))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.state").value("ACTIVATED"))
                .andExpect(jsonPath("$.storePrefix").value("app-v2-"));

        assertEquals(2, engine.lifecycle.active().version().number());
    }

    @Test
    void installWithAttachedClientShouldReportWaitingVersion() throws Exception {
        engine.lifecycle.attachClient();

        mvc.perform(post("/_engine/releases").contentType(MediaType.APPLICATION_JSON).content(RELEASE_V2))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.state").value("INSTALLED"));

        mvc.perform(get("/_engine/releases/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.waiting.version").value(2))
                .andExpect(jsonPath("$.attachedClients").value(1));
    }

    @Test
    void staleVersionShouldBeRejectedWithConflict() throws Exception {
        mvc.perform(post("/_engine/releases")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RELEASE_V2.replace("\"version\": 2", "\"version\": 1")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.version").value(1));
    }
}
