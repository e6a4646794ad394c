package de.htwsaar.minioffline.engine.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.support.EngineFixture;
import de.htwsaar.minioffline.engine.sync.PendingMutation;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SyncControllerTest {

    private EngineFixture engine;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        mvc = MockMvcBuilders.standaloneSetup(new SyncController(engine.syncQueue)).build();
    }

    @Test
    void pendingShouldListQueuedMutationsOldestFirst() throws Exception {
        engine.syncQueue.enqueue(new ResourceRequest("POST", "/api/a", Map.of(), null), "offline");
        engine.syncQueue.enqueue(new ResourceRequest("DELETE", "/api/b", Map.of(), null), "offline");

        mvc.perform(get("/_engine/sync/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].url").value("/api/a"))
                .andExpect(jsonPath("$[1].method").value("DELETE"))
                .andExpect(jsonPath("$[0].state").value("QUEUED"));
    }

    @Test
    void replayShouldDrainQueueWhenOnline() throws Exception {
        engine.network.respond("/api/a", 200, "ok");
        engine.syncQueue.enqueue(new ResourceRequest("POST", "/api/a", Map.of(), null), "offline");

        mvc.perform(post("/_engine/sync/replay"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.pending").value(0));
    }

    @Test
    void abandonedMutationCanBeDiscardedOnce() throws Exception {
        engine.network.setOffline(true);
        PendingMutation m = engine.syncQueue.enqueue(new ResourceRequest("PUT", "/api/a", Map.of(), null), "offline");
        for (int i = 0; i < 3; i++) {
            engine.syncQueue.replayNow();
        }

        mvc.perform(get("/_engine/sync/abandoned"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(m.id()))
                .andExpect(jsonPath("$[0].retryCount").value(3));
        mvc.perform(delete("/_engine/sync/abandoned/" + m.id())).andExpect(status().isOk());
        mvc.perform(delete("/_engine/sync/abandoned/" + m.id())).andExpect(status().isNotFound());
    }
}
