package de.htwsaar.minioffline.engine.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import de.htwsaar.minioffline.common.messaging.EngineEventType;
import de.htwsaar.minioffline.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class PushControllerTest {

    private EngineFixture engine;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        mvc = MockMvcBuilders.standaloneSetup(new PushController(engine.pushDispatcher)).build();
    }

    @Test
    void pushShouldBeAcceptedAndShown() throws Exception {
        mvc.perform(post("/_engine/push")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Update\",\"body\":\"Neue Daten\",\"data\":{\"url\":\"/dashboard/\"}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(true));

        assertEquals(1, engine.events.stream().filter(e -> e.type() == EngineEventType.SHOW_NOTIFICATION).count());
    }

    @Test
    void emptyPushShouldBeAcceptedButIgnored() throws Exception {
        mvc.perform(post("/_engine/push").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(false));

        assertEquals(0, engine.events.stream().filter(e -> e.type() == EngineEventType.SHOW_NOTIFICATION).count());
    }

    @Test
    void viewActionShouldOpenNotificationUrl() throws Exception {
        mvc.perform(post("/_engine/notifications/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"view\",\"data\":{\"url\":\"/orders/9\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.opened").value("/orders/9"));
    }
}
