package de.htwsaar.minioffline.engine.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import de.htwsaar.minioffline.engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class EngineMessageControllerTest {

    private EngineFixture engine;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        mvc = MockMvcBuilders.standaloneSetup(new EngineMessageController(engine.messageHandler)).build();
    }

    @Test
    void replyShouldMirrorCorrelationId() throws Exception {
        MvcResult started = mvc.perform(post("/_engine/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correlationId\":\"c-42\",\"type\":\"GET_CACHE_STATS\",\"data\":{}}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correlationId").value("c-42"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data['app-v1-static'].size").value(2));
    }

    @Test
    void failedMessageShouldStillProduceOneReply() throws Exception {
        MvcResult started = mvc.perform(post("/_engine/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correlationId\":\"c-7\",\"type\":\"CACHE_URLS\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.correlationId").value("c-7"))
                .andExpect(jsonPath("$.success").value(false));
    }
}
