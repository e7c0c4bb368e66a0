package com.chatrelay.server.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "relay.port=0")
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void healthReportsUpWhileListenerAccepts() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.relayPort").isNumber())
                .andExpect(jsonPath("$.activeSessions").isNumber());
    }

    @Test
    void metricsExposeDispatcherAndConnectionCounters() throws Exception {
        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessions.usernames").isArray())
                .andExpect(jsonPath("$.connections.handshakesRejected").isNumber())
                .andExpect(jsonPath("$.dispatcher.messagesBroadcast").isNumber())
                .andExpect(jsonPath("$.dispatcher.targetsNotFound").isNumber());
    }
}
