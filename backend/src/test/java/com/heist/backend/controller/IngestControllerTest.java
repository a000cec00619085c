package com.heist.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class IngestControllerTest {

    private static final String ADDRESS = "0x1f9840a85d5aF5bf1D1762F925BDADdC4201F984";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void acceptsMessageAndExposesSignal() throws Exception {
        mockMvc.perform(post("/api/ingest/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text": "stealth launch CA: %s", "platform": "telegram", "channel": "alpha", "messageId": "m-1"}
                                """.formatted(ADDRESS)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.signalEmitted").value(true))
                .andExpect(jsonPath("$.signal.address").value(ADDRESS))
                .andExpect(jsonPath("$.signal.chain").value("ethereum"));

        mockMvc.perform(get("/api/signals/metrics/" + ADDRESS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messageCount").value(1));
    }

    @Test
    void redeliveryIsAcceptedButEmitsNothing() throws Exception {
        String body = """
                {"text": "ape in 0x7Fc66500c84A76Ad7e9c93437bFc5Ac33E2DDaE9", "platform": "discord", "channel": "calls", "messageId": "dup-1"}
                """;
        mockMvc.perform(post("/api/ingest/messages").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.signalEmitted").value(true));

        mockMvc.perform(post("/api/ingest/messages").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.signalEmitted").value(false));
    }

    @Test
    void rejectsBlankText() throws Exception {
        mockMvc.perform(post("/api/ingest/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \" \", \"platform\": \"telegram\", \"channel\": \"alpha\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.details[0].field").value("text"));
    }

    @Test
    void signalLimitIsBounded() throws Exception {
        mockMvc.perform(get("/api/signals").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/signals").param("limit", "5"))
                .andExpect(status().isOk());
    }

    @Test
    void unknownTokenMetricsAreNotFound() throws Exception {
        mockMvc.perform(get("/api/signals/metrics/0x0000000000000000000000000000000000000001"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }
}
