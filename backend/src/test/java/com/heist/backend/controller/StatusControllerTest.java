package com.heist.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class StatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void reportsEngineStatus() throws Exception {
        mockMvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").isNotEmpty())
                .andExpect(jsonPath("$.engine.dryRun").value(true))
                .andExpect(jsonPath("$.sizing.strategy").value("BALANCED"))
                .andExpect(jsonPath("$.pipeline.signalsProcessed").isNumber());
    }

    @Test
    void listsRecentDecisions() throws Exception {
        mockMvc.perform(get("/api/pipeline/decisions").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void positionsAndAuditsAreReadOnlyViews() throws Exception {
        mockMvc.perform(get("/api/positions/open"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
        mockMvc.perform(get("/api/positions/closed"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/positions/no-such-id"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/audits/ethereum/0x0000000000000000000000000000000000000002"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("No cached audit")));
    }
}
